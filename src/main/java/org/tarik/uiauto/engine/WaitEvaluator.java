/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tarik.uiauto.engine;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uiauto.device.DeviceChannel;
import org.tarik.uiauto.dto.ActionResult;
import org.tarik.uiauto.dto.ElementSelector;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.time.Instant.now;
import static org.tarik.uiauto.dto.ActionResult.failed;
import static org.tarik.uiauto.dto.ActionResult.successful;
import static org.tarik.uiauto.dto.ErrorCode.*;
import static org.tarik.uiauto.utils.CommonUtils.sleepMillis;

/**
 * Polls the live UI tree until an element reaches the requested condition or the timeout elapses. The device channel is
 * acquired only for the duration of each single check, so that a long wait doesn't block other requests. The condition is
 * always checked at least once, hence a zero timeout means a single immediate check.
 */
public class WaitEvaluator {
    private static final Logger LOG = LoggerFactory.getLogger(WaitEvaluator.class);
    private final DeviceChannel deviceChannel;
    private final SelectorResolver selectorResolver;
    private final long pollIntervalMillis;

    public WaitEvaluator(@NotNull DeviceChannel deviceChannel, @NotNull SelectorResolver selectorResolver,
                         long pollIntervalMillis) {
        checkArgument(pollIntervalMillis > 0, "Poll interval must be positive, got %s", pollIntervalMillis);
        this.deviceChannel = checkNotNull(deviceChannel);
        this.selectorResolver = checkNotNull(selectorResolver);
        this.pollIntervalMillis = pollIntervalMillis;
    }

    public ActionResult waitFor(@Nullable ElementSelector selector, @Nullable String condition, long timeoutMillis) {
        LOG.debug("Waiting for element with selector: {}, condition: {}, timeout: {}ms", selector, condition, timeoutMillis);
        if (selector == null || !selector.isValid()) {
            LOG.warn("Invalid selector provided: {}", selector);
            return failed(INVALID_SELECTOR, "Invalid selector");
        }
        var waitCondition = WaitCondition.fromString(condition);
        if (waitCondition.isEmpty()) {
            LOG.warn("Invalid wait condition: {}", condition);
            return failed(INVALID_CONDITION, "Invalid wait condition: " + condition);
        }

        var deadline = now().plusMillis(Math.max(0, timeoutMillis));
        int checksAmount = 0;
        while (true) {
            CheckResult checkResult;
            try {
                checkResult = deviceChannel.withExclusiveAccess(deviceSurface -> {
                    var element = selectorResolver.findElement(deviceSurface, selector);
                    return new CheckResult(waitCondition.get().isSatisfiedBy(element), element.isPresent());
                });
            } catch (Exception e) {
                LOG.error("Failed to wait for element with selector {}", selector, e);
                return failed(OPERATION_FAILED, "Wait operation failed: " + e.getMessage());
            }
            checksAmount++;

            if (checkResult.conditionMet()) {
                LOG.debug("Wait condition {} met after {} check(s)", waitCondition.get(), checksAmount);
                return successful("Wait condition met", checkResult.elementFound());
            }

            var remainingMillis = Duration.between(now(), deadline).toMillis();
            if (remainingMillis <= 0) {
                LOG.debug("Wait condition {} not met after {} check(s) within {} ms", waitCondition.get(), checksAmount,
                        timeoutMillis);
                return failed(TIMEOUT, "Wait timeout", checkResult.elementFound());
            }
            if (!sleepMillis(Math.min(pollIntervalMillis, remainingMillis))) {
                return failed(OPERATION_FAILED, "Wait operation was interrupted", checkResult.elementFound());
            }
        }
    }

    private record CheckResult(boolean conditionMet, boolean elementFound) {
    }
}
