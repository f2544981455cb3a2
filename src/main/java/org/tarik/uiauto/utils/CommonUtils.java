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
package org.tarik.uiauto.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static java.util.Optional.empty;

public class CommonUtils {
    private static final Logger LOG = LoggerFactory.getLogger(CommonUtils.class);

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static boolean isNotBlank(String value) {
        return !isBlank(value);
    }

    public static Optional<Integer> parseStringAsInteger(String value) {
        if (isBlank(value)) {
            return empty();
        }
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            LOG.debug("'{}' is not a valid integer", value);
            return empty();
        }
    }

    public static Optional<Long> parseStringAsLong(String value) {
        if (isBlank(value)) {
            return empty();
        }
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            LOG.debug("'{}' is not a valid long value", value);
            return empty();
        }
    }

    /**
     * Sleeps the given amount of milliseconds.
     *
     * @return false if the sleep was interrupted, in which case the interrupt flag of the thread is restored
     */
    public static boolean sleepMillis(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            LOG.warn("Interrupted while sleeping for {} ms", millis);
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
