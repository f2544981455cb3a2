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
import org.tarik.uiauto.device.DeviceSurface;
import org.tarik.uiauto.dto.ActionResult;
import org.tarik.uiauto.dto.DeviceInfo;
import org.tarik.uiauto.dto.ElementSelector;
import org.tarik.uiauto.dto.PageSource;
import org.tarik.uiauto.utils.UiHierarchyXmlWriter;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Entry point to all automation operations on a single device. All of them share one {@link DeviceChannel}, so that
 * operations coming from concurrent requests are executed one after another.
 */
public class AutomationEngine {
    private static final Logger LOG = LoggerFactory.getLogger(AutomationEngine.class);
    private final DeviceChannel deviceChannel;
    private final TreeSnapshotBuilder treeSnapshotBuilder;
    private final ActionExecutor actionExecutor;
    private final WaitEvaluator waitEvaluator;

    public AutomationEngine(@NotNull DeviceSurface deviceSurface, long waitPollIntervalMillis) {
        this(new DeviceChannel(deviceSurface), new SelectorResolver(), new TreeSnapshotBuilder(), waitPollIntervalMillis);
    }

    AutomationEngine(@NotNull DeviceChannel deviceChannel, @NotNull SelectorResolver selectorResolver,
                     @NotNull TreeSnapshotBuilder treeSnapshotBuilder, long waitPollIntervalMillis) {
        this.deviceChannel = checkNotNull(deviceChannel);
        this.treeSnapshotBuilder = checkNotNull(treeSnapshotBuilder);
        this.actionExecutor = new ActionExecutor(deviceChannel, selectorResolver);
        this.waitEvaluator = new WaitEvaluator(deviceChannel, selectorResolver, waitPollIntervalMillis);
        LOG.info("Automation engine initialized");
    }

    public PageSource getPageSource() {
        LOG.debug("Getting page source");
        return deviceChannel.withExclusiveAccess(treeSnapshotBuilder::buildPageSource);
    }

    public String getPageSourceAsXml() {
        return UiHierarchyXmlWriter.toXml(getPageSource());
    }

    public ActionResult click(@Nullable ElementSelector selector) {
        return actionExecutor.click(selector);
    }

    public ActionResult input(@Nullable ElementSelector selector, @Nullable String text, boolean clearFirst) {
        return actionExecutor.input(selector, text, clearFirst);
    }

    public ActionResult scroll(@Nullable String direction, int steps, @Nullable ElementSelector selector) {
        return actionExecutor.scroll(direction, steps, selector);
    }

    public ActionResult waitFor(@Nullable ElementSelector selector, @Nullable String condition, long timeoutMillis) {
        return waitEvaluator.waitFor(selector, condition, timeoutMillis);
    }

    public ActionResult pressBack() {
        return actionExecutor.pressBack();
    }

    public ActionResult pressHome() {
        return actionExecutor.pressHome();
    }

    public ActionResult pressRecentApps() {
        return actionExecutor.pressRecentApps();
    }

    public DeviceInfo getDeviceInfo() {
        return actionExecutor.getDeviceInfo();
    }
}
