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
import org.tarik.uiauto.dto.Bounds;
import org.tarik.uiauto.dto.DeviceInfo;
import org.tarik.uiauto.dto.DeviceInfo.ScreenSize;
import org.tarik.uiauto.dto.ElementSelector;
import org.tarik.uiauto.dto.ScrollDirection;

import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Objects.requireNonNullElse;
import static org.tarik.uiauto.dto.ActionResult.acknowledged;
import static org.tarik.uiauto.dto.ActionResult.failed;
import static org.tarik.uiauto.dto.ErrorCode.*;

/**
 * Performs synthetic interactions with the device. The element lookup and the interaction with it happen within a single
 * exclusive access to the device, so that no other request can move the element in between. Nothing is retried: any
 * failure of the device is returned as {@code OPERATION_FAILED} together with its message.
 */
public class ActionExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ActionExecutor.class);
    static final int SCREEN_SWIPE_STEPS = 10;
    private final DeviceChannel deviceChannel;
    private final SelectorResolver selectorResolver;

    public ActionExecutor(@NotNull DeviceChannel deviceChannel, @NotNull SelectorResolver selectorResolver) {
        this.deviceChannel = checkNotNull(deviceChannel);
        this.selectorResolver = checkNotNull(selectorResolver);
    }

    public ActionResult click(@Nullable ElementSelector selector) {
        LOG.debug("Attempting to click element with selector: {}", selector);
        if (selector == null || !selector.isValid()) {
            return getInvalidSelectorResult(selector);
        }

        return executeOnDevice("Click", deviceSurface -> selectorResolver.resolve(deviceSurface, selector)
                .map(element -> {
                    Bounds bounds = element.getVisibleBounds();
                    LOG.debug("Element found, tapping at ({}, {})", bounds.centerX(), bounds.centerY());
                    var tapped = deviceSurface.tap(bounds.centerX(), bounds.centerY());
                    return acknowledged(tapped, "Element clicked successfully", "Element was found, but the tap failed", true);
                })
                .orElseGet(() -> getElementNotFoundResult(selector, "Element not found")));
    }

    public ActionResult input(@Nullable ElementSelector selector, @Nullable String text, boolean clearFirst) {
        var textToInput = requireNonNullElse(text, "");
        LOG.debug("Attempting to input text: '{}' with selector: {}", textToInput, selector);
        if (selector == null || !selector.isValid()) {
            return getInvalidSelectorResult(selector);
        }

        return executeOnDevice("Input", deviceSurface -> selectorResolver.resolve(deviceSurface, selector)
                .map(element -> {
                    if (clearFirst) {
                        LOG.debug("Clearing element first");
                        if (!deviceSurface.clearText(element)) {
                            return failed(OPERATION_FAILED, "Element was found, but its content couldn't be cleared", true);
                        }
                    }
                    var textSet = deviceSurface.setText(element, textToInput);
                    return acknowledged(textSet, "Text input successfully", "Element was found, but the text couldn't be set",
                            true);
                })
                .orElseGet(() -> getElementNotFoundResult(selector, "Element not found")));
    }

    /**
     * Scrolls either the container identified by the selector, or the whole screen if no usable selector is given.
     */
    public ActionResult scroll(@Nullable String direction, int steps, @Nullable ElementSelector selector) {
        LOG.debug("Attempting to scroll {} with steps: {}", direction, steps);
        var scrollDirection = ScrollDirection.fromString(direction);
        if (scrollDirection.isEmpty()) {
            LOG.warn("Invalid scroll direction: {}", direction);
            return failed(INVALID_DIRECTION, "Invalid scroll direction: " + direction);
        }

        if (selector != null && selector.isValid()) {
            return executeOnDevice("Scroll", deviceSurface -> selectorResolver.resolve(deviceSurface, selector)
                    .map(container -> {
                        LOG.debug("Scrolling container with selector: {}", selector);
                        var scrolled = deviceSurface.scroll(container, scrollDirection.get(), steps);
                        return acknowledged(scrolled, "Scroll completed", "Scroll failed", true);
                    })
                    .orElseGet(() -> getElementNotFoundResult(selector, "Scroll container not found")));
        } else {
            return executeOnDevice("Scroll", deviceSurface -> {
                LOG.debug("Scrolling entire screen");
                var screen = Bounds.ofScreen(deviceSurface.getDisplayWidth(), deviceSurface.getDisplayHeight());
                var path = screen.swipePathFor(scrollDirection.get());
                var swiped = deviceSurface.swipe(path.startX(), path.startY(), path.endX(), path.endY(), SCREEN_SWIPE_STEPS);
                return acknowledged(swiped, "Scroll completed", "Scroll failed");
            });
        }
    }

    public ActionResult pressBack() {
        return executeOnDevice("Back key", deviceSurface ->
                acknowledged(deviceSurface.pressBack(), "Back key pressed", "Back key press failed"));
    }

    public ActionResult pressHome() {
        return executeOnDevice("Home key", deviceSurface ->
                acknowledged(deviceSurface.pressHome(), "Home key pressed", "Home key press failed"));
    }

    public ActionResult pressRecentApps() {
        return executeOnDevice("Recent apps key", deviceSurface ->
                acknowledged(deviceSurface.pressRecentApps(), "Recent apps key pressed", "Recent apps key press failed"));
    }

    /**
     * Reads the static descriptors of the device. The query has no side effects on the screen.
     *
     * @throws org.tarik.uiauto.device.DeviceOperationException if the device couldn't be queried
     */
    public DeviceInfo getDeviceInfo() {
        return deviceChannel.withExclusiveAccess(deviceSurface -> {
            var deviceInfo = new DeviceInfo(
                    new ScreenSize(deviceSurface.getDisplayWidth(), deviceSurface.getDisplayHeight()),
                    deviceSurface.getApiLevel(),
                    deviceSurface.getManufacturer(),
                    deviceSurface.getModel(),
                    deviceSurface.getOsVersion());
            LOG.debug("Device info: {} {} (API {})", deviceInfo.manufacturer(), deviceInfo.model(), deviceInfo.apiLevel());
            return deviceInfo;
        });
    }

    private ActionResult executeOnDevice(String operationName, Function<DeviceSurface, ActionResult> operation) {
        try {
            var result = deviceChannel.withExclusiveAccess(operation);
            LOG.debug("{} operation completed with success: {}", operationName, result.success());
            return result;
        } catch (Exception e) {
            LOG.error("{} operation failed", operationName, e);
            return failed(OPERATION_FAILED, "%s operation failed: %s".formatted(operationName, e.getMessage()));
        }
    }

    private static ActionResult getInvalidSelectorResult(ElementSelector selector) {
        LOG.warn("Invalid selector provided: {}", selector);
        return failed(INVALID_SELECTOR, "Invalid selector");
    }

    private static ActionResult getElementNotFoundResult(ElementSelector selector, String message) {
        LOG.warn("{} with selector: {}", message, selector);
        return failed(ELEMENT_NOT_FOUND, message, false);
    }
}
