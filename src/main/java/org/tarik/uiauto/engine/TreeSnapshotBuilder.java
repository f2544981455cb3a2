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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uiauto.device.DeviceSurface;
import org.tarik.uiauto.device.LiveNode;
import org.tarik.uiauto.dto.Bounds;
import org.tarik.uiauto.dto.PageSource;
import org.tarik.uiauto.dto.UiElement;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static java.lang.System.currentTimeMillis;
import static org.tarik.uiauto.dto.UiElement.ERROR_CLASS_NAME;
import static org.tarik.uiauto.dto.UiElement.ROOT_FALLBACK_CLASS_NAME;

/**
 * Copies the live UI tree into an immutable {@link PageSource}. Building a snapshot never fails: a subtree which can't be
 * read is replaced with a placeholder node of the class {@value UiElement#ERROR_CLASS_NAME}, and if the tree can't be
 * read at all, a single-node tree is returned.
 */
public class TreeSnapshotBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(TreeSnapshotBuilder.class);

    public PageSource buildPageSource(@NotNull DeviceSurface deviceSurface) {
        var root = buildTree(deviceSurface);
        var width = getOrDefault(deviceSurface::getDisplayWidth, 0, "display width");
        var height = getOrDefault(deviceSurface::getDisplayHeight, 0, "display height");
        var packageName = getOrDefault(deviceSurface::getCurrentPackageName, "", "current package name");
        var activity = getOrDefault(deviceSurface::getCurrentActivity, "", "current activity");
        LOG.debug("Page source retrieved - Package: {}, Screen: {}x{}", packageName, width, height);
        return new PageSource(root, currentTimeMillis(), packageName, activity, Bounds.ofScreen(width, height));
    }

    private UiElement buildTree(DeviceSurface deviceSurface) {
        try {
            return deviceSurface.getRootNode()
                    .map(this::toUiElement)
                    .orElseGet(() -> {
                        LOG.warn("No accessible root node on the screen, returning an empty tree");
                        return UiElement.placeholder(ROOT_FALLBACK_CLASS_NAME);
                    });
        } catch (Exception e) {
            LOG.error("Failed to get the root node of the UI tree, returning an empty tree", e);
            return UiElement.placeholder(ROOT_FALLBACK_CLASS_NAME);
        }
    }

    UiElement toUiElement(LiveNode node) {
        try {
            List<UiElement> children = new ArrayList<>();
            for (LiveNode child : node.getChildren()) {
                children.add(toUiElement(child));
            }
            return new UiElement(
                    node.getResourceId(),
                    node.getText(),
                    node.getClassName(),
                    node.getContentDescription(),
                    node.getVisibleBounds(),
                    node.isClickable(),
                    node.isScrollable(),
                    node.isCheckable(),
                    node.isChecked(),
                    node.isEnabled(),
                    node.isFocused(),
                    children);
        } catch (Exception e) {
            LOG.error("Failed to read UI node, replacing its subtree with a placeholder", e);
            return UiElement.placeholder(ERROR_CLASS_NAME);
        }
    }

    private static <T> T getOrDefault(Supplier<T> valueSupplier, T defaultValue, String valueDescription) {
        try {
            return valueSupplier.get();
        } catch (Exception e) {
            LOG.warn("Couldn't get the {} of the device: {}", valueDescription, e.getMessage());
            return defaultValue;
        }
    }
}
