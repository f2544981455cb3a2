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
package org.tarik.uiauto.device.adb;

import org.jetbrains.annotations.NotNull;
import org.tarik.uiauto.device.LiveNode;
import org.tarik.uiauto.dto.Bounds;

import java.util.List;

/**
 * Node of a hierarchy dump taken by uiautomator on the device. Each query of {@link AdbDeviceSurface} takes a new dump, so
 * the node reflects the screen at the moment of the query which produced it.
 */
record AdbNode(@NotNull String resourceId,
               @NotNull String text,
               @NotNull String className,
               @NotNull String contentDescription,
               @NotNull String packageName,
               @NotNull Bounds bounds,
               boolean clickable,
               boolean scrollable,
               boolean checkable,
               boolean checked,
               boolean enabled,
               boolean focused,
               @NotNull List<AdbNode> children) implements LiveNode {

    @Override
    public String getResourceId() {
        return resourceId;
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public String getClassName() {
        return className;
    }

    @Override
    public String getContentDescription() {
        return contentDescription;
    }

    @Override
    public Bounds getVisibleBounds() {
        return bounds;
    }

    @Override
    public boolean isClickable() {
        return clickable;
    }

    @Override
    public boolean isScrollable() {
        return scrollable;
    }

    @Override
    public boolean isCheckable() {
        return checkable;
    }

    @Override
    public boolean isChecked() {
        return checked;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public boolean isFocused() {
        return focused;
    }

    @Override
    public List<AdbNode> getChildren() {
        return children;
    }
}
