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
package org.tarik.uiauto.device;

import org.tarik.uiauto.dto.Bounds;

import java.util.List;

/**
 * Handle to a node of the live UI tree, obtained by a fresh query of the device. Unlike
 * {@link org.tarik.uiauto.dto.UiElement} it is not meant to outlive the operation which queried it. Any accessor may throw
 * {@link DeviceOperationException} if the node has vanished or can't be read anymore.
 */
public interface LiveNode {
    String getResourceId();

    String getText();

    String getClassName();

    String getContentDescription();

    Bounds getVisibleBounds();

    boolean isClickable();

    boolean isScrollable();

    boolean isCheckable();

    boolean isChecked();

    boolean isEnabled();

    boolean isFocused();

    List<? extends LiveNode> getChildren();
}
