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
package org.tarik.uiauto.dto;

import com.google.gson.annotations.SerializedName;
import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;
import static java.util.Objects.requireNonNullElse;

/**
 * One full snapshot of the screen. The tree is owned by the response which carries it.
 */
public record PageSource(
        @SerializedName("root") @NotNull UiElement root,
        @SerializedName("timestamp") long timestamp,
        @SerializedName("package_name") @NotNull String packageName,
        @SerializedName("activity") @NotNull String activity,
        @SerializedName("screen_size") @NotNull Bounds screenSize) {

    public PageSource {
        requireNonNull(root, "Page source must have a root element");
        packageName = requireNonNullElse(packageName, "");
        activity = requireNonNullElse(activity, "");
        screenSize = requireNonNullElse(screenSize, Bounds.EMPTY);
    }
}
