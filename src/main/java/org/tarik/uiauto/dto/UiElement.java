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

import java.util.List;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNullElse;

/**
 * Point-in-time copy of a single node of the on-screen UI tree. Children keep the depth-first order reported by the
 * device.
 */
public record UiElement(
        @SerializedName("resource_id") @NotNull String resourceId,
        @SerializedName("text") @NotNull String text,
        @SerializedName("class_name") @NotNull String className,
        @SerializedName("content_desc") @NotNull String contentDescription,
        @SerializedName("bounds") @NotNull Bounds bounds,
        @SerializedName("clickable") boolean clickable,
        @SerializedName("scrollable") boolean scrollable,
        @SerializedName("checkable") boolean checkable,
        @SerializedName("checked") boolean checked,
        @SerializedName("enabled") boolean enabled,
        @SerializedName("focused") boolean focused,
        @SerializedName("children") @NotNull List<UiElement> children) {
    public static final String ERROR_CLASS_NAME = "error";
    public static final String ROOT_FALLBACK_CLASS_NAME = "android.widget.FrameLayout";

    public UiElement {
        resourceId = requireNonNullElse(resourceId, "");
        text = requireNonNullElse(text, "");
        className = requireNonNullElse(className, "");
        contentDescription = requireNonNullElse(contentDescription, "");
        bounds = requireNonNullElse(bounds, Bounds.EMPTY);
        children = List.copyOf(requireNonNullElse(children, List.of()));
    }

    /**
     * Creates a childless node which carries nothing but its class name, e.g. a placeholder for a node which couldn't be
     * read from the device.
     */
    public static UiElement placeholder(String className) {
        return new UiElement("", "", className, "", Bounds.EMPTY, false, false, false, false, true, false, List.of());
    }

    @Override
    public @NotNull String toString() {
        return new StringJoiner(", ", UiElement.class.getSimpleName() + "[", "]")
                .add("className='" + className + "'")
                .add("resourceId='" + resourceId + "'")
                .add("text='" + text + "'")
                .add("bounds=" + bounds.toNotation())
                .add("children=" + children.size())
                .toString();
    }
}
