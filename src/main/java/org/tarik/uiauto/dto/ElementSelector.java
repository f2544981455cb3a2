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
import org.jetbrains.annotations.Nullable;

import java.util.StringJoiner;

/**
 * Declarative description of a single UI element. All criteria are optional, but at least one of them must be set for the
 * selector to be usable.
 */
public record ElementSelector(
        @SerializedName("resource_id") @Nullable String resourceId,
        @SerializedName("text") @Nullable String text,
        @SerializedName("text_contains") @Nullable String textContains,
        @SerializedName("class_name") @Nullable String className,
        @SerializedName("content_desc") @Nullable String contentDescription,
        @SerializedName("index") @Nullable Integer index,
        @SerializedName("bounds") @Nullable Bounds bounds) {

    public boolean isValid() {
        return resourceId != null ||
                text != null ||
                textContains != null ||
                className != null ||
                contentDescription != null ||
                index != null ||
                bounds != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public @NotNull String toString() {
        var joiner = new StringJoiner(", ", "{", "}");
        if (resourceId != null) {
            joiner.add("resource_id='" + resourceId + "'");
        }
        if (text != null) {
            joiner.add("text='" + text + "'");
        }
        if (textContains != null) {
            joiner.add("text_contains='" + textContains + "'");
        }
        if (className != null) {
            joiner.add("class_name='" + className + "'");
        }
        if (contentDescription != null) {
            joiner.add("content_desc='" + contentDescription + "'");
        }
        if (index != null) {
            joiner.add("index=" + index);
        }
        if (bounds != null) {
            joiner.add("bounds=" + bounds.toNotation());
        }
        return joiner.toString();
    }

    public static class Builder {
        private String resourceId;
        private String text;
        private String textContains;
        private String className;
        private String contentDescription;
        private Integer index;
        private Bounds bounds;

        private Builder() {
        }

        public Builder withResourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder withText(String text) {
            this.text = text;
            return this;
        }

        public Builder withTextContains(String textContains) {
            this.textContains = textContains;
            return this;
        }

        public Builder withClassName(String className) {
            this.className = className;
            return this;
        }

        public Builder withContentDescription(String contentDescription) {
            this.contentDescription = contentDescription;
            return this;
        }

        public Builder withIndex(Integer index) {
            this.index = index;
            return this;
        }

        public Builder withBounds(Bounds bounds) {
            this.bounds = bounds;
            return this;
        }

        public ElementSelector build() {
            return new ElementSelector(resourceId, text, textContains, className, contentDescription, index, bounds);
        }
    }
}
