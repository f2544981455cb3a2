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

import java.util.Optional;

import static java.util.Arrays.stream;

public enum ScrollDirection {
    UP, DOWN, LEFT, RIGHT;

    public static Optional<ScrollDirection> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return stream(values())
                .filter(direction -> direction.name().equalsIgnoreCase(value.trim()))
                .findAny();
    }
}
