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

import org.tarik.uiauto.device.LiveNode;

import java.util.Optional;

import static java.util.Arrays.stream;

/**
 * Condition which a wait request expects the element to reach.
 */
public enum WaitCondition {
    VISIBLE {
        @Override
        boolean isSatisfiedBy(Optional<LiveNode> element) {
            return element.isPresent();
        }
    },
    /**
     * Holds as soon as nothing matches the selector, including the case when nothing has ever matched it.
     */
    GONE {
        @Override
        boolean isSatisfiedBy(Optional<LiveNode> element) {
            return element.isEmpty();
        }
    },
    CLICKABLE {
        @Override
        boolean isSatisfiedBy(Optional<LiveNode> element) {
            return element.map(LiveNode::isClickable).orElse(false);
        }
    };

    abstract boolean isSatisfiedBy(Optional<LiveNode> element);

    public static Optional<WaitCondition> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return stream(values())
                .filter(condition -> condition.name().equalsIgnoreCase(value.trim()))
                .findAny();
    }
}
