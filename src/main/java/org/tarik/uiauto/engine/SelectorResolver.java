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
import org.tarik.uiauto.dto.ElementSelector;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Optional.empty;

/**
 * Matches element selectors against the live UI tree of the device. Every resolution queries the device anew, nothing is
 * taken from earlier snapshots. The resolver never retries, callers which need to wait for an element poll it themselves.
 * <p>
 * Resolution isn't synchronized on its own: callers must hold the {@link org.tarik.uiauto.device.DeviceChannel} while
 * resolving and acting on the result.
 */
public class SelectorResolver {
    private static final Logger LOG = LoggerFactory.getLogger(SelectorResolver.class);

    /**
     * Builds the conjunction of all attribute criteria of the selector. Criteria which aren't set don't constrain the
     * match. The index is not part of the predicate, it's applied to the sequence of matching nodes.
     */
    public Predicate<LiveNode> toPredicate(@NotNull ElementSelector selector) {
        Predicate<LiveNode> predicate = node -> true;
        if (selector.resourceId() != null) {
            predicate = predicate.and(node -> selector.resourceId().equals(node.getResourceId()));
        }
        if (selector.text() != null) {
            predicate = predicate.and(node -> selector.text().equals(node.getText()));
        }
        if (selector.textContains() != null) {
            predicate = predicate.and(node -> node.getText() != null && node.getText().contains(selector.textContains()));
        }
        if (selector.className() != null) {
            predicate = predicate.and(node -> selector.className().equals(node.getClassName()));
        }
        if (selector.contentDescription() != null) {
            predicate = predicate.and(node -> selector.contentDescription().equals(node.getContentDescription()));
        }
        if (selector.bounds() != null) {
            predicate = predicate.and(node -> Objects.equals(selector.bounds(), node.getVisibleBounds()));
        }
        return predicate;
    }

    /**
     * Finds the element which matches the selector, or the element at the selector's index among all matching ones.
     *
     * @throws org.tarik.uiauto.device.DeviceOperationException if the device couldn't be queried
     */
    public Optional<LiveNode> findElement(@NotNull DeviceSurface deviceSurface, @NotNull ElementSelector selector) {
        checkArgument(selector.isValid(), "Selector must contain at least one criterion");
        var targetIndex = selector.index() == null ? 0 : selector.index();
        if (targetIndex < 0) {
            return empty();
        }
        var matches = findMatches(deviceSurface, selector, targetIndex + 1);
        return matches.size() > targetIndex ? Optional.of(matches.get(targetIndex)) : empty();
    }

    /**
     * Same as {@link #findElement(DeviceSurface, ElementSelector)}, but treats any failure to query the device as the
     * absence of the element.
     */
    public Optional<LiveNode> resolve(@NotNull DeviceSurface deviceSurface, @NotNull ElementSelector selector) {
        try {
            var element = findElement(deviceSurface, selector);
            LOG.debug("Element {} with selector {}", element.isPresent() ? "found" : "not found", selector);
            return element;
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            LOG.error("Failed to find element with selector {}", selector, e);
            return empty();
        }
    }

    private List<LiveNode> findMatches(DeviceSurface deviceSurface, ElementSelector selector, int maxMatches) {
        var predicate = toPredicate(selector);
        List<LiveNode> matches = new ArrayList<>();
        var root = deviceSurface.getRootNode();
        if (root.isEmpty()) {
            LOG.debug("No accessible root node on the screen");
            return matches;
        }

        Deque<LiveNode> nodesToVisit = new ArrayDeque<>();
        nodesToVisit.push(root.get());
        while (!nodesToVisit.isEmpty() && matches.size() < maxMatches) {
            var node = nodesToVisit.pop();
            if (predicate.test(node)) {
                matches.add(node);
            }
            var children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                nodesToVisit.push(children.get(i));
            }
        }
        return matches;
    }
}
