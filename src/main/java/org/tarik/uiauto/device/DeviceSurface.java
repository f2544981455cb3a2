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

import org.tarik.uiauto.dto.ScrollDirection;

import java.util.Optional;

/**
 * The live UI surface of the device together with its input channel. Implementations are not required to be thread-safe:
 * all calls are serialized by {@link DeviceChannel}. Failures of the underlying platform are reported as
 * {@link DeviceOperationException}, while boolean results carry the platform's own acknowledgment.
 */
public interface DeviceSurface {
    /**
     * Queries the live tree. Every call reflects the current state of the screen, nothing is cached between calls.
     *
     * @return the root node, or empty if no accessible root is present at the moment
     */
    Optional<? extends LiveNode> getRootNode();

    int getDisplayWidth();

    int getDisplayHeight();

    String getCurrentPackageName();

    String getCurrentActivity();

    boolean tap(int x, int y);

    /**
     * @param steps the amount of injected move events, each of which takes roughly 5 milliseconds
     */
    boolean swipe(int startX, int startY, int endX, int endY, int steps);

    boolean clearText(LiveNode node);

    boolean setText(LiveNode node, String text);

    /**
     * Scrolls the content of the given container.
     *
     * @param steps how many times the container is scrolled by one swipe across its middle third
     */
    boolean scroll(LiveNode container, ScrollDirection direction, int steps);

    boolean pressBack();

    boolean pressHome();

    boolean pressRecentApps();

    int getApiLevel();

    String getManufacturer();

    String getModel();

    String getOsVersion();
}
