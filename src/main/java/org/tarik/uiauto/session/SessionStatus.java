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
package org.tarik.uiauto.session;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * State of the automation session at the moment a lifecycle request was processed.
 *
 * @param serverUrl the externally reachable URL of the endpoint, present only while the session is running
 * @param message   human-readable outcome of the lifecycle request
 */
public record SessionStatus(@NotNull SessionState state, int port, @Nullable String serverUrl, @NotNull String message) {
    public boolean isRunning() {
        return state == SessionState.RUNNING;
    }
}
