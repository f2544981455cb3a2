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

/**
 * Signal towards the host process that it must be kept alive while a session is running.
 */
public interface ForegroundSignal {
    /**
     * @param serverUrl       the URL under which the running session is reachable
     * @param teardownAction  the action which stops the session if the host process is being torn down
     */
    void enterForeground(String serverUrl, Runnable teardownAction);

    void leaveForeground();
}
