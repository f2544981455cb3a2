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
 * Listening endpoint which serves automation requests for the duration of a session.
 */
public interface AutomationEndpoint {
    /**
     * Binds the endpoint and starts accepting requests. Returns once the endpoint is bound.
     */
    void start();

    /**
     * Releases the endpoint. Returns once the listening socket is closed, interrupting any pending accept.
     */
    void stop();

    int getPort();
}
