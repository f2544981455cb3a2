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

public record WaitRequest(
        @SerializedName("selector") ElementSelector selector,
        @SerializedName("timeout") Long timeout,
        @SerializedName("condition") String condition) {
    public static final long DEFAULT_TIMEOUT_MILLIS = 5000;
    public static final String DEFAULT_CONDITION = "visible";

    public WaitRequest {
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT_MILLIS;
        }
        if (condition == null) {
            condition = DEFAULT_CONDITION;
        }
    }
}
