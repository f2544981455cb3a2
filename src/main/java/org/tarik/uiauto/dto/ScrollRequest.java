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
import org.jetbrains.annotations.Nullable;

public record ScrollRequest(
        @SerializedName("direction") String direction,
        @SerializedName("steps") Integer steps,
        @SerializedName("selector") @Nullable ElementSelector selector) {
    public static final int DEFAULT_STEPS = 1;

    public ScrollRequest {
        if (steps == null) {
            steps = DEFAULT_STEPS;
        }
    }
}
