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

import static java.lang.System.currentTimeMillis;
import static java.util.Objects.requireNonNullElse;

/**
 * Uniform envelope of every mutating or query-adjacent operation. A failed result with {@code elementFound == false}
 * and {@link ErrorCode#ELEMENT_NOT_FOUND} means that the selector was well-formed, but nothing matched it.
 */
public record ActionResult(
        @SerializedName("success") boolean success,
        @SerializedName("message") @NotNull String message,
        @SerializedName("timestamp") long timestamp,
        @SerializedName("element_found") boolean elementFound,
        @SerializedName("error_code") @Nullable ErrorCode errorCode) {

    public ActionResult {
        message = requireNonNullElse(message, "");
    }

    public static ActionResult successful(String message) {
        return new ActionResult(true, message, currentTimeMillis(), false, null);
    }

    public static ActionResult successful(String message, boolean elementFound) {
        return new ActionResult(true, message, currentTimeMillis(), elementFound, null);
    }

    public static ActionResult failed(@NotNull ErrorCode errorCode, String message) {
        return new ActionResult(false, message, currentTimeMillis(), false, errorCode);
    }

    public static ActionResult failed(@NotNull ErrorCode errorCode, String message, boolean elementFound) {
        return new ActionResult(false, message, currentTimeMillis(), elementFound, errorCode);
    }

    /**
     * Wraps the boolean acknowledgment of a device call which has no error code of its own.
     */
    public static ActionResult acknowledged(boolean acknowledged, String successMessage, String failureMessage) {
        return acknowledged(acknowledged, successMessage, failureMessage, false);
    }

    public static ActionResult acknowledged(boolean acknowledged, String successMessage, String failureMessage,
                                            boolean elementFound) {
        return acknowledged
                ? successful(successMessage, elementFound)
                : failed(ErrorCode.OPERATION_FAILED, failureMessage, elementFound);
    }
}
