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

/**
 * Rectangle in screen pixels, expressed by its edges. The right and bottom edges are exclusive.
 */
public record Bounds(
        @SerializedName("left") int left,
        @SerializedName("top") int top,
        @SerializedName("right") int right,
        @SerializedName("bottom") int bottom) {
    public static final Bounds EMPTY = new Bounds(0, 0, 0, 0);

    public static Bounds ofScreen(int width, int height) {
        return new Bounds(0, 0, width, height);
    }

    public int centerX() {
        return (left + right) / 2;
    }

    public int centerY() {
        return (top + bottom) / 2;
    }

    public int width() {
        return right - left;
    }

    public int height() {
        return bottom - top;
    }

    public boolean isEmpty() {
        return width() <= 0 || height() <= 0;
    }

    public boolean contains(int x, int y) {
        return x >= left && x < right && y >= top && y < bottom;
    }

    /**
     * Calculates the finger path which scrolls the content of this area in the given direction. The path spans the middle
     * third of the area along the scroll axis and stays on its center line along the other one.
     */
    public SwipePath swipePathFor(ScrollDirection direction) {
        int upperThird = top + height() / 3;
        int lowerThird = top + height() * 2 / 3;
        int leftThird = left + width() / 3;
        int rightThird = left + width() * 2 / 3;
        return switch (direction) {
            case UP -> new SwipePath(centerX(), lowerThird, centerX(), upperThird);
            case DOWN -> new SwipePath(centerX(), upperThird, centerX(), lowerThird);
            case LEFT -> new SwipePath(rightThird, centerY(), leftThird, centerY());
            case RIGHT -> new SwipePath(leftThird, centerY(), rightThird, centerY());
        };
    }

    /**
     * Parses the "[left,top][right,bottom]" notation used by uiautomator hierarchy dumps.
     */
    public static Bounds parse(String boundsNotation) {
        if (boundsNotation == null || boundsNotation.isBlank()) {
            return EMPTY;
        }
        var numbers = boundsNotation.replaceAll("[^0-9,\\-]+", ",").replaceAll("^,+|,+$", "").split(",+");
        if (numbers.length != 4) {
            throw new IllegalArgumentException("'%s' is not a valid bounds notation".formatted(boundsNotation));
        }
        return new Bounds(Integer.parseInt(numbers[0]), Integer.parseInt(numbers[1]), Integer.parseInt(numbers[2]),
                Integer.parseInt(numbers[3]));
    }

    public String toNotation() {
        return "[%d,%d][%d,%d]".formatted(left, top, right, bottom);
    }

    public record SwipePath(int startX, int startY, int endX, int endY) {
    }
}
