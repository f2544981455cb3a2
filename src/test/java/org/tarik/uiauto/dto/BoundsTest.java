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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tarik.uiauto.dto.ScrollDirection.*;

class BoundsTest {

    @Test
    @DisplayName("Swipe path scrolling up moves the finger from the lower to the upper third along the vertical center line")
    void swipePathForUp() {
        // Given
        var screen = Bounds.ofScreen(1080, 1920);

        // When
        var path = screen.swipePathFor(UP);

        // Then
        assertThat(path).isEqualTo(new Bounds.SwipePath(540, 1280, 540, 640));
    }

    @Test
    @DisplayName("Swipe paths within a container stay inside of it")
    void swipePathsWithinContainer() {
        // Given
        var container = new Bounds(100, 300, 400, 900);

        // When / Then
        assertThat(container.swipePathFor(DOWN)).isEqualTo(new Bounds.SwipePath(250, 500, 250, 700));
        assertThat(container.swipePathFor(LEFT)).isEqualTo(new Bounds.SwipePath(300, 600, 200, 600));
        assertThat(container.swipePathFor(RIGHT)).isEqualTo(new Bounds.SwipePath(200, 600, 300, 600));
    }

    @Test
    @DisplayName("Parsing the uiautomator notation yields the four edges")
    void parseNotation() {
        // When
        var bounds = Bounds.parse("[0,63][1080,210]");

        // Then
        assertThat(bounds).isEqualTo(new Bounds(0, 63, 1080, 210));
        assertThat(bounds.toNotation()).isEqualTo("[0,63][1080,210]");
        assertThat(bounds.centerX()).isEqualTo(540);
        assertThat(bounds.height()).isEqualTo(147);
    }

    @Test
    @DisplayName("Blank notation is parsed as empty bounds, malformed notation is rejected")
    void parseBlankAndMalformedNotation() {
        assertThat(Bounds.parse("")).isEqualTo(Bounds.EMPTY);
        assertThat(Bounds.parse(null).isEmpty()).isTrue();
        assertThatThrownBy(() -> Bounds.parse("[0,0][10]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[0,0][10]");
    }

    @Test
    @DisplayName("Right and bottom edges are not part of the area")
    void containsExcludesRightAndBottomEdges() {
        var bounds = new Bounds(10, 10, 20, 20);

        assertThat(bounds.contains(10, 10)).isTrue();
        assertThat(bounds.contains(19, 19)).isTrue();
        assertThat(bounds.contains(20, 15)).isFalse();
        assertThat(bounds.contains(15, 20)).isFalse();
    }

    @Test
    @DisplayName("Scroll direction is parsed case-insensitively")
    void scrollDirectionFromString() {
        assertThat(ScrollDirection.fromString(" Up ")).contains(UP);
        assertThat(ScrollDirection.fromString("left")).contains(LEFT);
        assertThat(ScrollDirection.fromString("diagonal")).isEmpty();
        assertThat(ScrollDirection.fromString(null)).isEmpty();
    }
}
