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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tarik.uiauto.device.*;
import org.tarik.uiauto.dto.ElementSelector;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static java.util.concurrent.CompletableFuture.supplyAsync;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.tarik.uiauto.device.FixtureNode.node;
import static org.tarik.uiauto.dto.ErrorCode.*;

@ExtendWith(MockitoExtension.class)
class WaitEvaluatorTest {
    private static final long POLL_INTERVAL_MILLIS = 20;
    private static final ElementSelector LOGIN_BUTTON = ElementSelector.builder().withText("Log in").build();
    private static final ElementSelector PROGRESS_BAR = ElementSelector.builder().withClassName("android.widget.ProgressBar").build();

    @Mock
    private DeviceSurface mockDeviceSurface;

    private LoginScreen screen;
    private FixtureDeviceSurface deviceSurface;
    private DeviceChannel deviceChannel;
    private WaitEvaluator waitEvaluator;

    @BeforeEach
    void setUp() {
        screen = new LoginScreen();
        deviceSurface = screen.toDeviceSurface();
        deviceChannel = new DeviceChannel(deviceSurface);
        waitEvaluator = new WaitEvaluator(deviceChannel, new SelectorResolver(), POLL_INTERVAL_MILLIS);
    }

    @Test
    @DisplayName("Present element satisfies the visible condition with a single check even with zero timeout")
    void visibleWithZeroTimeout() {
        // When
        var result = waitEvaluator.waitFor(LOGIN_BUTTON, "visible", 0);

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.elementFound()).isTrue();
        assertThat(result.message()).isEqualTo("Wait condition met");
        assertThat(deviceSurface.getRootQueries()).isEqualTo(1);
    }

    @Test
    @DisplayName("Missing element with zero timeout times out after a single check without waiting for the next poll")
    void visibleMissWithZeroTimeout() {
        // Given
        var slowPollingEvaluator = new WaitEvaluator(deviceChannel, new SelectorResolver(), 10_000);
        var start = Instant.now();

        // When
        var result = slowPollingEvaluator.waitFor(PROGRESS_BAR, "visible", 0);

        // Then
        assertThat(Duration.between(start, Instant.now())).isLessThan(Duration.ofSeconds(5));
        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo(TIMEOUT);
        assertThat(result.elementFound()).isFalse();
        assertThat(deviceSurface.getRootQueries()).isEqualTo(1);
    }

    @Test
    @DisplayName("Element which never existed satisfies the gone condition immediately")
    void goneForElementWhichNeverExisted() {
        // When
        var result = waitEvaluator.waitFor(PROGRESS_BAR, "gone", 5000);

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.elementFound()).isFalse();
        assertThat(deviceSurface.getRootQueries()).isEqualTo(1);
    }

    @Test
    @DisplayName("Element which appears later satisfies the visible condition once it's on the screen")
    void visibleAfterAppearing() {
        // Given
        var progressBar = node("android.widget.ProgressBar").withBounds(500, 900, 580, 980);
        var appearingSurface = new FixtureDeviceSurface(screen.root) {
            @Override
            public Optional<FixtureNode> getRootNode() {
                if (getRootQueries() == 2) {
                    screen.list.addChild(progressBar);
                }
                return super.getRootNode();
            }
        };
        var evaluator = new WaitEvaluator(new DeviceChannel(appearingSurface), new SelectorResolver(), POLL_INTERVAL_MILLIS);

        // When
        var result = evaluator.waitFor(PROGRESS_BAR, "VISIBLE", 5000);

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.elementFound()).isTrue();
        assertThat(appearingSurface.getRootQueries()).isEqualTo(3);
    }

    @Test
    @DisplayName("Present but not clickable element times out and reports that it was found")
    void clickableTimeout() {
        // Given
        var selector = ElementSelector.builder().withText("Welcome back").build();
        var start = Instant.now();

        // When
        var result = waitEvaluator.waitFor(selector, "clickable", 100);

        // Then
        assertThat(Duration.between(start, Instant.now())).isGreaterThanOrEqualTo(Duration.ofMillis(100));
        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo(TIMEOUT);
        assertThat(result.message()).isEqualTo("Wait timeout");
        assertThat(result.elementFound()).isTrue();
        assertThat(deviceSurface.getRootQueries()).isGreaterThan(1);
    }

    @Test
    @DisplayName("Clickable condition holds for a clickable element")
    void clickable() {
        // When
        var result = waitEvaluator.waitFor(LOGIN_BUTTON, "clickable", 0);

        // Then
        assertThat(result.success()).isTrue();
    }

    @Test
    @DisplayName("Missing element times out on the visible condition")
    void visibleTimeout() {
        // When
        var result = waitEvaluator.waitFor(PROGRESS_BAR, "visible", 50);

        // Then
        assertThat(result.errorCode()).isEqualTo(TIMEOUT);
        assertThat(result.elementFound()).isFalse();
    }

    @Test
    @DisplayName("Unknown condition and invalid selector are rejected before the device is queried")
    void invalidInputDoesNotTouchDevice() {
        // Given
        var evaluator = new WaitEvaluator(new DeviceChannel(mockDeviceSurface), new SelectorResolver(), POLL_INTERVAL_MILLIS);

        // When
        var conditionResult = evaluator.waitFor(LOGIN_BUTTON, "enabled", 1000);
        var selectorResult = evaluator.waitFor(ElementSelector.builder().build(), "visible", 1000);

        // Then
        assertThat(conditionResult.errorCode()).isEqualTo(INVALID_CONDITION);
        assertThat(conditionResult.message()).isEqualTo("Invalid wait condition: enabled");
        assertThat(selectorResult.errorCode()).isEqualTo(INVALID_SELECTOR);
        verifyNoInteractions(mockDeviceSurface);
    }

    @Test
    @DisplayName("Failure to query the device ends the wait with a failed operation")
    void deviceFailure() {
        // Given
        deviceSurface.failWith(new DeviceOperationException("device offline"));

        // When
        var result = waitEvaluator.waitFor(LOGIN_BUTTON, "visible", 5000);

        // Then
        assertThat(result.errorCode()).isEqualTo(OPERATION_FAILED);
        assertThat(result.message()).contains("device offline");
    }

    @Test
    @DisplayName("Other requests get the device between the checks of a running wait")
    void deviceChannelIsReleasedBetweenChecks() throws Exception {
        // Given
        var waitFuture = supplyAsync(() -> waitEvaluator.waitFor(PROGRESS_BAR, "visible", 2000));
        Thread.sleep(100);

        // When
        var accessed = supplyAsync(() -> deviceChannel.withExclusiveAccess(surface -> true)).get();

        // Then
        assertThat(accessed).isTrue();
        assertThat(waitFuture).isNotDone();
        assertThat(waitFuture.get().errorCode()).isEqualTo(TIMEOUT);
    }
}
