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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.uiauto.device.DeviceOperationException;
import org.tarik.uiauto.device.LoginScreen;
import org.tarik.uiauto.dto.Bounds;
import org.tarik.uiauto.dto.UiElement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tarik.uiauto.device.FixtureNode.node;
import static org.tarik.uiauto.dto.UiElement.ERROR_CLASS_NAME;
import static org.tarik.uiauto.dto.UiElement.ROOT_FALLBACK_CLASS_NAME;

class TreeSnapshotBuilderTest {
    private final TreeSnapshotBuilder treeSnapshotBuilder = new TreeSnapshotBuilder();

    @Test
    @DisplayName("Snapshot mirrors the live tree together with the screen attributes")
    void snapshotMirrorsLiveTree() {
        // Given
        var screen = new LoginScreen();

        // When
        var pageSource = treeSnapshotBuilder.buildPageSource(screen.toDeviceSurface());

        // Then
        assertThat(pageSource.packageName()).isEqualTo("com.example.app");
        assertThat(pageSource.activity()).isEqualTo("com.example.app.MainActivity");
        assertThat(pageSource.screenSize()).isEqualTo(new Bounds(0, 0, 1080, 1920));
        var root = pageSource.root();
        assertThat(root.className()).isEqualTo("android.widget.FrameLayout");
        assertThat(root.children()).hasSize(2);
        var form = root.children().get(0);
        assertThat(form.children()).extracting(UiElement::resourceId)
                .containsExactly("com.example.app:id/title", "com.example.app:id/username", "com.example.app:id/remember",
                        "com.example.app:id/login", "com.example.app:id/cancel");
        var remember = form.children().get(2);
        assertThat(remember.checkable()).isTrue();
        assertThat(remember.checked()).isFalse();
        assertThat(remember.clickable()).isTrue();
        assertThat(remember.enabled()).isTrue();
        assertThat(remember.bounds()).isEqualTo(new Bounds(100, 450, 500, 550));
        assertThat(root.children().get(1).scrollable()).isTrue();
    }

    @Test
    @DisplayName("Snapshot is detached from the live tree")
    void snapshotIsDetached() {
        // Given
        var screen = new LoginScreen();
        var pageSource = treeSnapshotBuilder.buildPageSource(screen.toDeviceSurface());

        // When
        screen.username.setText("changed");

        // Then
        assertThat(pageSource.root().children().get(0).children().get(1).text()).isEqualTo("old value");
    }

    @Test
    @DisplayName("Unreadable node is replaced with an error placeholder while its siblings are kept")
    void unreadableNodeIsReplaced() {
        // Given
        var screen = new LoginScreen();
        screen.form.addChild(node("android.view.View").unreadable());

        // When
        var pageSource = treeSnapshotBuilder.buildPageSource(screen.toDeviceSurface());

        // Then
        var formChildren = pageSource.root().children().get(0).children();
        assertThat(formChildren).hasSize(6);
        assertThat(formChildren.get(5).className()).isEqualTo(ERROR_CLASS_NAME);
        assertThat(formChildren.get(5).children()).isEmpty();
        assertThat(formChildren.get(4).text()).isEqualTo("Cancel");
    }

    @Test
    @DisplayName("Screen without accessible root yields a single-node tree")
    void missingRoot() {
        // Given
        var deviceSurface = new LoginScreen().toDeviceSurface();
        deviceSurface.setRoot(null);

        // When
        var pageSource = treeSnapshotBuilder.buildPageSource(deviceSurface);

        // Then
        assertThat(pageSource.root().className()).isEqualTo(ROOT_FALLBACK_CLASS_NAME);
        assertThat(pageSource.root().children()).isEmpty();
        assertThat(pageSource.screenSize()).isEqualTo(new Bounds(0, 0, 1080, 1920));
    }

    @Test
    @DisplayName("Device which can't be queried at all still yields a snapshot")
    void deviceFailure() {
        // Given
        var deviceSurface = new LoginScreen().toDeviceSurface();
        deviceSurface.failWith(new DeviceOperationException("device offline"));

        // When
        var pageSource = treeSnapshotBuilder.buildPageSource(deviceSurface);

        // Then
        assertThat(pageSource.root().className()).isEqualTo(ROOT_FALLBACK_CLASS_NAME);
        assertThat(pageSource.packageName()).isEmpty();
        assertThat(pageSource.screenSize().isEmpty()).isTrue();
        assertThat(pageSource.timestamp()).isPositive();
    }
}
