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
package org.tarik.uiauto.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.uiauto.dto.Bounds;
import org.tarik.uiauto.dto.PageSource;
import org.tarik.uiauto.dto.UiElement;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UiHierarchyXmlWriterTest {

    @Test
    @DisplayName("Page source is written in the uiautomator hierarchy format")
    void pageSourceToXml() {
        // Given
        var button = new UiElement("com.example.app:id/save", "Save & exit", "android.widget.Button", "Save \"draft\"",
                new Bounds(10, 20, 110, 70), true, false, false, false, true, false, List.of());
        var checkbox = new UiElement("com.example.app:id/agree", "", "android.widget.CheckBox", "",
                new Bounds(10, 80, 110, 130), true, false, true, true, false, false, List.of());
        var root = new UiElement("", "", "android.widget.FrameLayout", "", new Bounds(0, 0, 1080, 1920), false, false, false,
                false, true, false, List.of(button, checkbox));
        var pageSource = new PageSource(root, 1700000000000L, "com.example.app", "com.example.app.MainActivity",
                Bounds.ofScreen(1080, 1920));

        // When
        var xml = UiHierarchyXmlWriter.toXml(pageSource);

        // Then
        assertThat(xml)
                .contains("<hierarchy rotation=\"0\" timestamp=\"1700000000000\" activity=\"com.example.app.MainActivity\">")
                .contains("<node index=\"0\" text=\"\" resource-id=\"\" class=\"android.widget.FrameLayout\"")
                .contains("text=\"Save &amp; exit\"")
                .contains("content-desc=\"Save &quot;draft&quot;\"")
                .contains("<node index=\"1\" text=\"\" resource-id=\"com.example.app:id/agree\"")
                .contains("checkable=\"true\" checked=\"true\" clickable=\"true\" enabled=\"false\"")
                .contains("package=\"com.example.app\"")
                .contains("bounds=\"[10,80][110,130]\"")
                .endsWith("</hierarchy>");
    }
}
