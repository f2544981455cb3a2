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

import org.jetbrains.annotations.NotNull;
import org.tarik.uiauto.dto.PageSource;
import org.tarik.uiauto.dto.UiElement;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;

/**
 * Serializes page sources into the XML hierarchy format produced by {@code uiautomator dump}, so that tools built around
 * that format can consume the snapshots as well.
 */
public class UiHierarchyXmlWriter {
    private static final String ENCODING = "UTF-8";
    private static final String HIERARCHY_TAG = "hierarchy";
    private static final String NODE_TAG = "node";

    public static String toXml(@NotNull PageSource pageSource) {
        var output = new StringWriter();
        try {
            XMLStreamWriter writer = XMLOutputFactory.newInstance().createXMLStreamWriter(output);
            try {
                writer.writeStartDocument(ENCODING, "1.0");
                writer.writeStartElement(HIERARCHY_TAG);
                writer.writeAttribute("rotation", "0");
                writer.writeAttribute("timestamp", String.valueOf(pageSource.timestamp()));
                writer.writeAttribute("activity", pageSource.activity());
                writeNode(writer, pageSource.root(), 0, pageSource.packageName());
                writer.writeEndElement();
                writer.writeEndDocument();
            } finally {
                writer.close();
            }
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Couldn't serialize the page source into XML", e);
        }
        return output.toString();
    }

    private static void writeNode(XMLStreamWriter writer, UiElement element, int index, String packageName)
            throws XMLStreamException {
        writer.writeStartElement(NODE_TAG);
        writer.writeAttribute("index", String.valueOf(index));
        writer.writeAttribute("text", element.text());
        writer.writeAttribute("resource-id", element.resourceId());
        writer.writeAttribute("class", element.className());
        writer.writeAttribute("package", packageName);
        writer.writeAttribute("content-desc", element.contentDescription());
        writer.writeAttribute("checkable", String.valueOf(element.checkable()));
        writer.writeAttribute("checked", String.valueOf(element.checked()));
        writer.writeAttribute("clickable", String.valueOf(element.clickable()));
        writer.writeAttribute("enabled", String.valueOf(element.enabled()));
        writer.writeAttribute("focused", String.valueOf(element.focused()));
        writer.writeAttribute("scrollable", String.valueOf(element.scrollable()));
        writer.writeAttribute("bounds", element.bounds().toNotation());
        for (int i = 0; i < element.children().size(); i++) {
            writeNode(writer, element.children().get(i), i, packageName);
        }
        writer.writeEndElement();
    }
}
