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
package org.tarik.uiauto.device.adb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uiauto.device.DeviceOperationException;
import org.tarik.uiauto.dto.Bounds;
import org.tarik.uiauto.dto.UiElement;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.lang.Boolean.parseBoolean;

/**
 * Parses the XML hierarchy produced by {@code uiautomator dump}.
 */
class UiHierarchyParser {
    private static final Logger LOG = LoggerFactory.getLogger(UiHierarchyParser.class);
    private static final String HIERARCHY_START_TAG = "<hierarchy";
    private static final String HIERARCHY_END_TAG = "</hierarchy>";
    private static final String NODE_TAG = "node";

    static Optional<AdbNode> parse(String dumpOutput) {
        var xml = extractHierarchy(dumpOutput);
        Element hierarchy;
        try {
            var factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            hierarchy = factory.newDocumentBuilder().parse(new InputSource(new StringReader(xml))).getDocumentElement();
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new DeviceOperationException("Couldn't parse the UI hierarchy dump", e);
        }

        var topLevelNodes = getChildNodes(hierarchy);
        if (topLevelNodes.isEmpty()) {
            return Optional.empty();
        } else if (topLevelNodes.size() == 1) {
            return Optional.of(topLevelNodes.get(0));
        } else {
            // Several windows are on the screen at once, e.g. a dialog above an activity
            var windowsArea = topLevelNodes.stream()
                    .map(AdbNode::bounds)
                    .reduce(UiHierarchyParser::union)
                    .orElse(Bounds.EMPTY);
            return Optional.of(new AdbNode("", "", UiElement.ROOT_FALLBACK_CLASS_NAME, "", topLevelNodes.get(0).packageName(),
                    windowsArea, false, false, false, false, true, false, topLevelNodes));
        }
    }

    private static String extractHierarchy(String dumpOutput) {
        if (dumpOutput == null) {
            throw new DeviceOperationException("UI hierarchy dump is empty");
        }
        int start = dumpOutput.indexOf(HIERARCHY_START_TAG);
        int end = dumpOutput.lastIndexOf(HIERARCHY_END_TAG);
        if (start < 0 || end < start) {
            throw new DeviceOperationException("UI hierarchy dump contains no hierarchy: " + dumpOutput.trim());
        }
        return dumpOutput.substring(start, end + HIERARCHY_END_TAG.length());
    }

    private static List<AdbNode> getChildNodes(Element parent) {
        List<AdbNode> children = new ArrayList<>();
        var childNodes = parent.getChildNodes();
        for (int i = 0; i < childNodes.getLength(); i++) {
            var child = childNodes.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE && NODE_TAG.equals(child.getNodeName())) {
                children.add(toNode((Element) child));
            }
        }
        return children;
    }

    private static AdbNode toNode(Element element) {
        try {
            return readNode(element);
        } catch (IllegalArgumentException e) {
            LOG.warn("Couldn't read node '{}' of the UI hierarchy dump, replacing its subtree with a placeholder: {}",
                    element.getAttribute("class"), e.getMessage());
            return new AdbNode("", "", UiElement.ERROR_CLASS_NAME, "", element.getAttribute("package"), Bounds.EMPTY, false,
                    false, false, false, true, false, List.of());
        }
    }

    private static AdbNode readNode(Element element) {
        return new AdbNode(
                element.getAttribute("resource-id"),
                element.getAttribute("text"),
                element.getAttribute("class"),
                element.getAttribute("content-desc"),
                element.getAttribute("package"),
                Bounds.parse(element.getAttribute("bounds")),
                parseBoolean(element.getAttribute("clickable")),
                parseBoolean(element.getAttribute("scrollable")),
                parseBoolean(element.getAttribute("checkable")),
                parseBoolean(element.getAttribute("checked")),
                !element.hasAttribute("enabled") || parseBoolean(element.getAttribute("enabled")),
                parseBoolean(element.getAttribute("focused")),
                getChildNodes(element));
    }

    private static Bounds union(Bounds first, Bounds second) {
        return new Bounds(Math.min(first.left(), second.left()), Math.min(first.top(), second.top()),
                Math.max(first.right(), second.right()), Math.max(first.bottom(), second.bottom()));
    }
}
