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
package org.tarik.uiauto.device;

import org.tarik.uiauto.dto.Bounds;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable in-memory node used by {@link FixtureDeviceSurface}.
 */
public class FixtureNode implements LiveNode {
    private final String className;
    private final List<FixtureNode> children = new ArrayList<>();
    private String resourceId = "";
    private String text = "";
    private String contentDescription = "";
    private Bounds bounds = Bounds.EMPTY;
    private boolean clickable;
    private boolean scrollable;
    private boolean checkable;
    private boolean checked;
    private boolean enabled = true;
    private boolean focused;
    private boolean unreadable;

    private FixtureNode(String className) {
        this.className = className;
    }

    public static FixtureNode node(String className) {
        return new FixtureNode(className);
    }

    public FixtureNode withResourceId(String resourceId) {
        this.resourceId = resourceId;
        return this;
    }

    public FixtureNode withText(String text) {
        this.text = text;
        return this;
    }

    public FixtureNode withContentDescription(String contentDescription) {
        this.contentDescription = contentDescription;
        return this;
    }

    public FixtureNode withBounds(int left, int top, int right, int bottom) {
        this.bounds = new Bounds(left, top, right, bottom);
        return this;
    }

    public FixtureNode clickable() {
        this.clickable = true;
        return this;
    }

    public FixtureNode scrollable() {
        this.scrollable = true;
        return this;
    }

    public FixtureNode checkable() {
        this.checkable = true;
        return this;
    }

    public FixtureNode focused() {
        this.focused = true;
        return this;
    }

    /**
     * Makes every accessor of this node throw, the way a node which vanished from the screen does.
     */
    public FixtureNode unreadable() {
        this.unreadable = true;
        return this;
    }

    public FixtureNode withChildren(FixtureNode... nodes) {
        children.addAll(List.of(nodes));
        return this;
    }

    public void setText(String text) {
        this.text = text;
    }

    public void setClickable(boolean clickable) {
        this.clickable = clickable;
    }

    public void toggleChecked() {
        checked = !checked;
    }

    public void removeChild(FixtureNode child) {
        children.remove(child);
    }

    public void addChild(FixtureNode child) {
        children.add(child);
    }

    @Override
    public String getResourceId() {
        return read(resourceId);
    }

    @Override
    public String getText() {
        return read(text);
    }

    @Override
    public String getClassName() {
        return read(className);
    }

    @Override
    public String getContentDescription() {
        return read(contentDescription);
    }

    @Override
    public Bounds getVisibleBounds() {
        return read(bounds);
    }

    @Override
    public boolean isClickable() {
        return read(clickable);
    }

    @Override
    public boolean isScrollable() {
        return read(scrollable);
    }

    @Override
    public boolean isCheckable() {
        return read(checkable);
    }

    @Override
    public boolean isChecked() {
        return read(checked);
    }

    @Override
    public boolean isEnabled() {
        return read(enabled);
    }

    @Override
    public boolean isFocused() {
        return read(focused);
    }

    @Override
    public List<FixtureNode> getChildren() {
        return read(List.copyOf(children));
    }

    private <T> T read(T value) {
        if (unreadable) {
            throw new DeviceOperationException("Node " + className + " is no longer available");
        }
        return value;
    }
}
