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

import org.tarik.uiauto.dto.ScrollDirection;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * In-memory device whose screen is a tree of {@link FixtureNode}. A tap toggles the checked state of the deepest checkable
 * node under the tapped point, text input changes the text of the node directly.
 */
public class FixtureDeviceSurface implements DeviceSurface {
    private final List<String> pressedKeys = new ArrayList<>();
    private final List<int[]> swipes = new ArrayList<>();
    private final List<int[]> taps = new ArrayList<>();
    private FixtureNode root;
    private RuntimeException failure;
    private int rootQueries;
    private int scrolls;

    public FixtureDeviceSurface(FixtureNode root) {
        this.root = root;
    }

    public void setRoot(FixtureNode root) {
        this.root = root;
    }

    /**
     * Makes every following call of this surface throw the given exception.
     */
    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public List<String> getPressedKeys() {
        return pressedKeys;
    }

    public List<int[]> getSwipes() {
        return swipes;
    }

    public List<int[]> getTaps() {
        return taps;
    }

    public int getRootQueries() {
        return rootQueries;
    }

    public int getScrolls() {
        return scrolls;
    }

    @Override
    public Optional<FixtureNode> getRootNode() {
        checkFailure();
        rootQueries++;
        return Optional.ofNullable(root);
    }

    @Override
    public int getDisplayWidth() {
        checkFailure();
        return 1080;
    }

    @Override
    public int getDisplayHeight() {
        checkFailure();
        return 1920;
    }

    @Override
    public String getCurrentPackageName() {
        checkFailure();
        return "com.example.app";
    }

    @Override
    public String getCurrentActivity() {
        checkFailure();
        return "com.example.app.MainActivity";
    }

    @Override
    public boolean tap(int x, int y) {
        checkFailure();
        taps.add(new int[]{x, y});
        findDeepestCheckableAt(root, x, y).ifPresent(FixtureNode::toggleChecked);
        return true;
    }

    @Override
    public boolean swipe(int startX, int startY, int endX, int endY, int steps) {
        checkFailure();
        swipes.add(new int[]{startX, startY, endX, endY, steps});
        return true;
    }

    @Override
    public boolean clearText(LiveNode node) {
        checkFailure();
        ((FixtureNode) node).setText("");
        return true;
    }

    @Override
    public boolean setText(LiveNode node, String text) {
        checkFailure();
        var fixtureNode = (FixtureNode) node;
        fixtureNode.setText(fixtureNode.getText() + text);
        return true;
    }

    @Override
    public boolean scroll(LiveNode container, ScrollDirection direction, int steps) {
        checkFailure();
        scrolls += steps;
        return container.isScrollable();
    }

    @Override
    public boolean pressBack() {
        return pressKey("BACK");
    }

    @Override
    public boolean pressHome() {
        return pressKey("HOME");
    }

    @Override
    public boolean pressRecentApps() {
        return pressKey("RECENT_APPS");
    }

    @Override
    public int getApiLevel() {
        checkFailure();
        return 34;
    }

    @Override
    public String getManufacturer() {
        checkFailure();
        return "Google";
    }

    @Override
    public String getModel() {
        checkFailure();
        return "Pixel 8";
    }

    @Override
    public String getOsVersion() {
        checkFailure();
        return "14";
    }

    private boolean pressKey(String key) {
        checkFailure();
        pressedKeys.add(key);
        return true;
    }

    private Optional<FixtureNode> findDeepestCheckableAt(FixtureNode node, int x, int y) {
        if (node == null || !node.getVisibleBounds().contains(x, y)) {
            return Optional.empty();
        }
        for (FixtureNode child : node.getChildren()) {
            var match = findDeepestCheckableAt(child, x, y);
            if (match.isPresent()) {
                return match;
            }
        }
        return node.isCheckable() ? Optional.of(node) : Optional.empty();
    }

    private void checkFailure() {
        if (failure != null) {
            throw failure;
        }
    }
}
