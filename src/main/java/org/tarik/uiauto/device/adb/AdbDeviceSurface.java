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

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uiauto.device.DeviceOperationException;
import org.tarik.uiauto.device.DeviceSurface;
import org.tarik.uiauto.device.LiveNode;
import org.tarik.uiauto.dto.ScrollDirection;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Collections.nCopies;
import static org.tarik.uiauto.utils.CommonUtils.parseStringAsInteger;

/**
 * Drives an Android device through ADB. The UI tree is queried with {@code uiautomator dump}, interactions are injected
 * with the {@code input} shell command.
 */
public class AdbDeviceSurface implements DeviceSurface {
    private static final Logger LOG = LoggerFactory.getLogger(AdbDeviceSurface.class);
    private static final String DUMP_TARGET = "/dev/tty";
    private static final int SWIPE_STEP_DURATION_MILLIS = 5;
    private static final int CONTAINER_SCROLL_SWIPE_STEPS = 20;
    private static final String KEYCODE_BACK = "KEYCODE_BACK";
    private static final String KEYCODE_HOME = "KEYCODE_HOME";
    private static final String KEYCODE_APP_SWITCH = "KEYCODE_APP_SWITCH";
    private static final String KEYCODE_MOVE_END = "KEYCODE_MOVE_END";
    private static final String KEYCODE_DEL = "KEYCODE_DEL";
    private static final Pattern DISPLAY_SIZE_PATTERN = Pattern.compile("(Physical|Override) size:\\s*(\\d+)x(\\d+)");
    private static final Pattern FOCUSED_WINDOW_PATTERN =
            Pattern.compile("mCurrentFocus=Window\\{\\S+ \\S+ ([^/\\s}]+)(?:/([^\\s}]+))?}");
    private static final char FIRST_TYPEABLE_CHARACTER = ' ';
    private static final char LAST_TYPEABLE_CHARACTER = '~';
    private static final String SHELL_SPECIAL_CHARACTERS = "()<>|;&*\\~\"'`$#?![]{}";
    private final AdbCommandRunner commandRunner;

    public AdbDeviceSurface(@NotNull AdbCommandRunner commandRunner) {
        this.commandRunner = checkNotNull(commandRunner);
    }

    @Override
    public Optional<? extends LiveNode> getRootNode() {
        var dumpOutput = commandRunner.execOut("uiautomator", "dump", DUMP_TARGET);
        return UiHierarchyParser.parse(dumpOutput);
    }

    @Override
    public int getDisplayWidth() {
        return getDisplaySize()[0];
    }

    @Override
    public int getDisplayHeight() {
        return getDisplaySize()[1];
    }

    @Override
    public String getCurrentPackageName() {
        return getFocusedWindowComponent()[0];
    }

    @Override
    public String getCurrentActivity() {
        return getFocusedWindowComponent()[1];
    }

    @Override
    public boolean tap(int x, int y) {
        commandRunner.shell("input", "tap", String.valueOf(x), String.valueOf(y));
        return true;
    }

    @Override
    public boolean swipe(int startX, int startY, int endX, int endY, int steps) {
        var durationMillis = Math.max(1, steps) * SWIPE_STEP_DURATION_MILLIS;
        commandRunner.shell("input", "swipe", String.valueOf(startX), String.valueOf(startY), String.valueOf(endX),
                String.valueOf(endY), String.valueOf(durationMillis));
        return true;
    }

    @Override
    public boolean clearText(LiveNode node) {
        var currentTextLength = node.getText().length();
        focus(node);
        if (currentTextLength == 0) {
            return true;
        }
        List<String> command = new ArrayList<>(List.of("input", "keyevent", KEYCODE_MOVE_END));
        command.addAll(nCopies(currentTextLength, KEYCODE_DEL));
        commandRunner.shell(command.toArray(String[]::new));
        return true;
    }

    @Override
    public boolean setText(LiveNode node, String text) {
        checkTypeable(text);
        focus(node);
        for (String chunk : toInputTextChunks(text)) {
            commandRunner.shell("input", "text", escapeInputText(chunk));
        }
        return true;
    }

    @Override
    public boolean scroll(LiveNode container, ScrollDirection direction, int steps) {
        var bounds = container.getVisibleBounds();
        if (bounds.isEmpty()) {
            LOG.warn("Container {} has no visible area, nothing to scroll", container.getClassName());
            return false;
        }
        var path = bounds.swipePathFor(direction);
        for (int i = 0; i < Math.max(1, steps); i++) {
            swipe(path.startX(), path.startY(), path.endX(), path.endY(), CONTAINER_SCROLL_SWIPE_STEPS);
        }
        return true;
    }

    @Override
    public boolean pressBack() {
        return pressKey(KEYCODE_BACK);
    }

    @Override
    public boolean pressHome() {
        return pressKey(KEYCODE_HOME);
    }

    @Override
    public boolean pressRecentApps() {
        return pressKey(KEYCODE_APP_SWITCH);
    }

    @Override
    public int getApiLevel() {
        var apiLevel = getSystemProperty("ro.build.version.sdk");
        return parseStringAsInteger(apiLevel).orElseThrow(() ->
                new DeviceOperationException("Device reported an invalid API level: '%s'".formatted(apiLevel)));
    }

    @Override
    public String getManufacturer() {
        return getSystemProperty("ro.product.manufacturer");
    }

    @Override
    public String getModel() {
        return getSystemProperty("ro.product.model");
    }

    @Override
    public String getOsVersion() {
        return getSystemProperty("ro.build.version.release");
    }

    private boolean pressKey(String keyCode) {
        commandRunner.shell("input", "keyevent", keyCode);
        return true;
    }

    private void focus(LiveNode node) {
        var bounds = node.getVisibleBounds();
        tap(bounds.centerX(), bounds.centerY());
    }

    private String getSystemProperty(String name) {
        return commandRunner.shell("getprop", name).trim();
    }

    private int[] getDisplaySize() {
        var output = commandRunner.shell("wm", "size");
        var matcher = DISPLAY_SIZE_PATTERN.matcher(output);
        int[] size = null;
        // An override size, if present, is reported after the physical one and is the one applications see
        while (matcher.find()) {
            size = new int[]{Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(3))};
        }
        if (size == null) {
            throw new DeviceOperationException("Couldn't identify the display size from: " + output.trim());
        }
        return size;
    }

    private String[] getFocusedWindowComponent() {
        var output = commandRunner.shell("dumpsys", "window");
        var matcher = FOCUSED_WINDOW_PATTERN.matcher(output);
        if (!matcher.find()) {
            LOG.debug("No focused window found in the window manager state");
            return new String[]{"", ""};
        }
        var packageName = matcher.group(1);
        var activity = matcher.group(2) == null ? "" : matcher.group(2);
        if (activity.startsWith(".")) {
            activity = packageName + activity;
        }
        return new String[]{packageName, activity};
    }

    /**
     * Splits the text so that no chunk contains a literal "%s", which the {@code input} command would type as a space.
     * Each chunk is meant to be sent with its own {@code input text} call.
     */
    static List<String> toInputTextChunks(String text) {
        List<String> chunks = new ArrayList<>();
        int chunkStart = 0;
        for (int i = 1; i < text.length(); i++) {
            if (text.charAt(i - 1) == '%' && text.charAt(i) == 's') {
                chunks.add(text.substring(chunkStart, i));
                chunkStart = i;
            }
        }
        if (chunkStart < text.length()) {
            chunks.add(text.substring(chunkStart));
        }
        return chunks;
    }

    private static void checkTypeable(String text) {
        for (char character : text.toCharArray()) {
            if (character < FIRST_TYPEABLE_CHARACTER || character > LAST_TYPEABLE_CHARACTER) {
                throw new DeviceOperationException(("Text contains the character '%s' (U+%04X) which can't be typed " +
                        "through the input command").formatted(character, (int) character));
            }
        }
    }

    static String escapeInputText(String text) {
        var escaped = new StringBuilder();
        for (char character : text.toCharArray()) {
            if (character == ' ') {
                escaped.append("%s");
            } else {
                if (SHELL_SPECIAL_CHARACTERS.indexOf(character) >= 0) {
                    escaped.append('\\');
                }
                escaped.append(character);
            }
        }
        return escaped.toString();
    }
}
