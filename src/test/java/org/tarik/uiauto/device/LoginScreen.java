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

import static org.tarik.uiauto.device.FixtureNode.node;

/**
 * Login form laid out on a 1080x1920 screen.
 */
public class LoginScreen {
    public static final String PACKAGE = "com.example.app";
    public final FixtureNode title = node("android.widget.TextView")
            .withResourceId(PACKAGE + ":id/title").withText("Welcome back").withBounds(100, 100, 980, 200);
    public final FixtureNode username = node("android.widget.EditText")
            .withResourceId(PACKAGE + ":id/username").withText("old value").withBounds(100, 300, 980, 400).clickable();
    public final FixtureNode remember = node("android.widget.CheckBox")
            .withResourceId(PACKAGE + ":id/remember").withText("Remember me").withBounds(100, 450, 500, 550).clickable()
            .checkable();
    public final FixtureNode login = node("android.widget.Button")
            .withResourceId(PACKAGE + ":id/login").withText("Log in").withBounds(100, 600, 500, 700).clickable();
    public final FixtureNode cancel = node("android.widget.Button")
            .withResourceId(PACKAGE + ":id/cancel").withText("Cancel").withContentDescription("Cancel login")
            .withBounds(580, 600, 980, 700).clickable();
    public final FixtureNode list = node("androidx.recyclerview.widget.RecyclerView")
            .withResourceId(PACKAGE + ":id/recent_accounts").withBounds(0, 800, 1080, 1800).scrollable();
    public final FixtureNode form = node("android.widget.LinearLayout")
            .withBounds(0, 0, 1080, 760)
            .withChildren(title, username, remember, login, cancel);
    public final FixtureNode root = node("android.widget.FrameLayout")
            .withBounds(0, 0, 1080, 1920)
            .withChildren(form, list);

    public FixtureDeviceSurface toDeviceSurface() {
        return new FixtureDeviceSurface(root);
    }
}
