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
package org.tarik.uiauto.server;

import io.javalin.Javalin;
import io.javalin.json.JavalinGson;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uiauto.engine.AutomationEngine;
import org.tarik.uiauto.session.AutomationEndpoint;

import java.util.function.BooleanSupplier;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static io.javalin.Javalin.create;

/**
 * Javalin server which exposes the {@link AutomationEngine} over HTTP for the duration of one session.
 */
public class AutomationServer implements AutomationEndpoint {
    private static final Logger LOG = LoggerFactory.getLogger(AutomationServer.class);
    private final AutomationResource automationResource;
    private final int port;
    private final long maxRequestSize;
    private Javalin app;

    public AutomationServer(@NotNull AutomationEngine automationEngine, int port, @NotNull BooleanSupplier sessionRunning,
                            @NotNull String serviceVersion, long maxRequestSize) {
        this.automationResource = new AutomationResource(checkNotNull(automationEngine), sessionRunning, serviceVersion);
        this.port = port;
        this.maxRequestSize = maxRequestSize;
    }

    @Override
    public synchronized void start() {
        checkState(app == null, "Server on port %s has already been started", port);
        app = create(config -> {
            config.http.maxRequestSize = maxRequestSize;
            config.showJavalinBanner = false;
            config.jsonMapper(new JavalinGson());
        })
                .get("/", automationResource::getIndexPage)
                .get("/health", automationResource::getHealth)
                .get("/ui/dump", automationResource::getPageSource)
                .get("/ui/dump/xml", automationResource::getPageSourceAsXml)
                .post("/ui/click", automationResource::click)
                .post("/ui/input", automationResource::input)
                .post("/ui/scroll", automationResource::scroll)
                .post("/ui/wait", automationResource::waitForElement)
                .post("/device/back", automationResource::pressBack)
                .post("/device/home", automationResource::pressHome)
                .post("/device/recent", automationResource::pressRecentApps)
                .get("/device/info", automationResource::getDeviceInfo);
        try {
            app.start(port);
        } catch (RuntimeException e) {
            app.stop();
            app = null;
            throw e;
        }
        LOG.info("HTTP server started on port {}", app.port());
    }

    @Override
    public synchronized void stop() {
        if (app == null) {
            return;
        }
        app.stop();
        app = null;
        LOG.info("HTTP server on port {} stopped", port);
    }

    @Override
    public synchronized int getPort() {
        return app == null ? port : app.port();
    }
}
