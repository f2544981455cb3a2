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

import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.apache.commons.io.IOUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uiauto.dto.*;
import org.tarik.uiauto.engine.AutomationEngine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.System.currentTimeMillis;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.tarik.uiauto.dto.ActionResult.failed;
import static org.tarik.uiauto.dto.ErrorCode.SERVICE_ERROR;

/**
 * HTTP handlers of the automation API. Every handler of a device operation first makes sure that the session is running,
 * then delegates to the {@link AutomationEngine}. Errors are always reported as an {@link ActionResult}.
 */
public class AutomationResource {
    private static final Logger LOG = LoggerFactory.getLogger(AutomationResource.class);
    private static final String INDEX_PAGE_RESOURCE = "/index.html";
    private static final String XML_CONTENT_TYPE = "application/xml";
    private static final String HEALTHY_STATUS = "healthy";
    private final AutomationEngine automationEngine;
    private final BooleanSupplier sessionRunning;
    private final String serviceVersion;
    private final String indexPage;

    public AutomationResource(@NotNull AutomationEngine automationEngine, @NotNull BooleanSupplier sessionRunning,
                              @NotNull String serviceVersion) {
        this.automationEngine = checkNotNull(automationEngine);
        this.sessionRunning = checkNotNull(sessionRunning);
        this.serviceVersion = checkNotNull(serviceVersion);
        this.indexPage = loadIndexPage();
    }

    public void getPageSource(@NotNull Context context) {
        respond(context, "get page source", automationEngine::getPageSource);
    }

    public void getPageSourceAsXml(@NotNull Context context) {
        if (isSessionNotRunning(context)) {
            return;
        }
        try {
            var xml = automationEngine.getPageSourceAsXml();
            context.contentType(XML_CONTENT_TYPE).result(xml);
        } catch (Exception e) {
            LOG.error("Failed to get XML dump", e);
            respondWithError(context, HttpStatus.INTERNAL_SERVER_ERROR, "Failed to get XML dump: " + e.getMessage());
        }
    }

    public void click(@NotNull Context context) {
        handleActionRequest(context, "click", ClickRequest.class,
                request -> automationEngine.click(request.selector()));
    }

    public void input(@NotNull Context context) {
        handleActionRequest(context, "input", InputRequest.class,
                request -> automationEngine.input(request.selector(), request.text(), request.clearFirst()));
    }

    public void scroll(@NotNull Context context) {
        handleActionRequest(context, "scroll", ScrollRequest.class,
                request -> automationEngine.scroll(request.direction(), request.steps(), request.selector()));
    }

    public void waitForElement(@NotNull Context context) {
        handleActionRequest(context, "wait", WaitRequest.class,
                request -> automationEngine.waitFor(request.selector(), request.condition(), request.timeout()));
    }

    public void pressBack(@NotNull Context context) {
        respond(context, "press back key", automationEngine::pressBack);
    }

    public void pressHome(@NotNull Context context) {
        respond(context, "press home key", automationEngine::pressHome);
    }

    public void pressRecentApps(@NotNull Context context) {
        respond(context, "press recent apps key", automationEngine::pressRecentApps);
    }

    public void getDeviceInfo(@NotNull Context context) {
        respond(context, "get device info", automationEngine::getDeviceInfo);
    }

    public void getHealth(@NotNull Context context) {
        context.json(new HealthStatus(HEALTHY_STATUS, currentTimeMillis(), serviceVersion));
    }

    public void getIndexPage(@NotNull Context context) {
        context.html(indexPage);
    }

    private <T> void handleActionRequest(Context context, String operationName, Class<T> requestClass,
                                         Function<T, ActionResult> action) {
        if (isSessionNotRunning(context)) {
            return;
        }
        T request;
        try {
            request = context.bodyAsClass(requestClass);
        } catch (Exception e) {
            LOG.error("Failed to process {} request", operationName, e);
            respondWithError(context, HttpStatus.BAD_REQUEST,
                    "Failed to process %s request: %s".formatted(operationName, e.getMessage()));
            return;
        }
        if (request == null) {
            respondWithError(context, HttpStatus.BAD_REQUEST,
                    "Failed to process %s request: request body is missing".formatted(operationName));
            return;
        }
        respondWithResult(context, operationName, () -> action.apply(request));
    }

    private void respond(Context context, String operationName, Supplier<?> operation) {
        if (!isSessionNotRunning(context)) {
            respondWithResult(context, operationName, operation);
        }
    }

    private static void respondWithResult(Context context, String operationName, Supplier<?> operation) {
        try {
            context.json(operation.get());
        } catch (Exception e) {
            LOG.error("Failed to {}", operationName, e);
            respondWithError(context, HttpStatus.INTERNAL_SERVER_ERROR,
                    "Failed to %s: %s".formatted(operationName, e.getMessage()));
        }
    }

    private boolean isSessionNotRunning(Context context) {
        if (sessionRunning.getAsBoolean()) {
            return false;
        }
        LOG.warn("Rejecting {} {}, the automation session is not running", context.method(), context.path());
        respondWithError(context, HttpStatus.SERVICE_UNAVAILABLE, "Automation session is not running");
        return true;
    }

    private static void respondWithError(Context context, HttpStatus status, String message) {
        context.status(status).json(failed(SERVICE_ERROR, message));
    }

    private static String loadIndexPage() {
        try {
            return IOUtils.resourceToString(INDEX_PAGE_RESOURCE, UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load resource " + INDEX_PAGE_RESOURCE, e);
        }
    }
}
