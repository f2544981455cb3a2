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
package org.tarik.uiauto;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uiauto.device.adb.AdbCommandRunner;
import org.tarik.uiauto.device.adb.AdbDeviceSurface;
import org.tarik.uiauto.engine.AutomationEngine;
import org.tarik.uiauto.server.AutomationServer;
import org.tarik.uiauto.session.SessionLifecycleController;
import org.tarik.uiauto.session.ShutdownHookForegroundSignal;
import org.tarik.uiauto.utils.CommonUtils;

import static org.tarik.uiauto.AutomationConfig.*;

public class Server {
    private static final Logger LOG = LoggerFactory.getLogger(Server.class);
    private static final String BASE_PACKAGE = "org.tarik.uiauto";

    public static void main(String[] args) {
        if (isDebugMode()) {
            enableDebugLogging();
        }
        int port = args.length > 0
                ? CommonUtils.parseStringAsInteger(args[0]).orElseThrow(
                () -> new IllegalArgumentException("Port argument is not a correct integer value: " + args[0]))
                : getStartPort();

        var commandRunner = new AdbCommandRunner(getAdbPath(), getAdbSerial().orElse(null), getAdbCommandTimeoutMillis());
        var automationEngine = new AutomationEngine(new AdbDeviceSurface(commandRunner), getWaitPollIntervalMillis());
        var controller = new SessionLifecycleController(
                (sessionPort, sessionRunning) -> new AutomationServer(automationEngine, sessionPort, sessionRunning,
                        getServiceVersion(), getHttpMaxRequestSize()),
                new ShutdownHookForegroundSignal());

        var status = controller.start(port);
        if (!status.isRunning()) {
            LOG.error("UI automation service could not be started: {}", status.message());
            System.exit(1);
        }
        LOG.info("UI automation service is running at {}", status.serverUrl());
    }

    private static void enableDebugLogging() {
        if (LoggerFactory.getLogger(BASE_PACKAGE) instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.DEBUG);
            LOG.debug("Debug logging enabled");
        }
    }
}
