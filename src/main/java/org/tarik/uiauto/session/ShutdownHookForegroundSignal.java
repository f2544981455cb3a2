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
package org.tarik.uiauto.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the JVM bound to a running session: the session is stopped by a shutdown hook if the process is terminated while
 * the session is still running.
 */
public class ShutdownHookForegroundSignal implements ForegroundSignal {
    private static final Logger LOG = LoggerFactory.getLogger(ShutdownHookForegroundSignal.class);
    private static final String HOOK_THREAD_NAME = "automation-session-teardown";
    private Thread shutdownHook;

    @Override
    public synchronized void enterForeground(String serverUrl, Runnable teardownAction) {
        if (shutdownHook != null) {
            LOG.debug("Process is already kept in foreground");
            return;
        }
        shutdownHook = new Thread(() -> {
            LOG.info("Process is shutting down, stopping the session at {}", serverUrl);
            teardownAction.run();
        }, HOOK_THREAD_NAME);
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOG.info("Process is kept in foreground while the session at {} is running", serverUrl);
    }

    @Override
    public synchronized void leaveForeground() {
        if (shutdownHook == null) {
            return;
        }
        if (Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                LOG.debug("Process shutdown is already in progress, the teardown hook stays registered");
            }
        }
        shutdownHook = null;
        LOG.info("Process is no longer kept in foreground");
    }
}
