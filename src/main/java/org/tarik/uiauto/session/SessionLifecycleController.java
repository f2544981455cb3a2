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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uiauto.utils.NetworkUtils;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.CompletableFuture.supplyAsync;
import static java.util.concurrent.Executors.newSingleThreadExecutor;
import static org.tarik.uiauto.session.SessionState.*;

/**
 * Owns the single automation session of the process. A session moves from {@code STOPPED} through {@code STARTING} to
 * {@code RUNNING} and back to {@code STOPPED}; a failed start passes through {@code FAILED} and ends in {@code STOPPED} as
 * well, so that no half-started session is ever left behind. Lifecycle requests are serialized, a start request for a
 * running session and a stop request for a stopped one are no-ops.
 */
public class SessionLifecycleController implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SessionLifecycleController.class);
    public static final int MIN_PORT = 1024;
    public static final int MAX_PORT = 65535;
    private static final String URL_TEMPLATE = "http://%s:%d";
    private final EndpointFactory endpointFactory;
    private final ForegroundSignal foregroundSignal;
    private final Supplier<String> hostAddressProvider;
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final ExecutorService startExecutor = newSingleThreadExecutor(runnable -> {
        var thread = new Thread(runnable, "automation-session-starter");
        thread.setDaemon(true);
        return thread;
    });
    private volatile SessionState state = STOPPED;
    private volatile Session session;

    public SessionLifecycleController(@NotNull EndpointFactory endpointFactory, @NotNull ForegroundSignal foregroundSignal) {
        this(endpointFactory, foregroundSignal, NetworkUtils::getReachableHostAddress);
    }

    public SessionLifecycleController(@NotNull EndpointFactory endpointFactory, @NotNull ForegroundSignal foregroundSignal,
                                      @NotNull Supplier<String> hostAddressProvider) {
        this.endpointFactory = checkNotNull(endpointFactory);
        this.foregroundSignal = checkNotNull(foregroundSignal);
        this.hostAddressProvider = checkNotNull(hostAddressProvider);
    }

    /**
     * Starts the session on the given port and returns once the endpoint is bound or the start has failed.
     *
     * @throws IllegalArgumentException if the port is outside the range {@value #MIN_PORT}-{@value #MAX_PORT}, in which case
     *                                  nothing has been started
     */
    public SessionStatus start(int port) {
        validatePort(port);
        lifecycleLock.lock();
        try {
            if (state == RUNNING) {
                LOG.warn("Session is already running on port {}, ignoring the start request", session.port());
                return getStatus("Session is already running");
            }
            return startSession(port);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Same as {@link #start(int)}, but doesn't block the caller. From the moment this method returns until the start
     * has completed, {@link #getState()} reports {@code STARTING}.
     *
     * @throws IllegalArgumentException if the port is outside the allowed range
     */
    public CompletableFuture<SessionStatus> startAsync(int port) {
        validatePort(port);
        lifecycleLock.lock();
        try {
            if (state == STOPPED) {
                state = STARTING;
            }
            return supplyAsync(() -> start(port), startExecutor);
        } catch (RejectedExecutionException e) {
            resetPendingStart();
            throw e;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Stops the session. The endpoint is released before the session is reported as stopped.
     */
    public SessionStatus stop() {
        lifecycleLock.lock();
        try {
            var currentSession = session;
            if (state != RUNNING || currentSession == null) {
                LOG.debug("Session is not running, nothing to stop");
                return getStatus("Session is not running");
            }

            String message = "Session stopped";
            try {
                currentSession.endpoint().stop();
            } catch (Exception e) {
                LOG.error("Failed to release the endpoint on port {} cleanly", currentSession.port(), e);
                message = "Session stopped, but the endpoint reported an error: " + e.getMessage();
            }
            foregroundSignal.leaveForeground();
            session = null;
            state = STOPPED;
            LOG.info("Automation session on port {} stopped", currentSession.port());
            return new SessionStatus(STOPPED, currentSession.port(), null, message);
        } finally {
            lifecycleLock.unlock();
        }
    }

    public boolean isRunning() {
        return state == RUNNING;
    }

    public SessionState getState() {
        return state;
    }

    public Optional<String> getServerUrl() {
        var currentSession = session;
        return isRunning() && currentSession != null ? Optional.of(currentSession.serverUrl()) : Optional.empty();
    }

    public Optional<Integer> getPort() {
        var currentSession = session;
        return isRunning() && currentSession != null ? Optional.of(currentSession.port()) : Optional.empty();
    }

    @Override
    public void close() {
        stop();
        startExecutor.shutdownNow();
        lifecycleLock.lock();
        try {
            resetPendingStart();
        } finally {
            lifecycleLock.unlock();
        }
    }

    private SessionStatus startSession(int port) {
        state = STARTING;
        LOG.info("Starting automation session on port {}", port);
        AutomationEndpoint endpoint = null;
        try {
            endpoint = endpointFactory.create(port, this::isRunning);
            endpoint.start();
            var boundPort = endpoint.getPort();
            var serverUrl = URL_TEMPLATE.formatted(hostAddressProvider.get(), boundPort);
            foregroundSignal.enterForeground(serverUrl, this::stop);
            session = new Session(boundPort, endpoint, serverUrl);
            state = RUNNING;
            LOG.info("Automation session started, reachable at {}", serverUrl);
            return getStatus("Session started");
        } catch (Exception e) {
            state = FAILED;
            LOG.error("Failed to start automation session on port {}", port, e);
            releaseAfterFailedStart(endpoint);
            session = null;
            state = STOPPED;
            return new SessionStatus(STOPPED, port, null, "Failed to start session: " + e.getMessage());
        }
    }

    private void resetPendingStart() {
        if (state == STARTING && session == null) {
            state = STOPPED;
        }
    }

    private void releaseAfterFailedStart(@Nullable AutomationEndpoint endpoint) {
        if (endpoint == null) {
            return;
        }
        try {
            endpoint.stop();
        } catch (Exception e) {
            LOG.error("Failed to release the endpoint after a failed start", e);
        }
    }

    private SessionStatus getStatus(String message) {
        var currentSession = session;
        if (currentSession == null) {
            return new SessionStatus(state, 0, null, message);
        }
        return new SessionStatus(state, currentSession.port(), currentSession.serverUrl(), message);
    }

    private static void validatePort(int port) {
        checkArgument(port >= MIN_PORT && port <= MAX_PORT, "Port must be within %s-%s, got %s", MIN_PORT, MAX_PORT, port);
    }

    private record Session(int port, AutomationEndpoint endpoint, String serverUrl) {
    }
}
