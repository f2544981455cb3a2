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

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The single logical automation handle. Every access to the device surface goes through
 * {@link #withExclusiveAccess(Function)}, so that two requests never interleave their gestures or act on bounds computed by
 * each other. Callers which arrive while the channel is busy wait in arrival order.
 */
public class DeviceChannel {
    private static final Logger LOG = LoggerFactory.getLogger(DeviceChannel.class);
    private final DeviceSurface deviceSurface;
    private final ReentrantLock lock = new ReentrantLock(true);

    public DeviceChannel(@NotNull DeviceSurface deviceSurface) {
        this.deviceSurface = checkNotNull(deviceSurface);
    }

    public <T> T withExclusiveAccess(Function<DeviceSurface, T> operation) {
        if (isBusy() && !lock.isHeldByCurrentThread()) {
            LOG.debug("Device channel is busy, {} request(s) already waiting", lock.getQueueLength());
        }
        lock.lock();
        try {
            return operation.apply(deviceSurface);
        } finally {
            lock.unlock();
        }
    }

    public boolean isBusy() {
        return lock.isLocked();
    }
}
