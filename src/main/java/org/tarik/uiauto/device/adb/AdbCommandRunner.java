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

import org.apache.commons.io.IOUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uiauto.device.DeviceOperationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.CompletableFuture.supplyAsync;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.tarik.uiauto.utils.CommonUtils.isNotBlank;

/**
 * Runs commands of the Android Debug Bridge against one device.
 */
public class AdbCommandRunner {
    private static final Logger LOG = LoggerFactory.getLogger(AdbCommandRunner.class);
    private static final String SERIAL_OPTION = "-s";
    private static final String SHELL_COMMAND = "shell";
    private static final String EXEC_OUT_COMMAND = "exec-out";
    private final String adbPath;
    private final @Nullable String deviceSerial;
    private final long commandTimeoutMillis;

    public AdbCommandRunner(@NotNull String adbPath, @Nullable String deviceSerial, long commandTimeoutMillis) {
        this.adbPath = adbPath;
        this.deviceSerial = deviceSerial;
        this.commandTimeoutMillis = commandTimeoutMillis;
    }

    /**
     * Runs the given command in the device shell.
     *
     * @return the standard output of the command
     * @throws DeviceOperationException if the command couldn't be started, exceeded the timeout or exited with a non-zero
     *                                  code
     */
    public String shell(String... command) {
        return run(SHELL_COMMAND, command);
    }

    /**
     * Same as {@link #shell(String...)}, but the output is transferred as binary, which keeps large outputs like
     * hierarchy dumps intact.
     */
    public String execOut(String... command) {
        return run(EXEC_OUT_COMMAND, command);
    }

    private String run(String adbCommand, String... arguments) {
        List<String> commandLine = new ArrayList<>();
        commandLine.add(adbPath);
        if (isNotBlank(deviceSerial)) {
            commandLine.add(SERIAL_OPTION);
            commandLine.add(deviceSerial);
        }
        commandLine.add(adbCommand);
        commandLine.addAll(List.of(arguments));

        LOG.debug("Executing command: {}", commandLine);
        Process process;
        try {
            process = new ProcessBuilder(commandLine).start();
        } catch (IOException e) {
            throw new DeviceOperationException("Couldn't start '%s'. Is ADB installed and on the PATH ?".formatted(adbPath), e);
        }

        CompletableFuture<String> outputFuture = supplyAsync(() -> readFully(process.getInputStream()));
        CompletableFuture<String> errorFuture = supplyAsync(() -> readFully(process.getErrorStream()));
        try {
            if (!process.waitFor(commandTimeoutMillis, MILLISECONDS)) {
                process.destroyForcibly();
                throw new DeviceOperationException("Command %s didn't finish within %d ms".formatted(commandLine,
                        commandTimeoutMillis));
            }
            var output = outputFuture.join();
            if (process.exitValue() != 0) {
                var errorMessage = "Command %s failed. Exit code: %s. Output: %s. Error: %s"
                        .formatted(commandLine, process.exitValue(), output.trim(), errorFuture.join().trim());
                throw new DeviceOperationException(errorMessage);
            }
            return output;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new DeviceOperationException("Interrupted while executing " + commandLine, e);
        } catch (CompletionException e) {
            throw new DeviceOperationException("Couldn't read the output of " + commandLine, e.getCause());
        }
    }

    private static String readFully(InputStream inputStream) {
        try (inputStream) {
            return IOUtils.toString(inputStream, UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
