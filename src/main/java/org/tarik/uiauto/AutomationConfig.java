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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.uiauto.utils.CommonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;

public class AutomationConfig {
    private static final Logger LOG = LoggerFactory.getLogger(AutomationConfig.class);
    private static final Properties properties = loadConfigPropertiesFromFile();

    public record ConfigProperty<T>(T value, boolean isSecret) {
    }

    // -----------------------------------------------------
    // Constants
    private static final String CONFIG_FILE = "config.properties";

    // Main Config
    private static final ConfigProperty<Integer> START_PORT = loadPropertyAsInteger("port", "PORT", "8080", false);
    private static final ConfigProperty<Boolean> DEBUG_MODE =
            loadProperty("debug.mode", "DEBUG_MODE", "false", Boolean::parseBoolean, false);
    private static final ConfigProperty<String> SERVICE_VERSION =
            loadProperty("service.version", "SERVICE_VERSION", "1.0.0", s -> s, false);
    private static final ConfigProperty<Long> HTTP_MAX_REQUEST_SIZE =
            loadPropertyAsLong("http.max.request.size", "HTTP_MAX_REQUEST_SIZE", "1000000", false);

    // Device Config
    private static final ConfigProperty<String> ADB_PATH = loadProperty("adb.path", "ADB_PATH", "adb", s -> s, false);
    private static final ConfigProperty<String> ADB_SERIAL = loadProperty("adb.serial", "ADB_SERIAL", "", s -> s, false);
    private static final ConfigProperty<Long> ADB_COMMAND_TIMEOUT_MILLIS =
            loadPropertyAsLong("adb.command.timeout.millis", "ADB_COMMAND_TIMEOUT_MILLIS", "10000", false);

    // Timeout and Retry Config
    private static final ConfigProperty<Long> WAIT_POLL_INTERVAL_MILLIS =
            loadPropertyAsLong("wait.poll.interval.millis", "WAIT_POLL_INTERVAL_MILLIS", "250", false);

    // -----------------------------------------------------
    // Main Config
    public static int getStartPort() {
        return START_PORT.value();
    }

    public static boolean isDebugMode() {
        return DEBUG_MODE.value();
    }

    public static String getServiceVersion() {
        return SERVICE_VERSION.value();
    }

    public static long getHttpMaxRequestSize() {
        return HTTP_MAX_REQUEST_SIZE.value();
    }

    // -----------------------------------------------------
    // Device Config
    public static String getAdbPath() {
        return ADB_PATH.value();
    }

    public static Optional<String> getAdbSerial() {
        return ofNullable(ADB_SERIAL.value()).filter(CommonUtils::isNotBlank);
    }

    public static long getAdbCommandTimeoutMillis() {
        return ADB_COMMAND_TIMEOUT_MILLIS.value();
    }

    // -----------------------------------------------------
    // Timeout and Retry Config
    public static long getWaitPollIntervalMillis() {
        return WAIT_POLL_INTERVAL_MILLIS.value();
    }

    // -----------------------------------------------------
    // Private methods
    private static Properties loadConfigPropertiesFromFile() {
        var properties = new Properties();
        try (InputStream inputStream = AutomationConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (inputStream == null) {
                LOG.error("Cannot find resource file '{}' in classpath.", CONFIG_FILE);
                throw new IOException("Cannot find resource: " + CONFIG_FILE);
            }
            properties.load(new InputStreamReader(inputStream, UTF_8));
            LOG.info("Loaded properties from {}", CONFIG_FILE);
            return properties;
        } catch (IOException e) {
            LOG.error("Error loading properties file {}", CONFIG_FILE, e);
            throw new UncheckedIOException(e);
        }
    }

    private static <T> ConfigProperty<T> loadProperty(String key, String envVar, String defaultValue, Function<String, T> converter,
                                                      boolean isSecret) {
        var value = getProperty(key, envVar, defaultValue, isSecret);
        return new ConfigProperty<>(converter.apply(value), isSecret);
    }

    private static Optional<String> getProperty(String key, String envVar, boolean isSecret) {
        var envVariableOptional = ofNullable(envVar)
                .map(System::getenv)
                .map(String::trim)
                .filter(CommonUtils::isNotBlank);
        if (envVariableOptional.isPresent()) {
            var message = "Using environment variable '%s' for key '%s'".formatted(envVar, key);
            if (!isSecret) {
                message = "%s with value '%s'".formatted(message, envVariableOptional.get());
            }
            LOG.info(message);
            return envVariableOptional;
        } else {
            var propertyFileValueOptional = ofNullable(properties.getProperty(key))
                    .map(String::trim)
                    .filter(CommonUtils::isNotBlank);
            if (propertyFileValueOptional.isPresent()) {
                var message = "Using property file value for key '%s'".formatted(key);
                if (!isSecret) {
                    message = "%s with value '%s'".formatted(message, propertyFileValueOptional.get());
                }
                LOG.info(message);
                return propertyFileValueOptional;
            } else {
                return empty();
            }
        }
    }

    private static String getProperty(String key, String envVar, String defaultValue, boolean isSecret) {
        return getProperty(key, envVar, isSecret).orElseGet(() -> {
            LOG.debug("Using default value for key '{}'", key);
            return defaultValue;
        });
    }

    private static ConfigProperty<Integer> loadPropertyAsInteger(String propertyKey, String envVar, String defaultValue, boolean isSecret) {
        var configProperty = loadProperty(propertyKey, envVar, defaultValue, s -> s, isSecret);
        Integer value = CommonUtils.parseStringAsInteger(configProperty.value()).orElseThrow(() -> new IllegalArgumentException(
                "The value of property '%s' is not a correct integer value:%s".formatted(propertyKey, configProperty.value())));
        return new ConfigProperty<>(value, configProperty.isSecret());
    }

    private static ConfigProperty<Long> loadPropertyAsLong(String propertyKey, String envVar, String defaultValue, boolean isSecret) {
        var configProperty = loadProperty(propertyKey, envVar, defaultValue, s -> s, isSecret);
        Long value = CommonUtils.parseStringAsLong(configProperty.value()).orElseThrow(() -> new IllegalArgumentException(
                "The value of property '%s' is not a correct long value:%s".formatted(propertyKey, configProperty.value())));
        return new ConfigProperty<>(value, configProperty.isSecret());
    }
}
