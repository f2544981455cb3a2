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
package org.tarik.uiauto.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Collections;
import java.util.Optional;

import static java.util.Comparator.comparing;

public class NetworkUtils {
    private static final Logger LOG = LoggerFactory.getLogger(NetworkUtils.class);
    public static final String LOOPBACK_HOST = "localhost";

    /**
     * Finds the address under which this host is reachable from the local network. Site-local IPv4 addresses of active
     * interfaces are preferred over other non-loopback IPv4 ones; the loopback host name is used if there are none.
     */
    public static String getReachableHostAddress() {
        return findLocalNetworkAddress().orElseGet(() -> {
            LOG.debug("No local network address found, falling back to {}", LOOPBACK_HOST);
            return LOOPBACK_HOST;
        });
    }

    private static Optional<String> findLocalNetworkAddress() {
        try {
            return Collections.list(NetworkInterface.getNetworkInterfaces()).stream()
                    .filter(NetworkUtils::isActivePhysicalInterface)
                    .flatMap(networkInterface -> Collections.list(networkInterface.getInetAddresses()).stream())
                    .filter(address -> address instanceof Inet4Address && !address.isLoopbackAddress() &&
                            !address.isLinkLocalAddress())
                    .min(comparing((InetAddress address) -> !address.isSiteLocalAddress()))
                    .map(InetAddress::getHostAddress);
        } catch (SocketException | RuntimeException e) {
            LOG.warn("Failed to get local IP address", e);
            return Optional.empty();
        }
    }

    private static boolean isActivePhysicalInterface(NetworkInterface networkInterface) {
        try {
            return networkInterface.isUp() && !networkInterface.isLoopback() && !networkInterface.isVirtual();
        } catch (SocketException e) {
            LOG.debug("Couldn't query the state of the network interface {}", networkInterface.getName());
            return false;
        }
    }
}
