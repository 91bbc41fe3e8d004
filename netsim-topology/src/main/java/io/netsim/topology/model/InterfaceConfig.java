package io.netsim.topology.model;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Interface settings as produced by a configuration parser.
///
/// @param name interface name, e.g. `GigabitEthernet0/0`
/// @param ipAddress dotted-quad address
/// @param subnetMask dotted mask or prefix length
/// @param bandwidth bandwidth in Mbps
/// @param mtu MTU in bytes
/// @param vlan access VLAN, or null
/// @param description free-form description, never null
/// @param shutdown true if administratively shut down
public record InterfaceConfig(String name, String ipAddress, String subnetMask, int bandwidth, int mtu,
                              Integer vlan, String description, boolean shutdown) {

    public static final int DEFAULT_BANDWIDTH = 100;
    public static final int DEFAULT_MTU = 1500;

    public InterfaceConfig {
        description = description == null ? "" : description;
    }

    /// @return an interface with default MTU, no VLAN and not shut down
    public static InterfaceConfig of(String name, String ipAddress, String subnetMask, int bandwidth) {
        return new InterfaceConfig(name, ipAddress, subnetMask, bandwidth, DEFAULT_MTU, null, "", false);
    }

    /// @return an interface with default bandwidth and MTU
    public static InterfaceConfig of(String name, String ipAddress, String subnetMask) {
        return of(name, ipAddress, subnetMask, DEFAULT_BANDWIDTH);
    }

    public InterfaceConfig withVlan(Integer vlan) {
        return new InterfaceConfig(name, ipAddress, subnetMask, bandwidth, mtu, vlan, description, shutdown);
    }

    public InterfaceConfig withMtu(int mtu) {
        return new InterfaceConfig(name, ipAddress, subnetMask, bandwidth, mtu, vlan, description, shutdown);
    }

    public InterfaceConfig withDescription(String description) {
        return new InterfaceConfig(name, ipAddress, subnetMask, bandwidth, mtu, vlan, description, shutdown);
    }

    public InterfaceConfig withShutdown(boolean shutdown) {
        return new InterfaceConfig(name, ipAddress, subnetMask, bandwidth, mtu, vlan, description, shutdown);
    }
}
