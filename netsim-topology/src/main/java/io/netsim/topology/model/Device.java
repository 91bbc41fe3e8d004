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

import io.netsim.topology.TopologyInferenceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/// A network device and its interfaces.
///
/// Devices are built once through [#builder(String)] and are immutable afterwards,
/// except for the operational state of their interfaces. Routing protocol names are
/// normalized to upper case so that `ospf` and `OSPF` name the same protocol.
public final class Device {

    private final String hostname;
    private final List<DeviceInterface> interfaces;
    private final Map<String, DeviceInterface> interfacesByName;
    private final Set<String> routingProtocols;
    private final Map<Integer, List<String>> vlans;
    private final String defaultGateway;

    private Device(Builder builder) {
        this.hostname = builder.hostname;
        List<DeviceInterface> list = new ArrayList<>();
        Map<String, DeviceInterface> byName = new LinkedHashMap<>();
        for (InterfaceConfig config : builder.interfaces) {
            DeviceInterface iface = new DeviceInterface(hostname, config);
            list.add(iface);
            byName.put(config.name(), iface);
        }
        this.interfaces = Collections.unmodifiableList(list);
        this.interfacesByName = Collections.unmodifiableMap(byName);
        this.routingProtocols = Collections.unmodifiableSet(new LinkedHashSet<>(builder.routingProtocols));

        Map<Integer, List<String>> membership = new TreeMap<>();
        for (Integer vlan : builder.vlans) {
            membership.put(vlan, new ArrayList<>());
        }
        for (DeviceInterface iface : list) {
            iface.vlan().ifPresent(v -> membership.computeIfAbsent(v, k -> new ArrayList<>()).add(iface.name()));
        }
        Map<Integer, List<String>> frozen = new TreeMap<>();
        membership.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.vlans = Collections.unmodifiableMap(frozen);
        this.defaultGateway = builder.defaultGateway;
    }

    public static Builder builder(String hostname) {
        return new Builder(hostname);
    }

    /// @return a builder holding this device's configuration, with fresh interface state
    public Builder toBuilder() {
        Builder builder = new Builder(hostname);
        interfaces.forEach(i -> builder.iface(i.config()));
        routingProtocols.forEach(builder::routingProtocol);
        vlans.keySet().forEach(builder::vlan);
        builder.defaultGateway(defaultGateway);
        return builder;
    }

    public String hostname() {
        return hostname;
    }

    /// @return interfaces in declared order
    public List<DeviceInterface> interfaces() {
        return interfaces;
    }

    public Optional<DeviceInterface> iface(String name) {
        return Optional.ofNullable(interfacesByName.get(name));
    }

    /// @return upper-case routing protocol names in configured order
    public Set<String> routingProtocols() {
        return routingProtocols;
    }

    public boolean runs(String protocol) {
        return routingProtocols.contains(normalizeProtocol(protocol));
    }

    /// @return vlan id to member interface names, ordered by vlan id
    public Map<Integer, List<String>> vlans() {
        return vlans;
    }

    public Optional<String> defaultGateway() {
        return Optional.ofNullable(defaultGateway);
    }

    public DeviceRole role() {
        if (!routingProtocols.isEmpty() || defaultGateway != null) {
            return DeviceRole.ROUTER;
        }
        if (!vlans.isEmpty()) {
            return DeviceRole.SWITCH;
        }
        return DeviceRole.ENDPOINT;
    }

    /// @return true if the device has interfaces and none of them is up
    public boolean isOffline() {
        return !interfaces.isEmpty() && interfaces.stream().noneMatch(DeviceInterface::isUp);
    }

    public static String normalizeProtocol(String protocol) {
        return protocol.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "Device{" + hostname + ", interfaces=" + interfaces.size() + ", protocols=" + routingProtocols + "}";
    }

    public static final class Builder {
        private final String hostname;
        private final List<InterfaceConfig> interfaces = new ArrayList<>();
        private final Set<String> routingProtocols = new LinkedHashSet<>();
        private final Set<Integer> vlans = new LinkedHashSet<>();
        private String defaultGateway;

        private Builder(String hostname) {
            if (hostname == null || hostname.isBlank()) {
                throw new TopologyInferenceException("device hostname must not be blank");
            }
            this.hostname = hostname;
        }

        public Builder iface(InterfaceConfig config) {
            Objects.requireNonNull(config, "config");
            if (config.name() == null || config.name().isBlank()) {
                throw new TopologyInferenceException("interface on " + hostname + " has no name");
            }
            for (InterfaceConfig existing : interfaces) {
                if (existing.name().equals(config.name())) {
                    throw new TopologyInferenceException(
                        "duplicate interface name " + config.name() + " on " + hostname);
                }
            }
            interfaces.add(config);
            return this;
        }

        public Builder iface(String name, String ipAddress, String subnetMask, int bandwidth) {
            return iface(InterfaceConfig.of(name, ipAddress, subnetMask, bandwidth));
        }

        public Builder routingProtocol(String protocol) {
            routingProtocols.add(normalizeProtocol(protocol));
            return this;
        }

        public Builder vlan(int vlanId) {
            vlans.add(vlanId);
            return this;
        }

        public Builder defaultGateway(String gateway) {
            this.defaultGateway = gateway;
            return this;
        }

        public Device build() {
            return new Device(this);
        }
    }
}
