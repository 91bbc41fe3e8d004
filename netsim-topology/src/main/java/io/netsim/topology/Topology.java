package io.netsim.topology;

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

import io.netsim.topology.model.Adjacency;
import io.netsim.topology.model.Connection;
import io.netsim.topology.model.Device;
import io.netsim.topology.model.DeviceInterface;
import io.netsim.topology.model.InterfaceKey;
import io.netsim.topology.model.Link;
import io.netsim.topology.model.LinkLatencyModel;
import io.netsim.topology.model.Orphan;
import io.netsim.topology.model.SharedSegment;
import io.netsim.topology.model.Subnet;
import io.netsim.topology.net.SubnetKey;
import io.netsim.topology.state.InterfaceState;
import io.netsim.topology.state.LinkState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/// The inferred network graph: devices, links, shared segments, the subnet index and
/// the orphan findings.
///
/// A topology owns its devices. Links, segments, subnets and orphans refer to
/// interfaces by [InterfaceKey] and are resolved through [#iface(InterfaceKey)].
/// All collections are unmodifiable and iterate in key order. The only mutable
/// part is interface state, which the fault injector drives.
///
/// Instances are built by [TopologyGenerator] or by [#builder(LinkLatencyModel)];
/// [Builder#build()] checks that every reference resolves and that no interface
/// belongs to more than one subnet.
public final class Topology {

    /// Routing domain of devices that only have a default gateway.
    public static final String STATIC_DOMAIN = "STATIC";

    private final SortedMap<String, Device> devices;
    private final SortedMap<String, Link> links;
    private final SortedMap<String, SharedSegment> segments;
    private final SortedMap<SubnetKey, Subnet> subnets;
    private final List<Orphan> orphans;
    private final SortedMap<Integer, List<String>> vlanIndex;
    private final SortedMap<String, List<String>> routingDomains;
    private final Map<InterfaceKey, Connection> connectionByInterface;
    private final LinkLatencyModel latencyModel;

    private Topology(Builder builder) {
        this.devices = Collections.unmodifiableSortedMap(new TreeMap<>(builder.devices));
        this.links = Collections.unmodifiableSortedMap(new TreeMap<>(builder.links));
        this.segments = Collections.unmodifiableSortedMap(new TreeMap<>(builder.segments));
        this.subnets = Collections.unmodifiableSortedMap(new TreeMap<>(builder.subnets));
        List<Orphan> sortedOrphans = new ArrayList<>(builder.orphans);
        sortedOrphans.sort((a, b) -> a.iface().compareTo(b.iface()));
        this.orphans = List.copyOf(sortedOrphans);
        this.latencyModel = builder.latencyModel;

        Map<InterfaceKey, Connection> byInterface = new HashMap<>();
        links.values().forEach(l -> l.members().forEach(m -> byInterface.put(m, l)));
        segments.values().forEach(s -> s.members().forEach(m -> byInterface.put(m, s)));
        this.connectionByInterface = Collections.unmodifiableMap(byInterface);

        SortedMap<Integer, SortedSet<String>> vlans = new TreeMap<>();
        SortedMap<String, SortedSet<String>> domains = new TreeMap<>();
        for (Device device : devices.values()) {
            device.vlans().keySet().forEach(v -> vlans.computeIfAbsent(v, k -> new TreeSet<>()).add(device.hostname()));
            device.routingProtocols()
                .forEach(p -> domains.computeIfAbsent(p, k -> new TreeSet<>()).add(device.hostname()));
            if (device.routingProtocols().isEmpty() && device.defaultGateway().isPresent()) {
                domains.computeIfAbsent(STATIC_DOMAIN, k -> new TreeSet<>()).add(device.hostname());
            }
        }
        SortedMap<Integer, List<String>> frozenVlans = new TreeMap<>();
        vlans.forEach((k, v) -> frozenVlans.put(k, List.copyOf(v)));
        this.vlanIndex = Collections.unmodifiableSortedMap(frozenVlans);
        SortedMap<String, List<String>> frozenDomains = new TreeMap<>();
        domains.forEach((k, v) -> frozenDomains.put(k, List.copyOf(v)));
        this.routingDomains = Collections.unmodifiableSortedMap(frozenDomains);
    }

    public static Builder builder(LinkLatencyModel latencyModel) {
        return new Builder(latencyModel);
    }

    public SortedMap<String, Device> devices() {
        return devices;
    }

    public Optional<Device> device(String hostname) {
        return Optional.ofNullable(devices.get(hostname));
    }

    public Optional<DeviceInterface> iface(InterfaceKey key) {
        Device device = devices.get(key.hostname());
        return device == null ? Optional.empty() : device.iface(key.name());
    }

    /// @return every interface of every device, hostname order then declared order
    public List<DeviceInterface> interfaces() {
        List<DeviceInterface> all = new ArrayList<>();
        devices.values().forEach(d -> all.addAll(d.interfaces()));
        return all;
    }

    public Collection<Link> links() {
        return links.values();
    }

    public Optional<Link> link(String key) {
        return Optional.ofNullable(links.get(key));
    }

    public Collection<SharedSegment> sharedSegments() {
        return segments.values();
    }

    public Optional<SharedSegment> sharedSegment(String key) {
        return Optional.ofNullable(segments.get(key));
    }

    public SortedMap<SubnetKey, Subnet> subnets() {
        return subnets;
    }

    public List<Orphan> orphans() {
        return orphans;
    }

    /// @return vlan id to the hostnames carrying it
    public SortedMap<Integer, List<String>> vlanIndex() {
        return vlanIndex;
    }

    /// @return upper-case protocol name to the hostnames running it
    public SortedMap<String, List<String>> routingDomains() {
        return routingDomains;
    }

    public LinkLatencyModel latencyModel() {
        return latencyModel;
    }

    /// @return links followed by shared segments, each in key order
    public List<Connection> connections() {
        List<Connection> all = new ArrayList<>(links.values());
        all.addAll(segments.values());
        return all;
    }

    public Optional<Connection> connection(String key) {
        Connection found = links.get(key);
        return found != null ? Optional.of(found) : Optional.ofNullable(segments.get(key));
    }

    /// @return the link or segment the interface belongs to, if any
    public Optional<Connection> connectionOf(InterfaceKey iface) {
        return Optional.ofNullable(connectionByInterface.get(iface));
    }

    /// @return connections touching the device, in key order
    public List<Connection> connectionsOf(String hostname) {
        List<Connection> result = new ArrayList<>();
        for (Connection connection : connections()) {
            if (connection.touches(hostname)) {
                result.add(connection);
            }
        }
        return result;
    }

    /// Lists, for one device, every (local interface, peer interface) pair joined by a
    /// link or segment. Peers on the same device are skipped.
    ///
    /// @param hostname the local device
    /// @return adjacencies ordered by local interface declaration, then peer key
    public List<Adjacency> adjacencies(String hostname) {
        Device device = devices.get(hostname);
        if (device == null) {
            return List.of();
        }
        List<Adjacency> result = new ArrayList<>();
        for (DeviceInterface local : device.interfaces()) {
            Connection connection = connectionByInterface.get(local.key());
            if (connection == null) {
                continue;
            }
            for (InterfaceKey member : connection.members()) {
                if (!member.hostname().equals(hostname)) {
                    result.add(new Adjacency(local.key(), member, connection));
                }
            }
        }
        return result;
    }

    /// @return hostnames reachable over one link or segment, sorted
    public SortedSet<String> neighbors(String hostname) {
        SortedSet<String> result = new TreeSet<>();
        adjacencies(hostname).forEach(a -> result.add(a.peerHost()));
        return result;
    }

    /// @return the current state of a link or segment, derived from its member interfaces
    public LinkState stateOf(Connection connection) {
        List<InterfaceState> states = new ArrayList<>();
        for (InterfaceKey member : connection.members()) {
            states.add(iface(member).map(DeviceInterface::state).orElse(InterfaceState.DOWN));
        }
        return LinkState.derive(states);
    }

    /// @return true if both interfaces are up and the connection is usable between them
    public boolean isPathUp(Adjacency adjacency) {
        return iface(adjacency.local()).map(DeviceInterface::isUp).orElse(false)
            && iface(adjacency.peer()).map(DeviceInterface::isUp).orElse(false);
    }

    @Override
    public String toString() {
        return "Topology{devices=" + devices.size() + ", links=" + links.size() + ", segments=" + segments.size()
            + ", subnets=" + subnets.size() + ", orphans=" + orphans.size() + "}";
    }

    public static final class Builder {
        private final LinkLatencyModel latencyModel;
        private final Map<String, Device> devices = new TreeMap<>();
        private final Map<String, Link> links = new TreeMap<>();
        private final Map<String, SharedSegment> segments = new TreeMap<>();
        private final Map<SubnetKey, Subnet> subnets = new TreeMap<>();
        private final List<Orphan> orphans = new ArrayList<>();

        private Builder(LinkLatencyModel latencyModel) {
            this.latencyModel = latencyModel;
        }

        public Builder device(Device device) {
            if (devices.putIfAbsent(device.hostname(), device) != null) {
                throw new TopologyInferenceException("duplicate device " + device.hostname());
            }
            return this;
        }

        public Builder link(Link link) {
            if (links.putIfAbsent(link.key(), link) != null) {
                throw new TopologyInferenceException("duplicate link " + link.key());
            }
            return this;
        }

        public Builder sharedSegment(SharedSegment segment) {
            if (segments.putIfAbsent(segment.key(), segment) != null) {
                throw new TopologyInferenceException("duplicate shared segment " + segment.key());
            }
            return this;
        }

        public Builder subnet(Subnet subnet) {
            if (subnets.putIfAbsent(subnet.key(), subnet) != null) {
                throw new TopologyInferenceException("duplicate subnet " + subnet.key());
            }
            return this;
        }

        public Builder orphan(Orphan orphan) {
            orphans.add(orphan);
            return this;
        }

        /// @throws TopologyInferenceException if a reference does not resolve or an
        ///     interface is grouped twice
        public Topology build() {
            Map<InterfaceKey, SubnetKey> grouped = new HashMap<>();
            for (Subnet subnet : subnets.values()) {
                for (InterfaceKey member : subnet.members()) {
                    requireInterface(member, "subnet " + subnet.key());
                    SubnetKey previous = grouped.putIfAbsent(member, subnet.key());
                    if (previous != null) {
                        throw new TopologyInferenceException(
                            member + " is grouped in both " + previous + " and " + subnet.key());
                    }
                }
            }
            Map<InterfaceKey, String> connected = new HashMap<>();
            List<Connection> all = new ArrayList<>(links.values());
            all.addAll(segments.values());
            for (Connection connection : all) {
                for (InterfaceKey member : connection.members()) {
                    requireInterface(member, connection.key());
                    String previous = connected.putIfAbsent(member, connection.key());
                    if (previous != null) {
                        throw new TopologyInferenceException(
                            member + " belongs to both " + previous + " and " + connection.key());
                    }
                }
            }
            for (Orphan orphan : orphans) {
                requireInterface(orphan.iface(), "orphan list");
                orphan.conflictingInterface().ifPresent(k -> requireInterface(k, "orphan " + orphan.iface()));
            }
            return new Topology(this);
        }

        private void requireInterface(InterfaceKey key, String referrer) {
            Device device = devices.get(key.hostname());
            if (device == null || device.iface(key.name()).isEmpty()) {
                throw new TopologyInferenceException(referrer + " refers to unknown interface " + key);
            }
        }
    }
}
