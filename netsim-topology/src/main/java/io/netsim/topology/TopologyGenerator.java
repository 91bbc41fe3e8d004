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

import io.netsim.topology.model.Device;
import io.netsim.topology.model.DeviceInterface;
import io.netsim.topology.model.InterfaceKey;
import io.netsim.topology.model.Link;
import io.netsim.topology.model.LinkLatencyModel;
import io.netsim.topology.model.LinkMedium;
import io.netsim.topology.model.Orphan;
import io.netsim.topology.model.OrphanReason;
import io.netsim.topology.model.SharedSegment;
import io.netsim.topology.model.Subnet;
import io.netsim.topology.net.Ipv4;
import io.netsim.topology.net.SubnetKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// Infers links, shared segments and orphans from per-device interface addressing.
///
/// Devices are visited in ascending hostname order and interfaces in declared order,
/// so the result depends only on the input, never on map iteration order.
///
/// | subnet members              | result                                   |
/// |-----------------------------|------------------------------------------|
/// | 1                           | `no-peer` orphan                         |
/// | 2, distinct devices         | [Link]                                   |
/// | 2, same device              | two `same-device` orphans, no link       |
/// | 3 or more                   | [SharedSegment]                          |
///
/// An interface whose address was already claimed by an earlier interface is left
/// out of grouping and reported as a `duplicate-ip` orphan naming the winner.
///
/// Each call builds fresh [Device] instances from the input, so faults applied to one
/// generated topology never show up in another.
public class TopologyGenerator {

    private static final Logger logger = LogManager.getLogger(TopologyGenerator.class);

    private final LinkLatencyModel latencyModel;

    public TopologyGenerator() {
        this(LinkLatencyModel.DEFAULT);
    }

    public TopologyGenerator(LinkLatencyModel latencyModel) {
        this.latencyModel = Objects.requireNonNull(latencyModel, "latencyModel");
    }

    public LinkLatencyModel latencyModel() {
        return latencyModel;
    }

    /// Generates a topology.
    ///
    /// @param input hostname to device
    /// @return the inferred topology
    /// @throws TopologyInferenceException if the input is structurally impossible
    public Topology generate(Map<String, Device> input) {
        Objects.requireNonNull(input, "input");
        Map<String, Device> devices = new TreeMap<>();
        for (Map.Entry<String, Device> entry : input.entrySet()) {
            Device device = entry.getValue();
            if (device == null || !entry.getKey().equals(device.hostname())) {
                throw new TopologyInferenceException("device map key '" + entry.getKey()
                    + "' does not match hostname '" + (device == null ? null : device.hostname()) + "'");
            }
            devices.put(entry.getKey(), device.toBuilder().build());
        }

        Topology.Builder builder = Topology.builder(latencyModel);
        devices.values().forEach(builder::device);

        Map<Integer, InterfaceKey> claimedAddresses = new HashMap<>();
        Map<SubnetKey, List<DeviceInterface>> groups = new TreeMap<>();
        for (Device device : devices.values()) {
            for (DeviceInterface iface : device.interfaces()) {
                SubnetKey subnet = subnetOf(iface);
                int address = Ipv4.parseAddress(iface.ipAddress());
                InterfaceKey winner = claimedAddresses.putIfAbsent(address, iface.key());
                if (winner != null) {
                    logger.warn("duplicate address {} on {}, already claimed by {}",
                        iface.ipAddress(), iface.key(), winner);
                    builder.orphan(new Orphan(iface.key(), OrphanReason.DUPLICATE_IP, winner));
                    continue;
                }
                groups.computeIfAbsent(subnet, k -> new ArrayList<>()).add(iface);
            }
        }

        int linkCount = 0;
        int segmentCount = 0;
        for (Map.Entry<SubnetKey, List<DeviceInterface>> group : groups.entrySet()) {
            SubnetKey subnet = group.getKey();
            List<DeviceInterface> members = group.getValue();
            builder.subnet(new Subnet(subnet, members.stream().map(DeviceInterface::key).toList()));
            if (members.size() == 1) {
                logger.debug("{} has no peer on {}", members.get(0).key(), subnet);
                builder.orphan(Orphan.of(members.get(0).key(), OrphanReason.NO_PEER));
            } else if (members.size() == 2) {
                DeviceInterface a = members.get(0);
                DeviceInterface b = members.get(1);
                if (a.hostname().equals(b.hostname())) {
                    logger.warn("{} and {} share {} on the same device", a.key(), b.key(), subnet);
                    builder.orphan(new Orphan(a.key(), OrphanReason.SAME_DEVICE, b.key()));
                    builder.orphan(new Orphan(b.key(), OrphanReason.SAME_DEVICE, a.key()));
                } else {
                    builder.link(linkBetween(a, b));
                    linkCount++;
                }
            } else {
                int bandwidth = members.stream().mapToInt(DeviceInterface::bandwidth).min().orElseThrow();
                builder.sharedSegment(new SharedSegment(subnet, members.stream().map(DeviceInterface::key).toList(),
                    bandwidth, latencyModel.latencyMs(bandwidth)));
                segmentCount++;
            }
        }

        Topology topology = builder.build();
        logger.info("generated topology: {} devices, {} links, {} shared segments, {} subnets, {} orphans",
            devices.size(), linkCount, segmentCount, groups.size(), topology.orphans().size());
        return topology;
    }

    Link linkBetween(DeviceInterface a, DeviceInterface b) {
        int bandwidth = Math.min(a.bandwidth(), b.bandwidth());
        return new Link(a.key(), b.key(), bandwidth, latencyModel.latencyMs(bandwidth),
            LinkMedium.between(a.name(), b.name()),
            LinkMedium.reliabilityOf(a.name()) * LinkMedium.reliabilityOf(b.name()));
    }

    private SubnetKey subnetOf(DeviceInterface iface) {
        if (iface.bandwidth() <= 0) {
            throw new TopologyInferenceException(iface.key() + " has non-positive bandwidth " + iface.bandwidth());
        }
        try {
            return SubnetKey.of(iface.ipAddress(), iface.subnetMask());
        } catch (IllegalArgumentException e) {
            throw new TopologyInferenceException(iface.key() + ": " + e.getMessage(), e);
        }
    }
}
