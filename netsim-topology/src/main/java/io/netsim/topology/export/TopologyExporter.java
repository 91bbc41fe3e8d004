package io.netsim.topology.export;

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

import io.netsim.topology.Topology;
import io.netsim.topology.model.Device;
import io.netsim.topology.model.DeviceInterface;
import io.netsim.topology.model.InterfaceKey;
import io.netsim.topology.model.Link;
import io.netsim.topology.model.Orphan;
import io.netsim.topology.model.SharedSegment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Converts a [Topology] into a [TopologyExport] and JSON.
public class TopologyExporter {

    public TopologyExport export(Topology topology) {
        Map<String, TopologyExport.DeviceExport> devices = new LinkedHashMap<>();
        for (Device device : topology.devices().values()) {
            List<TopologyExport.InterfaceExport> interfaces = new ArrayList<>();
            for (DeviceInterface iface : device.interfaces()) {
                interfaces.add(new TopologyExport.InterfaceExport(iface.name(), iface.ipAddress(),
                    iface.subnetMask(), iface.bandwidth(), iface.mtu(), iface.vlan().orElse(null),
                    iface.description(), iface.isShutdown(), iface.state().label()));
            }
            devices.put(device.hostname(), new TopologyExport.DeviceExport(device.hostname(),
                device.role().name().toLowerCase(Locale.ROOT), interfaces, List.copyOf(device.routingProtocols()),
                List.copyOf(device.vlans().keySet()), device.defaultGateway().orElse(null)));
        }

        List<TopologyExport.LinkExport> links = new ArrayList<>();
        for (Link link : topology.links()) {
            links.add(new TopologyExport.LinkExport(link.key(), link.endpointA().hostname(),
                link.endpointA().name(), link.endpointB().hostname(), link.endpointB().name(), link.bandwidth(),
                link.latencyMs(), link.reliability(), link.medium().label(), topology.stateOf(link).label()));
        }

        List<TopologyExport.SegmentExport> segments = new ArrayList<>();
        for (SharedSegment segment : topology.sharedSegments()) {
            segments.add(new TopologyExport.SegmentExport(segment.key(), segment.subnet().toString(),
                keys(segment.members()), segment.bandwidth(), segment.latencyMs(),
                topology.stateOf(segment).label()));
        }

        Map<String, List<String>> subnets = new LinkedHashMap<>();
        topology.subnets().forEach((key, subnet) -> subnets.put(key.toString(), keys(subnet.members())));

        Map<String, List<String>> vlans = new LinkedHashMap<>();
        topology.vlanIndex().forEach((vlan, hosts) -> vlans.put(String.valueOf(vlan), hosts));

        List<TopologyExport.OrphanExport> orphans = new ArrayList<>();
        for (Orphan orphan : topology.orphans()) {
            orphans.add(new TopologyExport.OrphanExport(orphan.iface().toString(), orphan.reason().label(),
                orphan.conflictFlagged(), orphan.conflictingInterface().map(InterfaceKey::toString).orElse(null)));
        }

        return new TopologyExport(topology.latencyModel().baseMs(), topology.latencyModel().scaleMsMbps(),
            devices, links, segments, subnets, vlans, new LinkedHashMap<>(topology.routingDomains()), orphans);
    }

    public String toJson(Topology topology) {
        return toJson(export(topology));
    }

    public String toJson(TopologyExport export) {
        return SHARED.gson.toJson(export);
    }

    private static List<String> keys(List<InterfaceKey> members) {
        return members.stream().map(InterfaceKey::toString).toList();
    }
}
