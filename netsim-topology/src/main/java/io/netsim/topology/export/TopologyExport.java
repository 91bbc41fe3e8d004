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

import java.util.List;
import java.util.Map;

/// Plain structured view of a topology, suitable for JSON serialization. Holds no
/// references into the live model.
///
/// @param latencyBaseMs latency model floor, ms
/// @param latencyScaleMsMbps latency model scale, ms times Mbps
/// @param devices devices by hostname
/// @param links point-to-point links in key order
/// @param sharedSegments shared segments in key order
/// @param subnets CIDR to member interface keys
/// @param vlans vlan id to hostnames
/// @param routingDomains protocol to hostnames
/// @param orphans orphan findings
public record TopologyExport(
    double latencyBaseMs,
    double latencyScaleMsMbps,
    Map<String, DeviceExport> devices,
    List<LinkExport> links,
    List<SegmentExport> sharedSegments,
    Map<String, List<String>> subnets,
    Map<String, List<String>> vlans,
    Map<String, List<String>> routingDomains,
    List<OrphanExport> orphans
) {

    public record DeviceExport(String hostname, String role, List<InterfaceExport> interfaces,
                               List<String> routingProtocols, List<Integer> vlans, String defaultGateway) {
    }

    public record InterfaceExport(String name, String ipAddress, String subnetMask, int bandwidth, int mtu,
                                  Integer vlan, String description, boolean shutdown, String state) {
    }

    public record LinkExport(String key, String sourceDevice, String sourceInterface, String targetDevice,
                             String targetInterface, int bandwidth, double latencyMs, double reliability,
                             String medium, String state) {
    }

    public record SegmentExport(String key, String subnet, List<String> members, int bandwidth, double latencyMs,
                                String state) {
    }

    public record OrphanExport(String iface, String reason, boolean conflict, String conflictsWith) {
    }
}
