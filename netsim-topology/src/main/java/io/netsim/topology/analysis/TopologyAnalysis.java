package io.netsim.topology.analysis;

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

/// Summary of a topology's structure, produced by [TopologyAnalyzer].
///
/// @param totalDevices number of devices
/// @param totalLinks number of point-to-point links
/// @param totalSharedSegments number of shared segments
/// @param totalSubnets number of subnet groupings
/// @param totalVlans number of distinct VLAN ids
/// @param totalRoutingDomains number of routing domains
/// @param components connected components, each a sorted hostname list, largest first
/// @param articulationPoints devices whose loss disconnects the graph
/// @param isolatedDevices devices without any link or segment
/// @param totalBandwidthMbps sum of connection bandwidths
/// @param averageBandwidthMbps mean connection bandwidth, 0 when there are none
/// @param bandwidthDistribution connection count per [BandwidthClass]
/// @param issues human readable findings
public record TopologyAnalysis(
    int totalDevices,
    int totalLinks,
    int totalSharedSegments,
    int totalSubnets,
    int totalVlans,
    int totalRoutingDomains,
    List<List<String>> components,
    List<String> articulationPoints,
    List<String> isolatedDevices,
    long totalBandwidthMbps,
    double averageBandwidthMbps,
    Map<BandwidthClass, Integer> bandwidthDistribution,
    List<String> issues
) {

    public boolean isFullyConnected() {
        return components.size() <= 1;
    }

    /// @return "Fully Connected" or "Disconnected (n components)"
    public String connectivityStatus() {
        return isFullyConnected() ? "Fully Connected" : "Disconnected (" + components.size() + " components)";
    }
}
