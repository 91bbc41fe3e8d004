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

/// Latency as a fixed, monotonically decreasing function of bandwidth:
/// `baseMs + scaleMsMbps / bandwidthMbps`.
///
/// @param baseMs floor latency in ms
/// @param scaleMsMbps serialization term, ms times Mbps
public record LinkLatencyModel(double baseMs, double scaleMsMbps) {

    public static final LinkLatencyModel DEFAULT = new LinkLatencyModel(0.1, 100.0);

    public LinkLatencyModel {
        if (baseMs < 0 || scaleMsMbps < 0) {
            throw new IllegalArgumentException("latency constants must be non-negative");
        }
    }

    public double latencyMs(int bandwidthMbps) {
        if (bandwidthMbps <= 0) {
            throw new IllegalArgumentException("bandwidth must be positive, got " + bandwidthMbps);
        }
        return baseMs + scaleMsMbps / bandwidthMbps;
    }
}
