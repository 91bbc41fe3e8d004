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

import java.util.List;

/// Anything that joins interfaces of different devices: a point-to-point [Link] or a
/// [SharedSegment]. Members are referenced by key; resolve them through the topology.
public interface Connection {

    String key();

    /// @return member interfaces in ascending key order
    List<InterfaceKey> members();

    /// @return bandwidth in Mbps, the minimum over all members
    int bandwidth();

    /// @return one-way latency in milliseconds
    double latencyMs();

    default boolean contains(InterfaceKey iface) {
        return members().contains(iface);
    }

    default boolean touches(String hostname) {
        return members().stream().anyMatch(k -> k.hostname().equals(hostname));
    }
}
