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

import io.netsim.topology.net.SubnetKey;

import java.util.List;

/// A broadcast domain of three or more interfaces sharing one subnet.
///
/// @param subnet the subnet key
/// @param members member interfaces, ascending
/// @param bandwidth minimum member bandwidth, Mbps
/// @param latencyMs one-way latency, ms
public record SharedSegment(SubnetKey subnet, List<InterfaceKey> members, int bandwidth, double latencyMs)
    implements Connection {

    public SharedSegment {
        members = members.stream().sorted().toList();
        if (members.size() < 3) {
            throw new IllegalArgumentException("a shared segment needs at least three members, got " + members);
        }
    }

    /// @return `segment:` followed by the subnet in CIDR form
    @Override
    public String key() {
        return "segment:" + subnet;
    }

    @Override
    public String toString() {
        return key() + members;
    }
}
