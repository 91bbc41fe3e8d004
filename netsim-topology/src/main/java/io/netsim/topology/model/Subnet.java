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

/// A group of interfaces sharing a subnet key, retained for lookup only.
///
/// @param key network address and prefix length
/// @param members member interfaces in discovery order
public record Subnet(SubnetKey key, List<InterfaceKey> members) {

    public Subnet {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
