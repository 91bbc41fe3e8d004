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

/// One direction of a neighbor relationship: a local interface, the interface it
/// reaches on another device, and the connection between them.
///
/// @param local the local interface
/// @param peer the peer interface
/// @param connection the link or segment joining them
public record Adjacency(InterfaceKey local, InterfaceKey peer, Connection connection) {

    public String localHost() {
        return local.hostname();
    }

    public String peerHost() {
        return peer.hostname();
    }
}
