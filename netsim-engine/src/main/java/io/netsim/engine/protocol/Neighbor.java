package io.netsim.engine.protocol;

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

import io.netsim.topology.model.InterfaceKey;

/// One row of a device's neighbor table.
///
/// @param localInterface the interface the hellos arrive on
/// @param peerHost the neighbor device
/// @param peerInterface the neighbor's sending interface
/// @param protocol upper-case routing protocol
/// @param state the relationship state
/// @param hellosReceived hellos counted since the relationship started or last regressed
/// @param lastHelloAt virtual time of the latest hello
/// @param stateSince virtual time of the latest state change
public record Neighbor(InterfaceKey localInterface, String peerHost, InterfaceKey peerInterface, String protocol,
                       NeighborState state, int hellosReceived, double lastHelloAt, double stateSince) {

    public String hostname() {
        return localInterface.hostname();
    }
}
