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
import java.util.Objects;

/// A point-to-point link between two interfaces on distinct devices.
///
/// Endpoints are stored in ascending key order, so the same pair of interfaces always
/// yields the same [#key()] regardless of discovery order.
///
/// @param endpointA the lower endpoint
/// @param endpointB the higher endpoint
/// @param bandwidth minimum endpoint bandwidth, Mbps
/// @param latencyMs one-way latency, ms
/// @param medium medium guessed from the interface names
/// @param reliability product of the endpoint reliabilities
public record Link(InterfaceKey endpointA, InterfaceKey endpointB, int bandwidth, double latencyMs,
                   LinkMedium medium, double reliability) implements Connection {

    public static final String SEPARATOR = "<->";

    public Link {
        Objects.requireNonNull(endpointA, "endpointA");
        Objects.requireNonNull(endpointB, "endpointB");
        if (endpointA.hostname().equals(endpointB.hostname())) {
            throw new IllegalArgumentException("link endpoints must be on distinct devices: " + endpointA
                + ", " + endpointB);
        }
        if (endpointA.compareTo(endpointB) > 0) {
            InterfaceKey swap = endpointA;
            endpointA = endpointB;
            endpointB = swap;
        }
    }

    public static String keyOf(InterfaceKey a, InterfaceKey b) {
        return a.compareTo(b) <= 0 ? a + SEPARATOR + b : b + SEPARATOR + a;
    }

    @Override
    public String key() {
        return endpointA + SEPARATOR + endpointB;
    }

    @Override
    public List<InterfaceKey> members() {
        return List.of(endpointA, endpointB);
    }

    /// @return the endpoint opposite to `iface`
    /// @throws IllegalArgumentException if `iface` is not an endpoint
    public InterfaceKey peerOf(InterfaceKey iface) {
        if (endpointA.equals(iface)) {
            return endpointB;
        }
        if (endpointB.equals(iface)) {
            return endpointA;
        }
        throw new IllegalArgumentException(iface + " is not an endpoint of " + key());
    }

    @Override
    public String toString() {
        return key();
    }
}
