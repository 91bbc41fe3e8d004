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

import java.util.Objects;
import java.util.Optional;

/// An interface left out of every link and segment.
///
/// @param iface the orphaned interface
/// @param reason why it was left out
/// @param conflictsWith for duplicate-ip, the interface that kept the address; otherwise null
public record Orphan(InterfaceKey iface, OrphanReason reason, InterfaceKey conflictsWith) {

    public Orphan {
        Objects.requireNonNull(iface, "iface");
        Objects.requireNonNull(reason, "reason");
    }

    public static Orphan of(InterfaceKey iface, OrphanReason reason) {
        return new Orphan(iface, reason, null);
    }

    public boolean conflictFlagged() {
        return reason.isConflict();
    }

    public Optional<InterfaceKey> conflictingInterface() {
        return Optional.ofNullable(conflictsWith);
    }
}
