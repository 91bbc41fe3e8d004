package io.netsim.engine.fault;

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
import java.util.Optional;

/// Immutable view of an injected fault at the moment it was read.
///
/// @param id the fault id, `F-0001` and up in injection order
/// @param kind what was taken down
/// @param target the target as given at injection
/// @param affected keys of the interfaces the fault holds down, sorted
/// @param injectedAt virtual time of injection
/// @param duration virtual seconds until automatic recovery, null if none
/// @param status active or cleared
/// @param clearedAt virtual time of clearing, null while active
/// @param clearCause how the fault ended, null while active
public record Fault(
    String id,
    FaultKind kind,
    String target,
    List<String> affected,
    double injectedAt,
    Double duration,
    FaultStatus status,
    Double clearedAt,
    FaultClearCause clearCause
) {

    public Fault {
        affected = List.copyOf(affected);
    }

    public boolean isActive() {
        return status == FaultStatus.ACTIVE;
    }

    /// @return the virtual time of scheduled recovery, empty without a duration
    public Optional<Double> recoveryAt() {
        return duration == null ? Optional.empty() : Optional.of(injectedAt + duration);
    }
}
