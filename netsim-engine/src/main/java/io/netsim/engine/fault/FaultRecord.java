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

import io.netsim.engine.scheduler.ScheduleToken;
import io.netsim.topology.model.InterfaceKey;

import java.util.List;

/// Mutable bookkeeping behind a [Fault]. Only touched under the scheduler lock.
final class FaultRecord {

    final String id;
    final FaultKind kind;
    final String target;
    final List<InterfaceKey> affected;
    final double injectedAt;
    final Double duration;
    FaultStatus status = FaultStatus.ACTIVE;
    Double clearedAt;
    FaultClearCause clearCause;
    ScheduleToken recovery;

    FaultRecord(String id, FaultKind kind, String target, List<InterfaceKey> affected, double injectedAt,
                Double duration) {
        this.id = id;
        this.kind = kind;
        this.target = target;
        this.affected = List.copyOf(affected);
        this.injectedAt = injectedAt;
        this.duration = duration;
    }

    Fault snapshot() {
        return new Fault(id, kind, target, affected.stream().map(InterfaceKey::toString).toList(), injectedAt,
            duration, status, clearedAt, clearCause);
    }
}
