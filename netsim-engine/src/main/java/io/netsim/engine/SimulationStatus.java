package io.netsim.engine;

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

import io.netsim.engine.scheduler.RunMode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Consistent snapshot of a running simulation, read under the engine lock.
///
/// @param runMode scheduler run mode
/// @param virtualTime the virtual clock
/// @param totalEvents events in the log
/// @param eventsByKind event count by kind label
/// @param totalFaults faults ever injected
/// @param activeFaults faults not yet cleared
/// @param interfacesUp interfaces operationally up
/// @param interfacesDown interfaces down or administratively down
/// @param linksUp links and segments with every member up
/// @param linksDegraded segments with some members down
/// @param linksDown links and segments that cannot carry traffic
/// @param devicesOffline devices with no interface up
/// @param fullAdjacencies neighbor relationships in `full`
/// @param initAdjacencies neighbor relationships in `init`
/// @param pendingCallbacks callbacks waiting in the scheduler queue
/// @param callbackFailures callbacks that threw
/// @param freeRunLimitReached dispatch stopped at the free-run limit and waits for stepping
public record SimulationStatus(
    RunMode runMode,
    double virtualTime,
    int totalEvents,
    Map<String, Long> eventsByKind,
    int totalFaults,
    int activeFaults,
    int interfacesUp,
    int interfacesDown,
    int linksUp,
    int linksDegraded,
    int linksDown,
    int devicesOffline,
    long fullAdjacencies,
    long initAdjacencies,
    int pendingCallbacks,
    long callbackFailures,
    boolean freeRunLimitReached
) {

    public SimulationStatus {
        eventsByKind = Collections.unmodifiableMap(new LinkedHashMap<>(eventsByKind));
    }

    public boolean isRunning() {
        return runMode == RunMode.RUNNING;
    }
}
