package io.netsim.engine.export;

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
import java.util.Map;

/// Presentation form of a simulation run. Plain data, safe to serialize.
///
/// @param startedAt wall-clock start, ISO-8601, null if never started
/// @param stoppedAt wall-clock stop, ISO-8601, null while running
/// @param runMode scheduler run mode label
/// @param virtualTime the virtual clock at export
/// @param totalEvents number of events
/// @param totalFaults number of faults ever injected
/// @param events the event log in order
/// @param faults every fault with its status
/// @param statistics event count by kind label
public record SimulationLogExport(
    String startedAt,
    String stoppedAt,
    String runMode,
    double virtualTime,
    int totalEvents,
    int totalFaults,
    List<EventExport> events,
    List<FaultExport> faults,
    Map<String, Long> statistics
) {

    public record EventExport(long sequence, double timestamp, String kind, String subject,
                              Map<String, Object> payload) {
    }

    public record FaultExport(String id, String kind, String target, List<String> affected, double injectedAt,
                              Double duration, String status, Double clearedAt, String clearCause) {
    }
}
