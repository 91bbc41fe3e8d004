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

import io.netsim.engine.SimulationEngine;
import io.netsim.engine.event.SimulationEvent;
import io.netsim.engine.fault.Fault;
import io.netsim.topology.export.SHARED;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Converts a [SimulationEngine]'s log and faults into a [SimulationLogExport] and JSON.
public class SimulationLogExporter {

    public SimulationLogExport export(SimulationEngine engine) {
        List<SimulationEvent> events = engine.events();
        List<Fault> faults = engine.faults();
        List<SimulationLogExport.EventExport> eventExports = events.stream()
            .map(e -> new SimulationLogExport.EventExport(e.sequence(), e.timestamp(), e.kind().label(),
                e.subject(), e.payload()))
            .toList();
        List<SimulationLogExport.FaultExport> faultExports = faults.stream()
            .map(f -> new SimulationLogExport.FaultExport(f.id(), f.kind().label(), f.target(), f.affected(),
                f.injectedAt(), f.duration(), f.status().label(), f.clearedAt(),
                f.clearCause() == null ? null : f.clearCause().label()))
            .toList();
        return new SimulationLogExport(
            engine.startedAt().map(Instant::toString).orElse(null),
            engine.stoppedAt().map(Instant::toString).orElse(null),
            engine.runMode().label(),
            engine.now(),
            eventExports.size(),
            faultExports.size(),
            eventExports,
            faultExports,
            statistics(events));
    }

    public String toJson(SimulationEngine engine) {
        return toJson(export(engine));
    }

    public String toJson(SimulationLogExport export) {
        return SHARED.gson.toJson(export);
    }

    /// Counts per kind over exactly the exported events, in first-seen order.
    private static Map<String, Long> statistics(List<SimulationEvent> events) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (SimulationEvent event : events) {
            counts.merge(event.kind().label(), 1L, Long::sum);
        }
        return counts;
    }
}
