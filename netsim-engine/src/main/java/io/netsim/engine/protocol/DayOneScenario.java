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

import io.netsim.engine.InvalidStateException;
import io.netsim.engine.config.SimulationConfig;
import io.netsim.engine.event.SimulationEvent;
import io.netsim.engine.event.SimulationEventKind;
import io.netsim.engine.scheduler.EventScheduler;
import io.netsim.engine.scheduler.ScheduleToken;
import io.netsim.topology.Topology;
import io.netsim.topology.model.Adjacency;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// The scripted discovery run against a freshly generated topology: ARP at a small
/// offset, neighbor discovery a little later, and periodic routing-protocol hellos.
/// Offsets are relative to the virtual time the scenario starts at. The scenario runs
/// at most once per engine.
public class DayOneScenario {

    private static final Logger logger = LogManager.getLogger(DayOneScenario.class);

    public static final String NAME = "day1";

    private final Topology topology;
    private final EventScheduler scheduler;
    private final SimulationConfig config;
    private final ArpDiscovery arp;
    private final HelloProtocol hellos;
    private final List<ScheduleToken> tokens = new ArrayList<>();
    private boolean started;

    public DayOneScenario(Topology topology, EventScheduler scheduler, NeighborTable neighbors, ArpTable arpTable,
                          SimulationConfig config) {
        this.topology = topology;
        this.scheduler = scheduler;
        this.config = config;
        this.arp = new ArpDiscovery(topology, scheduler, arpTable);
        this.hellos = new HelloProtocol(topology, scheduler, neighbors, config);
    }

    /// @return true if `name` names this scenario, e.g. `day1`, `day-1` or `Day_1`
    public static boolean isNamed(String name) {
        return name != null && name.replace("-", "").replace("_", "").equalsIgnoreCase(NAME);
    }

    /// Schedules the scenario. Must be called while holding the scheduler lock.
    ///
    /// @return the `scenario-started` event, not yet appended
    /// @throws InvalidStateException if the scenario already started
    public SimulationEvent start() {
        if (started) {
            throw new InvalidStateException("Day-1 scenario already started");
        }
        started = true;
        double now = scheduler.now();
        tokens.addAll(arp.schedule(now + config.arpOffset()));
        tokens.add(scheduler.schedule(now + config.neighborDiscoveryOffset(), "neighbor-discovery",
            this::discoverNeighbors));
        tokens.addAll(hellos.schedule(now));
        logger.info("Day-1 scenario started at t={}: {} links, {} segments, {} callbacks scheduled", now,
            topology.links().size(), topology.sharedSegments().size(), tokens.size());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("scenario", NAME);
        payload.put("links", topology.links().size());
        payload.put("shared-segments", topology.sharedSegments().size());
        return SimulationEvent.of(now, SimulationEventKind.SCENARIO_STARTED, NAME, payload);
    }

    public boolean isStarted() {
        return started;
    }

    /// Cancels the scenario's remaining timers, including the periodic hellos.
    public void cancel() {
        tokens.forEach(scheduler::cancel);
    }

    List<SimulationEvent> discoverNeighbors(double now) {
        List<SimulationEvent> events = new ArrayList<>();
        for (String hostname : topology.devices().keySet()) {
            Set<String> reported = new LinkedHashSet<>();
            for (Adjacency adjacency : topology.adjacencies(hostname)) {
                if (!topology.isPathUp(adjacency) || !reported.add(adjacency.peerHost())) {
                    continue;
                }
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("neighbor", adjacency.peerHost());
                payload.put("local-interface", adjacency.local().name());
                payload.put("remote-interface", adjacency.peer().name());
                payload.put("connection", adjacency.connection().key());
                events.add(SimulationEvent.of(now, SimulationEventKind.NEIGHBOR_DISCOVERY, hostname, payload));
            }
        }
        return events;
    }
}
