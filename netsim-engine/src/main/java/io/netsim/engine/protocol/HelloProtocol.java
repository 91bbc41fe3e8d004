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

import io.netsim.engine.config.SimulationConfig;
import io.netsim.engine.event.SimulationEvent;
import io.netsim.engine.event.SimulationEventKind;
import io.netsim.engine.scheduler.EventScheduler;
import io.netsim.engine.scheduler.ScheduleToken;
import io.netsim.topology.Topology;
import io.netsim.topology.model.Adjacency;
import io.netsim.topology.model.Device;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Periodic routing-protocol hellos and the neighbor relationships they build.
///
/// Each device sends one hello per configured protocol every interval, the first one
/// interval after scheduling. A hello goes out over every adjacency whose peer device
/// runs the same protocol and whose two interfaces are up, and arrives one connection
/// latency later if the path is still up.
public class HelloProtocol {

    private static final Logger logger = LogManager.getLogger(HelloProtocol.class);

    private final Topology topology;
    private final EventScheduler scheduler;
    private final NeighborTable neighbors;
    private final SimulationConfig config;

    public HelloProtocol(Topology topology, EventScheduler scheduler, NeighborTable neighbors,
                         SimulationConfig config) {
        this.topology = topology;
        this.scheduler = scheduler;
        this.neighbors = neighbors;
        this.config = config;
    }

    /// @param start virtual time the timers start from
    /// @return one periodic token per device and protocol
    public List<ScheduleToken> schedule(double start) {
        List<ScheduleToken> tokens = new ArrayList<>();
        for (Device device : topology.devices().values()) {
            for (String protocol : device.routingProtocols()) {
                double interval = config.helloInterval(protocol);
                String hostname = device.hostname();
                tokens.add(scheduler.schedule(start + interval, interval, "hello " + protocol + " " + hostname,
                    now -> send(hostname, protocol, now)));
                logger.debug("{} sends {} hellos every {}s", hostname, protocol, interval);
            }
        }
        return tokens;
    }

    List<SimulationEvent> send(String hostname, String protocol, double now) {
        List<SimulationEvent> events = new ArrayList<>();
        for (Adjacency adjacency : topology.adjacencies(hostname)) {
            boolean peerRuns = topology.device(adjacency.peerHost()).map(d -> d.runs(protocol)).orElse(false);
            if (!peerRuns || !topology.isPathUp(adjacency)) {
                continue;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("protocol", protocol);
            payload.put("to", adjacency.peer().toString());
            events.add(SimulationEvent.of(now, SimulationEventKind.HELLO, adjacency.local().toString(), payload));
            scheduler.schedule(now + adjacency.connection().latencyMs() / 1000.0,
                "hello-delivery " + adjacency.local() + " -> " + adjacency.peer(),
                t -> deliver(adjacency, protocol, t));
        }
        return events;
    }

    List<SimulationEvent> deliver(Adjacency adjacency, String protocol, double now) {
        if (!topology.isPathUp(adjacency)) {
            return List.of();
        }
        Optional<NeighborState> change = neighbors.receiveHello(adjacency.peer(), adjacency.local(), protocol, now);
        if (change.isEmpty()) {
            return List.of();
        }
        SimulationEventKind kind = change.get() == NeighborState.FULL
            ? SimulationEventKind.NEIGHBOR_FULL : SimulationEventKind.NEIGHBOR_INIT;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("neighbor", adjacency.localHost());
        payload.put("neighbor-interface", adjacency.local().toString());
        payload.put("protocol", protocol);
        payload.put("state", change.get().label());
        return List.of(SimulationEvent.of(now, kind, adjacency.peer().toString(), payload));
    }
}
