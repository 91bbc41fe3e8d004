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

import io.netsim.engine.event.SimulationEvent;
import io.netsim.engine.event.SimulationEventKind;
import io.netsim.engine.scheduler.EventScheduler;
import io.netsim.engine.scheduler.ScheduleToken;
import io.netsim.topology.Topology;
import io.netsim.topology.model.Connection;
import io.netsim.topology.model.DeviceInterface;
import io.netsim.topology.model.InterfaceKey;
import io.netsim.topology.model.Link;
import io.netsim.topology.model.SharedSegment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Day-1 address resolution.
///
/// On each link both endpoints ask for the other's address. On each shared segment
/// every member broadcasts once and every other member answers. A request is only
/// sent from an up interface; the reply arrives one link latency later and only if
/// both ends are still up, and fills the requester's [ArpTable].
public class ArpDiscovery {

    static final String BROADCAST = "ff:ff:ff:ff:ff:ff";

    private final Topology topology;
    private final EventScheduler scheduler;
    private final ArpTable arpTable;

    public ArpDiscovery(Topology topology, EventScheduler scheduler, ArpTable arpTable) {
        this.topology = topology;
        this.scheduler = scheduler;
        this.arpTable = arpTable;
    }

    /// @param at virtual time of the requests
    /// @return one token per link and segment
    public List<ScheduleToken> schedule(double at) {
        List<ScheduleToken> tokens = new ArrayList<>();
        for (Link link : topology.links()) {
            tokens.add(scheduler.schedule(at, "arp " + link.key(), now -> exchange(link, now)));
        }
        for (SharedSegment segment : topology.sharedSegments()) {
            tokens.add(scheduler.schedule(at, "arp " + segment.key(), now -> broadcast(segment, now)));
        }
        return tokens;
    }

    List<SimulationEvent> exchange(Link link, double now) {
        List<SimulationEvent> events = new ArrayList<>();
        request(link.endpointA(), link.endpointB(), link, now, events);
        request(link.endpointB(), link.endpointA(), link, now, events);
        return events;
    }

    List<SimulationEvent> broadcast(SharedSegment segment, double now) {
        List<SimulationEvent> events = new ArrayList<>();
        for (InterfaceKey requester : segment.members()) {
            DeviceInterface source = resolve(requester);
            if (!source.isUp()) {
                continue;
            }
            events.add(requestEvent(now, source, BROADCAST, segment));
            for (InterfaceKey target : segment.members()) {
                if (!target.equals(requester) && resolve(target).isUp()) {
                    scheduleReply(requester, target, segment, now);
                }
            }
        }
        return events;
    }

    private void request(InterfaceKey requester, InterfaceKey target, Connection connection, double now,
                         List<SimulationEvent> events) {
        DeviceInterface source = resolve(requester);
        if (!source.isUp()) {
            return;
        }
        DeviceInterface destination = resolve(target);
        events.add(requestEvent(now, source, destination.ipAddress(), connection));
        if (destination.isUp()) {
            scheduleReply(requester, target, connection, now);
        }
    }

    private void scheduleReply(InterfaceKey requester, InterfaceKey target, Connection connection, double now) {
        scheduler.schedule(now + connection.latencyMs() / 1000.0, "arp-reply " + target + " -> " + requester,
            t -> reply(requester, target, connection, t));
    }

    private List<SimulationEvent> reply(InterfaceKey requester, InterfaceKey target, Connection connection,
                                        double now) {
        DeviceInterface source = resolve(requester);
        DeviceInterface answering = resolve(target);
        if (!source.isUp() || !answering.isUp()) {
            return List.of();
        }
        String mac = MacAddresses.of(target);
        arpTable.learn(requester.hostname(), new ArpEntry(answering.ipAddress(), mac, requester, target, now));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requester", requester.toString());
        payload.put("ip", answering.ipAddress());
        payload.put("mac", mac);
        payload.put("connection", connection.key());
        return List.of(SimulationEvent.of(now, SimulationEventKind.ARP_REPLY, target.toString(), payload));
    }

    private SimulationEvent requestEvent(double now, DeviceInterface source, String targetIp, Connection connection) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sender-ip", source.ipAddress());
        payload.put("target-ip", targetIp);
        payload.put("connection", connection.key());
        return SimulationEvent.of(now, SimulationEventKind.ARP_REQUEST, source.key().toString(), payload);
    }

    private DeviceInterface resolve(InterfaceKey key) {
        return topology.iface(key).orElseThrow(() -> new IllegalStateException("unresolved interface " + key));
    }
}
