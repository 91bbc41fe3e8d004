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

import io.netsim.engine.EngineNetworks;
import io.netsim.engine.SimulationEngine;
import io.netsim.engine.event.EventQuery;
import io.netsim.engine.event.SimulationEvent;
import io.netsim.engine.event.SimulationEventKind;
import io.netsim.engine.fault.FaultKind;
import io.netsim.topology.model.InterfaceKey;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DayOneScenarioTest {

    @Test
    void ospfPairConvergesWithOneFullEventPerDirection() {
        try (SimulationEngine engine = new SimulationEngine(EngineNetworks.pair(), EngineNetworks.STEPPED)) {
            engine.start();
            engine.startDayOne();
            assertThat(engine.advanceTo(25.0, EngineNetworks.WAIT)).isTrue();

            List<SimulationEvent> full = engine.events(EventQuery.all().kinds(SimulationEventKind.NEIGHBOR_FULL));
            assertThat(full).extracting(SimulationEvent::subject)
                .containsExactlyInAnyOrder("R1:GigabitEthernet0/0", "R2:GigabitEthernet0/0");
            assertThat(engine.neighbors("R1")).singleElement().satisfies(n -> {
                assertThat(n.peerHost()).isEqualTo("R2");
                assertThat(n.state()).isEqualTo(NeighborState.FULL);
            });
            assertThat(engine.neighbors("R2")).extracting(Neighbor::state).containsExactly(NeighborState.FULL);
        }
    }

    @Test
    void firstHelloGoesOutOneIntervalAfterStart() {
        try (SimulationEngine engine = new SimulationEngine(EngineNetworks.pair(), EngineNetworks.STEPPED)) {
            engine.start();
            engine.startDayOne();
            engine.advanceTo(9.9, EngineNetworks.WAIT);
            assertThat(engine.events(EventQuery.all().kinds(SimulationEventKind.HELLO))).isEmpty();

            engine.advanceTo(10.0, EngineNetworks.WAIT);
            assertThat(engine.events(EventQuery.all().kinds(SimulationEventKind.HELLO)))
                .hasSize(2)
                .extracting(SimulationEvent::timestamp).containsOnly(10.0);
        }
    }

    @Test
    void arpPopulatesBothEndsOfALink() {
        try (SimulationEngine engine = new SimulationEngine(EngineNetworks.pair(), EngineNetworks.STEPPED)) {
            engine.start();
            engine.startDayOne();
            engine.advanceTo(1.0, EngineNetworks.WAIT);

            assertThat(engine.events(EventQuery.all().kinds(SimulationEventKind.ARP_REQUEST))).hasSize(2)
                .extracting(SimulationEvent::timestamp).containsOnly(0.1);
            assertThat(engine.events(EventQuery.all().kinds(SimulationEventKind.ARP_REPLY))).hasSize(2);

            List<ArpEntry> r1 = engine.arpTable("R1");
            assertThat(r1).singleElement().satisfies(entry -> {
                assertThat(entry.ipAddress()).isEqualTo("10.0.12.2");
                assertThat(entry.owner()).isEqualTo(new InterfaceKey("R2", "GigabitEthernet0/0"));
                assertThat(entry.macAddress()).isEqualTo(MacAddresses.of(entry.owner())).startsWith("02:");
                assertThat(entry.learnedAt()).isGreaterThan(0.1);
            });
            assertThat(engine.arpTable("R2")).extracting(ArpEntry::ipAddress).containsExactly("10.0.12.1");
        }
    }

    @Test
    void arpIsNotAnsweredByADownInterface() {
        try (SimulationEngine engine = new SimulationEngine(EngineNetworks.pair(), EngineNetworks.STEPPED)) {
            engine.start();
            engine.inject(FaultKind.INTERFACE_DOWN, "R2:GigabitEthernet0/0");
            engine.startDayOne();
            engine.advanceTo(1.0, EngineNetworks.WAIT);

            assertThat(engine.events(EventQuery.all().kinds(SimulationEventKind.ARP_REQUEST)))
                .extracting(SimulationEvent::subject).containsExactly("R1:GigabitEthernet0/0");
            assertThat(engine.events(EventQuery.all().kinds(SimulationEventKind.ARP_REPLY))).isEmpty();
            assertThat(engine.arpTable("R1")).isEmpty();
        }
    }

    @Test
    void sharedSegmentMembersAllResolveEachOther() {
        try (SimulationEngine engine = new SimulationEngine(EngineNetworks.lan(), EngineNetworks.STEPPED)) {
            engine.start();
            engine.startDayOne();
            engine.advanceTo(1.0, EngineNetworks.WAIT);

            assertThat(engine.events(EventQuery.all().kinds(SimulationEventKind.ARP_REQUEST))).hasSize(3)
                .extracting(e -> e.payload().get("target-ip")).containsOnly("ff:ff:ff:ff:ff:ff");
            assertThat(engine.events(EventQuery.all().kinds(SimulationEventKind.ARP_REPLY))).hasSize(6);
            assertThat(engine.arpTable("H1")).extracting(ArpEntry::ipAddress)
                .containsExactly("192.168.1.1", "192.168.1.254");
        }
    }

    @Test
    void neighborDiscoveryReportsEachAdjacentDeviceOnce() {
        try (SimulationEngine engine = new SimulationEngine(EngineNetworks.triangle(), EngineNetworks.STEPPED)) {
            engine.start();
            engine.startDayOne();
            engine.advanceTo(1.0, EngineNetworks.WAIT);

            List<SimulationEvent> discovered =
                engine.events(EventQuery.all().kinds(SimulationEventKind.NEIGHBOR_DISCOVERY));
            assertThat(discovered).hasSize(6).extracting(SimulationEvent::timestamp).containsOnly(0.5);
            assertThat(engine.events(EventQuery.all().kinds(SimulationEventKind.NEIGHBOR_DISCOVERY).subject("R1")))
                .extracting(e -> e.payload().get("neighbor")).containsExactly("R2", "R3");
        }
    }

    @Test
    void scenarioNamesAreMatchedLoosely() {
        assertThat(DayOneScenario.isNamed("day1")).isTrue();
        assertThat(DayOneScenario.isNamed("Day-1")).isTrue();
        assertThat(DayOneScenario.isNamed("day_1")).isTrue();
        assertThat(DayOneScenario.isNamed("link_failure")).isFalse();
        assertThat(DayOneScenario.isNamed(null)).isFalse();
    }
}
