package io.netsim.engine.event;

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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventLogTest {

    private final EventLog log = new EventLog();

    private void fill() {
        log.append(SimulationEvent.of(0.0, SimulationEventKind.SIMULATION_STARTED, "engine"));
        log.append(SimulationEvent.of(0.1, SimulationEventKind.ARP_REQUEST, "R1:Gi0/0"));
        log.append(SimulationEvent.of(0.1, SimulationEventKind.ARP_REQUEST, "R10:Gi0/0"));
        log.append(SimulationEvent.of(10.0, SimulationEventKind.HELLO, "R1:Gi0/0", Map.of("protocol", "OSPF")));
        log.append(SimulationEvent.of(25.0, SimulationEventKind.FAULT_INJECTED, "F-0001"));
    }

    @Test
    void appendAssignsConsecutiveSequences() {
        fill();
        assertThat(log.size()).isEqualTo(5);
        assertThat(log.snapshot()).extracting(SimulationEvent::sequence).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(log.statistics().total()).isEqualTo(5);
        assertThat(log.statistics().count(SimulationEventKind.ARP_REQUEST)).isEqualTo(2);
        assertThat(log.statistics().lastTimestamp()).isEqualTo(25.0);
        assertThat(log.statistics().snapshot()).containsEntry("arp-request", 2L).containsEntry("hello", 1L);
    }

    @Test
    void subjectMatchesHostAndItsInterfacesOnly() {
        fill();
        assertThat(log.query(EventQuery.all().subject("R1"))).extracting(SimulationEvent::sequence)
            .containsExactly(2L, 4L);
        assertThat(log.query(EventQuery.all().subject("F-0001"))).hasSize(1);
    }

    @Test
    void filtersCombineAndLastKeepsLogOrder() {
        fill();
        assertThat(log.query(EventQuery.all().kinds(SimulationEventKind.ARP_REQUEST, SimulationEventKind.HELLO)
            .since(0.1).last(2))).extracting(SimulationEvent::sequence).containsExactly(3L, 4L);
        assertThat(log.query(EventQuery.all().since(20.0))).extracting(SimulationEvent::kind)
            .containsExactly(SimulationEventKind.FAULT_INJECTED);
        assertThat(log.query(EventQuery.all().last(0))).isEmpty();
        assertThatThrownBy(() -> EventQuery.all().last(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failingSinkDoesNotBlockOthers() {
        List<SimulationEvent> seen = new ArrayList<>();
        log.addSink(event -> {
            throw new IllegalStateException("sink down");
        });
        log.addSink(seen::add);
        fill();
        assertThat(seen).hasSize(5);
        assertThat(log.size()).isEqualTo(5);
    }

    @Test
    void removedSinkStopsReceiving() {
        List<SimulationEvent> seen = new ArrayList<>();
        SimulationEventSink sink = seen::add;
        log.addSink(sink);
        log.append(SimulationEvent.of(1.0, SimulationEventKind.HELLO, "R1:Gi0/0"));
        assertThat(log.removeSink(sink)).isTrue();
        log.append(SimulationEvent.of(2.0, SimulationEventKind.HELLO, "R1:Gi0/0"));
        assertThat(seen).hasSize(1);
    }

    @Test
    void kindsParseFromEitherName() {
        assertThat(SimulationEventKind.fromLabel("neighbor-full")).isEqualTo(SimulationEventKind.NEIGHBOR_FULL);
        assertThat(SimulationEventKind.fromLabel("FAULT_CLEARED")).isEqualTo(SimulationEventKind.FAULT_CLEARED);
        assertThatThrownBy(() -> SimulationEventKind.fromLabel("ospf-hello"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loggingSinkAcceptsEveryKind() {
        LoggingEventSink sink = new LoggingEventSink();
        for (SimulationEventKind kind : SimulationEventKind.values()) {
            sink.onEvent(SimulationEvent.of(1.0, kind, "R1", Map.of("k", "v")));
            sink.onEvent(SimulationEvent.of(1.0, kind, "R1"));
        }
        assertThat(SimulationEvent.of(1.0, SimulationEventKind.HELLO, null).subject()).isEmpty();
    }
}
