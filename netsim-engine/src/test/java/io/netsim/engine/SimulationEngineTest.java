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

import io.netsim.engine.event.EventQuery;
import io.netsim.engine.event.SimulationEvent;
import io.netsim.engine.event.SimulationEventKind;
import io.netsim.engine.config.SimulationConfig;
import io.netsim.engine.fault.Fault;
import io.netsim.engine.fault.FaultKind;
import io.netsim.engine.fault.FaultStatus;
import io.netsim.engine.scheduler.RunMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulationEngineTest {

    @Test
    void lifecycleIsLoggedInOrder() {
        SimulationEngine engine = new SimulationEngine(EngineNetworks.pair(), EngineNetworks.STEPPED);
        engine.start();
        engine.pause();
        engine.resume();
        engine.stop();

        assertThat(engine.events()).extracting(SimulationEvent::kind).containsExactly(
            SimulationEventKind.SIMULATION_STARTED,
            SimulationEventKind.SIMULATION_PAUSED,
            SimulationEventKind.SIMULATION_RESUMED,
            SimulationEventKind.SIMULATION_STOPPED);
        assertThat(engine.events()).extracting(SimulationEvent::sequence).containsExactly(1L, 2L, 3L, 4L);
        assertThat(engine.startedAt()).isPresent();
        assertThat(engine.stoppedAt()).isPresent();
        assertThat(engine.runMode()).isEqualTo(RunMode.STOPPED);
    }

    @Test
    void doubleStartAndDoubleStopFail() {
        SimulationEngine engine = new SimulationEngine(EngineNetworks.pair(), EngineNetworks.STEPPED);
        assertThatThrownBy(engine::stop).isInstanceOf(InvalidStateException.class);
        engine.start();
        assertThatThrownBy(engine::start).isInstanceOf(InvalidStateException.class);
        engine.stop();
        assertThatThrownBy(engine::stop).isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(engine::start).isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(engine::startDayOne).isInstanceOf(InvalidStateException.class);
        assertThat(engine.events(EventQuery.all().kinds(SimulationEventKind.SIMULATION_STOPPED))).hasSize(1);
    }

    @Test
    void dayOneRunsOnlyOnce() {
        try (SimulationEngine engine = new SimulationEngine(EngineNetworks.pair(), EngineNetworks.STEPPED)) {
            engine.start();
            assertThat(engine.startScenario("day1")).isEmpty();
            assertThatThrownBy(engine::startDayOne).isInstanceOf(InvalidStateException.class);
            assertThat(engine.events(EventQuery.all().kinds(SimulationEventKind.SCENARIO_STARTED))).hasSize(1);
        }
    }

    @Test
    void clockIsMonotonicAcrossPauseAndResume() throws InterruptedException {
        try (SimulationEngine engine = new SimulationEngine(EngineNetworks.triangle(), EngineNetworks.STEPPED)) {
            engine.start();
            engine.startDayOne();
            engine.advanceTo(15.0, EngineNetworks.WAIT);
            engine.pause();
            Thread.sleep(30);
            assertThat(engine.now()).isEqualTo(15.0);
            engine.resume();
            engine.advanceBy(20.0, EngineNetworks.WAIT);
            assertThat(engine.now()).isEqualTo(35.0);

            List<SimulationEvent> events = engine.events();
            for (int i = 1; i < events.size(); i++) {
                assertThat(events.get(i).timestamp()).isGreaterThanOrEqualTo(events.get(i - 1).timestamp());
            }
        }
    }

    @Test
    void statusReflectsFaultsAndAdjacencies() {
        try (SimulationEngine engine = new SimulationEngine(EngineNetworks.triangle(), EngineNetworks.STEPPED)) {
            engine.start();
            engine.startDayOne();
            engine.advanceTo(25.0, EngineNetworks.WAIT);

            SimulationStatus converged = engine.status();
            assertThat(converged.isRunning()).isTrue();
            assertThat(converged.virtualTime()).isEqualTo(25.0);
            assertThat(converged.fullAdjacencies()).isEqualTo(6);
            assertThat(converged.linksUp()).isEqualTo(3);
            assertThat(converged.eventsByKind()).containsEntry("neighbor-full", 6L);

            engine.inject(FaultKind.DEVICE_FAILURE, "R3");
            SimulationStatus failed = engine.status();
            assertThat(failed.totalFaults()).isEqualTo(1);
            assertThat(failed.activeFaults()).isEqualTo(1);
            assertThat(failed.interfacesDown()).isEqualTo(2);
            assertThat(failed.interfacesUp()).isEqualTo(4);
            assertThat(failed.linksUp()).isEqualTo(1);
            assertThat(failed.linksDown()).isEqualTo(2);
            assertThat(failed.devicesOffline()).isEqualTo(1);
            assertThat(failed.fullAdjacencies()).isEqualTo(2);
            assertThat(failed.totalEvents()).isEqualTo(engine.events().size());
        }
    }

    @Test
    void sinksSeeEveryAppendedEvent() {
        List<SimulationEvent> seen = Collections.synchronizedList(new ArrayList<>());
        try (SimulationEngine engine = new SimulationEngine(EngineNetworks.pair(), EngineNetworks.STEPPED)) {
            engine.addSink(seen::add);
            engine.start();
            engine.startDayOne();
            engine.advanceTo(1.0, EngineNetworks.WAIT);
            assertThat(seen).containsExactlyElementsOf(engine.events());
        }
    }

    @Test
    void eventQueriesFilterAndLimit() {
        try (SimulationEngine engine = new SimulationEngine(EngineNetworks.triangle(), EngineNetworks.STEPPED)) {
            engine.start();
            engine.startDayOne();
            engine.advanceTo(12.0, EngineNetworks.WAIT);

            List<SimulationEvent> hellos = engine.events(EventQuery.all().kinds(SimulationEventKind.HELLO));
            assertThat(hellos).hasSize(6);
            assertThat(engine.events(EventQuery.all().kinds(SimulationEventKind.HELLO).subject("R2")))
                .hasSize(2)
                .allSatisfy(e -> assertThat(e.subject()).startsWith("R2:"));
            assertThat(engine.events(EventQuery.all().since(10.0)))
                .allSatisfy(e -> assertThat(e.timestamp()).isGreaterThanOrEqualTo(10.0));
            List<SimulationEvent> lastTwo = engine.events(EventQuery.all().last(2));
            List<SimulationEvent> all = engine.events();
            assertThat(lastTwo).containsExactlyElementsOf(all.subList(all.size() - 2, all.size()));
        }
    }

    @Test
    void statusAfterStopCountsTheStopEvent() throws InterruptedException {
        SimulationEngine engine = new SimulationEngine(EngineNetworks.triangle(), EngineNetworks.STEPPED);
        engine.start();
        engine.startDayOne();
        engine.advanceTo(12.0, EngineNetworks.WAIT);

        List<String> mismatches = Collections.synchronizedList(new ArrayList<>());
        Thread reader = new Thread(() -> {
            while (!Thread.currentThread().isInterrupted()) {
                SimulationStatus status = engine.status();
                long byKind = status.eventsByKind().values().stream().mapToLong(Long::longValue).sum();
                if (byKind != status.totalEvents()) {
                    mismatches.add(status.totalEvents() + " != " + byKind);
                }
                if (status.runMode() == RunMode.STOPPED && !status.eventsByKind().containsKey("simulation-stopped")) {
                    mismatches.add("stopped without its event at " + status.totalEvents());
                }
            }
        });
        reader.start();
        engine.stop();
        reader.interrupt();
        reader.join();

        SimulationStatus status = engine.status();
        assertThat(mismatches).isEmpty();
        assertThat(status.totalEvents()).isEqualTo(engine.events().size());
        assertThat(engine.events().get(engine.events().size() - 1).kind())
            .isEqualTo(SimulationEventKind.SIMULATION_STOPPED);
    }

    @Test
    void defaultConfigRecoversFaultsInRealTime() throws InterruptedException {
        try (SimulationEngine engine = new SimulationEngine(EngineNetworks.pair())) {
            engine.start();
            engine.startDayOne();
            Fault fault = engine.inject(FaultKind.LINK_FAILURE, EngineNetworks.R1_R2, 0.5);
            assertThat(engine.status().interfacesDown()).isEqualTo(2);

            assertThat(eventually(() -> !engine.fault(fault.id()).orElseThrow().isActive(), Duration.ofSeconds(5)))
                .isTrue();
            Fault cleared = engine.fault(fault.id()).orElseThrow();
            assertThat(cleared.status()).isEqualTo(FaultStatus.CLEARED);
            assertThat(cleared.clearedAt()).isEqualTo(fault.injectedAt() + 0.5);
            assertThat(engine.status().interfacesDown()).isZero();
            assertThat(engine.status().freeRunLimitReached()).isFalse();
        }
    }

    @Test
    void freeRunLimitIsReportedAndSteppingContinues() throws InterruptedException {
        SimulationConfig config = SimulationConfig.defaults().withPacingFactor(0).withMaxVirtualTime(50);
        try (SimulationEngine engine = new SimulationEngine(EngineNetworks.pair(), config)) {
            engine.start();
            engine.startDayOne();
            assertThat(eventually(() -> engine.status().freeRunLimitReached(), Duration.ofSeconds(5))).isTrue();
            SimulationStatus halted = engine.status();
            assertThat(halted.isRunning()).isTrue();
            assertThat(halted.virtualTime()).isLessThanOrEqualTo(50.0);
            assertThat(halted.pendingCallbacks()).isPositive();

            Fault fault = engine.inject(FaultKind.LINK_FAILURE, EngineNetworks.R1_R2, 5.0);
            assertThat(engine.advanceBy(10.0, EngineNetworks.WAIT)).isTrue();
            assertThat(engine.fault(fault.id()).orElseThrow().status()).isEqualTo(FaultStatus.CLEARED);
            assertThat(engine.now()).isGreaterThan(50.0);
        }
    }

    @Test
    void closeIsIdempotent() {
        SimulationEngine engine = new SimulationEngine(EngineNetworks.pair(), EngineNetworks.STEPPED);
        engine.start();
        engine.close();
        engine.close();
        assertThat(engine.runMode()).isEqualTo(RunMode.STOPPED);
        assertThat(engine.events(EventQuery.all().kinds(SimulationEventKind.SIMULATION_STOPPED))).hasSize(1);
    }

    private static boolean eventually(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(20);
        }
        return true;
    }
}
