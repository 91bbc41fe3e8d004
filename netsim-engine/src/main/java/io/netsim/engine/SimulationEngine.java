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

import io.netsim.engine.config.SimulationConfig;
import io.netsim.engine.event.EventLog;
import io.netsim.engine.event.EventQuery;
import io.netsim.engine.event.LoggingEventSink;
import io.netsim.engine.event.SimulationEvent;
import io.netsim.engine.event.SimulationEventKind;
import io.netsim.engine.event.SimulationEventSink;
import io.netsim.engine.export.SimulationLogExport;
import io.netsim.engine.export.SimulationLogExporter;
import io.netsim.engine.fault.Fault;
import io.netsim.engine.fault.FaultInjector;
import io.netsim.engine.fault.FaultKind;
import io.netsim.engine.fault.FaultScenario;
import io.netsim.engine.protocol.ArpEntry;
import io.netsim.engine.protocol.ArpTable;
import io.netsim.engine.protocol.DayOneScenario;
import io.netsim.engine.protocol.Neighbor;
import io.netsim.engine.protocol.NeighborState;
import io.netsim.engine.protocol.NeighborTable;
import io.netsim.engine.scheduler.EventScheduler;
import io.netsim.engine.scheduler.RunMode;
import io.netsim.topology.Topology;
import io.netsim.topology.model.Connection;
import io.netsim.topology.model.Device;
import io.netsim.topology.model.DeviceInterface;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Control surface of one simulation run over a generated [Topology].
///
/// The engine owns the virtual clock, the event log, the protocol tables and the fault
/// injector. Every entry point is safe to call from any thread; mutations are
/// serialized with the dispatch thread through the scheduler lock. A stopped engine
/// cannot be restarted: create a new one over a freshly generated topology instead.
///
/// ```java
/// Topology topology = new TopologyGenerator().generate(devices);
/// try (SimulationEngine engine = new SimulationEngine(topology)) {
///     engine.start();
///     engine.startDayOne();
///     engine.advanceTo(30, Duration.ofSeconds(5));
///     engine.inject(FaultKind.LINK_FAILURE, "R1:Gi0/0<->R2:Gi0/0", 30.0);
/// }
/// ```
public class SimulationEngine implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(SimulationEngine.class);

    private final Topology topology;
    private final SimulationConfig config;
    private final EventLog log = new EventLog();
    private final EventScheduler scheduler;
    private final NeighborTable neighbors = new NeighborTable();
    private final ArpTable arpTable = new ArpTable();
    private final FaultInjector faults;
    private final DayOneScenario dayOne;

    private volatile Instant startedAt;
    private volatile Instant stoppedAt;

    public SimulationEngine(Topology topology) {
        this(topology, SimulationConfig.defaults());
    }

    public SimulationEngine(Topology topology, SimulationConfig config) {
        this.topology = topology;
        this.config = config;
        this.scheduler = new EventScheduler(log, config.pacingFactor(), config.maxVirtualTime(),
            config.dispatchThreadName());
        this.faults = new FaultInjector(topology, scheduler, log, neighbors);
        this.dayOne = new DayOneScenario(topology, scheduler, neighbors, arpTable, config);
        log.addSink(new LoggingEventSink());
    }

    /// @throws InvalidStateException if already started or stopped
    public void start() {
        scheduler.runLocked(() -> {
            scheduler.start();
            startedAt = Instant.now();
            log.append(SimulationEvent.of(scheduler.now(), SimulationEventKind.SIMULATION_STARTED, "engine",
                Map.of("devices", topology.devices().size(), "connections", topology.connections().size())));
            logger.info("simulation started over {}", topology);
        });
    }

    /// Freezes the virtual clock. Faults can still be injected and cleared.
    public void pause() {
        scheduler.runLocked(() -> {
            scheduler.pause();
            log.append(SimulationEvent.of(scheduler.now(), SimulationEventKind.SIMULATION_PAUSED, "engine"));
        });
    }

    public void resume() {
        scheduler.runLocked(() -> {
            scheduler.resume();
            log.append(SimulationEvent.of(scheduler.now(), SimulationEventKind.SIMULATION_RESUMED, "engine"));
        });
    }

    /// Stops the simulation for good. Unfired callbacks are discarded, including pending
    /// fault recoveries; active faults stay active.
    ///
    /// @throws InvalidStateException if never started or already stopped
    public void stop() {
        scheduler.stop(() -> {
            stoppedAt = Instant.now();
            log.append(SimulationEvent.of(scheduler.now(), SimulationEventKind.SIMULATION_STOPPED, "engine",
                Map.of("events", log.size(), "faults", faults.totalCount())));
        });
        logger.info("simulation stopped at t={} after {} events", scheduler.now(), log.size());
    }

    /// Schedules the Day-1 discovery scenario relative to the current virtual time.
    ///
    /// @throws InvalidStateException if it already started or the engine has stopped
    public void startDayOne() {
        scheduler.runLocked(() -> {
            requireNotStopped("start the Day-1 scenario");
            log.append(dayOne.start());
        });
    }

    /// Starts a scenario by name: `day1`, or one of the [FaultScenario] names.
    ///
    /// @return the injected fault for a fault scenario; empty for `day1` or when the
    ///     topology has no eligible target
    /// @throws NotFoundException if no scenario has this name
    public Optional<Fault> startScenario(String name) {
        if (DayOneScenario.isNamed(name)) {
            startDayOne();
            return Optional.empty();
        }
        FaultScenario scenario = FaultScenario.fromName(name).orElseThrow(() -> {
            logger.warn("unknown scenario '{}'", name);
            return new NotFoundException("no scenario named '" + name + "'");
        });
        return scheduler.withLock(() -> {
            requireNotStopped("start scenario " + scenario.scenarioName());
            Optional<String> target = scenario.pickTarget(topology);
            if (target.isEmpty()) {
                logger.warn("scenario {} has no eligible target", scenario.scenarioName());
                return Optional.empty();
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("scenario", scenario.scenarioName());
            payload.put("target", target.get());
            log.append(SimulationEvent.of(scheduler.now(), SimulationEventKind.SCENARIO_STARTED,
                scenario.scenarioName(), payload));
            return Optional.of(faults.inject(scenario.kind(), target.get(),
                config.scenarioDuration(scenario.scenarioName())));
        });
    }

    /// @see FaultInjector#inject(FaultKind, String, Double)
    public Fault inject(FaultKind kind, String target, Double duration) {
        return faults.inject(kind, target, duration);
    }

    /// Injects a fault that holds until cleared.
    public Fault inject(FaultKind kind, String target) {
        return faults.inject(kind, target, null);
    }

    /// @see FaultInjector#clear(String)
    public boolean clear(String faultId) {
        return faults.clear(faultId);
    }

    public SimulationStatus status() {
        return scheduler.withLock(() -> {
            int up = 0;
            int down = 0;
            for (DeviceInterface iface : topology.interfaces()) {
                if (iface.isUp()) {
                    up++;
                } else {
                    down++;
                }
            }
            int linksUp = 0;
            int linksDegraded = 0;
            int linksDown = 0;
            for (Connection connection : topology.connections()) {
                switch (topology.stateOf(connection)) {
                    case UP -> linksUp++;
                    case DEGRADED -> linksDegraded++;
                    case DOWN -> linksDown++;
                }
            }
            int offline = (int) topology.devices().values().stream().filter(Device::isOffline).count();
            return new SimulationStatus(scheduler.mode(), scheduler.now(), log.size(),
                log.statistics().snapshot(), faults.totalCount(), faults.activeCount(), up, down, linksUp,
                linksDegraded, linksDown, offline, neighbors.count(NeighborState.FULL),
                neighbors.count(NeighborState.INIT), scheduler.pendingCount(), scheduler.failureCount(),
                scheduler.isFreeRunLimitReached());
        });
    }

    /// @return every event logged so far, in order
    public List<SimulationEvent> events() {
        return log.snapshot();
    }

    public List<SimulationEvent> events(EventQuery query) {
        return log.query(query);
    }

    public List<Fault> faults() {
        return faults.faults();
    }

    public Optional<Fault> fault(String faultId) {
        return faults.fault(faultId);
    }

    /// @return neighbor relationships held by a device
    public List<Neighbor> neighbors(String hostname) {
        return neighbors.neighbors(hostname);
    }

    public List<Neighbor> neighbors() {
        return neighbors.all();
    }

    /// @return the device's learned ARP entries
    public List<ArpEntry> arpTable(String hostname) {
        return arpTable.entries(hostname);
    }

    public void addSink(SimulationEventSink sink) {
        log.addSink(sink);
    }

    public boolean removeSink(SimulationEventSink sink) {
        return log.removeSink(sink);
    }

    /// Runs the simulation up to `target` virtual seconds and waits for it.
    ///
    /// @return true if the clock reached `target` within `timeout`
    /// @throws InvalidStateException if the engine is not running
    public boolean advanceTo(double target, Duration timeout) {
        return scheduler.advanceTo(target, timeout);
    }

    /// Runs the simulation `delta` virtual seconds past the current clock.
    public boolean advanceBy(double delta, Duration timeout) {
        return scheduler.advanceTo(scheduler.now() + delta, timeout);
    }

    public double now() {
        return scheduler.now();
    }

    public RunMode runMode() {
        return scheduler.mode();
    }

    public Topology topology() {
        return topology;
    }

    public SimulationConfig config() {
        return config;
    }

    public Optional<Instant> startedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> stoppedAt() {
        return Optional.ofNullable(stoppedAt);
    }

    public SimulationLogExport exportLog() {
        return new SimulationLogExporter().export(this);
    }

    /// Stops the engine if it is running or paused. Safe to call repeatedly.
    @Override
    public void close() {
        scheduler.close(() -> {
            stoppedAt = Instant.now();
            log.append(SimulationEvent.of(scheduler.now(), SimulationEventKind.SIMULATION_STOPPED, "engine"));
        });
    }

    private void requireNotStopped(String action) {
        if (scheduler.isTerminated()) {
            throw new InvalidStateException("cannot " + action + ": simulation has stopped");
        }
    }
}
