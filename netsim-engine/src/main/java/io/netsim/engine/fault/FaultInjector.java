package io.netsim.engine.fault;

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
import io.netsim.engine.NotFoundException;
import io.netsim.engine.event.EventLog;
import io.netsim.engine.event.SimulationEvent;
import io.netsim.engine.event.SimulationEventKind;
import io.netsim.engine.protocol.NeighborTable;
import io.netsim.engine.scheduler.EventScheduler;
import io.netsim.topology.Topology;
import io.netsim.topology.model.Connection;
import io.netsim.topology.model.Device;
import io.netsim.topology.model.DeviceInterface;
import io.netsim.topology.model.InterfaceKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/// Injects and clears faults against the live topology.
///
/// Every mutation runs under the scheduler lock, so a fault is applied to all of its
/// interfaces, its neighbor relationships regressed and its `fault-injected` event
/// appended before any callback or status read can observe the topology again.
/// Interfaces count holds: one stays down while any active fault covers it.
public class FaultInjector {

    private static final Logger logger = LogManager.getLogger(FaultInjector.class);

    private final Topology topology;
    private final EventScheduler scheduler;
    private final EventLog log;
    private final NeighborTable neighbors;
    private final Map<String, FaultRecord> faults = new LinkedHashMap<>();
    private int nextId;

    public FaultInjector(Topology topology, EventScheduler scheduler, EventLog log, NeighborTable neighbors) {
        this.topology = topology;
        this.scheduler = scheduler;
        this.log = log;
        this.neighbors = neighbors;
    }

    /// Injects a fault at the current virtual time. Works while running or paused.
    ///
    /// @param kind what to take down
    /// @param target interface key, connection key or hostname, depending on `kind`
    /// @param duration virtual seconds until automatic recovery, or null to hold until cleared
    /// @return the fault as injected
    /// @throws NotFoundException if the target does not resolve
    /// @throws InvalidStateException if the simulation has been stopped
    /// @throws IllegalArgumentException if the duration is not a positive finite number
    public Fault inject(FaultKind kind, String target, Double duration) {
        if (duration != null && (!(duration > 0) || duration.isInfinite())) {
            throw new IllegalArgumentException("fault duration must be positive, got " + duration);
        }
        return scheduler.withLock(() -> {
            if (scheduler.isTerminated()) {
                throw new InvalidStateException("cannot inject " + kind.label() + ": simulation has stopped");
            }
            List<InterfaceKey> affected = resolve(kind, target);
            double now = scheduler.now();
            FaultRecord record = new FaultRecord(String.format("F-%04d", ++nextId), kind, target, affected, now,
                duration);
            faults.put(record.id, record);

            List<String> downed = new ArrayList<>();
            for (InterfaceKey key : affected) {
                DeviceInterface iface = interfaceOf(key);
                if (iface.raiseFault(record.id)) {
                    downed.add(key.toString());
                }
            }
            int regressed = neighbors.regress(affected, now);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("kind", kind.label());
            payload.put("target", target);
            payload.put("affected", record.snapshot().affected());
            payload.put("newly-down", downed);
            payload.put("duration", duration);
            log.append(SimulationEvent.of(now, SimulationEventKind.FAULT_INJECTED, record.id, payload));

            if (duration != null) {
                record.recovery = scheduler.schedule(now + duration, "recover " + record.id,
                    t -> recover(record, t));
            }
            logger.info("injected {} {} on {} at t={} ({} interfaces, {} adjacencies reset)", record.id,
                kind.label(), target, now, affected.size(), regressed);
            return record.snapshot();
        });
    }

    /// Clears an active fault now and cancels its pending recovery.
    ///
    /// @return true if the fault was active, false if it had already cleared
    /// @throws NotFoundException if no fault has this id
    public boolean clear(String faultId) {
        return scheduler.withLock(() -> {
            FaultRecord record = faults.get(faultId);
            if (record == null) {
                logger.warn("clear requested for unknown fault {}", faultId);
                throw new NotFoundException("no fault with id '" + faultId + "'");
            }
            if (record.status == FaultStatus.CLEARED) {
                return false;
            }
            scheduler.cancel(record.recovery);
            log.append(release(record, scheduler.now(), FaultClearCause.MANUAL));
            return true;
        });
    }

    public List<Fault> faults() {
        return scheduler.withLock(() -> faults.values().stream().map(FaultRecord::snapshot).toList());
    }

    public Optional<Fault> fault(String faultId) {
        return scheduler.withLock(() -> Optional.ofNullable(faults.get(faultId)).map(FaultRecord::snapshot));
    }

    public int activeCount() {
        return scheduler.withLock(
            () -> (int) faults.values().stream().filter(r -> r.status == FaultStatus.ACTIVE).count());
    }

    public int totalCount() {
        return scheduler.withLock(faults::size);
    }

    private List<SimulationEvent> recover(FaultRecord record, double now) {
        if (record.status == FaultStatus.CLEARED) {
            return List.of();
        }
        return List.of(release(record, now, FaultClearCause.RECOVERY));
    }

    private SimulationEvent release(FaultRecord record, double now, FaultClearCause cause) {
        List<String> restored = new ArrayList<>();
        for (InterfaceKey key : record.affected) {
            DeviceInterface iface = interfaceOf(key);
            if (iface.releaseFault(record.id)) {
                restored.add(key.toString());
            }
        }
        record.status = FaultStatus.CLEARED;
        record.clearedAt = now;
        record.clearCause = cause;
        logger.info("cleared {} at t={} ({}), {} interfaces restored", record.id, now, cause.label(),
            restored.size());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", record.kind.label());
        payload.put("target", record.target);
        payload.put("cause", cause.label());
        payload.put("restored", restored);
        return SimulationEvent.of(now, SimulationEventKind.FAULT_CLEARED, record.id, payload);
    }

    private List<InterfaceKey> resolve(FaultKind kind, String target) {
        if (target == null || target.isBlank()) {
            throw notFound(kind, target);
        }
        TreeSet<InterfaceKey> keys = new TreeSet<>();
        switch (kind) {
            case INTERFACE_DOWN -> {
                InterfaceKey key;
                try {
                    key = InterfaceKey.parse(target);
                } catch (IllegalArgumentException e) {
                    throw notFound(kind, target);
                }
                if (topology.iface(key).isEmpty()) {
                    throw notFound(kind, target);
                }
                keys.add(key);
            }
            case LINK_FAILURE -> {
                Connection connection = topology.connection(target).orElseThrow(() -> notFound(kind, target));
                keys.addAll(connection.members());
            }
            case DEVICE_FAILURE -> {
                Device device = topology.device(target).orElseThrow(() -> notFound(kind, target));
                device.interfaces().forEach(i -> keys.add(i.key()));
            }
        }
        return List.copyOf(keys);
    }

    private NotFoundException notFound(FaultKind kind, String target) {
        logger.warn("{} target '{}' does not resolve", kind.label(), target);
        return new NotFoundException(kind.label() + " target '" + target + "' not found");
    }

    private DeviceInterface interfaceOf(InterfaceKey key) {
        return topology.iface(key).orElseThrow(() -> new IllegalStateException("unresolved interface " + key));
    }
}
