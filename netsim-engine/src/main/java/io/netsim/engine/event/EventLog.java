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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/// Append-only, in-memory simulation event log.
///
/// Appends take the write lock and assign consecutive sequence numbers starting at 1.
/// Reads copy out under the read lock, so a reader always sees a prefix of the log.
/// Registered sinks and the built-in [EventStatistics] are notified after the write
/// lock is released, in append order for any single appending thread.
public class EventLog {

    private static final Logger logger = LogManager.getLogger(EventLog.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<SimulationEvent> events = new ArrayList<>();
    private final List<SimulationEventSink> sinks = new CopyOnWriteArrayList<>();
    private final EventStatistics statistics = new EventStatistics();

    /// Appends an event, assigning its sequence number.
    ///
    /// @param event the unsequenced event
    /// @return the event as stored
    public SimulationEvent append(SimulationEvent event) {
        SimulationEvent stored;
        lock.writeLock().lock();
        try {
            stored = event.withSequence(events.size() + 1L);
            events.add(stored);
        } finally {
            lock.writeLock().unlock();
        }
        statistics.onEvent(stored);
        for (SimulationEventSink sink : sinks) {
            try {
                sink.onEvent(stored);
            } catch (RuntimeException e) {
                logger.warn("event sink {} failed on {}: {}", sink, stored, e.getMessage(), e);
            }
        }
        return stored;
    }

    public List<SimulationEvent> appendAll(List<SimulationEvent> batch) {
        List<SimulationEvent> stored = new ArrayList<>(batch.size());
        for (SimulationEvent event : batch) {
            stored.add(append(event));
        }
        return stored;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return events.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /// @return a copy of the whole log
    public List<SimulationEvent> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(events);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<SimulationEvent> query(EventQuery query) {
        Predicate<SimulationEvent> predicate = query.predicate();
        List<SimulationEvent> matches = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (SimulationEvent event : events) {
                if (predicate.test(event)) {
                    matches.add(event);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        int from = Math.max(0, matches.size() - query.limit());
        return List.copyOf(matches.subList(from, matches.size()));
    }

    public EventStatistics statistics() {
        return statistics;
    }

    public void addSink(SimulationEventSink sink) {
        sinks.add(sink);
    }

    public boolean removeSink(SimulationEventSink sink) {
        return sinks.remove(sink);
    }
}
