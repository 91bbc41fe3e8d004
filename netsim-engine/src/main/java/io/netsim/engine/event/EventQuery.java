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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;

/// Filter and limit for reading the event log.
///
/// ```java
/// log.query(EventQuery.all().kinds(SimulationEventKind.FAULT_INJECTED).since(50.0).last(10));
/// ```
///
/// Filters combine with AND. [#last(int)] keeps the most recent matches, still in log
/// order.
public final class EventQuery {

    private final Set<SimulationEventKind> kinds;
    private final String subject;
    private final double since;
    private final int last;

    private EventQuery(Set<SimulationEventKind> kinds, String subject, double since, int last) {
        this.kinds = kinds;
        this.subject = subject;
        this.since = since;
        this.last = last;
    }

    public static EventQuery all() {
        return new EventQuery(Collections.emptySet(), null, Double.NEGATIVE_INFINITY, Integer.MAX_VALUE);
    }

    public EventQuery kinds(SimulationEventKind first, SimulationEventKind... rest) {
        return new EventQuery(Collections.unmodifiableSet(EnumSet.of(first, rest)), subject, since, last);
    }

    /// Matches events whose subject equals `subject` or starts with `subject:`, so a
    /// hostname also matches that device's interface keys.
    public EventQuery subject(String subject) {
        return new EventQuery(kinds, subject, since, last);
    }

    /// @param timestamp inclusive lower bound on event time
    public EventQuery since(double timestamp) {
        return new EventQuery(kinds, subject, timestamp, last);
    }

    public EventQuery last(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got " + count);
        }
        return new EventQuery(kinds, subject, since, count);
    }

    public int limit() {
        return last;
    }

    Predicate<SimulationEvent> predicate() {
        return event -> (kinds.isEmpty() || kinds.contains(event.kind()))
            && (subject == null || event.subject().equals(subject) || event.subject().startsWith(subject + ":"))
            && event.timestamp() >= since;
    }
}
