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
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/// Running counts of appended events by kind.
///
/// Counters are [LongAdder]s, so reads never block appends. A snapshot taken while
/// events are being appended may be off by the events in flight.
public class EventStatistics implements SimulationEventSink {

    private final Map<SimulationEventKind, LongAdder> counts = new EnumMap<>(SimulationEventKind.class);
    private final LongAdder total = new LongAdder();
    private volatile double lastTimestamp;

    public EventStatistics() {
        for (SimulationEventKind kind : SimulationEventKind.values()) {
            counts.put(kind, new LongAdder());
        }
    }

    @Override
    public void onEvent(SimulationEvent event) {
        counts.get(event.kind()).increment();
        total.increment();
        lastTimestamp = event.timestamp();
    }

    public long count(SimulationEventKind kind) {
        return counts.get(kind).sum();
    }

    public long total() {
        return total.sum();
    }

    /// @return virtual time of the latest appended event
    public double lastTimestamp() {
        return lastTimestamp;
    }

    /// @return exported kind name to count, kinds with no events omitted, in kind order
    public Map<String, Long> snapshot() {
        Map<String, Long> result = new LinkedHashMap<>();
        counts.forEach((kind, adder) -> {
            long value = adder.sum();
            if (value > 0) {
                result.put(kind.label(), value);
            }
        });
        return Collections.unmodifiableMap(result);
    }
}
