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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One entry of the simulation event log.
///
/// Events are created unsequenced by whoever observes the occurrence and receive
/// their sequence number when appended to an [EventLog]. The payload keeps insertion
/// order and is never null.
///
/// @param sequence position in the log, starting at 1; 0 until appended
/// @param timestamp virtual time of the occurrence, seconds
/// @param kind what happened
/// @param subject key of the device, interface, link or fault concerned
/// @param payload free-form details
public record SimulationEvent(long sequence, double timestamp, SimulationEventKind kind, String subject,
                              Map<String, Object> payload) {

    public SimulationEvent {
        Objects.requireNonNull(kind, "kind");
        subject = subject == null ? "" : subject;
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static SimulationEvent of(double timestamp, SimulationEventKind kind, String subject,
                                     Map<String, Object> payload) {
        return new SimulationEvent(0, timestamp, kind, subject, payload);
    }

    public static SimulationEvent of(double timestamp, SimulationEventKind kind, String subject) {
        return of(timestamp, kind, subject, Map.of());
    }

    SimulationEvent withSequence(long sequence) {
        return new SimulationEvent(sequence, timestamp, kind, subject, payload);
    }

    @Override
    public String toString() {
        return "#" + sequence + " t=" + timestamp + " " + kind.label() + " " + subject + (payload.isEmpty() ? ""
            : " " + payload);
    }
}
