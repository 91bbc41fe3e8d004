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

import org.apache.logging.log4j.Level;

/// Kinds of [SimulationEvent], each with its exported name and the log4j level
/// [LoggingEventSink] mirrors it at.
public enum SimulationEventKind {
    SIMULATION_STARTED("simulation-started", Level.INFO),
    SIMULATION_PAUSED("simulation-paused", Level.INFO),
    SIMULATION_RESUMED("simulation-resumed", Level.INFO),
    SIMULATION_STOPPED("simulation-stopped", Level.INFO),
    SCENARIO_STARTED("scenario-started", Level.INFO),
    ARP_REQUEST("arp-request", Level.DEBUG),
    ARP_REPLY("arp-reply", Level.DEBUG),
    NEIGHBOR_DISCOVERY("neighbor-discovery", Level.DEBUG),
    HELLO("hello", Level.TRACE),
    NEIGHBOR_INIT("neighbor-init", Level.DEBUG),
    NEIGHBOR_FULL("neighbor-full", Level.INFO),
    FAULT_INJECTED("fault-injected", Level.WARN),
    FAULT_CLEARED("fault-cleared", Level.INFO);

    private final String label;
    private final Level level;

    SimulationEventKind(String label, Level level) {
        this.label = label;
        this.level = level;
    }

    public String label() {
        return label;
    }

    public Level level() {
        return level;
    }

    /// Accepts the exported name or the constant name, e.g. `fault-injected` or
    /// `FAULT_INJECTED`.
    public static SimulationEventKind fromLabel(String label) {
        for (SimulationEventKind kind : values()) {
            if (kind.label.equals(label) || kind.name().equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown event kind '" + label + "'");
    }
}
