package io.netsim.engine.scheduler;

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

import io.netsim.engine.event.SimulationEvent;

import java.util.List;

/// A callback run by the dispatch loop at its scheduled virtual time.
@FunctionalInterface
public interface ScheduledAction {

    /// @param now the virtual time of dispatch
    /// @return events to append to the log, in order; never null
    List<SimulationEvent> fire(double now);
}
