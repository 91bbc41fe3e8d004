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

/// Receives every event appended to an [EventLog], in append order.
///
/// Sinks run on the appending thread, often the dispatch thread while it holds the
/// engine lock, so they must be quick and must not call back into the engine.
@FunctionalInterface
public interface SimulationEventSink {

    void onEvent(SimulationEvent event);
}
