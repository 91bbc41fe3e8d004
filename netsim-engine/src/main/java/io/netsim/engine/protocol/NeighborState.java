package io.netsim.engine.protocol;

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

/// State of a routing-protocol neighbor relationship.
///
/// | From   | hello, below threshold | hello, threshold reached | fault on the path |
/// |--------|------------------------|--------------------------|-------------------|
/// | none   | `INIT`                 | rejected                 | none              |
/// | `INIT` | `INIT`                 | `FULL`                   | `INIT`            |
/// | `FULL` | `FULL`                 | `FULL`                   | `INIT`            |
///
/// See [NeighborStateMachine].
public enum NeighborState {
    INIT("init"),
    FULL("full");

    private final String label;

    NeighborState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
