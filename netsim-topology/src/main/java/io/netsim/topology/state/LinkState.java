package io.netsim.topology.state;

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

import java.util.Collection;

/// Operational state of a link or shared segment, derived from its member interfaces.
public enum LinkState {
    /// Every member interface is up.
    UP("up"),
    /// A shared segment with some members down but at least two still up.
    DEGRADED("degraded"),
    /// Fewer than two member interfaces are up, or a point-to-point endpoint is down.
    DOWN("down");

    private final String label;

    LinkState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /// Derives the state from the member interface states.
    ///
    /// @param members the member states; two for a link, three or more for a segment
    /// @return the derived state
    public static LinkState derive(Collection<InterfaceState> members) {
        long up = members.stream().filter(s -> s == InterfaceState.UP).count();
        if (up == members.size()) {
            return UP;
        }
        if (members.size() > 2 && up >= 2) {
            return DEGRADED;
        }
        return DOWN;
    }
}
