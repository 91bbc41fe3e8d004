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

/// Operational state of an interface.
///
/// | From         | [InterfaceTransition#FAULT_RAISED] | [InterfaceTransition#FAULT_RELEASED]     |
/// |--------------|------------------------------------|------------------------------------------|
/// | `UP`         | `DOWN`                             | rejected                                 |
/// | `DOWN`       | `DOWN`                             | `UP` once no fault holds the interface   |
/// | `ADMIN_DOWN` | `ADMIN_DOWN`                       | `ADMIN_DOWN`                             |
///
/// See [InterfaceStateMachine] for the transition function.
public enum InterfaceState {
    UP("up"),
    DOWN("down"),
    ADMIN_DOWN("administratively-down");

    private final String label;

    InterfaceState(String label) {
        this.label = label;
    }

    /// @return the exported name of this state
    public String label() {
        return label;
    }

    /// @param label an exported name
    /// @return the matching state
    /// @throws IllegalArgumentException if no state has that name
    public static InterfaceState fromLabel(String label) {
        for (InterfaceState state : values()) {
            if (state.label.equals(label)) {
                return state;
            }
        }
        throw new IllegalArgumentException("unknown interface state: " + label);
    }
}
