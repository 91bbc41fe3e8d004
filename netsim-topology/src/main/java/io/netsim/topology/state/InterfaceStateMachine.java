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

/// Transition function for [InterfaceState].
///
/// Several faults may hold one interface down at the same time, e.g. a
/// link failure overlapping a device failure. The caller tracks the holds and
/// tells the machine whether any remain after a release.
public final class InterfaceStateMachine {

    private InterfaceStateMachine() {
    }

    /// Computes the next state.
    ///
    /// @param current the current state
    /// @param transition the input
    /// @param holdsRemaining for [InterfaceTransition#FAULT_RELEASED], whether other faults
    ///     still hold the interface; ignored otherwise
    /// @return the next state
    /// @throws IllegalStateException when releasing a fault from an interface that is up,
    ///     which means the release has no matching raise
    public static InterfaceState next(InterfaceState current, InterfaceTransition transition,
                                      boolean holdsRemaining) {
        switch (transition) {
            case FAULT_RAISED:
                return current == InterfaceState.ADMIN_DOWN ? InterfaceState.ADMIN_DOWN : InterfaceState.DOWN;
            case FAULT_RELEASED:
                switch (current) {
                    case UP:
                        throw new IllegalStateException("fault released on an interface that is up");
                    case DOWN:
                        return holdsRemaining ? InterfaceState.DOWN : InterfaceState.UP;
                    default:
                        return InterfaceState.ADMIN_DOWN;
                }
            default:
                throw new IllegalArgumentException("unhandled transition: " + transition);
        }
    }
}
