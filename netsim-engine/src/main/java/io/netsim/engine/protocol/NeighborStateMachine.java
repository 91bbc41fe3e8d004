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

/// Transition function of [NeighborState]. A `null` state stands for "no relationship".
public final class NeighborStateMachine {

    /// Hellos needed from the same peer, with no fault in between, to reach `FULL`.
    public static final int FULL_THRESHOLD = 2;

    private NeighborStateMachine() {
    }

    /// @param current the current state, or null if the peer is unknown
    /// @param hellosReceived hellos counted since the relationship started or last
    ///     regressed, including this one
    /// @return the next state
    /// @throws IllegalStateException if the count would reach `FULL` from no relationship
    public static NeighborState onHello(NeighborState current, int hellosReceived) {
        if (hellosReceived < 1) {
            throw new IllegalArgumentException("hello count must be >= 1, got " + hellosReceived);
        }
        NeighborState next = hellosReceived >= FULL_THRESHOLD ? NeighborState.FULL : NeighborState.INIT;
        if (current == NeighborState.FULL) {
            next = NeighborState.FULL;
        }
        check(current, next);
        return next;
    }

    /// @return `INIT` for an existing relationship, null if there is none
    public static NeighborState onPathFault(NeighborState current) {
        return current == null ? null : NeighborState.INIT;
    }

    /// Rejects a transition the state machine does not allow.
    ///
    /// @throws IllegalStateException for `FULL` without a prior `INIT`
    public static void check(NeighborState from, NeighborState to) {
        if (from == null && to == NeighborState.FULL) {
            throw new IllegalStateException("neighbor cannot become full without first being init");
        }
    }
}
