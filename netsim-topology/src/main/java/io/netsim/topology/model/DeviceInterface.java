package io.netsim.topology.model;

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

import io.netsim.topology.state.InterfaceState;
import io.netsim.topology.state.InterfaceStateMachine;
import io.netsim.topology.state.InterfaceTransition;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// An interface of a [Device].
///
/// Everything except the operational state is fixed at construction. The state is
/// driven through [InterfaceStateMachine] by fault holds: each active fault that
/// targets the interface adds a hold, and the interface returns to its configured
/// state when the last hold is released.
///
/// The owning device is referenced by hostname only.
public final class DeviceInterface {

    private final InterfaceKey key;
    private final InterfaceConfig config;
    private final InterfaceState configuredState;

    private InterfaceState state;
    private final Set<String> faultHolds = new LinkedHashSet<>();

    DeviceInterface(String hostname, InterfaceConfig config) {
        this.key = new InterfaceKey(hostname, config.name());
        this.config = config;
        this.configuredState = config.shutdown() ? InterfaceState.ADMIN_DOWN : InterfaceState.UP;
        this.state = configuredState;
    }

    public InterfaceKey key() {
        return key;
    }

    /// @return hostname of the owning device
    public String hostname() {
        return key.hostname();
    }

    public String name() {
        return key.name();
    }

    public String ipAddress() {
        return config.ipAddress();
    }

    public String subnetMask() {
        return config.subnetMask();
    }

    /// @return bandwidth in Mbps
    public int bandwidth() {
        return config.bandwidth();
    }

    public int mtu() {
        return config.mtu();
    }

    public Optional<Integer> vlan() {
        return Optional.ofNullable(config.vlan());
    }

    public String description() {
        return config.description();
    }

    public boolean isShutdown() {
        return config.shutdown();
    }

    /// @return the settings this interface was built from
    public InterfaceConfig config() {
        return config;
    }

    /// @return the state before any fault was applied
    public InterfaceState configuredState() {
        return configuredState;
    }

    public synchronized InterfaceState state() {
        return state;
    }

    public synchronized boolean isUp() {
        return state == InterfaceState.UP;
    }

    /// @return ids of the faults currently holding this interface down, in raise order
    public synchronized List<String> faultHolds() {
        return List.copyOf(faultHolds);
    }

    /// Adds a fault hold.
    ///
    /// @param faultId the fault taking the hold
    /// @return true if the state changed
    public synchronized boolean raiseFault(String faultId) {
        if (!faultHolds.add(faultId)) {
            return false;
        }
        InterfaceState previous = state;
        state = InterfaceStateMachine.next(state, InterfaceTransition.FAULT_RAISED, true);
        return previous != state;
    }

    /// Releases a fault hold. Releasing a hold that is not present does nothing.
    ///
    /// @param faultId the fault releasing its hold
    /// @return true if the state changed
    public synchronized boolean releaseFault(String faultId) {
        if (!faultHolds.remove(faultId)) {
            return false;
        }
        InterfaceState previous = state;
        state = InterfaceStateMachine.next(state, InterfaceTransition.FAULT_RELEASED, !faultHolds.isEmpty());
        return previous != state;
    }

    @Override
    public String toString() {
        return key + " " + config.ipAddress() + "/" + config.subnetMask() + " [" + state().label() + "]";
    }
}
