package io.netsim.engine.fault;

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

import io.netsim.topology.Topology;
import io.netsim.topology.model.Device;
import io.netsim.topology.model.DeviceInterface;
import io.netsim.topology.model.Link;

import java.util.Locale;
import java.util.Optional;

/// Canned faults that pick their own target: the first eligible one in lexicographic
/// order. The duration comes from the `scenario-durations` configuration.
public enum FaultScenario {
    /// Fails the link with the lowest key.
    LINK_FAILURE("link_failure", FaultKind.LINK_FAILURE) {
        @Override
        public Optional<String> pickTarget(Topology topology) {
            return topology.links().stream().map(Link::key).sorted().findFirst();
        }
    },
    /// Downs the up interface with the lowest `host:interface` key.
    INTERFACE_FAILURE("interface_failure", FaultKind.INTERFACE_DOWN) {
        @Override
        public Optional<String> pickTarget(Topology topology) {
            return topology.interfaces().stream()
                .filter(DeviceInterface::isUp)
                .map(i -> i.key().toString())
                .sorted()
                .findFirst();
        }
    },
    /// Fails the device with the lowest hostname that has interfaces.
    DEVICE_FAILURE("device_failure", FaultKind.DEVICE_FAILURE) {
        @Override
        public Optional<String> pickTarget(Topology topology) {
            return topology.devices().values().stream()
                .filter(d -> !d.interfaces().isEmpty())
                .map(Device::hostname)
                .findFirst();
        }
    };

    private final String scenarioName;
    private final FaultKind kind;

    FaultScenario(String scenarioName, FaultKind kind) {
        this.scenarioName = scenarioName;
        this.kind = kind;
    }

    public String scenarioName() {
        return scenarioName;
    }

    public FaultKind kind() {
        return kind;
    }

    /// @return the target to fault, empty when the topology has nothing eligible
    public abstract Optional<String> pickTarget(Topology topology);

    /// Accepts `link_failure`, `link-failure` or `LINK_FAILURE`.
    public static Optional<FaultScenario> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FaultScenario scenario : values()) {
            if (scenario.scenarioName.equals(normalized)) {
                return Optional.of(scenario);
            }
        }
        return Optional.empty();
    }
}
