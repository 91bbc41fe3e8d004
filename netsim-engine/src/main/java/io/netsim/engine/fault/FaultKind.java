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

/// What a fault takes down.
public enum FaultKind {
    /// One interface, addressed as `host:interface`.
    INTERFACE_DOWN("interface-down"),
    /// Every member of a link or shared segment, addressed by connection key.
    LINK_FAILURE("link-failure"),
    /// Every interface of a device, addressed by hostname.
    DEVICE_FAILURE("device-failure");

    private final String label;

    FaultKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /// Accepts the label or the constant name, e.g. `link-failure` or `LINK_FAILURE`.
    public static FaultKind fromLabel(String label) {
        for (FaultKind kind : values()) {
            if (kind.label.equals(label) || kind.name().equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown fault kind '" + label + "'");
    }
}
