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

/// Why an interface did not end up in a link or segment.
public enum OrphanReason {
    /// Nothing else is on the subnet.
    NO_PEER("no-peer", false),
    /// Another interface claimed the same address first.
    DUPLICATE_IP("duplicate-ip", true),
    /// The only other subnet member sits on the same device.
    SAME_DEVICE("same-device", true);

    private final String label;
    private final boolean conflict;

    OrphanReason(String label, boolean conflict) {
        this.label = label;
        this.conflict = conflict;
    }

    public String label() {
        return label;
    }

    /// @return true if this reason indicates a configuration conflict rather than a stub
    public boolean isConflict() {
        return conflict;
    }

    public static OrphanReason fromLabel(String label) {
        for (OrphanReason reason : values()) {
            if (reason.label.equals(label)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("unknown orphan reason '" + label + "'");
    }
}
