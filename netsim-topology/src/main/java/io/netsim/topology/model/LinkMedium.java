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

import java.util.Locale;

/// Physical medium of a link, guessed from interface name prefixes.
public enum LinkMedium {
    GIGABIT_ETHERNET("gigabit-ethernet", "gigabitethernet", 0.9999),
    FAST_ETHERNET("fast-ethernet", "fastethernet", 0.9995),
    SERIAL("serial", "serial", 0.9980),
    LOOPBACK("loopback", "loopback", 1.0),
    ETHERNET("ethernet", "ethernet", 0.9990);

    /// Reliability of an interface whose name matches no known prefix.
    public static final double UNKNOWN_RELIABILITY = 0.9990;

    private final String label;
    private final String prefix;
    private final double reliability;

    LinkMedium(String label, String prefix, double reliability) {
        this.label = label;
        this.prefix = prefix;
        this.reliability = reliability;
    }

    public String label() {
        return label;
    }

    /// @return per-interface reliability for this medium, in [0,1]
    public double reliability() {
        return reliability;
    }

    /// Matches the leading part of an interface name, e.g. `GigabitEthernet0/1`.
    /// Order matters: the more specific prefixes are tested first.
    ///
    /// @return the medium, or null if the name is not recognized
    public static LinkMedium ofInterfaceName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (LinkMedium medium : values()) {
            if (lower.startsWith(medium.prefix)) {
                return medium;
            }
        }
        return null;
    }

    public static double reliabilityOf(String interfaceName) {
        LinkMedium medium = ofInterfaceName(interfaceName);
        return medium == null ? UNKNOWN_RELIABILITY : medium.reliability;
    }

    /// The medium of a link is the fastest medium found on either end.
    public static LinkMedium between(String nameA, String nameB) {
        LinkMedium a = ofInterfaceName(nameA);
        LinkMedium b = ofInterfaceName(nameB);
        for (LinkMedium candidate : new LinkMedium[]{GIGABIT_ETHERNET, FAST_ETHERNET, SERIAL, LOOPBACK}) {
            if (candidate == a || candidate == b) {
                return candidate;
            }
        }
        return ETHERNET;
    }

    public static LinkMedium fromLabel(String label) {
        for (LinkMedium medium : values()) {
            if (medium.label.equals(label)) {
                return medium;
            }
        }
        throw new IllegalArgumentException("unknown link medium '" + label + "'");
    }
}
