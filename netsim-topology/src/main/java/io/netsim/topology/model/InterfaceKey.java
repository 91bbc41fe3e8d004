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

import java.util.Comparator;
import java.util.Objects;

/// Lookup key of an interface: owning hostname plus interface name. Links, segments
/// and faults refer to interfaces through this key, never by object reference.
///
/// @param hostname the owning device
/// @param name the interface name on that device
public record InterfaceKey(String hostname, String name) implements Comparable<InterfaceKey> {

    private static final Comparator<InterfaceKey> ORDER =
        Comparator.comparing(InterfaceKey::hostname).thenComparing(InterfaceKey::name);

    public InterfaceKey {
        Objects.requireNonNull(hostname, "hostname");
        Objects.requireNonNull(name, "name");
    }

    /// Parses the `hostname:interface` form. The first colon separates the parts,
    /// so interface names may themselves contain colons.
    ///
    /// @param text the key text
    /// @return the key
    /// @throws IllegalArgumentException if there is no separator
    public static InterfaceKey parse(String text) {
        int colon = text == null ? -1 : text.indexOf(':');
        if (colon <= 0 || colon == text.length() - 1) {
            throw new IllegalArgumentException("expected hostname:interface, got '" + text + "'");
        }
        return new InterfaceKey(text.substring(0, colon), text.substring(colon + 1));
    }

    @Override
    public int compareTo(InterfaceKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return hostname + ":" + name;
    }
}
