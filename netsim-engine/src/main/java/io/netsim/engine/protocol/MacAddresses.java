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

import io.netsim.topology.model.InterfaceKey;

/// Deterministic, locally administered MAC addresses derived from interface keys.
public final class MacAddresses {

    private MacAddresses() {
    }

    public static String of(InterfaceKey key) {
        String text = key.toString();
        int high = text.hashCode();
        int low = new StringBuilder(text).reverse().toString().hashCode();
        return String.format("02:%02x:%02x:%02x:%02x:%02x",
            (high >>> 24) & 0xff, (high >>> 16) & 0xff, (high >>> 8) & 0xff, high & 0xff, low & 0xff);
    }
}
