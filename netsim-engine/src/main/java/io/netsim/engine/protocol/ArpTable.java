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

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/// Per-device ARP caches. A later reply for the same address replaces the earlier one.
public class ArpTable {

    private final Map<String, Map<String, ArpEntry>> byHost = new TreeMap<>();

    public synchronized void learn(String hostname, ArpEntry entry) {
        byHost.computeIfAbsent(hostname, h -> new TreeMap<>()).put(entry.ipAddress(), entry);
    }

    /// @return the device's entries ordered by address text, empty for an unknown device
    public synchronized List<ArpEntry> entries(String hostname) {
        Map<String, ArpEntry> entries = byHost.get(hostname);
        return entries == null ? List.of() : List.copyOf(entries.values());
    }

    public synchronized int size() {
        int size = 0;
        for (Map<String, ArpEntry> entries : byHost.values()) {
            size += entries.size();
        }
        return size;
    }
}
