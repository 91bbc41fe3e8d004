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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Neighbor relationships of every device, keyed by receiving interface, peer device and
/// protocol. All methods are synchronized; reads return copies.
public class NeighborTable {

    private static final Logger logger = LogManager.getLogger(NeighborTable.class);

    private static final Comparator<Neighbor> ORDER = Comparator.comparing(Neighbor::localInterface)
        .thenComparing(Neighbor::peerHost)
        .thenComparing(Neighbor::protocol);

    private final Map<Key, Entry> entries = new LinkedHashMap<>();

    /// Records a hello arriving on `receiver` from `sender`.
    ///
    /// @return the new state if the relationship changed state, empty otherwise
    public synchronized Optional<NeighborState> receiveHello(InterfaceKey receiver, InterfaceKey sender,
                                                             String protocol, double now) {
        Key key = new Key(receiver, sender.hostname(), protocol);
        Entry entry = entries.computeIfAbsent(key, k -> new Entry());
        NeighborState previous = entry.state;
        entry.hellos++;
        entry.state = NeighborStateMachine.onHello(previous, entry.hellos);
        entry.peerInterface = sender;
        entry.lastHelloAt = now;
        if (entry.state == previous) {
            return Optional.empty();
        }
        entry.since = now;
        return Optional.of(entry.state);
    }

    /// Drops every relationship carried over any of `interfaces` back to `INIT` with its
    /// hello count reset.
    ///
    /// @return number of relationships that had made progress and were reset
    public synchronized int regress(Collection<InterfaceKey> interfaces, double now) {
        Set<InterfaceKey> affected = new HashSet<>(interfaces);
        int regressed = 0;
        for (Map.Entry<Key, Entry> mapEntry : entries.entrySet()) {
            Key key = mapEntry.getKey();
            Entry entry = mapEntry.getValue();
            if (!affected.contains(key.receiver()) && !affected.contains(entry.peerInterface)) {
                continue;
            }
            if (entry.hellos == 0 && entry.state == NeighborState.INIT) {
                continue;
            }
            NeighborState previous = entry.state;
            entry.state = NeighborStateMachine.onPathFault(previous);
            entry.hellos = 0;
            if (previous != entry.state) {
                entry.since = now;
            }
            regressed++;
            logger.debug("neighbor {} -> {} ({}) regressed from {} at t={}", key.receiver(), key.peerHost(),
                key.protocol(), previous.label(), now);
        }
        return regressed;
    }

    public synchronized List<Neighbor> neighbors(String hostname) {
        List<Neighbor> result = new ArrayList<>();
        entries.forEach((key, entry) -> {
            if (key.receiver().hostname().equals(hostname)) {
                result.add(entry.toNeighbor(key));
            }
        });
        result.sort(ORDER);
        return result;
    }

    public synchronized List<Neighbor> all() {
        List<Neighbor> result = new ArrayList<>();
        entries.forEach((key, entry) -> result.add(entry.toNeighbor(key)));
        result.sort(ORDER);
        return result;
    }

    public synchronized long count(NeighborState state) {
        return entries.values().stream().filter(e -> e.state == state).count();
    }

    private record Key(InterfaceKey receiver, String peerHost, String protocol) {
    }

    private static final class Entry {
        NeighborState state;
        int hellos;
        InterfaceKey peerInterface;
        double lastHelloAt;
        double since;

        Neighbor toNeighbor(Key key) {
            return new Neighbor(key.receiver(), key.peerHost(), peerInterface, key.protocol(), state, hellos,
                lastHelloAt, since);
        }
    }
}
