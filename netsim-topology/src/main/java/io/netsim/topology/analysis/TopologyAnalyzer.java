package io.netsim.topology.analysis;

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
import io.netsim.topology.model.Connection;
import io.netsim.topology.model.Orphan;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/// Graph queries over a [Topology], treating devices as vertices and links or
/// segment co-membership as edges.
///
/// Neighbors are always visited in hostname order, so every result here is
/// deterministic.
public class TopologyAnalyzer {

    private static final Logger logger = LogManager.getLogger(TopologyAnalyzer.class);

    private final Topology topology;
    private final Map<String, SortedSet<String>> adjacency = new TreeMap<>();

    public TopologyAnalyzer(Topology topology) {
        this.topology = topology;
        for (String hostname : topology.devices().keySet()) {
            adjacency.put(hostname, topology.neighbors(hostname));
        }
    }

    public TopologyAnalysis analyze() {
        List<List<String>> components = connectedComponents();
        List<String> articulation = articulationPoints();
        List<String> isolated = isolatedDevices();

        List<Connection> connections = topology.connections();
        long total = 0;
        Map<BandwidthClass, Integer> distribution = new EnumMap<>(BandwidthClass.class);
        for (BandwidthClass bucket : BandwidthClass.values()) {
            distribution.put(bucket, 0);
        }
        for (Connection connection : connections) {
            total += connection.bandwidth();
            distribution.merge(BandwidthClass.of(connection.bandwidth()), 1, Integer::sum);
        }
        double average = connections.isEmpty() ? 0.0 : (double) total / connections.size();

        List<String> issues = new ArrayList<>();
        if (!topology.devices().isEmpty()) {
            if (!articulation.isEmpty()) {
                issues.add("Single points of failure detected: " + String.join(", ", articulation));
            }
            int low = distribution.get(BandwidthClass.LOW);
            if (low > 0) {
                issues.add("Low bandwidth links detected: " + low + " links < 100 Mbps");
            }
            if (!isolated.isEmpty()) {
                issues.add("Isolated devices detected: " + String.join(", ", isolated));
            }
            if (topology.routingDomains().containsKey("OSPF") && topology.routingDomains().containsKey("BGP")) {
                issues.add("Multiple routing protocols detected - potential for routing conflicts");
            }
            List<String> conflicts = topology.orphans().stream()
                .filter(Orphan::conflictFlagged)
                .map(o -> o.iface() + " (" + o.reason().label() + ")")
                .toList();
            if (!conflicts.isEmpty()) {
                issues.add("Conflicting interfaces detected: " + String.join(", ", conflicts));
            }
        }

        TopologyAnalysis analysis = new TopologyAnalysis(
            topology.devices().size(),
            topology.links().size(),
            topology.sharedSegments().size(),
            topology.subnets().size(),
            topology.vlanIndex().size(),
            topology.routingDomains().size(),
            components,
            articulation,
            isolated,
            total,
            average,
            distribution,
            List.copyOf(issues));
        logger.debug("analysis: {}, {} issues", analysis.connectivityStatus(), issues.size());
        return analysis;
    }

    /// @return components as sorted hostname lists, largest first, ties by first hostname
    public List<List<String>> connectedComponents() {
        List<List<String>> components = new ArrayList<>();
        SortedSet<String> seen = new TreeSet<>();
        for (String start : adjacency.keySet()) {
            if (seen.contains(start)) {
                continue;
            }
            SortedSet<String> component = new TreeSet<>();
            Deque<String> pending = new ArrayDeque<>();
            pending.add(start);
            seen.add(start);
            while (!pending.isEmpty()) {
                String current = pending.poll();
                component.add(current);
                for (String next : adjacency.get(current)) {
                    if (seen.add(next)) {
                        pending.add(next);
                    }
                }
            }
            components.add(List.copyOf(component));
        }
        components.sort(Comparator.<List<String>>comparingInt(List::size).reversed()
            .thenComparing(c -> c.get(0)));
        return components;
    }

    /// Devices whose removal increases the number of connected components.
    ///
    /// @return sorted hostnames
    public List<String> articulationPoints() {
        Map<String, Integer> discovery = new HashMap<>();
        Map<String, Integer> low = new HashMap<>();
        SortedSet<String> points = new TreeSet<>();
        int[] timer = {0};
        for (String root : adjacency.keySet()) {
            if (!discovery.containsKey(root)) {
                visit(root, null, discovery, low, points, timer);
            }
        }
        return List.copyOf(points);
    }

    private void visit(String node, String parent, Map<String, Integer> discovery, Map<String, Integer> low,
                       SortedSet<String> points, int[] timer) {
        discovery.put(node, timer[0]);
        low.put(node, timer[0]);
        timer[0]++;
        int children = 0;
        for (String next : adjacency.get(node)) {
            if (!discovery.containsKey(next)) {
                children++;
                visit(next, node, discovery, low, points, timer);
                low.put(node, Math.min(low.get(node), low.get(next)));
                if (parent != null && low.get(next) >= discovery.get(node)) {
                    points.add(node);
                }
            } else if (!next.equals(parent)) {
                low.put(node, Math.min(low.get(node), discovery.get(next)));
            }
        }
        if (parent == null && children > 1) {
            points.add(node);
        }
    }

    /// @return sorted hostnames of devices with no neighbor
    public List<String> isolatedDevices() {
        return adjacency.entrySet().stream()
            .filter(e -> e.getValue().isEmpty())
            .map(Map.Entry::getKey)
            .toList();
    }

    /// Breadth-first shortest path by hop count. Among equal-length paths the one
    /// visiting lower hostnames first wins.
    ///
    /// @return hostnames from source to target inclusive, or empty if unreachable or unknown
    public Optional<List<String>> shortestPath(String source, String target) {
        if (!adjacency.containsKey(source) || !adjacency.containsKey(target)) {
            return Optional.empty();
        }
        Map<String, String> previous = new HashMap<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(source);
        previous.put(source, source);
        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (current.equals(target)) {
                LinkedList<String> path = new LinkedList<>();
                for (String step = target; !step.equals(source); step = previous.get(step)) {
                    path.addFirst(step);
                }
                path.addFirst(source);
                return Optional.of(List.copyOf(path));
            }
            for (String next : adjacency.get(current)) {
                if (!previous.containsKey(next)) {
                    previous.put(next, current);
                    pending.add(next);
                }
            }
        }
        return Optional.empty();
    }

    /// @return sorted neighbor hostnames, empty for an unknown device
    public List<String> neighbors(String hostname) {
        SortedSet<String> found = adjacency.get(hostname);
        return found == null ? List.of() : List.copyOf(found);
    }
}
