package io.netsim.engine.config;

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

import io.netsim.topology.NetsimException;
import io.netsim.topology.model.Device;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/// Engine settings, loaded from YAML.
///
/// Every source is overlaid on the bundled `netsim-defaults.yaml`, so a user file only
/// needs the keys it changes. Keys are kebab-case; see the bundled file for the full
/// list.
///
/// @param pacingFactor wall seconds per virtual second, 0 for unpaced dispatch
/// @param maxVirtualTime free-running dispatch limit in virtual seconds
/// @param arpOffset delay of the Day-1 ARP exchange
/// @param neighborDiscoveryOffset delay of the Day-1 neighbor discovery events
/// @param defaultHelloInterval hello interval of protocols not listed in `helloIntervals`
/// @param helloIntervals hello interval by upper-case protocol name
/// @param scenarioDurations fault duration by fault scenario name
/// @param dispatchThreadName name of the dispatch thread
public record SimulationConfig(
    double pacingFactor,
    double maxVirtualTime,
    double arpOffset,
    double neighborDiscoveryOffset,
    double defaultHelloInterval,
    Map<String, Double> helloIntervals,
    Map<String, Double> scenarioDurations,
    String dispatchThreadName
) {

    public static final String DEFAULTS_RESOURCE = "netsim-defaults.yaml";

    private static final Set<String> KEYS = Set.of("pacing-factor", "max-virtual-time", "arp-offset",
        "neighbor-discovery-offset", "default-hello-interval", "hello-intervals", "scenario-durations",
        "dispatch-thread-name");

    private static final SimulationConfig DEFAULTS = loadDefaults();

    public SimulationConfig {
        if (pacingFactor < 0 || Double.isNaN(pacingFactor)) {
            throw new NetsimException("pacing-factor must be >= 0, got " + pacingFactor);
        }
        if (maxVirtualTime < 0 || Double.isNaN(maxVirtualTime)) {
            throw new NetsimException("max-virtual-time must be >= 0, got " + maxVirtualTime);
        }
        if (arpOffset < 0 || neighborDiscoveryOffset < 0) {
            throw new NetsimException("scenario offsets must be >= 0");
        }
        if (!(defaultHelloInterval > 0)) {
            throw new NetsimException("default-hello-interval must be > 0, got " + defaultHelloInterval);
        }
        Map<String, Double> intervals = new LinkedHashMap<>();
        helloIntervals.forEach((protocol, seconds) -> {
            if (seconds == null || !(seconds > 0)) {
                throw new NetsimException("hello interval of " + protocol + " must be > 0, got " + seconds);
            }
            intervals.put(protocolKey(protocol), seconds);
        });
        helloIntervals = Collections.unmodifiableMap(intervals);
        scenarioDurations.forEach((scenario, seconds) -> {
            if (seconds == null || !(seconds > 0)) {
                throw new NetsimException("duration of scenario " + scenario + " must be > 0, got " + seconds);
            }
        });
        scenarioDurations = Collections.unmodifiableMap(new LinkedHashMap<>(scenarioDurations));
    }

    /// @return the bundled defaults
    public static SimulationConfig defaults() {
        return DEFAULTS;
    }

    /// Loads a YAML file and overlays it on the defaults.
    ///
    /// @param path the file
    /// @return the configuration
    public static SimulationConfig file(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return DEFAULTS.overlay(load(reader, path.toString()));
        } catch (IOException e) {
            throw new NetsimException("unable to read simulation config " + path + ": " + e.getMessage(), e);
        }
    }

    /// Parses YAML text and overlays it on the defaults.
    ///
    /// @param yaml the document
    /// @return the configuration
    public static SimulationConfig fromString(String yaml) {
        LoadSettings settings = LoadSettings.builder().setLabel("inline").build();
        try {
            return DEFAULTS.overlay(asMap(new Load(settings).loadFromString(yaml), "inline"));
        } catch (YamlEngineException e) {
            throw new NetsimException("malformed simulation config: " + e.getMessage(), e);
        }
    }

    public SimulationConfig withPacingFactor(double factor) {
        return new SimulationConfig(factor, maxVirtualTime, arpOffset, neighborDiscoveryOffset, defaultHelloInterval,
            helloIntervals, scenarioDurations, dispatchThreadName);
    }

    public SimulationConfig withMaxVirtualTime(double seconds) {
        return new SimulationConfig(pacingFactor, seconds, arpOffset, neighborDiscoveryOffset, defaultHelloInterval,
            helloIntervals, scenarioDurations, dispatchThreadName);
    }

    public SimulationConfig withHelloInterval(String protocol, double seconds) {
        Map<String, Double> intervals = new LinkedHashMap<>(helloIntervals);
        intervals.put(protocolKey(protocol), seconds);
        return new SimulationConfig(pacingFactor, maxVirtualTime, arpOffset, neighborDiscoveryOffset,
            defaultHelloInterval, intervals, scenarioDurations, dispatchThreadName);
    }

    /// @return the hello interval of a protocol, or the default interval for unknown ones
    public double helloInterval(String protocol) {
        return helloIntervals.getOrDefault(protocolKey(protocol), defaultHelloInterval);
    }

    /// @return the configured duration of a fault scenario, or null if none is configured
    public Double scenarioDuration(String scenario) {
        return scenarioDurations.get(scenario);
    }

    SimulationConfig overlay(Map<String, Object> values) {
        for (String key : values.keySet()) {
            if (!KEYS.contains(key)) {
                throw new NetsimException("unknown simulation config key '" + key + "'");
            }
        }
        Map<String, Double> intervals = new LinkedHashMap<>(helloIntervals);
        intervals.putAll(numberMap(values.get("hello-intervals"), "hello-intervals"));
        Map<String, Double> durations = new LinkedHashMap<>(scenarioDurations);
        durations.putAll(numberMap(values.get("scenario-durations"), "scenario-durations"));
        Object threadName = values.get("dispatch-thread-name");
        return new SimulationConfig(
            number(values, "pacing-factor", pacingFactor),
            number(values, "max-virtual-time", maxVirtualTime),
            number(values, "arp-offset", arpOffset),
            number(values, "neighbor-discovery-offset", neighborDiscoveryOffset),
            number(values, "default-hello-interval", defaultHelloInterval),
            intervals,
            durations,
            threadName == null ? dispatchThreadName : threadName.toString());
    }

    private static SimulationConfig loadDefaults() {
        InputStream stream = SimulationConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE);
        if (stream == null) {
            throw new IllegalStateException("missing classpath resource " + DEFAULTS_RESOURCE);
        }
        Map<String, Object> values;
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            values = load(reader, DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("unable to read " + DEFAULTS_RESOURCE, e);
        }
        SimulationConfig empty = new SimulationConfig(0.0, 0.0, 0.0, 0.0, 10.0, Map.of(), Map.of(), "netsim-dispatch");
        return empty.overlay(values);
    }

    private static Map<String, Object> load(Reader reader, String label) {
        LoadSettings settings = LoadSettings.builder().setLabel(label).build();
        try {
            return asMap(new Load(settings).loadFromReader(reader), label);
        } catch (YamlEngineException e) {
            throw new NetsimException("malformed simulation config " + label + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object document, String label) {
        if (document == null) {
            return Map.of();
        }
        if (!(document instanceof Map)) {
            throw new NetsimException("simulation config " + label + " must be a mapping");
        }
        return (Map<String, Object>) document;
    }

    private static double number(Map<String, Object> values, String key, double fallback) {
        Object value = values.get(key);
        if (value == null) {
            return fallback;
        }
        if (!(value instanceof Number)) {
            throw new NetsimException("config key '" + key + "' must be a number, got '" + value + "'");
        }
        return ((Number) value).doubleValue();
    }

    private static Map<String, Double> numberMap(Object value, String key) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new NetsimException("config key '" + key + "' must be a mapping");
        }
        Map<String, Double> result = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> {
            if (!(v instanceof Number)) {
                throw new NetsimException("config key '" + key + "." + k + "' must be a number, got '" + v + "'");
            }
            result.put(String.valueOf(k), ((Number) v).doubleValue());
        });
        return result;
    }

    private static String protocolKey(String protocol) {
        return Device.normalizeProtocol(protocol).replace("-", "");
    }
}
