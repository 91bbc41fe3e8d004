package io.netsim.topology.export;

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

import com.google.gson.JsonParseException;
import io.netsim.topology.Topology;
import io.netsim.topology.TopologyInferenceException;
import io.netsim.topology.model.Device;
import io.netsim.topology.model.InterfaceConfig;
import io.netsim.topology.model.InterfaceKey;
import io.netsim.topology.model.Link;
import io.netsim.topology.model.LinkLatencyModel;
import io.netsim.topology.model.LinkMedium;
import io.netsim.topology.model.Orphan;
import io.netsim.topology.model.OrphanReason;
import io.netsim.topology.model.SharedSegment;
import io.netsim.topology.model.Subnet;
import io.netsim.topology.net.SubnetKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

/// Rebuilds a [Topology] from a [TopologyExport].
///
/// Interface state is not restored; every imported interface starts from its
/// configured state. Any reference that does not resolve fails the import with
/// [TopologyInferenceException].
public class TopologyImporter {

    private static final Logger logger = LogManager.getLogger(TopologyImporter.class);

    public TopologyExport fromJson(String json) {
        try {
            TopologyExport export = SHARED.gson.fromJson(json, TopologyExport.class);
            if (export == null) {
                throw new TopologyInferenceException("empty topology document");
            }
            return export;
        } catch (JsonParseException e) {
            throw new TopologyInferenceException("malformed topology document: " + e.getMessage(), e);
        }
    }

    public Topology importJson(String json) {
        return toTopology(fromJson(json));
    }

    public Topology toTopology(TopologyExport export) {
        if (export.devices() == null) {
            throw new TopologyInferenceException("topology document has no devices");
        }
        try {
            Topology.Builder builder =
                Topology.builder(new LinkLatencyModel(export.latencyBaseMs(), export.latencyScaleMsMbps()));
            for (Map.Entry<String, TopologyExport.DeviceExport> entry : export.devices().entrySet()) {
                builder.device(toDevice(entry.getKey(),
                    required(entry.getValue(), "device '" + entry.getKey() + "'")));
            }
            for (TopologyExport.LinkExport link : nullToEmpty(export.links())) {
                required(link, "link entry");
                String where = "link '" + link.key() + "' ";
                builder.link(new Link(
                    new InterfaceKey(required(link.sourceDevice(), where + "sourceDevice"),
                        required(link.sourceInterface(), where + "sourceInterface")),
                    new InterfaceKey(required(link.targetDevice(), where + "targetDevice"),
                        required(link.targetInterface(), where + "targetInterface")),
                    link.bandwidth(), link.latencyMs(), LinkMedium.fromLabel(link.medium()), link.reliability()));
            }
            for (TopologyExport.SegmentExport segment : nullToEmpty(export.sharedSegments())) {
                required(segment, "shared segment entry");
                String cidr = required(segment.subnet(), "segment '" + segment.key() + "' subnet");
                builder.sharedSegment(new SharedSegment(SubnetKey.parse(cidr), parseKeys(segment.members()),
                    segment.bandwidth(), segment.latencyMs()));
            }
            if (export.subnets() != null) {
                export.subnets().forEach((cidr, members) ->
                    builder.subnet(new Subnet(SubnetKey.parse(cidr), parseKeys(members))));
            }
            for (TopologyExport.OrphanExport orphan : nullToEmpty(export.orphans())) {
                required(orphan, "orphan entry");
                builder.orphan(new Orphan(InterfaceKey.parse(required(orphan.iface(), "orphan iface")),
                    OrphanReason.fromLabel(required(orphan.reason(), "orphan reason")),
                    orphan.conflictsWith() == null ? null : InterfaceKey.parse(orphan.conflictsWith())));
            }
            Topology topology = builder.build();
            logger.debug("imported {}", topology);
            return topology;
        } catch (IllegalArgumentException e) {
            throw new TopologyInferenceException("invalid topology document: " + e.getMessage(), e);
        }
    }

    private Device toDevice(String hostname, TopologyExport.DeviceExport export) {
        if (!hostname.equals(export.hostname())) {
            throw new TopologyInferenceException(
                "device key '" + hostname + "' does not match hostname '" + export.hostname() + "'");
        }
        Device.Builder builder = Device.builder(hostname);
        for (TopologyExport.InterfaceExport iface : nullToEmpty(export.interfaces())) {
            required(iface, "interface entry on " + hostname);
            String name = required(iface.name(), "interface name on " + hostname);
            builder.iface(new InterfaceConfig(name,
                required(iface.ipAddress(), hostname + ":" + name + " ipAddress"),
                required(iface.subnetMask(), hostname + ":" + name + " subnetMask"),
                iface.bandwidth(), iface.mtu(), iface.vlan(), iface.description(), iface.shutdown()));
        }
        nullToEmpty(export.routingProtocols()).forEach(builder::routingProtocol);
        nullToEmpty(export.vlans()).forEach(builder::vlan);
        builder.defaultGateway(export.defaultGateway());
        return builder.build();
    }

    /// @throws TopologyInferenceException naming the missing field when `value` is null
    private static <T> T required(T value, String what) {
        if (value == null) {
            throw new TopologyInferenceException("invalid topology document: missing " + what);
        }
        return value;
    }

    private static List<InterfaceKey> parseKeys(List<String> keys) {
        return nullToEmpty(keys).stream().map(InterfaceKey::parse).toList();
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
