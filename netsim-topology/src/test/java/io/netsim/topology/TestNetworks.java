package io.netsim.topology;

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

import io.netsim.topology.model.Device;
import io.netsim.topology.model.InterfaceConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/// Device sets shared by the topology tests.
public final class TestNetworks {

    private TestNetworks() {
    }

    /// R1, R2 and R3, each pair joined by its own /30.
    public static Map<String, Device> triangle() {
        Map<String, Device> devices = new LinkedHashMap<>();
        devices.put("R1", Device.builder("R1")
            .iface("GigabitEthernet0/0", "10.0.12.1", "255.255.255.252", 1000)
            .iface("GigabitEthernet0/1", "10.0.13.1", "255.255.255.252", 1000)
            .routingProtocol("ospf")
            .build());
        devices.put("R2", Device.builder("R2")
            .iface("GigabitEthernet0/0", "10.0.12.2", "255.255.255.252", 1000)
            .iface("GigabitEthernet0/1", "10.0.23.1", "255.255.255.252", 100)
            .routingProtocol("ospf")
            .build());
        devices.put("R3", Device.builder("R3")
            .iface("GigabitEthernet0/0", "10.0.13.2", "255.255.255.252", 1000)
            .iface("FastEthernet0/1", "10.0.23.2", "/30", 100)
            .routingProtocol("OSPF")
            .build());
        return devices;
    }

    /// Three routers and a switch on one /24, plus a stub loopback on R1.
    public static Map<String, Device> lan() {
        Map<String, Device> devices = new LinkedHashMap<>();
        devices.put("SW1", Device.builder("SW1")
            .iface(InterfaceConfig.of("Vlan10", "192.168.1.254", "255.255.255.0", 1000).withVlan(10))
            .vlan(10)
            .vlan(20)
            .build());
        devices.put("R1", Device.builder("R1")
            .iface("GigabitEthernet0/0", "192.168.1.1", "255.255.255.0", 1000)
            .iface("Loopback0", "1.1.1.1", "255.255.255.255", 8000)
            .routingProtocol("ospf")
            .build());
        devices.put("R2", Device.builder("R2")
            .iface("GigabitEthernet0/0", "192.168.1.2", "255.255.255.0", 100)
            .routingProtocol("bgp")
            .build());
        devices.put("H1", Device.builder("H1")
            .iface("Ethernet0", "192.168.1.10", "24", 10)
            .defaultGateway("192.168.1.1")
            .build());
        return devices;
    }
}
