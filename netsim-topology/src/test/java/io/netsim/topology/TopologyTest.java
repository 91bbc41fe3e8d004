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
import io.netsim.topology.model.DeviceInterface;
import io.netsim.topology.model.InterfaceKey;
import io.netsim.topology.model.Link;
import io.netsim.topology.model.LinkLatencyModel;
import io.netsim.topology.model.LinkMedium;
import io.netsim.topology.model.Subnet;
import io.netsim.topology.net.SubnetKey;
import io.netsim.topology.state.InterfaceState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopologyTest {

    private static final InterfaceKey A0 = new InterfaceKey("A", "Gi0/0");
    private static final InterfaceKey B0 = new InterfaceKey("B", "Gi0/0");

    private Topology.Builder twoDevices() {
        return Topology.builder(LinkLatencyModel.DEFAULT)
            .device(Device.builder("A").iface("Gi0/0", "10.0.0.1", "30", 100).build())
            .device(Device.builder("B").iface("Gi0/0", "10.0.0.2", "30", 100).build());
    }

    @Test
    void rejectsInterfaceInTwoSubnets() {
        Topology.Builder builder = twoDevices()
            .subnet(new Subnet(SubnetKey.parse("10.0.0.0/30"), List.of(A0, B0)))
            .subnet(new Subnet(SubnetKey.parse("10.0.0.0/29"), List.of(A0)));

        assertThatThrownBy(builder::build)
            .isInstanceOf(TopologyInferenceException.class)
            .hasMessageContaining("grouped in both");
    }

    @Test
    void rejectsDuplicateSubnetKey() {
        Topology.Builder builder = twoDevices().subnet(new Subnet(SubnetKey.parse("10.0.0.0/30"), List.of(A0)));

        assertThatThrownBy(() -> builder.subnet(new Subnet(SubnetKey.parse("10.0.0.0/30"), List.of(B0))))
            .isInstanceOf(TopologyInferenceException.class);
    }

    @Test
    void rejectsDanglingLinkEndpoint() {
        Topology.Builder builder = twoDevices()
            .link(new Link(A0, new InterfaceKey("B", "Gi9/9"), 100, 1.1, LinkMedium.ETHERNET, 0.998));

        assertThatThrownBy(builder::build)
            .isInstanceOf(TopologyInferenceException.class)
            .hasMessageContaining("B:Gi9/9");
    }

    @Test
    void linkKeyIsOrderIndependent() {
        Link forward = new Link(A0, B0, 100, 1.1, LinkMedium.ETHERNET, 0.998);
        Link backward = new Link(B0, A0, 100, 1.1, LinkMedium.ETHERNET, 0.998);

        assertThat(forward).isEqualTo(backward);
        assertThat(forward.key()).isEqualTo("A:Gi0/0<->B:Gi0/0").isEqualTo(Link.keyOf(B0, A0));
        assertThat(forward.peerOf(B0)).isEqualTo(A0);
    }

    @Test
    void overlappingFaultHoldsReleaseInAnyOrder() {
        Topology topology = twoDevices().build();
        DeviceInterface iface = topology.iface(A0).orElseThrow();

        assertThat(iface.raiseFault("F-0001")).isTrue();
        assertThat(iface.raiseFault("F-0002")).isFalse();
        assertThat(iface.releaseFault("F-0001")).isFalse();
        assertThat(iface.state()).isEqualTo(InterfaceState.DOWN);
        assertThat(iface.releaseFault("F-0001")).isFalse();
        assertThat(iface.releaseFault("F-0002")).isTrue();
        assertThat(iface.state()).isEqualTo(InterfaceState.UP);
        assertThat(iface.faultHolds()).isEmpty();
    }

    @Test
    void interfaceKeyParsesFirstColon() {
        assertThat(InterfaceKey.parse("R1:Serial0/0:1")).isEqualTo(new InterfaceKey("R1", "Serial0/0:1"));
        assertThatThrownBy(() -> InterfaceKey.parse("R1")).isInstanceOf(IllegalArgumentException.class);
    }
}
