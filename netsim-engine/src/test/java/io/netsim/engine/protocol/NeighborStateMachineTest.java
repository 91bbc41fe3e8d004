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
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NeighborStateMachineTest {

    private static final InterfaceKey R1 = new InterfaceKey("R1", "Gi0/0");
    private static final InterfaceKey R2 = new InterfaceKey("R2", "Gi0/0");

    @Test
    void twoHellosReachFull() {
        assertThat(NeighborStateMachine.onHello(null, 1)).isEqualTo(NeighborState.INIT);
        assertThat(NeighborStateMachine.onHello(NeighborState.INIT, 2)).isEqualTo(NeighborState.FULL);
        assertThat(NeighborStateMachine.onHello(NeighborState.FULL, 1)).isEqualTo(NeighborState.FULL);
    }

    @Test
    void fullWithoutInitIsRejected() {
        assertThatThrownBy(() -> NeighborStateMachine.onHello(null, 2))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> NeighborStateMachine.check(null, NeighborState.FULL))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> NeighborStateMachine.onHello(NeighborState.INIT, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pathFaultRegressesToInit() {
        assertThat(NeighborStateMachine.onPathFault(NeighborState.FULL)).isEqualTo(NeighborState.INIT);
        assertThat(NeighborStateMachine.onPathFault(NeighborState.INIT)).isEqualTo(NeighborState.INIT);
        assertThat(NeighborStateMachine.onPathFault(null)).isNull();
    }

    @Test
    void tableReportsOnlyStateChanges() {
        NeighborTable table = new NeighborTable();

        assertThat(table.receiveHello(R2, R1, "OSPF", 10.0)).contains(NeighborState.INIT);
        assertThat(table.receiveHello(R2, R1, "OSPF", 20.0)).contains(NeighborState.FULL);
        assertThat(table.receiveHello(R2, R1, "OSPF", 30.0)).isEmpty();

        List<Neighbor> neighbors = table.neighbors("R2");
        assertThat(neighbors).hasSize(1);
        Neighbor neighbor = neighbors.get(0);
        assertThat(neighbor.peerHost()).isEqualTo("R1");
        assertThat(neighbor.peerInterface()).isEqualTo(R1);
        assertThat(neighbor.state()).isEqualTo(NeighborState.FULL);
        assertThat(neighbor.hellosReceived()).isEqualTo(3);
        assertThat(neighbor.lastHelloAt()).isEqualTo(30.0);
        assertThat(neighbor.stateSince()).isEqualTo(20.0);
        assertThat(table.neighbors("R1")).isEmpty();
    }

    @Test
    void regressionNeedsAFreshExchange() {
        NeighborTable table = new NeighborTable();
        table.receiveHello(R2, R1, "OSPF", 10.0);
        table.receiveHello(R2, R1, "OSPF", 20.0);
        table.receiveHello(R1, R2, "BGP", 20.0);

        assertThat(table.regress(List.of(R1), 25.0)).isEqualTo(2);
        assertThat(table.count(NeighborState.FULL)).isZero();
        assertThat(table.count(NeighborState.INIT)).isEqualTo(2);

        assertThat(table.receiveHello(R2, R1, "OSPF", 30.0)).isEmpty();
        assertThat(table.receiveHello(R2, R1, "OSPF", 40.0)).contains(NeighborState.FULL);
        assertThat(table.all()).extracting(Neighbor::protocol).containsExactly("BGP", "OSPF");
    }
}
