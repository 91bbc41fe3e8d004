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

/// A learned IP to MAC binding.
///
/// @param ipAddress the resolved address
/// @param macAddress the hardware address that answered
/// @param via the local interface the reply arrived on
/// @param owner the interface owning the address
/// @param learnedAt virtual time of the reply
public record ArpEntry(String ipAddress, String macAddress, InterfaceKey via, InterfaceKey owner, double learnedAt) {
}
