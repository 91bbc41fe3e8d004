package io.netsim.topology.model;

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

/// Coarse role of a device, inferred from its configuration.
public enum DeviceRole {
    /// Runs a routing protocol or has a default gateway.
    ROUTER,
    /// Carries VLANs but does no routing.
    SWITCH,
    /// Anything else.
    ENDPOINT
}
