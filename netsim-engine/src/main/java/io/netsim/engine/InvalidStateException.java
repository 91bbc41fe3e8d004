package io.netsim.engine;

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

/// An operation was called in a run mode that does not allow it, such as starting a
/// running simulation. Nothing was changed.
public class InvalidStateException extends NetsimException {

    public InvalidStateException(String message) {
        super(message);
    }
}
