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

/// Root of the unchecked exceptions raised by topology generation and simulation.
public class NetsimException extends RuntimeException {

    /// Creates an exception with a message.
    ///
    /// @param message the detail message
    public NetsimException(String message) {
        super(message);
    }

    /// Creates an exception with a message and a cause.
    ///
    /// @param message the detail message
    /// @param cause the underlying cause
    public NetsimException(String message, Throwable cause) {
        super(message, cause);
    }
}
