package io.netsim.engine.scheduler;

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

/// Run mode of an [EventScheduler].
///
/// ```
///            start             pause
///  STOPPED ---------> RUNNING -------> PAUSED
///     ^                 |  ^             |
///     |      stop       |  +--resume-----+
///     +-----------------+----------------+
/// ```
///
/// A scheduler that has been stopped is terminated: it returns to `STOPPED` and can
/// never be started again.
public enum RunMode {
    STOPPED("stopped"),
    RUNNING("running"),
    PAUSED("paused");

    private final String label;

    RunMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
