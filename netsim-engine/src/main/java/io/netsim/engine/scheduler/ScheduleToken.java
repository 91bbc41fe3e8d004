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

/// Handle of a scheduled callback, used to cancel it.
///
/// Cancelling is idempotent. A one-shot callback that has fired is done; cancelling
/// it afterwards is a no-op.
public final class ScheduleToken {

    private final long id;
    private final String label;
    private volatile boolean cancelled;
    private volatile boolean done;

    ScheduleToken(long id, String label) {
        this.id = id;
        this.label = label;
    }

    public long id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /// @return true once the callback will never fire again
    public boolean isDone() {
        return done || cancelled;
    }

    void markCancelled() {
        cancelled = true;
    }

    void markDone() {
        done = true;
    }

    @Override
    public String toString() {
        return "token#" + id + "(" + label + (cancelled ? ", cancelled" : done ? ", done" : "") + ")";
    }
}
