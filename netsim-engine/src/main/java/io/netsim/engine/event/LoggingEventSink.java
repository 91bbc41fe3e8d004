package io.netsim.engine.event;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Mirrors simulation events to log4j at the level of their kind.
public class LoggingEventSink implements SimulationEventSink {

    private final Logger logger;

    public LoggingEventSink() {
        this(LogManager.getLogger(LoggingEventSink.class));
    }

    public LoggingEventSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void onEvent(SimulationEvent event) {
        if (!logger.isEnabled(event.kind().level())) {
            return;
        }
        if (event.payload().isEmpty()) {
            logger.log(event.kind().level(), "[t={}] {} {}", format(event.timestamp()), event.kind().label(),
                event.subject());
        } else {
            logger.log(event.kind().level(), "[t={}] {} {} {}", format(event.timestamp()), event.kind().label(),
                event.subject(), event.payload());
        }
    }

    private static String format(double timestamp) {
        return String.format("%.4f", timestamp);
    }
}
