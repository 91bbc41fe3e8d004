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

import io.netsim.engine.InvalidStateException;
import io.netsim.engine.event.EventLog;
import io.netsim.engine.event.SimulationEvent;
import io.netsim.engine.event.SimulationEventKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventSchedulerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private final EventLog log = new EventLog();

    private EventScheduler stepped() {
        return new EventScheduler(log, 0.0, 0.0, "test-dispatch");
    }

    private static ScheduledAction record(List<String> fired, String label) {
        return now -> {
            fired.add(label + "@" + now);
            return List.of();
        };
    }

    @Test
    void dispatchesByTimeThenInsertionOrder() {
        List<String> fired = Collections.synchronizedList(new ArrayList<>());
        try (EventScheduler scheduler = stepped()) {
            scheduler.schedule(5.0, "b", record(fired, "b"));
            scheduler.schedule(1.0, "a", record(fired, "a"));
            scheduler.schedule(5.0, "c", record(fired, "c"));
            scheduler.start();

            assertThat(scheduler.advanceTo(10.0, WAIT)).isTrue();
            assertThat(fired).containsExactly("a@1.0", "b@5.0", "c@5.0");
            assertThat(scheduler.now()).isEqualTo(10.0);
            assertThat(scheduler.dispatchedCount()).isEqualTo(3);
        }
    }

    @Test
    void idleClockDoesNotMoveWithoutStepping() throws InterruptedException {
        try (EventScheduler scheduler = stepped()) {
            scheduler.start();
            Thread.sleep(50);
            assertThat(scheduler.now()).isZero();
        }
    }

    @Test
    void periodicCallbackRepeatsUntilCancelled() {
        AtomicInteger count = new AtomicInteger();
        try (EventScheduler scheduler = stepped()) {
            ScheduleToken token = scheduler.schedule(1.0, 2.0, "tick", now -> {
                count.incrementAndGet();
                return List.of();
            });
            scheduler.start();
            scheduler.advanceTo(7.0, WAIT);
            assertThat(count).hasValue(4);

            assertThat(scheduler.cancel(token)).isTrue();
            scheduler.advanceTo(20.0, WAIT);
            assertThat(count).hasValue(4);
            assertThat(token.isDone()).isTrue();
        }
    }

    @Test
    void cancelIsIdempotent() {
        List<String> fired = Collections.synchronizedList(new ArrayList<>());
        try (EventScheduler scheduler = stepped()) {
            ScheduleToken once = scheduler.schedule(1.0, "once", record(fired, "once"));
            ScheduleToken dropped = scheduler.schedule(2.0, "dropped", record(fired, "dropped"));
            assertThat(scheduler.cancel(dropped)).isTrue();
            assertThat(scheduler.cancel(dropped)).isFalse();
            assertThat(scheduler.cancel(null)).isFalse();

            scheduler.start();
            scheduler.advanceTo(5.0, WAIT);
            assertThat(fired).containsExactly("once@1.0");
            assertThat(once.isDone()).isTrue();
            assertThat(scheduler.cancel(once)).isFalse();
            assertThat(scheduler.pendingCount()).isZero();
        }
    }

    @Test
    void pastTimesAreClampedToTheClock() {
        List<String> fired = Collections.synchronizedList(new ArrayList<>());
        try (EventScheduler scheduler = stepped()) {
            scheduler.start();
            scheduler.advanceTo(10.0, WAIT);
            scheduler.schedule(3.0, "late", record(fired, "late"));
            scheduler.advanceTo(10.0, WAIT);
            assertThat(fired).containsExactly("late@10.0");
        }
    }

    @Test
    void rejectsIllegalTransitions() {
        EventScheduler scheduler = stepped();
        assertThatThrownBy(scheduler::pause).isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(scheduler::resume).isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(scheduler::stop).isInstanceOf(InvalidStateException.class);

        scheduler.start();
        assertThatThrownBy(scheduler::start).isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(scheduler::resume).isInstanceOf(InvalidStateException.class);
        assertThat(scheduler.mode()).isEqualTo(RunMode.RUNNING);

        scheduler.stop();
        assertThat(scheduler.isTerminated()).isTrue();
        assertThatThrownBy(scheduler::stop).isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(scheduler::start).isInstanceOf(InvalidStateException.class);
        assertThat(scheduler.mode()).isEqualTo(RunMode.STOPPED);
        scheduler.close();
    }

    @Test
    void pauseFreezesClockButAcceptsWork() throws InterruptedException {
        List<String> fired = Collections.synchronizedList(new ArrayList<>());
        try (EventScheduler scheduler = stepped()) {
            scheduler.start();
            scheduler.advanceTo(5.0, WAIT);
            scheduler.pause();
            scheduler.schedule(6.0, "queued", record(fired, "queued"));
            Thread.sleep(50);

            assertThat(scheduler.now()).isEqualTo(5.0);
            assertThat(scheduler.pendingCount()).isEqualTo(1);
            assertThatThrownBy(() -> scheduler.advanceTo(8.0, WAIT)).isInstanceOf(InvalidStateException.class);

            scheduler.resume();
            assertThat(scheduler.now()).isEqualTo(5.0);
            scheduler.advanceTo(8.0, WAIT);
            assertThat(fired).containsExactly("queued@6.0");
            assertThat(scheduler.now()).isEqualTo(8.0);
        }
    }

    @Test
    void stopDiscardsQueuedCallbacks() {
        List<String> fired = Collections.synchronizedList(new ArrayList<>());
        EventScheduler scheduler = stepped();
        ScheduleToken pending = scheduler.schedule(100.0, "never", record(fired, "never"));
        scheduler.start();
        scheduler.advanceTo(1.0, WAIT);
        scheduler.stop();

        assertThat(pending.isCancelled()).isTrue();
        assertThat(scheduler.pendingCount()).isZero();
        assertThat(scheduler.schedule(200.0, "after", record(fired, "after")).isCancelled()).isTrue();
        assertThat(fired).isEmpty();
        assertThat(scheduler.now()).isEqualTo(1.0);
    }

    @Test
    void failingCallbackIsCountedAndDispatchContinues() {
        List<String> fired = Collections.synchronizedList(new ArrayList<>());
        try (EventScheduler scheduler = stepped()) {
            scheduler.schedule(1.0, "boom", now -> {
                throw new IllegalStateException("boom");
            });
            scheduler.schedule(2.0, "after", record(fired, "after"));
            scheduler.start();
            scheduler.advanceTo(3.0, WAIT);

            assertThat(scheduler.failureCount()).isEqualTo(1);
            assertThat(fired).containsExactly("after@2.0");
        }
    }

    @Test
    void returnedEventsAreAppendedToTheLog() {
        try (EventScheduler scheduler = stepped()) {
            scheduler.schedule(2.5, "emit", now -> List.of(
                SimulationEvent.of(now, SimulationEventKind.HELLO, "R1:Gi0/0"),
                SimulationEvent.of(now, SimulationEventKind.HELLO, "R2:Gi0/0")));
            scheduler.start();
            scheduler.advanceTo(3.0, WAIT);
        }
        assertThat(log.snapshot()).extracting(SimulationEvent::sequence).containsExactly(1L, 2L);
        assertThat(log.snapshot()).extracting(SimulationEvent::timestamp).containsOnly(2.5);
    }

    @Test
    void pacingThrottlesDispatchAgainstWallTime() {
        try (EventScheduler scheduler = new EventScheduler(log, 0.02, 0.0, "paced-dispatch")) {
            scheduler.schedule(5.0, "paced", now -> List.of());
            scheduler.start();
            long began = System.nanoTime();
            scheduler.advanceTo(5.0, WAIT);
            long elapsedMillis = Duration.ofNanos(System.nanoTime() - began).toMillis();
            assertThat(elapsedMillis).isGreaterThanOrEqualTo(80);
        }
    }

    @Test
    void freeRunningLoopDispatchesUpToItsLimit() throws InterruptedException {
        List<String> fired = Collections.synchronizedList(new ArrayList<>());
        try (EventScheduler scheduler = new EventScheduler(log, 0.0, 10.0, "free-dispatch")) {
            scheduler.schedule(4.0, "inside", record(fired, "inside"));
            scheduler.schedule(12.0, "outside", record(fired, "outside"));
            scheduler.start();
            for (int i = 0; i < 100 && fired.isEmpty(); i++) {
                Thread.sleep(10);
            }
            assertThat(fired).containsExactly("inside@4.0");
            assertThat(scheduler.pendingCount()).isEqualTo(1);
        }
    }
}
