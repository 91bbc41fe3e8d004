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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/// Discrete-event scheduler with a single virtual clock.
///
/// Callbacks are kept in a queue ordered by scheduled time, then by insertion order, so
/// equal-time callbacks run first-in first-out. One daemon dispatch thread pops the
/// earliest callback, moves the clock to its time, runs it, appends the events it
/// returns to the [EventLog] and re-enqueues it if it repeats.
///
/// # Locking
///
/// One [ReentrantLock] guards the queue, the clock and the run mode. The dispatch
/// thread holds it while a callback runs, so callbacks and any caller using
/// [#withLock(Supplier)] are serialized. Code that must never observe a half-applied
/// change, such as fault injection, runs under this lock.
///
/// # Horizon
///
/// The loop only dispatches callbacks due at or before the horizon: the larger of the
/// free-running limit, the current clock and the highest target passed to
/// [#advanceTo(double, Duration)]. An empty queue, or one whose head lies beyond the
/// horizon, idles without moving the clock. Only [#advanceTo(double, Duration)] moves
/// an idle clock forward.
///
/// # Pacing
///
/// With a pacing factor `p > 0` a callback at virtual time `t` is not dispatched before
/// `p * (t - t0)` wall seconds have passed since the last start or resume at clock `t0`.
public class EventScheduler implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(EventScheduler.class);

    private static final Comparator<Entry> ORDER =
        Comparator.comparingDouble(Entry::time).thenComparingLong(Entry::sequence);
    private static final long JOIN_MILLIS = 2_000;

    private final EventLog log;
    private final double pacingFactor;
    private final double freeRunLimit;
    private final String threadName;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);
    private final Map<Long, Entry> pending = new HashMap<>();
    private final LongAdder dispatched = new LongAdder();
    private final LongAdder failures = new LongAdder();

    private long nextSequence;
    private long nextTokenId;
    private double clock;
    private double stepTarget;
    private RunMode mode = RunMode.STOPPED;
    private boolean terminated;
    private boolean freeRunLimitReached;
    private Thread dispatcher;
    private long wallAnchorNanos;
    private double virtualAnchor;

    /// @param log where callback events are appended
    /// @param pacingFactor wall seconds per virtual second, 0 for unpaced
    /// @param freeRunLimit virtual time up to which the loop runs without stepping
    /// @param threadName name of the dispatch thread
    public EventScheduler(EventLog log, double pacingFactor, double freeRunLimit, String threadName) {
        if (pacingFactor < 0 || freeRunLimit < 0) {
            throw new IllegalArgumentException("pacing factor and free-run limit must be >= 0");
        }
        this.log = log;
        this.pacingFactor = pacingFactor;
        this.freeRunLimit = freeRunLimit;
        this.threadName = threadName;
    }

    /// @return the current virtual time
    public double now() {
        lock.lock();
        try {
            return clock;
        } finally {
            lock.unlock();
        }
    }

    public RunMode mode() {
        lock.lock();
        try {
            return mode;
        } finally {
            lock.unlock();
        }
    }

    /// @return true once [#stop()] has been called
    public boolean isTerminated() {
        lock.lock();
        try {
            return terminated;
        } finally {
            lock.unlock();
        }
    }

    /// Runs `work` while holding the scheduler lock, serialized with the dispatch loop.
    public <T> T withLock(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable work) {
        lock.lock();
        try {
            work.run();
        } finally {
            lock.unlock();
        }
    }

    /// Schedules a one-shot callback.
    ///
    /// @see #schedule(double, double, String, ScheduledAction)
    public ScheduleToken schedule(double at, String label, ScheduledAction action) {
        return schedule(at, 0.0, label, action);
    }

    /// Schedules a callback. A time earlier than the clock is treated as now. After
    /// [#stop()] nothing is queued and the returned token is already cancelled.
    ///
    /// @param at virtual time of the first dispatch
    /// @param repeatInterval interval between dispatches, or 0 for a one-shot callback
    /// @param label description used in logs
    /// @param action the callback
    /// @return the cancellation token
    public ScheduleToken schedule(double at, double repeatInterval, String label, ScheduledAction action) {
        if (Double.isNaN(at) || Double.isInfinite(at)) {
            throw new IllegalArgumentException("schedule time must be finite, got " + at);
        }
        if (repeatInterval < 0 || Double.isNaN(repeatInterval)) {
            throw new IllegalArgumentException("repeat interval must be >= 0, got " + repeatInterval);
        }
        lock.lock();
        try {
            ScheduleToken token = new ScheduleToken(++nextTokenId, label);
            if (terminated) {
                logger.debug("not scheduling {} on a stopped scheduler", label);
                token.markCancelled();
                return token;
            }
            Entry entry = new Entry(Math.max(at, clock), nextSequence++, token, action, repeatInterval);
            queue.add(entry);
            pending.put(token.id(), entry);
            changed.signalAll();
            return token;
        } finally {
            lock.unlock();
        }
    }

    /// Schedules a one-shot callback `delay` virtual seconds from now.
    public ScheduleToken scheduleAfter(double delay, String label, ScheduledAction action) {
        lock.lock();
        try {
            return schedule(clock + delay, 0.0, label, action);
        } finally {
            lock.unlock();
        }
    }

    /// Cancels a callback. Cancelling a fired, cancelled or null token does nothing.
    ///
    /// @return true if a pending callback was removed
    public boolean cancel(ScheduleToken token) {
        if (token == null) {
            return false;
        }
        lock.lock();
        try {
            if (token.isDone()) {
                return false;
            }
            token.markCancelled();
            Entry entry = pending.remove(token.id());
            if (entry != null) {
                queue.remove(entry);
            }
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void start() {
        lock.lock();
        try {
            if (terminated) {
                throw new InvalidStateException("scheduler has been stopped and cannot be restarted");
            }
            if (mode != RunMode.STOPPED) {
                throw new InvalidStateException("cannot start: scheduler is " + mode.label());
            }
            mode = RunMode.RUNNING;
            resetPacingAnchor();
            dispatcher = new Thread(this::runLoop, threadName);
            dispatcher.setDaemon(true);
            dispatcher.start();
            logger.debug("scheduler started at t={}", clock);
        } finally {
            lock.unlock();
        }
    }

    /// Freezes the clock. Queued callbacks are kept and new ones are still accepted.
    public void pause() {
        lock.lock();
        try {
            if (mode != RunMode.RUNNING) {
                throw new InvalidStateException("cannot pause: scheduler is " + mode.label());
            }
            mode = RunMode.PAUSED;
            changed.signalAll();
            logger.debug("scheduler paused at t={}", clock);
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            if (mode != RunMode.PAUSED) {
                throw new InvalidStateException("cannot resume: scheduler is " + mode.label());
            }
            mode = RunMode.RUNNING;
            resetPacingAnchor();
            changed.signalAll();
            logger.debug("scheduler resumed at t={}", clock);
        } finally {
            lock.unlock();
        }
    }

    /// Stops dispatch for good. Queued callbacks are discarded without firing and their
    /// tokens are cancelled.
    public void stop() {
        stop(() -> { });
    }

    /// Like [#stop()], running `onStopped` under the lock as the mode turns stopped, so
    /// readers holding the lock never see the stopped mode without its effects.
    public void stop(Runnable onStopped) {
        Thread toJoin;
        lock.lock();
        try {
            if (mode == RunMode.STOPPED) {
                throw new InvalidStateException("cannot stop: scheduler is " + (terminated ? "already stopped"
                    : "not started"));
            }
            mode = RunMode.STOPPED;
            terminated = true;
            int discarded = queue.size();
            for (Entry entry : queue) {
                entry.token().markCancelled();
            }
            queue.clear();
            pending.clear();
            changed.signalAll();
            toJoin = dispatcher;
            logger.debug("scheduler stopped at t={}, {} callbacks discarded", clock, discarded);
            onStopped.run();
        } finally {
            lock.unlock();
        }
        join(toJoin);
    }

    /// Stops the scheduler if it is running or paused. Safe to call repeatedly.
    @Override
    public void close() {
        close(() -> { });
    }

    /// Like [#close()]; `onStopped` runs under the lock only if this call stopped the scheduler.
    public void close(Runnable onStopped) {
        Thread toJoin = null;
        lock.lock();
        try {
            if (mode != RunMode.STOPPED) {
                toJoin = dispatcher;
                mode = RunMode.STOPPED;
                queue.forEach(e -> e.token().markCancelled());
                queue.clear();
                pending.clear();
                onStopped.run();
            }
            terminated = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        join(toJoin);
    }

    /// Dispatches every callback due at or before `target`, then moves the clock to
    /// `target` if it is still behind. Callbacks due later stay queued.
    ///
    /// @param target the virtual time to reach
    /// @param timeout the longest wall time to wait
    /// @return true if the clock reached `target`; false on timeout, interruption, or
    ///     when the scheduler was paused or stopped while waiting
    /// @throws InvalidStateException if the scheduler is not running
    public boolean advanceTo(double target, Duration timeout) {
        lock.lock();
        try {
            if (mode != RunMode.RUNNING) {
                throw new InvalidStateException("cannot advance: scheduler is " + mode.label());
            }
            if (target > stepTarget) {
                stepTarget = target;
            }
            changed.signalAll();
            long remaining = timeout.toNanos();
            while (true) {
                if (mode != RunMode.RUNNING) {
                    return false;
                }
                Entry next = queue.peek();
                if (next == null || next.time() > target) {
                    if (clock < target) {
                        clock = target;
                        resetPacingAnchor();
                    }
                    return true;
                }
                if (remaining <= 0) {
                    logger.warn("timed out advancing to t={}, clock at t={} with {} callbacks due",
                        target, clock, pending.size());
                    return false;
                }
                remaining = changed.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /// @return number of queued callbacks
    public int pendingCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public long dispatchedCount() {
        return dispatched.sum();
    }

    /// @return number of callbacks that threw
    public long failureCount() {
        return failures.sum();
    }

    private void runLoop() {
        lock.lock();
        try {
            while (!terminated) {
                if (mode != RunMode.RUNNING) {
                    changed.await();
                    continue;
                }
                Entry next = queue.peek();
                if (next == null || next.time() > horizon()) {
                    if (next != null && freeRunLimit > 0 && next.time() > freeRunLimit && !freeRunLimitReached) {
                        freeRunLimitReached = true;
                        logger.warn("free-running dispatch halted at the t={} limit, {} callbacks wait for stepping"
                            + " (next {} at t={})", freeRunLimit, queue.size(), next.token().label(), next.time());
                    }
                    changed.await();
                    continue;
                }
                if (pacingFactor > 0) {
                    long dueNanos = wallAnchorNanos
                        + (long) ((next.time() - virtualAnchor) * pacingFactor * TimeUnit.SECONDS.toNanos(1));
                    long waitNanos = dueNanos - System.nanoTime();
                    if (waitNanos > 0) {
                        changed.awaitNanos(waitNanos);
                        continue;
                    }
                }
                queue.poll();
                pending.remove(next.token().id());
                dispatch(next);
                changed.signalAll();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("dispatch thread interrupted at t={}", clock);
        } finally {
            lock.unlock();
        }
    }

    private void dispatch(Entry entry) {
        clock = Math.max(clock, entry.time());
        List<SimulationEvent> events;
        try {
            events = entry.action().fire(clock);
        } catch (RuntimeException e) {
            failures.increment();
            logger.error("callback {} failed at t={}: {}", entry.token(), clock, e.getMessage(), e);
            events = List.of();
        }
        dispatched.increment();
        if (events != null && !events.isEmpty()) {
            log.appendAll(new ArrayList<>(events));
        }
        ScheduleToken token = entry.token();
        if (entry.repeatInterval() > 0 && !token.isCancelled() && !terminated) {
            Entry again = new Entry(entry.time() + entry.repeatInterval(), nextSequence++, token, entry.action(),
                entry.repeatInterval());
            queue.add(again);
            pending.put(token.id(), again);
        } else {
            token.markDone();
        }
    }

    /// Whether a callback came due past the free-run limit, so time now moves only by stepping.
    public boolean isFreeRunLimitReached() {
        lock.lock();
        try {
            return freeRunLimitReached;
        } finally {
            lock.unlock();
        }
    }

    private double horizon() {
        return Math.max(Math.max(freeRunLimit, stepTarget), clock);
    }

    private void resetPacingAnchor() {
        wallAnchorNanos = System.nanoTime();
        virtualAnchor = clock;
    }

    private void join(Thread thread) {
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(JOIN_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record Entry(double time, long sequence, ScheduleToken token, ScheduledAction action,
                         double repeatInterval) {
    }
}
