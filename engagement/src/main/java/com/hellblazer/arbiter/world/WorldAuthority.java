/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Arbiter.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.arbiter.world;

import com.hellblazer.arbiter.common.FrameClock;
import com.hellblazer.arbiter.event.EngagementEvent.CombatStateChanged;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;
import java.util.function.Supplier;

/**
 * The single serialized writer of one world.
 * <p>
 * Each tick runs, in order:
 * <ol>
 *   <li>Advance the authoritative clock by one frame</li>
 *   <li>Drain every queued mutation, in submission order</li>
 *   <li>Engagement phase: revalidate ongoing engagements</li>
 *   <li>Sweep phase: expire disengage windows and publish state changes</li>
 * </ol>
 * The sweep therefore always observes refreshes submitted in the same tick. A failing mutation is logged with its
 * frame number and the tick continues.
 * <p>
 * Usage:
 * <pre>
 * var authority = new WorldAuthority(clock, frame -> coordinator.revalidateEngagements(), tracker::sweep);
 * authority.submit(() -> coordinator.reportResolution(attacker, victim));
 * authority.start(250);   // or drive advanceTick() directly
 * </pre>
 *
 * @author hal.hildebrand
 */
public class WorldAuthority implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorldAuthority.class);

    /**
     * Result of one tick.
     *
     * @param previousFrame    frame before the tick
     * @param frame            frame after the tick
     * @param time             authoritative time of the tick
     * @param mutationsApplied mutations that completed normally
     * @param mutationsFailed  mutations that threw
     * @param stateChanges     combat state changes applied by the sweep
     */
    public record TickResult(long previousFrame, long frame, double time, int mutationsApplied, int mutationsFailed,
                             List<CombatStateChanged> stateChanges) {
        public TickResult {
            stateChanges = List.copyOf(stateChanges);
        }
    }

    private final FrameClock                         clock;
    private final LongConsumer                       engagementPhase;
    private final Supplier<List<CombatStateChanged>> sweepPhase;
    private final Queue<Runnable>                    mutations = new ConcurrentLinkedQueue<>();
    private final Object                             tickLock  = new Object();
    private volatile ScheduledExecutorService        scheduler;
    private volatile Thread                          authorityThread;

    /**
     * @param clock           authoritative clock, advanced once per tick
     * @param engagementPhase called with the new frame after mutations are drained
     * @param sweepPhase      periodic engagement sweep, last step of every tick
     */
    public WorldAuthority(FrameClock clock, LongConsumer engagementPhase,
                          Supplier<List<CombatStateChanged>> sweepPhase) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.engagementPhase = Objects.requireNonNull(engagementPhase, "engagementPhase");
        this.sweepPhase = Objects.requireNonNull(sweepPhase, "sweepPhase");
    }

    /**
     * Queue a mutation for the next tick. Safe from any thread.
     */
    public void submit(Runnable mutation) {
        mutations.add(Objects.requireNonNull(mutation, "mutation"));
    }

    /**
     * Queue a computation for the next tick and receive its result.
     */
    public <T> CompletableFuture<T> call(Supplier<T> computation) {
        Objects.requireNonNull(computation, "computation");
        var future = new CompletableFuture<T>();
        mutations.add(() -> {
            try {
                future.complete(computation.get());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
                throw e;
            }
        });
        return future;
    }

    /**
     * Run one tick on the calling thread.
     */
    public TickResult advanceTick() {
        synchronized (tickLock) {
            authorityThread = Thread.currentThread();
            try {
                var previousFrame = clock.getCurrentFrame();
                var frame = clock.incrementFrame();

                int applied = 0;
                int failed = 0;
                Runnable mutation;
                while ((mutation = mutations.poll()) != null) {
                    try {
                        mutation.run();
                        applied++;
                    } catch (RuntimeException e) {
                        failed++;
                        log.error("Mutation failed in frame {}", frame, e);
                    }
                }

                engagementPhase.accept(frame);
                var changes = sweepPhase.get();
                return new TickResult(previousFrame, frame, clock.now(), applied, failed, changes);
            } finally {
                authorityThread = null;
            }
        }
    }

    /**
     * Tick at a fixed rate on a dedicated thread.
     */
    public synchronized void start(long intervalMillis) {
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("Interval must be positive: " + intervalMillis);
        }
        if (scheduler != null) {
            throw new IllegalStateException("World authority already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "world-authority");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::tick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("World authority started with {}ms ticks", intervalMillis);
    }

    public boolean isRunning() {
        var current = scheduler;
        return current != null && !current.isShutdown();
    }

    /**
     * @return true if the calling thread is currently running a tick
     */
    public boolean isAuthorityThread() {
        return Thread.currentThread() == authorityThread;
    }

    public int pendingMutations() {
        return mutations.size();
    }

    public FrameClock getClock() {
        return clock;
    }

    @Override
    public synchronized void close() {
        var current = scheduler;
        if (current == null) {
            return;
        }
        scheduler = null;
        current.shutdown();
        try {
            if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("World authority stopped at frame {}", clock.getCurrentFrame());
    }

    private void tick() {
        try {
            advanceTick();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the fixed-rate schedule
            log.error("Tick failed at frame {}", clock.getCurrentFrame(), e);
        }
    }

    @Override
    public String toString() {
        return String.format("WorldAuthority{frame=%d, pending=%d, running=%s}", clock.getCurrentFrame(),
                             mutations.size(), isRunning());
    }
}
