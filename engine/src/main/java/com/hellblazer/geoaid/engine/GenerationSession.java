/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Geo-AID Debugger.
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
package com.hellblazer.geoaid.engine;

import com.hellblazer.geoaid.engine.optimizer.AdjustmentOptimizer;
import com.hellblazer.geoaid.engine.optimizer.OptimizerFactory;
import com.hellblazer.geoaid.engine.startup.StartupParameters;
import com.hellblazer.geoaid.figure.Figure;
import com.hellblazer.geoaid.figure.GenerationFlags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One active generation run: the control channel's sending side, the shared flags, the figure slot and the worker
 * thread.
 * <p>
 * {@link #close()} is the only path that sends {@link ControlMessage#QUIT}; it is idempotent and every owner must
 * call it, typically through try-with-resources or the control panel's quit action. The worker finishes any step in
 * progress and then exits; joining it is optional. The worker is a daemon thread, so a session that is never closed
 * lives until process exit.
 *
 * @author hal.hildebrand
 */
public class GenerationSession implements AutoCloseable {
    private static final Logger        log      = LoggerFactory.getLogger(GenerationSession.class);
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final ControlChannel   channel;
    private final GenerationFlags  flags;
    private final LatestFigureSlot slot;
    private final Thread           worker;
    private final AtomicBoolean    closed = new AtomicBoolean();

    private GenerationSession(ControlChannel channel, GenerationFlags flags, LatestFigureSlot slot, Thread worker) {
        this.channel = channel;
        this.flags = flags;
        this.slot = slot;
        this.worker = worker;
    }

    public static GenerationSession start(StartupParameters parameters) {
        return start(parameters, AdjustmentOptimizer::new);
    }

    /**
     * Build the channel, slot and optimizer and start the worker thread.
     */
    public static GenerationSession start(StartupParameters parameters, OptimizerFactory optimizers) {
        return start(parameters, optimizers, new LatestFigureSlot(Figure.empty()));
    }

    /**
     * Start a session that publishes into the given slot.
     */
    public static GenerationSession start(StartupParameters parameters, OptimizerFactory optimizers,
                                          LatestFigureSlot slot) {
        var problem = parameters.problem();
        var optimizer = optimizers.create(problem, parameters.workerCount());
        var channel = new ControlChannel();
        var worker = new GenerationWorker(optimizer, channel, slot, problem.template(), parameters.bound());

        var thread = new Thread(worker, "generation-worker-" + SEQUENCE.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(
        (t, e) -> log.error("Generation worker {} terminated abnormally", t.getName(), e));
        thread.start();
        log.info("Started {}: {} workers, max adjustment {}", thread.getName(), parameters.workerCount(),
                 parameters.bound());
        return new GenerationSession(channel, problem.flags(), slot, thread);
    }

    /**
     * Request one step.
     *
     * @return false if the session is already closed
     * @throws IllegalStateException if the worker has stopped
     */
    public boolean next() {
        return channel.send(ControlMessage.NEXT);
    }

    /**
     * Request one step only if no earlier step is still in flight.
     *
     * @return true if a step was requested
     * @throws IllegalStateException if the worker has stopped
     */
    public boolean nextIfIdle() {
        if (!channel.isIdle() && !channel.isDisconnected()) {
            return false;
        }
        return next();
    }

    public boolean isIdle() {
        return channel.isIdle();
    }

    public int inFlight() {
        return channel.inFlight();
    }

    public GenerationFlags flags() {
        return flags;
    }

    /**
     * The most recently published figure, or {@link Figure#empty()} before the first step completes.
     */
    public Figure snapshot() {
        return slot.snapshot();
    }

    public LatestFigureSlot slot() {
        return slot;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean isWorkerAlive() {
        return worker.isAlive();
    }

    /**
     * Wait for the worker thread to exit.
     *
     * @return true if the worker has terminated
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        worker.join(Math.max(1L, timeout.toMillis()));
        return !worker.isAlive();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            channel.send(ControlMessage.QUIT);
            log.info("Closed {}", worker.getName());
        }
    }
}
