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

import com.hellblazer.geoaid.engine.optimizer.Magnitudes;
import com.hellblazer.geoaid.engine.optimizer.Optimizer;
import com.hellblazer.geoaid.figure.Figure;
import com.hellblazer.geoaid.figure.FigureTemplate;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Optimizer double that records calls. When gated, every step waits for a permit.
 *
 * @author hal.hildebrand
 */
class CountingOptimizer implements Optimizer {
    final AtomicInteger  precomputes = new AtomicInteger();
    final AtomicInteger  steps       = new AtomicInteger();
    final AtomicInteger  closes      = new AtomicInteger();
    final CountDownLatch stepStarted = new CountDownLatch(1);
    private final Semaphore gate;

    CountingOptimizer() {
        this(null);
    }

    CountingOptimizer(Semaphore gate) {
        this.gate = gate;
    }

    @Override
    public Magnitudes precompute(double bound) {
        precomputes.incrementAndGet();
        return new Magnitudes(new double[] { bound });
    }

    @Override
    public void step(Magnitudes magnitudes) {
        stepStarted.countDown();
        if (gate != null) {
            gate.acquireUninterruptibly();
        }
        steps.incrementAndGet();
    }

    @Override
    public Figure materialize(FigureTemplate template) {
        return new Figure(List.of(), steps.get(), 1.0 / (1 + steps.get()));
    }

    @Override
    public void close() {
        closes.incrementAndGet();
    }
}
