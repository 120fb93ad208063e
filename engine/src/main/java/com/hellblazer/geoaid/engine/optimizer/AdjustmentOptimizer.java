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
package com.hellblazer.geoaid.engine.optimizer;

import com.hellblazer.geoaid.figure.Figure;
import com.hellblazer.geoaid.figure.FigureTemplate;
import com.hellblazer.geoaid.figure.problem.ProblemDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2d;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

/**
 * Random adjustment search over point positions.
 * <p>
 * Every step, each of {@code workerCount} candidates perturbs all points by a Gaussian offset scaled by that
 * candidate's magnitude. Candidates are evaluated in parallel; the one with the lowest total constraint error (lowest
 * index on ties) replaces the current positions if it is strictly better. Each candidate draws from a random source
 * derived from the problem seed, the generation and the candidate index, so the outcome of N steps does not depend on
 * thread scheduling.
 *
 * @author hal.hildebrand
 */
public class AdjustmentOptimizer implements Optimizer {
    private static final Logger log = LoggerFactory.getLogger(AdjustmentOptimizer.class);

    private final ProblemDefinition problem;
    private final int               workerCount;
    private final long              seed;
    private final ForkJoinPool      pool;
    private       Point2d[]         positions;
    private       double            quality;
    private       long              generation;

    public AdjustmentOptimizer(ProblemDefinition problem, int workerCount) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
        }
        this.problem = problem;
        this.workerCount = workerCount;
        this.seed = problem.flags().seed();

        var entropy = new Random(seed);
        positions = new Point2d[problem.pointCount()];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = new Point2d(entropy.nextDouble() * 2.0 - 1.0, entropy.nextDouble() * 2.0 - 1.0);
        }
        quality = problem.quality(positions);
        pool = new ForkJoinPool(Math.min(workerCount, Runtime.getRuntime().availableProcessors()));
    }

    @Override
    public Magnitudes precompute(double bound) {
        if (!(bound > 0.0) || !Double.isFinite(bound)) {
            throw new IllegalArgumentException("bound must be a finite positive number: " + bound);
        }
        var values = new double[workerCount];
        for (int i = 0; i < workerCount; i++) {
            values[i] = bound * (i + 1) / workerCount;
        }
        return new Magnitudes(values);
    }

    @Override
    public void step(Magnitudes magnitudes) {
        if (magnitudes.size() != workerCount) {
            throw new IllegalArgumentException(
            "Expected " + workerCount + " magnitudes, got " + magnitudes.size());
        }
        var current = positions;
        var currentGeneration = generation;
        Candidate best;
        try {
            best = pool.submit(() -> IntStream.range(0, workerCount)
                                              .parallel()
                                              .mapToObj(i -> propose(current, currentGeneration, i,
                                                                     magnitudes.get(i)))
                                              .reduce(Candidate::better)
                                              .orElseThrow()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while evaluating candidates", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Candidate evaluation failed", e.getCause());
        }

        if (best.quality() < quality) {
            positions = best.positions();
            quality = best.quality();
            log.debug("Generation {}: candidate {} improved quality to {}", currentGeneration + 1, best.index(),
                      quality);
        }
        generation++;
    }

    @Override
    public Figure materialize(FigureTemplate template) {
        return template.materialize(positions, generation, quality);
    }

    @Override
    public void close() {
        pool.shutdown();
    }

    public long generation() {
        return generation;
    }

    public double quality() {
        return quality;
    }

    /**
     * Copy of the current positions.
     */
    public Point2d[] positions() {
        var copy = new Point2d[positions.length];
        for (int i = 0; i < positions.length; i++) {
            copy[i] = new Point2d(positions[i]);
        }
        return copy;
    }

    private Candidate propose(Point2d[] current, long currentGeneration, int index, double magnitude) {
        var random = new Random(mix(seed, currentGeneration, index));
        var proposal = new Point2d[current.length];
        for (int i = 0; i < current.length; i++) {
            proposal[i] = new Point2d(current[i].x + random.nextGaussian() * magnitude,
                                      current[i].y + random.nextGaussian() * magnitude);
        }
        return new Candidate(index, proposal, problem.quality(proposal));
    }

    private static long mix(long seed, long generation, int index) {
        var h = seed * 0x9E3779B97F4A7C15L + generation;
        h = (h ^ (h >>> 30)) * 0xBF58476D1CE4E5B9L + index;
        h = (h ^ (h >>> 27)) * 0x94D049BB133111EBL;
        return h ^ (h >>> 31);
    }

    private record Candidate(int index, Point2d[] positions, double quality) {

        Candidate better(Candidate other) {
            var order = Double.compare(quality, other.quality);
            if (order == 0) {
                return index <= other.index ? this : other;
            }
            return order < 0 ? this : other;
        }
    }
}
