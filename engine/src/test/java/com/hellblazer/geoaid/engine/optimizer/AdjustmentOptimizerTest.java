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

import com.hellblazer.geoaid.engine.TestProblems;
import com.hellblazer.geoaid.figure.problem.ProblemDefinition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AdjustmentOptimizer.
 *
 * @author hal.hildebrand
 */
class AdjustmentOptimizerTest {

    @Test
    void testPrecomputeSpreadsMagnitudesUpToBound() {
        try (var optimizer = new AdjustmentOptimizer(TestProblems.equilateral(), 4)) {
            var magnitudes = optimizer.precompute(0.5);

            assertEquals(4, magnitudes.size());
            assertEquals(0.125, magnitudes.get(0), 1e-12);
            assertEquals(0.25, magnitudes.get(1), 1e-12);
            assertEquals(0.375, magnitudes.get(2), 1e-12);
            assertEquals(0.5, magnitudes.get(3), 1e-12);
        }
    }

    @Test
    void testRejectsInvalidArguments() {
        var problem = TestProblems.equilateral();
        assertThrows(IllegalArgumentException.class, () -> new AdjustmentOptimizer(problem, 0));
        try (var optimizer = new AdjustmentOptimizer(problem, 2)) {
            assertThrows(IllegalArgumentException.class, () -> optimizer.precompute(0.0));
            assertThrows(IllegalArgumentException.class, () -> optimizer.precompute(-1.0));
            assertThrows(IllegalArgumentException.class, () -> optimizer.precompute(Double.NaN));
            assertThrows(IllegalArgumentException.class,
                         () -> optimizer.step(new Magnitudes(new double[] { 0.1, 0.2, 0.3 })));
        }
    }

    @Test
    void testStepsAreDeterministic() {
        var problem = TestProblems.equilateral();
        try (var first = new AdjustmentOptimizer(problem, 16); var second = new AdjustmentOptimizer(problem, 16)) {
            var m1 = first.precompute(0.5);
            var m2 = second.precompute(0.5);
            for (int i = 0; i < 25; i++) {
                first.step(m1);
                second.step(m2);
            }
            assertEquals(first.materialize(problem.template()), second.materialize(problem.template()));
        }
    }

    @Test
    void testQualityNeverGetsWorse() {
        var problem = TestProblems.equilateral();
        try (var optimizer = new AdjustmentOptimizer(problem, 32)) {
            var magnitudes = optimizer.precompute(0.5);
            var initial = optimizer.quality();
            var previous = initial;
            for (int i = 0; i < 200; i++) {
                optimizer.step(magnitudes);
                assertTrue(optimizer.quality() <= previous);
                previous = optimizer.quality();
            }
            assertEquals(200, optimizer.generation());
            assertTrue(optimizer.quality() < initial, "200 steps should improve a random start");
            assertEquals(problem.quality(optimizer.positions()), optimizer.quality(), 1e-12);
        }
    }

    @Test
    void testMaterializeRecordsGeneration() {
        var problem = TestProblems.equilateral();
        try (var optimizer = new AdjustmentOptimizer(problem, 4)) {
            var magnitudes = optimizer.precompute(0.5);
            optimizer.step(magnitudes);
            optimizer.step(magnitudes);

            var figure = optimizer.materialize(problem.template());
            assertEquals(2, figure.generation());
            assertEquals(optimizer.quality(), figure.quality());
            assertEquals(problem.template().elements().size(), figure.items().size());
        }
    }

    @Test
    void testSeedChangesStartingPositions() {
        var problem = TestProblems.equilateral();
        var reseeded = new ProblemDefinition(
        problem.flags().withSeed(problem.flags().seed() + 1), problem.pointNames(), problem.constraints(),
        problem.template());
        try (var a = new AdjustmentOptimizer(problem, 1); var b = new AdjustmentOptimizer(reseeded, 1)) {
            assertNotEquals(a.materialize(problem.template()), b.materialize(problem.template()));
        }
    }
}
