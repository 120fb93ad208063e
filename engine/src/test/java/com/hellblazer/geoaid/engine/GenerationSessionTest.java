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
import com.hellblazer.geoaid.engine.optimizer.Magnitudes;
import com.hellblazer.geoaid.engine.startup.StartupParameters;
import com.hellblazer.geoaid.engine.startup.StartupValidator;
import com.hellblazer.geoaid.figure.Figure;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end tests for GenerationSession.
 *
 * @author hal.hildebrand
 */
class GenerationSessionTest {

    @Test
    void testThreeStepsMatchSequentialReference() throws Exception {
        var validation = new StartupValidator().validate(TestProblems.path("equilateral.json"), "4", "0.5");
        assertTrue(validation.isValid(), validation::toString);
        var parameters = validation.parameters().orElseThrow();

        try (var session = GenerationSession.start(parameters)) {
            assertTrue(session.next());
            assertTrue(session.next());
            assertTrue(session.next());
            GenerationWorkerTest.awaitIdle(session::isIdle);

            var problem = parameters.problem();
            try (var reference = new AdjustmentOptimizer(problem, 4)) {
                var magnitudes = reference.precompute(0.5);
                for (int i = 0; i < 3; i++) {
                    reference.step(magnitudes);
                }
                assertEquals(reference.materialize(problem.template()), session.snapshot());
            }
            assertEquals(3, session.snapshot().generation());
            assertEquals(3, session.slot().version());
            assertEquals(problem.flags(), session.flags());
        }
    }

    @Test
    void testIdleSessionKeepsEmptyFigure() throws Exception {
        var optimizer = new CountingOptimizer();
        try (var session = GenerationSession.start(parameters(1), (p, w) -> optimizer)) {
            Thread.sleep(50);
            assertEquals(Figure.empty(), session.snapshot());
            assertEquals(0, session.slot().version());
            assertTrue(session.isIdle());
            assertEquals(0, optimizer.steps.get());
        }
    }

    @Test
    void testCloseTerminatesWorkerAndRejectsFurtherSteps() throws Exception {
        var optimizer = new CountingOptimizer();
        var session = GenerationSession.start(parameters(2), (p, w) -> optimizer);
        assertTrue(session.next());
        GenerationWorkerTest.awaitIdle(session::isIdle);
        var version = session.slot().version();

        session.close();
        assertTrue(session.isClosed());
        assertTrue(session.awaitTermination(Duration.ofSeconds(5)));
        assertFalse(session.isWorkerAlive());
        assertEquals(1, optimizer.closes.get());

        assertFalse(session.next());
        assertFalse(session.nextIfIdle());
        assertEquals(version, session.slot().version());

        session.close();
        assertEquals(1, optimizer.closes.get());
    }

    @Test
    void testNextIfIdleKeepsOneStepInFlight() throws Exception {
        var gate = new Semaphore(0);
        var optimizer = new CountingOptimizer(gate);
        try (var session = GenerationSession.start(parameters(1), (p, w) -> optimizer)) {
            assertTrue(session.nextIfIdle());
            assertTrue(optimizer.stepStarted.await(5, TimeUnit.SECONDS));

            assertFalse(session.nextIfIdle());
            assertFalse(session.nextIfIdle());
            assertEquals(1, session.inFlight());

            gate.release();
            GenerationWorkerTest.awaitIdle(session::isIdle);
            assertEquals(1, optimizer.steps.get());
            assertEquals(1, session.snapshot().generation());

            gate.release();
            assertTrue(session.nextIfIdle());
            GenerationWorkerTest.awaitIdle(session::isIdle);
            assertEquals(2, optimizer.steps.get());
        }
    }

    @Test
    void testCloseDuringStepLetsStepFinish() throws Exception {
        var gate = new Semaphore(0);
        var optimizer = new CountingOptimizer(gate);
        var session = GenerationSession.start(parameters(1), (p, w) -> optimizer);
        assertTrue(session.next());
        assertTrue(optimizer.stepStarted.await(5, TimeUnit.SECONDS));
        assertTrue(session.next());

        session.close();
        gate.release(2);

        assertTrue(session.awaitTermination(Duration.ofSeconds(5)));
        assertEquals(1, optimizer.steps.get());
        assertEquals(1, session.slot().version());
        assertEquals(1, optimizer.closes.get());
    }

    @Test
    void testDeadWorkerRejectsStepsLoudly() throws Exception {
        var optimizer = new CountingOptimizer() {
            @Override
            public void step(Magnitudes magnitudes) {
                throw new IllegalStateException("step failed");
            }
        };
        var session = GenerationSession.start(parameters(1), (p, w) -> optimizer);
        assertTrue(session.next());
        assertTrue(session.awaitTermination(Duration.ofSeconds(5)));
        assertFalse(session.isWorkerAlive());

        assertThrows(IllegalStateException.class, session::next);
        assertThrows(IllegalStateException.class, session::nextIfIdle);
        assertEquals(0, session.inFlight());
        assertEquals(0, session.slot().version());

        session.close();
        assertTrue(session.isClosed());
        assertFalse(session.next());
        assertEquals(1, optimizer.closes.get());
    }

    @Test
    void testPublishesIntoSuppliedSlot() throws Exception {
        var slot = new LatestFigureSlot();
        try (var session = GenerationSession.start(parameters(1), (p, w) -> new CountingOptimizer(), slot)) {
            assertSame(slot, session.slot());
            session.next();
            GenerationWorkerTest.awaitIdle(session::isIdle);
            assertEquals(1, slot.version());
        }
    }

    private static StartupParameters parameters(int workers) {
        return new StartupParameters(TestProblems.equilateral(), workers, 0.5);
    }
}
