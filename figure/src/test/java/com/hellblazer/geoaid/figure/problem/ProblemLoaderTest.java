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
package com.hellblazer.geoaid.figure.problem;

import com.hellblazer.geoaid.figure.FigureTemplate.CircleElement;
import com.hellblazer.geoaid.figure.FigureTemplate.PointElement;
import com.hellblazer.geoaid.figure.FigureTemplate.SegmentElement;
import com.hellblazer.geoaid.figure.GenerationFlags;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProblemLoader - JSON problem documents to problem definitions.
 *
 * @author hal.hildebrand
 */
class ProblemLoaderTest {

    private final ProblemLoader loader = new ProblemLoader();

    @Test
    void testLoadResourceFile() throws Exception {
        var path = Path.of(getClass().getResource("/problems/equilateral.json").toURI());
        var problem = loader.load(path);

        assertEquals(List.of("A", "B", "C", "O"), problem.pointNames());
        assertEquals(5, problem.constraints().size());
        assertEquals(8, problem.template().elements().size());
        assertEquals(new GenerationFlags(0.1, true, 7), problem.flags());

        assertEquals(new PointElement(0, "A", true), problem.template().elements().get(0));
        assertEquals(new SegmentElement(0, 1, "c"), problem.template().elements().get(4));
        assertEquals(new CircleElement(3, 0, "circumcircle"), problem.template().elements().get(7));
    }

    @Test
    void testSampleProblemsLoad() throws Exception {
        var samples = Path.of("..", "examples");
        try (var files = Files.list(samples)) {
            var names = files.filter(f -> f.toString().endsWith(".json")).sorted().toList();
            assertEquals(2, names.size());
            for (var file : names) {
                var problem = loader.load(file);
                assertFalse(problem.template().elements().isEmpty(), file.toString());
                assertFalse(problem.constraints().isEmpty(), file.toString());
            }
        }
    }

    @Test
    void testConstraintTypes() throws Exception {
        var problem = loader.parse("""
            {
              "points": ["A", "B", "C", "D"],
              "constraints": [
                { "type": "distance", "points": ["A", "B"], "value": 2.5 },
                { "type": "angle", "points": ["B", "A", "C"], "degrees": 90 },
                { "type": "collinear", "points": ["A", "B", "D"] },
                { "type": "equal-distance", "points": ["A", "B", "C", "D"] }
              ]
            }
            """);

        assertEquals(new Constraint.Distance(0, 1, 2.5), problem.constraints().get(0));
        assertEquals(new Constraint.Angle(1, 0, 2, Math.PI / 2), problem.constraints().get(1));
        assertEquals(new Constraint.Collinear(0, 1, 3), problem.constraints().get(2));
        assertEquals(new Constraint.EqualDistance(0, 1, 2, 3), problem.constraints().get(3));
    }

    @Test
    void testDefaultsWhenFlagsMissing() throws Exception {
        var problem = loader.parse("{ \"points\": [\"A\"], \"figure\": [ { \"type\": \"point\", \"point\": \"A\" } ] }");

        assertEquals(GenerationFlags.DEFAULT, problem.flags());
        assertTrue(problem.constraints().isEmpty());
        var point = (PointElement) problem.template().elements().get(0);
        assertNull(point.label());
        assertTrue(point.displayDot());
    }

    @Test
    void testPointDotCanBeHidden() throws Exception {
        var problem = loader.parse(
        "{ \"points\": [\"A\"], \"figure\": [ { \"type\": \"point\", \"point\": \"A\", \"dot\": false } ] }");

        assertFalse(((PointElement) problem.template().elements().get(0)).displayDot());
    }

    @Test
    void testMalformedJson() {
        var e = assertThrows(ProblemDefinitionException.class, () -> loader.parse("{ \"points\": [ "));
        assertTrue(e.getMessage().startsWith("Malformed"), e.getMessage());
    }

    @Test
    void testUnknownPoint() {
        var e = assertThrows(ProblemDefinitionException.class, () -> loader.parse(
        "{ \"points\": [\"A\"], \"figure\": [ { \"type\": \"segment\", \"points\": [\"A\", \"Z\"] } ] }"));
        assertEquals("Unknown point: Z", e.getMessage());
    }

    @Test
    void testDuplicatePoint() {
        var e = assertThrows(ProblemDefinitionException.class, () -> loader.parse("{ \"points\": [\"A\", \"A\"] }"));
        assertEquals("Duplicate point: A", e.getMessage());
    }

    @Test
    void testWrongArity() {
        assertThrows(ProblemDefinitionException.class, () -> loader.parse(
        "{ \"points\": [\"A\", \"B\"], \"constraints\": [ { \"type\": \"collinear\", \"points\": [\"A\", \"B\"] } ] }"));
    }

    @Test
    void testUnknownTypes() {
        assertThrows(ProblemDefinitionException.class, () -> loader.parse(
        "{ \"points\": [\"A\"], \"figure\": [ { \"type\": \"hexagon\", \"point\": \"A\" } ] }"));
        assertThrows(ProblemDefinitionException.class, () -> loader.parse(
        "{ \"points\": [\"A\"], \"constraints\": [ { \"type\": \"tangent\", \"points\": [\"A\"] } ] }"));
    }

    @Test
    void testInvalidFlags() {
        assertThrows(ProblemDefinitionException.class,
                     () -> loader.parse("{ \"flags\": { \"margin\": 0.7 }, \"points\": [\"A\"] }"));
        assertThrows(ProblemDefinitionException.class,
                     () -> loader.parse("{ \"flags\": { \"seed\": 1.5 }, \"points\": [\"A\"] }"));
        assertThrows(ProblemDefinitionException.class,
                     () -> loader.parse("{ \"flags\": { \"showLabels\": \"yes\" }, \"points\": [\"A\"] }"));
    }

    @Test
    void testMissingPoints() {
        assertThrows(ProblemDefinitionException.class, () -> loader.parse("{ \"points\": [] }"));
        assertThrows(ProblemDefinitionException.class, () -> loader.parse("[1, 2, 3]"));
    }

    @Test
    void testMissingFile() {
        assertThrows(ProblemDefinitionException.class, () -> loader.load(Path.of("does-not-exist.json")));
        assertThrows(ProblemDefinitionException.class, () -> loader.load(null));
    }
}
