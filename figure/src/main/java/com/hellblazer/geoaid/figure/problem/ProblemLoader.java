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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.geoaid.figure.FigureTemplate;
import com.hellblazer.geoaid.figure.FigureTemplate.CircleElement;
import com.hellblazer.geoaid.figure.FigureTemplate.Element;
import com.hellblazer.geoaid.figure.FigureTemplate.LineElement;
import com.hellblazer.geoaid.figure.FigureTemplate.PointElement;
import com.hellblazer.geoaid.figure.FigureTemplate.RayElement;
import com.hellblazer.geoaid.figure.FigureTemplate.SegmentElement;
import com.hellblazer.geoaid.figure.GenerationFlags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link ProblemDefinition}s from JSON documents.
 * <p>
 * Document layout:
 * <pre>
 * {
 *   "flags":       { "margin": 0.1, "showLabels": true, "seed": 7 },
 *   "points":      [ "A", "B", "C" ],
 *   "constraints": [ { "type": "distance", "points": ["A", "B"], "value": 1.0 }, ... ],
 *   "figure":      [ { "type": "segment", "points": ["A", "B"], "label": "c" }, ... ]
 * }
 * </pre>
 * Constraint types are {@code distance}, {@code angle} (degrees, vertex in the middle), {@code collinear} and
 * {@code equal-distance}. Figure element types are {@code point}, {@code line}, {@code segment}, {@code ray} and
 * {@code circle}.
 *
 * @author hal.hildebrand
 */
public class ProblemLoader {
    private static final Logger log = LoggerFactory.getLogger(ProblemLoader.class);

    private final ObjectMapper objectMapper;

    public ProblemLoader() {
        this(new ObjectMapper());
    }

    public ProblemLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ProblemDefinition load(Path file) throws ProblemDefinitionException {
        if (file == null) {
            throw new ProblemDefinitionException("No problem file selected");
        }
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProblemDefinitionException("Cannot read " + file + ": " + e.getMessage(), e);
        }
        var problem = parse(text);
        log.info("Loaded problem {}: {} points, {} constraints, {} figure elements", file, problem.pointCount(),
                 problem.constraints().size(), problem.template().elements().size());
        return problem;
    }

    public ProblemDefinition parse(String text) throws ProblemDefinitionException {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProblemDefinitionException("Malformed problem document: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProblemDefinitionException("Problem document must be a JSON object");
        }

        var flags = parseFlags(root.path("flags"));
        var points = parsePoints(root.path("points"));

        var constraints = new ArrayList<Constraint>();
        for (var node : array(root, "constraints")) {
            constraints.add(parseConstraint(node, points));
        }

        var elements = new ArrayList<Element>();
        for (var node : array(root, "figure")) {
            elements.add(parseElement(node, points));
        }

        return new ProblemDefinition(flags, new ArrayList<>(points.keySet()), constraints,
                                     new FigureTemplate(elements));
    }

    private List<JsonNode> array(JsonNode root, String field) throws ProblemDefinitionException {
        var node = root.path(field);
        if (node.isMissingNode()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ProblemDefinitionException("'" + field + "' must be an array");
        }
        var result = new ArrayList<JsonNode>();
        node.forEach(result::add);
        return result;
    }

    private GenerationFlags parseFlags(JsonNode node) throws ProblemDefinitionException {
        var flags = GenerationFlags.DEFAULT;
        if (node.isMissingNode()) {
            return flags;
        }
        if (!node.isObject()) {
            throw new ProblemDefinitionException("'flags' must be an object");
        }
        try {
            if (node.has("margin")) {
                flags = flags.withMargin(number(node, "margin"));
            }
        } catch (IllegalArgumentException e) {
            throw new ProblemDefinitionException(e.getMessage(), e);
        }
        if (node.has("showLabels")) {
            var show = node.get("showLabels");
            if (!show.isBoolean()) {
                throw new ProblemDefinitionException("'showLabels' must be a boolean");
            }
            flags = flags.withShowLabels(show.booleanValue());
        }
        if (node.has("seed")) {
            var seed = node.get("seed");
            if (!seed.canConvertToLong() || !seed.isIntegralNumber()) {
                throw new ProblemDefinitionException("'seed' must be an integer");
            }
            flags = flags.withSeed(seed.longValue());
        }
        return flags;
    }

    private Map<String, Integer> parsePoints(JsonNode node) throws ProblemDefinitionException {
        if (!node.isArray() || node.isEmpty()) {
            throw new ProblemDefinitionException("'points' must be a non-empty array of names");
        }
        var points = new LinkedHashMap<String, Integer>();
        for (var name : node) {
            if (!name.isTextual() || name.asText().isBlank()) {
                throw new ProblemDefinitionException("Point names must be non-blank strings");
            }
            if (points.putIfAbsent(name.asText(), points.size()) != null) {
                throw new ProblemDefinitionException("Duplicate point: " + name.asText());
            }
        }
        return points;
    }

    private Constraint parseConstraint(JsonNode node, Map<String, Integer> points) throws ProblemDefinitionException {
        var type = type(node);
        switch (type) {
        case "distance": {
            var refs = refs(node, points, 2);
            var value = number(node, "value");
            if (value < 0.0) {
                throw new ProblemDefinitionException("distance value must be non-negative: " + value);
            }
            return new Constraint.Distance(refs[0], refs[1], value);
        }
        case "angle": {
            var refs = refs(node, points, 3);
            var degrees = number(node, "degrees");
            if (degrees < 0.0 || degrees > 180.0) {
                throw new ProblemDefinitionException("angle must be within [0, 180] degrees: " + degrees);
            }
            return new Constraint.Angle(refs[0], refs[1], refs[2], Math.toRadians(degrees));
        }
        case "collinear": {
            var refs = refs(node, points, 3);
            return new Constraint.Collinear(refs[0], refs[1], refs[2]);
        }
        case "equal-distance": {
            var refs = refs(node, points, 4);
            return new Constraint.EqualDistance(refs[0], refs[1], refs[2], refs[3]);
        }
        default:
            throw new ProblemDefinitionException("Unknown constraint type: " + type);
        }
    }

    private Element parseElement(JsonNode node, Map<String, Integer> points) throws ProblemDefinitionException {
        var type = type(node);
        var label = node.hasNonNull("label") ? node.get("label").asText() : null;
        switch (type) {
        case "point": {
            var dot = !node.has("dot") || node.get("dot").asBoolean(true);
            return new PointElement(ref(node.path("point"), points), label, dot);
        }
        case "line": {
            var refs = refs(node, points, 2);
            return new LineElement(refs[0], refs[1], label);
        }
        case "segment": {
            var refs = refs(node, points, 2);
            return new SegmentElement(refs[0], refs[1], label);
        }
        case "ray": {
            var refs = refs(node, points, 2);
            return new RayElement(refs[0], refs[1], label);
        }
        case "circle":
            return new CircleElement(ref(node.path("center"), points), ref(node.path("through"), points), label);
        default:
            throw new ProblemDefinitionException("Unknown figure element type: " + type);
        }
    }

    private String type(JsonNode node) throws ProblemDefinitionException {
        if (!node.isObject() || !node.path("type").isTextual()) {
            throw new ProblemDefinitionException("Every entry needs a 'type': " + node);
        }
        return node.get("type").asText();
    }

    private double number(JsonNode node, String field) throws ProblemDefinitionException {
        var value = node.path(field);
        if (!value.isNumber() || !Double.isFinite(value.doubleValue())) {
            throw new ProblemDefinitionException("'" + field + "' must be a finite number: " + node);
        }
        return value.doubleValue();
    }

    private int[] refs(JsonNode node, Map<String, Integer> points, int arity) throws ProblemDefinitionException {
        var names = node.path("points");
        if (!names.isArray() || names.size() != arity) {
            throw new ProblemDefinitionException(
            "'" + node.path("type").asText() + "' needs exactly " + arity + " points: " + node);
        }
        var result = new int[arity];
        for (int i = 0; i < arity; i++) {
            result[i] = ref(names.get(i), points);
        }
        return result;
    }

    private int ref(JsonNode name, Map<String, Integer> points) throws ProblemDefinitionException {
        if (!name.isTextual()) {
            throw new ProblemDefinitionException("Point reference must be a name: " + name);
        }
        var index = points.get(name.asText());
        if (index == null) {
            throw new ProblemDefinitionException("Unknown point: " + name.asText());
        }
        return index;
    }
}
