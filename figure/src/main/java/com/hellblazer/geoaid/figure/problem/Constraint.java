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

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;

/**
 * A geometric requirement on the problem's points. Each constraint reports a non-negative squared error for a set of
 * positions; zero means the constraint is satisfied.
 *
 * @author hal.hildebrand
 */
public sealed interface Constraint permits Constraint.Distance, Constraint.Angle, Constraint.Collinear,
                                           Constraint.EqualDistance {

    double error(Point2d[] positions);

    int[] pointIndices();

    /**
     * |ab| = value
     */
    record Distance(int a, int b, double value) implements Constraint {
        @Override
        public double error(Point2d[] positions) {
            var delta = positions[a].distance(positions[b]) - value;
            return delta * delta;
        }

        @Override
        public int[] pointIndices() {
            return new int[] { a, b };
        }
    }

    /**
     * The angle a-vertex-c equals {@code radians}, measured in [0, pi].
     */
    record Angle(int a, int vertex, int c, double radians) implements Constraint {
        @Override
        public double error(Point2d[] positions) {
            var u = new Vector2d();
            u.sub(positions[a], positions[vertex]);
            var v = new Vector2d();
            v.sub(positions[c], positions[vertex]);
            if (u.lengthSquared() == 0.0 || v.lengthSquared() == 0.0) {
                return Math.PI * Math.PI;
            }
            var delta = u.angle(v) - radians;
            return delta * delta;
        }

        @Override
        public int[] pointIndices() {
            return new int[] { a, vertex, c };
        }
    }

    /**
     * a, b and c lie on one line. The error is the squared sine of the angle at {@code a}.
     */
    record Collinear(int a, int b, int c) implements Constraint {
        @Override
        public double error(Point2d[] positions) {
            var u = new Vector2d();
            u.sub(positions[b], positions[a]);
            var v = new Vector2d();
            v.sub(positions[c], positions[a]);
            var norm = u.length() * v.length();
            if (norm == 0.0) {
                return 0.0;
            }
            var sine = (u.x * v.y - u.y * v.x) / norm;
            return sine * sine;
        }

        @Override
        public int[] pointIndices() {
            return new int[] { a, b, c };
        }
    }

    /**
     * |ab| = |cd|
     */
    record EqualDistance(int a, int b, int c, int d) implements Constraint {
        @Override
        public double error(Point2d[] positions) {
            var delta = positions[a].distance(positions[b]) - positions[c].distance(positions[d]);
            return delta * delta;
        }

        @Override
        public int[] pointIndices() {
            return new int[] { a, b, c, d };
        }
    }
}
