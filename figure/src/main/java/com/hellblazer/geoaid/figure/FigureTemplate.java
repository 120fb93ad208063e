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
package com.hellblazer.geoaid.figure;

import com.hellblazer.geoaid.figure.FigureItem.CircleItem;
import com.hellblazer.geoaid.figure.FigureItem.LineItem;
import com.hellblazer.geoaid.figure.FigureItem.PointItem;
import com.hellblazer.geoaid.figure.FigureItem.RayItem;
import com.hellblazer.geoaid.figure.FigureItem.SegmentItem;

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.List;

/**
 * The shape of the figure to display, with every element referring to the problem's points by index. Combined with
 * a set of point positions it materializes into a {@link Figure}.
 *
 * @author hal.hildebrand
 */
public record FigureTemplate(List<Element> elements) {

    public FigureTemplate {
        elements = List.copyOf(elements);
    }

    /**
     * Resolve every element against the given positions.
     *
     * @param positions  point positions, indexed as in the problem definition
     * @param generation step count recorded on the figure
     * @param quality    constraint error recorded on the figure
     */
    public Figure materialize(Point2d[] positions, long generation, double quality) {
        var items = new ArrayList<FigureItem>(elements.size());
        for (var element : elements) {
            items.add(element.resolve(positions));
        }
        return new Figure(items, generation, quality);
    }

    /**
     * The highest point index referenced, or -1 for an empty template.
     */
    public int maxPointIndex() {
        var max = -1;
        for (var element : elements) {
            for (var index : element.pointIndices()) {
                max = Math.max(max, index);
            }
        }
        return max;
    }

    public sealed interface Element permits PointElement, LineElement, SegmentElement, RayElement, CircleElement {

        int[] pointIndices();

        FigureItem resolve(Point2d[] positions);
    }

    public record PointElement(int point, String label, boolean displayDot) implements Element {
        @Override
        public int[] pointIndices() {
            return new int[] { point };
        }

        @Override
        public FigureItem resolve(Point2d[] positions) {
            return new PointItem(Position.of(positions[point]), label, displayDot);
        }
    }

    public record LineElement(int a, int b, String label) implements Element {
        @Override
        public int[] pointIndices() {
            return new int[] { a, b };
        }

        @Override
        public FigureItem resolve(Point2d[] positions) {
            return new LineItem(Position.of(positions[a]), Position.of(positions[b]), label);
        }
    }

    public record SegmentElement(int a, int b, String label) implements Element {
        @Override
        public int[] pointIndices() {
            return new int[] { a, b };
        }

        @Override
        public FigureItem resolve(Point2d[] positions) {
            return new SegmentItem(Position.of(positions[a]), Position.of(positions[b]), label);
        }
    }

    public record RayElement(int origin, int through, String label) implements Element {
        @Override
        public int[] pointIndices() {
            return new int[] { origin, through };
        }

        @Override
        public FigureItem resolve(Point2d[] positions) {
            return new RayItem(Position.of(positions[origin]), Position.of(positions[through]), label);
        }
    }

    /**
     * A circle centered on one point and passing through another.
     */
    public record CircleElement(int center, int through, String label) implements Element {
        @Override
        public int[] pointIndices() {
            return new int[] { center, through };
        }

        @Override
        public FigureItem resolve(Point2d[] positions) {
            var c = positions[center];
            return new CircleItem(Position.of(c), c.distance(positions[through]), label);
        }
    }
}
