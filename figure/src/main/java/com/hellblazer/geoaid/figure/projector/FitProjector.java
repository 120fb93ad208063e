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
package com.hellblazer.geoaid.figure.projector;

import com.hellblazer.geoaid.figure.Figure;
import com.hellblazer.geoaid.figure.FigureItem;
import com.hellblazer.geoaid.figure.FigureItem.CircleItem;
import com.hellblazer.geoaid.figure.FigureItem.LineItem;
import com.hellblazer.geoaid.figure.FigureItem.PointItem;
import com.hellblazer.geoaid.figure.FigureItem.RayItem;
import com.hellblazer.geoaid.figure.FigureItem.SegmentItem;
import com.hellblazer.geoaid.figure.GenerationFlags;
import com.hellblazer.geoaid.figure.Position;
import com.hellblazer.geoaid.figure.projector.DrawItem.DrawCircle;
import com.hellblazer.geoaid.figure.projector.DrawItem.DrawLine;
import com.hellblazer.geoaid.figure.projector.DrawItem.DrawPoint;
import com.hellblazer.geoaid.figure.projector.DrawItem.DrawRay;
import com.hellblazer.geoaid.figure.projector.DrawItem.DrawSegment;
import com.hellblazer.geoaid.figure.projector.DrawItem.Label;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects a figure by fitting its model space bounding box into the viewport with a uniform scale.
 * <p>
 * The bounding box covers point positions, the defining points of lines, segments and rays, and the full extent of
 * circles. The y axis is flipped so model space "up" is screen space "up". Lines and rays are clipped against the
 * viewport; a line or ray that misses the viewport is dropped.
 *
 * @author hal.hildebrand
 */
public class FitProjector implements Projector {

    public static final double LABEL_OFFSET = 8.0;

    private static final double EPSILON = 1e-12;

    @Override
    public ProjectedFigure project(Figure figure, GenerationFlags flags, Viewport viewport) {
        if (figure.isEmpty()) {
            return new ProjectedFigure(List.of(), viewport);
        }
        var transform = Transform.fit(figure, viewport, flags.margin());
        var items = new ArrayList<DrawItem>(figure.items().size());
        for (var item : figure.items()) {
            var projected = project(item, transform, flags.showLabels(), viewport);
            if (projected != null) {
                items.add(projected);
            }
        }
        return new ProjectedFigure(items, viewport);
    }

    private DrawItem project(FigureItem item, Transform transform, boolean showLabels, Viewport viewport) {
        var labelled = showLabels && item.hasLabel();
        if (item instanceof PointItem point) {
            var p = transform.apply(point.position());
            return new DrawPoint(p, point.displayDot(),
                                 labelled ? new Label(item.label(), p.offset(LABEL_OFFSET, -LABEL_OFFSET)) : null);
        }
        if (item instanceof SegmentItem segment) {
            var a = transform.apply(segment.a());
            var b = transform.apply(segment.b());
            return new DrawSegment(a, b, labelled ? new Label(item.label(), labelAt(a.midpoint(b))) : null);
        }
        if (item instanceof LineItem line) {
            var clipped = clip(transform.apply(line.a()), transform.apply(line.b()), Double.NEGATIVE_INFINITY,
                               viewport);
            if (clipped == null) {
                return null;
            }
            return new DrawLine(clipped[0], clipped[1],
                                labelled ? new Label(item.label(), labelAt(clipped[0].midpoint(clipped[1]))) : null);
        }
        if (item instanceof RayItem ray) {
            var clipped = clip(transform.apply(ray.origin()), transform.apply(ray.through()), 0.0, viewport);
            if (clipped == null) {
                return null;
            }
            return new DrawRay(clipped[0], clipped[1],
                               labelled ? new Label(item.label(), labelAt(clipped[0].midpoint(clipped[1]))) : null);
        }
        if (item instanceof CircleItem circle) {
            var center = transform.apply(circle.center());
            var radius = circle.radius() * transform.scale();
            return new DrawCircle(center, radius,
                                  labelled ? new Label(item.label(), center.offset(0.0, -radius - LABEL_OFFSET))
                                           : null);
        }
        throw new IllegalArgumentException("Unknown figure item: " + item);
    }

    private ScreenPoint labelAt(ScreenPoint anchor) {
        return anchor.offset(LABEL_OFFSET, -LABEL_OFFSET);
    }

    /**
     * Liang-Barsky clipping of p(t) = from + t * (through - from), t in [tMin, +inf), against the viewport.
     *
     * @return the visible end points, or null if the line misses the viewport or is degenerate
     */
    static ScreenPoint[] clip(ScreenPoint from, ScreenPoint through, double tMin, Viewport viewport) {
        var dx = through.x() - from.x();
        var dy = through.y() - from.y();
        if (Math.abs(dx) < EPSILON && Math.abs(dy) < EPSILON) {
            return null;
        }
        var t0 = tMin;
        var t1 = Double.POSITIVE_INFINITY;
        double[] p = { -dx, dx, -dy, dy };
        double[] q = { from.x(), viewport.width() - from.x(), from.y(), viewport.height() - from.y() };
        for (int i = 0; i < 4; i++) {
            if (Math.abs(p[i]) < EPSILON) {
                if (q[i] < 0.0) {
                    return null;
                }
                continue;
            }
            var r = q[i] / p[i];
            if (p[i] < 0.0) {
                t0 = Math.max(t0, r);
            } else {
                t1 = Math.min(t1, r);
            }
        }
        if (t0 > t1) {
            return null;
        }
        return new ScreenPoint[] { new ScreenPoint(from.x() + t0 * dx, from.y() + t0 * dy),
                                   new ScreenPoint(from.x() + t1 * dx, from.y() + t1 * dy) };
    }

    /**
     * Uniform scale plus translation from model space to screen space.
     */
    record Transform(double scale, double modelCenterX, double modelCenterY, double screenCenterX,
                     double screenCenterY) {

        static Transform fit(Figure figure, Viewport viewport, double margin) {
            var minX = Double.POSITIVE_INFINITY;
            var minY = Double.POSITIVE_INFINITY;
            var maxX = Double.NEGATIVE_INFINITY;
            var maxY = Double.NEGATIVE_INFINITY;
            for (var item : figure.items()) {
                for (var extent : extents(item)) {
                    minX = Math.min(minX, extent[0]);
                    minY = Math.min(minY, extent[1]);
                    maxX = Math.max(maxX, extent[2]);
                    maxY = Math.max(maxY, extent[3]);
                }
            }
            var spanX = maxX - minX;
            var spanY = maxY - minY;
            var availableX = viewport.width() * (1.0 - 2.0 * margin);
            var availableY = viewport.height() * (1.0 - 2.0 * margin);

            var scale = Double.POSITIVE_INFINITY;
            if (spanX > EPSILON) {
                scale = availableX / spanX;
            }
            if (spanY > EPSILON) {
                scale = Math.min(scale, availableY / spanY);
            }
            if (Double.isInfinite(scale)) {
                scale = 1.0;
            }
            return new Transform(scale, (minX + maxX) / 2.0, (minY + maxY) / 2.0, viewport.width() / 2.0,
                                 viewport.height() / 2.0);
        }

        private static List<double[]> extents(FigureItem item) {
            if (item instanceof PointItem point) {
                return List.of(box(point.position(), 0.0));
            }
            if (item instanceof LineItem line) {
                return List.of(box(line.a(), 0.0), box(line.b(), 0.0));
            }
            if (item instanceof SegmentItem segment) {
                return List.of(box(segment.a(), 0.0), box(segment.b(), 0.0));
            }
            if (item instanceof RayItem ray) {
                return List.of(box(ray.origin(), 0.0), box(ray.through(), 0.0));
            }
            if (item instanceof CircleItem circle) {
                return List.of(box(circle.center(), circle.radius()));
            }
            throw new IllegalArgumentException("Unknown figure item: " + item);
        }

        private static double[] box(Position p, double radius) {
            return new double[] { p.x() - radius, p.y() - radius, p.x() + radius, p.y() + radius };
        }

        ScreenPoint apply(Position p) {
            return new ScreenPoint(screenCenterX + (p.x() - modelCenterX) * scale,
                                   screenCenterY - (p.y() - modelCenterY) * scale);
        }
    }
}
