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
package com.hellblazer.geoaid.portal.render;

import com.hellblazer.geoaid.figure.projector.DrawItem;
import com.hellblazer.geoaid.figure.projector.DrawItem.DrawCircle;
import com.hellblazer.geoaid.figure.projector.DrawItem.DrawLine;
import com.hellblazer.geoaid.figure.projector.DrawItem.DrawPoint;
import com.hellblazer.geoaid.figure.projector.DrawItem.DrawRay;
import com.hellblazer.geoaid.figure.projector.DrawItem.DrawSegment;
import com.hellblazer.geoaid.figure.projector.DrawItem.Label;
import com.hellblazer.geoaid.figure.projector.ProjectedFigure;
import com.hellblazer.geoaid.figure.projector.ScreenPoint;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.paint.Color;
import javafx.scene.text.Font;

/**
 * Draws projected figures onto a JavaFX canvas: black 1px strokes on white.
 *
 * @author hal.hildebrand
 */
public class FigureRenderer {
    private static final double DOT_RADIUS  = 2.0;
    private static final double LINE_WIDTH  = 1.0;
    private static final Color  BACKGROUND  = Color.WHITE;
    private static final Color  FOREGROUND  = Color.BLACK;

    private final Font labelFont;

    public FigureRenderer(double labelFontSize) {
        this.labelFont = Font.font(labelFontSize);
    }

    public void clear(GraphicsContext gc, double width, double height) {
        gc.setFill(BACKGROUND);
        gc.fillRect(0, 0, width, height);
    }

    public void draw(GraphicsContext gc, ProjectedFigure figure) {
        gc.setStroke(FOREGROUND);
        gc.setFill(FOREGROUND);
        gc.setLineWidth(LINE_WIDTH);
        gc.setFont(labelFont);
        for (var item : figure.items()) {
            draw(gc, item);
            drawLabel(gc, item.label());
        }
    }

    private void draw(GraphicsContext gc, DrawItem item) {
        if (item instanceof DrawPoint point) {
            if (point.displayDot()) {
                var p = point.position();
                gc.fillOval(p.x() - DOT_RADIUS, p.y() - DOT_RADIUS, 2 * DOT_RADIUS, 2 * DOT_RADIUS);
            }
        } else if (item instanceof DrawLine line) {
            stroke(gc, line.a(), line.b());
        } else if (item instanceof DrawSegment segment) {
            stroke(gc, segment.a(), segment.b());
        } else if (item instanceof DrawRay ray) {
            stroke(gc, ray.origin(), ray.end());
        } else if (item instanceof DrawCircle circle) {
            var c = circle.center();
            var r = circle.radius();
            gc.strokeOval(c.x() - r, c.y() - r, 2 * r, 2 * r);
        }
    }

    private void stroke(GraphicsContext gc, ScreenPoint a, ScreenPoint b) {
        gc.strokeLine(a.x(), a.y(), b.x(), b.y());
    }

    private void drawLabel(GraphicsContext gc, Label label) {
        if (label != null) {
            gc.fillText(label.content(), label.position().x(), label.position().y());
        }
    }
}
