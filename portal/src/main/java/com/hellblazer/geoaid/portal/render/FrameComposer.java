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

import com.hellblazer.geoaid.engine.GenerationSession;
import com.hellblazer.geoaid.figure.Figure;
import com.hellblazer.geoaid.figure.projector.ProjectedFigure;
import com.hellblazer.geoaid.figure.projector.Projector;
import com.hellblazer.geoaid.figure.projector.Viewport;
import com.hellblazer.geoaid.portal.panel.ControlPanelModel;

import java.util.Optional;

/**
 * Per frame projection step: snapshot the active session's latest figure and project it onto the current viewport.
 * The slot is read without blocking; while the worker holds it, the figure of the previous frame is projected again.
 * Only that figure is kept between frames, so a resized canvas simply projects differently on the next frame.
 *
 * @author hal.hildebrand
 */
public class FrameComposer {

    /**
     * One composed frame: the figure it was built from and its projection.
     */
    public record Frame(Figure figure, ProjectedFigure projected) {
    }

    private final ControlPanelModel model;
    private final Projector         projector;
    private       GenerationSession lastSession;
    private       Figure            lastFigure = Figure.empty();

    public FrameComposer(ControlPanelModel model, Projector projector) {
        this.model = model;
        this.projector = projector;
    }

    /**
     * @return the frame to draw, or empty when there is no session or the viewport has no area
     */
    public Optional<Frame> compose(double width, double height) {
        if (!(width > 0.0) || !(height > 0.0)) {
            return Optional.empty();
        }
        return model.activeSession().map(session -> {
            var figure = latest(session);
            return new Frame(figure, projector.project(figure, session.flags(), new Viewport(width, height)));
        });
    }

    private Figure latest(GenerationSession session) {
        if (session != lastSession) {
            lastSession = session;
            lastFigure = Figure.empty();
        }
        session.slot().trySnapshot().ifPresent(figure -> lastFigure = figure);
        return lastFigure;
    }
}
