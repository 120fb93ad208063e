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

import com.hellblazer.geoaid.portal.panel.ControlPanelModel;
import javafx.animation.AnimationTimer;
import javafx.scene.canvas.Canvas;

import java.util.function.Consumer;

/**
 * Frame loop on the JavaFX application thread. Each pulse clears the canvas, draws the latest figure of the active
 * session, then gives the control panel its per frame hook, which may request the next step.
 *
 * @author hal.hildebrand
 */
public class RenderLoop extends AnimationTimer {

    private final Canvas                            canvas;
    private final FrameComposer                     composer;
    private final FigureRenderer                    renderer;
    private final ControlPanelModel                 model;
    private       Consumer<FrameComposer.Frame>     frameCallback;

    public RenderLoop(Canvas canvas, FrameComposer composer, FigureRenderer renderer, ControlPanelModel model) {
        this.canvas = canvas;
        this.composer = composer;
        this.renderer = renderer;
        this.model = model;
    }

    /**
     * Receives each drawn frame, e.g. to show the generation in a status line.
     */
    public void setFrameCallback(Consumer<FrameComposer.Frame> callback) {
        this.frameCallback = callback;
    }

    @Override
    public void handle(long now) {
        var gc = canvas.getGraphicsContext2D();
        var width = canvas.getWidth();
        var height = canvas.getHeight();
        renderer.clear(gc, width, height);

        composer.compose(width, height).ifPresent(frame -> {
            renderer.draw(gc, frame.projected());
            if (frameCallback != null) {
                frameCallback.accept(frame);
            }
        });

        model.onFrame();
    }
}
