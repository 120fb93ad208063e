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
package com.hellblazer.geoaid.portal;

import com.hellblazer.geoaid.figure.projector.FitProjector;
import com.hellblazer.geoaid.portal.panel.ControlPanelModel;
import com.hellblazer.geoaid.portal.panel.ControlPanelView;
import com.hellblazer.geoaid.portal.render.FigureRenderer;
import com.hellblazer.geoaid.portal.render.FrameComposer;
import com.hellblazer.geoaid.portal.render.RenderLoop;
import javafx.application.Application;
import javafx.scene.Scene;
import javafx.scene.canvas.Canvas;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.Pane;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Geo-AID Debugger: step through, run or halt figure generation while the figure is rendered live.
 * <p>
 * Run with {@code mvn exec:java -pl portal}, optionally passing {@code --file=}, {@code --workers=} and
 * {@code --bound=} through {@code -Dexec.args}. Sample problems live in the top level {@code examples} directory,
 * e.g. {@code -Dexec.args=--file=examples/bisector.json} from the project root.
 *
 * @author hal.hildebrand
 */
public class DebuggerApp extends Application {
    private static final Logger log = LoggerFactory.getLogger(DebuggerApp.class);

    private ControlPanelModel model;
    private RenderLoop        renderLoop;

    @Override
    public void start(Stage primaryStage) {
        var config = DebuggerConfiguration.DEFAULT.withNamedParameters(getParameters().getNamed());

        model = new ControlPanelModel(config.workerCount(), config.maxAdjustment());
        model.setFile(config.initialFile());
        var panel = new ControlPanelView(model);
        panel.setPrefWidth(config.panelWidth());
        panel.setMinWidth(config.panelWidth());
        model.setStateListener(panel::refresh);

        // Canvas follows its container, so every frame projects onto the current window size
        var canvas = new Canvas();
        var canvasPane = new Pane(canvas);
        canvas.widthProperty().bind(canvasPane.widthProperty());
        canvas.heightProperty().bind(canvasPane.heightProperty());

        var layout = new BorderPane();
        layout.setCenter(canvasPane);
        layout.setRight(panel);

        renderLoop = new RenderLoop(canvas, new FrameComposer(model, new FitProjector()),
                                    new FigureRenderer(config.labelFontSize()), model);
        renderLoop.setFrameCallback(frame -> panel.showStatus(frame.figure().generation(), frame.figure().quality()));

        primaryStage.setTitle(config.title());
        primaryStage.setScene(new Scene(layout, config.windowWidth(), config.windowHeight()));
        primaryStage.setResizable(true);
        primaryStage.show();

        renderLoop.start();
        log.info("{} started", config.title());
    }

    @Override
    public void stop() {
        if (renderLoop != null) {
            renderLoop.stop();
        }
        if (model != null) {
            model.close();
        }
        log.info("Debugger stopped");
    }

    public static class Launcher {
        public static void main(String[] args) {
            Application.launch(DebuggerApp.class, args);
        }
    }
}
