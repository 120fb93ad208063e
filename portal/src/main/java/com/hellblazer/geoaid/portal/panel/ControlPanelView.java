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
package com.hellblazer.geoaid.portal.panel;

import com.hellblazer.geoaid.engine.startup.StartupField;
import com.hellblazer.geoaid.portal.panel.PanelState.Active;
import com.hellblazer.geoaid.portal.panel.PanelState.NoSession;
import javafx.geometry.Insets;
import javafx.scene.Node;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.control.TextField;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.VBox;
import javafx.scene.paint.Color;
import javafx.stage.FileChooser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JavaFX rendition of the {@link ControlPanelModel}: the start-up form while there is no session, the run controls
 * while there is one. Which of the two is visible follows the model's state.
 *
 * @author hal.hildebrand
 */
public class ControlPanelView extends VBox {
    private static final Logger log = LoggerFactory.getLogger(ControlPanelView.class);

    private final ControlPanelModel model;
    private final FileChooser       fileChooser = new FileChooser();

    // Start-up form
    private final GridPane  startForm    = new GridPane();
    private final Label     notice       = errorLabel();
    private final Label     fileLabel    = new Label("(none)");
    private final Button    openButton   = new Button("Open");
    private final Label     fileError    = errorLabel();
    private final TextField workerCount  = new TextField();
    private final Label     workerError  = errorLabel();
    private final TextField maxAdjustment = new TextField();
    private final Label     boundError   = errorLabel();
    private final Button    generate     = new Button("Generate");

    // Session controls
    private final VBox   sessionControls = new VBox(8);
    private final Button quit            = new Button("Quit");
    private final Button runStop         = new Button("Run");
    private final Button nextStep        = new Button("Next step");
    private final Label  status          = new Label();

    public ControlPanelView(ControlPanelModel model) {
        this.model = model;
        setSpacing(10);
        setPadding(new Insets(12));
        setStyle("-fx-background-color: #f0f0f0;");

        fileChooser.setTitle("Open problem");
        fileChooser.getExtensionFilters()
                   .addAll(new FileChooser.ExtensionFilter("Problem definitions", "*.json"),
                           new FileChooser.ExtensionFilter("All files", "*.*"));

        buildStartForm();
        buildSessionControls();

        var title = new Label("Start generating");
        title.setStyle("-fx-font-weight: bold; -fx-font-size: 14px;");
        getChildren().addAll(title, startForm, sessionControls);

        refresh(model.state());
    }

    /**
     * Show the part of the panel that matches the given state.
     */
    public void refresh(PanelState state) {
        var noSession = state instanceof NoSession;
        show(startForm, noSession);
        show(sessionControls, !noSession);

        if (state instanceof NoSession form) {
            var file = model.getFile();
            fileLabel.setText(file == null ? "(none)" : file.toString());
            openButton.setText(file == null ? "Open" : "Change");
            showError(notice, form.notice(), "Session ended");
            showError(fileError, form.errors().get(StartupField.FILE), "Invalid file");
            showError(workerError, form.errors().get(StartupField.WORKER_COUNT), "Invalid worker count");
            showError(boundError, form.errors().get(StartupField.ADJUSTMENT_BOUND), "Invalid max adjustment");
        } else if (state instanceof Active active) {
            runStop.setText(active.running() ? "Stop" : "Run");
            nextStep.setDisable(active.running());
        }
    }

    /**
     * Update the status line with the generation and quality currently displayed.
     */
    public void showStatus(long generation, double quality) {
        status.setText(String.format("Generation %d, error %.6g", generation, quality));
    }

    private void buildStartForm() {
        startForm.setHgap(8);
        startForm.setVgap(6);

        workerCount.setText(model.getWorkerCountText());
        workerCount.textProperty().addListener((obs, old, text) -> model.setWorkerCountText(text));
        maxAdjustment.setText(model.getBoundText());
        maxAdjustment.textProperty().addListener((obs, old, text) -> model.setBoundText(text));

        openButton.setOnAction(e -> chooseFile());
        generate.setOnAction(e -> model.generate());

        fileLabel.setMaxWidth(180);
        startForm.add(notice, 0, 0, 2, 1);
        startForm.addRow(1, new Label("File:"), new HBox(6, fileLabel, openButton));
        startForm.add(fileError, 0, 2, 2, 1);
        startForm.addRow(3, new Label("Worker count:"), workerCount);
        startForm.add(workerError, 0, 4, 2, 1);
        startForm.addRow(5, new Label("Maximum adjustment:"), maxAdjustment);
        startForm.add(boundError, 0, 6, 2, 1);
        startForm.add(generate, 1, 7);
    }

    private void buildSessionControls() {
        quit.setOnAction(e -> model.quit());
        runStop.setOnAction(e -> {
            if (model.isRunning()) {
                model.stop();
            } else {
                model.run();
            }
        });
        nextStep.setOnAction(e -> model.step());
        sessionControls.getChildren().addAll(new HBox(6, quit, runStop, nextStep), status);
    }

    private void chooseFile() {
        var window = getScene() == null ? null : getScene().getWindow();
        var chosen = fileChooser.showOpenDialog(window);
        if (chosen != null) {
            log.debug("Selected problem file {}", chosen);
            model.setFile(chosen.toPath());
            fileChooser.setInitialDirectory(chosen.getParentFile());
            refresh(model.state());
        }
    }

    private static Label errorLabel() {
        var label = new Label();
        label.setTextFill(Color.RED);
        label.setWrapText(true);
        label.setMaxWidth(260);
        return label;
    }

    private static void showError(Label label, String detail, String heading) {
        var visible = detail != null;
        label.setText(visible ? heading + ": " + detail : "");
        show(label, visible);
    }

    private static void show(Node node, boolean visible) {
        node.setVisible(visible);
        node.setManaged(visible);
    }
}
