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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration record for the debugger window.
 *
 * @param workerCount   initial text of the worker count field
 * @param maxAdjustment initial text of the maximum adjustment field
 * @param initialFile   problem file preselected in the panel, may be null
 * @param panelWidth    width of the control panel; the canvas gets the rest of the window
 * @param labelFontSize font size of figure labels
 * @param windowWidth   initial window width
 * @param windowHeight  initial window height
 * @param title         window title
 * @author hal.hildebrand
 */
public record DebuggerConfiguration(
    String workerCount,
    String maxAdjustment,
    Path initialFile,
    double panelWidth,
    double labelFontSize,
    double windowWidth,
    double windowHeight,
    String title
) {
    private static final Logger log = LoggerFactory.getLogger(DebuggerConfiguration.class);

    /**
     * Default configuration.
     */
    public static final DebuggerConfiguration DEFAULT = new DebuggerConfiguration(
        "512",   // workerCount
        "0.5",   // maxAdjustment
        null,    // initialFile
        300.0,   // panelWidth
        18.0,    // labelFontSize
        1280.0,  // windowWidth
        800.0,   // windowHeight
        "Geo-AID Debugger"
    );

    public DebuggerConfiguration withWorkerCount(String workerCount) {
        return new DebuggerConfiguration(workerCount, maxAdjustment, initialFile, panelWidth, labelFontSize,
                                         windowWidth, windowHeight, title);
    }

    public DebuggerConfiguration withMaxAdjustment(String maxAdjustment) {
        return new DebuggerConfiguration(workerCount, maxAdjustment, initialFile, panelWidth, labelFontSize,
                                         windowWidth, windowHeight, title);
    }

    public DebuggerConfiguration withInitialFile(Path initialFile) {
        return new DebuggerConfiguration(workerCount, maxAdjustment, initialFile, panelWidth, labelFontSize,
                                         windowWidth, windowHeight, title);
    }

    /**
     * Apply named command line parameters: {@code --file=}, {@code --workers=} and {@code --bound=}. The values only
     * prefill the control panel and are validated when a session is started. Unknown names are logged and ignored.
     */
    public DebuggerConfiguration withNamedParameters(Map<String, String> named) {
        var result = this;
        for (var entry : named.entrySet()) {
            switch (entry.getKey()) {
            case "file" -> result = result.withInitialFile(Path.of(entry.getValue()));
            case "workers" -> result = result.withWorkerCount(entry.getValue());
            case "bound" -> result = result.withMaxAdjustment(entry.getValue());
            default -> log.warn("Ignoring unknown parameter --{}", entry.getKey());
            }
        }
        return result;
    }
}
