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
package com.hellblazer.geoaid.engine.startup;

import com.hellblazer.geoaid.figure.problem.ProblemDefinition;
import com.hellblazer.geoaid.figure.problem.ProblemDefinitionException;
import com.hellblazer.geoaid.figure.problem.ProblemLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.regex.Pattern;

/**
 * Checks the three start-up fields independently of each other. Nothing is allocated for a session unless all of
 * them pass. Numbers must be plain ASCII decimals; Java literal forms such as {@code 1d} or {@code 0x1p-1} are
 * rejected.
 *
 * @author hal.hildebrand
 */
public class StartupValidator {
    public static final String INVALID_WORKER_COUNT = "Must be positive integer.";
    public static final String INVALID_BOUND        = "Must be a positive float";

    private static final Logger  log     = LoggerFactory.getLogger(StartupValidator.class);
    private static final Pattern INTEGER = Pattern.compile("\\+?[0-9]+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    private final ProblemLoader loader;

    public StartupValidator() {
        this(new ProblemLoader());
    }

    public StartupValidator(ProblemLoader loader) {
        this.loader = loader;
    }

    public StartupValidation validate(Path file, String workerCount, String bound) {
        var errors = new EnumMap<StartupField, String>(StartupField.class);

        ProblemDefinition problem = null;
        try {
            problem = loader.load(file);
        } catch (ProblemDefinitionException e) {
            errors.put(StartupField.FILE, e.getMessage());
        }

        var workers = parseWorkerCount(workerCount);
        if (workers <= 0) {
            errors.put(StartupField.WORKER_COUNT, INVALID_WORKER_COUNT);
        }

        var maxAdjustment = parseBound(bound);
        if (!(maxAdjustment > 0.0) || !Double.isFinite(maxAdjustment)) {
            errors.put(StartupField.ADJUSTMENT_BOUND, INVALID_BOUND);
        }

        if (!errors.isEmpty()) {
            log.debug("Start-up rejected: {}", errors);
            return StartupValidation.invalid(errors);
        }
        return StartupValidation.valid(new StartupParameters(problem, workers, maxAdjustment));
    }

    private static int parseWorkerCount(String text) {
        if (text == null || !INTEGER.matcher(text.trim()).matches()) {
            return -1;
        }
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static double parseBound(String text) {
        if (text == null || !DECIMAL.matcher(text.trim()).matches()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
