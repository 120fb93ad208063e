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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of validating the start-up fields: either parameters for a new session or at least one field error, never
 * both.
 *
 * @author hal.hildebrand
 */
public final class StartupValidation {

    private final Map<StartupField, String> errors;
    private final StartupParameters         parameters;

    private StartupValidation(Map<StartupField, String> errors, StartupParameters parameters) {
        this.errors = errors;
        this.parameters = parameters;
    }

    static StartupValidation valid(StartupParameters parameters) {
        return new StartupValidation(Collections.emptyMap(), parameters);
    }

    static StartupValidation invalid(Map<StartupField, String> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one error");
        }
        return new StartupValidation(Collections.unmodifiableMap(new EnumMap<>(errors)), null);
    }

    public boolean isValid() {
        return parameters != null;
    }

    public Optional<StartupParameters> parameters() {
        return Optional.ofNullable(parameters);
    }

    public Map<StartupField, String> errors() {
        return errors;
    }

    public Optional<String> error(StartupField field) {
        return Optional.ofNullable(errors.get(field));
    }

    @Override
    public String toString() {
        return isValid() ? "StartupValidation[valid]" : "StartupValidation" + errors;
    }
}
