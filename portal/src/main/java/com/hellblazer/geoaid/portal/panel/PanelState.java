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

import com.hellblazer.geoaid.engine.GenerationSession;
import com.hellblazer.geoaid.engine.startup.StartupField;

import java.util.Map;
import java.util.Objects;

/**
 * What the control panel shows: the start-up form, or the controls of a running session. Exactly one of the two is
 * ever current.
 *
 * @author hal.hildebrand
 */
public sealed interface PanelState permits PanelState.NoSession, PanelState.Active {

    /**
     * Start-up form, with the errors of the last rejected attempt. {@code notice} explains why the previous session
     * ended, if it did not end by request; it is null otherwise.
     */
    record NoSession(Map<StartupField, String> errors, String notice) implements PanelState {
        public static final NoSession CLEAN = new NoSession(Map.of());

        public NoSession {
            errors = Map.copyOf(errors);
        }

        public NoSession(Map<StartupField, String> errors) {
            this(errors, null);
        }
    }

    /**
     * A live session. {@code running} is true while steps are requested every frame.
     */
    record Active(GenerationSession session, boolean running) implements PanelState {
        public Active {
            Objects.requireNonNull(session, "session");
        }

        Active withRunning(boolean running) {
            return new Active(session, running);
        }
    }
}
