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
import com.hellblazer.geoaid.engine.startup.StartupParameters;
import com.hellblazer.geoaid.engine.startup.StartupValidator;
import com.hellblazer.geoaid.portal.panel.PanelState.Active;
import com.hellblazer.geoaid.portal.panel.PanelState.NoSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Toolkit independent state machine behind the control panel. Confined to the UI thread.
 * <p>
 * Holds the start-up inputs, which survive across sessions, and the current {@link PanelState}. Commands that do not
 * apply to the current state are ignored and report false. A session whose worker has stopped is ended on the next
 * step request and the form reports why.
 *
 * @author hal.hildebrand
 */
public class ControlPanelModel implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ControlPanelModel.class);

    private final StartupValidator                              validator;
    private final Function<StartupParameters, GenerationSession> sessions;
    private       Path                                          file;
    private       String                                        workerCountText;
    private       String                                        boundText;
    private       PanelState                                    state = NoSession.CLEAN;
    private       SessionPhase                                  phase = SessionPhase.NO_SESSION;
    private       Consumer<PanelState>                          stateListener;

    public ControlPanelModel(String workerCountText, String boundText) {
        this(new StartupValidator(), GenerationSession::start, workerCountText, boundText);
    }

    public ControlPanelModel(StartupValidator validator, Function<StartupParameters, GenerationSession> sessions,
                             String workerCountText, String boundText) {
        this.validator = validator;
        this.sessions = sessions;
        this.workerCountText = workerCountText;
        this.boundText = boundText;
    }

    public PanelState state() {
        return state;
    }

    public SessionPhase phase() {
        return phase;
    }

    public Optional<GenerationSession> activeSession() {
        if (state instanceof Active active) {
            return Optional.of(active.session());
        }
        return Optional.empty();
    }

    public boolean isRunning() {
        return state instanceof Active active && active.running();
    }

    /**
     * Receives every state change. Called on the UI thread.
     */
    public void setStateListener(Consumer<PanelState> listener) {
        this.stateListener = listener;
    }

    public Path getFile() {
        return file;
    }

    public void setFile(Path file) {
        this.file = file;
    }

    public String getWorkerCountText() {
        return workerCountText;
    }

    public void setWorkerCountText(String workerCountText) {
        this.workerCountText = workerCountText;
    }

    public String getBoundText() {
        return boundText;
    }

    public void setBoundText(String boundText) {
        this.boundText = boundText;
    }

    /**
     * Validate the inputs and start a session if all of them pass.
     *
     * @return true if a session was started
     */
    public boolean generate() {
        if (!(state instanceof NoSession)) {
            return false;
        }
        phase = SessionPhase.STARTING;
        var validation = validator.validate(file, workerCountText, boundText);
        var parameters = validation.parameters();
        if (parameters.isEmpty()) {
            phase = SessionPhase.NO_SESSION;
            transition(new NoSession(validation.errors()));
            return false;
        }
        GenerationSession session;
        try {
            session = sessions.apply(parameters.get());
        } catch (RuntimeException e) {
            phase = SessionPhase.NO_SESSION;
            log.error("Unable to start a session for {}", file, e);
            throw e;
        }
        phase = SessionPhase.ACTIVE;
        log.info("Session active for {}", file);
        transition(new Active(session, false));
        return true;
    }

    /**
     * Request a single step. Only while a session is active and not running.
     */
    public boolean step() {
        if (state instanceof Active active && !active.running()) {
            return send(active, GenerationSession::next);
        }
        return false;
    }

    public boolean run() {
        if (state instanceof Active active && !active.running()) {
            transition(active.withRunning(true));
            return true;
        }
        return false;
    }

    public boolean stop() {
        if (state instanceof Active active && active.running()) {
            transition(active.withRunning(false));
            return true;
        }
        return false;
    }

    /**
     * Close the session and return to the start-up form.
     */
    public boolean quit() {
        return terminate(NoSession.CLEAN);
    }

    /**
     * Per frame hook. While running, requests the next step once the previous one has been handled, so at most one
     * step is ever in flight.
     *
     * @return true if a step was requested
     */
    public boolean onFrame() {
        if (state instanceof Active active && active.running()) {
            return send(active, GenerationSession::nextIfIdle);
        }
        return false;
    }

    @Override
    public void close() {
        quit();
    }

    private boolean send(Active active, Predicate<GenerationSession> command) {
        try {
            return command.test(active.session());
        } catch (IllegalStateException e) {
            log.error("Generation worker stopped, ending the session", e);
            terminate(new NoSession(Map.of(), "Generation worker stopped"));
            return false;
        }
    }

    private boolean terminate(NoSession next) {
        if (!(state instanceof Active active)) {
            return false;
        }
        phase = SessionPhase.TERMINATING;
        active.session().close();
        phase = SessionPhase.NO_SESSION;
        log.info("Session closed");
        transition(next);
        return true;
    }

    private void transition(PanelState next) {
        state = next;
        if (stateListener != null) {
            stateListener.accept(next);
        }
    }
}
