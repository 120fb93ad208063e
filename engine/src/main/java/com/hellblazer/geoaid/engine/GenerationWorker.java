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
package com.hellblazer.geoaid.engine;

import com.hellblazer.geoaid.engine.optimizer.Optimizer;
import com.hellblazer.geoaid.figure.FigureTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receive loop run on the session's dedicated thread. Owns the optimizer exclusively.
 * <p>
 * Magnitudes are precomputed once on entry. Each {@link ControlMessage#NEXT} performs one step and publishes the
 * materialized figure into the slot; {@link ControlMessage#QUIT} ends the loop and closes the optimizer. Steps that
 * are still queued when the channel closes are discarded without running. An interrupted receive means the channel
 * can no longer be trusted and kills the thread. However the loop ends, the channel is disconnected so the sender
 * learns that nobody is receiving.
 *
 * @author hal.hildebrand
 */
public class GenerationWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(GenerationWorker.class);

    private final Optimizer        optimizer;
    private final ControlChannel   channel;
    private final LatestFigureSlot slot;
    private final FigureTemplate   template;
    private final double           bound;

    public GenerationWorker(Optimizer optimizer, ControlChannel channel, LatestFigureSlot slot,
                            FigureTemplate template, double bound) {
        this.optimizer = optimizer;
        this.channel = channel;
        this.slot = slot;
        this.template = template;
        this.bound = bound;
    }

    @Override
    public void run() {
        try {
            var magnitudes = optimizer.precompute(bound);
            log.info("Generation worker ready, {} magnitudes up to {}", magnitudes.size(), bound);
            var steps = 0L;
            while (true) {
                ControlMessage message;
                try {
                    message = channel.receive();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.error("Control channel disconnected after {} steps, aborting generation worker", steps);
                    throw new IllegalStateException("Control channel disconnected", e);
                }
                switch (message) {
                case QUIT -> {
                    log.info("Generation worker quitting after {} steps", steps);
                    return;
                }
                case NEXT -> {
                    if (channel.isClosed()) {
                        channel.acknowledge();
                        log.debug("Discarding step queued before quit");
                    } else {
                        try {
                            optimizer.step(magnitudes);
                            slot.publish(optimizer.materialize(template));
                            steps++;
                        } finally {
                            channel.acknowledge();
                        }
                    }
                }
                }
            }
        } finally {
            channel.disconnect();
            optimizer.close();
        }
    }
}
