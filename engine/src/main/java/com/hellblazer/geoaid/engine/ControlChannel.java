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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ordered single producer, single consumer command queue between the UI thread and the generation worker.
 * <p>
 * Sending never blocks. Once {@link ControlMessage#QUIT} has been sent the channel is closed and every later send is
 * rejected. The channel counts {@link ControlMessage#NEXT} commands that were sent but not yet acknowledged by the
 * worker, so a producer running continuously can keep at most one step in flight instead of growing the queue every
 * frame. When the consumer stops, it disconnects the channel; sending a step after that throws instead of queueing
 * work nobody will do.
 *
 * @author hal.hildebrand
 */
public class ControlChannel {
    private static final Logger log = LoggerFactory.getLogger(ControlChannel.class);

    private final BlockingQueue<ControlMessage> queue        = new LinkedBlockingQueue<>();
    private final AtomicBoolean                 closed       = new AtomicBoolean();
    private final AtomicBoolean                 disconnected = new AtomicBoolean();
    private final AtomicInteger                 inFlight     = new AtomicInteger();

    /**
     * Enqueue a command. Must only be called from the producer thread.
     *
     * @return true if the command was accepted, false if the channel is already closed
     * @throws IllegalStateException if a step is sent after the consumer has gone away
     */
    public boolean send(ControlMessage message) {
        if (message == ControlMessage.QUIT) {
            if (!closed.compareAndSet(false, true)) {
                log.warn("Rejecting {}: channel already closed", message);
                return false;
            }
            if (disconnected.get()) {
                log.info("Consumer already gone, {} closes the channel only", message);
                return false;
            }
            queue.add(message);
            return true;
        }
        if (closed.get()) {
            log.warn("Rejecting {}: channel already closed", message);
            return false;
        }
        if (disconnected.get()) {
            log.error("Cannot send {}: consumer disconnected", message);
            throw new IllegalStateException("Control channel disconnected");
        }
        inFlight.incrementAndGet();
        queue.add(message);
        return true;
    }

    /**
     * Called by the consumer when it stops receiving, normally or not. Pending commands are dropped and every later
     * step is refused loudly.
     */
    public void disconnect() {
        if (disconnected.compareAndSet(false, true)) {
            queue.clear();
            inFlight.set(0);
        }
    }

    public boolean isDisconnected() {
        return disconnected.get();
    }

    /**
     * Block until the next command arrives. Consumer side.
     */
    public ControlMessage receive() throws InterruptedException {
        return queue.take();
    }

    /**
     * Mark one {@link ControlMessage#NEXT} as handled, whether it was processed or discarded. Consumer side.
     */
    public void acknowledge() {
        if (inFlight.decrementAndGet() < 0) {
            throw new IllegalStateException("Acknowledged more steps than were sent");
        }
    }

    /**
     * @return the number of steps sent and not yet acknowledged
     */
    public int inFlight() {
        return inFlight.get();
    }

    public boolean isIdle() {
        return inFlight.get() == 0;
    }

    public boolean isClosed() {
        return closed.get();
    }
}
