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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.hellblazer.geoaid.engine.ControlMessage.NEXT;
import static com.hellblazer.geoaid.engine.ControlMessage.QUIT;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ControlChannel - ordering, closing on quit and in-flight accounting.
 *
 * @author hal.hildebrand
 */
class ControlChannelTest {

    @Test
    void testDeliversInSendOrder() throws Exception {
        var channel = new ControlChannel();
        assertTrue(channel.send(NEXT));
        assertTrue(channel.send(NEXT));
        assertTrue(channel.send(QUIT));

        var received = new ArrayList<ControlMessage>();
        for (int i = 0; i < 3; i++) {
            received.add(channel.receive());
        }
        assertEquals(List.of(NEXT, NEXT, QUIT), received);
    }

    @Test
    void testQuitClosesChannel() {
        var channel = new ControlChannel();
        assertFalse(channel.isClosed());

        assertTrue(channel.send(QUIT));
        assertTrue(channel.isClosed());
        assertFalse(channel.send(NEXT), "No command is accepted after quit");
        assertFalse(channel.send(QUIT), "Quit is accepted only once");
        assertEquals(0, channel.inFlight());
    }

    @Test
    void testInFlightAccounting() {
        var channel = new ControlChannel();
        assertTrue(channel.isIdle());

        channel.send(NEXT);
        channel.send(NEXT);
        assertEquals(2, channel.inFlight());
        assertFalse(channel.isIdle());

        channel.acknowledge();
        channel.acknowledge();
        assertTrue(channel.isIdle());

        assertThrows(IllegalStateException.class, channel::acknowledge);
    }

    @Test
    void testSendDoesNotBlockWithoutConsumer() {
        var channel = new ControlChannel();
        var start = System.nanoTime();
        for (int i = 0; i < 10_000; i++) {
            assertTrue(channel.send(NEXT));
        }
        assertTrue(System.nanoTime() - start < 5_000_000_000L);
        assertEquals(10_000, channel.inFlight());
    }

    @Test
    void testStepsAfterDisconnectFailLoudly() {
        var channel = new ControlChannel();
        channel.send(NEXT);
        channel.send(NEXT);

        channel.disconnect();

        assertTrue(channel.isDisconnected());
        assertTrue(channel.isIdle(), "pending steps are dropped with the consumer");
        var thrown = assertThrows(IllegalStateException.class, () -> channel.send(NEXT));
        assertEquals("Control channel disconnected", thrown.getMessage());
        assertEquals(0, channel.inFlight());

        assertFalse(channel.send(QUIT), "quit after disconnect only closes");
        assertTrue(channel.isClosed());
        assertFalse(channel.send(NEXT), "a closed channel rejects quietly");
    }
}
