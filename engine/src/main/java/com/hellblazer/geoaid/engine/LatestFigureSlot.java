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

import com.hellblazer.geoaid.figure.Figure;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single value hand-off between the generation worker (writer) and the render loop (reader). Holds exactly one
 * figure; a publish replaces the previous one. The lock is held only while the reference is swapped or copied out,
 * never while a figure is being computed or drawn.
 *
 * @author hal.hildebrand
 */
public class LatestFigureSlot {

    private final ReentrantLock lock = new ReentrantLock();
    private       Figure        figure;
    private       long          version;

    public LatestFigureSlot() {
        this(Figure.empty());
    }

    public LatestFigureSlot(Figure initial) {
        this.figure = Objects.requireNonNull(initial, "initial");
    }

    public void publish(Figure next) {
        Objects.requireNonNull(next, "figure");
        lock.lock();
        try {
            figure = next;
            version++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy out the current figure. Figures are immutable, so the returned reference is the copy.
     */
    public Figure snapshot() {
        lock.lock();
        try {
            return figure;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy out the current figure only if the slot is not being written right now.
     */
    public Optional<Figure> trySnapshot() {
        if (!lock.tryLock()) {
            return Optional.empty();
        }
        try {
            return Optional.of(figure);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of publishes so far.
     */
    public long version() {
        lock.lock();
        try {
            return version;
        } finally {
            lock.unlock();
        }
    }
}
