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
package com.hellblazer.geoaid.figure.projector;

import com.hellblazer.geoaid.figure.Figure;
import com.hellblazer.geoaid.figure.GenerationFlags;

/**
 * Maps a model space figure onto a viewport. Called once per rendered frame; implementations must not keep state
 * between calls.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface Projector {

    ProjectedFigure project(Figure figure, GenerationFlags flags, Viewport viewport);
}
