/*
 * This file is part of JLogic.
 * Copyright (c) 2024 The JLogic Authors.
 *
 * JLogic is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JLogic is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JLogic. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jlogic;

import java.util.List;
import org.immutables.value.Value;

/**
 * A rectangle of true cells of a Karnaugh map, possibly wrapping around its edges.
 */
@Value.Immutable
public abstract class KarnaughGroup {
    /**
     * Cells as {@code row * columns + column}.
     */
    public abstract List<Integer> cells();

    public abstract List<Integer> minterms();

    public abstract int height();

    public abstract int width();

    /**
     * Bits shared by all minterms of the group, {@code -} where they differ.
     */
    public abstract String pattern();

    public abstract Expression term();

    public int size() {
        return height() * width();
    }
}
