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

import java.util.BitSet;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates all assignments of {@code size} variables in binary counting order, where variable
 * {@code 0} is the most significant bit. Bit {@code i} of the returned set is the value of
 * variable {@code i}. The returned set is reused between calls.
 */
final class AssignmentIterator implements Iterator<BitSet> {
    private final BitSet iteration;
    private final int size;
    private int numSetBits = -1;

    AssignmentIterator(int size) {
        this.size = size;
        iteration = new BitSet(size);
    }

    @Override
    public boolean hasNext() {
        return numSetBits < size;
    }

    @Override
    public BitSet next() {
        if (numSetBits == -1) {
            numSetBits = 0;
            return iteration;
        }

        if (numSetBits == size) {
            throw new NoSuchElementException("No next element");
        }

        for (int index = size - 1; index >= 0; index--) {
            if (iteration.get(index)) {
                iteration.clear(index);
                numSetBits -= 1;
            } else {
                iteration.set(index);
                numSetBits += 1;
                break;
            }
        }

        return iteration;
    }
}
