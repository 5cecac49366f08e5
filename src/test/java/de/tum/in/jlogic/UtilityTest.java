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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.Iterators;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

public class UtilityTest {
    @Test
    public void testAssignmentIteratorCount() {
        Random random = new Random(0);
        int size = 1 + random.nextInt(12);
        AssignmentIterator iterator = new AssignmentIterator(size);
        AtomicLong counter = new AtomicLong();
        iterator.forEachRemaining(i -> counter.incrementAndGet());
        assertThat(counter.get(), is(1L << size));
    }

    @Test
    public void testAssignmentIteratorOrder() {
        AssignmentIterator iterator = new AssignmentIterator(3);
        List<String> assignments = new ArrayList<>();
        while (iterator.hasNext()) {
            BitSet assignment = iterator.next();
            StringBuilder builder = new StringBuilder();
            for (int i = 0; i < 3; i++) {
                builder.append(assignment.get(i) ? '1' : '0');
            }
            assignments.add(builder.toString());
        }
        assertThat(assignments, contains("000", "001", "010", "011", "100", "101", "110", "111"));
    }

    @Test
    public void testAssignmentIteratorSizes() {
        for (int size = 0; size <= 4; size++) {
            assertThat(Iterators.size(new AssignmentIterator(size)), is(1 << size));
        }
    }

    @Test
    public void testEmptyAssignment() {
        AssignmentIterator iterator = new AssignmentIterator(0);
        assertThat(iterator.hasNext(), is(true));
        assertThat(iterator.next().isEmpty(), is(true));
        assertThat(iterator.hasNext(), is(false));
    }

    @Test
    public void testPadBinary() {
        assertThat(Util.padBinary(5, 4), is("0101"));
        assertThat(Util.padBinary(0, 2), is("00"));
    }

    @Test
    public void testBitSets() {
        assertThat(BitSets.isSubset(BitSets.of(1, 3), BitSets.of(1, 2, 3)), is(true));
        assertThat(BitSets.isSubset(BitSets.of(1, 4), BitSets.of(1, 2, 3)), is(false));
        assertThat(BitSets.toList(BitSets.union(List.of(BitSets.of(0), BitSets.of(2)))), contains(0, 2));
    }
}
