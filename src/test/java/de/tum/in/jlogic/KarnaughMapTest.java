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
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

public class KarnaughMapTest {
    private static Expression parse(String input) throws ExpressionSyntaxException {
        return ExpressionParser.parse(input);
    }

    @Test
    public void testContradictionAndTautology() throws ExpressionSyntaxException {
        KarnaughResult contradiction = KarnaughMap.minimize(parse("A∧¬A"));
        assertThat(contradiction.text(), is("0"));
        assertThat(contradiction.groups(), is(empty()));
        assertThat(contradiction.verified(), is(true));

        KarnaughResult tautology = KarnaughMap.minimize(parse("A∨¬A"));
        assertThat(tautology.text(), is("1"));
        assertThat(tautology.verified(), is(true));
    }

    @Test
    public void testSingleVariable() throws ExpressionSyntaxException {
        KarnaughResult result = KarnaughMap.minimize(parse("¬¬A"));
        assertThat(result.rowVariables(), is(empty()));
        assertThat(result.columnVariables(), contains("A"));
        assertThat(result.grid(), contains(List.of(false, true)));
        assertThat(result.text(), is("A"));
    }

    @Test
    public void testTwoVariables() throws ExpressionSyntaxException {
        KarnaughResult result = KarnaughMap.minimize(parse("(A∧B)∨(¬A∧B)"));
        assertThat(result.grid(), contains(List.of(false, true), List.of(false, true)));
        assertThat(result.minterms(), contains(1, 3));
        assertThat(result.groups().size(), is(1));
        KarnaughGroup group = result.groups().get(0);
        assertThat(group.height(), is(2));
        assertThat(group.width(), is(1));
        assertThat(group.pattern(), is("-1"));
        assertThat(group.minterms(), contains(1, 3));
        assertThat(result.text(), is("B"));
        assertThat(result.verified(), is(true));
    }

    @Test
    public void testThreeVariables() throws ExpressionSyntaxException {
        KarnaughResult result = KarnaughMap.minimize(parse("(A∧B∧C)∨(¬A∧B∧C)"));
        assertThat(result.rowVariables(), contains("A"));
        assertThat(result.columnVariables(), contains("B", "C"));
        assertThat(result.columnOrder(), contains(0, 1, 3, 2));
        assertThat(result.groups().size(), is(1));
        assertThat(result.groups().get(0).cells(), contains(2, 6));
        assertThat(result.text(), is("B∧C"));
    }

    @Test
    public void testGrayWraparound() throws ExpressionSyntaxException {
        // Columns BC = 00 and BC = 10 are neighbours across the edge
        KarnaughResult result = KarnaughMap.minimize(parse("¬C∧(A∨¬A)∧(B∨¬B)"));
        assertThat(result.groups().size(), is(1));
        assertThat(result.groups().get(0).size(), is(4));
        assertThat(result.text(), is("¬C"));
    }

    @Test
    public void testFourVariables() throws ExpressionSyntaxException {
        KarnaughResult result = KarnaughMap.minimize(parse("(A∨¬A)∧B∧(C∨¬C)∧D"));
        assertThat(result.rowVariables(), contains("A", "B"));
        assertThat(result.rowOrder(), contains(0, 1, 3, 2));
        assertThat(result.groups().size(), is(1));
        assertThat(result.groups().get(0).pattern(), is("-1-1"));
        assertThat(result.text(), is("B∧D"));
    }

    @Test
    public void testCorners() throws ExpressionSyntaxException {
        KarnaughResult result = KarnaughMap.minimize(parse("¬B∧¬D∧(A∨¬A)∧(C∨¬C)"));
        assertThat(result.groups().size(), is(1));
        assertThat(result.groups().get(0).cells(), contains(15, 12, 3, 0));
        assertThat(result.text(), is("¬B∧¬D"));
    }

    @Test
    public void testSeveralGroups() throws ExpressionSyntaxException {
        KarnaughResult result = KarnaughMap.minimize(parse("(A∧B)∨(¬A∧C)"));
        assertThat(result.verified(), is(true));
        assertThat(TruthTable.equivalent(result.result(), parse("(A∧B)∨(¬A∧C)")), is(true));
    }

    @Test
    public void testCapacity() {
        assertThrows(CapacityException.class, () -> KarnaughMap.minimize(parse("A∧B∧C∧D∧E")));
        assertThrows(CapacityException.class, () -> KarnaughMap.minimize(parse("1")));
    }
}
