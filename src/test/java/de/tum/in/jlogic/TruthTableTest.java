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
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class TruthTableTest {
    private static Expression parse(String input) throws ExpressionSyntaxException {
        return ExpressionParser.parse(input);
    }

    @Test
    public void testConjunction() throws ExpressionSyntaxException {
        TruthTable table = TruthTable.of(parse("A∧B"));
        assertThat(table.variables(), contains("A", "B"));
        assertThat(table.rowCount(), is(4));
        assertThat(table.minterms(), contains(3));
        assertThat(table.maxterms(), contains(0, 1, 2));
        assertThat(table.rows(), contains("00|0", "01|0", "10|0", "11|1"));
        assertThat(table.value(2, 0), is(true));
        assertThat(table.value(2, 1), is(false));
    }

    @Test
    public void testRowOrder() throws ExpressionSyntaxException {
        // First variable is the most significant bit
        TruthTable table = TruthTable.of(parse("A∧¬B∧¬C"));
        assertThat(table.minterms(), contains(4));
        assertThat(TruthTable.of(parse("C"), List.of("A", "B", "C")).minterms(), contains(1, 3, 5, 7));
    }

    @Test
    public void testTautologyAndContradiction() throws ExpressionSyntaxException {
        assertThat(TruthTable.of(parse("A∨¬A")).isTautology(), is(true));
        assertThat(TruthTable.of(parse("A∨¬A")).isContradiction(), is(false));
        assertThat(TruthTable.of(parse("A∧¬A")).isContradiction(), is(true));
        assertThat(TruthTable.of(parse("A∧¬A")).minterms(), is(empty()));
        assertThat(TruthTable.of(parse("(A→B)∨(B→A)")).isTautology(), is(true));
    }

    @Test
    public void testConstants() throws ExpressionSyntaxException {
        TruthTable zero = TruthTable.of(parse("0"));
        TruthTable one = TruthTable.of(parse("1"));
        assertThat(zero.rowCount(), is(1));
        assertThat(one.result(0), is(true));
        assertThat(zero.fingerprint(), is(not(one.fingerprint())));
        assertThat(TruthTable.of(parse("¬1")).fingerprint(), is(zero.fingerprint()));
    }

    @Test
    public void testFingerprint() throws ExpressionSyntaxException {
        List<String> variables = List.of("A", "B");
        assertThat(TruthTable.fingerprint(parse("A→B"), variables),
                is(TruthTable.fingerprint(parse("¬A∨B"), variables)));
        assertThat(TruthTable.fingerprint(parse("A→B"), variables),
                is(not(TruthTable.fingerprint(parse("B→A"), variables))));
        assertThat(TruthTable.fingerprint(parse("A"), variables),
                is(TruthTable.fingerprint(parse("A∧(B∨¬B)"), variables)));
    }

    @Test
    public void testEquivalent() throws ExpressionSyntaxException {
        assertThat(TruthTable.equivalent(parse("A→B"), parse("¬B→¬A")), is(true));
        assertThat(TruthTable.equivalent(parse("A"), parse("A∧(B∨¬B)")), is(true));
        assertThat(TruthTable.equivalent(parse("A⊕B"), parse("(A∧¬B)∨(¬A∧B)")), is(true));
        assertThat(TruthTable.equivalent(parse("A→B"), parse("B→A")), is(false));
    }

    @Test
    public void testEvaluate() throws ExpressionSyntaxException {
        Map<String, Boolean> assignment = new HashMap<>();
        assignment.put("A", true);
        assignment.put("B", false);
        assertThat(TruthTable.evaluate(parse("A→B"), assignment), is(false));
        assertThat(TruthTable.evaluate(parse("A↔¬B"), assignment), is(true));
        assertThrows(EvaluationException.class, () -> TruthTable.evaluate(parse("A∧C"), assignment));
    }

    @Test
    public void testEvaluateNullValue() throws ExpressionSyntaxException {
        Map<String, Boolean> assignment = new HashMap<>();
        assignment.put("A", true);
        assignment.put("B", null);
        Expression expression = parse("A∨B");
        assertThrows(EvaluationException.class, () -> TruthTable.evaluate(expression, assignment));
    }

    @Test
    public void testMetaVariablesDoNotEvaluate() {
        Expression schema = Expression.implies(Expression.meta("p"), Expression.variable("A"));
        assertThrows(EvaluationException.class, () -> TruthTable.of(schema));
    }

    @Test
    public void testCapacity() {
        List<Expression> variables = new ArrayList<>();
        for (char name = 'A'; name <= 'Q'; name++) {
            variables.add(Expression.variable(String.valueOf(name)));
        }
        CapacityException exception =
                assertThrows(CapacityException.class, () -> TruthTable.of(Expression.and(variables)));
        assertThat(exception.variableCount(), is(17));
        assertThat(exception.limit(), is(TruthTable.MAX_VARIABLES));
    }
}
