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

import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result column of an expression over an ordered list of variables. Rows are enumerated in binary
 * counting order, the first variable being the most significant bit.
 */
public final class TruthTable {
    public static final int MAX_VARIABLES = 16;

    private final List<String> variables;
    private final BitSet results;
    private final int rowCount;

    private TruthTable(List<String> variables, BitSet results) {
        this.variables = variables;
        this.results = results;
        this.rowCount = 1 << variables.size();
    }

    public static TruthTable of(Expression expression) {
        return of(expression, expression.variables());
    }

    /**
     * Enumerates {@code expression} over {@code variables}, which must contain every variable of
     * the expression and may contain more.
     *
     * @throws CapacityException if there are more than {@link #MAX_VARIABLES} variables.
     * @throws EvaluationException if a variable of the expression is missing.
     */
    public static TruthTable of(Expression expression, List<String> variables) {
        CapacityException.check("Truth table", variables.size(), 0, MAX_VARIABLES);
        List<String> order = ImmutableList.copyOf(variables);
        BitSet results = new BitSet(1 << order.size());
        Iterator<BitSet> iterator = new AssignmentIterator(order.size());
        int row = 0;
        while (iterator.hasNext()) {
            if (expression.evaluate(order, iterator.next())) {
                results.set(row);
            }
            row += 1;
        }
        return new TruthTable(order, results);
    }

    /**
     * Evaluates {@code expression} under the given assignment.
     *
     * @throws EvaluationException if a variable of the expression is not assigned or assigned
     *     {@code null}.
     */
    public static boolean evaluate(Expression expression, Map<String, Boolean> assignment) {
        List<String> order = new ArrayList<>(assignment.keySet());
        BitSet valuation = new BitSet(order.size());
        for (int i = 0; i < order.size(); i++) {
            Boolean value = assignment.get(order.get(i));
            if (value == null) {
                throw new EvaluationException("No value for variable " + order.get(i));
            }
            if (value) {
                valuation.set(i);
            }
        }
        return expression.evaluate(order, valuation);
    }

    /**
     * Determines whether the two expressions agree on every assignment of the union of their
     * variables.
     */
    public static boolean equivalent(Expression first, Expression second) {
        Set<String> union = new TreeSet<>(first.variables());
        union.addAll(second.variables());
        List<String> order = List.copyOf(union);
        return of(first, order).fingerprint().equals(of(second, order).fingerprint());
    }

    public static String fingerprint(Expression expression, List<String> variables) {
        return of(expression, variables).fingerprint();
    }

    public List<String> variables() {
        return variables;
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean result(int row) {
        Util.checkArgument(0 <= row && row < rowCount, "Row %d out of range", row);
        return results.get(row);
    }

    /**
     * Returns the value of variable {@code variable} in row {@code row}.
     */
    public boolean value(int row, int variable) {
        return (row >>> (variables.size() - 1 - variable) & 1) == 1;
    }

    public List<Integer> minterms() {
        return BitSets.toList(results);
    }

    public List<Integer> maxterms() {
        BitSet zeros = BitSets.copyOf(results);
        zeros.flip(0, rowCount);
        return BitSets.toList(zeros);
    }

    public boolean isTautology() {
        return results.cardinality() == rowCount;
    }

    public boolean isContradiction() {
        return results.isEmpty();
    }

    /**
     * Returns a digest of the result column. Two expressions are equivalent iff their tables over
     * the same variable list have the same fingerprint.
     */
    public String fingerprint() {
        return Hashing.sha256().newHasher()
                .putInt(rowCount)
                .putBytes(results.toByteArray())
                .hash()
                .toString();
    }

    /**
     * Returns one line per row, the assignment as binary digits followed by the result.
     */
    public List<String> rows() {
        List<String> rows = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
            String assignment = variables.isEmpty() ? "" : Util.padBinary(row, variables.size());
            rows.add(assignment + "|" + (results.get(row) ? '1' : '0'));
        }
        return rows;
    }

    @Override
    public String toString() {
        return variables + " " + String.join(",", rows());
    }
}
