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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Minimization by grouping adjacent true cells of a Karnaugh map. Groups are chosen greedily,
 * largest first, so the result is equivalent but not necessarily minimal.
 */
public final class KarnaughMap {
    public static final int MAX_VARIABLES = 4;

    private static final Logger logger = Logger.getLogger(KarnaughMap.class.getName());
    private static final List<Integer> GRAY_ONE_BIT = List.of(0, 1);
    private static final List<Integer> GRAY_TWO_BITS = List.of(0, 1, 3, 2);

    private final List<String> variables;
    private final int rowBits;
    private final int columnBits;
    private final List<Integer> rowOrder;
    private final List<Integer> columnOrder;
    private final boolean[][] grid;

    private KarnaughMap(List<String> variables, TruthTable table) {
        this.variables = variables;
        int count = variables.size();
        this.rowBits = count / 2;
        this.columnBits = count - rowBits;
        this.rowOrder = grayOrder(rowBits);
        this.columnOrder = grayOrder(columnBits);
        this.grid = new boolean[rowOrder.size()][columnOrder.size()];
        for (int row = 0; row < rows(); row++) {
            for (int column = 0; column < columns(); column++) {
                grid[row][column] = table.result(minterm(row, column));
            }
        }
    }

    /**
     * Minimizes an expression of one to four variables.
     *
     * @throws CapacityException if the expression has no or more than {@link #MAX_VARIABLES}
     *     variables.
     */
    public static KarnaughResult minimize(Expression expression) {
        List<String> variables = expression.variables();
        CapacityException.check("Karnaugh map", variables.size(), 1, MAX_VARIABLES);
        TruthTable table = TruthTable.of(expression, variables);
        KarnaughMap map = new KarnaughMap(variables, table);

        List<KarnaughGroup> groups = table.isContradiction() || table.isTautology()
                ? List.of()
                : map.findGroups();
        Expression result;
        if (table.isContradiction() || table.isTautology()) {
            result = Expression.constant(table.isTautology());
        } else {
            List<Expression> terms = new ArrayList<>(groups.size());
            for (KarnaughGroup group : groups) {
                terms.add(group.term());
            }
            result = Normalizer.junction(Expression.Kind.OR, terms);
        }

        boolean verified = TruthTable.of(result, variables).fingerprint().equals(table.fingerprint());
        if (!verified) {
            logger.log(Level.WARNING, "Karnaugh map result {0} of {1} is not equivalent",
                    new Object[] {result, expression});
        }
        logger.log(Level.FINE, "Grouped {0} into {1} with {2} groups", new Object[] {expression, result, groups.size()});

        List<List<Boolean>> rows = new ArrayList<>(map.rows());
        for (boolean[] cells : map.grid) {
            List<Boolean> row = new ArrayList<>(cells.length);
            for (boolean cell : cells) {
                row.add(cell);
            }
            rows.add(row);
        }
        return ImmutableKarnaughResult.builder()
                .variables(variables)
                .rowVariables(variables.subList(0, map.rowBits))
                .columnVariables(variables.subList(map.rowBits, variables.size()))
                .rowOrder(map.rowOrder)
                .columnOrder(map.columnOrder)
                .grid(rows)
                .minterms(table.minterms())
                .groups(groups)
                .result(result)
                .verified(verified)
                .build();
    }

    private static List<Integer> grayOrder(int bits) {
        switch (bits) {
            case 0:
                return List.of(0);
            case 1:
                return GRAY_ONE_BIT;
            case 2:
                return GRAY_TWO_BITS;
            default:
                throw new IllegalArgumentException("Unsupported axis width " + bits);
        }
    }

    private int rows() {
        return rowOrder.size();
    }

    private int columns() {
        return columnOrder.size();
    }

    private int minterm(int row, int column) {
        return rowOrder.get(row) << columnBits | columnOrder.get(column);
    }

    /**
     * Tries all power-of-two rectangles by decreasing area and accepts every placement that
     * consists of true cells only and contains at least one cell not covered yet.
     */
    private List<KarnaughGroup> findGroups() {
        List<int[]> shapes = new ArrayList<>();
        for (int height = 1; height <= rows(); height *= 2) {
            for (int width = 1; width <= columns(); width *= 2) {
                shapes.add(new int[] {height, width});
            }
        }
        shapes.sort(Comparator.<int[]>comparingInt(shape -> -shape[0] * shape[1])
                .thenComparingInt(shape -> -shape[0]));

        BitSet covered = new BitSet();
        List<KarnaughGroup> groups = new ArrayList<>();
        for (int[] shape : shapes) {
            int height = shape[0];
            int width = shape[1];
            int startRows = height == rows() ? 1 : rows();
            int startColumns = width == columns() ? 1 : columns();
            for (int top = 0; top < startRows; top++) {
                for (int left = 0; left < startColumns; left++) {
                    List<Integer> cells = rectangle(top, left, height, width);
                    if (!allTrue(cells) || allCovered(cells, covered)) {
                        continue;
                    }
                    for (int cell : cells) {
                        covered.set(cell);
                    }
                    groups.add(group(cells, height, width));
                }
            }
        }
        return groups;
    }

    private List<Integer> rectangle(int top, int left, int height, int width) {
        List<Integer> cells = new ArrayList<>(height * width);
        for (int i = 0; i < height; i++) {
            for (int j = 0; j < width; j++) {
                int row = (top + i) % rows();
                int column = (left + j) % columns();
                cells.add(row * columns() + column);
            }
        }
        return cells;
    }

    private boolean allTrue(List<Integer> cells) {
        for (int cell : cells) {
            if (!grid[cell / columns()][cell % columns()]) {
                return false;
            }
        }
        return true;
    }

    private static boolean allCovered(List<Integer> cells, BitSet covered) {
        for (int cell : cells) {
            if (!covered.get(cell)) {
                return false;
            }
        }
        return true;
    }

    private KarnaughGroup group(List<Integer> cells, int height, int width) {
        List<Integer> minterms = new ArrayList<>(cells.size());
        for (int cell : cells) {
            minterms.add(minterm(cell / columns(), cell % columns()));
        }
        minterms.sort(Comparator.naturalOrder());

        StringBuilder pattern = new StringBuilder(variables.size());
        int first = minterms.get(0);
        for (int position = 0; position < variables.size(); position++) {
            int shift = variables.size() - 1 - position;
            int bit = first >>> shift & 1;
            boolean constant = true;
            for (int minterm : minterms) {
                if ((minterm >>> shift & 1) != bit) {
                    constant = false;
                    break;
                }
            }
            pattern.append(constant ? (char) ('0' + bit) : Implicant.DONT_CARE);
        }
        Expression term = Implicant.ofPattern(pattern.toString()).toTerm(variables);
        return ImmutableKarnaughGroup.builder()
                .cells(cells)
                .minterms(minterms)
                .height(height)
                .width(width)
                .pattern(pattern.toString())
                .term(term)
                .build();
    }
}
