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

import java.util.Comparator;
import java.util.Objects;

/**
 * Cost of a tree used to rank rewrites: literal count, then node count, then length of the
 * canonical text, compared lexicographically.
 */
public final class Measure implements Comparable<Measure> {
    private static final Comparator<Measure> ORDER = Comparator.comparingInt(Measure::literals)
            .thenComparingInt(Measure::nodes)
            .thenComparingInt(Measure::length);

    private final int literals;
    private final int nodes;
    private final int length;

    Measure(int literals, int nodes, int length) {
        this.literals = literals;
        this.nodes = nodes;
        this.length = length;
    }

    public static Measure of(Expression expression) {
        return new Measure(expression.literalCount(), expression.nodeCount(), expression.toString().length());
    }

    public int literals() {
        return literals;
    }

    public int nodes() {
        return nodes;
    }

    public int length() {
        return length;
    }

    public boolean isLessThan(Measure other) {
        return compareTo(other) < 0;
    }

    /**
     * Determines whether going from {@code before} to this measure is a regression the driver
     * should not accept, according to the thresholds of {@code configuration}.
     */
    boolean isSignificantRegressionOf(Measure before, SimplifierConfiguration configuration) {
        if (literals > before.literals + configuration.literalIncreaseLimit()) {
            return true;
        }
        if (nodes > before.nodes + configuration.nodeIncreaseWithLengthLimit()
                && length > before.length + configuration.lengthIncreaseLimit()) {
            return true;
        }
        return nodes > before.nodes + configuration.nodeIncreaseLimit();
    }

    @Override
    public int compareTo(Measure o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Measure)) {
            return false;
        }
        Measure that = (Measure) object;
        return literals == that.literals && nodes == that.nodes && length == that.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(literals, nodes, length);
    }

    @Override
    public String toString() {
        return "(" + literals + "," + nodes + "," + length + ")";
    }
}
