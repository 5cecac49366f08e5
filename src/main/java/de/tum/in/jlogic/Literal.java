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
import javax.annotation.Nullable;

/**
 * A variable together with its polarity.
 */
public final class Literal implements Comparable<Literal> {
    private static final Comparator<Literal> ORDER =
            Comparator.comparing(Literal::variable).thenComparing(literal -> !literal.positive);

    private final String variable;
    private final boolean positive;

    public Literal(String variable, boolean positive) {
        this.variable = variable;
        this.positive = positive;
    }

    /**
     * Returns the literal represented by {@code expression}, or {@code null} if it is neither a
     * variable nor a negated variable.
     */
    @Nullable
    public static Literal of(Expression expression) {
        if (expression.kind() == Expression.Kind.VARIABLE) {
            return new Literal(((Expression.Variable) expression).name(), true);
        }
        if (expression.kind() == Expression.Kind.NOT) {
            Expression child = ((Expression.Not) expression).child();
            if (child.kind() == Expression.Kind.VARIABLE) {
                return new Literal(((Expression.Variable) child).name(), false);
            }
        }
        return null;
    }

    public String variable() {
        return variable;
    }

    public boolean positive() {
        return positive;
    }

    public Expression toExpression() {
        Expression node = Expression.variable(variable);
        return positive ? node : Expression.not(node);
    }

    @Override
    public int compareTo(Literal o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Literal)) {
            return false;
        }
        Literal that = (Literal) object;
        return positive == that.positive && variable.equals(that.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, positive);
    }

    @Override
    public String toString() {
        return positive ? variable : Expression.NOT_SYMBOL + variable;
    }
}
