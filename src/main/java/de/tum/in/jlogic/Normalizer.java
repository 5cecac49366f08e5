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
import java.util.Comparator;
import java.util.List;

/**
 * Baseline normalization: flattening of conjunctions and disjunctions, deterministic argument
 * order, removal of double negation and, on request, elimination of implications and
 * biconditionals. De Morgan and constant absorption are left to the laws.
 */
public final class Normalizer {
    /**
     * Total order on normalized trees used for the arguments of conjunctions and disjunctions:
     * constants, then literals by variable (positive first), then everything else by kind and
     * canonical text.
     */
    public static final Comparator<Expression> ORDER = Normalizer::compare;

    private Normalizer() {}

    public static Expression normalize(Expression expression) {
        return normalize(expression, false);
    }

    public static Expression normalize(Expression expression, boolean expandImplications) {
        switch (expression.kind()) {
            case CONSTANT:
            case VARIABLE:
            case META:
                return expression;
            case NOT: {
                Expression child = normalize(((Expression.Not) expression).child(), expandImplications);
                if (child.kind() == Expression.Kind.NOT) {
                    return ((Expression.Not) child).child();
                }
                return Expression.not(child);
            }
            case AND:
            case OR: {
                Expression.Kind kind = expression.kind();
                List<Expression> arguments = new ArrayList<>();
                for (Expression argument : expression.children()) {
                    Expression normalized = normalize(argument, expandImplications);
                    if (normalized.kind() == kind) {
                        arguments.addAll(normalized.children());
                    } else {
                        arguments.add(normalized);
                    }
                }
                if (arguments.size() == 1) {
                    return arguments.get(0);
                }
                arguments.sort(ORDER);
                return Expression.junction(kind, arguments);
            }
            case IMPLIES: {
                Expression.BinaryOperation implication = (Expression.BinaryOperation) expression;
                if (expandImplications) {
                    return normalize(Expression.or(Expression.not(implication.left()), implication.right()), true);
                }
                return Expression.implies(normalize(implication.left(), false), normalize(implication.right(), false));
            }
            case IFF: {
                Expression.BinaryOperation biconditional = (Expression.BinaryOperation) expression;
                if (expandImplications) {
                    Expression left = biconditional.left();
                    Expression right = biconditional.right();
                    return normalize(
                            Expression.or(
                                    Expression.and(left, right),
                                    Expression.and(Expression.not(left), Expression.not(right))),
                            true);
                }
                return Expression.iff(normalize(biconditional.left(), false), normalize(biconditional.right(), false));
            }
            default:
                throw new IllegalStateException("Unknown kind " + expression.kind());
        }
    }

    /**
     * Builds a normalized conjunction or disjunction of the given normalized arguments. An empty
     * argument list yields the neutral element of the operation.
     */
    static Expression junction(Expression.Kind kind, List<Expression> arguments) {
        if (arguments.isEmpty()) {
            return Expression.constant(kind == Expression.Kind.AND);
        }
        if (arguments.size() == 1) {
            return arguments.get(0);
        }
        return normalize(Expression.junction(kind, arguments));
    }

    private static int rank(Expression expression) {
        switch (expression.kind()) {
            case CONSTANT:
                return 0;
            case VARIABLE:
                return 1;
            case NOT:
                return expression.isLiteral() ? 1 : 2;
            case AND:
                return 3;
            case OR:
                return 4;
            case IMPLIES:
                return 5;
            case IFF:
                return 6;
            case META:
                return 7;
            default:
                throw new IllegalStateException("Unknown kind " + expression.kind());
        }
    }

    private static int compare(Expression first, Expression second) {
        int firstRank = rank(first);
        int secondRank = rank(second);
        if (firstRank != secondRank) {
            return Integer.compare(firstRank, secondRank);
        }
        if (firstRank == 1) {
            Literal firstLiteral = Literal.of(first);
            Literal secondLiteral = Literal.of(second);
            assert firstLiteral != null && secondLiteral != null;
            return firstLiteral.compareTo(secondLiteral);
        }
        return first.toString().compareTo(second.toString());
    }
}
