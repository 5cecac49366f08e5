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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Finds the applications of {@link AlgebraicLaw}s in a normalized tree. Every law is tried at
 * every position, each law yields at most one rewrite per position. The dual form of each law
 * (swapping conjunction and disjunction) is covered as well.
 */
public final class LawEngine {
    private LawEngine() {}

    public static List<Match> findMatches(Expression tree) {
        List<Match> matches = new ArrayList<>();
        collect(tree, TreePath.root(), matches);
        return matches;
    }

    /**
     * Returns the matches at the single position {@code path} of {@code tree}.
     */
    public static List<Match> findMatches(Expression tree, TreePath path) {
        List<Match> matches = new ArrayList<>();
        matchesAt(path.get(tree), path, matches);
        return matches;
    }

    private static void collect(Expression node, TreePath path, List<Match> matches) {
        matchesAt(node, path, matches);
        List<Expression> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            collect(children.get(i), path.child(i), matches);
        }
    }

    private static void matchesAt(Expression node, TreePath path, List<Match> matches) {
        for (AlgebraicLaw law : AlgebraicLaw.values()) {
            Expression after = rewrite(law, node);
            if (after == null || after.equals(node)) {
                continue;
            }
            if (law.isGated() && !Measure.of(after).isLessThan(Measure.of(node))) {
                continue;
            }
            matches.add(new Match(law.displayName(), Match.Source.ALGEBRAIC, path, node, after, false));
        }
    }

    /**
     * Applies {@code law} to the root of {@code node}. Returns the normalized result or
     * {@code null} if the law does not apply there.
     */
    @Nullable
    public static Expression rewrite(AlgebraicLaw law, Expression node) {
        switch (law) {
            case CONSTANT_NEGATION:
                return constantNegation(node);
            case DE_MORGAN:
                return deMorgan(node);
            case IDEMPOTENCE:
                return idempotence(node);
            case IDENTITY:
                return identity(node);
            case DOMINATION:
                return domination(node);
            case COMPLEMENT:
                return complement(node);
            case ABSORPTION:
                return absorption(node);
            case ABSORPTION_WITH_NEGATION:
                return absorptionWithNegation(node);
            case COMBINING:
                return combining(node);
            case CONSENSUS:
                return consensus(node);
            case DISTRIBUTION:
                return distribution(node);
            case FACTORING:
                return factoring(node);
            default:
                throw new IllegalStateException("Unknown law " + law);
        }
    }

    @Nullable
    private static Expression constantNegation(Expression node) {
        if (node.kind() != Expression.Kind.NOT) {
            return null;
        }
        Expression child = ((Expression.Not) node).child();
        if (child.kind() != Expression.Kind.CONSTANT) {
            return null;
        }
        return Expression.constant(!((Expression.Constant) child).value());
    }

    @Nullable
    private static Expression deMorgan(Expression node) {
        if (node.kind() != Expression.Kind.NOT) {
            return null;
        }
        Expression child = ((Expression.Not) node).child();
        if (!child.isJunction()) {
            return null;
        }
        List<Expression> negated = new ArrayList<>(child.children().size());
        for (Expression argument : child.children()) {
            negated.add(negationOf(argument));
        }
        return Normalizer.junction(dual(child.kind()), negated);
    }

    @Nullable
    private static Expression idempotence(Expression node) {
        if (!node.isJunction()) {
            return null;
        }
        Set<Expression> distinct = new LinkedHashSet<>(node.children());
        if (distinct.size() == node.children().size()) {
            return null;
        }
        return Normalizer.junction(node.kind(), new ArrayList<>(distinct));
    }

    @Nullable
    private static Expression identity(Expression node) {
        if (!node.isJunction()) {
            return null;
        }
        Expression neutral = Expression.constant(node.kind() == Expression.Kind.AND);
        if (!node.children().contains(neutral)) {
            return null;
        }
        List<Expression> remaining = new ArrayList<>(node.children());
        remaining.removeIf(neutral::equals);
        return Normalizer.junction(node.kind(), remaining);
    }

    @Nullable
    private static Expression domination(Expression node) {
        if (!node.isJunction()) {
            return null;
        }
        Expression dominant = Expression.constant(node.kind() == Expression.Kind.OR);
        return node.children().contains(dominant) ? dominant : null;
    }

    @Nullable
    private static Expression complement(Expression node) {
        if (!node.isJunction()) {
            return null;
        }
        List<Expression> arguments = node.children();
        for (Expression argument : arguments) {
            if (arguments.contains(negationOf(argument))) {
                return Expression.constant(node.kind() == Expression.Kind.OR);
            }
        }
        return null;
    }

    /**
     * {@code X∨(X∧Y) = X}, generalized to removing every argument whose terms include all terms
     * of another argument.
     */
    @Nullable
    private static Expression absorption(Expression node) {
        if (!node.isJunction()) {
            return null;
        }
        Expression.Kind dual = dual(node.kind());
        List<Expression> arguments = node.children();
        List<Set<Expression>> terms = termSets(arguments, dual);
        boolean[] removed = new boolean[arguments.size()];
        boolean any = false;
        for (int absorbed = 0; absorbed < arguments.size(); absorbed++) {
            for (int absorber = 0; absorber < arguments.size(); absorber++) {
                if (absorber == absorbed || removed[absorber]
                        || arguments.get(absorber).equals(arguments.get(absorbed))) {
                    continue;
                }
                if (terms.get(absorbed).containsAll(terms.get(absorber))) {
                    removed[absorbed] = true;
                    any = true;
                    break;
                }
            }
        }
        if (!any) {
            return null;
        }
        List<Expression> remaining = new ArrayList<>();
        for (int i = 0; i < arguments.size(); i++) {
            if (!removed[i]) {
                remaining.add(arguments.get(i));
            }
        }
        return Normalizer.junction(node.kind(), remaining);
    }

    /**
     * {@code X∨(¬X∧Y) = X∨Y}.
     */
    @Nullable
    private static Expression absorptionWithNegation(Expression node) {
        if (!node.isJunction()) {
            return null;
        }
        Expression.Kind dual = dual(node.kind());
        List<Expression> arguments = node.children();
        for (int i = 0; i < arguments.size(); i++) {
            Expression negation = negationOf(arguments.get(i));
            for (int j = 0; j < arguments.size(); j++) {
                Expression other = arguments.get(j);
                if (i == j || other.kind() != dual || !other.children().contains(negation)) {
                    continue;
                }
                List<Expression> reduced = new ArrayList<>(other.children());
                reduced.removeIf(negation::equals);
                List<Expression> result = new ArrayList<>(arguments);
                result.set(j, Normalizer.junction(dual, reduced));
                return Normalizer.junction(node.kind(), result);
            }
        }
        return null;
    }

    /**
     * {@code (X∧Y)∨(¬X∧Y) = Y}.
     */
    @Nullable
    private static Expression combining(Expression node) {
        if (!node.isJunction()) {
            return null;
        }
        Expression.Kind dual = dual(node.kind());
        List<Expression> arguments = node.children();
        List<Set<Expression>> terms = termSets(arguments, dual);
        for (int i = 0; i < arguments.size(); i++) {
            for (int j = i + 1; j < arguments.size(); j++) {
                Set<Expression> first = terms.get(i);
                Set<Expression> second = terms.get(j);
                if (first.size() != second.size() || first.size() < 2) {
                    continue;
                }
                Set<Expression> onlyFirst = new LinkedHashSet<>(first);
                onlyFirst.removeAll(second);
                Set<Expression> onlySecond = new LinkedHashSet<>(second);
                onlySecond.removeAll(first);
                if (onlyFirst.size() != 1 || onlySecond.size() != 1) {
                    continue;
                }
                Expression pivot = onlyFirst.iterator().next();
                if (!negationOf(pivot).equals(onlySecond.iterator().next())) {
                    continue;
                }
                Set<Expression> common = new LinkedHashSet<>(first);
                common.remove(pivot);
                List<Expression> result = new ArrayList<>(arguments);
                result.set(i, Normalizer.junction(dual, new ArrayList<>(common)));
                result.remove(j);
                return Normalizer.junction(node.kind(), result);
            }
        }
        return null;
    }

    /**
     * {@code (X∧Y)∨(¬X∧Z)∨T = (X∧Y)∨(¬X∧Z)} whenever {@code T} contains all terms of the
     * consensus {@code Y∧Z}.
     */
    @Nullable
    private static Expression consensus(Expression node) {
        if (!node.isJunction() || node.children().size() < 3) {
            return null;
        }
        Expression.Kind dual = dual(node.kind());
        List<Expression> arguments = node.children();
        List<Set<Expression>> terms = termSets(arguments, dual);
        for (int redundant = 0; redundant < arguments.size(); redundant++) {
            for (int positive = 0; positive < arguments.size(); positive++) {
                if (positive == redundant) {
                    continue;
                }
                for (int negative = 0; negative < arguments.size(); negative++) {
                    if (negative == redundant || negative == positive) {
                        continue;
                    }
                    if (coversConsensus(terms.get(positive), terms.get(negative), terms.get(redundant))) {
                        List<Expression> result = new ArrayList<>(arguments);
                        result.remove(redundant);
                        return Normalizer.junction(node.kind(), result);
                    }
                }
            }
        }
        return null;
    }

    private static boolean coversConsensus(Set<Expression> positive, Set<Expression> negative,
            Set<Expression> candidate) {
        for (Expression pivot : positive) {
            Expression negatedPivot = negationOf(pivot);
            if (!negative.contains(negatedPivot)) {
                continue;
            }
            Set<Expression> consensus = new LinkedHashSet<>(positive);
            consensus.remove(pivot);
            for (Expression term : negative) {
                if (!term.equals(negatedPivot)) {
                    consensus.add(term);
                }
            }
            if (!consensus.isEmpty() && candidate.containsAll(consensus)) {
                return true;
            }
        }
        return false;
    }

    /**
     * {@code X∧(Y∨Z) = (X∧Y)∨(X∧Z)} and its dual. Products containing a term and its negation are
     * dropped. Of all arguments that can be distributed over, the one giving the smallest result is
     * chosen.
     */
    @Nullable
    private static Expression distribution(Expression node) {
        if (!node.isJunction()) {
            return null;
        }
        Expression.Kind dual = dual(node.kind());
        List<Expression> arguments = node.children();
        Expression best = null;
        for (int i = 0; i < arguments.size(); i++) {
            Expression inner = arguments.get(i);
            if (inner.kind() != dual) {
                continue;
            }
            List<Expression> rest = new ArrayList<>(arguments);
            rest.remove(i);
            List<Expression> products = new ArrayList<>(inner.children().size());
            for (Expression term : inner.children()) {
                Set<Expression> product = new LinkedHashSet<>(rest);
                product.add(term);
                if (!containsComplement(product)) {
                    products.add(Normalizer.junction(node.kind(), new ArrayList<>(product)));
                }
            }
            Expression candidate = products.isEmpty()
                    ? Expression.constant(node.kind() == Expression.Kind.OR)
                    : Normalizer.junction(dual, products);
            best = smaller(best, candidate);
        }
        return best;
    }

    /**
     * {@code (A∧X)∨(A∧Y) = A∧(X∨Y)} and its dual. Of all common terms, the one giving the
     * smallest result is factored out.
     */
    @Nullable
    private static Expression factoring(Expression node) {
        if (!node.isJunction()) {
            return null;
        }
        Expression.Kind dual = dual(node.kind());
        List<Expression> arguments = node.children();
        List<Set<Expression>> terms = termSets(arguments, dual);
        Set<Expression> factors = new LinkedHashSet<>();
        for (Set<Expression> set : terms) {
            factors.addAll(set);
        }

        Expression best = null;
        for (Expression factor : factors) {
            List<Expression> remainders = new ArrayList<>();
            List<Expression> others = new ArrayList<>();
            for (int i = 0; i < arguments.size(); i++) {
                Set<Expression> set = terms.get(i);
                if (set.size() >= 2 && set.contains(factor)) {
                    Set<Expression> remainder = new LinkedHashSet<>(set);
                    remainder.remove(factor);
                    remainders.add(Normalizer.junction(dual, new ArrayList<>(remainder)));
                } else {
                    others.add(arguments.get(i));
                }
            }
            if (remainders.size() < 2) {
                continue;
            }
            Expression factored = Normalizer.junction(dual,
                    List.of(factor, Normalizer.junction(node.kind(), remainders)));
            others.add(factored);
            best = smaller(best, Normalizer.junction(node.kind(), others));
        }
        return best;
    }

    private static boolean containsComplement(Set<Expression> terms) {
        for (Expression term : terms) {
            if (terms.contains(negationOf(term))) {
                return true;
            }
        }
        return false;
    }

    private static Expression smaller(@Nullable Expression current, Expression candidate) {
        if (current == null) {
            return candidate;
        }
        int comparison = Measure.of(candidate).compareTo(Measure.of(current));
        if (comparison < 0 || (comparison == 0 && candidate.toString().compareTo(current.toString()) < 0)) {
            return candidate;
        }
        return current;
    }

    /**
     * Returns the normalized negation of {@code expression}.
     */
    static Expression negationOf(Expression expression) {
        return expression.kind() == Expression.Kind.NOT
                ? ((Expression.Not) expression).child()
                : Expression.not(expression);
    }

    static Expression.Kind dual(Expression.Kind kind) {
        switch (kind) {
            case AND:
                return Expression.Kind.OR;
            case OR:
                return Expression.Kind.AND;
            default:
                throw new IllegalArgumentException("No dual for " + kind);
        }
    }

    /**
     * Views every argument as a junction of kind {@code dual}, returning the set of its terms.
     */
    private static List<Set<Expression>> termSets(List<Expression> arguments, Expression.Kind dual) {
        List<Set<Expression>> sets = new ArrayList<>(arguments.size());
        for (Expression argument : arguments) {
            sets.add(argument.kind() == dual
                    ? new LinkedHashSet<>(argument.children())
                    : new LinkedHashSet<>(List.of(argument)));
        }
        return sets;
    }
}
