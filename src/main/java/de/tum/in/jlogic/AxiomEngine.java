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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Matches {@link Axiom} schemas against the subtrees of a tree by syntactic unification.
 *
 * <p>Conjunctions and disjunctions with two arguments are unified in both argument orders. Larger
 * ones are only unified positionally, so a schema may miss a match which would need a different
 * argument permutation.
 */
public final class AxiomEngine {
    private AxiomEngine() {}

    public static List<Match> findMatches(Expression tree) {
        return findMatches(tree, Axiom.CATALOG);
    }

    public static List<Match> findMatches(Expression tree, List<Axiom> axioms) {
        List<Match> matches = new ArrayList<>();
        collect(tree, TreePath.root(), axioms, matches);
        return matches;
    }

    /**
     * Returns the axiom matches at the single position {@code path} of {@code tree}.
     */
    public static List<Match> findMatches(Expression tree, TreePath path) {
        List<Match> matches = new ArrayList<>();
        matchesAt(path.get(tree), path, Axiom.CATALOG, matches);
        return matches;
    }

    private static void collect(Expression node, TreePath path, List<Axiom> axioms, List<Match> matches) {
        matchesAt(node, path, axioms, matches);
        List<Expression> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            collect(children.get(i), path.child(i), axioms, matches);
        }
    }

    private static void matchesAt(Expression node, TreePath path, List<Axiom> axioms, List<Match> matches) {
        for (Axiom axiom : axioms) {
            tryDirection(axiom, axiom.lhs(), axiom.rhs(), node, path, matches);
            if (axiom.direction() == Axiom.Direction.BOTH) {
                tryDirection(axiom, axiom.rhs(), axiom.lhs(), node, path, matches);
            }
        }
    }

    private static void tryDirection(Axiom axiom, Expression from, Expression to, Expression node, TreePath path,
            List<Match> matches) {
        Map<String, Expression> environment = unify(from, node, Map.of());
        if (environment == null) {
            return;
        }
        Expression instance = instantiate(to, environment);
        Util.checkState(!instance.containsMetaVariables(), "Unbound meta-variables in %s for %s", instance, axiom);
        Expression after = Normalizer.normalize(instance);
        if (after.equals(node)) {
            return;
        }
        if (axiom.isDesugaring() || Measure.of(after).isLessThan(Measure.of(node))) {
            matches.add(new Match(axiom.lawName(), Match.Source.AXIOM, path, node, after, axiom.isDesugaring()));
        }
    }

    /**
     * Unifies {@code pattern} with {@code term}, extending the bindings of {@code environment}.
     * Returns the extended bindings or {@code null} if the two do not unify. The given environment
     * is never modified.
     */
    @Nullable
    public static Map<String, Expression> unify(Expression pattern, Expression term,
            Map<String, Expression> environment) {
        switch (pattern.kind()) {
            case META: {
                String name = ((Expression.MetaVariable) pattern).name();
                Expression bound = environment.get(name);
                if (bound != null) {
                    return unify(bound, term, environment);
                }
                Map<String, Expression> extended = new HashMap<>(environment);
                extended.put(name, term);
                return extended;
            }
            case CONSTANT:
            case VARIABLE:
                return pattern.equals(term) ? environment : null;
            case NOT:
                if (term.kind() != Expression.Kind.NOT) {
                    return null;
                }
                return unify(((Expression.Not) pattern).child(), ((Expression.Not) term).child(), environment);
            case IMPLIES:
            case IFF:
                if (term.kind() != pattern.kind()) {
                    return null;
                }
                return unifyAll(pattern.children(), term.children(), environment);
            case AND:
            case OR: {
                if (term.kind() != pattern.kind() || term.children().size() != pattern.children().size()) {
                    return null;
                }
                Map<String, Expression> direct = unifyAll(pattern.children(), term.children(), environment);
                if (direct != null || pattern.children().size() != 2) {
                    return direct;
                }
                return unifyAll(pattern.children(), List.of(term.child(1), term.child(0)), environment);
            }
            default:
                throw new IllegalStateException("Unknown kind " + pattern.kind());
        }
    }

    @Nullable
    private static Map<String, Expression> unifyAll(List<Expression> patterns, List<Expression> terms,
            Map<String, Expression> environment) {
        Map<String, Expression> current = environment;
        for (int i = 0; i < patterns.size(); i++) {
            current = unify(patterns.get(i), terms.get(i), current);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Replaces the bound meta-variables of {@code pattern}. Unbound meta-variables are kept.
     */
    public static Expression instantiate(Expression pattern, Map<String, Expression> environment) {
        if (pattern.kind() == Expression.Kind.META) {
            Expression bound = environment.get(((Expression.MetaVariable) pattern).name());
            return bound == null ? pattern : bound;
        }
        List<Expression> children = pattern.children();
        if (children.isEmpty()) {
            return pattern;
        }
        List<Expression> instantiated = new ArrayList<>(children.size());
        for (Expression child : children) {
            instantiated.add(instantiate(child, environment));
        }
        return pattern.withChildren(instantiated);
    }
}
