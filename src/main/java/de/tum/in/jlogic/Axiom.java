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
import java.util.List;
import javax.annotation.Nullable;

/**
 * An equivalence schema {@code lhs ⇔ rhs} over meta-variables, which may be applied in the
 * directions given by {@link #direction()}.
 */
public final class Axiom {
    private static final Expression P = Expression.meta("p");
    private static final Expression Q = Expression.meta("q");

    public static final Axiom IMPLICATION_ELIMINATION = new Axiom("A1", "Implication elimination",
            Expression.implies(P, Q),
            Expression.or(Expression.not(P), Q),
            Direction.FORWARD, true,
            List.of(AlgebraicLaw.DE_MORGAN));

    public static final Axiom BICONDITIONAL_ELIMINATION = new Axiom("A2", "Biconditional elimination",
            Expression.iff(P, Q),
            Expression.or(Expression.and(P, Q), Expression.and(Expression.not(P), Expression.not(Q))),
            Direction.FORWARD, true,
            List.of(AlgebraicLaw.DISTRIBUTION, AlgebraicLaw.COMPLEMENT));

    public static final Axiom CONTRAPOSITION = new Axiom("A5", "Contraposition",
            Expression.implies(P, Q),
            Expression.implies(Expression.not(Q), Expression.not(P)),
            Direction.BOTH, false,
            List.of());

    public static final Axiom REDUCTIO = new Axiom("A12", "Reductio ad absurdum",
            Expression.implies(P, Expression.and(Q, Expression.not(Q))),
            Expression.not(P),
            Direction.FORWARD, false,
            List.of(AlgebraicLaw.COMPLEMENT, AlgebraicLaw.IDENTITY));

    public static final List<Axiom> CATALOG = ImmutableList.of(
            IMPLICATION_ELIMINATION, BICONDITIONAL_ELIMINATION, CONTRAPOSITION, REDUCTIO);

    private final String id;
    private final String name;
    private final Expression lhs;
    private final Expression rhs;
    private final Direction direction;
    private final boolean desugaring;
    private final List<AlgebraicLaw> derivedLaws;

    private Axiom(String id, String name, Expression lhs, Expression rhs, Direction direction, boolean desugaring,
            List<AlgebraicLaw> derivedLaws) {
        this.id = id;
        this.name = name;
        this.lhs = lhs;
        this.rhs = rhs;
        this.direction = direction;
        this.desugaring = desugaring;
        this.derivedLaws = ImmutableList.copyOf(derivedLaws);
    }

    /**
     * Looks up an axiom by id (e.g. {@code A1}), by name or by its law name, ignoring case.
     */
    @Nullable
    public static Axiom byName(String name) {
        for (Axiom axiom : CATALOG) {
            if (axiom.id.equalsIgnoreCase(name) || axiom.name.equalsIgnoreCase(name)
                    || axiom.lawName().equalsIgnoreCase(name)) {
                return axiom;
            }
        }
        return null;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    /**
     * Returns the name under which applications of this axiom are recorded.
     */
    public String lawName() {
        return id + " " + name;
    }

    public Expression lhs() {
        return lhs;
    }

    public Expression rhs() {
        return rhs;
    }

    public Direction direction() {
        return direction;
    }

    /**
     * Determines whether this axiom eliminates an implication or biconditional. Such axioms may
     * be applied even though they grow the expression.
     */
    public boolean isDesugaring() {
        return desugaring;
    }

    /**
     * Laws whose derivation relies on this axiom.
     */
    public List<AlgebraicLaw> derivedLaws() {
        return derivedLaws;
    }

    @Override
    public String toString() {
        return id + ": " + lhs + (direction == Direction.BOTH ? " ⇔ " : " ⇒ ") + rhs;
    }

    public enum Direction {
        /** Left-hand side to right-hand side only. */
        FORWARD,
        BOTH
    }
}
