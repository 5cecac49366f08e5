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

import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
public abstract class Derivation {
    /**
     * The normalized expression the derivation started from.
     */
    public abstract Expression start();

    public abstract Expression result();

    public abstract List<DerivationStep> steps();

    public abstract Termination termination();

    /**
     * Determines whether each step starts with the expression the previous one ended with.
     */
    public boolean isContinuous() {
        Expression current = start();
        for (DerivationStep step : steps()) {
            if (!step.expressionBefore().equals(current)) {
                return false;
            }
            current = step.expressionAfter();
        }
        return current.equals(result());
    }

    public enum Termination {
        /** No further rewrite applies. */
        FIXPOINT,
        /** A rewrite led back to an expression seen before. */
        OSCILLATION,
        /** The step budget ran out. */
        BUDGET_EXCEEDED,
        /** The chosen rewrite did not change the expression. */
        NO_OP
    }
}
