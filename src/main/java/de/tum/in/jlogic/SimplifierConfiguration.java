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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class SimplifierConfiguration {
    public static final int DEFAULT_STEP_BUDGET = 80;
    public static final int DEFAULT_MAX_VARIABLES = 8;
    public static final int DEFAULT_LITERAL_INCREASE_LIMIT = 0;
    public static final int DEFAULT_NODE_INCREASE_WITH_LENGTH_LIMIT = 2;
    public static final int DEFAULT_LENGTH_INCREASE_LIMIT = 3;
    public static final int DEFAULT_NODE_INCREASE_LIMIT = 5;

    public static SimplifierConfiguration defaults() {
        return ImmutableSimplifierConfiguration.builder().build();
    }

    /**
     * Maximal number of rewrite attempts, including rejected ones.
     */
    @Value.Default
    public int stepBudget() {
        return DEFAULT_STEP_BUDGET;
    }

    @Value.Default
    public int maxVariables() {
        return DEFAULT_MAX_VARIABLES;
    }

    @Value.Default
    public Mode mode() {
        return Mode.MIXED;
    }

    /**
     * A step which increases the literal count by more than this is rejected.
     */
    @Value.Default
    public int literalIncreaseLimit() {
        return DEFAULT_LITERAL_INCREASE_LIMIT;
    }

    /**
     * A step which increases the node count by more than this and at the same time the length of
     * the text by more than {@link #lengthIncreaseLimit()} is rejected.
     */
    @Value.Default
    public int nodeIncreaseWithLengthLimit() {
        return DEFAULT_NODE_INCREASE_WITH_LENGTH_LIMIT;
    }

    @Value.Default
    public int lengthIncreaseLimit() {
        return DEFAULT_LENGTH_INCREASE_LIMIT;
    }

    /**
     * A step which increases the node count by more than this is rejected.
     */
    @Value.Default
    public int nodeIncreaseLimit() {
        return DEFAULT_NODE_INCREASE_LIMIT;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(stepBudget() >= 0, "Negative step budget %d", stepBudget());
        Util.checkArgument(maxVariables() >= 0, "Negative variable limit %d", maxVariables());
    }

    public enum Mode {
        /** Algebraic laws only, implications and biconditionals are eliminated first. */
        ALGEBRAIC(true, false),
        /** Axiom schemas only. */
        AXIOMS(false, true),
        /** Laws and axioms, implications are kept so that the axioms can act on them. */
        MIXED(true, true);

        private final boolean laws;
        private final boolean axioms;

        Mode(boolean laws, boolean axioms) {
            this.laws = laws;
            this.axioms = axioms;
        }

        public boolean usesLaws() {
            return laws;
        }

        public boolean usesAxioms() {
            return axioms;
        }

        public boolean expandsImplications() {
            return this == ALGEBRAIC;
        }
    }
}
