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

import javax.annotation.Nullable;

/**
 * The local rewrite laws of Boolean algebra known to {@link LawEngine}.
 */
public enum AlgebraicLaw {
    CONSTANT_NEGATION("Constant negation"),
    DE_MORGAN("De Morgan"),
    IDEMPOTENCE("Idempotence"),
    IDENTITY("Identity"),
    DOMINATION("Domination"),
    COMPLEMENT("Complement"),
    ABSORPTION("Absorption"),
    ABSORPTION_WITH_NEGATION("Absorption with negation"),
    COMBINING("Combining"),
    CONSENSUS("Consensus"),
    DISTRIBUTION("Distribution"),
    FACTORING("Factoring");

    private final String displayName;

    AlgebraicLaw(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Looks up a law by its constant name or display name, ignoring case.
     */
    @Nullable
    public static AlgebraicLaw byName(String name) {
        for (AlgebraicLaw law : values()) {
            if (law.name().equalsIgnoreCase(name) || law.displayName.equalsIgnoreCase(name)) {
                return law;
            }
        }
        return null;
    }

    /**
     * Determines whether matches of this law are only offered when they shrink the subtree.
     */
    public boolean isGated() {
        return this == DISTRIBUTION || this == FACTORING;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
