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

/**
 * One rewrite of a derivation: the law, where it was applied, the subtree before and after and the
 * whole expression before and after.
 */
@Value.Immutable
public abstract class DerivationStep {
    public static final String OSCILLATION = "Oscillation detected";

    public abstract String law();

    public abstract Match.Source source();

    public abstract TreePath path();

    public abstract Expression before();

    public abstract Expression after();

    public abstract Expression expressionBefore();

    public abstract Expression expressionAfter();

    public abstract EquivalenceCertificate certificate();

    /**
     * Other laws that could have been applied at the same position.
     */
    public abstract List<String> alternatives();

    public boolean isOscillation() {
        return OSCILLATION.equals(law());
    }

    @Override
    public String toString() {
        return law() + " at " + path() + ": " + before() + " => " + after();
    }
}
