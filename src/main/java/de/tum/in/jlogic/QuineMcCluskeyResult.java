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
import java.util.Map;
import org.immutables.value.Value;

/**
 * Outcome of {@link QuineMcCluskey#minimize(Expression)} with its intermediate tables. The tables
 * are empty for constant functions.
 */
@Value.Immutable
public abstract class QuineMcCluskeyResult {
    public abstract List<String> variables();

    public abstract List<Integer> minterms();

    /**
     * The implicants (as patterns) entering each combination round, starting with the minterms.
     */
    public abstract List<List<String>> rounds();

    public abstract List<Implicant> primeImplicants();

    /**
     * Maps each minterm to the patterns of the prime implicants covering it.
     */
    public abstract Map<Integer, List<String>> coverage();

    public abstract List<Implicant> essentialImplicants();

    public abstract List<Implicant> selectedImplicants();

    public abstract Expression result();

    public abstract boolean verified();

    public String text() {
        return result().toString();
    }

    public int termCount() {
        Expression result = result();
        if (result.kind() == Expression.Kind.CONSTANT) {
            return 0;
        }
        return result.kind() == Expression.Kind.OR ? result.children().size() : 1;
    }

    public int literalCount() {
        return result().literalCount();
    }
}
