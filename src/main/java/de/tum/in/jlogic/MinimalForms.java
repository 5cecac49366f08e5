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
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.immutables.value.Value;

/**
 * Minimal disjunctive and conjunctive normal forms of a function. The conjunctive form is obtained
 * by minimizing the complement, i.e. covering the zeros of the function, and negating the result.
 */
@Value.Immutable
public abstract class MinimalForms {
    private static final Logger logger = Logger.getLogger(MinimalForms.class.getName());

    /**
     * @throws CapacityException if the expression has more than
     *     {@link QuineMcCluskey#MAX_VARIABLES} variables.
     */
    public static MinimalForms of(Expression expression) {
        List<String> variables = expression.variables();
        CapacityException.check("Minimal forms", variables.size(), 0, QuineMcCluskey.MAX_VARIABLES);
        TruthTable table = TruthTable.of(expression, variables);

        Expression dnf = QuineMcCluskey.minimize(expression).result();

        Expression cnf;
        List<Integer> zeros = table.maxterms();
        if (table.isContradiction() || table.isTautology()) {
            cnf = Expression.constant(table.isTautology());
        } else {
            List<Expression> clauses = new ArrayList<>();
            for (Implicant implicant : QuineMcCluskey.cover(zeros, variables.size()).selected) {
                clauses.add(implicant.toClause(variables));
            }
            cnf = Normalizer.junction(Expression.Kind.AND, clauses);
        }

        String fingerprint = table.fingerprint();
        boolean dnfVerified = TruthTable.fingerprint(dnf, variables).equals(fingerprint);
        boolean cnfVerified = TruthTable.fingerprint(cnf, variables).equals(fingerprint);
        if (!dnfVerified || !cnfVerified) {
            logger.log(Level.WARNING, "Normal forms {0} / {1} of {2} are not equivalent",
                    new Object[] {dnf, cnf, expression});
        }
        return ImmutableMinimalForms.builder()
                .variables(variables)
                .dnf(dnf)
                .cnf(cnf)
                .dnfVerified(dnfVerified)
                .cnfVerified(cnfVerified)
                .build();
    }

    public abstract List<String> variables();

    public abstract Expression dnf();

    public abstract Expression cnf();

    public abstract boolean dnfVerified();

    public abstract boolean cnfVerified();
}
