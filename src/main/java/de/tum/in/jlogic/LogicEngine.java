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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point combining the parser, the rewrite driver and the minimizers on textual input.
 */
public final class LogicEngine {
    private static final Logger logger = Logger.getLogger(LogicEngine.class.getName());

    private final Simplifier simplifier;

    public LogicEngine() {
        this(SimplifierConfiguration.defaults());
    }

    public LogicEngine(SimplifierConfiguration configuration) {
        this.simplifier = new Simplifier(configuration);
    }

    /**
     * Derives a simplified form of {@code input}. If the derivation ends with more literals than
     * the Quine–McCluskey minimum, the latter is returned instead. Expressions with more than
     * {@link QuineMcCluskey#MAX_VARIABLES} variables keep the derived form.
     *
     * @throws CapacityException if the expression has more variables than the derivation
     *     supports.
     */
    public Simplification simplify(String input) throws ExpressionSyntaxException {
        Expression expression = ExpressionParser.parse(input);
        List<String> variables = expression.variables();
        Derivation derivation = simplifier.simplify(expression);

        Expression result = derivation.result();
        Simplification.Source source = Simplification.Source.DERIVATION;
        QuineMcCluskeyResult quineMcCluskey = null;
        if (variables.size() <= QuineMcCluskey.MAX_VARIABLES) {
            quineMcCluskey = QuineMcCluskey.minimize(expression);
            if (result.literalCount() > quineMcCluskey.literalCount()) {
                logger.log(Level.FINE, "Derivation result {0} of {1} is not minimal, using {2}",
                        new Object[] {result, input, quineMcCluskey.result()});
                result = quineMcCluskey.result();
                source = Simplification.Source.QUINE_MCCLUSKEY;
            }
        }

        boolean verified = EquivalenceCertificate.of(expression, result, variables).equal();
        if (!verified) {
            logger.log(Level.WARNING, "Simplified form {0} of {1} is not equivalent", new Object[] {result, input});
        }
        return ImmutableSimplification.builder()
                .input(input)
                .expression(expression)
                .derivation(derivation)
                .quineMcCluskey(quineMcCluskey)
                .result(result)
                .source(source)
                .verified(verified)
                .build();
    }

    public Analysis analyze(String input) throws ExpressionSyntaxException {
        String standardized = ExpressionParser.standardize(input);
        Expression expression = ExpressionParser.parse(input);
        List<String> variables = expression.variables();
        TruthTable table = TruthTable.of(expression, variables);

        ImmutableAnalysis.Builder builder = ImmutableAnalysis.builder()
                .input(input)
                .standardized(standardized)
                .expression(expression)
                .normalized(Normalizer.normalize(expression, true))
                .variables(variables)
                .truthTable(table)
                .tautology(table.isTautology())
                .contradiction(table.isContradiction());

        try {
            builder.karnaughMap(KarnaughMap.minimize(expression));
        } catch (CapacityException e) {
            builder.karnaughMapError(e.getMessage());
        }
        try {
            builder.quineMcCluskey(QuineMcCluskey.minimize(expression));
            builder.minimalForms(MinimalForms.of(expression));
        } catch (CapacityException e) {
            builder.quineMcCluskeyError(e.getMessage());
        }
        return builder.build();
    }

    /**
     * Determines whether {@code input} is true under every assignment. Invalid input and input
     * with too many variables yield {@code false}.
     */
    public boolean isTautology(String input) {
        try {
            return TruthTable.of(ExpressionParser.parse(input)).isTautology();
        } catch (ExpressionSyntaxException | CapacityException e) {
            logger.log(Level.WARNING, "Treating " + input + " as no tautology", e);
            return false;
        }
    }

    /**
     * Determines whether {@code input} is false under every assignment. Invalid input and input
     * with too many variables yield {@code false}.
     */
    public boolean isContradiction(String input) {
        try {
            return TruthTable.of(ExpressionParser.parse(input)).isContradiction();
        } catch (ExpressionSyntaxException | CapacityException e) {
            logger.log(Level.WARNING, "Treating " + input + " as no contradiction", e);
            return false;
        }
    }

    public boolean areEquivalent(String first, String second) throws ExpressionSyntaxException {
        return TruthTable.equivalent(ExpressionParser.parse(first), ExpressionParser.parse(second));
    }
}
