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
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Greedy rewrite driver. Each round collects every law and axiom match of the current tree, applies
 * the one leading to the smallest tree and verifies the step against the truth table. Steps that
 * grow the tree too much are rolled back and not tried again during the run, revisiting an earlier
 * tree stops the derivation.
 */
public final class Simplifier {
    private static final Logger logger = Logger.getLogger(Simplifier.class.getName());

    private final SimplifierConfiguration configuration;
    private final Function<Expression, List<Match>> matchSource;

    public Simplifier() {
        this(SimplifierConfiguration.defaults());
    }

    public Simplifier(SimplifierConfiguration configuration) {
        this(configuration, tree -> findMatches(configuration, tree));
    }

    /**
     * Creates a driver which draws the matches of each round from {@code matchSource} instead of
     * the law and axiom catalogs.
     */
    Simplifier(SimplifierConfiguration configuration, Function<Expression, List<Match>> matchSource) {
        this.configuration = configuration;
        this.matchSource = matchSource;
    }

    public SimplifierConfiguration configuration() {
        return configuration;
    }

    /**
     * Derives a simpler equivalent of {@code expression}.
     *
     * @throws CapacityException if the expression has more variables than
     *     {@link SimplifierConfiguration#maxVariables()}.
     */
    public Derivation simplify(Expression expression) {
        List<String> variables = expression.variables();
        CapacityException.check("Derivation", variables.size(), 0, configuration.maxVariables());

        Expression current = Normalizer.normalize(expression, configuration.mode().expandsImplications());
        Expression start = current;
        Set<String> seen = new HashSet<>();
        seen.add(current.toString());
        Set<List<String>> blacklist = new HashSet<>();
        List<DerivationStep> steps = new ArrayList<>();
        Derivation.Termination termination = Derivation.Termination.BUDGET_EXCEEDED;

        for (int round = 0; round < configuration.stepBudget(); round++) {
            List<Candidate> candidates = new ArrayList<>();
            for (Match match : matchSource.apply(current)) {
                if (!blacklist.contains(key(match))) {
                    candidates.add(new Candidate(match, match.path().replace(current, match.after())));
                }
            }
            if (candidates.isEmpty()) {
                termination = Derivation.Termination.FIXPOINT;
                break;
            }

            Candidate chosen = candidates.stream().min(Candidate.ORDER).orElseThrow();
            Expression next = chosen.result;
            logger.log(Level.FINER, "Round {0}: chose {1} out of {2} candidates",
                    new Object[] {round, chosen.match, candidates.size()});

            if (next.equals(current)) {
                termination = Derivation.Termination.NO_OP;
                break;
            }
            if (!chosen.match.isDesugaring()
                    && chosen.measure.isSignificantRegressionOf(Measure.of(current), configuration)) {
                logger.log(Level.FINEST, "Rejecting {0}: {1} grows too much", new Object[] {chosen.match, next});
                blacklist.add(key(chosen.match));
                continue;
            }
            EquivalenceCertificate certificate = EquivalenceCertificate.of(current, next, variables);
            if (!certificate.equal()) {
                logger.log(Level.WARNING, "Rejecting {0}: {1} is not equivalent to {2}",
                        new Object[] {chosen.match, next, current});
                blacklist.add(key(chosen.match));
                continue;
            }
            if (!seen.add(next.toString())) {
                logger.log(Level.FINE, "Oscillation at {0} via {1}", new Object[] {next, chosen.match});
                steps.add(oscillationStep(current, variables));
                termination = Derivation.Termination.OSCILLATION;
                break;
            }

            steps.add(step(chosen.match, current, next, certificate, candidates));
            current = next;
        }

        logger.log(Level.FINE, "Derived {0} from {1} in {2} steps ({3})",
                new Object[] {current, start, steps.size(), termination});
        return ImmutableDerivation.builder()
                .start(start)
                .result(current)
                .steps(steps)
                .termination(termination)
                .build();
    }

    /**
     * Applies the law or axiom named {@code law} at {@code path} of the normalized form of
     * {@code expression}.
     *
     * @throws IllegalArgumentException if the law does not apply at that position. The message
     *     lists the laws which do.
     */
    public DerivationStep applyLaw(Expression expression, TreePath path, String law) {
        List<String> variables = expression.variables();
        CapacityException.check("Derivation", variables.size(), 0, configuration.maxVariables());
        Expression current = Normalizer.normalize(expression, configuration.mode().expandsImplications());

        List<Match> matches = new ArrayList<>();
        if (configuration.mode().usesLaws()) {
            matches.addAll(LawEngine.findMatches(current, path));
        }
        if (configuration.mode().usesAxioms()) {
            matches.addAll(AxiomEngine.findMatches(current, path));
        }
        List<Candidate> candidates = new ArrayList<>(matches.size());
        for (Match match : matches) {
            candidates.add(new Candidate(match, path.replace(current, match.after())));
        }

        for (Candidate candidate : candidates) {
            if (names(candidate.match.law(), law)) {
                Expression next = candidate.result;
                return step(candidate.match, current, next, EquivalenceCertificate.of(current, next, variables),
                        candidates);
            }
        }
        throw new IllegalArgumentException(String.format("%s does not apply at %s of %s, applicable: %s",
                law, path, current, candidates.stream().map(c -> c.match.law()).collect(Collectors.toList())));
    }

    private static List<Match> findMatches(SimplifierConfiguration configuration, Expression tree) {
        List<Match> matches = new ArrayList<>();
        if (configuration.mode().usesLaws()) {
            matches.addAll(LawEngine.findMatches(tree));
        }
        if (configuration.mode().usesAxioms()) {
            matches.addAll(AxiomEngine.findMatches(tree));
        }
        return matches;
    }

    private static boolean names(String recordedLaw, String requested) {
        if (recordedLaw.equalsIgnoreCase(requested)) {
            return true;
        }
        AlgebraicLaw law = AlgebraicLaw.byName(requested);
        if (law != null) {
            return law.displayName().equals(recordedLaw);
        }
        Axiom axiom = Axiom.byName(requested);
        return axiom != null && axiom.lawName().equals(recordedLaw);
    }

    private static DerivationStep step(Match match, Expression current, Expression next,
            EquivalenceCertificate certificate, List<Candidate> candidates) {
        Set<String> alternatives = new LinkedHashSet<>();
        for (Candidate candidate : candidates) {
            if (candidate.match.path().equals(match.path()) && !candidate.match.law().equals(match.law())) {
                alternatives.add(candidate.match.law());
            }
        }
        return ImmutableDerivationStep.builder()
                .law(match.law())
                .source(match.source())
                .path(match.path())
                .before(match.before())
                .after(match.after())
                .expressionBefore(current)
                .expressionAfter(next)
                .certificate(certificate)
                .alternatives(alternatives)
                .build();
    }

    private static DerivationStep oscillationStep(Expression current, List<String> variables) {
        return ImmutableDerivationStep.builder()
                .law(DerivationStep.OSCILLATION)
                .source(Match.Source.ALGEBRAIC)
                .path(TreePath.root())
                .before(current)
                .after(current)
                .expressionBefore(current)
                .expressionAfter(current)
                .certificate(EquivalenceCertificate.of(current, current, variables))
                .build();
    }

    /**
     * Identifies a rewrite of a subtree independently of its position and the surrounding tree.
     */
    private static List<String> key(Match match) {
        return List.of(match.before().toString(), match.after().toString(), match.law());
    }

    private static final class Candidate {
        static final Comparator<Candidate> ORDER = Comparator.<Candidate, Measure>comparing(c -> c.measure)
                .thenComparing(c -> c.match.source())
                .thenComparingInt(c -> c.text.length())
                .thenComparing(c -> c.text)
                .thenComparing(c -> c.match.law());

        final Match match;
        final Expression result;
        final Measure measure;
        final String text;

        Candidate(Match match, Expression replaced) {
            this.match = match;
            this.result = Normalizer.normalize(replaced);
            this.measure = Measure.of(result);
            this.text = result.toString();
        }
    }
}
