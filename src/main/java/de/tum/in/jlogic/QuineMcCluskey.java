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
import java.util.BitSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Two-level minimization by the Quine–McCluskey method. Prime implicants are obtained by repeated
 * combination of implicants, essential ones are always selected and the remaining minterms are
 * covered by a minimal choice found with Petrick's method.
 */
public final class QuineMcCluskey {
    public static final int MAX_VARIABLES = 4;

    private static final Logger logger = Logger.getLogger(QuineMcCluskey.class.getName());

    private QuineMcCluskey() {}

    /**
     * Computes a minimal sum of products of {@code expression}.
     *
     * @throws CapacityException if the expression has more than {@link #MAX_VARIABLES} variables.
     */
    public static QuineMcCluskeyResult minimize(Expression expression) {
        List<String> variables = expression.variables();
        CapacityException.check("Quine-McCluskey", variables.size(), 0, MAX_VARIABLES);
        TruthTable table = TruthTable.of(expression, variables);
        List<Integer> minterms = table.minterms();

        ImmutableQuineMcCluskeyResult.Builder builder = ImmutableQuineMcCluskeyResult.builder()
                .variables(variables)
                .minterms(minterms);

        Expression result;
        if (table.isContradiction() || table.isTautology()) {
            result = Expression.constant(table.isTautology());
        } else {
            Cover cover = cover(minterms, variables.size());
            List<Expression> terms = new ArrayList<>(cover.selected.size());
            for (Implicant implicant : cover.selected) {
                terms.add(implicant.toTerm(variables));
            }
            result = Normalizer.junction(Expression.Kind.OR, terms);
            Map<Integer, List<String>> coverage = new LinkedHashMap<>();
            cover.coverage.forEach((minterm, implicants) -> coverage.put(minterm, patterns(implicants)));
            List<List<String>> rounds = new ArrayList<>();
            for (List<Implicant> round : cover.rounds) {
                rounds.add(patterns(round));
            }
            builder.rounds(rounds)
                    .primeImplicants(cover.primes)
                    .coverage(coverage)
                    .essentialImplicants(cover.essentials)
                    .selectedImplicants(cover.selected);
        }

        boolean verified = TruthTable.of(result, variables).fingerprint().equals(table.fingerprint());
        if (!verified) {
            logger.log(Level.WARNING, "Minimized form {0} of {1} is not equivalent", new Object[] {result, expression});
        }
        logger.log(Level.FINE, "Minimized {0} to {1}", new Object[] {expression, result});
        return builder.result(result).verified(verified).build();
    }

    /**
     * Computes prime implicants and a minimal cover of the given (non-empty) set of minterms over
     * {@code width} variables.
     */
    static Cover cover(Collection<Integer> minterms, int width) {
        Util.checkArgument(!minterms.isEmpty(), "No minterms to cover");
        Cover cover = new Cover();

        List<Implicant> current = new ArrayList<>();
        for (int minterm : new TreeSet<>(minterms)) {
            current.add(Implicant.ofMinterm(minterm, width));
        }
        Set<Implicant> primes = new TreeSet<>();
        while (!current.isEmpty()) {
            cover.rounds.add(List.copyOf(current));
            Map<Integer, List<Implicant>> groups = new TreeMap<>();
            for (Implicant implicant : current) {
                groups.computeIfAbsent(implicant.ones(), k -> new ArrayList<>()).add(implicant);
            }
            Set<Implicant> next = new LinkedHashSet<>();
            Set<Implicant> combined = new HashSet<>();
            for (Map.Entry<Integer, List<Implicant>> group : groups.entrySet()) {
                List<Implicant> neighbours = groups.get(group.getKey() + 1);
                if (neighbours == null) {
                    continue;
                }
                for (Implicant implicant : group.getValue()) {
                    for (Implicant neighbour : neighbours) {
                        Implicant merged = implicant.combine(neighbour);
                        if (merged != null) {
                            next.add(merged);
                            combined.add(implicant);
                            combined.add(neighbour);
                        }
                    }
                }
            }
            for (Implicant implicant : current) {
                if (!combined.contains(implicant)) {
                    primes.add(implicant);
                }
            }
            current = new ArrayList<>(next);
        }
        cover.primes.addAll(primes);

        for (int minterm : new TreeSet<>(minterms)) {
            List<Implicant> coverers = new ArrayList<>();
            for (Implicant prime : cover.primes) {
                if (prime.covers(minterm)) {
                    coverers.add(prime);
                }
            }
            assert !coverers.isEmpty();
            cover.coverage.put(minterm, coverers);
        }

        Set<Implicant> essentials = new LinkedHashSet<>();
        for (List<Implicant> coverers : cover.coverage.values()) {
            if (coverers.size() == 1) {
                essentials.add(coverers.get(0));
            }
        }
        cover.essentials.addAll(essentials);

        BitSet covered = coveredBy(essentials);
        List<Integer> remaining = new ArrayList<>();
        for (int minterm : cover.coverage.keySet()) {
            if (!covered.get(minterm)) {
                remaining.add(minterm);
            }
        }

        List<Implicant> selected = new ArrayList<>(essentials);
        if (!remaining.isEmpty()) {
            selected.addAll(petrick(cover.primes, cover.coverage, remaining));
        }
        cover.selected.addAll(removeRedundant(selected));
        return cover;
    }

    /**
     * Multiplies out the product over the remaining minterms of the sums of their coverers,
     * dropping products that contain another one, and returns the cheapest product.
     */
    private static List<Implicant> petrick(List<Implicant> primes, Map<Integer, List<Implicant>> coverage,
            List<Integer> remaining) {
        List<BitSet> product = new ArrayList<>();
        product.add(new BitSet());
        for (int minterm : remaining) {
            List<BitSet> expanded = new ArrayList<>();
            for (BitSet term : product) {
                for (Implicant coverer : coverage.get(minterm)) {
                    BitSet extended = BitSets.copyOf(term);
                    extended.set(primes.indexOf(coverer));
                    expanded.add(extended);
                }
            }
            product = absorb(expanded);
        }
        Util.checkState(!product.isEmpty(), "No cover for minterms %s", remaining);

        Comparator<BitSet> cost = Comparator.<BitSet>comparingInt(BitSet::cardinality)
                .thenComparingInt(term -> literalCount(primes, term))
                .thenComparing(BitSets::toList, QuineMcCluskey::compareLexicographically);
        BitSet best = product.stream().min(cost).orElseThrow();
        logger.log(Level.FINER, "Petrick product has {0} terms, chose {1}", new Object[] {product.size(), best});

        List<Implicant> chosen = new ArrayList<>();
        for (int index : BitSets.toList(best)) {
            chosen.add(primes.get(index));
        }
        return chosen;
    }

    private static List<BitSet> absorb(List<BitSet> terms) {
        List<BitSet> distinct = new ArrayList<>(new LinkedHashSet<>(terms));
        distinct.sort(Comparator.comparingInt(BitSet::cardinality));
        List<BitSet> minimal = new ArrayList<>();
        for (BitSet term : distinct) {
            boolean absorbed = false;
            for (BitSet smaller : minimal) {
                if (BitSets.isSubset(smaller, term)) {
                    absorbed = true;
                    break;
                }
            }
            if (!absorbed) {
                minimal.add(term);
            }
        }
        return minimal;
    }

    /**
     * Drops every implicant whose minterms are covered by the other selected implicants.
     */
    private static List<Implicant> removeRedundant(List<Implicant> selected) {
        List<Implicant> result = new ArrayList<>(selected);
        for (Implicant candidate : selected) {
            List<Implicant> others = new ArrayList<>(result);
            others.remove(candidate);
            if (BitSets.isSubset(candidate.minterms(), coveredBy(others))) {
                logger.log(Level.FINER, "Dropping redundant implicant {0}", candidate);
                result.remove(candidate);
            }
        }
        return result;
    }

    private static BitSet coveredBy(Collection<Implicant> implicants) {
        List<BitSet> minterms = new ArrayList<>(implicants.size());
        for (Implicant implicant : implicants) {
            minterms.add(implicant.minterms());
        }
        return BitSets.union(minterms);
    }

    private static int literalCount(List<Implicant> primes, BitSet term) {
        int count = 0;
        for (int index = term.nextSetBit(0); index >= 0; index = term.nextSetBit(index + 1)) {
            count += primes.get(index).literalCount();
        }
        return count;
    }

    private static int compareLexicographically(List<Integer> first, List<Integer> second) {
        for (int i = 0; i < Math.min(first.size(), second.size()); i++) {
            int comparison = Integer.compare(first.get(i), second.get(i));
            if (comparison != 0) {
                return comparison;
            }
        }
        return Integer.compare(first.size(), second.size());
    }

    private static List<String> patterns(Collection<Implicant> implicants) {
        List<String> patterns = new ArrayList<>(implicants.size());
        for (Implicant implicant : implicants) {
            patterns.add(implicant.pattern());
        }
        return patterns;
    }

    static final class Cover {
        final List<List<Implicant>> rounds = new ArrayList<>();
        final List<Implicant> primes = new ArrayList<>();
        final Map<Integer, List<Implicant>> coverage = new LinkedHashMap<>();
        final List<Implicant> essentials = new ArrayList<>();
        final List<Implicant> selected = new ArrayList<>();
    }
}
