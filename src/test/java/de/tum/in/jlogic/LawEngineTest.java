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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class LawEngineTest {
    private static Stream<Arguments> rewrites() {
        return Stream.of(
                Arguments.of(AlgebraicLaw.CONSTANT_NEGATION, "¬1", "0"),
                Arguments.of(AlgebraicLaw.CONSTANT_NEGATION, "¬0", "1"),
                Arguments.of(AlgebraicLaw.DE_MORGAN, "¬(A∧B)", "¬A∨¬B"),
                Arguments.of(AlgebraicLaw.DE_MORGAN, "¬(A∨¬B)", "¬A∧B"),
                Arguments.of(AlgebraicLaw.IDEMPOTENCE, "A∧A∧B", "A∧B"),
                Arguments.of(AlgebraicLaw.IDEMPOTENCE, "(A∧B)∨(B∧A)", "A∧B"),
                Arguments.of(AlgebraicLaw.IDENTITY, "A∧1", "A"),
                Arguments.of(AlgebraicLaw.IDENTITY, "A∨0∨B", "A∨B"),
                Arguments.of(AlgebraicLaw.DOMINATION, "A∧0", "0"),
                Arguments.of(AlgebraicLaw.DOMINATION, "A∨B∨1", "1"),
                Arguments.of(AlgebraicLaw.COMPLEMENT, "A∧¬A", "0"),
                Arguments.of(AlgebraicLaw.COMPLEMENT, "B∨A∨¬A", "1"),
                Arguments.of(AlgebraicLaw.COMPLEMENT, "(A∧B)∨¬(A∧B)", "1"),
                Arguments.of(AlgebraicLaw.ABSORPTION, "A∨(A∧B)", "A"),
                Arguments.of(AlgebraicLaw.ABSORPTION, "A∧(A∨B)", "A"),
                Arguments.of(AlgebraicLaw.ABSORPTION, "(A∧B)∨(A∧B∧C)∨D", "D∨(A∧B)"),
                Arguments.of(AlgebraicLaw.ABSORPTION_WITH_NEGATION, "A∨(¬A∧B)", "A∨B"),
                Arguments.of(AlgebraicLaw.ABSORPTION_WITH_NEGATION, "A∧(¬A∨B)", "A∧B"),
                Arguments.of(AlgebraicLaw.COMBINING, "(A∧B)∨(¬A∧B)", "B"),
                Arguments.of(AlgebraicLaw.COMBINING, "(A∧B∧C)∨(¬A∧B∧C)", "B∧C"),
                Arguments.of(AlgebraicLaw.COMBINING, "(A∨B)∧(A∨¬B)", "A"),
                Arguments.of(AlgebraicLaw.CONSENSUS, "(A∧B)∨(¬A∧C)∨(B∧C)", "(A∧B)∨(¬A∧C)"),
                Arguments.of(AlgebraicLaw.CONSENSUS, "(A∨B)∧(¬A∨C)∧(B∨C)", "(A∨B)∧(¬A∨C)"),
                Arguments.of(AlgebraicLaw.DISTRIBUTION, "A∧(¬A∨B)", "A∧B"),
                Arguments.of(AlgebraicLaw.DISTRIBUTION, "A∧(¬A∨¬A)", "0"),
                Arguments.of(AlgebraicLaw.FACTORING, "(A∧B)∨(A∧C)", "A∧(B∨C)"),
                Arguments.of(AlgebraicLaw.FACTORING, "(A∨B)∧(A∨C)", "A∨(B∧C)"));
    }

    private static Stream<Arguments> inapplicable() {
        return Stream.of(
                Arguments.of(AlgebraicLaw.CONSTANT_NEGATION, "¬A"),
                Arguments.of(AlgebraicLaw.DE_MORGAN, "¬A"),
                Arguments.of(AlgebraicLaw.IDEMPOTENCE, "A∧B"),
                Arguments.of(AlgebraicLaw.IDENTITY, "A∨1"),
                Arguments.of(AlgebraicLaw.DOMINATION, "A∨0"),
                Arguments.of(AlgebraicLaw.COMPLEMENT, "A∧¬B"),
                Arguments.of(AlgebraicLaw.ABSORPTION, "(A∧B)∨(A∧C)"),
                Arguments.of(AlgebraicLaw.COMBINING, "(A∧B)∨(¬A∧C)"),
                Arguments.of(AlgebraicLaw.CONSENSUS, "(A∧B)∨(¬A∧C)∨D"),
                Arguments.of(AlgebraicLaw.FACTORING, "(A∧B)∨(C∧D)"));
    }

    private static Expression normalized(String input) throws ExpressionSyntaxException {
        return Normalizer.normalize(ExpressionParser.parse(input), true);
    }

    private static List<String> laws(List<Match> matches) {
        return matches.stream().map(Match::law).collect(Collectors.toList());
    }

    @ParameterizedTest
    @MethodSource("rewrites")
    public void testRewrite(AlgebraicLaw law, String input, String expected) throws ExpressionSyntaxException {
        Expression before = normalized(input);
        Expression after = LawEngine.rewrite(law, before);
        assertThat(after, is(not(nullValue())));
        assertThat(after.toString(), is(expected));
        assertThat(TruthTable.equivalent(before, after), is(true));
    }

    @ParameterizedTest
    @MethodSource("inapplicable")
    public void testNotApplicable(AlgebraicLaw law, String input) throws ExpressionSyntaxException {
        assertThat(LawEngine.rewrite(law, normalized(input)), is(nullValue()));
    }

    @Test
    public void testFindMatchesAtEveryPosition() throws ExpressionSyntaxException {
        Expression tree = normalized("C∧¬(A∧1)");
        List<Match> matches = LawEngine.findMatches(tree);
        assertThat(laws(matches), hasItem("De Morgan"));
        assertThat(laws(matches), hasItem("Identity"));
        for (Match match : matches) {
            assertThat(match.path().get(tree), is(match.before()));
            assertThat(match.source(), is(Match.Source.ALGEBRAIC));
            assertThat(TruthTable.equivalent(match.before(), match.after()), is(true));
        }
    }

    @Test
    public void testDistributionIsGated() throws ExpressionSyntaxException {
        assertThat(laws(LawEngine.findMatches(normalized("A∧(B∨C)"))), not(hasItem("Distribution")));
        assertThat(laws(LawEngine.findMatches(normalized("A∧(¬A∨B)"))), hasItem("Distribution"));
    }

    @Test
    public void testFactoringIsGated() throws ExpressionSyntaxException {
        assertThat(laws(LawEngine.findMatches(normalized("(A∧B)∨(A∧C)"))), hasItem("Factoring"));
        assertThat(laws(LawEngine.findMatches(normalized("(A∧B)∨(A∧C)∨D"))), hasItem("Factoring"));
        assertThat(laws(LawEngine.findMatches(normalized("A∨(B∧C)"))), not(hasItem("Factoring")));
    }

    @Test
    public void testMatchesAtPath() throws ExpressionSyntaxException {
        Expression tree = normalized("C∨¬(A∧B)");
        List<Match> matches = LawEngine.findMatches(tree, TreePath.of(1));
        assertThat(laws(matches), hasItem("De Morgan"));
        for (Match match : matches) {
            assertThat(match.path(), is(TreePath.of(1)));
        }
    }

    @Test
    public void testLawNames() {
        assertThat(AlgebraicLaw.byName("de morgan"), is(AlgebraicLaw.DE_MORGAN));
        assertThat(AlgebraicLaw.byName("ABSORPTION_WITH_NEGATION"), is(AlgebraicLaw.ABSORPTION_WITH_NEGATION));
        assertThat(AlgebraicLaw.byName("Modus ponens"), is(nullValue()));
    }
}
