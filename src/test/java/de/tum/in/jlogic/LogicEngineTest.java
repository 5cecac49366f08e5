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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

public class LogicEngineTest {
    private final LogicEngine engine = new LogicEngine();

    private static Stream<Arguments> simplifications() {
        return Stream.of(
                Arguments.of("A & !A", "0"),
                Arguments.of("A | ~A", "1"),
                Arguments.of("(A & B) | (!A & B)", "B"),
                Arguments.of("(A∧B∧C)∨(¬A∧B∧C)", "B∧C"),
                Arguments.of("A => (B & !B)", "¬A"),
                Arguments.of("A∨(A∧B)", "A"));
    }

    @ParameterizedTest
    @MethodSource("simplifications")
    public void testSimplify(String input, String expected) throws ExpressionSyntaxException {
        Simplification simplification = engine.simplify(input);
        assertThat(simplification.text(), is(expected));
        assertThat(simplification.input(), is(input));
        assertThat(simplification.verified(), is(true));
        assertThat(simplification.quineMcCluskey(), is(notNullValue()));
    }

    @Test
    public void testSimplifyRecordsAxiomStep() throws ExpressionSyntaxException {
        Simplification simplification = engine.simplify("A→(B∧¬B)");
        Derivation derivation = simplification.derivation();
        assertThat(derivation.steps().size(), is(1));
        assertThat(derivation.steps().get(0).law(), is("A12 Reductio ad absurdum"));
        assertThat(simplification.source(), is(Simplification.Source.DERIVATION));
    }

    @Test
    public void testSimplifyWithAxiomsOnly() throws ExpressionSyntaxException {
        LogicEngine axioms = new LogicEngine(ImmutableSimplifierConfiguration.builder()
                .mode(SimplifierConfiguration.Mode.AXIOMS)
                .build());
        Simplification simplification = axioms.simplify("A→(B∧¬B)");
        assertThat(simplification.text(), is("¬A"));
        assertThat(simplification.derivation().steps().get(0).source(), is(Match.Source.AXIOM));
    }

    @Test
    public void testSimplifyNeverExceedsMinimum() throws ExpressionSyntaxException {
        Simplification simplification = engine.simplify("(¬A∧¬B)∨(¬A∧¬C)∨(¬B∧C)∨(B∧¬C)∨(A∧C)∨(A∧B)");
        assertThat(simplification.result().literalCount(),
                lessThanOrEqualTo(simplification.quineMcCluskey().literalCount()));
        assertThat(simplification.verified(), is(true));
    }

    @Test
    public void testSimplifyManyVariables() throws ExpressionSyntaxException {
        Simplification simplification = engine.simplify("A∧B∧C∧D∧E");
        assertThat(simplification.quineMcCluskey(), is(nullValue()));
        assertThat(simplification.source(), is(Simplification.Source.DERIVATION));
        assertThat(simplification.text(), is("A∧B∧C∧D∧E"));

        assertThrows(CapacityException.class, () -> engine.simplify("A∧B∧C∧D∧E∧F∧G∧H∧I"));
        assertThrows(ExpressionSyntaxException.class, () -> engine.simplify("A∧"));
    }

    @Test
    public void testTautologyAndContradiction() {
        assertThat(engine.isTautology("A∨¬A"), is(true));
        assertThat(engine.isTautology("(A→B)∨(B→A)"), is(true));
        assertThat(engine.isTautology("A∨B"), is(false));
        assertThat(engine.isContradiction("A∧¬A"), is(true));
        assertThat(engine.isContradiction("A↔¬A"), is(true));
        assertThat(engine.isContradiction("A∧B"), is(false));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "(", "A∧∧B", "A∨B∨C∨D∨E∨F∨G∨H∨I∨J∨K∨L∨M∨N∨O∨P∨Q∨¬A"})
    public void testInvalidInputIsNeither(String input) {
        assertThat(engine.isTautology(input), is(false));
        assertThat(engine.isContradiction(input), is(false));
    }

    @Test
    public void testEquivalence() throws ExpressionSyntaxException {
        assertThat(engine.areEquivalent("A→B", "¬B→¬A"), is(true));
        assertThat(engine.areEquivalent("A⊕B", "¬(A↔B)"), is(true));
        assertThat(engine.areEquivalent("A→B", "B→A"), is(false));
        assertThat(engine.areEquivalent("A∨¬A", "B∨¬B"), is(true));
    }

    @Test
    public void testAnalyze() throws ExpressionSyntaxException {
        Analysis analysis = engine.analyze("A & B");
        assertThat(analysis.standardized(), is("A∧B"));
        assertThat(analysis.variables().size(), is(2));
        assertThat(analysis.truthTable().minterms().size(), is(1));
        assertThat(analysis.karnaughMap().text(), is("A∧B"));
        assertThat(analysis.quineMcCluskey().text(), is("A∧B"));
        assertThat(analysis.minimalForms().cnf().toString(), is("A∧B"));
        assertThat(analysis.tautology(), is(false));
        assertThat(analysis.contradiction(), is(false));
    }

    @Test
    public void testAnalyzeBeyondMinimizers() throws ExpressionSyntaxException {
        Analysis analysis = engine.analyze("A∧B∧C∧D∧E");
        assertThat(analysis.karnaughMap(), is(nullValue()));
        assertThat(analysis.karnaughMapError(), containsString("Karnaugh map"));
        assertThat(analysis.quineMcCluskey(), is(nullValue()));
        assertThat(analysis.quineMcCluskeyError(), is(notNullValue()));
        assertThat(analysis.minimalForms(), is(nullValue()));
        assertThat(analysis.truthTable().rowCount(), is(32));
    }

    @Test
    public void testAnalyzeConstant() throws ExpressionSyntaxException {
        Analysis analysis = engine.analyze("1");
        assertThat(analysis.karnaughMap(), is(nullValue()));
        assertThat(analysis.karnaughMapError(), is(notNullValue()));
        assertThat(analysis.quineMcCluskey().text(), is("1"));
        assertThat(analysis.tautology(), is(true));

        assertThrows(ExpressionSyntaxException.class, () -> engine.analyze("A∧∧B"));
    }
}
