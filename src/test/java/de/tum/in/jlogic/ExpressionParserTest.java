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
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class ExpressionParserTest {
    private static Stream<Arguments> spellings() {
        return Stream.of(
                Arguments.of("A & B", "A∧B"),
                Arguments.of("~A | B", "¬A∨B"),
                Arguments.of("!A + B", "¬A∨B"),
                Arguments.of("A => B", "A→B"),
                Arguments.of("A ⇒ B", "A→B"),
                Arguments.of("A <=> B", "A↔B"),
                Arguments.of("A ⇔ B", "A↔B"),
                Arguments.of("A ≡ B", "A↔B"),
                Arguments.of("A ^ B", "A⊕B"),
                Arguments.of(" ( A∧1 ) ∨ 0 ", "(A∧1)∨0"));
    }

    private static Stream<Arguments> trees() {
        return Stream.of(
                Arguments.of("A∧B∨C", "(A∧B)∨C"),
                Arguments.of("A∨B∧C", "A∨(B∧C)"),
                Arguments.of("A→B→C", "A→(B→C)"),
                Arguments.of("A↔B↔C", "A↔(B↔C)"),
                Arguments.of("A∨B↔C→D", "(A∨B)↔(C→D)"),
                Arguments.of("¬A∧B", "¬A∧B"),
                Arguments.of("¬(A∧B)", "¬(A∧B)"),
                Arguments.of("¬¬A", "¬¬A"),
                Arguments.of("A⊕B", "¬(A↔B)"),
                Arguments.of("A↑B", "¬(A∧B)"),
                Arguments.of("A↓B", "¬(A∨B)"),
                Arguments.of("A←B", "B→A"),
                Arguments.of("((A))", "A"));
    }

    private static Stream<Arguments> errors() {
        return Stream.of(
                Arguments.of("A B", 2, "B"),
                Arguments.of("A∧", 1, "∧"),
                Arguments.of("∧A", 0, "∧"),
                Arguments.of("A∧∧B", 2, "∧"),
                Arguments.of("(A", 0, "("),
                Arguments.of("A)", 1, ")"),
                Arguments.of("()", 1, ")"),
                Arguments.of("(A∧)", 3, ")"),
                Arguments.of("A¬B", 1, "¬"),
                Arguments.of("A(B)", 1, "("),
                Arguments.of("a∧B", 0, "a"),
                Arguments.of("A∧#", 2, "#"),
                Arguments.of("", -1, ""),
                Arguments.of("   ", -1, ""),
                Arguments.of("¬", -1, ""));
    }

    @ParameterizedTest
    @MethodSource("spellings")
    public void testStandardize(String input, String expected) throws ExpressionSyntaxException {
        assertThat(ExpressionParser.standardize(input), is(expected));
    }

    @ParameterizedTest
    @MethodSource("trees")
    public void testParse(String input, String expected) throws ExpressionSyntaxException {
        assertThat(ExpressionParser.parse(input).toString(), is(expected));
    }

    @ParameterizedTest
    @MethodSource("errors")
    public void testSyntaxErrors(String input, int position, String token) {
        ExpressionSyntaxException exception =
                assertThrows(ExpressionSyntaxException.class, () -> ExpressionParser.parse(input));
        assertThat(exception.position(), is(position));
        assertThat(exception.token(), is(token));
        assertThrows(ExpressionSyntaxException.class, () -> ExpressionParser.standardize(input));
    }

    @Test
    public void testConstants() throws ExpressionSyntaxException {
        assertThat(ExpressionParser.parse("1").isConstant(true), is(true));
        assertThat(ExpressionParser.parse("0").isConstant(false), is(true));
        assertThat(ExpressionParser.parse("A∧0").variables().size(), is(1));
    }

    @Test
    public void testCanonicalTextParsesBack() throws ExpressionSyntaxException {
        for (String input : new String[] {"(C∧¬A)∨(B∧A)", "¬(A∨B)∧(C→D)", "A↔(B∨¬C)", "¬¬(A∧B∧(C∨D))"}) {
            Expression normalized = Normalizer.normalize(ExpressionParser.parse(input));
            Expression reparsed = Normalizer.normalize(ExpressionParser.parse(normalized.toString()));
            assertThat(reparsed, is(normalized));
        }
    }
}
