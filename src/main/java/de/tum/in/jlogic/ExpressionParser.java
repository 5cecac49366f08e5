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

import de.tum.in.jlogic.Lexer.Token;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads expressions from text.
 *
 * <p>Operators, from tightest to loosest binding: {@code ¬}; {@code ∧}; {@code ∨ ⊕ ↑ ↓};
 * {@code → ←}; {@code ↔}. Implications and the biconditional associate to the right, all other
 * binary operators to the left. Exclusive or, NAND, NOR and converse implication are rewritten
 * into the basic connectives while reading.
 */
public final class ExpressionParser {
    private static final Logger logger = Logger.getLogger(ExpressionParser.class.getName());

    private final List<Token> tokens;
    private int index = 0;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Validates {@code input} and returns it in standard spelling without whitespace.
     */
    public static String standardize(String input) throws ExpressionSyntaxException {
        List<Token> tokens = Lexer.tokenize(input);
        validate(tokens);
        StringBuilder builder = new StringBuilder(tokens.size());
        for (Token token : tokens) {
            builder.append(token.symbol());
        }
        return builder.toString();
    }

    /**
     * Validates {@code input} and builds the corresponding tree. The tree is not normalized,
     * implications and biconditionals are kept.
     */
    public static Expression parse(String input) throws ExpressionSyntaxException {
        List<Token> tokens = Lexer.tokenize(input);
        validate(tokens);
        ExpressionParser parser = new ExpressionParser(tokens);
        Expression expression = parser.parseBinary(1);
        Util.checkState(parser.index == tokens.size(), "Trailing tokens after %s", expression);
        logger.log(Level.FINE, "Parsed {0} into {1}", new Object[] {input, expression});
        return expression;
    }

    private static void validate(List<Token> tokens) throws ExpressionSyntaxException {
        if (tokens.isEmpty()) {
            throw new ExpressionSyntaxException("Empty expression", -1, "");
        }

        Deque<Token> open = new ArrayDeque<>();
        boolean expectOperand = true;
        Token previous = null;
        for (Token token : tokens) {
            switch (token.type) {
                case VARIABLE:
                case CONSTANT:
                    if (!expectOperand) {
                        throw new ExpressionSyntaxException("Missing operator between operands", token.position,
                                token.raw);
                    }
                    expectOperand = false;
                    break;
                case NOT:
                    if (!expectOperand) {
                        throw new ExpressionSyntaxException("Negation cannot follow an operand", token.position,
                                token.raw);
                    }
                    break;
                case OPEN:
                    if (!expectOperand) {
                        throw new ExpressionSyntaxException("Missing operator before parenthesis", token.position,
                                token.raw);
                    }
                    open.push(token);
                    break;
                case CLOSE:
                    if (open.isEmpty()) {
                        throw new ExpressionSyntaxException("Unbalanced closing parenthesis", token.position,
                                token.raw);
                    }
                    if (expectOperand) {
                        assert previous != null;
                        String message = previous.type == Token.Type.OPEN
                                ? "Empty parentheses" : "Missing operand before closing parenthesis";
                        throw new ExpressionSyntaxException(message, token.position, token.raw);
                    }
                    open.pop();
                    break;
                default:
                    assert token.isBinaryOperator();
                    if (expectOperand) {
                        String message = previous == null
                                ? "Expression cannot start with an operator" : "Missing operand before operator";
                        throw new ExpressionSyntaxException(message, token.position, token.raw);
                    }
                    expectOperand = true;
                    break;
            }
            previous = token;
        }

        if (expectOperand) {
            if (previous.isBinaryOperator()) {
                throw new ExpressionSyntaxException("Expression cannot end with an operator", previous.position,
                        previous.raw);
            }
            throw new ExpressionSyntaxException("Unexpected end of input", -1, "");
        }
        if (!open.isEmpty()) {
            Token unmatched = open.peek();
            throw new ExpressionSyntaxException("Unbalanced opening parenthesis", unmatched.position, unmatched.raw);
        }
    }

    private Expression parseBinary(int minimumPrecedence) {
        Expression left = parseUnary();
        while (index < tokens.size()) {
            Token operator = tokens.get(index);
            if (!operator.isBinaryOperator() || operator.type.precedence < minimumPrecedence) {
                break;
            }
            index += 1;
            int precedence = operator.type.precedence;
            Expression right = parseBinary(operator.type.rightAssociative ? precedence : precedence + 1);
            left = combine(operator.type, left, right);
        }
        return left;
    }

    private Expression parseUnary() {
        Token token = tokens.get(index);
        index += 1;
        switch (token.type) {
            case VARIABLE:
                return Expression.variable(token.raw);
            case CONSTANT:
                return Expression.constant("1".equals(token.raw));
            case NOT:
                return Expression.not(parseUnary());
            case OPEN: {
                Expression inner = parseBinary(1);
                Util.checkState(tokens.get(index).type == Token.Type.CLOSE, "Expected ) at %s", tokens.get(index));
                index += 1;
                return inner;
            }
            default:
                throw new IllegalStateException("Unexpected token " + token);
        }
    }

    private static Expression combine(Token.Type operator, Expression left, Expression right) {
        switch (operator) {
            case AND:
                return Expression.and(left, right);
            case OR:
                return Expression.or(left, right);
            case XOR:
                return Expression.not(Expression.iff(left, right));
            case NAND:
                return Expression.not(Expression.and(left, right));
            case NOR:
                return Expression.not(Expression.or(left, right));
            case IMPLIES:
                return Expression.implies(left, right);
            case CONVERSE:
                return Expression.implies(right, left);
            case IFF:
                return Expression.iff(left, right);
            default:
                throw new IllegalStateException("Not a binary operator: " + operator);
        }
    }
}
