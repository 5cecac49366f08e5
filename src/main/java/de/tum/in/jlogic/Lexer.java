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

/**
 * Splits raw input into tokens and maps alternative operator spellings onto one symbol per
 * operator.
 */
final class Lexer {
    private Lexer() {}

    static List<Token> tokenize(String input) throws ExpressionSyntaxException {
        List<Token> tokens = new ArrayList<>();
        int position = 0;
        while (position < input.length()) {
            char character = input.charAt(position);
            if (Character.isWhitespace(character)) {
                position += 1;
                continue;
            }
            if ('A' <= character && character <= 'Z') {
                tokens.add(new Token(Token.Type.VARIABLE, String.valueOf(character), position));
                position += 1;
                continue;
            }
            if (input.startsWith("<=>", position)) {
                tokens.add(new Token(Token.Type.IFF, "<=>", position));
                position += 3;
                continue;
            }
            if (input.startsWith("=>", position)) {
                tokens.add(new Token(Token.Type.IMPLIES, "=>", position));
                position += 2;
                continue;
            }

            Token.Type type;
            switch (character) {
                case '0':
                case '1':
                    type = Token.Type.CONSTANT;
                    break;
                case '¬':
                case '~':
                case '!':
                    type = Token.Type.NOT;
                    break;
                case '∧':
                case '&':
                    type = Token.Type.AND;
                    break;
                case '∨':
                case '|':
                case '+':
                    type = Token.Type.OR;
                    break;
                case '⊕':
                case '^':
                    type = Token.Type.XOR;
                    break;
                case '↑':
                    type = Token.Type.NAND;
                    break;
                case '↓':
                    type = Token.Type.NOR;
                    break;
                case '→':
                case '⇒':
                    type = Token.Type.IMPLIES;
                    break;
                case '←':
                    type = Token.Type.CONVERSE;
                    break;
                case '↔':
                case '⇔':
                case '≡':
                    type = Token.Type.IFF;
                    break;
                case '(':
                    type = Token.Type.OPEN;
                    break;
                case ')':
                    type = Token.Type.CLOSE;
                    break;
                default:
                    throw new ExpressionSyntaxException("Invalid character", position, String.valueOf(character));
            }
            tokens.add(new Token(type, String.valueOf(character), position));
            position += 1;
        }
        return tokens;
    }

    static final class Token {
        final Type type;
        final String raw;
        final int position;

        Token(Type type, String raw, int position) {
            this.type = type;
            this.raw = raw;
            this.position = position;
        }

        /**
         * Returns the text of this token in standard spelling.
         */
        String symbol() {
            switch (type) {
                case VARIABLE:
                case CONSTANT:
                    return raw;
                default:
                    return type.symbol;
            }
        }

        boolean isBinaryOperator() {
            return type.precedence > 0 && type != Type.NOT;
        }

        @Override
        public String toString() {
            return raw + "@" + position;
        }

        enum Type {
            VARIABLE("", 0, false),
            CONSTANT("", 0, false),
            NOT("¬", 5, false),
            AND("∧", 4, false),
            OR("∨", 3, false),
            XOR("⊕", 3, false),
            NAND("↑", 3, false),
            NOR("↓", 3, false),
            IMPLIES("→", 2, true),
            CONVERSE("←", 2, true),
            IFF("↔", 1, true),
            OPEN("(", 0, false),
            CLOSE(")", 0, false);

            final String symbol;
            final int precedence;
            final boolean rightAssociative;

            Type(String symbol, int precedence, boolean rightAssociative) {
                this.symbol = symbol;
                this.precedence = precedence;
                this.rightAssociative = rightAssociative;
            }
        }
    }
}
