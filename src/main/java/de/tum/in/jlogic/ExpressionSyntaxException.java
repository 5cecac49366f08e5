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

/**
 * Signals that the raw input text is not a well-formed expression. The position is the offset of
 * the offending token in the raw input, or {@code -1} if the input ended unexpectedly.
 */
public class ExpressionSyntaxException extends Exception {
    private final int position;
    private final String token;

    public ExpressionSyntaxException(String message, int position, String token) {
        super(position < 0 ? message : String.format("%s (at position %d, token '%s')", message, position, token));
        this.position = position;
        this.token = token;
    }

    public int position() {
        return position;
    }

    public String token() {
        return token;
    }
}
