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
 * A rewrite available at some position of a tree. The replacement is normalized.
 */
public final class Match {
    private final String law;
    private final Source source;
    private final TreePath path;
    private final Expression before;
    private final Expression after;
    private final boolean desugaring;

    Match(String law, Source source, TreePath path, Expression before, Expression after, boolean desugaring) {
        this.law = law;
        this.source = source;
        this.path = path;
        this.before = before;
        this.after = after;
        this.desugaring = desugaring;
    }

    public String law() {
        return law;
    }

    public Source source() {
        return source;
    }

    public TreePath path() {
        return path;
    }

    public Expression before() {
        return before;
    }

    public Expression after() {
        return after;
    }

    /**
     * Determines whether this rewrite eliminates an implication or biconditional, in which case it
     * may grow the expression.
     */
    public boolean isDesugaring() {
        return desugaring;
    }

    @Override
    public String toString() {
        return law + "@" + path + ": " + before + " => " + after;
    }

    public enum Source {
        ALGEBRAIC, AXIOM
    }
}
