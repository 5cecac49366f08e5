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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Location of a subtree, given as the sequence of child indices from the root. Negations have the
 * single child {@code 0}, implications and biconditionals have {@code 0} (left) and {@code 1}
 * (right), conjunctions and disjunctions are indexed by argument position.
 */
public final class TreePath {
    private static final TreePath ROOT = new TreePath(new int[0]);

    private final int[] indices;

    private TreePath(int[] indices) {
        this.indices = indices;
    }

    public static TreePath root() {
        return ROOT;
    }

    public static TreePath of(int... indices) {
        return indices.length == 0 ? ROOT : new TreePath(indices.clone());
    }

    public TreePath child(int index) {
        int[] extended = new int[indices.length + 1];
        System.arraycopy(indices, 0, extended, 0, indices.length);
        extended[indices.length] = index;
        return new TreePath(extended);
    }

    public int length() {
        return indices.length;
    }

    public List<Integer> indices() {
        ImmutableList.Builder<Integer> builder = ImmutableList.builderWithExpectedSize(indices.length);
        for (int index : indices) {
            builder.add(index);
        }
        return builder.build();
    }

    public Expression get(Expression root) {
        Expression current = root;
        for (int index : indices) {
            current = current.child(index);
        }
        return current;
    }

    /**
     * Returns a tree equal to {@code root} except that the subtree at this path is
     * {@code replacement}. Only the ancestors along the path are rebuilt, {@code root} itself is
     * left untouched.
     */
    public Expression replace(Expression root, Expression replacement) {
        Expression[] ancestors = new Expression[indices.length];
        Expression current = root;
        for (int depth = 0; depth < indices.length; depth++) {
            ancestors[depth] = current;
            current = current.child(indices[depth]);
        }
        Expression rebuilt = replacement;
        for (int depth = indices.length - 1; depth >= 0; depth--) {
            rebuilt = ancestors[depth].withChild(indices[depth], rebuilt);
        }
        return rebuilt;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof TreePath)) {
            return false;
        }
        return Arrays.equals(indices, ((TreePath) object).indices);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(indices);
    }

    @Override
    public String toString() {
        return indices().stream().map(String::valueOf).collect(Collectors.joining(",", "[", "]"));
    }
}
