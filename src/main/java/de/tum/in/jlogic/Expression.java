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
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import javax.annotation.Nullable;

/**
 * Immutable propositional formula. The set of node kinds is closed, consumers dispatch on
 * {@link #kind()} and cast to the nested node class.
 *
 * <p>Equality and hashing are defined through the canonical text ({@link #toString()}), so two
 * trees are equal iff they serialize identically. Apply {@link Normalizer#normalize(Expression,
 * boolean)} first to make this a semantic-class equality.
 */
@SuppressWarnings("AccessingNonPublicFieldOfAnotherObject")
public abstract class Expression {
    public static final char NOT_SYMBOL = '¬';
    public static final char AND_SYMBOL = '∧';
    public static final char OR_SYMBOL = '∨';
    public static final char IMPLIES_SYMBOL = '→';
    public static final char IFF_SYMBOL = '↔';

    private static final Constant TRUE = new Constant(true);
    private static final Constant FALSE = new Constant(false);

    @Nullable
    private String canonical;

    Expression() {}

    public static Expression constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Expression variable(String name) {
        return new Variable(name);
    }

    public static Expression not(Expression child) {
        return new Not(child);
    }

    public static Expression and(Expression... arguments) {
        return new NaryOperation(Kind.AND, ImmutableList.copyOf(arguments));
    }

    public static Expression and(List<Expression> arguments) {
        return new NaryOperation(Kind.AND, ImmutableList.copyOf(arguments));
    }

    public static Expression or(Expression... arguments) {
        return new NaryOperation(Kind.OR, ImmutableList.copyOf(arguments));
    }

    public static Expression or(List<Expression> arguments) {
        return new NaryOperation(Kind.OR, ImmutableList.copyOf(arguments));
    }

    /**
     * Builds a conjunction or disjunction, depending on {@code kind}.
     */
    public static Expression junction(Kind kind, List<Expression> arguments) {
        Util.checkArgument(kind == Kind.AND || kind == Kind.OR, "Not a junction: %s", kind);
        return new NaryOperation(kind, ImmutableList.copyOf(arguments));
    }

    public static Expression implies(Expression left, Expression right) {
        return new BinaryOperation(Kind.IMPLIES, left, right);
    }

    public static Expression iff(Expression left, Expression right) {
        return new BinaryOperation(Kind.IFF, left, right);
    }

    static Expression meta(String name) {
        return new MetaVariable(name);
    }

    public abstract Kind kind();

    public abstract List<Expression> children();

    /**
     * Returns a node of the same kind with the given children. The number of children has to fit
     * the kind.
     */
    public abstract Expression withChildren(List<Expression> children);

    public Expression child(int index) {
        List<Expression> children = children();
        Util.checkArgument(0 <= index && index < children.size(),
                "Child index %d out of range for %s node with %d children", index, kind(), children.size());
        return children.get(index);
    }

    public Expression withChild(int index, Expression child) {
        List<Expression> children = new ArrayList<>(children());
        Util.checkArgument(0 <= index && index < children.size(),
                "Child index %d out of range for %s node with %d children", index, kind(), children.size());
        children.set(index, child);
        return withChildren(children);
    }

    /**
     * Evaluates this tree, where bit {@code i} of {@code valuation} is the value of
     * {@code variables.get(i)}.
     *
     * @throws EvaluationException if a variable is not contained in {@code variables} or a
     *     meta-variable is encountered.
     */
    public abstract boolean evaluate(List<String> variables, BitSet valuation);

    abstract void gatherVariables(Set<String> set);

    abstract void write(StringBuilder builder);

    /**
     * Returns the variables occurring in this tree in ascending order.
     */
    public List<String> variables() {
        Set<String> set = new TreeSet<>();
        gatherVariables(set);
        return List.copyOf(set);
    }

    public int nodeCount() {
        int count = 1;
        for (Expression child : children()) {
            count += child.nodeCount();
        }
        return count;
    }

    public int literalCount() {
        int count = 0;
        for (Expression child : children()) {
            count += child.literalCount();
        }
        return count;
    }

    public int depth() {
        int depth = 0;
        for (Expression child : children()) {
            depth = Math.max(depth, child.depth());
        }
        return depth + 1;
    }

    public boolean isCompound() {
        Kind kind = kind();
        return kind == Kind.AND || kind == Kind.OR || kind == Kind.IMPLIES || kind == Kind.IFF;
    }

    public boolean isJunction() {
        return kind() == Kind.AND || kind() == Kind.OR;
    }

    /**
     * Determines whether this is a variable or a negated variable.
     */
    public boolean isLiteral() {
        return kind() == Kind.VARIABLE || (kind() == Kind.NOT && ((Not) this).child.kind() == Kind.VARIABLE);
    }

    public boolean isConstant(boolean value) {
        return kind() == Kind.CONSTANT && ((Constant) this).value == value;
    }

    public boolean containsMetaVariables() {
        if (kind() == Kind.META) {
            return true;
        }
        for (Expression child : children()) {
            if (child.containsMetaVariables()) {
                return true;
            }
        }
        return false;
    }

    final void writeOperand(StringBuilder builder) {
        if (isCompound()) {
            builder.append('(');
            write(builder);
            builder.append(')');
        } else {
            write(builder);
        }
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Expression)) {
            return false;
        }
        return toString().equals(object.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    /**
     * Returns the canonical text of this tree.
     */
    @Override
    public String toString() {
        String text = canonical;
        if (text == null) {
            StringBuilder builder = new StringBuilder();
            write(builder);
            text = builder.toString();
            canonical = text;
        }
        return text;
    }

    public enum Kind {
        CONSTANT, VARIABLE, NOT, AND, OR, IMPLIES, IFF, META
    }

    public static final class Constant extends Expression {
        private final boolean value;

        private Constant(boolean value) {
            this.value = value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.CONSTANT;
        }

        @Override
        public List<Expression> children() {
            return List.of();
        }

        @Override
        public Expression withChildren(List<Expression> children) {
            Util.checkArgument(children.isEmpty(), "Constants have no children");
            return this;
        }

        @Override
        public boolean evaluate(List<String> variables, BitSet valuation) {
            return value;
        }

        @Override
        void gatherVariables(Set<String> set) {
            // No variables in this leaf
        }

        @Override
        void write(StringBuilder builder) {
            builder.append(value ? '1' : '0');
        }
    }

    public static final class Variable extends Expression {
        private final String name;

        private Variable(String name) {
            this.name = name;
        }

        public String name() {
            return name;
        }

        @Override
        public Kind kind() {
            return Kind.VARIABLE;
        }

        @Override
        public List<Expression> children() {
            return List.of();
        }

        @Override
        public Expression withChildren(List<Expression> children) {
            Util.checkArgument(children.isEmpty(), "Variables have no children");
            return this;
        }

        @Override
        public boolean evaluate(List<String> variables, BitSet valuation) {
            int index = variables.indexOf(name);
            if (index < 0) {
                throw new EvaluationException("No value for variable " + name);
            }
            return valuation.get(index);
        }

        @Override
        void gatherVariables(Set<String> set) {
            set.add(name);
        }

        @Override
        public int literalCount() {
            return 1;
        }

        @Override
        void write(StringBuilder builder) {
            builder.append(name);
        }
    }

    public static final class Not extends Expression {
        final Expression child;

        private Not(Expression child) {
            this.child = child;
        }

        public Expression child() {
            return child;
        }

        @Override
        public Kind kind() {
            return Kind.NOT;
        }

        @Override
        public List<Expression> children() {
            return List.of(child);
        }

        @Override
        public Expression withChildren(List<Expression> children) {
            Util.checkArgument(children.size() == 1, "Negation needs exactly one child, got %d", children.size());
            return new Not(children.get(0));
        }

        @Override
        public boolean evaluate(List<String> variables, BitSet valuation) {
            return !child.evaluate(variables, valuation);
        }

        @Override
        void gatherVariables(Set<String> set) {
            child.gatherVariables(set);
        }

        @Override
        void write(StringBuilder builder) {
            builder.append(NOT_SYMBOL);
            child.writeOperand(builder);
        }
    }

    /**
     * Conjunction or disjunction of an arbitrary number of arguments.
     */
    public static final class NaryOperation extends Expression {
        private final Kind kind;
        private final List<Expression> arguments;

        private NaryOperation(Kind kind, List<Expression> arguments) {
            Util.checkArgument(!arguments.isEmpty(), "%s needs at least one argument", kind);
            this.kind = kind;
            this.arguments = arguments;
        }

        @Override
        public Kind kind() {
            return kind;
        }

        @Override
        public List<Expression> children() {
            return arguments;
        }

        @Override
        public Expression withChildren(List<Expression> children) {
            return new NaryOperation(kind, ImmutableList.copyOf(children));
        }

        @Override
        public boolean evaluate(List<String> variables, BitSet valuation) {
            boolean conjunction = kind == Kind.AND;
            for (Expression argument : arguments) {
                if (argument.evaluate(variables, valuation) != conjunction) {
                    return !conjunction;
                }
            }
            return conjunction;
        }

        @Override
        void gatherVariables(Set<String> set) {
            for (Expression argument : arguments) {
                argument.gatherVariables(set);
            }
        }

        @Override
        void write(StringBuilder builder) {
            char symbol = kind == Kind.AND ? AND_SYMBOL : OR_SYMBOL;
            boolean first = true;
            for (Expression argument : arguments) {
                if (!first) {
                    builder.append(symbol);
                }
                first = false;
                argument.writeOperand(builder);
            }
        }
    }

    /**
     * Implication or biconditional.
     */
    public static final class BinaryOperation extends Expression {
        private final Kind kind;
        private final Expression left;
        private final Expression right;

        private BinaryOperation(Kind kind, Expression left, Expression right) {
            this.kind = kind;
            this.left = left;
            this.right = right;
        }

        public Expression left() {
            return left;
        }

        public Expression right() {
            return right;
        }

        @Override
        public Kind kind() {
            return kind;
        }

        @Override
        public List<Expression> children() {
            return List.of(left, right);
        }

        @Override
        public Expression withChildren(List<Expression> children) {
            Util.checkArgument(children.size() == 2, "%s needs exactly two children, got %d", kind, children.size());
            return new BinaryOperation(kind, children.get(0), children.get(1));
        }

        @Override
        public boolean evaluate(List<String> variables, BitSet valuation) {
            boolean leftValue = left.evaluate(variables, valuation);
            boolean rightValue = right.evaluate(variables, valuation);
            return kind == Kind.IMPLIES ? !leftValue || rightValue : leftValue == rightValue;
        }

        @Override
        void gatherVariables(Set<String> set) {
            left.gatherVariables(set);
            right.gatherVariables(set);
        }

        @Override
        void write(StringBuilder builder) {
            left.writeOperand(builder);
            builder.append(kind == Kind.IMPLIES ? IMPLIES_SYMBOL : IFF_SYMBOL);
            right.writeOperand(builder);
        }
    }

    /**
     * Placeholder of an axiom schema which unifies with any subtree.
     */
    public static final class MetaVariable extends Expression {
        private final String name;

        private MetaVariable(String name) {
            this.name = name;
        }

        public String name() {
            return name;
        }

        @Override
        public Kind kind() {
            return Kind.META;
        }

        @Override
        public List<Expression> children() {
            return List.of();
        }

        @Override
        public Expression withChildren(List<Expression> children) {
            Util.checkArgument(children.isEmpty(), "Meta-variables have no children");
            return this;
        }

        @Override
        public boolean evaluate(List<String> variables, BitSet valuation) {
            throw new EvaluationException("Unbound meta-variable ?" + name);
        }

        @Override
        void gatherVariables(Set<String> set) {
            // Placeholders are not propositional variables
        }

        @Override
        void write(StringBuilder builder) {
            builder.append('?').append(name);
        }
    }
}
