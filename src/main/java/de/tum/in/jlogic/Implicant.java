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
import java.util.List;
import javax.annotation.Nullable;

/**
 * A product term given as a pattern over {@code 0}, {@code 1} and {@code -} (don't care), one
 * character per variable, together with the minterms it covers.
 */
public final class Implicant implements Comparable<Implicant> {
    public static final char DONT_CARE = '-';

    private final String pattern;
    private final BitSet minterms;

    private Implicant(String pattern, BitSet minterms) {
        this.pattern = pattern;
        this.minterms = minterms;
    }

    public static Implicant ofMinterm(int minterm, int width) {
        return new Implicant(Util.padBinary(minterm, width), BitSets.of(minterm));
    }

    /**
     * Builds the implicant of the given pattern, covering every assignment which agrees with the
     * fixed positions of the pattern.
     */
    public static Implicant ofPattern(String pattern) {
        int width = pattern.length();
        BitSet minterms = new BitSet();
        for (int minterm = 0; minterm < 1 << width; minterm++) {
            if (matches(pattern, minterm)) {
                minterms.set(minterm);
            }
        }
        return new Implicant(pattern, minterms);
    }

    private static boolean matches(String pattern, int minterm) {
        int width = pattern.length();
        for (int position = 0; position < width; position++) {
            char bit = pattern.charAt(position);
            boolean value = (minterm >>> (width - 1 - position) & 1) == 1;
            if (bit != DONT_CARE && (bit == '1') != value) {
                return false;
            }
        }
        return true;
    }

    public String pattern() {
        return pattern;
    }

    public BitSet minterms() {
        return BitSets.copyOf(minterms);
    }

    public boolean covers(int minterm) {
        return minterms.get(minterm);
    }

    /**
     * Merges two implicants which have their don't cares at the same positions and differ in
     * exactly one fixed position. Returns {@code null} if that is not the case.
     */
    @Nullable
    public Implicant combine(Implicant other) {
        if (pattern.length() != other.pattern.length()) {
            return null;
        }
        int difference = -1;
        for (int position = 0; position < pattern.length(); position++) {
            char bit = pattern.charAt(position);
            char otherBit = other.pattern.charAt(position);
            if (bit == otherBit) {
                continue;
            }
            if (bit == DONT_CARE || otherBit == DONT_CARE || difference >= 0) {
                return null;
            }
            difference = position;
        }
        if (difference < 0) {
            return null;
        }
        StringBuilder combined = new StringBuilder(pattern);
        combined.setCharAt(difference, DONT_CARE);
        BitSet union = BitSets.copyOf(minterms);
        union.or(other.minterms);
        return new Implicant(combined.toString(), union);
    }

    public int literalCount() {
        int count = 0;
        for (int position = 0; position < pattern.length(); position++) {
            if (pattern.charAt(position) != DONT_CARE) {
                count += 1;
            }
        }
        return count;
    }

    int ones() {
        int count = 0;
        for (int position = 0; position < pattern.length(); position++) {
            if (pattern.charAt(position) == '1') {
                count += 1;
            }
        }
        return count;
    }

    /**
     * Returns the conjunction of the literals fixed by this implicant, {@code 1} if there are none.
     */
    public Expression toTerm(List<String> variables) {
        return Normalizer.junction(Expression.Kind.AND, literals(variables, true));
    }

    /**
     * Returns the disjunction of the negated literals fixed by this implicant, i.e. the clause
     * which is false exactly on the covered assignments. {@code 0} if there are none.
     */
    public Expression toClause(List<String> variables) {
        return Normalizer.junction(Expression.Kind.OR, literals(variables, false));
    }

    private List<Expression> literals(List<String> variables, boolean positive) {
        Util.checkArgument(variables.size() == pattern.length(), "Pattern %s does not fit %s", pattern, variables);
        List<Expression> literals = new ArrayList<>();
        for (int position = 0; position < pattern.length(); position++) {
            char bit = pattern.charAt(position);
            if (bit != DONT_CARE) {
                literals.add(new Literal(variables.get(position), (bit == '1') == positive).toExpression());
            }
        }
        return literals;
    }

    @Override
    public int compareTo(Implicant o) {
        return pattern.compareTo(o.pattern);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Implicant)) {
            return false;
        }
        return pattern.equals(((Implicant) object).pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
