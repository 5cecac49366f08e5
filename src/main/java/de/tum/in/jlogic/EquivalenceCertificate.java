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

import java.util.List;
import org.immutables.value.Value;

/**
 * Evidence that a rewrite preserves the truth table, obtained by comparing the fingerprints of
 * both trees over the same variables.
 */
@Value.Immutable
public abstract class EquivalenceCertificate {
    public static final String TRUTH_TABLE_HASH = "truth-table-hash";

    public static EquivalenceCertificate of(Expression before, Expression after, List<String> variables) {
        String beforeHash = TruthTable.fingerprint(before, variables);
        String afterHash = TruthTable.fingerprint(after, variables);
        return ImmutableEquivalenceCertificate.builder()
                .method(TRUTH_TABLE_HASH)
                .beforeHash(beforeHash)
                .afterHash(afterHash)
                .equal(beforeHash.equals(afterHash))
                .build();
    }

    public abstract String method();

    public abstract boolean equal();

    public abstract String beforeHash();

    public abstract String afterHash();
}
