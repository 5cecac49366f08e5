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

import javax.annotation.Nullable;
import org.immutables.value.Value;

@Value.Immutable
public abstract class Simplification {
    public abstract String input();

    public abstract Expression expression();

    public abstract Derivation derivation();

    /**
     * The Quine–McCluskey result the derivation was compared with, absent for expressions with
     * too many variables.
     */
    @Nullable
    public abstract QuineMcCluskeyResult quineMcCluskey();

    public abstract Expression result();

    public abstract Source source();

    public abstract boolean verified();

    public String text() {
        return result().toString();
    }

    public enum Source {
        DERIVATION, QUINE_MCCLUSKEY
    }
}
