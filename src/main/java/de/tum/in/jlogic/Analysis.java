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
import javax.annotation.Nullable;
import org.immutables.value.Value;

/**
 * Everything known about one expression. Components which do not support the number of variables
 * are absent and their error message is given instead.
 */
@Value.Immutable
public abstract class Analysis {
    public abstract String input();

    public abstract String standardized();

    public abstract Expression expression();

    public abstract Expression normalized();

    public abstract List<String> variables();

    public abstract TruthTable truthTable();

    @Nullable
    public abstract KarnaughResult karnaughMap();

    @Nullable
    public abstract String karnaughMapError();

    @Nullable
    public abstract QuineMcCluskeyResult quineMcCluskey();

    @Nullable
    public abstract String quineMcCluskeyError();

    @Nullable
    public abstract MinimalForms minimalForms();

    public abstract boolean tautology();

    public abstract boolean contradiction();
}
