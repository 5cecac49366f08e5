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

@Value.Immutable
public abstract class KarnaughResult {
    public abstract List<String> variables();

    public abstract List<String> rowVariables();

    public abstract List<String> columnVariables();

    /**
     * Values of the row variables for each row, in Gray code order.
     */
    public abstract List<Integer> rowOrder();

    public abstract List<Integer> columnOrder();

    public abstract List<List<Boolean>> grid();

    public abstract List<Integer> minterms();

    public abstract List<KarnaughGroup> groups();

    public abstract Expression result();

    public abstract boolean verified();

    public String text() {
        return result().toString();
    }
}
