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
 * Signals that an expression references more variables than a component supports.
 */
public class CapacityException extends IllegalArgumentException {
    private final int variableCount;
    private final int limit;

    public CapacityException(String component, int variableCount, int minimum, int limit) {
        super(String.format("%s supports %d to %d variables, got %d", component, minimum, limit, variableCount));
        this.variableCount = variableCount;
        this.limit = limit;
    }

    public int variableCount() {
        return variableCount;
    }

    public int limit() {
        return limit;
    }

    static void check(String component, int variableCount, int minimum, int limit) {
        if (variableCount < minimum || variableCount > limit) {
            throw new CapacityException(component, variableCount, minimum, limit);
        }
    }
}
