/*
 * This file is part of JMBA.
 * Copyright (c) 2017-2023 Tobias Meggendorfer.
 *
 * JMBA is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JMBA is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JMBA. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jmba;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The truth vector of an expression whose variables range over {0, 1}. Row {@code i} assigns bit
 * {@code j} of {@code i} to the {@code j}-th variable and holds the lowest bit of the result.
 */
public final class TruthTable {
    private final ImmutableList<String> variables;
    private final int[] values;

    private TruthTable(ImmutableList<String> variables, int[] values) {
        this.variables = variables;
        this.values = values;
    }

    /** Computes the truth table over the variables of {@code expression} in order of occurrence. */
    public static TruthTable of(ExpressionNode expression) {
        return of(expression, List.copyOf(expression.variables()));
    }

    /**
     * Computes the truth table over the given variables, which have to include all variables of the
     * expression.
     */
    public static TruthTable of(ExpressionNode expression, List<String> variables) {
        int count = variables.size();
        Preconditions.checkArgument(0 < count && count <= Implicant.MAX_VARIABLES,
                "Variable count %s not in [1, %s]", count, Implicant.MAX_VARIABLES);
        Preconditions.checkArgument(ImmutableSet.copyOf(variables).size() == count,
                "Duplicate variable in %s", variables);
        Preconditions.checkArgument(variables.containsAll(expression.variables()),
                "Variables %s do not include all of %s", variables, expression.variables());

        int[] values = new int[1 << count];
        Map<String, BigInteger> assignment = new HashMap<>();
        for (int row = 0; row < values.length; row++) {
            for (int variable = 0; variable < count; variable++) {
                assignment.put(variables.get(variable), ((row >>> variable) & 1) == 1 ? BigInteger.ONE : BigInteger.ZERO);
            }
            values[row] = expression.evaluate(assignment).testBit(0) ? 1 : 0;
        }
        return new TruthTable(ImmutableList.copyOf(variables), values);
    }

    public List<String> variables() {
        return variables;
    }

    public int variableCount() {
        return variables.size();
    }

    public int value(int row) {
        return values[row];
    }

    public int[] values() {
        return values.clone();
    }

    /** Returns the rows with value 1. */
    public BitSet minterms() {
        BitSet minterms = new BitSet(values.length);
        for (int row = 0; row < values.length; row++) {
            if (values[row] == 1) {
                minterms.set(row);
            }
        }
        return minterms;
    }

    public Dnf minimize() {
        return DnfMinimizer.minimize(variables.size(), values);
    }

    @Override
    public String toString() {
        return variables + " " + Arrays.toString(values);
    }
}
