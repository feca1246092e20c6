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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A disjunction of prime implicants, as computed by {@link DnfMinimizer}.
 */
public final class Dnf {
    private final int variableCount;
    private final ImmutableList<Implicant> primes;

    Dnf(int variableCount, List<Implicant> primes) {
        this.variableCount = variableCount;
        this.primes = ImmutableList.copyOf(primes);
    }

    public int variableCount() {
        return variableCount;
    }

    /** Returns the primes in the order they were found. */
    public List<Implicant> primes() {
        return primes;
    }

    /**
     * Returns the formula of this DNF: the constant {@code false} if there are no primes, the
     * conjunction of the only prime, or the disjunction of all conjunctions.
     */
    public FormulaNode toFormula() {
        if (primes.isEmpty()) {
            return FormulaNode.constant(false);
        }
        if (primes.size() == 1) {
            return primes.get(0).toFormula();
        }
        List<FormulaNode> conjunctions = new ArrayList<>(primes.size());
        for (Implicant prime : primes) {
            conjunctions.add(prime.toFormula());
        }
        return FormulaNode.disjunction(conjunctions);
    }

    /**
     * Returns the DNF as expression text over the given names, e.g. {@code (x&~y)|z}. Conjunctions
     * are parenthesized only if there are several of them. Without primes, this is {@code 0}.
     */
    public String toString(List<String> variableNames) {
        Preconditions.checkArgument(variableNames.size() == variableCount,
                "Expected %s variable names, got %s", variableCount, variableNames.size());
        if (primes.isEmpty()) {
            return "0";
        }

        StringBuilder builder = new StringBuilder();
        for (Implicant prime : primes) {
            if (builder.length() > 0) {
                builder.append('|');
            }
            String conjunction = prime.toString(variableNames);
            if (primes.size() > 1 && conjunction.indexOf('&') >= 0) {
                builder.append('(').append(conjunction).append(')');
            } else {
                builder.append(conjunction);
            }
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("implicants:\n");
        for (Implicant prime : primes) {
            builder.append("    ").append(prime)
                    .append(' ').append(Arrays.toString(BitSets.toArray(prime.minterms())))
                    .append('\n');
        }
        return builder.toString();
    }
}
