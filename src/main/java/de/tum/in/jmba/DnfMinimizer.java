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
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.function.IntUnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes a disjunctive normal form for a Boolean function given by its truth vector, following
 * the Quine-McCluskey method: implicants are merged round by round until no two can be combined,
 * and the resulting primes are reduced by a single greedy pass.
 *
 * <p>The greedy pass keeps a prime if it covers a minterm not covered by the primes kept before
 * it. This yields a cover, but not necessarily one of minimal size.</p>
 *
 * <p>The running time is exponential in the number of variables, callers have to bound it.</p>
 */
public final class DnfMinimizer {
    private static final Logger logger = Logger.getLogger(DnfMinimizer.class.getName());

    // Intrinsified by the JIT where the platform has a population count instruction
    private static final IntUnaryOperator POPULATION_COUNT = Integer::bitCount;

    private DnfMinimizer() {}

    /**
     * Minimizes the function over {@code variableCount} variables whose value for the assignment
     * {@code i} (bit {@code j} of {@code i} being the value of variable {@code j}) is
     * {@code truthVector[i]}.
     *
     * @throws IllegalArgumentException
     *     if the vector does not have {@code 2^variableCount} entries or an entry is neither 0 nor 1.
     */
    public static Dnf minimize(int variableCount, int[] truthVector) {
        Preconditions.checkArgument(0 < variableCount && variableCount <= Implicant.MAX_VARIABLES,
                "Variable count %s not in [1, %s]", variableCount, Implicant.MAX_VARIABLES);
        Preconditions.checkArgument(truthVector.length == 1 << variableCount,
                "Truth vector has %s entries, expected 2^%s", truthVector.length, variableCount);

        BitSet required = new BitSet(truthVector.length);
        for (int i = 0; i < truthVector.length; i++) {
            int value = truthVector[i];
            Preconditions.checkArgument(value == 0 || value == 1, "Entry %s of truth vector is %s", i, value);
            if (value == 1) {
                required.set(i);
            }
        }
        return minimize(variableCount, required);
    }

    static Dnf minimize(int variableCount, BitSet required) {
        ImplicantGeneration generation = ImplicantGeneration.initial(variableCount, required, POPULATION_COUNT);
        List<Implicant> primes = new ArrayList<>();

        int rounds = 0;
        while (true) {
            ImplicantGeneration.Round round = generation.merge();
            rounds += 1;
            // Every merge turns an assigned slot into a don't care
            assert rounds <= variableCount + 1;

            primes.addAll(round.primes());
            logger.log(Level.FINER, "Round {0}: {1} implicants, {2} merges, {3} primes",
                    new Object[] {rounds, generation.size(), round.mergeCount(), round.primes().size()});
            if (round.isFixpoint()) {
                break;
            }
            generation = round.next();
        }

        List<Implicant> kept = dropRedundant(primes, required);
        logger.log(Level.FINE, "Minimized function over {0} variables with {1} minterms to {2} of {3} primes "
                + "in {4} rounds", new Object[] {variableCount, required.cardinality(), kept.size(), primes.size(), rounds});
        return new Dnf(variableCount, kept);
    }

    /**
     * Scans {@code primes} in order and keeps those which cover a minterm of {@code required} not
     * covered by an earlier kept prime.
     */
    static List<Implicant> dropRedundant(List<Implicant> primes, BitSet required) {
        BitSet outstanding = BitSets.copyOf(required);
        List<Implicant> kept = new ArrayList<>();
        for (Implicant prime : primes) {
            if (prime.coversAny(outstanding)) {
                outstanding.andNot(prime.minterms());
                kept.add(prime);
            }
        }
        assert outstanding.isEmpty();
        return kept;
    }
}
