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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.IntUnaryOperator;

/**
 * The implicants alive in one round of the minimization, partitioned into buckets by their number of
 * {@link Implicant.Slot#ONE} slots. Only implicants of adjacent buckets can be merged.
 *
 * <p>A generation is never modified. {@link #merge()} produces the next generation together with the
 * implicants of this one which did not take part in any merge.</p>
 */
final class ImplicantGeneration {
    private final int variableCount;
    private final ImmutableList<ImmutableList<Implicant>> buckets;

    private ImplicantGeneration(int variableCount, ImmutableList<ImmutableList<Implicant>> buckets) {
        assert buckets.size() == variableCount + 1;
        this.variableCount = variableCount;
        this.buckets = buckets;
    }

    /** Creates one implicant per minterm, bucketed by its population count. */
    static ImplicantGeneration initial(int variableCount, BitSet minterms, IntUnaryOperator populationCount) {
        List<List<Implicant>> buckets = emptyBuckets(variableCount);
        for (int minterm = minterms.nextSetBit(0); minterm >= 0; minterm = minterms.nextSetBit(minterm + 1)) {
            buckets.get(populationCount.applyAsInt(minterm)).add(Implicant.of(variableCount, minterm));
        }
        return new ImplicantGeneration(variableCount, freeze(buckets));
    }

    private static List<List<Implicant>> emptyBuckets(int variableCount) {
        List<List<Implicant>> buckets = new ArrayList<>(variableCount + 1);
        for (int i = 0; i <= variableCount; i++) {
            buckets.add(new ArrayList<>());
        }
        return buckets;
    }

    private static ImmutableList<ImmutableList<Implicant>> freeze(List<? extends Iterable<Implicant>> buckets) {
        ImmutableList.Builder<ImmutableList<Implicant>> builder = ImmutableList.builderWithExpectedSize(buckets.size());
        for (Iterable<Implicant> bucket : buckets) {
            builder.add(ImmutableList.copyOf(bucket));
        }
        return builder.build();
    }

    List<Implicant> bucket(int ones) {
        return buckets.get(ones);
    }

    int size() {
        return buckets.stream().mapToInt(List::size).sum();
    }

    boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Attempts to merge every implicant of bucket {@code k} with every implicant of bucket
     * {@code k+1}. Merged implicants form the next generation, where an implicant obtained from
     * several pairs is kept once. Implicants of this generation which were not merged with any other
     * are the primes of this round, in bucket order.
     */
    Round merge() {
        List<Set<Implicant>> next = new ArrayList<>(variableCount + 1);
        BitSet[] merged = new BitSet[variableCount + 1];
        for (int ones = 0; ones <= variableCount; ones++) {
            next.add(new LinkedHashSet<>());
            merged[ones] = new BitSet(buckets.get(ones).size());
        }

        int mergeCount = 0;
        for (int ones = 0; ones < variableCount; ones++) {
            List<Implicant> lower = buckets.get(ones);
            List<Implicant> upper = buckets.get(ones + 1);
            for (int i = 0; i < lower.size(); i++) {
                for (int j = 0; j < upper.size(); j++) {
                    Implicant result = lower.get(i).tryMerge(upper.get(j));
                    if (result == null) {
                        continue;
                    }
                    mergeCount += 1;
                    merged[ones].set(i);
                    merged[ones + 1].set(j);
                    next.get(result.countOnes()).add(result);
                }
            }
        }

        ImmutableList.Builder<Implicant> primes = ImmutableList.builder();
        for (int ones = 0; ones <= variableCount; ones++) {
            List<Implicant> bucket = buckets.get(ones);
            for (int i = merged[ones].nextClearBit(0); i < bucket.size(); i = merged[ones].nextClearBit(i + 1)) {
                primes.add(bucket.get(i));
            }
        }
        return new Round(new ImplicantGeneration(variableCount, freeze(next)), primes.build(), mergeCount);
    }

    /** The outcome of merging one generation. */
    static final class Round {
        private final ImplicantGeneration next;
        private final ImmutableList<Implicant> primes;
        private final int mergeCount;

        Round(ImplicantGeneration next, ImmutableList<Implicant> primes, int mergeCount) {
            this.next = next;
            this.primes = primes;
            this.mergeCount = mergeCount;
        }

        ImplicantGeneration next() {
            return next;
        }

        List<Implicant> primes() {
            return primes;
        }

        int mergeCount() {
            return mergeCount;
        }

        boolean isFixpoint() {
            return mergeCount == 0;
        }
    }
}
