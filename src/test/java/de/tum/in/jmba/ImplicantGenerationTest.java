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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

import java.util.BitSet;
import org.junit.jupiter.api.Test;

public class ImplicantGenerationTest {
    private static BitSet bits(int... indices) {
        BitSet set = new BitSet();
        for (int index : indices) {
            set.set(index);
        }
        return set;
    }

    @Test
    public void testInitialBucketsByPopulationCount() {
        ImplicantGeneration generation = ImplicantGeneration.initial(3, bits(0, 3, 5, 6, 7), Integer::bitCount);
        assertThat(generation.bucket(0), contains(Implicant.of(3, 0)));
        assertThat(generation.bucket(1), is(empty()));
        assertThat(generation.bucket(2), contains(Implicant.of(3, 3), Implicant.of(3, 5), Implicant.of(3, 6)));
        assertThat(generation.bucket(3), contains(Implicant.of(3, 7)));
        assertThat(generation.size(), is(5));
    }

    @Test
    public void testRoundSeparatesPrimes() {
        // 0 has no neighbour, 3, 5, 6 and 7 merge pairwise
        ImplicantGeneration generation = ImplicantGeneration.initial(3, bits(0, 3, 5, 6, 7), Integer::bitCount);
        ImplicantGeneration.Round round = generation.merge();

        assertThat(round.mergeCount(), is(3));
        assertThat(round.isFixpoint(), is(false));
        assertThat(round.primes(), contains(Implicant.of(3, 0)));
        assertThat(round.next().size(), is(3));
        assertThat(round.next().bucket(2), contains(
                Implicant.of(3, 3).tryMerge(Implicant.of(3, 7)),
                Implicant.of(3, 5).tryMerge(Implicant.of(3, 7)),
                Implicant.of(3, 6).tryMerge(Implicant.of(3, 7))));

        ImplicantGeneration.Round last = round.next().merge();
        assertThat(last.isFixpoint(), is(true));
        assertThat(last.primes().size(), is(3));
        assertThat(last.next().isEmpty(), is(true));
    }

    @Test
    public void testGenerationsAreNotModified() {
        ImplicantGeneration generation = ImplicantGeneration.initial(2, bits(0, 1, 2, 3), Integer::bitCount);
        ImplicantGeneration.Round first = generation.merge();
        ImplicantGeneration.Round second = generation.merge();

        assertThat(second.mergeCount(), is(first.mergeCount()));
        assertThat(second.primes(), is(first.primes()));
        assertThat(second.next().bucket(0), is(first.next().bucket(0)));
        assertThat(generation.size(), is(4));
    }

    @Test
    public void testDuplicatesAreMergedOnce() {
        ImplicantGeneration generation = ImplicantGeneration.initial(2, bits(0, 1, 2, 3), Integer::bitCount);
        ImplicantGeneration.Round first = generation.merge();
        assertThat(first.mergeCount(), is(4));
        assertThat(first.primes(), is(empty()));

        // [-, 0] + [-, 1] and [0, -] + [1, -] both yield [-, -]
        ImplicantGeneration.Round second = first.next().merge();
        assertThat(second.mergeCount(), is(2));
        assertThat(second.next().size(), is(1));
        assertThat(second.next().bucket(0).get(0).countLiterals(), is(0));
        assertThat(second.next().bucket(0).get(0).minterms(), is(bits(0, 1, 2, 3)));
    }

    @Test
    public void testEmptyGeneration() {
        ImplicantGeneration generation = ImplicantGeneration.initial(3, new BitSet(), Integer::bitCount);
        assertThat(generation.isEmpty(), is(true));
        ImplicantGeneration.Round round = generation.merge();
        assertThat(round.isFixpoint(), is(true));
        assertThat(round.primes(), is(empty()));
    }
}
