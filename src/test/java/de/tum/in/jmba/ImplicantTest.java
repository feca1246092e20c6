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
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.tum.in.jmba.Implicant.Slot;
import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ImplicantTest {
    private static BitSet bits(int... indices) {
        BitSet set = new BitSet();
        for (int index : indices) {
            set.set(index);
        }
        return set;
    }

    @Test
    public void testVectorOfMinterm() {
        Implicant implicant = Implicant.of(3, 5);
        assertThat(implicant.slot(0), is(Slot.ONE));
        assertThat(implicant.slot(1), is(Slot.ZERO));
        assertThat(implicant.slot(2), is(Slot.ONE));
        assertThat(implicant.countOnes(), is(2));
        assertThat(implicant.countLiterals(), is(3));
        assertThat(implicant.minterms(), is(bits(5)));
        assertThat(implicant.toString(), is("[1, 0, 1]"));
    }

    @Test
    public void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> Implicant.of(2, 4));
        assertThrows(IllegalArgumentException.class, () -> Implicant.of(0, 0));
        assertThrows(IllegalArgumentException.class, () -> Implicant.of(3, -1));
    }

    @Test
    public void testMergeSingleDifference() {
        Implicant merged = Implicant.of(3, 5).tryMerge(Implicant.of(3, 7));
        assertThat(merged.slot(0), is(Slot.ONE));
        assertThat(merged.slot(1), is(Slot.DONT_CARE));
        assertThat(merged.slot(2), is(Slot.ONE));
        assertThat(merged.minterms(), is(bits(5, 7)));
        assertThat(merged.countOnes(), is(2));
        assertThat(Implicant.of(3, 7).tryMerge(Implicant.of(3, 5)), is(merged));
    }

    @Test
    public void testMergeOfGeneralizedImplicants() {
        Implicant first = Implicant.of(3, 0).tryMerge(Implicant.of(3, 1));
        Implicant second = Implicant.of(3, 4).tryMerge(Implicant.of(3, 5));
        Implicant merged = first.tryMerge(second);
        assertThat(merged.toString(), is("[-, 0, -]"));
        assertThat(merged.minterms(), is(bits(0, 1, 4, 5)));
        assertThat(merged.countOnes(), is(0));
    }

    @Test
    public void testNoMergeWithoutExactlyOneDifference() {
        assertThat(Implicant.of(3, 5).tryMerge(Implicant.of(3, 5)), is(nullValue()));
        assertThat(Implicant.of(3, 0).tryMerge(Implicant.of(3, 3)), is(nullValue()));
        assertThat(Implicant.of(3, 1).tryMerge(Implicant.of(3, 6)), is(nullValue()));
    }

    @Test
    public void testNoMergeAgainstDontCare() {
        Implicant generalized = Implicant.of(3, 0).tryMerge(Implicant.of(3, 1));
        assertThat(generalized.toString(), is("[-, 0, 0]"));

        // Only difference is in the don't care slot
        assertThat(generalized.tryMerge(Implicant.of(3, 0)), is(nullValue()));
        assertThat(Implicant.of(3, 1).tryMerge(generalized), is(nullValue()));
        // Don't care against an assigned slot and one further difference
        assertThat(generalized.tryMerge(Implicant.of(3, 2)), is(nullValue()));
        assertThat(generalized.tryMerge(Implicant.of(3, 4)), is(nullValue()));
        // Don't care slots in different positions
        Implicant other = Implicant.of(3, 0).tryMerge(Implicant.of(3, 2));
        assertThat(generalized.tryMerge(other), is(nullValue()));
    }

    @Test
    public void testMergeRequiresEqualLength() {
        assertThrows(IllegalArgumentException.class, () -> Implicant.of(2, 1).tryMerge(Implicant.of(3, 1)));
    }

    @Test
    public void testToFormula() {
        Implicant implicant = Implicant.of(3, 1).tryMerge(Implicant.of(3, 3));
        assertThat(implicant.toFormula(), is(FormulaNode.conjunction(List.of(
                FormulaNode.literal(0, false),
                FormulaNode.literal(2, true)))));

        Implicant single = Implicant.of(2, 0).tryMerge(Implicant.of(2, 1));
        assertThat(single.toFormula(), is(FormulaNode.literal(1, true)));

        Implicant tautology = Implicant.of(1, 0).tryMerge(Implicant.of(1, 1));
        assertThat(tautology.toFormula(), is(FormulaNode.constant(true)));
    }

    @Test
    public void testToStringWithNames() {
        Implicant implicant = Implicant.of(3, 1).tryMerge(Implicant.of(3, 3));
        assertThat(implicant.toString(List.of("x", "y", "z")), is("x&~z"));
        assertThat(Implicant.of(1, 0).toString(List.of("x")), is("~x"));
        assertThat(Implicant.of(1, 0).tryMerge(Implicant.of(1, 1)).toString(List.of("x")), is("-1"));
        assertThrows(IllegalArgumentException.class, () -> implicant.toString(List.of("x")));
    }
}
