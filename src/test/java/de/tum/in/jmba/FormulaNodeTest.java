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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.BitSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class FormulaNodeTest {
    @Test
    public void testEvaluation() {
        FormulaNode formula = FormulaNode.disjunction(List.of(
                FormulaNode.conjunction(List.of(FormulaNode.literal(0, false), FormulaNode.literal(2, true))),
                FormulaNode.literal(1, false)));

        assertThat(formula.evaluate(0b001), is(true));
        assertThat(formula.evaluate(0b101), is(false));
        assertThat(formula.evaluate(0b110), is(true));
        assertThat(formula.evaluate(new boolean[] {true, false, true}), is(false));
        BitSet valuation = new BitSet();
        valuation.set(1);
        assertThat(formula.evaluate(valuation), is(true));
        assertThat(formula.variables(), is(Set.of(0, 1, 2)));
    }

    @Test
    public void testConstants() {
        assertThat(FormulaNode.constant(true).evaluate(0L), is(true));
        assertThat(FormulaNode.constant(false).evaluate(new boolean[0]), is(false));
        assertThat(FormulaNode.constant(false).variables().isEmpty(), is(true));
        assertThat(FormulaNode.constant(true).toString(), is("true"));
    }

    @Test
    public void testOperationsNeedTwoOperands() {
        assertThrows(IllegalArgumentException.class, () -> FormulaNode.conjunction(List.of(FormulaNode.literal(0, true))));
        assertThrows(IllegalArgumentException.class, () -> FormulaNode.disjunction(List.of()));
        assertThrows(IllegalArgumentException.class, () -> FormulaNode.literal(-1, false));
    }

    @Test
    public void testToString() {
        FormulaNode formula = FormulaNode.conjunction(List.of(FormulaNode.literal(0, false), FormulaNode.literal(3, true)));
        assertThat(formula.toString(), is("CONJUNCTION[0, ~3]"));
    }
}
