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
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A conjunction of possibly negated variables, represented as a vector with one {@link Slot} per
 * variable, together with the minterms it was built from.
 *
 * <p>Implicants are immutable. Two implicants are combined by {@link #tryMerge(Implicant)} if they
 * differ in a single variable only, e.g. {@code x&y&z} and {@code x&y&~z} merge into {@code x&y}.</p>
 */
public final class Implicant {
    /** Implicants are built from truth vectors indexed by {@code int}. */
    public static final int MAX_VARIABLES = 30;

    private final int variableCount;
    // Variables whose slot is not DONT_CARE
    private final BitSet assigned;
    // Subset of assigned
    private final BitSet ones;
    private final BitSet minterms;

    private Implicant(int variableCount, BitSet assigned, BitSet ones, BitSet minterms) {
        assert !minterms.isEmpty();
        this.variableCount = variableCount;
        this.assigned = assigned;
        this.ones = ones;
        this.minterms = minterms;
    }

    /**
     * Creates the implicant which is true exactly for the given assignment, where bit {@code i} of
     * {@code minterm} is the value of variable {@code i}.
     */
    public static Implicant of(int variableCount, int minterm) {
        Preconditions.checkArgument(0 < variableCount && variableCount <= MAX_VARIABLES,
                "Variable count %s not in [1, %s]", variableCount, MAX_VARIABLES);
        Preconditions.checkArgument(0 <= minterm && minterm < (1 << variableCount),
                "Minterm %s out of range for %s variables", minterm, variableCount);

        BitSet assigned = new BitSet(variableCount);
        assigned.set(0, variableCount);
        BitSet minterms = new BitSet();
        minterms.set(minterm);
        return new Implicant(variableCount, assigned, BitSets.of(minterm), minterms);
    }

    public int variableCount() {
        return variableCount;
    }

    public Slot slot(int variable) {
        Objects.checkIndex(variable, variableCount);
        if (!assigned.get(variable)) {
            return Slot.DONT_CARE;
        }
        return ones.get(variable) ? Slot.ONE : Slot.ZERO;
    }

    /** Returns the number of {@link Slot#ONE} slots. */
    public int countOnes() {
        return ones.cardinality();
    }

    /** Returns the number of slots which are not {@link Slot#DONT_CARE}. */
    public int countLiterals() {
        return assigned.cardinality();
    }

    public BitSet minterms() {
        return BitSets.copyOf(minterms);
    }

    boolean coversAny(BitSet required) {
        return minterms.intersects(required);
    }

    /**
     * Merges this implicant with {@code other} if their vectors differ in exactly one slot and this
     * slot is assigned in both. The result has {@link Slot#DONT_CARE} at that position and covers the
     * minterms of both.
     *
     * @return The merged implicant or {@code null} if the two cannot be merged.
     *
     * @throws IllegalArgumentException
     *     if the implicants are over a different number of variables.
     */
    @Nullable
    public Implicant tryMerge(Implicant other) {
        Preconditions.checkArgument(variableCount == other.variableCount,
                "Cannot merge implicants over %s and %s variables", variableCount, other.variableCount);

        // A slot which is DONT_CARE in only one of the two is a difference which cannot be merged
        if (!assigned.equals(other.assigned)) {
            return null;
        }
        BitSet difference = BitSets.copyOf(ones);
        difference.xor(other.ones);
        if (difference.cardinality() != 1) {
            return null;
        }

        BitSet mergedAssigned = BitSets.copyOf(assigned);
        mergedAssigned.andNot(difference);
        BitSet mergedOnes = BitSets.copyOf(ones);
        mergedOnes.andNot(difference);
        BitSet mergedMinterms = BitSets.copyOf(minterms);
        mergedMinterms.or(other.minterms);
        return new Implicant(variableCount, mergedAssigned, mergedOnes, mergedMinterms);
    }

    /**
     * Returns the conjunction represented by this implicant. A single literal is returned as is, an
     * implicant without literals yields {@code true}.
     */
    public FormulaNode toFormula() {
        List<FormulaNode> literals = new ArrayList<>(assigned.cardinality());
        for (int variable = assigned.nextSetBit(0); variable >= 0; variable = assigned.nextSetBit(variable + 1)) {
            literals.add(FormulaNode.literal(variable, !ones.get(variable)));
        }
        if (literals.isEmpty()) {
            return FormulaNode.constant(true);
        }
        return literals.size() == 1 ? literals.get(0) : FormulaNode.conjunction(literals);
    }

    /**
     * Returns the conjunction as expression text, e.g. {@code x&~z}. Without literals, this is
     * {@code -1}, the value with all bits set.
     */
    public String toString(List<String> variableNames) {
        Preconditions.checkArgument(variableNames.size() == variableCount,
                "Expected %s variable names, got %s", variableCount, variableNames.size());

        StringBuilder builder = new StringBuilder();
        for (int variable = assigned.nextSetBit(0); variable >= 0; variable = assigned.nextSetBit(variable + 1)) {
            if (builder.length() > 0) {
                builder.append('&');
            }
            if (!ones.get(variable)) {
                builder.append('~');
            }
            builder.append(variableNames.get(variable));
        }
        return builder.length() == 0 ? "-1" : builder.toString();
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Implicant)) {
            return false;
        }
        Implicant that = (Implicant) object;
        return variableCount == that.variableCount
                && assigned.equals(that.assigned)
                && ones.equals(that.ones)
                && minterms.equals(that.minterms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variableCount, assigned, ones, minterms);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("[");
        for (int variable = 0; variable < variableCount; variable++) {
            if (variable > 0) {
                builder.append(", ");
            }
            builder.append(slot(variable).symbol());
        }
        return builder.append(']').toString();
    }

    public enum Slot {
        ZERO('0'), ONE('1'), DONT_CARE('-');

        private final char symbol;

        Slot(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }
    }
}
