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
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A propositional formula over numbered variables as assembled from prime implicants: constants,
 * possibly negated literals and n-ary conjunctions and disjunctions.
 */
public abstract class FormulaNode {
    FormulaNode() {}

    public static FormulaNode constant(boolean value) {
        return value ? Constant.TRUE : Constant.FALSE;
    }

    public static FormulaNode literal(int variable, boolean negated) {
        return new Literal(variable, negated);
    }

    public static FormulaNode conjunction(List<FormulaNode> children) {
        return new Operation(Operation.Type.CONJUNCTION, children);
    }

    public static FormulaNode disjunction(List<FormulaNode> children) {
        return new Operation(Operation.Type.INCLUSIVE_DISJUNCTION, children);
    }

    public abstract boolean evaluate(BitSet valuation);

    public abstract boolean evaluate(boolean[] valuation);

    /** Evaluates the formula where bit {@code i} of {@code assignment} is the value of variable {@code i}. */
    public boolean evaluate(long assignment) {
        return evaluate(BitSets.of(assignment));
    }

    public List<FormulaNode> children() {
        return List.of();
    }

    public Set<Integer> variables() {
        Set<Integer> set = new TreeSet<>();
        gatherVariables(set);
        return set;
    }

    abstract void gatherVariables(Set<Integer> set);

    /**
     * A constant. {@code false} only arises for functions without satisfying assignment, {@code true}
     * for the implicant without literals.
     */
    public static final class Constant extends FormulaNode {
        static final Constant TRUE = new Constant(true);
        static final Constant FALSE = new Constant(false);

        private final boolean value;

        private Constant(boolean value) {
            this.value = value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public boolean evaluate(BitSet valuation) {
            return value;
        }

        @Override
        public boolean evaluate(boolean[] valuation) {
            return value;
        }

        @Override
        void gatherVariables(Set<Integer> set) {
            // No variables in this leaf
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Constant)) {
                return false;
            }
            return value == ((Constant) object).value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class Literal extends FormulaNode {
        private final int variable;
        private final boolean negated;

        Literal(int variable, boolean negated) {
            Preconditions.checkArgument(variable >= 0, "Negative variable %s", variable);
            this.variable = variable;
            this.negated = negated;
        }

        public int variable() {
            return variable;
        }

        public boolean isNegated() {
            return negated;
        }

        @Override
        public boolean evaluate(BitSet valuation) {
            return valuation.get(variable) != negated;
        }

        @Override
        public boolean evaluate(boolean[] valuation) {
            return valuation[variable] != negated;
        }

        @Override
        void gatherVariables(Set<Integer> set) {
            set.add(variable);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Literal)) {
                return false;
            }
            Literal that = (Literal) object;
            return variable == that.variable && negated == that.negated;
        }

        @Override
        public int hashCode() {
            return Objects.hash(variable, negated);
        }

        @Override
        public String toString() {
            return negated ? "~" + variable : String.valueOf(variable);
        }
    }

    public static final class Operation extends FormulaNode {
        private final Type type;
        private final ImmutableList<FormulaNode> children;

        Operation(Type type, List<FormulaNode> children) {
            Preconditions.checkArgument(children.size() >= 2,
                    "%s needs at least two operands, got %s", type, children.size());
            this.type = type;
            this.children = ImmutableList.copyOf(children);
        }

        public Type type() {
            return type;
        }

        @Override
        public List<FormulaNode> children() {
            return children;
        }

        @Override
        public boolean evaluate(BitSet valuation) {
            switch (type) {
                case CONJUNCTION:
                    return children.stream().allMatch(child -> child.evaluate(valuation));
                case INCLUSIVE_DISJUNCTION:
                    return children.stream().anyMatch(child -> child.evaluate(valuation));
                default:
                    throw new IllegalStateException("Unknown type");
            }
        }

        @Override
        public boolean evaluate(boolean[] valuation) {
            switch (type) {
                case CONJUNCTION:
                    return children.stream().allMatch(child -> child.evaluate(valuation));
                case INCLUSIVE_DISJUNCTION:
                    return children.stream().anyMatch(child -> child.evaluate(valuation));
                default:
                    throw new IllegalStateException("Unknown type");
            }
        }

        @Override
        void gatherVariables(Set<Integer> set) {
            for (FormulaNode child : children) {
                child.gatherVariables(set);
            }
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Operation)) {
                return false;
            }
            Operation that = (Operation) object;
            return type == that.type && children.equals(that.children);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, children);
        }

        @Override
        public String toString() {
            return type + children.toString();
        }

        public enum Type {
            CONJUNCTION, INCLUSIVE_DISJUNCTION
        }
    }
}
