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
import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A node of a parsed expression. There is one subclass per shape: {@link Constant} carries a value,
 * {@link Variable} a name, and {@link Operation} an operator together with its ordered operands.
 *
 * <p>Nodes are immutable. Every node knows the {@link ModularRing} it was parsed in, so that
 * later passes can reduce constants and evaluate without further context.</p>
 */
public abstract class ExpressionNode {
    private final ModularRing ring;

    ExpressionNode(ModularRing ring) {
        this.ring = Objects.requireNonNull(ring);
    }

    public static Constant constant(ModularRing ring, BigInteger value) {
        return new Constant(ring, value);
    }

    public static Constant constant(ModularRing ring, long value) {
        return new Constant(ring, BigInteger.valueOf(value));
    }

    public static Variable variable(ModularRing ring, String name) {
        return new Variable(ring, name);
    }

    public static Operation operation(ModularRing ring, Kind kind, List<ExpressionNode> children) {
        return new Operation(ring, kind, children);
    }

    public static Operation operation(ModularRing ring, Kind kind, ExpressionNode... children) {
        return new Operation(ring, kind, List.of(children));
    }

    public abstract Kind kind();

    public ModularRing ring() {
        return ring;
    }

    /** Returns the ordered operands of this node, which is empty for leaves. */
    public List<ExpressionNode> children() {
        return List.of();
    }

    public boolean isLeaf() {
        return children().isEmpty();
    }

    /** Returns the names of all variables occurring in this expression, in order of first occurrence. */
    public Set<String> variables() {
        Set<String> variables = new LinkedHashSet<>();
        gatherVariables(variables);
        return variables;
    }

    abstract void gatherVariables(Set<String> set);

    /**
     * Evaluates this expression in its ring.
     *
     * @param assignment
     *     Values of the variables, which need not be reduced.
     *
     * @return The value of the expression in {@code [0, 2^bitWidth)}.
     *
     * @throws IllegalArgumentException
     *     if a variable of the expression has no value.
     */
    public abstract BigInteger evaluate(Map<String, BigInteger> assignment);

    /** Returns an infix representation which parses to an equivalent expression. */
    @Override
    public abstract String toString();

    public enum Kind {
        CONSTANT(""),
        VARIABLE(""),
        SUM("+"),
        PRODUCT("*"),
        POWER("**"),
        NEGATION("~"),
        CONJUNCTION("&"),
        EXCLUSIVE_DISJUNCTION("^"),
        INCLUSIVE_DISJUNCTION("|");

        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public static final class Constant extends ExpressionNode {
        private final BigInteger value;

        Constant(ModularRing ring, BigInteger value) {
            super(ring);
            this.value = Objects.requireNonNull(value);
        }

        /** Returns the literal value as written, without reduction modulo the ring's modulus. */
        public BigInteger value() {
            return value;
        }

        /** Returns a constant with the negated value in the same ring. */
        public Constant negate() {
            return new Constant(ring(), value.negate());
        }

        @Override
        public Kind kind() {
            return Kind.CONSTANT;
        }

        @Override
        void gatherVariables(Set<String> set) {
            // No variables in this leaf
        }

        @Override
        public BigInteger evaluate(Map<String, BigInteger> assignment) {
            return ring().reduce(value);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Constant)) {
                return false;
            }
            Constant that = (Constant) object;
            return value.equals(that.value) && ring().equals(that.ring());
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, ring());
        }

        @Override
        public String toString() {
            return value.signum() < 0 ? "(" + value + ")" : value.toString();
        }
    }

    public static final class Variable extends ExpressionNode {
        private final String name;

        Variable(ModularRing ring, String name) {
            super(ring);
            Preconditions.checkArgument(!name.isEmpty(), "Empty variable name");
            this.name = name;
        }

        public String name() {
            return name;
        }

        @Override
        public Kind kind() {
            return Kind.VARIABLE;
        }

        @Override
        void gatherVariables(Set<String> set) {
            set.add(name);
        }

        @Override
        public BigInteger evaluate(Map<String, BigInteger> assignment) {
            BigInteger value = assignment.get(name);
            Preconditions.checkArgument(value != null, "No value for variable %s", name);
            return ring().reduce(value);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Variable)) {
                return false;
            }
            Variable that = (Variable) object;
            return name.equals(that.name) && ring().equals(that.ring());
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, ring());
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Operation extends ExpressionNode {
        private final Kind kind;
        private final ImmutableList<ExpressionNode> children;

        Operation(ModularRing ring, Kind kind, List<ExpressionNode> children) {
            super(ring);
            this.kind = kind;
            this.children = ImmutableList.copyOf(children);
            switch (kind) {
                case CONSTANT:
                case VARIABLE:
                    throw new IllegalArgumentException("Not an operator: " + kind);
                case NEGATION:
                    Preconditions.checkArgument(this.children.size() == 1,
                            "Negation takes one operand, got %s", this.children.size());
                    break;
                case POWER:
                    Preconditions.checkArgument(this.children.size() == 2,
                            "Power takes two operands, got %s", this.children.size());
                    break;
                default:
                    Preconditions.checkArgument(this.children.size() >= 2,
                            "%s needs at least two operands, got %s", kind, this.children.size());
            }
            for (ExpressionNode child : this.children) {
                Preconditions.checkArgument(ring.equals(child.ring()), "Operand %s from ring %s", child, child.ring());
            }
        }

        @Override
        public Kind kind() {
            return kind;
        }

        @Override
        public List<ExpressionNode> children() {
            return children;
        }

        /** Returns an operation of the same kind and ring with the given operands. */
        public Operation withChildren(List<ExpressionNode> newChildren) {
            return new Operation(ring(), kind, newChildren);
        }

        @Override
        void gatherVariables(Set<String> set) {
            for (ExpressionNode child : children) {
                child.gatherVariables(set);
            }
        }

        @Override
        public BigInteger evaluate(Map<String, BigInteger> assignment) {
            ModularRing ring = ring();
            switch (kind) {
                case NEGATION:
                    return ring.mask().subtract(children.get(0).evaluate(assignment));
                case POWER:
                    return children.get(0)
                            .evaluate(assignment)
                            .modPow(children.get(1).evaluate(assignment), ring.modulus());
                default:
                    break;
            }

            BigInteger value = children.get(0).evaluate(assignment);
            for (ExpressionNode child : children.subList(1, children.size())) {
                BigInteger operand = child.evaluate(assignment);
                switch (kind) {
                    case SUM:
                        value = value.add(operand);
                        break;
                    case PRODUCT:
                        value = value.multiply(operand);
                        break;
                    case CONJUNCTION:
                        value = value.and(operand);
                        break;
                    case EXCLUSIVE_DISJUNCTION:
                        value = value.xor(operand);
                        break;
                    case INCLUSIVE_DISJUNCTION:
                        value = value.or(operand);
                        break;
                    default:
                        throw new IllegalStateException("Unknown type " + kind);
                }
                value = ring.reduce(value);
            }
            return value;
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
            return kind == that.kind && children.equals(that.children) && ring().equals(that.ring());
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, children, ring());
        }

        @Override
        public String toString() {
            if (kind == Kind.NEGATION) {
                return kind.symbol() + operand(children.get(0));
            }
            StringBuilder builder = new StringBuilder();
            for (ExpressionNode child : children) {
                if (builder.length() > 0) {
                    builder.append(kind.symbol());
                }
                builder.append(operand(child));
            }
            return builder.toString();
        }

        private static String operand(ExpressionNode child) {
            return child.isLeaf() ? child.toString() : "(" + child + ")";
        }
    }
}
