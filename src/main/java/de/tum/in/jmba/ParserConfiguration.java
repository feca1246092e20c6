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

import org.immutables.value.Value;

/**
 * Options of {@link ExpressionParser}. Instances are obtained through
 * {@code ImmutableParserConfiguration.builder()}; inconsistent options are rejected when the
 * configuration is built, before any expression is looked at.
 */
@Value.Immutable
public abstract class ParserConfiguration {
    public static ParserConfiguration of(int bitWidth) {
        return ImmutableParserConfiguration.builder().bitWidth(bitWidth).build();
    }

    /** The expression is interpreted modulo {@code 2^bitWidth}. */
    public abstract int bitWidth();

    @Value.Default
    public boolean reduceConstants() {
        return true;
    }

    /** Whether the parsed tree is handed to {@link ExpressionRefiner#refine(ExpressionNode)}. */
    @Value.Default
    public boolean refine() {
        return false;
    }

    /**
     * Whether the refined tree is handed to {@link ExpressionRefiner#markLinear(ExpressionNode)}.
     * Requires {@link #refine()}.
     */
    @Value.Default
    public boolean markLinear() {
        return false;
    }

    public ModularRing ring() {
        return ModularRing.of(bitWidth(), reduceConstants());
    }

    @Value.Check
    protected void check() {
        Util.checkState(bitWidth() > 0, "Bit width must be positive, got %d", bitWidth());
        Util.checkState(!markLinear() || refine(), "Marking linear subexpressions requires refinement");
    }
}
