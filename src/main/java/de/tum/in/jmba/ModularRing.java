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
import java.math.BigInteger;
import java.util.Objects;

/**
 * The ring of integers modulo {@code 2^bitWidth} an expression is interpreted in.
 */
public final class ModularRing {
    private final int bitWidth;
    private final BigInteger modulus;
    private final BigInteger mask;
    private final boolean reduceConstants;

    private ModularRing(int bitWidth, boolean reduceConstants) {
        this.bitWidth = bitWidth;
        this.modulus = BigInteger.ONE.shiftLeft(bitWidth);
        this.mask = modulus.subtract(BigInteger.ONE);
        this.reduceConstants = reduceConstants;
    }

    public static ModularRing of(int bitWidth) {
        return of(bitWidth, true);
    }

    public static ModularRing of(int bitWidth, boolean reduceConstants) {
        Preconditions.checkArgument(bitWidth > 0, "Bit width must be positive, got %s", bitWidth);
        return new ModularRing(bitWidth, reduceConstants);
    }

    public int bitWidth() {
        return bitWidth;
    }

    /** Returns {@code 2^bitWidth}. */
    public BigInteger modulus() {
        return modulus;
    }

    /** Returns {@code 2^bitWidth - 1}, i.e. the value with all bits set. */
    public BigInteger mask() {
        return mask;
    }

    /**
     * Whether later passes should reduce constants modulo {@link #modulus()}. The parser itself
     * stores literals unreduced in either case.
     */
    public boolean reduceConstants() {
        return reduceConstants;
    }

    /** Returns the representative of {@code value} in {@code [0, modulus)}. */
    public BigInteger reduce(BigInteger value) {
        return value.mod(modulus);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof ModularRing)) {
            return false;
        }
        ModularRing that = (ModularRing) object;
        return bitWidth == that.bitWidth && reduceConstants == that.reduceConstants;
    }

    @Override
    public int hashCode() {
        return Objects.hash(bitWidth, reduceConstants);
    }

    @Override
    public String toString() {
        return "Z/2^" + bitWidth;
    }
}
