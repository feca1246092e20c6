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

/**
 * A normalization stage applied to freshly parsed expressions, see {@link ParserConfiguration#refine()}
 * and {@link ParserConfiguration#markLinear()}.
 */
public interface ExpressionRefiner {
    static ExpressionRefiner identity() {
        return IdentityRefiner.INSTANCE;
    }

    ExpressionNode refine(ExpressionNode root);

    /** Marks linear subexpressions of an already refined tree. */
    ExpressionNode markLinear(ExpressionNode root);

    enum IdentityRefiner implements ExpressionRefiner {
        INSTANCE;

        @Override
        public ExpressionNode refine(ExpressionNode root) {
            return root;
        }

        @Override
        public ExpressionNode markLinear(ExpressionNode root) {
            return root;
        }
    }
}
