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
 * Thrown when an expression does not conform to the grammar of {@link ExpressionParser}.
 */
public class ExpressionSyntaxException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String expression;
    private final int position;

    public ExpressionSyntaxException(String message, String expression, int position) {
        super(message + " at position " + position);
        this.expression = expression;
        this.position = position;
    }

    static ExpressionSyntaxException at(Cursor cursor, String formatString, Object... format) {
        String message = String.format(formatString, format) + " near " + cursor.describeCurrent();
        return new ExpressionSyntaxException(message, cursor.text(), cursor.offset());
    }

    public String getExpression() {
        return expression;
    }

    /** Returns the offset of the offending character in the expression. */
    public int getPosition() {
        return position;
    }

    /** Returns the offending character, or {@code -1} if the error occurred at the end of input. */
    public int getOffendingCharacter() {
        return position < expression.length() ? expression.charAt(position) : -1;
    }
}
