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

import java.util.Objects;

/**
 * An immutable position in the text being parsed. Advancing returns a new cursor, so every grammar
 * rule receives the position to start at and hands back the position after what it consumed.
 */
final class Cursor {
    static final int END = -1;

    private final String text;
    private final int offset;

    private Cursor(String text, int offset) {
        assert 0 <= offset && offset <= text.length();
        this.text = text;
        this.offset = offset;
    }

    /** Returns a cursor at the first non-whitespace character of {@code text}. */
    static Cursor of(String text) {
        return new Cursor(Objects.requireNonNull(text), 0).skipWhitespace();
    }

    String text() {
        return text;
    }

    int offset() {
        return offset;
    }

    boolean atEnd() {
        return offset == text.length();
    }

    /** Returns the current character or {@link #END}. */
    int peek() {
        return offset < text.length() ? text.charAt(offset) : END;
    }

    /** Returns the character after the current one or {@link #END}. */
    int peekNext() {
        return offset + 1 < text.length() ? text.charAt(offset + 1) : END;
    }

    boolean startsWith(String prefix) {
        return text.startsWith(prefix, offset);
    }

    /** Consumes one character and any whitespace following it. */
    Cursor advance() {
        return advanceRaw().skipWhitespace();
    }

    /** Consumes {@code count} characters and any whitespace following them. */
    Cursor advance(int count) {
        return advanceRaw(count).skipWhitespace();
    }

    /** Consumes one character, keeping whitespace after it. */
    Cursor advanceRaw() {
        return advanceRaw(1);
    }

    Cursor advanceRaw(int count) {
        assert offset + count <= text.length();
        return new Cursor(text, offset + count);
    }

    Cursor skipWhitespace() {
        int position = offset;
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
            position += 1;
        }
        return position == offset ? this : new Cursor(text, position);
    }

    /** Returns the text between {@code start} and this cursor. */
    String since(Cursor start) {
        assert start.text == text && start.offset <= offset;
        return text.substring(start.offset, offset);
    }

    /** Returns a human readable description of the current character. */
    String describeCurrent() {
        return atEnd() ? "end of input" : "'" + text.charAt(offset) + "'";
    }

    @Override
    public String toString() {
        return text.substring(0, offset) + "|" + text.substring(offset);
    }
}
