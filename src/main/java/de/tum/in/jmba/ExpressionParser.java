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

import de.tum.in.jmba.ExpressionNode.Constant;
import de.tum.in.jmba.ExpressionNode.Kind;
import de.tum.in.jmba.ExpressionNode.Operation;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses expressions over the ring of integers modulo {@code 2^n} into {@link ExpressionNode} trees.
 *
 * <p>Operators, from lowest to highest precedence:</p>
 * <ol>
 *   <li>{@code |} inclusive disjunction</li>
 *   <li>{@code ^} exclusive disjunction</li>
 *   <li>{@code &} conjunction</li>
 *   <li>{@code <<} left shift, rewritten to {@code a * 2**b}</li>
 *   <li>{@code +}, {@code -} sum</li>
 *   <li>{@code *} product</li>
 *   <li>{@code ~}, unary {@code -}</li>
 *   <li>{@code **} power, whose operands are terminals</li>
 * </ol>
 *
 * <p>Terminals are parenthesized expressions, variables such as {@code x} or {@code x[3]} and
 * decimal, binary ({@code 0b}) or hexadecimal ({@code 0x}) literals. Chains of equal precedence
 * yield a single node with all operands. Subtraction and negation are expressed as products with
 * {@code -1}, folded into constants and leading constant factors where possible. Shift and power do
 * not associate, {@code a<<b<<c} and {@code a**b**c} need parentheses.</p>
 *
 * <p>The parser holds no mutable state, grammar rules take and return {@link Cursor} values.</p>
 */
public final class ExpressionParser {
    private static final Logger logger = Logger.getLogger(ExpressionParser.class.getName());

    private final ModularRing ring;

    ExpressionParser(ModularRing ring) {
        this.ring = ring;
    }

    public static ExpressionNode parse(String expression, int bitWidth) throws ExpressionSyntaxException {
        return parse(expression, ParserConfiguration.of(bitWidth));
    }

    public static ExpressionNode parse(String expression, ParserConfiguration configuration)
            throws ExpressionSyntaxException {
        return parse(expression, configuration, ExpressionRefiner.identity());
    }

    /**
     * Parses the given expression and applies the normalization stages requested by the
     * configuration.
     *
     * @throws ExpressionSyntaxException
     *     if the expression is malformed. No tree is produced in this case.
     */
    public static ExpressionNode parse(String expression, ParserConfiguration configuration,
            ExpressionRefiner refiner) throws ExpressionSyntaxException {
        ExpressionNode root;
        try {
            root = new ExpressionParser(configuration.ring()).parseExpression(Cursor.of(expression));
        } catch (ExpressionSyntaxException e) {
            logger.log(Level.FINE, "Failed to parse {0}: {1}", new Object[] {expression, e.getMessage()});
            throw e;
        }
        logger.log(Level.FINER, "Parsed {0} into {1}", new Object[] {expression, root});

        if (configuration.refine()) {
            root = refiner.refine(root);
            if (configuration.markLinear()) {
                root = refiner.markLinear(root);
            }
        }
        return root;
    }

    ExpressionNode parseExpression(Cursor cursor) throws ExpressionSyntaxException {
        Parsed parsed = parseInclusiveDisjunction(cursor);
        if (!parsed.cursor().atEnd()) {
            throw ExpressionSyntaxException.at(parsed.cursor(), "Unexpected trailing input");
        }
        return parsed.node();
    }

    Parsed parseInclusiveDisjunction(Cursor cursor) throws ExpressionSyntaxException {
        return parseChain(cursor, '|', Kind.INCLUSIVE_DISJUNCTION, this::parseExclusiveDisjunction);
    }

    Parsed parseExclusiveDisjunction(Cursor cursor) throws ExpressionSyntaxException {
        return parseChain(cursor, '^', Kind.EXCLUSIVE_DISJUNCTION, this::parseConjunction);
    }

    Parsed parseConjunction(Cursor cursor) throws ExpressionSyntaxException {
        return parseChain(cursor, '&', Kind.CONJUNCTION, this::parseShift);
    }

    private Parsed parseChain(Cursor cursor, char operator, Kind kind, Rule operand)
            throws ExpressionSyntaxException {
        Parsed first = operand.parse(cursor);
        if (first.cursor().peek() != operator) {
            return first;
        }

        List<ExpressionNode> children = new ArrayList<>();
        children.add(first.node());
        Cursor current = first.cursor();
        while (current.peek() == operator) {
            Parsed next = operand.parse(current.advance());
            children.add(next.node());
            current = next.cursor();
        }
        return new Parsed(ExpressionNode.operation(ring, kind, children), current);
    }

    Parsed parseShift(Cursor cursor) throws ExpressionSyntaxException {
        Parsed base = parseSum(cursor);
        if (!base.cursor().startsWith("<<")) {
            return base;
        }

        Parsed shift = parseSum(base.cursor().advance(2));
        if (shift.cursor().startsWith("<<")) {
            throw ExpressionSyntaxException.at(shift.cursor(), "Nested shift operators require parentheses");
        }

        // a << b is a * 2**b
        ExpressionNode power = ExpressionNode.operation(ring, Kind.POWER, ExpressionNode.constant(ring, 2), shift.node());
        return new Parsed(ExpressionNode.operation(ring, Kind.PRODUCT, base.node(), power), shift.cursor());
    }

    Parsed parseSum(Cursor cursor) throws ExpressionSyntaxException {
        Parsed first = parseProduct(cursor);
        if (!isAdditiveOperator(first.cursor().peek())) {
            return first;
        }

        List<ExpressionNode> children = new ArrayList<>();
        children.add(first.node());
        Cursor current = first.cursor();
        while (isAdditiveOperator(current.peek())) {
            boolean subtract = current.peek() == '-';
            Parsed next = parseProduct(current.advance());
            children.add(subtract ? multiplyByMinusOne(next.node()) : next.node());
            current = next.cursor();
        }
        return new Parsed(ExpressionNode.operation(ring, Kind.SUM, children), current);
    }

    Parsed parseProduct(Cursor cursor) throws ExpressionSyntaxException {
        Parsed first = parseUnary(cursor);
        if (!isMultiplication(first.cursor())) {
            return first;
        }

        List<ExpressionNode> children = new ArrayList<>();
        children.add(first.node());
        Cursor current = first.cursor();
        while (isMultiplication(current)) {
            Parsed next = parseUnary(current.advance());
            children.add(next.node());
            current = next.cursor();
        }
        return new Parsed(ExpressionNode.operation(ring, Kind.PRODUCT, children), current);
    }

    Parsed parseUnary(Cursor cursor) throws ExpressionSyntaxException {
        if (cursor.peek() == '~') {
            Parsed operand = parseUnary(cursor.advance());
            return new Parsed(ExpressionNode.operation(ring, Kind.NEGATION, operand.node()), operand.cursor());
        }
        if (cursor.peek() == '-') {
            Parsed operand = parseUnary(cursor.advance());
            return new Parsed(multiplyByMinusOne(operand.node()), operand.cursor());
        }
        return parsePower(cursor);
    }

    Parsed parsePower(Cursor cursor) throws ExpressionSyntaxException {
        Parsed base = parseTerminal(cursor);
        if (!base.cursor().startsWith("**")) {
            return base;
        }

        Parsed exponent = parseTerminal(base.cursor().advance(2));
        if (exponent.cursor().startsWith("**")) {
            throw ExpressionSyntaxException.at(exponent.cursor(), "Nested power operators require parentheses");
        }
        return new Parsed(
                ExpressionNode.operation(ring, Kind.POWER, base.node(), exponent.node()), exponent.cursor());
    }

    Parsed parseTerminal(Cursor cursor) throws ExpressionSyntaxException {
        if (cursor.peek() == '(') {
            Parsed inner = parseInclusiveDisjunction(cursor.advance());
            if (inner.cursor().peek() != ')') {
                throw ExpressionSyntaxException.at(inner.cursor(), "Missing closing parenthesis");
            }
            return new Parsed(inner.node(), inner.cursor().advance());
        }
        if (isLetter(cursor.peek())) {
            return parseVariable(cursor);
        }
        return parseConstant(cursor);
    }

    Parsed parseVariable(Cursor cursor) throws ExpressionSyntaxException {
        assert isLetter(cursor.peek());
        Cursor end = cursor.advanceRaw();
        while (isIdentifierPart(end.peek())) {
            end = end.advanceRaw();
        }

        if (end.peek() == '[') {
            Cursor index = end.advanceRaw();
            if (!isDigit(index.peek(), 10)) {
                throw ExpressionSyntaxException.at(index, "Expected an index for variable %s", end.since(cursor));
            }
            while (isDigit(index.peek(), 10)) {
                index = index.advanceRaw();
            }
            if (index.peek() != ']') {
                throw ExpressionSyntaxException.at(index, "Missing closing bracket of variable index");
            }
            end = index.advanceRaw();
        }

        return new Parsed(ExpressionNode.variable(ring, end.since(cursor)), end.skipWhitespace());
    }

    Parsed parseConstant(Cursor cursor) throws ExpressionSyntaxException {
        if (cursor.startsWith("0b")) {
            return parseDigits(cursor.advanceRaw(2), 2, "binary");
        }
        if (cursor.startsWith("0x")) {
            return parseDigits(cursor.advanceRaw(2), 16, "hex");
        }
        if (!isDigit(cursor.peek(), 10)) {
            throw ExpressionSyntaxException.at(cursor, "Unexpected character, expected a variable or constant");
        }
        return parseDigits(cursor, 10, "decimal");
    }

    private Parsed parseDigits(Cursor start, int radix, String name) throws ExpressionSyntaxException {
        if (!isDigit(start.peek(), radix)) {
            throw ExpressionSyntaxException.at(start, "Invalid %s digit", name);
        }
        Cursor end = start;
        while (isDigit(end.peek(), radix)) {
            end = end.advanceRaw();
        }
        // Something like 0b102 or 12ab is a malformed literal, not a literal followed by garbage
        if (isIdentifierPart(end.peek())) {
            throw ExpressionSyntaxException.at(end, "Invalid %s digit", name);
        }

        BigInteger value = new BigInteger(end.since(start), radix);
        return new Parsed(ExpressionNode.constant(ring, value), end.skipWhitespace());
    }

    /**
     * Returns {@code -node}, folding the factor into a constant or a leading constant factor of a
     * product.
     */
    ExpressionNode multiplyByMinusOne(ExpressionNode node) {
        if (node instanceof Constant) {
            return ((Constant) node).negate();
        }
        if (node.kind() == Kind.PRODUCT) {
            Operation product = (Operation) node;
            List<ExpressionNode> factors = new ArrayList<>(product.children());
            if (factors.get(0) instanceof Constant) {
                factors.set(0, ((Constant) factors.get(0)).negate());
            } else {
                factors.add(0, ExpressionNode.constant(ring, -1));
            }
            return product.withChildren(factors);
        }
        return ExpressionNode.operation(ring, Kind.PRODUCT, ExpressionNode.constant(ring, -1), node);
    }

    private static boolean isAdditiveOperator(int character) {
        return character == '+' || character == '-';
    }

    private static boolean isMultiplication(Cursor cursor) {
        return cursor.peek() == '*' && cursor.peekNext() != '*';
    }

    private static boolean isLetter(int character) {
        return ('a' <= character && character <= 'z') || ('A' <= character && character <= 'Z');
    }

    private static boolean isDigit(int character, int radix) {
        return 0 <= character && character < 128 && Character.digit((char) character, radix) >= 0;
    }

    private static boolean isIdentifierPart(int character) {
        return isLetter(character) || isDigit(character, 10) || character == '_';
    }

    @FunctionalInterface
    private interface Rule {
        Parsed parse(Cursor cursor) throws ExpressionSyntaxException;
    }

    /** A parsed subexpression together with the position after it. */
    static final class Parsed {
        private final ExpressionNode node;
        private final Cursor cursor;

        Parsed(ExpressionNode node, Cursor cursor) {
            this.node = node;
            this.cursor = cursor;
        }

        ExpressionNode node() {
            return node;
        }

        Cursor cursor() {
            return cursor;
        }
    }
}
