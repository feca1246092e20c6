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

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Renders parsed expressions and parses them again, checking that nothing changes.
 */
public class ExpressionRoundTripTest {
    private static final List<String> VARIABLES = List.of("a", "b", "c", "x[0]", "x[1]");
    private static final int EXPRESSIONS = 500;
    private static final int ASSIGNMENTS = 20;

    static Stream<Arguments> expressions() {
        Random random = new Random(0L);
        return IntStream.of(1, 8, 64).boxed().flatMap(bitWidth -> IntStream.range(0, EXPRESSIONS / 3)
                .mapToObj(i -> Arguments.of(bitWidth, randomExpression(random, 4))));
    }

    private static String randomExpression(Random random, int depth) {
        if (depth == 0 || random.nextInt(4) == 0) {
            return randomTerminal(random, depth);
        }
        String left = randomExpression(random, depth - 1);
        String right = randomExpression(random, depth - 1);
        switch (random.nextInt(11)) {
            case 0:
                return left + " + " + right;
            case 1:
                return left + "-" + right;
            case 2:
                return left + "*" + right;
            case 3:
                return left + " & " + right;
            case 4:
                return left + "|" + right;
            case 5:
                return left + " ^ " + right;
            case 6:
                return "~" + randomTerminal(random, depth - 1);
            case 7:
                return "-" + randomTerminal(random, depth - 1);
            case 8:
                return randomTerminal(random, depth - 1) + "**" + randomTerminal(random, depth - 1);
            case 9:
                return "((" + left + ") << (" + right + "))";
            default:
                return "(" + left + ")";
        }
    }

    private static String randomTerminal(Random random, int depth) {
        switch (random.nextInt(depth > 0 ? 5 : 4)) {
            case 0:
                return String.valueOf(random.nextInt(1000));
            case 1:
                return "0x" + Integer.toHexString(random.nextInt(1 << 16));
            case 2:
                return "0b" + Integer.toBinaryString(random.nextInt(64));
            case 3:
                return VARIABLES.get(random.nextInt(VARIABLES.size()));
            default:
                return "(" + randomExpression(random, depth - 1) + ")";
        }
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testRenderingParsesToSameTree(int bitWidth, String expression) throws ExpressionSyntaxException {
        ExpressionNode parsed = ExpressionParser.parse(expression, bitWidth);
        ExpressionNode reparsed = ExpressionParser.parse(parsed.toString(), bitWidth);
        assertThat(reparsed, is(parsed));
        assertThat(reparsed.toString(), is(parsed.toString()));
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testRenderingEvaluatesIdentically(int bitWidth, String expression) throws ExpressionSyntaxException {
        ExpressionNode parsed = ExpressionParser.parse(expression, bitWidth);
        ExpressionNode reparsed = ExpressionParser.parse(parsed.toString(), bitWidth);

        Random random = new Random(expression.hashCode());
        Map<String, BigInteger> assignment = new HashMap<>();
        for (int i = 0; i < ASSIGNMENTS; i++) {
            for (String variable : VARIABLES) {
                assignment.put(variable, new BigInteger(bitWidth + 4, random));
            }
            BigInteger value = parsed.evaluate(assignment);
            assertThat(reparsed.evaluate(assignment), is(value));
            assertThat(value.signum() >= 0 && value.compareTo(parsed.ring().modulus()) < 0, is(true));
        }
    }
}
