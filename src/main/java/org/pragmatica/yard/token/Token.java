package org.pragmatica.yard.token;

import org.pragmatica.yard.grammar.Operator;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Element of an RPN sequence: a numeric literal or an operator.
 */
public sealed interface Token {

    /**
     * Text form as written in RPN output.
     */
    String render();

    /**
     * Numeric literal. Integer and decimal literals stay distinct kinds.
     */
    sealed interface Number extends Token {
        /**
         * The parsed value, {@link BigInteger} or {@link Double}.
         */
        java.lang.Number value();
    }

    /**
     * Literal written without a decimal point.
     */
    record IntegerNumber(BigInteger value) implements Number {
        public static IntegerNumber of(long value) {
            return new IntegerNumber(BigInteger.valueOf(value));
        }

        @Override
        public String render() {
            return value.toString();
        }
    }

    /**
     * Literal written with a decimal point.
     */
    record DecimalNumber(Double value) implements Number {
        public static DecimalNumber of(double value) {
            return new DecimalNumber(value);
        }

        @Override
        public String render() {
            return value.toString();
        }
    }

    record OperatorToken(Operator operator) implements Token {
        public static OperatorToken of(Operator operator) {
            return new OperatorToken(operator);
        }

        @Override
        public String render() {
            return operator.toString();
        }
    }

    /**
     * Space-separated text of a token sequence, e.g. {@code 1 2 + 3 *}.
     */
    static String render(List<Token> tokens) {
        return tokens.stream()
                     .map(Token::render)
                     .collect(Collectors.joining(" "));
    }
}
