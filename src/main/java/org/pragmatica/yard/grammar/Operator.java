package org.pragmatica.yard.grammar;

import io.vavr.control.Option;

/**
 * Binary operators recognized in expressions, with their precedence and associativity.
 *
 * <pre>
 *  ,        0  left
 *  + -      1  left
 *  * /      2  left
 *  ^        2  right
 *  d %      3  left
 * </pre>
 */
public enum Operator {
    COMMA(',', 0, Associativity.LEFT),
    PLUS('+', 1, Associativity.LEFT),
    MINUS('-', 1, Associativity.LEFT),
    MULTIPLY('*', 2, Associativity.LEFT),
    DIVIDE('/', 2, Associativity.LEFT),
    POWER('^', 2, Associativity.RIGHT),
    DICE('d', 3, Associativity.LEFT),
    MODULO('%', 3, Associativity.LEFT);

    private final char symbol;
    private final int precedence;
    private final Associativity associativity;

    Operator(char symbol, int precedence, Associativity associativity) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    public char symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public Associativity associativity() {
        return associativity;
    }

    /**
     * Sign operators may also start a literal.
     */
    public boolean isSign() {
        return this == PLUS || this == MINUS;
    }

    /**
     * Look up the operator written as {@code symbol}.
     */
    public static Option<Operator> fromSymbol(char symbol) {
        for (var operator : values()) {
            if (operator.symbol == symbol) {
                return Option.some(operator);
            }
        }
        return Option.none();
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
