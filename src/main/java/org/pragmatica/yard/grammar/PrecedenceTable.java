package org.pragmatica.yard.grammar;

/**
 * Decides whether an incoming operator displaces the operator on top of the stack.
 */
public final class PrecedenceTable {
    private PrecedenceTable() {}

    public enum Ordering {
        HIGHER,
        EQUAL,
        LOWER
    }

    /**
     * Outcome of comparing an incoming operator with the stack top.
     *
     * @param ordering      precedence of the incoming operator relative to the top
     * @param associativity associativity of the incoming operator
     */
    public record Comparison(Ordering ordering, Associativity associativity) {
        /**
         * Whether the stack top must be emitted before the incoming operator is pushed.
         */
        public boolean flushesTop() {
            return ordering == Ordering.LOWER
                   || (ordering == Ordering.EQUAL && associativity == Associativity.LEFT);
        }
    }

    /**
     * Compare {@code incoming} against {@code top}. The incoming operator always ranks higher
     * than an open group, so it is pushed on top of the group marker.
     */
    public static Comparison compare(Operator incoming, StackSymbol top) {
        if (top instanceof StackSymbol.Deferred deferred) {
            return compare(incoming, deferred.operator());
        }
        return new Comparison(Ordering.HIGHER, incoming.associativity());
    }

    public static Comparison compare(Operator incoming, Operator top) {
        return new Comparison(order(incoming.precedence(), top.precedence()), incoming.associativity());
    }

    private static Ordering order(int incoming, int top) {
        if (incoming > top) {
            return Ordering.HIGHER;
        }
        return incoming == top
               ? Ordering.EQUAL
               : Ordering.LOWER;
    }
}
