package org.pragmatica.yard.grammar;

import org.pragmatica.yard.tree.SourceLocation;

/**
 * Entry of the operator stack: a deferred operator or an open group marker.
 */
public sealed interface StackSymbol {
    SourceLocation location();

    /**
     * Operator waiting for its right operand.
     */
    record Deferred(SourceLocation location, Operator operator) implements StackSymbol {}

    /**
     * Marker left by {@code (}; flushing never crosses it.
     */
    record OpenGroup(SourceLocation location) implements StackSymbol {}
}
