package org.pragmatica.yard.converter;

/**
 * Handling of parentheses without a partner.
 */
public enum ParenthesisPolicy {
    /**
     * A {@code )} with no open group closes nothing, a {@code (} left open at the end is dropped.
     */
    LENIENT,
    /**
     * Either case fails with {@link org.pragmatica.yard.error.ConversionError.UnbalancedParenthesis}.
     */
    STRICT
}
