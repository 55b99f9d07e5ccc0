package org.pragmatica.yard.converter;

/**
 * Converter configuration options.
 */
public record ConverterConfig(
    ParenthesisPolicy parenthesisPolicy,
    int maxInputLength
) {
    public static final int DEFAULT_MAX_INPUT_LENGTH = 1_000_000;

    public static final ConverterConfig DEFAULT = new ConverterConfig(
        ParenthesisPolicy.LENIENT,
        DEFAULT_MAX_INPUT_LENGTH
    );

    public ConverterConfig {
        if (parenthesisPolicy == null) {
            throw new IllegalArgumentException("Parenthesis policy must be set");
        }
        if (maxInputLength < 0) {
            throw new IllegalArgumentException("Maximum input length must not be negative: " + maxInputLength);
        }
    }
}
