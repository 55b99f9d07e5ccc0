package org.pragmatica.yard.error;

/**
 * Unchecked carrier for a {@link ConversionError}, for callers that prefer exceptions:
 * {@code ShuntingYard.toAst(text).getOrElseThrow(ConversionException::new)}.
 */
public class ConversionException extends RuntimeException {
    private final ConversionError error;

    public ConversionException(ConversionError error) {
        super(error.message());
        this.error = error;
    }

    public ConversionError error() {
        return error;
    }
}
