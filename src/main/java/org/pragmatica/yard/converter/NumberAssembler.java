package org.pragmatica.yard.converter;

import io.vavr.control.Either;
import org.pragmatica.yard.error.ConversionError;
import org.pragmatica.yard.token.Token;
import org.pragmatica.yard.tree.SourceSpan;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Turns the characters collected for a literal into a number token.
 * A literal containing {@code .} becomes a decimal, anything else an integer.
 */
public final class NumberAssembler {
    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?[0-9]+\\.[0-9]+");

    private NumberAssembler() {}

    public static Either<ConversionError, Token.Number> assemble(String literal, SourceSpan span) {
        if (literal.indexOf('.') >= 0) {
            if (!DECIMAL.matcher(literal).matches()) {
                return Either.left(new ConversionError.InvalidNumber(span, literal));
            }
            var value = Double.parseDouble(literal);
            // Out of double range
            return Double.isInfinite(value)
                   ? Either.left(new ConversionError.InvalidNumber(span, literal))
                   : Either.right(Token.DecimalNumber.of(value));
        }
        return INTEGER.matcher(literal).matches()
               ? Either.right(new Token.IntegerNumber(new BigInteger(literal)))
               : Either.left(new ConversionError.InvalidNumber(span, literal));
    }
}
