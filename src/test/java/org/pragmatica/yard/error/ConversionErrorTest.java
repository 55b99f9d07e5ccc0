package org.pragmatica.yard.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.yard.tree.SourceLocation;
import org.pragmatica.yard.tree.SourceSpan;

import static org.junit.jupiter.api.Assertions.*;

class ConversionErrorTest {

    private static final SourceLocation LOC = SourceLocation.at(1, 3, 2);

    @Test
    void invalidCharacter_messageNamesCharacterAndRemainder() {
        var error = new ConversionError.InvalidCharacter(LOC, "x", "x*2");

        assertEquals("Unexpected 'x' at 1:3, failed to parse expression starting at 'x*2'", error.message());
        assertEquals(SourceSpan.single(LOC), error.span().get());
    }

    @Test
    void invalidNumber_messageNamesLiteral() {
        var span = SourceSpan.of(LOC, SourceLocation.at(1, 8, 7));
        var error = new ConversionError.InvalidNumber(span, "1.2.3");

        assertEquals("Invalid number '1.2.3' at 1:3", error.message());
        assertEquals(span, error.span().get());
    }

    @Test
    void unbalancedParenthesis_messageDependsOnSide() {
        assertEquals("Unclosed '(' at 1:3", new ConversionError.UnbalancedParenthesis(LOC, '(').message());
        assertEquals("Unmatched ')' at 1:3", new ConversionError.UnbalancedParenthesis(LOC, ')').message());
    }

    @Test
    void malformedRpn_hasNoSpan() {
        var error = new ConversionError.MalformedRpn(3, 1, "operator '*' needs two operands");

        assertTrue(error.span().isEmpty());
        assertEquals("Malformed RPN at token 3: operator '*' needs two operands (1 node(s) available)",
                     error.message());
    }

    @Test
    void conversionException_carriesError() {
        var error = new ConversionError.UnbalancedParenthesis(LOC, ')');
        var exception = new ConversionException(error);

        assertSame(error, exception.error());
        assertEquals(error.message(), exception.getMessage());
    }
}
