package org.pragmatica.yard.error;

import io.vavr.control.Option;
import org.junit.jupiter.api.Test;
import org.pragmatica.yard.ShuntingYard;
import org.pragmatica.yard.converter.ParenthesisPolicy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.yard.RpnFixtures.rpn;

class DiagnosticTest {

    @Test
    void invalidCharacter_formatsWithCaret() {
        var error = ShuntingYard.toRpn("1+x*2").getLeft();

        var expected = """
            error[E0001]: unexpected character 'x'
             --> 1:3
              |
            1 | 1+x*2
              |   ^ expected a digit, '.', a parenthesis or an operator
              |
            """;
        assertEquals(expected, error.diagnostic().format("1+x*2"));
    }

    @Test
    void invalidNumber_underlinesWholeLiteral() {
        var source = "2 * 1.2.3";
        var formatted = ShuntingYard.toRpn(source).getLeft().diagnostic().format(source);

        assertThat(formatted).startsWith("error[E0002]: invalid number literal '1.2.3'\n");
        assertThat(formatted).contains("1 | 2 * 1.2.3\n");
        assertThat(formatted).contains("  |     ^^^^^ not a valid number\n");
        assertThat(formatted).contains("  = help: numbers look like 42, -7 or 3.25\n");
    }

    @Test
    void errorOnSecondLine_showsThatLine() {
        var source = "1 +\n2 ? 3";
        var formatted = ShuntingYard.toRpn(source).getLeft().diagnostic().format(source);

        assertThat(formatted).contains(" --> 2:3\n");
        assertThat(formatted).contains("2 | 2 ? 3\n");
        assertThat(formatted).contains("  |   ^ ");
    }

    @Test
    void unbalancedParenthesis_pointsAtOpeningParenthesis() {
        var converter = ShuntingYard.builder()
                                    .parentheses(ParenthesisPolicy.STRICT)
                                    .build();
        var diagnostic = converter.toRpn("(1+2").getLeft().diagnostic();

        assertEquals("E0003", diagnostic.code());
        assertEquals("1:1: error[E0003]: unbalanced parenthesis", diagnostic.formatSimple());
        assertThat(diagnostic.format("(1+2")).contains("  | ^ this group is never closed\n");
    }

    @Test
    void malformedRpn_hasNoSourceSection() {
        var diagnostic = ShuntingYard.buildAst(rpn(1, "+")).getLeft().diagnostic();

        var formatted = diagnostic.format("");
        assertThat(formatted).startsWith("error[E0004]: malformed RPN: operator '+' needs two operands\n");
        assertThat(formatted).doesNotContain("-->");
        assertThat(formatted).contains("  = token 1, 1 node(s) on the stack\n");
        assertEquals("error[E0004]: malformed RPN: operator '+' needs two operands", diagnostic.formatSimple());
    }

    @Test
    void withNote_keepsExistingNotes() {
        var diagnostic = Diagnostic.error("E9999", "test", Option.none())
                                   .withNote("first")
                                   .withHelp("second");

        assertEquals(2, diagnostic.notes().size());
        assertEquals("help: second", diagnostic.notes().get(1));
    }
}
