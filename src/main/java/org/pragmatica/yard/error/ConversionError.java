package org.pragmatica.yard.error;

import io.vavr.control.Option;
import org.pragmatica.yard.tree.SourceLocation;
import org.pragmatica.yard.tree.SourceSpan;

/**
 * Reason an expression could not be converted.
 */
public sealed interface ConversionError {
    String message();

    /**
     * Region of the raw expression the error points at, if the error comes from scanning text.
     */
    Option<SourceSpan> span();

    /**
     * Caret-style report for this error.
     */
    Diagnostic diagnostic();

    /**
     * Character that is neither part of a literal, a parenthesis nor an operator.
     *
     * @param found     the offending character; two chars long for a supplementary code point
     * @param remaining unscanned rest of the normalized expression, starting at {@code found}
     */
    record InvalidCharacter(
    SourceLocation location,
    String found,
    String remaining) implements ConversionError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", failed to parse expression starting at '"
                   + remaining + "'";
        }

        @Override
        public Option<SourceSpan> span() {
            return Option.some(SourceSpan.of(location,
                                             SourceLocation.at(location.line(),
                                                               location.column() + found.length(),
                                                               location.offset() + found.length())));
        }

        @Override
        public Diagnostic diagnostic() {
            return Diagnostic.error("E0001", "unexpected character '" + found + "'", span())
                             .withLabel("expected a digit, '.', a parenthesis or an operator");
        }
    }

    /**
     * Assembled literal that does not parse as its kind of number.
     */
    record InvalidNumber(
    SourceSpan location,
    String literal) implements ConversionError {
        @Override
        public String message() {
            return "Invalid number '" + literal + "' at " + location.start();
        }

        @Override
        public Option<SourceSpan> span() {
            return Option.some(location);
        }

        @Override
        public Diagnostic diagnostic() {
            return Diagnostic.error("E0002", "invalid number literal '" + literal + "'", span())
                             .withLabel("not a valid number")
                             .withHelp("numbers look like 42, -7 or 3.25");
        }
    }

    /**
     * Parenthesis without a partner, reported only with the strict parenthesis policy.
     */
    record UnbalancedParenthesis(
    SourceLocation location,
    char parenthesis) implements ConversionError {
        @Override
        public String message() {
            return parenthesis == '('
                   ? "Unclosed '(' at " + location
                   : "Unmatched ')' at " + location;
        }

        @Override
        public Option<SourceSpan> span() {
            return Option.some(SourceSpan.single(location));
        }

        @Override
        public Diagnostic diagnostic() {
            var label = parenthesis == '('
                        ? "this group is never closed"
                        : "no group to close";
            return Diagnostic.error("E0003", "unbalanced parenthesis", span())
                             .withLabel(label);
        }
    }

    /**
     * RPN sequence that does not fold into exactly one tree.
     *
     * @param index     position of the offending token, or the sequence length when nodes are left over
     * @param available nodes on the stack when the problem was detected
     */
    record MalformedRpn(
    int index,
    int available,
    String reason) implements ConversionError {
        @Override
        public String message() {
            return "Malformed RPN at token " + index + ": " + reason + " (" + available + " node(s) available)";
        }

        @Override
        public Option<SourceSpan> span() {
            return Option.none();
        }

        @Override
        public Diagnostic diagnostic() {
            return Diagnostic.error("E0004", "malformed RPN: " + reason, span())
                             .withNote("token " + index + ", " + available + " node(s) on the stack");
        }
    }
}
