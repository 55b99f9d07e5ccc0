package org.pragmatica.yard;

import io.vavr.control.Either;
import org.pragmatica.yard.converter.Converter;
import org.pragmatica.yard.converter.ConverterConfig;
import org.pragmatica.yard.converter.ParenthesisPolicy;
import org.pragmatica.yard.converter.ShuntingYardEngine;
import org.pragmatica.yard.error.ConversionError;
import org.pragmatica.yard.token.Token;
import org.pragmatica.yard.tree.AstNode;

import java.util.List;

/**
 * Entry point for converting algebraic expressions.
 *
 * <p>Example usage:
 * <pre>{@code
 * ShuntingYard.toRpn("(1+2)*(3+4)").get();   // 1 2 + 3 4 + *
 * ShuntingYard.toAst("(1+2)*(3+4)").get();   // {"*", {"+", 1, 2}, {"+", 3, 4}}
 *
 * var strict = ShuntingYard.builder()
 *                          .parentheses(ParenthesisPolicy.STRICT)
 *                          .build();
 * strict.toRpn("(1+2");                        // Left(UnbalancedParenthesis)
 * }</pre>
 */
public final class ShuntingYard {
    private static final Converter DEFAULT = ShuntingYardEngine.create(ConverterConfig.DEFAULT);

    private ShuntingYard() {}

    /**
     * Convert the expression to reverse-polish notation using the default configuration.
     */
    public static Either<ConversionError, List<Token>> toRpn(String expression) {
        return DEFAULT.toRpn(expression);
    }

    /**
     * Convert the expression to a syntax tree using the default configuration.
     */
    public static Either<ConversionError, AstNode> toAst(String expression) {
        return DEFAULT.toAst(expression);
    }

    /**
     * Fold an RPN sequence into a syntax tree.
     */
    public static Either<ConversionError, AstNode> buildAst(List<Token> rpn) {
        return DEFAULT.buildAst(rpn);
    }

    /**
     * Create a converter with custom configuration.
     */
    public static Converter converter(ConverterConfig config) {
        return ShuntingYardEngine.create(config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ParenthesisPolicy parenthesisPolicy = ParenthesisPolicy.LENIENT;
        private int maxInputLength = ConverterConfig.DEFAULT_MAX_INPUT_LENGTH;

        private Builder() {}

        public Builder parentheses(ParenthesisPolicy policy) {
            this.parenthesisPolicy = policy;
            return this;
        }

        public Builder maxInputLength(int length) {
            this.maxInputLength = length;
            return this;
        }

        public Converter build() {
            return converter(new ConverterConfig(parenthesisPolicy, maxInputLength));
        }
    }
}
