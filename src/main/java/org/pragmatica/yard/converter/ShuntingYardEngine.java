package org.pragmatica.yard.converter;

import io.vavr.control.Either;
import org.pragmatica.yard.error.ConversionError;
import org.pragmatica.yard.token.Token;
import org.pragmatica.yard.tree.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link Converter} built on the shunting-yard reducer and the RPN tree builder.
 */
public final class ShuntingYardEngine implements Converter {
    private static final Logger log = LoggerFactory.getLogger(ShuntingYardEngine.class);

    private final ConverterConfig config;

    private ShuntingYardEngine(ConverterConfig config) {
        this.config = config;
    }

    public static ShuntingYardEngine create(ConverterConfig config) {
        return new ShuntingYardEngine(config);
    }

    @Override
    public ConverterConfig config() {
        return config;
    }

    @Override
    public Either<ConversionError, List<Token>> toRpn(String expression) {
        if (expression.length() > config.maxInputLength()) {
            throw new IllegalArgumentException(
            "Expression exceeds maximum length of " + config.maxInputLength() + " characters");
        }
        var result = InfixReducer.reduce(Normalizer.normalize(expression), config.parenthesisPolicy());
        if (result.isLeft()) {
            log.debug("Failed to convert '{}': {}", expression, result.getLeft().message());
        }else if (log.isTraceEnabled()) {
            log.trace("Converted '{}' to RPN: {}", expression, Token.render(result.get()));
        }
        return result;
    }

    @Override
    public Either<ConversionError, AstNode> toAst(String expression) {
        return toRpn(expression).flatMap(this::buildAst);
    }

    @Override
    public Either<ConversionError, AstNode> buildAst(List<Token> rpn) {
        var result = RpnTreeBuilder.build(rpn);
        if (result.isLeft()) {
            log.debug("Failed to build tree from '{}': {}", Token.render(rpn), result.getLeft().message());
        }
        return result;
    }
}
