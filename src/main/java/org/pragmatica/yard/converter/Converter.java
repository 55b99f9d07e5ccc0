package org.pragmatica.yard.converter;

import io.vavr.control.Either;
import org.pragmatica.yard.error.ConversionError;
import org.pragmatica.yard.token.Token;
import org.pragmatica.yard.tree.AstNode;

import java.util.List;

/**
 * Converts infix expressions to RPN and to syntax trees. Implementations are stateless and
 * may be shared between threads.
 */
public interface Converter {

    /**
     * Convert the expression to reverse-polish notation. Whitespace is ignored.
     */
    Either<ConversionError, List<Token>> toRpn(String expression);

    /**
     * Convert the expression to a syntax tree. An empty expression yields {@link AstNode.Empty}.
     */
    Either<ConversionError, AstNode> toAst(String expression);

    /**
     * Fold an RPN sequence, produced here or elsewhere, into a syntax tree.
     */
    Either<ConversionError, AstNode> buildAst(List<Token> rpn);

    ConverterConfig config();
}
