package org.pragmatica.yard.converter;

import io.vavr.control.Either;
import org.pragmatica.yard.error.ConversionError;
import org.pragmatica.yard.token.Token;
import org.pragmatica.yard.tree.AstNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Folds an RPN sequence into a binary tree.
 *
 * <p>Numbers push a leaf. An operator pops the right operand, then the left one, and pushes
 * the branch joining them. A well-formed sequence leaves exactly one node; an empty sequence
 * yields {@link AstNode.Empty}.
 */
public final class RpnTreeBuilder {
    private RpnTreeBuilder() {}

    public static Either<ConversionError, AstNode> build(List<Token> rpn) {
        if (rpn.isEmpty()) {
            return Either.right(AstNode.empty());
        }
        Deque<AstNode> nodes = new ArrayDeque<>();
        for (int index = 0; index < rpn.size(); index++ ) {
            var token = rpn.get(index);
            if (token instanceof Token.Number number) {
                nodes.push(AstNode.leaf(number));
            }else if (token instanceof Token.OperatorToken operatorToken) {
                if (nodes.size() < 2) {
                    return Either.left(new ConversionError.MalformedRpn(index,
                                                                        nodes.size(),
                                                                        "operator '" + operatorToken.operator()
                                                                        + "' needs two operands"));
                }
                var right = nodes.pop();
                var left = nodes.pop();
                nodes.push(AstNode.branch(operatorToken.operator(), left, right));
            }
        }
        if (nodes.size() != 1) {
            return Either.left(new ConversionError.MalformedRpn(rpn.size(),
                                                                nodes.size(),
                                                                "operands left without an operator"));
        }
        return Either.right(nodes.pop());
    }
}
