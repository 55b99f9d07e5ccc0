package org.pragmatica.yard.converter;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.yard.error.ConversionError;
import org.pragmatica.yard.grammar.Operator;
import org.pragmatica.yard.grammar.PrecedenceTable;
import org.pragmatica.yard.grammar.StackSymbol;
import org.pragmatica.yard.token.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Shunting-yard pass: folds a normalized expression, one character at a time, into RPN.
 *
 * <p>Running state is the literal being assembled, the operator stack, the output built so far
 * and whether the next character may be a sign starting a literal. That flag is set at the
 * start, after {@code (} and after a binary operator, and cleared by literal characters.
 * A {@code )} leaves it unchanged.
 */
public final class InfixReducer {
    private static final int DEFAULT_LITERAL_CAPACITY = 16;

    private enum CharClass {
        LITERAL,
        OPEN,
        CLOSE,
        OPERATOR,
        OTHER
    }

    private final NormalizedExpression expression;
    private final ParenthesisPolicy parenthesisPolicy;
    private final StringBuilder literal = new StringBuilder(DEFAULT_LITERAL_CAPACITY);
    private final Deque<StackSymbol> operators = new ArrayDeque<>();
    private final List<Token> output = new ArrayList<>();
    private int literalStart;
    private boolean expectsOperand = true;

    private InfixReducer(NormalizedExpression expression, ParenthesisPolicy parenthesisPolicy) {
        this.expression = expression;
        this.parenthesisPolicy = parenthesisPolicy;
    }

    public static Either<ConversionError, List<Token>> reduce(NormalizedExpression expression) {
        return reduce(expression, ParenthesisPolicy.LENIENT);
    }

    public static Either<ConversionError, List<Token>> reduce(NormalizedExpression expression,
                                                               ParenthesisPolicy parenthesisPolicy) {
        return new InfixReducer(expression, parenthesisPolicy).reduceAll();
    }

    private Either<ConversionError, List<Token>> reduceAll() {
        for (int index = 0; index < expression.length(); index++ ) {
            var failure = step(index);
            if (failure.isDefined()) {
                return Either.left(failure.get());
            }
        }
        var failure = finish();
        if (failure.isDefined()) {
            return Either.left(failure.get());
        }
        return Either.right(List.copyOf(output));
    }

    private Option<ConversionError> step(int index) {
        char c = expression.charAt(index);
        return switch (classify(c)) {
            case LITERAL -> appendLiteral(index, c);
            case OPEN -> openGroup(index);
            case CLOSE -> closeGroup(index);
            case OPERATOR -> operator(index, Operator.fromSymbol(c).get());
            case OTHER -> invalidCharacter(index);
        };
    }

    private static CharClass classify(char c) {
        if ((c >= '0' && c <= '9') || c == '.') {
            return CharClass.LITERAL;
        }
        if (c == '(') {
            return CharClass.OPEN;
        }
        if (c == ')') {
            return CharClass.CLOSE;
        }
        return Operator.fromSymbol(c).isDefined()
               ? CharClass.OPERATOR
               : CharClass.OTHER;
    }

    private Option<ConversionError> appendLiteral(int index, char c) {
        if (literal.length() == 0) {
            literalStart = index;
        }
        literal.append(c);
        expectsOperand = false;
        return Option.none();
    }

    private Option<ConversionError> openGroup(int index) {
        // No implicit multiplication: '(' right after a literal is rejected
        if (literal.length() > 0) {
            return invalidCharacter(index);
        }
        operators.push(new StackSymbol.OpenGroup(expression.location(index)));
        expectsOperand = true;
        return Option.none();
    }

    private Option<ConversionError> closeGroup(int index) {
        var failure = flushLiteral();
        if (failure.isDefined()) {
            return failure;
        }
        while (!operators.isEmpty()) {
            var top = operators.pop();
            if (top instanceof StackSymbol.Deferred deferred) {
                output.add(Token.OperatorToken.of(deferred.operator()));
            }else {
                return Option.none();
            }
        }
        return parenthesisPolicy == ParenthesisPolicy.STRICT
               ? Option.some(new ConversionError.UnbalancedParenthesis(expression.location(index), ')'))
               : Option.none();
    }

    private Option<ConversionError> operator(int index, Operator incoming) {
        if (incoming.isSign() && literal.length() == 0 && expectsOperand) {
            // Unary sign becomes the first character of the next literal
            literalStart = index;
            literal.append(incoming.symbol());
            expectsOperand = false;
            return Option.none();
        }
        var failure = flushLiteral();
        if (failure.isDefined()) {
            return failure;
        }
        while (!operators.isEmpty() && PrecedenceTable.compare(incoming, operators.peek()).flushesTop()) {
            var deferred = (StackSymbol.Deferred) operators.pop();
            output.add(Token.OperatorToken.of(deferred.operator()));
        }
        operators.push(new StackSymbol.Deferred(expression.location(index), incoming));
        expectsOperand = true;
        return Option.none();
    }

    private Option<ConversionError> invalidCharacter(int index) {
        var found = new String(Character.toChars(expression.text().codePointAt(index)));
        return Option.some(new ConversionError.InvalidCharacter(expression.location(index),
                                                                found,
                                                                expression.remaining(index)));
    }

    private Option<ConversionError> flushLiteral() {
        if (literal.length() == 0) {
            return Option.none();
        }
        var span = expression.span(literalStart, literalStart + literal.length() - 1);
        var assembled = NumberAssembler.assemble(literal.toString(), span);
        literal.setLength(0);
        if (assembled.isLeft()) {
            return Option.some(assembled.getLeft());
        }
        output.add(assembled.get());
        return Option.none();
    }

    private Option<ConversionError> finish() {
        var failure = flushLiteral();
        if (failure.isDefined()) {
            return failure;
        }
        while (!operators.isEmpty()) {
            var top = operators.pop();
            if (top instanceof StackSymbol.Deferred deferred) {
                output.add(Token.OperatorToken.of(deferred.operator()));
            }else if (parenthesisPolicy == ParenthesisPolicy.STRICT) {
                return Option.some(new ConversionError.UnbalancedParenthesis(top.location(), '('));
            }
        }
        return Option.none();
    }
}
