package org.pragmatica.yard.tree;

import org.pragmatica.yard.grammar.Operator;
import org.pragmatica.yard.token.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Binary syntax tree of an expression. Leaves hold literals, branches hold an operator and
 * exactly two children.
 *
 * <p>Trees built from long operator chains are as deep as the chain, so every walk below uses
 * an explicit stack instead of recursion.
 */
public sealed interface AstNode {

    /**
     * Flatten back to RPN (post-order).
     */
    default List<Token> toRpn() {
        // Root, right, left pre-order reversed is left, right, root post-order
        var tokens = new ArrayList<Token>();
        Deque<AstNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (node instanceof Leaf leaf) {
                tokens.add(leaf.number());
            }else if (node instanceof Branch branch) {
                tokens.add(Token.OperatorToken.of(branch.operator()));
                pending.push(branch.left());
                pending.push(branch.right());
            }
        }
        Collections.reverse(tokens);
        return List.copyOf(tokens);
    }

    /**
     * Tuple form, e.g. {@code {"*", {"+", 1, 2}, 3}}. The empty tree renders as {@code {}}.
     */
    default String render() {
        if (this instanceof Empty) {
            return "{}";
        }
        return write(this, "{\"", "\", ", ", ", "}");
    }

    /**
     * Fully parenthesized infix form, e.g. {@code ((1 + 2) * 3)}.
     */
    default String toInfix() {
        return write(this, "(", "", " ", ")");
    }

    /**
     * Number of nodes, not counting the empty sentinel.
     */
    default int size() {
        int size = 0;
        Deque<AstNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (node instanceof Leaf) {
                size++ ;
            }else if (node instanceof Branch branch) {
                size++ ;
                pending.push(branch.left());
                pending.push(branch.right());
            }
        }
        return size;
    }

    /**
     * Longest path from this node to a leaf, in nodes.
     */
    default int depth() {
        int depth = 0;
        Deque<AstNode> nodes = new ArrayDeque<>();
        Deque<Integer> levels = new ArrayDeque<>();
        nodes.push(this);
        levels.push(1);
        while (!nodes.isEmpty()) {
            var node = nodes.pop();
            int level = levels.pop();
            if (node instanceof Leaf) {
                depth = Math.max(depth, level);
            }else if (node instanceof Branch branch) {
                depth = Math.max(depth, level);
                nodes.push(branch.left());
                levels.push(level + 1);
                nodes.push(branch.right());
                levels.push(level + 1);
            }
        }
        return depth;
    }

    /**
     * Tree of an empty expression.
     */
    record Empty() implements AstNode {
        public static final Empty INSTANCE = new Empty();
    }

    record Leaf(Token.Number number) implements AstNode {}

    record Branch(Operator operator, AstNode left, AstNode right) implements AstNode {}

    static AstNode empty() {
        return Empty.INSTANCE;
    }

    static AstNode leaf(Token.Number number) {
        return new Leaf(number);
    }

    static AstNode branch(Operator operator, AstNode left, AstNode right) {
        return new Branch(operator, left, right);
    }

    /**
     * Writes a branch as {@code open operator afterOperator left separator right close} for the
     * tuple form, or {@code open left separator operator separator right close} for infix when
     * {@code afterOperator} is empty.
     */
    private static String write(AstNode root, String open, String afterOperator, String separator, String close) {
        var sb = new StringBuilder();
        // Holds nodes still to write and literal text, popped in output order
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var item = pending.pop();
            if (item instanceof String text) {
                sb.append(text);
            }else if (item instanceof Leaf leaf) {
                sb.append(leaf.number().render());
            }else if (item instanceof Branch branch) {
                var operator = branch.operator().toString();
                pending.push(close);
                pending.push(branch.right());
                if (afterOperator.isEmpty()) {
                    pending.push(separator + operator + separator);
                    pending.push(branch.left());
                    pending.push(open);
                }else {
                    pending.push(separator);
                    pending.push(branch.left());
                    pending.push(open + operator + afterOperator);
                }
            }
        }
        return sb.toString();
    }
}
