package com.xlformula.analysis;

import com.xlformula.tree.GrammarSymbol;
import com.xlformula.tree.NonTerminal;
import com.xlformula.tree.ParseNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Queries over a parse tree. Enumeration is depth-first pre-order with children visited
 * left to right, and uses an explicit stack so tree depth is not limited by the call stack.
 */
public final class Traversal {

    private Traversal() {
    }

    /**
     * All nodes of the subtree rooted at {@code root}, root first. The stream is lazy and,
     * like any stream, can only be consumed once.
     */
    public static Stream<ParseNode> allNodes(ParseNode root) {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(new PreOrderIterator(root), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * All nodes of a given kind, in pre-order.
     */
    public static Stream<ParseNode> allNodes(ParseNode root, GrammarSymbol kind) {
        return allNodes(root).filter(node -> node.is(kind));
    }

    /**
     * Whether the tree contains any node of a kind. Stops at the first match.
     */
    public static boolean contains(ParseNode root, GrammarSymbol kind) {
        return allNodes(root, kind).findFirst().isPresent();
    }

    /**
     * Go to the first non-formula node below {@code node}.
     */
    public static ParseNode skipFormula(ParseNode node) {
        return skip(node, n -> n.is(NonTerminal.FORMULA));
    }

    /**
     * Go to the first node that is neither a formula nor parentheses.
     */
    public static ParseNode skipFormulaAndParentheses(ParseNode node) {
        return skip(node, n -> n.is(NonTerminal.FORMULA) || Shapes.isParentheses(n));
    }

    private static ParseNode skip(ParseNode node, Predicate<ParseNode> predicate) {
        while (predicate.test(node) && node.children().notEmpty()) {
            node = node.child(0);
        }
        return node;
    }

    private static final class PreOrderIterator implements Iterator<ParseNode> {
        private final Deque<ParseNode> stack = new ArrayDeque<>();

        PreOrderIterator(ParseNode root) {
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public ParseNode next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            ParseNode node = stack.pop();
            // Reverse order so the leftmost child is popped first
            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
            return node;
        }
    }
}
