package com.xlformula.tree;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Arrays;

/**
 * A node of a formula parse tree. Nodes are immutable; a branch owns its children and a
 * leaf owns the exact source text of its token.
 */
public sealed interface ParseNode {
    GrammarSymbol kind();

    ImmutableList<ParseNode> children();

    /** Source text of a terminal. Fails on a non-terminal. */
    String tokenText();

    /** Whether a terminal's symbol is flagged as an operator. Fails on a non-terminal. */
    boolean isOperator();

    default boolean isTerminal() {
        return kind().isTerminal();
    }

    default boolean is(GrammarSymbol symbol) {
        return kind() == symbol;
    }

    default ParseNode child(int index) {
        return children().get(index);
    }

    static Branch branch(NonTerminal kind, ParseNode... children) {
        return new Branch(kind, Lists.immutable.withAll(Arrays.asList(children)));
    }

    static Branch branch(NonTerminal kind, Iterable<? extends ParseNode> children) {
        return new Branch(kind, Lists.immutable.withAll(children));
    }

    static Leaf leaf(Terminal kind, String text) {
        return new Leaf(kind, text);
    }

    /** Leaf for a token with a fixed literal, such as an operator. */
    static Leaf leaf(Terminal kind) {
        if (kind.literal() == null) {
            throw new IllegalArgumentException("Token " + kind.symbolName() + " has no fixed text");
        }
        return new Leaf(kind, kind.literal());
    }

    record Branch(NonTerminal kind, ImmutableList<ParseNode> children) implements ParseNode {
        public Branch {
            if (kind == null || children == null) {
                throw new IllegalArgumentException("Branch needs a kind and a child list");
            }
        }

        @Override
        public String tokenText() {
            throw new IllegalStateException("Non-terminal " + kind.symbolName() + " has no token text");
        }

        @Override
        public boolean isOperator() {
            throw new IllegalStateException("Non-terminal " + kind.symbolName() + " has no operator flag");
        }
    }

    record Leaf(Terminal kind, String text) implements ParseNode {
        public Leaf {
            if (kind == null || text == null) {
                throw new IllegalArgumentException("Leaf needs a kind and a text");
            }
        }

        @Override
        public ImmutableList<ParseNode> children() {
            return Lists.immutable.empty();
        }

        @Override
        public String tokenText() {
            return text;
        }

        @Override
        public boolean isOperator() {
            return kind.isOperator();
        }
    }
}
