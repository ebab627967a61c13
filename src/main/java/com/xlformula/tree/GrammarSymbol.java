package com.xlformula.tree;

/**
 * A symbol of the Excel formula grammar. The vocabulary is closed: every node kind the
 * grammar can produce is a constant of {@link NonTerminal} or {@link Terminal}.
 */
public sealed interface GrammarSymbol permits NonTerminal, Terminal {
    String symbolName();

    boolean isTerminal();
}
