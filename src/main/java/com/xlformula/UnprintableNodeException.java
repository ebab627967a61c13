package com.xlformula;

import com.xlformula.tree.GrammarSymbol;
import com.xlformula.tree.ParseNode;

/**
 * Thrown by the printer for a node shape it has no rule for. A tree produced by the
 * formula grammar never triggers this; seeing it means the grammar changed and the
 * printer was not updated.
 */
public class UnprintableNodeException extends FormulaException {

    private final GrammarSymbol kind;

    public UnprintableNodeException(ParseNode node) {
        super("Could not print node of type '" + node.kind().symbolName() + "' with "
                + node.children().size() + " children. The grammar was probably modified without updating the printer");
        this.kind = node.kind();
    }

    public GrammarSymbol getKind() {
        return kind;
    }
}
