package com.xlformula;

import com.xlformula.tree.GrammarSymbol;
import com.xlformula.tree.ParseNode;

/**
 * Thrown when a function or operator name is requested for a node that is neither.
 * Callers are expected to check {@code Shapes.isFunction} first.
 */
public class InvalidShapeException extends FormulaException {

    private final GrammarSymbol kind;

    public InvalidShapeException(ParseNode node) {
        super("Not a function call: " + node.kind().symbolName() + " with " + node.children().size() + " children");
        this.kind = node.kind();
    }

    public GrammarSymbol getKind() {
        return kind;
    }
}
