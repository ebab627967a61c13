package com.xlformula.analysis;

import com.xlformula.InvalidShapeException;
import com.xlformula.tree.NonTerminal;
import com.xlformula.tree.ParseNode;

import java.util.Locale;

/**
 * Canonical names for function calls and operations. Named calls yield the upper-cased
 * function name; operations yield the symbol name of their operator token.
 */
public final class FunctionNames {

    private FunctionNames() {
    }

    /**
     * Get the function or operator name of this node.
     *
     * @throws InvalidShapeException if the node is not a function or operation
     */
    public static String functionName(ParseNode node) {
        if (node.is(NonTerminal.REFERENCE_FUNCTION)) {
            return nameFromToken(node, node);
        }
        if (node.is(NonTerminal.FUNCTION_CALL) && node.children().notEmpty() && node.child(0).is(NonTerminal.FUNCTION)) {
            return nameFromToken(node, node.child(0));
        }
        if (Shapes.isBinaryOperation(node) || Shapes.isUnaryPostfixOperation(node)) {
            return node.child(1).kind().symbolName();
        }
        if (Shapes.isUnaryPrefixOperation(node)) {
            return node.child(0).kind().symbolName();
        }
        throw new InvalidShapeException(node);
    }

    /**
     * Check if this node is a specific function or operation.
     */
    public static boolean matchFunction(ParseNode node, String name) {
        return Shapes.isFunction(node) && functionName(node).equals(name);
    }

    // The grammar keeps the opening parenthesis in the name token, e.g. "SUM("
    private static String nameFromToken(ParseNode call, ParseNode holder) {
        if (holder.children().isEmpty() || !holder.child(0).isTerminal()) {
            throw new InvalidShapeException(call);
        }
        String text = holder.child(0).tokenText();
        if (text.isEmpty()) {
            throw new InvalidShapeException(call);
        }
        return text.substring(0, text.length() - 1).toUpperCase(Locale.ROOT);
    }
}
