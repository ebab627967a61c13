package com.xlformula.analysis;

import com.xlformula.tree.NonTerminal;
import com.xlformula.tree.ParseNode;
import com.xlformula.tree.Terminal;

/**
 * Structural predicates that recognise what a node means from its kind, its child count
 * and the operator flag of its terminal children.
 *
 * <p>A node can satisfy several predicates at once (a binary operation is also a function),
 * so callers test them in a fixed order rather than treating them as exclusive.</p>
 */
public final class Shapes {

    private Shapes() {
    }

    /**
     * Whether this node represents source parentheses "(_)": a Formula or Reference wrapping
     * a single node of its own kind.
     */
    public static boolean isParentheses(ParseNode node) {
        if (!node.is(NonTerminal.FORMULA) && !node.is(NonTerminal.REFERENCE)) {
            return false;
        }
        return node.children().size() == 1 && node.child(0).kind() == node.kind();
    }

    public static boolean isBinaryOperation(ParseNode node) {
        return (node.is(NonTerminal.FUNCTION_CALL) || node.is(NonTerminal.REFERENCE))
                && node.children().size() == 3
                && isOperatorToken(node.child(1));
    }

    public static boolean isUnaryOperation(ParseNode node) {
        return isUnaryPrefixOperation(node) || isUnaryPostfixOperation(node);
    }

    public static boolean isUnaryPrefixOperation(ParseNode node) {
        return node.is(NonTerminal.FUNCTION_CALL)
                && node.children().size() == 2
                && isOperatorToken(node.child(0));
    }

    public static boolean isUnaryPostfixOperation(ParseNode node) {
        return node.is(NonTerminal.FUNCTION_CALL)
                && node.children().size() == 2
                && isOperatorToken(node.child(1));
    }

    /**
     * Whether this node is a call with a name, as opposed to a unary or binary operation.
     */
    public static boolean isNamedFunction(ParseNode node) {
        return (node.is(NonTerminal.FUNCTION_CALL) && node.children().anySatisfy(child -> child.is(NonTerminal.FUNCTION)))
                || node.is(NonTerminal.REFERENCE_FUNCTION);
    }

    public static boolean isFunction(ParseNode node) {
        return isNamedFunction(node) || isBinaryOperation(node) || isUnaryOperation(node);
    }

    /**
     * Whether this node calls a built-in Excel function: a reference function, or a named
     * call whose name token is a known Excel function rather than a user-defined one.
     */
    public static boolean isBuiltinFunction(ParseNode node) {
        if (!isFunction(node)) {
            return false;
        }
        if (node.is(NonTerminal.REFERENCE_FUNCTION)) {
            return true;
        }
        return node.is(NonTerminal.FUNCTION_CALL)
                && node.child(0).is(NonTerminal.FUNCTION)
                && node.child(0).children().notEmpty()
                && node.child(0).child(0).is(Terminal.EXCEL_FUNCTION);
    }

    /**
     * Whether this node is a range intersection. Only explicit checks are used, so a
     * malformed node yields {@code false} instead of an error.
     */
    public static boolean isIntersection(ParseNode node) {
        return isBinaryOperation(node) && node.child(1).is(Terminal.INTERSECT);
    }

    public static boolean isUnion(ParseNode node) {
        return node.is(NonTerminal.REFERENCE)
                && node.children().size() == 1
                && node.child(0).is(NonTerminal.UNION);
    }

    /**
     * True if this node is a number constant with a sign, such as {@code -1}.
     */
    public static boolean isNumberWithSign(ParseNode node) {
        if (!isUnaryPrefixOperation(node)) {
            return false;
        }
        ParseNode operand = node.child(1);
        if (operand.children().isEmpty() || !operand.child(0).is(NonTerminal.CONSTANT)) {
            return false;
        }
        ParseNode constant = operand.child(0);
        return constant.children().notEmpty() && constant.child(0).is(NonTerminal.NUMBER);
    }

    private static boolean isOperatorToken(ParseNode node) {
        return node.isTerminal() && node.isOperator();
    }
}
