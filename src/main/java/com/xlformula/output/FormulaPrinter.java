package com.xlformula.output;

import com.xlformula.UnprintableNodeException;
import com.xlformula.analysis.Shapes;
import com.xlformula.tree.NonTerminal;
import com.xlformula.tree.ParseNode;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Reconstructs formula text from a parse tree.
 *
 * <p>The grammar drops some tokens it can reconstruct: the closing parenthesis of a
 * function call, the "!" after a file-only prefix, and the whitespace of an intersection.
 * Those are written back here. Binary operators on values are padded with single spaces,
 * so the output is the canonical form of the formula.</p>
 */
public class FormulaPrinter {

    public String print(ParseNode node) {
        // For terminals, just print the token text
        if (node.isTerminal()) {
            return node.tokenText();
        }

        ParseNode.Branch branch = (ParseNode.Branch) node;
        ImmutableList<String> children = branch.children().collect(this::print);

        return switch (branch.kind()) {
            case FORMULA -> Shapes.isParentheses(branch)
                    ? "(" + first(branch, children) + ")"
                    : first(branch, children);

            case FUNCTION_CALL -> printFunctionCall(branch, children);

            case REFERENCE -> printReference(branch, children);

            // Closing parenthesis is not in the tree
            case REFERENCE_FUNCTION -> children.makeString("") + ")";

            case FILE -> "[" + first(branch, children) + "]";

            case PREFIX -> printPrefix(branch, children);

            case ARRAY_FORMULA -> {
                if (children.size() < 2) {
                    throw new UnprintableNodeException(branch);
                }
                yield "{=" + children.get(1) + "}";
            }

            case ARRAY_CONSTANT, DYNAMIC_DATA_EXCHANGE, FORMULA_WITH_EQ -> children.makeString("");

            case ARGUMENTS, ARRAY_ROWS, UNION -> children.makeString(",");

            case ARRAY_COLUMNS -> children.makeString(";");

            case CONSTANT_ARRAY -> "{" + first(branch, children) + "}";

            case FUNCTION, ARGUMENT, CELL, NAMED_RANGE, VERTICAL_RANGE, HORIZONTAL_RANGE, REF_ERROR,
                    CONSTANT, NUMBER, TEXT, BOOL, ERROR -> {
                if (children.size() != 1) {
                    throw new UnprintableNodeException(branch);
                }
                yield children.get(0);
            }
        };
    }

    private String printFunctionCall(ParseNode.Branch node, ImmutableList<String> children) {
        if (Shapes.isNamedFunction(node)) {
            // Closing parenthesis is not in the tree
            return children.makeString("") + ")";
        }
        if (Shapes.isBinaryOperation(node)) {
            return children.get(0) + " " + children.get(1) + " " + children.get(2);
        }
        // Unary operation
        return children.makeString("");
    }

    private String printReference(ParseNode.Branch node, ImmutableList<String> children) {
        if (Shapes.isParentheses(node) || Shapes.isUnion(node)) {
            return "(" + children.get(0) + ")";
        }
        if (Shapes.isIntersection(node)) {
            // The intersection token is whitespace; write one space instead of its text
            return children.get(0) + " " + children.get(2);
        }
        if (Shapes.isBinaryOperation(node)) {
            return children.get(0) + children.get(1) + children.get(2);
        }
        return children.makeString("");
    }

    private String printPrefix(ParseNode.Branch node, ImmutableList<String> children) {
        String prefix = children.makeString("");
        // The "!" after a prefix made of just a file is not kept in the tree
        if (node.children().size() == 1 && node.child(0).is(NonTerminal.FILE)) {
            prefix += "!";
        }
        return prefix;
    }

    private static String first(ParseNode node, ImmutableList<String> children) {
        if (children.isEmpty()) {
            throw new UnprintableNodeException(node);
        }
        return children.get(0);
    }
}
