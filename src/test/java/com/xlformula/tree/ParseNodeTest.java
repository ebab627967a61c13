package com.xlformula.tree;

import org.junit.jupiter.api.Test;

import static com.xlformula.tree.ParseNode.branch;
import static com.xlformula.tree.ParseNode.leaf;
import static org.junit.jupiter.api.Assertions.*;

public class ParseNodeTest {

    @Test
    public void testLeafExposesTokenAndOperatorFlag() {
        ParseNode plus = leaf(Terminal.PLUS);
        ParseNode cell = leaf(Terminal.CELL_TOKEN, "A1");

        assertTrue(plus.isTerminal());
        assertEquals("+", plus.tokenText());
        assertTrue(plus.isOperator());
        assertEquals("A1", cell.tokenText());
        assertFalse(cell.isOperator());
        assertTrue(cell.children().isEmpty());
    }

    @Test
    public void testBranchFailsFastOnTokenQueries() {
        ParseNode cell = branch(NonTerminal.CELL, leaf(Terminal.CELL_TOKEN, "A1"));

        assertFalse(cell.isTerminal());
        assertThrows(IllegalStateException.class, cell::tokenText);
        assertThrows(IllegalStateException.class, cell::isOperator);
    }

    @Test
    public void testChildrenKeepOrder() {
        ParseNode call = branch(NonTerminal.FUNCTION_CALL,
                leaf(Terminal.NUMBER_TOKEN, "1"), leaf(Terminal.PLUS), leaf(Terminal.NUMBER_TOKEN, "2"));

        assertEquals(3, call.children().size());
        assertEquals("1", call.child(0).tokenText());
        assertEquals("+", call.child(1).tokenText());
        assertEquals("2", call.child(2).tokenText());
        assertTrue(call.is(NonTerminal.FUNCTION_CALL));
        assertFalse(call.is(NonTerminal.REFERENCE));
    }

    @Test
    public void testLeafWithoutFixedTextNeedsExplicitText() {
        assertThrows(IllegalArgumentException.class, () -> leaf(Terminal.CELL_TOKEN));
        assertThrows(IllegalArgumentException.class, () -> leaf(Terminal.INTERSECT));
    }

    @Test
    public void testSymbolNames() {
        assertEquals("FunctionCall", NonTerminal.FUNCTION_CALL.symbolName());
        assertEquals("INTERSECT", Terminal.INTERSECT.symbolName());
        assertTrue(Terminal.INTERSECT.isOperator());
        assertFalse(Terminal.EXCEL_FUNCTION.isOperator());
        assertFalse(NonTerminal.FORMULA.isTerminal());
        assertTrue(Terminal.COLON.isTerminal());
    }
}
