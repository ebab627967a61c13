package com.xlformula.analysis;

import com.xlformula.grammar.ExcelFormulaParser;
import com.xlformula.tree.NonTerminal;
import com.xlformula.tree.ParseNode;
import com.xlformula.tree.Terminal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static com.xlformula.tree.ParseNode.branch;
import static com.xlformula.tree.ParseNode.leaf;
import static org.junit.jupiter.api.Assertions.*;

public class ShapesTest {

    private final ExcelFormulaParser parser = new ExcelFormulaParser();

    private ParseNode parse(String formula) {
        return parser.parse(formula).root();
    }

    private ParseNode firstMatching(String formula, Predicate<ParseNode> predicate) {
        return Traversal.allNodes(parse(formula)).filter(predicate).findFirst()
                .orElseThrow(() -> new AssertionError("No matching node in " + formula));
    }

    private ParseNode firstFunctionCall(String formula) {
        return firstMatching(formula, node -> node.is(NonTerminal.FUNCTION_CALL));
    }

    @Test
    public void testBinaryOperation() {
        ParseNode addition = firstFunctionCall("=1+2");

        assertTrue(Shapes.isBinaryOperation(addition));
        assertTrue(Shapes.isFunction(addition));
        assertFalse(Shapes.isNamedFunction(addition));
        assertFalse(Shapes.isUnaryOperation(addition));
        assertFalse(Shapes.isBuiltinFunction(addition));
    }

    @Test
    public void testNamedFunction() {
        ParseNode sum = firstFunctionCall("=SUM(A1,A2)");

        assertTrue(Shapes.isNamedFunction(sum));
        assertTrue(Shapes.isFunction(sum));
        assertTrue(Shapes.isBuiltinFunction(sum));
        assertFalse(Shapes.isBinaryOperation(sum));
    }

    @Test
    public void testUserDefinedFunctionIsNotBuiltin() {
        ParseNode udf = firstFunctionCall("=MyFunction(A1)");

        assertTrue(Shapes.isNamedFunction(udf));
        assertFalse(Shapes.isBuiltinFunction(udf));
    }

    @Test
    public void testReferenceFunction() {
        ParseNode index = firstMatching("=INDEX(A1:B2,1,1)", node -> node.is(NonTerminal.REFERENCE_FUNCTION));

        assertTrue(Shapes.isNamedFunction(index));
        assertTrue(Shapes.isFunction(index));
        assertTrue(Shapes.isBuiltinFunction(index));
    }

    @Test
    public void testParentheses() {
        ParseNode formula = parse("=(1+2)*3").child(1);
        ParseNode multiplication = formula.child(0);
        ParseNode leftOperand = multiplication.child(0);

        assertTrue(Shapes.isBinaryOperation(multiplication));
        assertTrue(Shapes.isParentheses(leftOperand));
        assertFalse(Shapes.isParentheses(formula));
        assertFalse(Shapes.isParentheses(multiplication.child(2)));
    }

    @Test
    public void testReferenceParentheses() {
        ParseNode reference = parse("=(A1)").child(1).child(0);

        assertTrue(reference.is(NonTerminal.REFERENCE));
        assertTrue(Shapes.isParentheses(reference));
        assertFalse(Shapes.isUnion(reference));
    }

    @Test
    public void testUnaryPrefixAndPostfix() {
        ParseNode negation = firstFunctionCall("=-A1");
        ParseNode percentage = firstFunctionCall("=A1%");

        assertTrue(Shapes.isUnaryPrefixOperation(negation));
        assertFalse(Shapes.isUnaryPostfixOperation(negation));
        assertTrue(Shapes.isUnaryPostfixOperation(percentage));
        assertFalse(Shapes.isUnaryPrefixOperation(percentage));
        assertTrue(Shapes.isUnaryOperation(negation));
        assertTrue(Shapes.isUnaryOperation(percentage));
        assertTrue(Shapes.isFunction(negation));
    }

    @Test
    public void testIntersection() {
        ParseNode reference = parse("=A1 B1").child(1).child(0);

        assertTrue(Shapes.isIntersection(reference));
        assertTrue(Shapes.isBinaryOperation(reference));
        assertTrue(reference.child(1).is(Terminal.INTERSECT));
    }

    @Test
    public void testRangeIsNotIntersection() {
        ParseNode reference = parse("=A1:B2").child(1).child(0);

        assertTrue(Shapes.isBinaryOperation(reference));
        assertFalse(Shapes.isIntersection(reference));
    }

    @Test
    public void testIntersectionToleratesMalformedNodes() {
        ParseNode operatorless = branch(NonTerminal.REFERENCE,
                branch(NonTerminal.CELL, leaf(Terminal.CELL_TOKEN, "A1")),
                branch(NonTerminal.CELL, leaf(Terminal.CELL_TOKEN, "B1")),
                branch(NonTerminal.CELL, leaf(Terminal.CELL_TOKEN, "C1")));
        ParseNode empty = branch(NonTerminal.REFERENCE);

        assertFalse(Shapes.isIntersection(operatorless));
        assertFalse(Shapes.isIntersection(empty));
        assertFalse(Shapes.isIntersection(leaf(Terminal.INTERSECT, " ")));
    }

    @Test
    public void testUnion() {
        ParseNode reference = parse("=(A1,B1)").child(1).child(0);

        assertTrue(Shapes.isUnion(reference));
        assertFalse(Shapes.isParentheses(reference));
        assertEquals(2, reference.child(0).children().size());
    }

    @Test
    public void testNumberWithSign() {
        assertTrue(Shapes.isNumberWithSign(firstFunctionCall("=-1")));
        assertTrue(Shapes.isNumberWithSign(firstFunctionCall("=+2.5")));
        assertFalse(Shapes.isNumberWithSign(firstFunctionCall("=-A1")));
        assertFalse(Shapes.isNumberWithSign(firstFunctionCall("=-\"a\"")));
        assertFalse(Shapes.isNumberWithSign(firstFunctionCall("=1%")));
    }

    @Test
    public void testNumberWithSignOnMalformedOperand() {
        ParseNode bare = branch(NonTerminal.FUNCTION_CALL, leaf(Terminal.MINUS), leaf(Terminal.NUMBER_TOKEN, "1"));

        assertTrue(Shapes.isUnaryPrefixOperation(bare));
        assertFalse(Shapes.isNumberWithSign(bare));
    }

    @Test
    public void testPlainNodesMatchNothing() {
        ParseNode cell = firstMatching("=A1", node -> node.is(NonTerminal.CELL));

        assertFalse(Shapes.isFunction(cell));
        assertFalse(Shapes.isParentheses(cell));
        assertFalse(Shapes.isUnion(cell));
        assertFalse(Shapes.isIntersection(cell));
        assertFalse(Shapes.isNumberWithSign(cell));
        assertFalse(Shapes.isFunction(leaf(Terminal.PLUS)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "=1+2", "=SUM(A1,A2)", "=(1+2)*3", "=Sheet1!A1", "=A1 B1", "={1,2;3,4}",
            "=-1", "=A1%", "=(A1,B1)", "=INDEX(A1:B2,1,1):C3", "=[1]!Name"
    })
    public void testPredicatesAreRepeatable(String formula) {
        List<Predicate<ParseNode>> predicates = List.of(
                Shapes::isParentheses, Shapes::isBinaryOperation, Shapes::isUnaryPrefixOperation,
                Shapes::isUnaryPostfixOperation, Shapes::isUnaryOperation, Shapes::isNamedFunction,
                Shapes::isFunction, Shapes::isBuiltinFunction, Shapes::isIntersection, Shapes::isUnion,
                Shapes::isNumberWithSign);

        for (ParseNode node : Traversal.allNodes(parse(formula)).collect(Collectors.toList())) {
            for (Predicate<ParseNode> predicate : predicates) {
                assertEquals(predicate.test(node), predicate.test(node));
            }
            assertFalse(Shapes.isUnaryPrefixOperation(node) && Shapes.isUnaryPostfixOperation(node));
        }
    }
}
