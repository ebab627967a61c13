package com.xlformula.output;

import com.xlformula.grammar.ExcelFormulaParser;
import com.xlformula.tree.ParseNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TreeFormatterTest {

    private final ParseNode one = new ExcelFormulaParser().parse("=1").root();

    @Test
    public void testPrettyText() {
        String expected = String.join("\n",
                "FormulaWithEq",
                "  \"=\" (=)",
                "  Formula",
                "    Constant",
                "      Number",
                "        \"1\" (NumberToken)");

        assertEquals(expected, new TreeFormatter(true).formatText(one));
    }

    @Test
    public void testCompactText() {
        assertEquals("(FormulaWithEq \"=\" (Formula (Constant (Number \"1\"))))", new TreeFormatter(false).formatText(one));
    }

    @Test
    public void testCompactJson() {
        String expected = "{\"kind\":\"FormulaWithEq\",\"children\":["
                + "{\"kind\":\"=\",\"text\":\"=\",\"operator\":true},"
                + "{\"kind\":\"Formula\",\"children\":[{\"kind\":\"Constant\",\"children\":[{\"kind\":\"Number\",\"children\":["
                + "{\"kind\":\"NumberToken\",\"text\":\"1\",\"operator\":false}]}]}]}]}";

        assertEquals(expected, new TreeFormatter(false).formatJson(one));
    }

    @Test
    public void testPrettyJson() {
        String json = new TreeFormatter(true).formatJson(one);

        assertTrue(json.contains("\n"));
        assertTrue(json.contains("\"kind\" : \"FormulaWithEq\""));
        assertTrue(json.contains("\"text\" : \"1\""));
    }

    @Test
    public void testEscapesTokenText() {
        ParseNode text = new ExcelFormulaParser().parse("\"a\"\"b\"").root();

        assertEquals("(Formula (Constant (Text \"\\\"a\\\"\\\"b\\\"\")))", new TreeFormatter(false).formatText(text));
        assertTrue(new TreeFormatter(false).formatJson(text).contains("\"text\":\"\\\"a\\\"\\\"b\\\"\""));
    }

    @Test
    public void testFormatterIsReusable() {
        TreeFormatter formatter = new TreeFormatter(false);
        String first = formatter.formatText(one);

        assertEquals(first, formatter.formatText(one));
    }
}
