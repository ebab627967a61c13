package com.xlformula.tree;

/**
 * Token symbols. Operator tokens have a fixed literal and carry the operator flag the
 * shape predicates rely on; all other tokens take their text from the formula.
 */
public enum Terminal implements GrammarSymbol {
    EQUALS("=", "=", true),
    NOT_EQUALS("<>", "<>", true),
    LESS_OR_EQUAL("<=", "<=", true),
    GREATER_OR_EQUAL(">=", ">=", true),
    LESS_THAN("<", "<", true),
    GREATER_THAN(">", ">", true),
    CONCAT("&", "&", true),
    PLUS("+", "+", true),
    MINUS("-", "-", true),
    MULTIPLY("*", "*", true),
    DIVIDE("/", "/", true),
    POWER("^", "^", true),
    PERCENT("%", "%", true),
    COLON(":", ":", true),
    // Written as whitespace between two references, so there is no fixed literal
    INTERSECT("INTERSECT", null, true),

    EXCLAMATION("!", "!", false),
    QUOTE("'", "'", false),
    EXCEL_FUNCTION("ExcelFunction"),
    UDF_FUNCTION("UDFunctionName"),
    REF_FUNCTION("RefFunctionName"),
    CELL_TOKEN("CellToken"),
    NAME_TOKEN("NameToken"),
    VERTICAL_RANGE_TOKEN("VRangeToken"),
    HORIZONTAL_RANGE_TOKEN("HRangeToken"),
    NUMBER_TOKEN("NumberToken"),
    TEXT_TOKEN("TextToken"),
    BOOL_TOKEN("BoolToken"),
    ERROR_TOKEN("ErrorToken"),
    REF_ERROR_TOKEN("RefErrorToken"),
    SHEET_TOKEN("SheetNameToken"),
    QUOTED_SHEET_TOKEN("SheetNameQuotedToken"),
    FILE_NAME_TOKEN("FileNameToken"),
    DDE_TOPIC_TOKEN("SingleQuotedString"),
    EMPTY_ARGUMENT("EmptyArgumentToken");

    private final String symbolName;
    private final String literal;
    private final boolean operator;

    Terminal(String symbolName) {
        this(symbolName, null, false);
    }

    Terminal(String symbolName, String literal, boolean operator) {
        this.symbolName = symbolName;
        this.literal = literal;
        this.operator = operator;
    }

    @Override
    public String symbolName() {
        return symbolName;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    /** The fixed source text of this token, or {@code null} when the text varies. */
    public String literal() {
        return literal;
    }

    public boolean isOperator() {
        return operator;
    }
}
