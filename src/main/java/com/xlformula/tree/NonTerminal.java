package com.xlformula.tree;

public enum NonTerminal implements GrammarSymbol {
    FORMULA("Formula"),
    FORMULA_WITH_EQ("FormulaWithEq"),
    ARRAY_FORMULA("ArrayFormula"),
    FUNCTION_CALL("FunctionCall"),
    FUNCTION("Function"),
    ARGUMENTS("Arguments"),
    ARGUMENT("Argument"),
    REFERENCE("Reference"),
    REFERENCE_FUNCTION("ReferenceFunction"),
    UNION("Union"),
    PREFIX("Prefix"),
    FILE("File"),
    CELL("Cell"),
    NAMED_RANGE("NamedRange"),
    VERTICAL_RANGE("VerticalRange"),
    HORIZONTAL_RANGE("HorizontalRange"),
    REF_ERROR("RefError"),
    DYNAMIC_DATA_EXCHANGE("DynamicDataExchange"),
    CONSTANT("Constant"),
    NUMBER("Number"),
    TEXT("Text"),
    BOOL("Bool"),
    ERROR("Error"),
    CONSTANT_ARRAY("ConstantArray"),
    ARRAY_COLUMNS("ArrayColumns"),
    ARRAY_ROWS("ArrayRows"),
    ARRAY_CONSTANT("ArrayConstant");

    private final String symbolName;

    NonTerminal(String symbolName) {
        this.symbolName = symbolName;
    }

    @Override
    public String symbolName() {
        return symbolName;
    }

    @Override
    public boolean isTerminal() {
        return false;
    }
}
