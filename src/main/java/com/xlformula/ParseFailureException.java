package com.xlformula;

/**
 * Thrown when a formula is not valid according to the grammar. No partial tree is kept.
 */
public class ParseFailureException extends FormulaException {

    private final String formula;
    private final int position;

    public ParseFailureException(String message, String formula, int position) {
        super("Failed parsing input <<" + formula + ">> at position " + position + ": " + message);
        this.formula = formula;
        this.position = position;
    }

    public String getFormula() {
        return formula;
    }

    public int getPosition() {
        return position;
    }
}
