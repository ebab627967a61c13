package com.xlformula.grammar;

import com.xlformula.ParseFailureException;
import com.xlformula.tree.ParseTree;

/**
 * Turns formula text into a parse tree. Implementations keep no state between calls.
 */
public interface FormulaParser {

    /**
     * @throws ParseFailureException if the text is not a valid formula
     */
    ParseTree parse(String formula);
}
