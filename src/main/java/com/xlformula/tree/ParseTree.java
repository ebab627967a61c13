package com.xlformula.tree;

/**
 * Result of a successful parse: the formula that was parsed and the root of its tree.
 */
public record ParseTree(String formula, ParseNode root) {
}
