package com.xlformula.grammar;

import com.xlformula.ParseFailureException;
import com.xlformula.tree.NonTerminal;
import com.xlformula.tree.ParseNode;
import com.xlformula.tree.ParseTree;
import com.xlformula.tree.Terminal;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.xlformula.tree.ParseNode.branch;
import static com.xlformula.tree.ParseNode.leaf;

/**
 * Recursive-descent parser for Excel formulas.
 *
 * <p>The trees it builds follow the conventions the printer relies on: punctuation such as
 * parentheses, braces and argument separators is not kept as nodes, a function name token
 * includes its opening parenthesis, and a sheet name token includes its trailing "!".</p>
 *
 * <p>Operator precedence, from loosest to tightest: comparison, {@code &}, {@code + -},
 * {@code * /}, {@code ^}, postfix {@code %}, prefix {@code + -}; then for references union
 * {@code ,} (only inside parentheses), intersection (whitespace), range {@code :}.</p>
 */
public class ExcelFormulaParser implements FormulaParser {
    private static final Logger log = LoggerFactory.getLogger(ExcelFormulaParser.class);

    private static final ImmutableList<Terminal> COMPARISON_OPERATORS = Lists.immutable.of(
            Terminal.NOT_EQUALS, Terminal.LESS_OR_EQUAL, Terminal.GREATER_OR_EQUAL,
            Terminal.LESS_THAN, Terminal.GREATER_THAN, Terminal.EQUALS);
    private static final ImmutableList<Terminal> ADDITIVE_OPERATORS = Lists.immutable.of(Terminal.PLUS, Terminal.MINUS);
    private static final ImmutableList<Terminal> MULTIPLICATIVE_OPERATORS = Lists.immutable.of(Terminal.MULTIPLY, Terminal.DIVIDE);

    private static final ImmutableSet<String> REFERENCE_FUNCTIONS = Sets.immutable.of("INDEX", "OFFSET", "INDIRECT");

    private static final ImmutableSet<String> EXCEL_FUNCTIONS = Sets.immutable.of(
            "ABS", "AND", "AVERAGE", "AVERAGEIF", "CHOOSE", "COLUMN", "COLUMNS", "CONCATENATE", "COUNT",
            "COUNTA", "COUNTBLANK", "COUNTIF", "COUNTIFS", "DATE", "DAY", "EXP", "FIND", "HLOOKUP", "IF",
            "IFERROR", "INT", "ISBLANK", "ISERROR", "ISNUMBER", "ISTEXT", "LEFT", "LEN", "LN", "LOG", "LOG10",
            "LOOKUP", "LOWER", "MATCH", "MAX", "MID", "MIN", "MOD", "MONTH", "NA", "NOT", "NOW", "OR", "PI",
            "POWER", "PRODUCT", "RAND", "RIGHT", "ROUND", "ROUNDDOWN", "ROUNDUP", "ROW", "ROWS", "SEARCH",
            "SQRT", "STDEV", "STDEV.S", "SUBSTITUTE", "SUM", "SUMIF", "SUMIFS", "SUMPRODUCT", "TEXT", "TODAY",
            "TRANSPOSE", "TRIM", "UPPER", "VALUE", "VLOOKUP", "YEAR");

    private static final Pattern CELL = Pattern.compile("\\$?[A-Za-z]{1,3}\\$?[0-9]{1,7}(?![A-Za-z0-9_.\\\\(!])");
    private static final Pattern VERTICAL_RANGE = Pattern.compile("\\$?[A-Za-z]{1,3}:\\$?[A-Za-z]{1,3}(?![A-Za-z0-9_.\\\\(!])");
    private static final Pattern HORIZONTAL_RANGE = Pattern.compile("\\$?[0-9]{1,7}:\\$?[0-9]{1,7}(?![0-9.])");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_\\\\][A-Za-z0-9_.\\\\?]*");
    private static final Pattern NUMBER = Pattern.compile("([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?");
    private static final Pattern ERROR = Pattern.compile("#NULL!|#DIV/0!|#VALUE!|#NAME\\?|#NUM!|#N/A|#GETTING_DATA");
    private static final String REF_ERROR = "#REF!";

    @Override
    public ParseTree parse(String formula) {
        if (formula == null || formula.isBlank()) {
            throw new ParseFailureException("Empty formula", formula == null ? "" : formula, 0);
        }
        ParseNode root = new Cursor(formula).root();
        log.debug("Parsed formula <<{}>> into a {} tree", formula, root.kind().symbolName());
        return new ParseTree(formula, root);
    }

    /**
     * Parsing state for one formula.
     */
    private static final class Cursor {
        private final String input;
        private int pos;

        Cursor(String input) {
            this.input = input;
        }

        ParseNode root() {
            skipWhitespace();
            ParseNode root;
            if (input.startsWith("{=", pos)) {
                pos += 2;
                ParseNode formula = formula();
                expect('}');
                root = branch(NonTerminal.ARRAY_FORMULA, leaf(Terminal.EQUALS), formula);
            } else if (peek('=')) {
                pos++;
                root = branch(NonTerminal.FORMULA_WITH_EQ, leaf(Terminal.EQUALS), formula());
            } else {
                root = formula();
            }
            skipWhitespace();
            if (!atEnd()) {
                throw fail("Unexpected '" + current() + "'");
            }
            return root;
        }

        // Every level below returns a Formula node

        private ParseNode formula() {
            return comparison();
        }

        private ParseNode comparison() {
            ParseNode left = concatenation();
            Terminal op;
            while ((op = operator(COMPARISON_OPERATORS)) != null) {
                left = binary(left, op, concatenation());
            }
            return left;
        }

        private ParseNode concatenation() {
            ParseNode left = additive();
            while (operator(Terminal.CONCAT)) {
                left = binary(left, Terminal.CONCAT, additive());
            }
            return left;
        }

        private ParseNode additive() {
            ParseNode left = multiplicative();
            Terminal op;
            while ((op = operator(ADDITIVE_OPERATORS)) != null) {
                left = binary(left, op, multiplicative());
            }
            return left;
        }

        private ParseNode multiplicative() {
            ParseNode left = power();
            Terminal op;
            while ((op = operator(MULTIPLICATIVE_OPERATORS)) != null) {
                left = binary(left, op, power());
            }
            return left;
        }

        private ParseNode power() {
            ParseNode left = percent();
            while (operator(Terminal.POWER)) {
                left = binary(left, Terminal.POWER, percent());
            }
            return left;
        }

        private ParseNode percent() {
            ParseNode operand = prefix();
            while (operator(Terminal.PERCENT)) {
                operand = formula(branch(NonTerminal.FUNCTION_CALL, operand, leaf(Terminal.PERCENT)));
            }
            return operand;
        }

        private ParseNode prefix() {
            Terminal op = operator(ADDITIVE_OPERATORS);
            if (op != null) {
                return formula(branch(NonTerminal.FUNCTION_CALL, leaf(op), prefix()));
            }
            return primary();
        }

        private ParseNode primary() {
            skipWhitespace();
            if (atEnd()) {
                throw fail("Unexpected end of formula");
            }
            char c = current();
            if (c == '(') {
                ParseNode group = parenthesized();
                return group.is(NonTerminal.REFERENCE) ? formula(referenceExpression(group)) : group;
            }
            if (c == '{') {
                return formula(constantArray());
            }
            if (c == '"' || (c == '#' && !input.startsWith(REF_ERROR, pos))) {
                return formula(constant());
            }
            if (lookingAt(HORIZONTAL_RANGE) == null && (Character.isDigit(c) || c == '.')) {
                return formula(constant());
            }
            Matcher identifier = lookingAt(IDENTIFIER);
            if (identifier != null && lookingAt(CELL) == null && lookingAt(VERTICAL_RANGE) == null) {
                String name = identifier.group();
                int after = identifier.end();
                if (charAt(after) == '(' && !isReferenceFunction(name)) {
                    return formula(functionCall(name, after));
                }
                if (isBool(name, after)) {
                    return formula(constant());
                }
            }
            return formula(referenceExpression(referencePrimary()));
        }

        private ParseNode binary(ParseNode left, Terminal op, ParseNode right) {
            return formula(branch(NonTerminal.FUNCTION_CALL, left, leaf(op), right));
        }

        private ParseNode formula(ParseNode content) {
            return branch(NonTerminal.FORMULA, content);
        }

        /**
         * Parses "(...)". Returns a Reference for parenthesised references and unions, and a
         * Formula wrapping the inner Formula otherwise.
         */
        private ParseNode parenthesized() {
            expect('(');
            ParseNode inner = formula();
            if (consume(',')) {
                MutableList<ParseNode> references = Lists.mutable.of(requireReference(inner));
                do {
                    references.add(requireReference(formula()));
                } while (consume(','));
                expect(')');
                return branch(NonTerminal.REFERENCE, branch(NonTerminal.UNION, references));
            }
            expect(')');
            ParseNode reference = referenceOf(inner);
            return reference != null
                    ? branch(NonTerminal.REFERENCE, reference)
                    : formula(inner);
        }

        private ParseNode functionCall(String name, int openParen) {
            Terminal token = EXCEL_FUNCTIONS.contains(name.toUpperCase(Locale.ROOT))
                    ? Terminal.EXCEL_FUNCTION
                    : Terminal.UDF_FUNCTION;
            pos = openParen + 1;
            ParseNode function = branch(NonTerminal.FUNCTION, leaf(token, name + "("));
            return branch(NonTerminal.FUNCTION_CALL, function, arguments());
        }

        // Called after the opening parenthesis; consumes the closing one
        private ParseNode arguments() {
            MutableList<ParseNode> arguments = Lists.mutable.empty();
            if (consume(')')) {
                return branch(NonTerminal.ARGUMENTS, arguments);
            }
            do {
                skipWhitespace();
                if (peek(',') || peek(')')) {
                    arguments.add(branch(NonTerminal.ARGUMENT, leaf(Terminal.EMPTY_ARGUMENT, "")));
                } else {
                    arguments.add(branch(NonTerminal.ARGUMENT, formula()));
                }
            } while (consume(','));
            expect(')');
            return branch(NonTerminal.ARGUMENTS, arguments);
        }

        // References

        private ParseNode referenceExpression(ParseNode first) {
            ParseNode left = range(first);
            while (intersectionAhead()) {
                int start = pos;
                skipWhitespace();
                ParseNode op = leaf(Terminal.INTERSECT, input.substring(start, pos));
                left = branch(NonTerminal.REFERENCE, left, op, range(referencePrimary()));
            }
            return left;
        }

        private ParseNode range(ParseNode first) {
            ParseNode left = first;
            while (peek(':')) {
                pos++;
                left = branch(NonTerminal.REFERENCE, left, leaf(Terminal.COLON), referencePrimary());
            }
            return left;
        }

        private boolean intersectionAhead() {
            if (atEnd() || !Character.isWhitespace(current())) {
                return false;
            }
            int saved = pos;
            skipWhitespace();
            boolean reference = !atEnd() && startsReference();
            pos = saved;
            return reference;
        }

        private boolean startsReference() {
            char c = current();
            if (c == '(' || c == '$' || c == '\'' || c == '[' || input.startsWith(REF_ERROR, pos)) {
                return true;
            }
            if (lookingAt(HORIZONTAL_RANGE) != null || lookingAt(CELL) != null || lookingAt(VERTICAL_RANGE) != null) {
                return true;
            }
            Matcher identifier = lookingAt(IDENTIFIER);
            if (identifier == null) {
                return false;
            }
            int after = identifier.end();
            if (charAt(after) == '(') {
                return isReferenceFunction(identifier.group());
            }
            return !isBool(identifier.group(), after);
        }

        /**
         * A single reference operand, returned as a Reference node.
         */
        private ParseNode referencePrimary() {
            if (atEnd()) {
                throw fail("Expected a reference");
            }
            char c = current();
            if (c == '(') {
                return requireReferenceGroup(parenthesized());
            }
            if (c == '[') {
                return fileReference();
            }
            if (c == '\'') {
                ParseNode prefix = branch(NonTerminal.PREFIX, leaf(Terminal.QUOTE), leaf(Terminal.QUOTED_SHEET_TOKEN, quotedSheet()));
                return branch(NonTerminal.REFERENCE, prefix, referenceItem());
            }
            Matcher identifier = lookingAt(IDENTIFIER);
            if (identifier != null && lookingAt(CELL) == null && lookingAt(VERTICAL_RANGE) == null) {
                String name = identifier.group();
                int after = identifier.end();
                if (charAt(after) == '(') {
                    if (!isReferenceFunction(name)) {
                        throw fail("Function " + name + " does not return a reference");
                    }
                    pos = after + 1;
                    ParseNode function = branch(NonTerminal.REFERENCE_FUNCTION,
                            leaf(Terminal.REF_FUNCTION, name + "("), arguments());
                    return branch(NonTerminal.REFERENCE, function);
                }
                if (charAt(after) == '!') {
                    pos = after + 1;
                    ParseNode prefix = branch(NonTerminal.PREFIX, leaf(Terminal.SHEET_TOKEN, name + "!"));
                    return branch(NonTerminal.REFERENCE, prefix, referenceItem());
                }
            }
            return branch(NonTerminal.REFERENCE, referenceItem());
        }

        /**
         * "[1]Sheet1!A1", "[1]!Name" or the dynamic data exchange form "[1]!'topic'".
         */
        private ParseNode fileReference() {
            ParseNode file = file();
            if (peek('!')) {
                pos++;
                if (peek('\'')) {
                    ParseNode dde = branch(NonTerminal.DYNAMIC_DATA_EXCHANGE,
                            file, leaf(Terminal.EXCLAMATION), leaf(Terminal.DDE_TOPIC_TOKEN, quoted()));
                    return branch(NonTerminal.REFERENCE, dde);
                }
                // The "!" of a file-only prefix is not kept in the tree
                return branch(NonTerminal.REFERENCE, branch(NonTerminal.PREFIX, file), referenceItem());
            }
            Matcher sheet = lookingAt(IDENTIFIER);
            if (sheet == null || charAt(sheet.end()) != '!') {
                throw fail("Expected a sheet name after the file");
            }
            pos = sheet.end() + 1;
            ParseNode prefix = branch(NonTerminal.PREFIX, file, leaf(Terminal.SHEET_TOKEN, sheet.group() + "!"));
            return branch(NonTerminal.REFERENCE, prefix, referenceItem());
        }

        private ParseNode file() {
            int close = input.indexOf(']', pos + 1);
            if (close <= pos + 1) {
                throw fail("Expected a file name between brackets");
            }
            String name = input.substring(pos + 1, close);
            pos = close + 1;
            return branch(NonTerminal.FILE, leaf(Terminal.FILE_NAME_TOKEN, name));
        }

        /**
         * A cell, range, name or #REF! without prefix.
         */
        private ParseNode referenceItem() {
            if (atEnd()) {
                throw fail("Expected a reference");
            }
            if (input.startsWith(REF_ERROR, pos)) {
                pos += REF_ERROR.length();
                return branch(NonTerminal.REF_ERROR, leaf(Terminal.REF_ERROR_TOKEN, REF_ERROR));
            }
            Matcher matcher;
            if ((matcher = lookingAt(HORIZONTAL_RANGE)) != null) {
                return item(NonTerminal.HORIZONTAL_RANGE, Terminal.HORIZONTAL_RANGE_TOKEN, matcher);
            }
            if ((matcher = lookingAt(CELL)) != null) {
                return item(NonTerminal.CELL, Terminal.CELL_TOKEN, matcher);
            }
            if ((matcher = lookingAt(VERTICAL_RANGE)) != null) {
                return item(NonTerminal.VERTICAL_RANGE, Terminal.VERTICAL_RANGE_TOKEN, matcher);
            }
            if ((matcher = lookingAt(IDENTIFIER)) != null) {
                return item(NonTerminal.NAMED_RANGE, Terminal.NAME_TOKEN, matcher);
            }
            throw fail("Expected a reference");
        }

        private ParseNode item(NonTerminal kind, Terminal token, Matcher matcher) {
            pos = matcher.end();
            return branch(kind, leaf(token, matcher.group()));
        }

        private ParseNode requireReference(ParseNode formula) {
            ParseNode reference = referenceOf(formula);
            if (reference == null) {
                throw fail("Expected a reference");
            }
            return reference;
        }

        private ParseNode requireReferenceGroup(ParseNode group) {
            if (!group.is(NonTerminal.REFERENCE)) {
                throw fail("Expected a reference");
            }
            return group;
        }

        // The Reference inside Formula[Reference], or null
        private static ParseNode referenceOf(ParseNode formula) {
            if (formula.is(NonTerminal.FORMULA) && formula.children().size() == 1
                    && formula.child(0).is(NonTerminal.REFERENCE)) {
                return formula.child(0);
            }
            return null;
        }

        // Constants

        private ParseNode constant() {
            skipWhitespace();
            if (atEnd()) {
                throw fail("Expected a constant");
            }
            char c = current();
            if (c == '"') {
                return constant(NonTerminal.TEXT, Terminal.TEXT_TOKEN, text());
            }
            Matcher matcher;
            if ((matcher = lookingAt(ERROR)) != null) {
                pos = matcher.end();
                return constant(NonTerminal.ERROR, Terminal.ERROR_TOKEN, matcher.group());
            }
            if ((matcher = lookingAt(NUMBER)) != null) {
                pos = matcher.end();
                return constant(NonTerminal.NUMBER, Terminal.NUMBER_TOKEN, matcher.group());
            }
            if ((matcher = lookingAt(IDENTIFIER)) != null && isBool(matcher.group(), matcher.end())) {
                pos = matcher.end();
                return constant(NonTerminal.BOOL, Terminal.BOOL_TOKEN, matcher.group());
            }
            throw fail("Expected a constant");
        }

        private ParseNode constant(NonTerminal kind, Terminal token, String text) {
            return branch(NonTerminal.CONSTANT, branch(kind, leaf(token, text)));
        }

        private ParseNode constantArray() {
            expect('{');
            MutableList<ParseNode> rows = Lists.mutable.empty();
            do {
                MutableList<ParseNode> values = Lists.mutable.empty();
                do {
                    values.add(arrayConstant());
                } while (consume(','));
                rows.add(branch(NonTerminal.ARRAY_ROWS, values));
            } while (consume(';'));
            expect('}');
            return branch(NonTerminal.CONSTANT_ARRAY, branch(NonTerminal.ARRAY_COLUMNS, rows));
        }

        private ParseNode arrayConstant() {
            skipWhitespace();
            if (peek('-')) {
                pos++;
                Matcher number = lookingAt(NUMBER);
                if (number == null) {
                    throw fail("Expected a number");
                }
                pos = number.end();
                return branch(NonTerminal.ARRAY_CONSTANT, leaf(Terminal.MINUS),
                        branch(NonTerminal.NUMBER, leaf(Terminal.NUMBER_TOKEN, number.group())));
            }
            if (input.startsWith(REF_ERROR, pos)) {
                pos += REF_ERROR.length();
                return branch(NonTerminal.ARRAY_CONSTANT,
                        branch(NonTerminal.REF_ERROR, leaf(Terminal.REF_ERROR_TOKEN, REF_ERROR)));
            }
            return branch(NonTerminal.ARRAY_CONSTANT, constant());
        }

        // Tokens

        private String text() {
            int end = pos + 1;
            while (true) {
                if (end >= input.length()) {
                    throw fail("Unterminated string");
                }
                if (input.charAt(end) == '"') {
                    if (charAt(end + 1) != '"') {
                        break;
                    }
                    end++;
                }
                end++;
            }
            String text = input.substring(pos, end + 1);
            pos = end + 1;
            return text;
        }

        // 'Sheet 1'! without the opening quote, which is a node of its own
        private String quotedSheet() {
            String quoted = quoted();
            if (!peek('!')) {
                throw fail("Expected '!' after quoted sheet name");
            }
            pos++;
            return quoted.substring(1) + "!";
        }

        private String quoted() {
            int end = pos + 1;
            while (true) {
                if (end >= input.length()) {
                    throw fail("Unterminated quoted name");
                }
                if (input.charAt(end) == '\'') {
                    if (charAt(end + 1) != '\'') {
                        break;
                    }
                    end++;
                }
                end++;
            }
            String quoted = input.substring(pos, end + 1);
            pos = end + 1;
            return quoted;
        }

        private Terminal operator(ImmutableList<Terminal> candidates) {
            skipWhitespace();
            for (Terminal candidate : candidates) {
                if (input.startsWith(candidate.literal(), pos)) {
                    pos += candidate.literal().length();
                    return candidate;
                }
            }
            return null;
        }

        private boolean operator(Terminal candidate) {
            return operator(Lists.immutable.of(candidate)) != null;
        }

        private static boolean isReferenceFunction(String name) {
            return REFERENCE_FUNCTIONS.contains(name.toUpperCase(Locale.ROOT));
        }

        private boolean isBool(String name, int after) {
            return (name.equalsIgnoreCase("TRUE") || name.equalsIgnoreCase("FALSE"))
                    && charAt(after) != '(' && charAt(after) != '!';
        }

        private Matcher lookingAt(Pattern pattern) {
            Matcher matcher = pattern.matcher(input).region(pos, input.length());
            return matcher.lookingAt() ? matcher : null;
        }

        private void expect(char expected) {
            skipWhitespace();
            if (atEnd() || current() != expected) {
                throw fail("Expected '" + expected + "'");
            }
            pos++;
        }

        private boolean consume(char expected) {
            skipWhitespace();
            if (peek(expected)) {
                pos++;
                return true;
            }
            return false;
        }

        private boolean peek(char expected) {
            return !atEnd() && current() == expected;
        }

        private void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(current())) {
                pos++;
            }
        }

        private char current() {
            return input.charAt(pos);
        }

        private char charAt(int index) {
            return index < input.length() ? input.charAt(index) : '\0';
        }

        private boolean atEnd() {
            return pos >= input.length();
        }

        private ParseFailureException fail(String message) {
            return new ParseFailureException(message, input, pos);
        }
    }
}
