package com.xlformula.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.xlformula.tree.ParseNode;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Dumps a parse tree for inspection, either as an indented outline or as JSON.
 *
 * <p>Example outline for {@code =1+2}:</p>
 * <pre>
 * FormulaWithEq
 *   "=" (=)
 *   Formula
 *     FunctionCall
 *       Formula
 *         Constant
 *           Number
 *             "1" (NumberToken)
 *       "+" (+)
 *       ...
 * </pre>
 */
public class TreeFormatter {
    private static final String INDENT = "  ";

    private final boolean prettyPrint;
    private final JsonFactory factory = new JsonFactory();

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public TreeFormatter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String formatText(ParseNode node) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0); // Clear the builder

        if (prettyPrint) {
            formatPretty(node, 0, sb);
            sb.setLength(sb.length() - 1); // drop the last newline
        } else {
            formatCompact(node, sb);
        }

        return sb.toString();
    }

    public String formatJson(ParseNode node) {
        StringWriter writer = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(writer)) {
            if (prettyPrint) {
                generator.useDefaultPrettyPrinter();
            }
            writeJson(node, generator);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write parse tree as JSON", e);
        }
        return writer.toString();
    }

    private void formatPretty(ParseNode node, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth));

        if (node.isTerminal()) {
            sb.append('"').append(escapeString(node.tokenText())).append("\" (")
              .append(node.kind().symbolName()).append(")\n");
            return;
        }

        sb.append(node.kind().symbolName()).append('\n');
        for (ParseNode child : node.children()) {
            formatPretty(child, depth + 1, sb);
        }
    }

    private void formatCompact(ParseNode node, StringBuilder sb) {
        if (node.isTerminal()) {
            sb.append('"').append(escapeString(node.tokenText())).append('"');
            return;
        }

        sb.append('(').append(node.kind().symbolName());
        for (ParseNode child : node.children()) {
            sb.append(' ');
            formatCompact(child, sb);
        }
        sb.append(')');
    }

    private void writeJson(ParseNode node, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        generator.writeStringField("kind", node.kind().symbolName());
        if (node.isTerminal()) {
            generator.writeStringField("text", node.tokenText());
            generator.writeBooleanField("operator", node.isOperator());
        } else {
            generator.writeArrayFieldStart("children");
            for (ParseNode child : node.children()) {
                writeJson(child, generator);
            }
            generator.writeEndArray();
        }
        generator.writeEndObject();
    }

    private String escapeString(String s) {
        // Fast path: if no escaping needed, return original
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c == '\n' || c == '\r' || c == '\t') {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"'  -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default   -> result.append(c);
            }
        }
        return result.toString();
    }
}
