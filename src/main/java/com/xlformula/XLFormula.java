package com.xlformula;

import com.xlformula.analysis.FunctionNames;
import com.xlformula.analysis.Shapes;
import com.xlformula.analysis.Traversal;
import com.xlformula.grammar.ExcelFormulaParser;
import com.xlformula.grammar.FormulaParser;
import com.xlformula.output.FormulaPrinter;
import com.xlformula.output.TreeFormatter;
import com.xlformula.tree.ParseTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(name = "xlformula", mixinStandardHelpOptions = true, version = "1.0",
         description = "Parse Excel formulas and print them in canonical form")
public class XLFormula implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(XLFormula.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "The formula to parse (default: one formula per line from the input)")
    private String formula;

    @Option(names = {"-i", "--input"}, description = "File with one formula per line (default: stdin)")
    private File inputFile;

    @Option(names = {"-t", "--tree"}, description = "Print the parse tree instead of the formula")
    private boolean printTree = false;

    @Option(names = {"-j", "--json"}, description = "Print the parse tree as JSON")
    private boolean jsonOutput = false;

    @Option(names = {"-c", "--compact-output"}, description = "Print trees on a single line")
    private boolean compactOutput = false;

    @Option(names = {"-f", "--functions"}, description = "List the functions and operators a formula uses")
    private boolean listFunctions = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new XLFormula()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            FormulaParser parser = new ExcelFormulaParser();
            FormulaPrinter printer = new FormulaPrinter();
            TreeFormatter formatter = new TreeFormatter(!compactOutput);

            for (String input : formulas()) {
                ParseTree tree = parser.parse(input);
                if (listFunctions) {
                    Traversal.allNodes(tree.root())
                            .filter(Shapes::isFunction)
                            .map(FunctionNames::functionName)
                            .distinct()
                            .forEach(out::println);
                } else if (jsonOutput) {
                    out.println(formatter.formatJson(tree.root()));
                } else if (printTree) {
                    out.println(formatter.formatText(tree.root()));
                } else {
                    out.println(printer.print(tree.root()));
                }
            }
            out.flush();
            return 0;
        } catch (FormulaException | IOException e) {
            log.debug("Formula processing failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private List<String> formulas() throws IOException {
        if (formula != null) {
            return List.of(formula);
        }
        BufferedReader reader = inputFile != null
                ? Files.newBufferedReader(inputFile.toPath(), StandardCharsets.UTF_8)
                : new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try (reader) {
            return reader.lines()
                    .filter(line -> !line.isBlank())
                    .collect(Collectors.toList());
        }
    }
}
