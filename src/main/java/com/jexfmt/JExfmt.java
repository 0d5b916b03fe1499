package com.jexfmt;

import com.jexfmt.algebra.FormatOptions;
import com.jexfmt.ast.Node;
import com.jexfmt.format.ExpressionFormatter;
import com.jexfmt.json.JsonValue;
import com.jexfmt.json.TreeDecoder;
import com.jexfmt.json.TreeJsonParser;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.util.concurrent.Callable;

@Command(name = "jexfmt", mixinStandardHelpOptions = true, version = "1.0",
         description = "Format a JSON-encoded quoted expression tree as source text")
public class JExfmt implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Input tree file (default: stdin)")
    private File inputFile;

    @Option(names = {"-w", "--width"}, description = "Maximum line width (default: ${DEFAULT-VALUE})")
    private int width = FormatOptions.DEFAULT_WIDTH;

    @Option(names = {"--max-depth"}, description = "Maximum JSON nesting depth (default: ${DEFAULT-VALUE})")
    private int maxDepth = TreeJsonParser.DEFAULT_MAX_DEPTH;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JExfmt()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            ExpressionFormatter formatter = new ExpressionFormatter(new FormatOptions(width));

            JsonValue encoded;
            try (InputStream input = inputFile != null ? new FileInputStream(inputFile) : System.in) {
                encoded = new TreeJsonParser(maxDepth).parse(input);
            }
            Node tree = new TreeDecoder().decode(encoded);

            spec.commandLine().getOut().println(formatter.format(tree));
            spec.commandLine().getOut().flush();
            return 0;
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        }
    }
}
