package com.litequery;

import com.litequery.ast.QueryAst;
import com.litequery.compiler.UnsupportedExpressionException;
import com.litequery.compiler.WhereExpressionCompiler;
import com.litequery.expr.Expression;
import com.litequery.expr.ExpressionJsonReader;
import com.litequery.output.OutputFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.Callable;

@Command(name = "lqc", mixinStandardHelpOptions = true, version = "1.0",
         description = "Compile a JSON-encoded predicate expression tree into a native query AST")
public class LQC implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(LQC.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Expression tree JSON file (default: stdin)")
    private File inputFile;

    @Option(names = {"-e", "--expression"}, description = "Expression tree JSON given inline")
    private String expression;

    @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
    private boolean compactOutput = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LQC()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            Expression predicate = readExpression();
            QueryAst query = WhereExpressionCompiler.compile(predicate);

            OutputFormatter formatter = new OutputFormatter(!compactOutput);
            spec.commandLine().getOut().println(formatter.format(query));
            spec.commandLine().getOut().flush();
            return 0;
        } catch (IOException e) {
            LOG.debug("Could not read expression", e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        } catch (UnsupportedExpressionException e) {
            LOG.debug("Predicate rejected at '{}'", e.getConstruct(), e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }

    private Expression readExpression() throws IOException {
        ExpressionJsonReader reader = new ExpressionJsonReader();
        if (expression != null) {
            return reader.read(expression);
        }
        if (inputFile != null) {
            try (InputStream input = new FileInputStream(inputFile)) {
                return reader.read(input);
            }
        }
        return reader.read(System.in);
    }
}
