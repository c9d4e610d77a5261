package org.pragmatica.exprjson.cli;

import org.pragmatica.exprjson.ExprJson;
import org.pragmatica.exprjson.convert.ExprConverter;
import org.pragmatica.exprjson.emit.EmitException;
import org.pragmatica.exprjson.emit.JsonEmitter;
import org.pragmatica.exprjson.error.Diagnostic;
import org.pragmatica.exprjson.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
    name = "expr-json",
    mixinStandardHelpOptions = true,
    version = "expr-json 0.1.0",
    description = "Parse a Rust expression and print its canonical JSON form.",
    footer = {
        "",
        "Examples:",
        "  expr-json \"1 + 2 * 3\"",
        "  expr-json \"foo.bar(baz)\"",
        "  expr-json \"if x > 0 { x } else { -x }\""
    }
)
public class ExprJsonCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ExprJsonCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "1", paramLabel = "EXPRESSION", description = "Rust expression to convert")
    private String expression;

    @Option(names = {"-c", "--compact"}, description = "Print compact JSON instead of pretty-printed JSON")
    private boolean compact;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        var result = ExprJson.parse(expression);
        if (result instanceof ParseResult.Failure failure) {
            err.print(Diagnostic.of(failure.error()).format(expression, "expression"));
            err.flush();
            return 1;
        }

        String json;
        try {
            json = JsonEmitter.emit(ExprConverter.convert(result.unwrap()), !compact);
        } catch (EmitException e) {
            log.debug("Emitting failed", e);
            err.println("Error serializing JSON: " + e.getMessage());
            err.flush();
            return 1;
        }
        out.println(json);
        out.flush();
        return 0;
    }

    /**
     * Command line with argument errors reported on stderr as a message plus usage, exit code 1.
     * Arguments starting with {@code -} that are not known options are taken as the expression.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new ExprJsonCommand())
            .setUnmatchedOptionsArePositionalParams(true)
            .setParameterExceptionHandler(ExprJsonCommand::handleParameterException);
    }

    private static int handleParameterException(ParameterException ex, String[] args) {
        var commandLine = ex.getCommandLine();
        var err = commandLine.getErr();
        err.println(ex.getMessage());
        commandLine.usage(err);
        err.flush();
        return 1;
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
