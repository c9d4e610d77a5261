package org.pragmatica.exprjson.cli;

import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class ExprJsonCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        var commandLine = ExprJsonCommand.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void run_validExpression_printsPrettyJson() {
        var exitCode = run("1 + 2 * 3");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("{\n  \"kind\": \"Binary\",\n  \"attrs\": [],\n");
        assertThat(out.toString()).endsWith("}" + System.lineSeparator());
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void run_compactFlag_printsSingleLine() {
        var exitCode = run("--compact", "x");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .isEqualTo("{\"kind\":\"Path\",\"attrs\":[],\"qself\":null,\"path\":\"x\"}" + System.lineSeparator());
    }

    @Test
    void run_parseFailure_diagnosticOnStderr() {
        var exitCode = run("(a + )");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString())
            .startsWith("error: expected expression, found ')'\n")
            .contains("  --> expression:1:6")
            .contains("1 | (a + )");
    }

    @Test
    void run_unencodableString_serializationErrorOnStderr() {
        var exitCode = run("\"\uD800\"");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).startsWith("Error serializing JSON: String is not valid Unicode");
    }

    @Test
    void run_missingArgument_usageWithExamples() {
        var exitCode = run();

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString())
            .contains("EXPRESSION")
            .contains("Usage: expr-json")
            .contains("expr-json \"1 + 2 * 3\"")
            .contains("expr-json \"foo.bar(baz)\"")
            .contains("expr-json \"if x > 0 { x } else { -x }\"");
    }

    @Test
    void run_extraArgument_usageError() {
        var exitCode = run("a", "b");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Usage: expr-json");
    }

    @Test
    void run_expressionStartingWithDash_treatedAsExpression() {
        var exitCode = run("-x");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\"kind\": \"Unary\"");
    }

    @Test
    void run_help_printsUsageOnStdout() {
        var exitCode = run("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: expr-json").contains("--compact");
    }

    @Test
    void run_version_printsVersion() {
        var exitCode = run("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("expr-json 0.1.0");
    }
}
