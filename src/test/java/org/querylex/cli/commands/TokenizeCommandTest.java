package org.querylex.cli.commands;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.querylex.cli.CommandLineInterface;
import org.querylex.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@code tokenize} subcommand in-process and checks its output.
 */
@Tag("unit")
class TokenizeCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        cmd = CommandLineInterface.createCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    @Test
    void tokenize_tableFormat_printsOneLinePerToken() {
        int exitCode = cmd.execute("tokenize", "SELECT", "*", "FROM", "[nt:base]");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).hasSize(4);
        assertThat(out.toString().lines().toList().get(3))
                .contains("3")
                .contains("QUOTED_IDENTIFIER")
                .endsWith("[nt:base]");
    }

    @Test
    void tokenize_jsonFormat_printsTokensAndDelimiters() {
        // When
        int exitCode = cmd.execute("tokenize", "--format", "json", "--alignment", "token", "a<=b  c");

        // Then
        assertThat(exitCode).isZero();
        JsonObject json = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(json.get("statement").getAsString()).isEqualTo("a<=b  c");
        assertThat(json.get("alignment").getAsString()).isEqualTo("TOKEN");

        JsonArray tokens = json.getAsJsonArray("tokens");
        assertThat(tokens).hasSize(4);
        JsonObject operator = tokens.get(1).getAsJsonObject();
        assertThat(operator.get("type").getAsString()).isEqualTo("OPERATOR");
        assertThat(operator.get("text").getAsString()).isEqualTo("<=");
        assertThat(operator.get("offset").getAsInt()).isEqualTo(1);
        assertThat(operator.get("endOffset").getAsInt()).isEqualTo(3);

        JsonArray delimiters = json.getAsJsonArray("delimiters");
        assertThat(delimiters.get(2).getAsString()).isEqualTo("  ");
        assertThat(delimiters.get(0).getAsString()).isEmpty();
    }

    @Test
    void tokenize_withDropAndUpperKeywords_filtersOutput() {
        int exitCode = cmd.execute("tokenize", "--drop", "punctuation", "--upper-keywords", "select * from t");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("SELECT")
                .contains("FROM")
                .doesNotContain("*")
                .doesNotContain("PUNCTUATION");
    }

    @Test
    void tokenize_unterminatedString_failsWithSyntaxError() {
        int exitCode = cmd.execute("tokenize", "SELECT 'open");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Syntax error: unterminated quoted string ''open' in 'SELECT 'open'");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void tokenize_missingConfigFile_reportsInvalidConfiguration(@TempDir Path tempDir) {
        // Given
        String missing = tempDir.resolve("absent.conf").toString();

        // When
        int exitCode = cmd.execute("-c", missing, "tokenize", "a");

        // Then
        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString())
                .startsWith("Invalid configuration: ")
                .contains("absent.conf")
                .doesNotContain("Exception");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void tokenize_lenientBracketPolicy_printsWarningSummary(@TempDir Path tempDir) throws Exception {
        // Given
        Path config = tempDir.resolve("lenient.conf");
        Files.writeString(config, "querylex.scanner.unterminated-bracket = IGNORE\n");

        // When
        int exitCode = cmd.execute("-c", config.toString(), "tokenize", "SELECT * FROM [nt:base");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).hasSize(3);
        assertThat(err.toString().lines()).hasSize(1);
        assertThat(err.toString())
                .startsWith("[WARNING] offset 14: ")
                .contains("[nt:base");
    }
}
