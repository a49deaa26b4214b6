package org.querylex.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.typesafe.config.ConfigException;
import org.querylex.cli.CommandLineInterface;
import org.querylex.sql2.api.InvalidQueryException;
import org.querylex.sql2.filter.KeywordCaseFilter;
import org.querylex.sql2.filter.TokenFilterChain;
import org.querylex.sql2.filter.TokenTypeFilter;
import org.querylex.sql2.lexer.Token;
import org.querylex.sql2.lexer.TokenType;
import org.querylex.sql2.scanner.DelimiterAlignment;
import org.querylex.sql2.scanner.ScannerOptions;
import org.querylex.sql2.scanner.Sql2Scanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "tokenize",
    description = "Scan a SQL2 statement and print its tokens"
)
public class TokenizeCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(TokenizeCommand.class);

    enum OutputFormat { TABLE, JSON }

    @Parameters(
        arity = "1..*",
        paramLabel = "STATEMENT",
        description = "The statement; several arguments are joined with single spaces"
    )
    private List<String> words = new ArrayList<>();

    @Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: TABLE)"
    )
    private OutputFormat format = OutputFormat.TABLE;

    @Option(
        names = {"-a", "--alignment"},
        description = "Delimiter alignment, overrides the configuration: ${COMPLETION-CANDIDATES}"
    )
    private DelimiterAlignment alignment;

    @Option(
        names = {"--drop"},
        description = "Token kinds to leave out of the output: ${COMPLETION-CANDIDATES}"
    )
    private List<TokenType> dropped = new ArrayList<>();

    @Option(
        names = {"--upper-keywords"},
        description = "Print SQL2 keywords in upper case"
    )
    private boolean upperKeywords;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        ScannerOptions options;
        try {
            options = ScannerOptions.fromConfig(parent.getConfig());
        } catch (ConfigException e) {
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return 2;
        }
        if (alignment != null) {
            options = options.withDelimiterAlignment(alignment);
        }
        String statement = String.join(" ", words);

        Sql2Scanner scanner;
        try {
            scanner = new Sql2Scanner(statement, options);
        } catch (InvalidQueryException e) {
            LOG.debug("Scanning failed", e);
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        }

        List<Token> tokens = buildFilterChain().apply(scanner.getTokens());
        PrintWriter out = spec.commandLine().getOut();
        if (format == OutputFormat.JSON) {
            out.println(toJson(scanner, tokens));
        } else {
            printTable(out, tokens);
        }
        if (scanner.getDiagnostics().hasWarnings()) {
            spec.commandLine().getErr().println(scanner.getDiagnostics().summary());
        }
        out.flush();
        return 0;
    }

    private TokenFilterChain buildFilterChain() {
        TokenFilterChain chain = new TokenFilterChain();
        if (!dropped.isEmpty()) {
            chain.addFilter(new TokenTypeFilter(dropped));
        }
        if (upperKeywords) {
            chain.addFilter(new KeywordCaseFilter());
        }
        return chain;
    }

    private void printTable(PrintWriter out, List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            out.printf("%4d  %-17s %s%n", i, token.type(), token.text());
        }
    }

    private String toJson(Sql2Scanner scanner, List<Token> tokens) {
        JsonObject root = new JsonObject();
        root.addProperty("statement", scanner.getStatement());
        root.addProperty("alignment", scanner.getOptions().delimiterAlignment().name());

        JsonArray tokenArray = new JsonArray();
        for (Token token : tokens) {
            JsonObject json = new JsonObject();
            json.addProperty("type", token.type().name());
            json.addProperty("text", token.text());
            json.addProperty("offset", token.offset());
            json.addProperty("endOffset", token.endOffset());
            tokenArray.add(json);
        }
        root.add("tokens", tokenArray);

        JsonArray delimiterArray = new JsonArray();
        scanner.getDelimiters().forEach(delimiterArray::add);
        root.add("delimiters", delimiterArray);

        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        return gson.toJson(root);
    }
}
