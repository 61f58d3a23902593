package org.azula.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.azula.cli.CommandLineInterface;
import org.azula.compiler.BatchTokenizer;
import org.azula.compiler.SourceFile;
import org.azula.compiler.TokenizedFile;
import org.azula.compiler.diagnostics.Diagnostic;
import org.azula.compiler.frontend.lexer.KeywordTable;
import org.azula.compiler.frontend.lexer.LexerOptions;
import org.azula.compiler.frontend.lexer.Token;
import org.azula.compiler.frontend.lexer.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Prints the token stream of one or more Azula source files.
 */
@Command(name = "tokenize", mixinStandardHelpOptions = true,
        description = "Scans Azula source files and prints their tokens.")
public class TokenizeCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(TokenizeCommand.class);

    static final int EXIT_ILLEGAL_TOKENS = 1;
    static final int EXIT_UNREADABLE = 2;
    static final int EXIT_BAD_CONFIG = 3;

    /** Output formats. */
    enum Format { TEXT, JSON }

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "The source files to scan.")
    private List<Path> files;

    @Option(names = {"-f", "--format"}, defaultValue = "TEXT",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private Format format;

    @Option(names = "--strict", description = "Exit with code 1 if any file contains illegal tokens.")
    private boolean strict;

    @Option(names = {"-t", "--threads"}, description = "Worker threads (default: azula.lexer.batch.threads).")
    private Integer threads;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final LexerOptions options;
        try {
            final Config config = parent.getConfig();
            options = LexerOptions.fromConfig(config);
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return EXIT_BAD_CONFIG;
        }
        final int threadCount = threads != null ? threads : options.batchThreads();
        if (threadCount < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--threads must be at least 1, was " + threadCount);
        }

        final List<SourceFile> sources = new ArrayList<>(files.size());
        for (Path path : files) {
            try {
                sources.add(SourceFile.read(path));
            } catch (IOException e) {
                LOG.error("Could not read source file {}: {}", path, e.toString());
                spec.commandLine().getErr().println("Could not read source file: " + path);
                return EXIT_UNREADABLE;
            }
        }

        final List<TokenizedFile> results;
        try (BatchTokenizer tokenizer = new BatchTokenizer(KeywordTable.defaults(), options, threadCount)) {
            results = tokenizer.tokenizeAll(sources);
        }

        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        if (format == Format.JSON) {
            printJson(results, out);
        } else {
            printText(results, out);
        }
        for (TokenizedFile result : results) {
            result.diagnostics().forEach(err::println);
        }
        out.flush();
        err.flush();

        final boolean anyIllegal = results.stream().anyMatch(TokenizedFile::hasIllegalTokens);
        if (anyIllegal) {
            LOG.info("Illegal tokens found in {} of {} file(s)",
                    results.stream().filter(TokenizedFile::hasIllegalTokens).count(), results.size());
        }
        return strict && anyIllegal ? EXIT_ILLEGAL_TOKENS : 0;
    }

    private void printText(List<TokenizedFile> results, PrintWriter out) {
        for (TokenizedFile result : results) {
            for (Token token : result.tokens()) {
                out.println(token.describe());
            }
        }
    }

    private void printJson(List<TokenizedFile> results, PrintWriter out) {
        final List<FileDump> dumps = new ArrayList<>(results.size());
        for (TokenizedFile result : results) {
            final List<TokenDump> tokens = new ArrayList<>(result.tokens().size());
            for (Token token : result.tokens()) {
                tokens.add(new TokenDump(token.kind().diagnosticName(), categoryLabel(token.kind()),
                        token.literal(), token.line(), token.column()));
            }
            final List<String> diagnostics = result.diagnostics().stream().map(Diagnostic::toString).toList();
            dumps.add(new FileDump(result.source().name(), tokens, diagnostics));
        }
        final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        out.println(gson.toJson(dumps));
    }

    static String categoryLabel(TokenKind kind) {
        return switch (kind.category()) {
            case SENTINEL -> "sentinel";
            case LITERAL -> "literal";
            case DECLARATIVE_KEYWORD, CONTROL_FLOW_KEYWORD -> "keyword";
            case PUNCTUATION -> "punctuation";
            case OPERATOR -> "operator";
            case DELIMITER -> "delimiter";
        };
    }

    private record FileDump(String file, List<TokenDump> tokens, List<String> diagnostics) {}

    private record TokenDump(String kind, String category, String literal, int line, int column) {}
}
