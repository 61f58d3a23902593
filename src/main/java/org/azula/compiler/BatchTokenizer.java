package org.azula.compiler;

import org.azula.compiler.diagnostics.DiagnosticsEngine;
import org.azula.compiler.frontend.lexer.KeywordTable;
import org.azula.compiler.frontend.lexer.Lexer;
import org.azula.compiler.frontend.lexer.LexerOptions;
import org.azula.compiler.frontend.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Tokenizes several source files, optionally in parallel.
 * <p>
 * Every file gets its own {@link Lexer} and {@link DiagnosticsEngine}; only the
 * immutable {@link KeywordTable} and {@link LexerOptions} are shared. Results are
 * returned in input order.
 */
public class BatchTokenizer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BatchTokenizer.class);

    private final KeywordTable keywords;
    private final LexerOptions options;
    private final int threadCount;
    private final ExecutorService executorService;

    /**
     * Creates a tokenizer with the default keyword table, using
     * {@link LexerOptions#batchThreads()} worker threads.
     * @param options The lexer options.
     */
    public BatchTokenizer(LexerOptions options) {
        this(KeywordTable.defaults(), options, options.batchThreads());
    }

    /**
     * @param keywords The keyword table shared by all lexers.
     * @param options The lexer options shared by all lexers.
     * @param threadCount Number of worker threads. With 1, files are scanned in the calling thread.
     */
    public BatchTokenizer(KeywordTable keywords, LexerOptions options, int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be at least 1, was " + threadCount);
        }
        this.keywords = Objects.requireNonNull(keywords, "keywords");
        this.options = Objects.requireNonNull(options, "options");
        this.threadCount = threadCount;
        this.executorService = threadCount > 1 ? Executors.newFixedThreadPool(threadCount) : null;
    }

    /**
     * Scans a single file in the calling thread.
     * @param file The file to scan.
     * @return The tokens and diagnostics of the file.
     */
    public TokenizedFile tokenize(SourceFile file) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(file.content(), diagnostics, file.name(), keywords, options);
        List<Token> tokens = lexer.scanTokens();
        return new TokenizedFile(file, tokens, diagnostics.getDiagnostics());
    }

    /**
     * Scans all files.
     * @param files The files to scan.
     * @return One result per file, in the order of {@code files}.
     * @throws IllegalStateException if a scan fails or the calling thread is interrupted.
     */
    public List<TokenizedFile> tokenizeAll(List<SourceFile> files) {
        LOG.debug("Tokenizing {} file(s) with {} thread(s)", files.size(), threadCount);
        List<TokenizedFile> results = new ArrayList<>(files.size());
        if (executorService == null) {
            for (SourceFile file : files) {
                results.add(tokenize(file));
            }
            return results;
        }

        List<Future<TokenizedFile>> futures = new ArrayList<>(files.size());
        for (SourceFile file : files) {
            futures.add(executorService.submit(() -> tokenize(file)));
        }
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while tokenizing " + files.get(i).name(), e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Failed to tokenize " + files.get(i).name(), e.getCause());
            }
        }
        return results;
    }

    public int getThreadCount() {
        return threadCount;
    }

    @Override
    public void close() {
        if (executorService != null) {
            executorService.shutdownNow();
        }
    }
}
