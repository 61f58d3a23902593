package org.azula.compiler.frontend.lexer;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Tunables of the lexer, read from the {@code azula.lexer} block of the configuration.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * azula.lexer {
 *   tab-width = 1       # columns a tab advances the position by
 *   batch.threads = 1   # worker threads used by the BatchTokenizer
 * }
 * </pre>
 *
 * @param tabWidth Number of columns a tab character occupies. At least 1.
 * @param batchThreads Number of threads used to tokenize several files. At least 1.
 */
public record LexerOptions(int tabWidth, int batchThreads) {

    static final String CONFIG_PATH = "azula.lexer";
    private static final String TAB_WIDTH_KEY = "tab-width";
    private static final String BATCH_THREADS_KEY = "batch.threads";

    private static final LexerOptions DEFAULTS = new LexerOptions(1, 1);

    public LexerOptions {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be at least 1, was " + tabWidth);
        }
        if (batchThreads < 1) {
            throw new IllegalArgumentException("batchThreads must be at least 1, was " + batchThreads);
        }
    }

    /**
     * @return Options that count a tab as one column and scan in a single thread.
     */
    public static LexerOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the options from a configuration. Missing keys fall back to {@link #defaults()}.
     *
     * @param config The application configuration.
     * @return The resolved options.
     * @throws ConfigException.BadValue if a value is out of range.
     */
    public static LexerOptions fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return DEFAULTS;
        }
        Config lexerConfig = config.getConfig(CONFIG_PATH);
        int tabWidth = lexerConfig.hasPath(TAB_WIDTH_KEY) ? lexerConfig.getInt(TAB_WIDTH_KEY) : DEFAULTS.tabWidth();
        int threads = lexerConfig.hasPath(BATCH_THREADS_KEY) ? lexerConfig.getInt(BATCH_THREADS_KEY) : DEFAULTS.batchThreads();

        if (tabWidth < 1) {
            throw new ConfigException.BadValue(CONFIG_PATH + "." + TAB_WIDTH_KEY, "must be at least 1, was " + tabWidth);
        }
        if (threads < 1) {
            throw new ConfigException.BadValue(CONFIG_PATH + "." + BATCH_THREADS_KEY, "must be at least 1, was " + threads);
        }
        return new LexerOptions(tabWidth, threads);
    }

    /**
     * Reads the options from {@code reference.conf} on the classpath.
     *
     * @return The options declared as defaults by the application.
     */
    public static LexerOptions fromReference() {
        return fromConfig(ConfigFactory.defaultReference());
    }
}
