package org.azula.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String LEXER_LOGGER = "org.azula.compiler.frontend.lexer.Lexer";
    private static final String BATCH_LOGGER = "org.azula.compiler.BatchTokenizer";

    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context().getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context().getLogger(LEXER_LOGGER).setLevel(null);
        context().getLogger(BATCH_LOGGER).setLevel(null);
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    @Test
    void configure_withPlainFormat_keepsPlainAppender() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(LoggingConfigurator.PLAIN_APPENDER, context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        final ch.qos.logback.classic.Logger root = context().getLogger(Logger.ROOT_LOGGER_NAME);
        assertEquals(Level.INFO, root.getLevel());
        assertEquals(true, root.getAppender(LoggingConfigurator.PLAIN_APPENDER) != null);
    }

    @Test
    void configure_appliesSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "WARN"
              levels {
                "org.azula.compiler.frontend.lexer.Lexer" = "TRACE"
                "org.azula.compiler.BatchTokenizer" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.WARN, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.TRACE, context().getLogger(LEXER_LOGGER).getLevel());
        assertEquals(Level.DEBUG, context().getLogger(BATCH_LOGGER).getLevel());
    }

    @Test
    void configure_skipsUnknownLevel() {
        final Config config = ConfigFactory.parseString("""
            logging.levels { "org.azula.compiler.BatchTokenizer" = "LOUD" }
            """);

        LoggingConfigurator.configure(config);

        assertNull(context().getLogger(BATCH_LOGGER).getLevel());
    }

    @Test
    void configure_isIdempotent() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + LEXER_LOGGER + "\" = \"DEBUG\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + LEXER_LOGGER + "\" = \"ERROR\" }"));

        assertEquals(Level.DEBUG, context().getLogger(LEXER_LOGGER).getLevel());
    }

    @Test
    void configure_withoutLoggingBlock_changesNothing() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertEquals(originalRootLevel, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
