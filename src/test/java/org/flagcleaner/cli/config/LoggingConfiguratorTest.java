package org.flagcleaner.cli.config;

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

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String REWRITE_LOGGER = "org.flagcleaner.cleaner.rewrite";
    private static final String IO_LOGGER = "org.flagcleaner.cleaner.io";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger(REWRITE_LOGGER).setLevel(null);
        context.getLogger(IO_LOGGER).setLevel(null);
    }

    @Test
    void configure_withPlainFormat_shouldSetFormatProperty() {
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
        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY))
            .isEqualTo(LoggingConfigurator.PLAIN_APPENDER);
    }

    @Test
    void configure_shouldApplyDefaultAndSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "WARN"
              levels {
                "org.flagcleaner.cleaner.rewrite" = "DEBUG"
                "org.flagcleaner.cleaner.io" = "LOUD"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
        assertThat(context.getLogger(REWRITE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger(IO_LOGGER).getLevel()).isNull();
    }

    @Test
    void configure_shouldBeIdempotent() {
        // Given
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"WARN\" }"));

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"ERROR\" }"));

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void setLevel_shouldChangeSingleLogger() {
        // When
        LoggingConfigurator.setLevel(REWRITE_LOGGER, "TRACE");

        // Then
        assertThat(context.getLogger(REWRITE_LOGGER).getLevel()).isEqualTo(Level.TRACE);
    }
}
