package org.endowsim.cli.config;

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

@Tag("unit")
class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.endowsim.runtime").setLevel(null);
        context.getLogger("org.endowsim.cli").setLevel(null);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
    }

    @Test
    void configure_withPlainFormat_shouldSelectPlainAppender() {
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
        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void configure_withJsonFormat_shouldSelectJsonAppender() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "json"
              default-level = "WARN"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT");
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void configure_withSpecificLevels_shouldApplyPerLogger() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              levels {
                "org.endowsim.runtime" = "DEBUG"
                "org.endowsim.cli" = "ERROR"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertThat(context.getLogger("org.endowsim.runtime").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("org.endowsim.cli").getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void configure_isIdempotentUntilReset() {
        // Given
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = DEBUG"));

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = DEBUG"));
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void configure_withoutLoggingBlock_shouldLeaveLevelsUntouched() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(originalRootLevel);
    }

    @Test
    void appenderFor_mapsFormatNames() {
        assertThat(LoggingConfigurator.appenderFor("JSON")).isEqualTo("STDOUT");
        assertThat(LoggingConfigurator.appenderFor("plain")).isEqualTo("STDOUT_PLAIN");
        assertThat(LoggingConfigurator.appenderFor("anything")).isEqualTo("STDOUT_PLAIN");
    }
}
