package org.pxboard.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pxboard.junit.extensions.logging.ExpectLog;
import org.pxboard.junit.extensions.logging.LogLevel;
import org.pxboard.junit.extensions.logging.LogWatchExtension;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger("org.pxboard.test.alpha").setLevel(null);
        context.getLogger("org.pxboard.test.beta").setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void appliesDefaultAndPerLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(String.join("\n",
            "logging {",
            "  default-level = \"ERROR\"",
            "  levels { \"org.pxboard.test.alpha\" = \"DEBUG\", \"org.pxboard.test.beta\" = \"OFF\" }",
            "}")));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.pxboard.test.alpha").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("org.pxboard.test.beta").getLevel()).isEqualTo(Level.OFF);
    }

    @Test
    void appliesOnlyOnce() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.pxboard.test.alpha\" = \"DEBUG\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.pxboard.test.alpha\" = \"ERROR\" }"));

        assertThat(context.getLogger("org.pxboard.test.alpha").getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*LoggingConfigurator", messagePattern = "Ignoring unknown level 'LOUD'.*")
    void unknownLevelIsIgnored() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.pxboard.test.alpha\" = \"LOUD\" }"));

        assertThat(context.getLogger("org.pxboard.test.alpha").getLevel()).isNull();
    }
}
