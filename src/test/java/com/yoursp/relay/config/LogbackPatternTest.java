package com.yoursp.relay.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Renders events through the console pattern declared in logback-spring.xml.
 */
class LogbackPatternTest {

    private final LoggerContext context = new LoggerContext();
    private PatternLayoutEncoder encoder;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        configurator.doConfigure(getClass().getResource("/logback-spring.xml"));

        ConsoleAppender<ILoggingEvent> console = (ConsoleAppender<ILoggingEvent>) context
                .getLogger(Logger.ROOT_LOGGER_NAME).getAppender("CONSOLE");
        encoder = (PatternLayoutEncoder) console.getEncoder();
    }

    @AfterEach
    void tearDown() {
        context.stop();
    }

    @Test
    void eachEventEndsWithLineSeparator() {
        String line = render("File ingested: note.txt (10 bytes)");

        assertTrue(line.endsWith(System.lineSeparator()), line);
        assertFalse(line.contains("%n"), line);
        assertEquals(1, line.split(System.lineSeparator()).length);
    }

    @Test
    void messageIsMasked() {
        String line = render("Connecting with secretKey=wJalrXUtnFEMI");

        assertTrue(line.contains("secretKey=[REDACTED]"), line);
        assertFalse(line.contains("wJalrXUtnFEMI"));
    }

    private String render(String message) {
        LoggingEvent event = new LoggingEvent(getClass().getName(), context.getLogger("com.yoursp.relay.test"),
                Level.INFO, message, null, null);
        return encoder.getLayout().doLayout(event);
    }
}
