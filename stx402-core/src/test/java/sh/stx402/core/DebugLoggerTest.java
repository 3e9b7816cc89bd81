// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger debugLogger = (Logger) LoggerFactory.getLogger("sh.stx402.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        appender = new ListAppender<>();
        appender.start();
        debugLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        Stx402Debug.setEnabled(false);
        debugLogger.detachAndStopAllAppenders();
    }

    @Test
    void silentWhenDisabled() {
        DebugLogger.logAuth(LogFormatter.formatAuthGranted("update", "SP2J6ZY48GV1EZ5V2V5RB9MP66SW86PYKKNRV9EJ7", "payment"));
        DebugLogger.logRegistry("anything");
        DebugLogger.logProbe("anything");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void channelsAreIndependent() {
        Stx402Debug.setProbeLogging(true);

        DebugLogger.logAuth("auth line");
        DebugLogger.logProbe("probe line");

        assertEquals(1, appender.list.size());
        assertEquals("probe line", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void authLineCarriesTagAndShortenedOwner() {
        Stx402Debug.setAuthLogging(true);

        DebugLogger.logAuth(LogFormatter.formatAuthDenied(
                "delete", "SP2J6ZY48GV1EZ5V2V5RB9MP66SW86PYKKNRV9EJ7", "timestamp expired"));

        final String message = appender.list.get(0).getFormattedMessage();
        assertTrue(message.contains("[AUTH]"));
        assertTrue(message.contains("op=delete"));
        assertTrue(message.contains("owner=SP2J6Z...9EJ7"));
        assertTrue(message.contains("timestamp expired"));
    }

    @Test
    void signaturesNeverReachTheSink() {
        Stx402Debug.setEnabled(true);

        DebugLogger.log("request %s", "{\"signature\":\"e9b6865abc77874aebfe25d7ad85fabe\"}");

        final String message = appender.list.get(0).getFormattedMessage();
        assertFalse(message.contains("e9b6865abc"));
        assertTrue(message.contains("REDACTED"));
    }

    @Test
    void probeLineFormatsDuration() {
        Stx402Debug.setProbeLogging(true);

        DebugLogger.logProbe(LogFormatter.formatProbe("https://api.example.com/x", 402, true, 1_500_000));

        final String message = appender.list.get(0).getFormattedMessage();
        assertTrue(message.contains("[PROBE]"));
        assertTrue(message.contains("status=402"));
        assertTrue(message.contains("x402=true"));
        assertTrue(message.contains("duration=1.50s"));
    }
}
