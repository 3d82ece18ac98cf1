package ai.chess;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.spi.FilterReply;
import java.net.URL;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Production logging setup: per-move output lands in the game log while warnings from the
 * engine still show up on the console.
 */
class LoggingConfigurationTest {

    @TempDir
    Path logDir;

    private LoggerContext context;

    @BeforeEach
    void configure() throws Exception {
        context = new LoggerContext();
        context.putProperty("LOG_DIR", logDir.toString());
        URL config = getClass().getResource("/logback-spring.xml");
        assertNotNull(config, "logback-spring.xml should be on the classpath");

        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        configurator.doConfigure(config);
    }

    @AfterEach
    void stop() {
        context.stop();
    }

    @Test
    void engineLoggerWritesToGameFileAndConsole() {
        List<Appender<ILoggingEvent>> appenders = appendersOf(context.getLogger("ai.chess"));

        assertTrue(appenders.stream().anyMatch(a -> a instanceof FileAppender),
                "game file appender attached");
        assertTrue(appenders.stream().anyMatch(a -> a instanceof ConsoleAppender),
                "console appender attached");
    }

    @Test
    void engineWarningsReachConsoleButDebugOutputDoesNot() {
        Logger engine = context.getLogger("ai.chess.Game");
        Appender<ILoggingEvent> console = appendersOf(context.getLogger("ai.chess")).stream()
                .filter(a -> a instanceof ConsoleAppender)
                .findFirst()
                .orElseThrow();

        assertEquals(FilterReply.DENY,
                console.getFilterChainDecision(event(engine, Level.INFO, "Applied e2e4")));
        assertEquals(FilterReply.DENY,
                console.getFilterChainDecision(event(engine, Level.DEBUG, "Received e2e4")));
        assertNotEquals(FilterReply.DENY,
                console.getFilterChainDecision(event(engine, Level.WARN, "AI sent illegal move")));
        assertNotEquals(FilterReply.DENY,
                console.getFilterChainDecision(event(engine, Level.ERROR, "boom")));
    }

    private static LoggingEvent event(Logger logger, Level level, String message) {
        return new LoggingEvent(Logger.class.getName(), logger, level, message, null, null);
    }

    private static List<Appender<ILoggingEvent>> appendersOf(Logger logger) {
        List<Appender<ILoggingEvent>> result = new ArrayList<>();
        Iterator<Appender<ILoggingEvent>> it = logger.iteratorForAppenders();
        while (it.hasNext()) {
            result.add(it.next());
        }
        return result;
    }
}
