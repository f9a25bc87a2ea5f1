package io.microtrace.platform.starter.observability.obsv;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import io.microtrace.platform.http.context.RequestIdContext;
import net.logstash.logback.composite.JsonProviders;
import net.logstash.logback.composite.loggingevent.ArgumentsJsonProvider;
import net.logstash.logback.composite.loggingevent.KeyValuePairsJsonProvider;
import net.logstash.logback.composite.loggingevent.LogLevelJsonProvider;
import net.logstash.logback.composite.loggingevent.LoggerNameJsonProvider;
import net.logstash.logback.composite.loggingevent.LoggingEventFormattedTimestampJsonProvider;
import net.logstash.logback.composite.loggingevent.MdcJsonProvider;
import net.logstash.logback.composite.loggingevent.MessageJsonProvider;
import net.logstash.logback.composite.loggingevent.StackTraceJsonProvider;
import net.logstash.logback.composite.loggingevent.ThreadNameJsonProvider;
import net.logstash.logback.encoder.LoggingEventCompositeJsonEncoder;

/**
 * Installs a single JSON console appender on the root logger.
 *
 * <p>Each record is one JSON object per line with {@code asctime}, {@code levelname}, {@code
 * name}, {@code message}, {@code request_id}, plus any SLF4J key/value pairs and MDC entries.
 * Installing twice on the same context is a no-op, so records are never duplicated.
 */
public final class JsonConsoleLogging {

    public static final String APPENDER_NAME = "MICROTRACE_JSON";
    /** Name of the console appender configured by Spring Boot's default logback setup. */
    public static final String SPRING_CONSOLE_APPENDER = "CONSOLE";

    private static final Object LOCK = new Object();

    private final Level rootLevel;
    private final boolean replaceConsole;
    private Appender<ILoggingEvent> displaced;

    public JsonConsoleLogging(Level rootLevel, boolean replaceConsole) {
        this.rootLevel = rootLevel;
        this.replaceConsole = replaceConsole;
    }

    /**
     * Attaches the JSON appender to the root logger of {@code context}.
     *
     * @return {@code false} if an appender with {@link #APPENDER_NAME} was already attached
     */
    public boolean install(LoggerContext context) {
        synchronized (LOCK) {
            Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
            if (root.getAppender(APPENDER_NAME) != null) {
                return false;
            }
            ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
            appender.setContext(context);
            appender.setName(APPENDER_NAME);
            appender.setEncoder(newEncoder(context));
            appender.start();

            if (replaceConsole) {
                Appender<ILoggingEvent> console = root.getAppender(SPRING_CONSOLE_APPENDER);
                if (console != null) {
                    root.detachAppender(console);
                    displaced = console;
                }
            }
            root.addAppender(appender);
            if (rootLevel != null) {
                root.setLevel(rootLevel);
            }
            return true;
        }
    }

    /** Detaches the JSON appender and restores the console appender it displaced, if any. */
    public boolean uninstall(LoggerContext context) {
        synchronized (LOCK) {
            Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
            Appender<ILoggingEvent> appender = root.getAppender(APPENDER_NAME);
            if (appender == null) {
                return false;
            }
            root.detachAppender(appender);
            appender.stop();
            if (displaced != null) {
                root.addAppender(displaced);
                displaced = null;
            }
            return true;
        }
    }

    /** Builds the encoder shared by the console appender and tests. */
    public static LoggingEventCompositeJsonEncoder newEncoder(LoggerContext context) {
        LoggingEventCompositeJsonEncoder encoder = new LoggingEventCompositeJsonEncoder();
        encoder.setContext(context);
        JsonProviders<ILoggingEvent> providers = encoder.getProviders();

        LoggingEventFormattedTimestampJsonProvider timestamp = new LoggingEventFormattedTimestampJsonProvider();
        timestamp.setFieldName("asctime");
        timestamp.setTimeZone("UTC");
        providers.addProvider(timestamp);

        LogLevelJsonProvider level = new LogLevelJsonProvider();
        level.setFieldName("levelname");
        providers.addProvider(level);

        LoggerNameJsonProvider name = new LoggerNameJsonProvider();
        name.setFieldName("name");
        providers.addProvider(name);

        providers.addProvider(new MessageJsonProvider());
        providers.addProvider(new RequestIdJsonProvider());

        ThreadNameJsonProvider thread = new ThreadNameJsonProvider();
        thread.setFieldName("thread");
        providers.addProvider(thread);

        // request_id is written by RequestIdJsonProvider even when absent
        MdcJsonProvider mdc = new MdcJsonProvider();
        mdc.addExcludeMdcKeyName(RequestIdContext.MDC_KEY);
        providers.addProvider(mdc);

        providers.addProvider(new KeyValuePairsJsonProvider());
        providers.addProvider(new ArgumentsJsonProvider());
        providers.addProvider(new StackTraceJsonProvider());

        encoder.start();
        return encoder;
    }
}
