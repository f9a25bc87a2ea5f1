package io.microtrace.platform.starter.observability.obsv;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.boot.context.logging.LoggingApplicationListener;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.GenericApplicationListener;
import org.springframework.core.ResolvableType;

/**
 * LogJsonApplicationListener
 *
 * Switches the process to structured JSON console logging before the application context is
 * created, so startup lines (auto-configuration, tracing bootstrap, worker settings) are JSON too.
 *
 * Behavior:
 * - Runs right after Spring Boot's {@link LoggingApplicationListener} has initialized Logback on
 *   {@link ApplicationEnvironmentPreparedEvent}, binds {@code microtrace.obsv.logs.*} from the
 *   environment and installs {@link JsonConsoleLogging} on the root logger.
 * - On close of the root context, removes it again and restores the displaced appender. A failed
 *   start is reported in JSON before that close.
 * - Installation is idempotent: a second application in the same JVM does not add a second
 *   appender, and only the application that installed it removes it.
 *
 * Registered in {@code META-INF/spring.factories}; it is not a bean.
 */
public class LogJsonApplicationListener implements GenericApplicationListener {

    public static final int ORDER = LoggingApplicationListener.DEFAULT_ORDER + 1;

    private JsonConsoleLogging logging;
    private boolean installedHere;

    @Override
    public boolean supportsEventType(ResolvableType eventType) {
        Class<?> type = eventType.getRawClass();
        return type != null
                && (ApplicationEnvironmentPreparedEvent.class.isAssignableFrom(type)
                        || ContextClosedEvent.class.isAssignableFrom(type));
    }

    @Override
    public void onApplicationEvent(ApplicationEvent event) {
        if (event instanceof ApplicationEnvironmentPreparedEvent prepared) {
            onEnvironmentPrepared(prepared);
        } else if (event instanceof ContextClosedEvent closed) {
            if (closed.getApplicationContext().getParent() == null) {
                remove();
            }
        }
    }

    @Override
    public int getOrder() {
        return ORDER;
    }

    /** Whether this listener attached the JSON appender and still owns it. */
    public synchronized boolean isInstalled() {
        return installedHere;
    }

    private synchronized void onEnvironmentPrepared(ApplicationEnvironmentPreparedEvent event) {
        LogJsonProperties props = Binder.get(event.getEnvironment())
                .bind(LogJsonProperties.PREFIX, LogJsonProperties.class)
                .orElseGet(LogJsonProperties::new);
        LoggerContext context = loggerContext();
        if (!props.isEnabled() || context == null || installedHere) {
            return;
        }
        logging = new JsonConsoleLogging(rootLevel(props.getLevel()), props.isReplaceConsole());
        installedHere = logging.install(context);
    }

    private synchronized void remove() {
        LoggerContext context = loggerContext();
        if (installedHere && context != null) {
            logging.uninstall(context);
        }
        installedHere = false;
    }

    static Level rootLevel(String level) {
        return level == null || level.isBlank() ? null : Level.toLevel(level.trim(), Level.INFO);
    }

    private static LoggerContext loggerContext() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        return factory instanceof LoggerContext context ? context : null;
    }
}
