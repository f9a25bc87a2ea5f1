package io.microtrace.platform.starter.observability.obsv;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for structured JSON console logging.
 *
 * <p>Bound from the environment by {@link LogJsonApplicationListener} before the context exists.
 */
@ConfigurationProperties(prefix = LogJsonProperties.PREFIX)
public class LogJsonProperties {

    public static final String PREFIX = "microtrace.obsv.logs";

    /** Install the JSON console appender. */
    private boolean enabled = true;

    /** Root logger level applied on install. Blank leaves the root level untouched. */
    private String level = "INFO";

    /** Detach Spring Boot's plain-text CONSOLE appender while the JSON appender is installed. */
    private boolean replaceConsole = true;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getLevel() { return level; }
    public void setLevel(String level) { this.level = level; }

    public boolean isReplaceConsole() { return replaceConsole; }
    public void setReplaceConsole(boolean replaceConsole) { this.replaceConsole = replaceConsole; }
}
