package io.microtrace.platform.starter.observability.obsv;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.OutputStreamAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.microtrace.platform.http.context.RequestIdContext;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class JsonConsoleLoggingTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final LoggerContext context = new LoggerContext();

  private Logger captureLogger;
  private OutputStreamAppender<ILoggingEvent> captureAppender;

  @AfterEach
  void tearDown() {
    if (captureLogger != null) {
      captureLogger.detachAppender(captureAppender);
      captureAppender.stop();
    }
    context.stop();
  }

  @Test
  void installingTwiceAttachesOneAppender() {
    JsonConsoleLogging logging = new JsonConsoleLogging(Level.INFO, false);

    assertThat(logging.install(context)).isTrue();
    assertThat(logging.install(context)).isFalse();
    assertThat(new JsonConsoleLogging(Level.INFO, false).install(context)).isFalse();

    Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    assertThat(appenderNames(root)).containsExactly(JsonConsoleLogging.APPENDER_NAME);
    assertThat(root.getLevel()).isEqualTo(Level.INFO);
  }

  @Test
  void replacesConsoleAndRestoresItOnUninstall() {
    Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
    console.setName(JsonConsoleLogging.SPRING_CONSOLE_APPENDER);
    console.setContext(context);
    root.addAppender(console);

    JsonConsoleLogging logging = new JsonConsoleLogging(null, true);
    logging.install(context);
    assertThat(appenderNames(root)).containsExactly(JsonConsoleLogging.APPENDER_NAME);

    assertThat(logging.uninstall(context)).isTrue();
    assertThat(appenderNames(root)).containsExactly(JsonConsoleLogging.SPRING_CONSOLE_APPENDER);
    assertThat(logging.uninstall(context)).isFalse();
  }

  @Test
  void recordCarriesStandardFieldsAndPlaceholderRequestId() throws Exception {
    org.slf4j.Logger log = captureLogger("json.fields");

    log.atInfo().addKeyValue("path", "/analyze").log("request_completed");

    JsonNode json = lastRecord();
    assertThat(json.get("asctime").asText()).isNotBlank();
    assertThat(json.get("levelname").asText()).isEqualTo("INFO");
    assertThat(json.get("name").asText()).isEqualTo("json.fields");
    assertThat(json.get("message").asText()).isEqualTo("request_completed");
    assertThat(json.get("request_id").asText()).isEqualTo("-");
    assertThat(json.get("path").asText()).isEqualTo("/analyze");
  }

  @Test
  void recordCarriesRequestIdFromContext() throws Exception {
    org.slf4j.Logger log = captureLogger("json.request");

    try (RequestIdContext.Scope ignored = RequestIdContext.open("abc-123")) {
      log.info("inside");
    }
    log.info("outside");

    String[] lines = output().split("\\R");
    assertThat(mapper.readTree(lines[0]).get("request_id").asText()).isEqualTo("abc-123");
    assertThat(mapper.readTree(lines[1]).get("request_id").asText()).isEqualTo("-");
  }

  @Test
  void recordIncludesStackTraceForExceptions() throws Exception {
    org.slf4j.Logger log = captureLogger("json.error");

    log.error("failed", new IllegalStateException("kaput"));

    JsonNode json = lastRecord();
    assertThat(json.get("levelname").asText()).isEqualTo("ERROR");
    assertThat(json.get("stack_trace").asText()).contains("IllegalStateException", "kaput");
  }

  private org.slf4j.Logger captureLogger(String name) {
    LoggerContext global = (LoggerContext) LoggerFactory.getILoggerFactory();
    captureAppender = new OutputStreamAppender<>();
    captureAppender.setContext(global);
    captureAppender.setName("capture");
    captureAppender.setEncoder(JsonConsoleLogging.newEncoder(global));
    captureAppender.setOutputStream(new ByteArrayOutputStream());
    captureAppender.start();

    captureLogger = global.getLogger(name);
    captureLogger.setLevel(Level.DEBUG);
    captureLogger.setAdditive(false);
    captureLogger.addAppender(captureAppender);
    return captureLogger;
  }

  private String output() {
    ByteArrayOutputStream out = (ByteArrayOutputStream) captureAppender.getOutputStream();
    return out.toString(StandardCharsets.UTF_8).trim();
  }

  private JsonNode lastRecord() throws Exception {
    String[] lines = output().split("\\R");
    return mapper.readTree(lines[lines.length - 1]);
  }

  private static List<String> appenderNames(Logger logger) {
    List<String> names = new ArrayList<>();
    for (Iterator<Appender<ILoggingEvent>> it = logger.iteratorForAppenders(); it.hasNext(); ) {
      names.add(it.next().getName());
    }
    return names;
  }
}
