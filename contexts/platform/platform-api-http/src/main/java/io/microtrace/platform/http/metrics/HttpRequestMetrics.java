package io.microtrace.platform.http.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import jakarta.servlet.ServletException;
import java.time.Duration;
import java.util.Objects;

/**
 * The three request collectors, registered lazily per tag combination in a shared {@link
 * MeterRegistry}.
 *
 * <ul>
 *   <li>{@value #REQUESTS} (Counter; tags: method, path, status), exported as {@code
 *       requests_total}
 *   <li>{@value #LATENCY} (Timer; tags: method, path), exported as the {@code
 *       request_latency_seconds} histogram
 *   <li>{@value #ERRORS} (Counter; tags: method, path, exception), exported as {@code
 *       errors_total}
 * </ul>
 *
 * <p>Micrometer meters are safe for concurrent increments; no locking here.
 */
public final class HttpRequestMetrics {

  public static final String REQUESTS = "requests";
  public static final String LATENCY = "request.latency";
  public static final String ERRORS = "errors";

  public static final String TAG_METHOD = "method";
  public static final String TAG_PATH = "path";
  public static final String TAG_STATUS = "status";
  public static final String TAG_EXCEPTION = "exception";

  /** Path label for requests that matched no handler. */
  public static final String UNMATCHED_PATH = "UNMATCHED";

  /** Classic Prometheus client default buckets. */
  static final Duration[] LATENCY_BUCKETS = {
    Duration.ofMillis(5),
    Duration.ofMillis(10),
    Duration.ofMillis(25),
    Duration.ofMillis(50),
    Duration.ofMillis(75),
    Duration.ofMillis(100),
    Duration.ofMillis(250),
    Duration.ofMillis(500),
    Duration.ofMillis(750),
    Duration.ofSeconds(1),
    Duration.ofMillis(2500),
    Duration.ofSeconds(5),
    Duration.ofMillis(7500),
    Duration.ofSeconds(10)
  };

  private final MeterRegistry registry;

  public HttpRequestMetrics(MeterRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /** Counts one finished request and records its latency. */
  public void recordCompletion(String method, String path, int status, Duration elapsed) {
    Counter.builder(REQUESTS)
        .description("Total number of HTTP requests processed.")
        .tags(Tags.of(TAG_METHOD, method, TAG_PATH, path, TAG_STATUS, Integer.toString(status)))
        .register(registry)
        .increment();
    Timer.builder(LATENCY)
        .description("Request latency in seconds.")
        .tags(Tags.of(TAG_METHOD, method, TAG_PATH, path))
        .serviceLevelObjectives(LATENCY_BUCKETS)
        .register(registry)
        .record(elapsed);
  }

  /** Counts one failed request under the failure's kind. */
  public void recordError(String method, String path, Throwable error) {
    Counter.builder(ERRORS)
        .description("Total number of exceptions raised by requests.")
        .tags(Tags.of(TAG_METHOD, method, TAG_PATH, path, TAG_EXCEPTION, kindOf(error)))
        .register(registry)
        .increment();
  }

  /**
   * Simple class name of the failure. Servlet-container wrapping ({@link ServletException} with a
   * root cause) is peeled off so the label names what the handler actually threw.
   */
  public static String kindOf(Throwable error) {
    Throwable t = error;
    while (t instanceof ServletException se && se.getRootCause() != null && se.getRootCause() != t) {
      t = se.getRootCause();
    }
    String simple = t.getClass().getSimpleName();
    return simple.isEmpty() ? t.getClass().getName() : simple;
  }
}
