package io.microtrace.platform.http.context;

import java.util.Objects;
import org.slf4j.MDC;

/**
 * Ambient request id for the current thread, stored in the SLF4J {@link MDC} under {@value
 * #MDC_KEY} so every log line of a request carries it.
 *
 * <p>Ids are published through {@link #open(String)}, which returns a {@link Scope} that puts back
 * whatever value was active before (or removes the key) when closed. Always use it in a
 * try-with-resources block; that keeps the id from leaking into the next request served by the
 * same (possibly virtual) thread.
 *
 * <pre>{@code
 * try (RequestIdContext.Scope ignored = RequestIdContext.open(requestId)) {
 *   chain.doFilter(request, response);
 * }
 * }</pre>
 */
public final class RequestIdContext {

  /** MDC key, also the JSON log field name. */
  public static final String MDC_KEY = "request_id";

  /** Value reported when no request is active (startup logs, background threads). */
  public static final String NONE = "-";

  private RequestIdContext() {}

  /**
   * Publishes {@code requestId} as the current id until the returned scope is closed.
   *
   * @param requestId non-blank id
   * @return scope restoring the previous value on {@link Scope#close()}
   */
  public static Scope open(String requestId) {
    Objects.requireNonNull(requestId, "requestId");
    if (requestId.isBlank()) {
      throw new IllegalArgumentException("requestId must not be blank");
    }
    String previous = MDC.get(MDC_KEY);
    MDC.put(MDC_KEY, requestId);
    return new Scope(previous);
  }

  /** Current id, or {@value #NONE} outside a request. */
  public static String current() {
    String id = MDC.get(MDC_KEY);
    return (id == null || id.isEmpty()) ? NONE : id;
  }

  /** Restores the id that was active when the scope was opened. Idempotent. */
  public static final class Scope implements AutoCloseable {
    private final String previous;
    private boolean closed;

    private Scope(String previous) {
      this.previous = previous;
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      if (previous == null) {
        MDC.remove(MDC_KEY);
      } else {
        MDC.put(MDC_KEY, previous);
      }
    }
  }
}
