package io.microtrace.platform.domain.error;

import java.io.Serial;
import java.util.Objects;

/**
 * Framework-agnostic declared error carrying an RFC7807 {@link ProblemTypes.ProblemType} and the
 * HTTP status it maps to.
 *
 * <p>Declared errors are the expected failure paths of the service: the web layer renders them as
 * {@code application/problem+json} with {@link #status()} and counts them in the error metric
 * under the concrete exception class name. Anything else that escapes a handler is treated as
 * undeclared.
 *
 * <p>Stack traces are only captured for 5xx statuses unless the caller says otherwise.
 */
public class MicroTraceException extends RuntimeException {

  @Serial private static final long serialVersionUID = 1L;

  private final transient ProblemTypes.ProblemType type;
  private final int status;

  /**
   * Creates a declared error using the type's default status.
   *
   * @param type problem type (required)
   * @param detail non-PII, actionable detail; defaults to the type title when {@code null}
   */
  public MicroTraceException(ProblemTypes.ProblemType type, String detail) {
    this(type, type.defaultStatus(), detail, null);
  }

  /**
   * Primary constructor.
   *
   * @param type problem type (required)
   * @param status HTTP status to respond with
   * @param detail non-PII, actionable detail; defaults to the type title when {@code null}
   * @param cause optional cause
   */
  public MicroTraceException(
      ProblemTypes.ProblemType type, int status, String detail, Throwable cause) {
    super(
        Objects.requireNonNullElse(detail, Objects.requireNonNull(type, "type").title()),
        cause,
        true,
        status >= 500);
    if (status < 100 || status > 599) {
      throw new IllegalArgumentException("Invalid HTTP status: " + status);
    }
    this.type = type;
    this.status = status;
  }

  /** Problem type rendered in the response body. */
  public ProblemTypes.ProblemType type() {
    return type;
  }

  /** HTTP status code for this failure. */
  public int status() {
    return status;
  }

  /** Short title of the problem type. */
  public String title() {
    return type.title();
  }
}
