package io.microtrace.platform.starter.error.web.autoconfig;

import io.microtrace.platform.domain.error.MicroTraceException;
import io.microtrace.platform.domain.error.ProblemTypes;
import io.microtrace.platform.domain.error.ProblemTypes.ProblemType;
import io.microtrace.platform.http.filters.RequestIdFilter;
import io.microtrace.platform.http.filters.RequestMetricsFilter;
import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Centralized RFC7807 mapping for web endpoints.
 *
 * <p>Notes:
 *
 * <ul>
 *   <li>Declared errors ({@link MicroTraceException}, {@link ErrorResponseException} and {@link
 *       ResponseStatusException}) are rendered with their status and marked on the request so the
 *       metrics filter counts them as errors.
 *   <li>Request validation and protocol errors become 4xx problems and are not counted as errors.
 *   <li>No catch-all handler: undeclared exceptions propagate to the container.
 *   <li>Every problem carries the {@code requestId} of the request.
 * </ul>
 */
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice
public class ProblemExceptionAdvice {

  private static final Logger log = LoggerFactory.getLogger(ProblemExceptionAdvice.class);

  private static final MediaType PROBLEM_JSON = MediaType.APPLICATION_PROBLEM_JSON;

  // -------------------------- Domain --------------------------

  /** Maps {@link MicroTraceException} to Problem+JSON with the declared status and type. */
  @ExceptionHandler(MicroTraceException.class)
  public ResponseEntity<ProblemDetail> handleMicroTrace(
      HttpServletRequest req, MicroTraceException ex) {
    RequestMetricsFilter.markDeclaredError(req, ex);
    log.atWarn()
        .addKeyValue("problem", ex.type().slug())
        .addKeyValue("status_code", ex.status())
        .log("declared_error");
    ProblemDetail p = problem(req, ex.status(), ex.type(), ex.getMessage());
    return respond(p, ex.status(), null);
  }

  // -------------------------- Validation --------------------------

  /** Maps binding and bean-validation errors to a 400 with field violations. */
  @ExceptionHandler(BindException.class)
  public ResponseEntity<ProblemDetail> handleBind(HttpServletRequest req, BindException ex) {
    List<Map<String, String>> errs = new ArrayList<>(ex.getErrorCount());
    ex.getBindingResult()
        .getAllErrors()
        .forEach(
            err -> {
              String field = err instanceof FieldError fe ? fe.getField() : err.getObjectName();
              errs.add(violation(field, safe(err.getDefaultMessage()), err.getCode()));
            });
    ProblemDetail p =
        problem(req, 400, ProblemTypes.VALIDATION_FAILED, "Validation failed for request.");
    p.setProperty("errors", errs);
    return respond(p, 400, null);
  }

  /** Maps malformed JSON/body to a 400 problem. */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleMalformed(
      HttpServletRequest req, HttpMessageNotReadableException ex) {
    ProblemDetail p = problem(req, 400, ProblemTypes.MALFORMED_REQUEST, "Malformed request body.");
    return respond(p, 400, null);
  }

  // -------------------------- Protocol --------------------------

  /** Maps unsupported media type to 415. */
  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ProblemDetail> handleUnsupported(
      HttpServletRequest req, HttpMediaTypeNotSupportedException ex) {
    ProblemDetail p = problem(req, 415, null, "Unsupported media type.");
    HttpHeaders headers = new HttpHeaders();
    if (!ex.getSupportedMediaTypes().isEmpty()) {
      headers.setAccept(ex.getSupportedMediaTypes());
    }
    return respond(p, 415, headers);
  }

  /** Maps method not allowed to 405 and sets Allow if available. */
  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ProblemDetail> handleMethodNotAllowed(
      HttpServletRequest req, HttpRequestMethodNotSupportedException ex) {
    ProblemDetail p = problem(req, 405, null, "HTTP method not allowed for this endpoint.");
    HttpHeaders headers = new HttpHeaders();
    Set<HttpMethod> supported = ex.getSupportedHttpMethods();
    if (supported != null && !supported.isEmpty()) {
      headers.setAllow(supported);
    }
    return respond(p, 405, headers);
  }

  // -------------------------- Explicit status exceptions --------------------------

  /** Maps {@link ResponseStatusException} to Problem+JSON using its status and reason. */
  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatus(
      HttpServletRequest req, ResponseStatusException ex) {
    RequestMetricsFilter.markDeclaredError(req, ex);
    int status = ex.getStatusCode().value();
    ProblemDetail p = problem(req, status, null, safe(ex.getReason()));
    return respond(p, status, null);
  }

  /** Maps {@link ErrorResponseException} to Problem+JSON using its {@link ProblemDetail}. */
  @ExceptionHandler(ErrorResponseException.class)
  public ResponseEntity<ProblemDetail> handleErrorResponse(
      HttpServletRequest req, ErrorResponseException ex) {
    RequestMetricsFilter.markDeclaredError(req, ex);
    int status = ex.getStatusCode().value();
    // getBody() is non-null by contract
    ProblemDetail p = problem(req, status, null, safe(ex.getBody().getDetail()));
    return respond(p, status, null);
  }

  // -------------------------- helpers --------------------------

  private static ProblemDetail problem(
      HttpServletRequest req, int status, ProblemType typeOrNull, String detail) {
    ProblemDetail p = ProblemDetail.forStatusAndDetail(HttpStatus.valueOf(status), detail);
    if (typeOrNull != null) {
      p.setType(typeOrNull.uri());
      p.setTitle(typeOrNull.title());
      p.setProperty("code", typeOrNull.slug());
    }
    p.setProperty("requestId", RequestIdFilter.requestIdOf(req));
    return p;
  }

  private static Map<String, String> violation(String field, String message, String code) {
    Map<String, String> v = new LinkedHashMap<>();
    v.put("field", field);
    v.put("message", message);
    if (code != null) {
      v.put("code", code);
    }
    return v;
  }

  /** Builds the response with the problem content type and optional headers. */
  private ResponseEntity<ProblemDetail> respond(
      ProblemDetail p, int status, HttpHeaders headersOrNull) {
    HttpHeaders headers = (headersOrNull == null ? new HttpHeaders() : headersOrNull);
    headers.setContentType(PROBLEM_JSON);
    return new ResponseEntity<>(p, headers, HttpStatus.valueOf(status));
  }

  private static String safe(Object o) {
    String s = (o == null ? null : String.valueOf(o));
    return (s == null || s.isBlank()) ? "Request could not be processed." : s;
  }
}
