package io.microtrace.platform.http.filters;

import io.microtrace.platform.http.metrics.HttpRequestMetrics;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Records request count, latency and errors for every request, and logs one {@code
 * request_completed} line per request.
 *
 * <p>Outcome status:
 *
 * <ul>
 *   <li>success: the response status;
 *   <li>declared error (handled by an exception advice that called {@link
 *       #markDeclaredError(HttpServletRequest, Throwable)}): the status the advice wrote;
 *   <li>undeclared exception escaping the chain: {@value #FALLBACK_STATUS}, and the exception is
 *       rethrown unchanged.
 * </ul>
 *
 * <p>The {@code path} label is the matched route template ({@code /items/{id}}), never the raw
 * URI, so the label set stays bounded. Requests no handler matched share {@value
 * HttpRequestMetrics#UNMATCHED_PATH}. The completion log keeps the raw path.
 *
 * <p>Counting happens in a {@code finally} block, so each request yields exactly one counter
 * increment and one latency sample whatever the outcome. The ERROR re-dispatch is not filtered,
 * which keeps a failed request from being counted twice.
 *
 * <p>Runs inside {@link RequestIdFilter} and {@link ServerTracingFilter}, so the completion log
 * carries the request id and the trace ids.
 */
@Order(RequestMetricsFilter.ORDER)
public final class RequestMetricsFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestMetricsFilter.class);

  public static final int ORDER = ServerTracingFilter.ORDER + 10;

  public static final int FALLBACK_STATUS = 500;

  /** Request attribute carrying a declared error that was already rendered as a response. */
  public static final String REQUEST_ATTR_DECLARED_ERROR =
      RequestMetricsFilter.class.getName() + ".DECLARED_ERROR";

  private final HttpRequestMetrics metrics;

  public RequestMetricsFilter(HttpRequestMetrics metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Tells the filter that {@code error} was raised downstream and turned into a response by an
   * exception handler, so it is counted as an error even though it never reaches the filter.
   */
  public static void markDeclaredError(HttpServletRequest request, Throwable error) {
    request.setAttribute(REQUEST_ATTR_DECLARED_ERROR, error);
  }

  @Override
  protected void doFilterInternal(
      @NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response,
      @NonNull FilterChain chain)
      throws ServletException, IOException {

    final String method = request.getMethod();
    final long start = System.nanoTime();
    int status = FALLBACK_STATUS;

    try {
      chain.doFilter(request, response);
      status = response.getStatus();
      if (request.getAttribute(REQUEST_ATTR_DECLARED_ERROR) instanceof Throwable declared) {
        metrics.recordError(method, routeOf(request), declared);
      }
    } catch (IOException | ServletException | RuntimeException | Error ex) {
      metrics.recordError(method, routeOf(request), ex);
      throw ex;
    } finally {
      Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
      metrics.recordCompletion(method, routeOf(request), status, elapsed);
      log.atInfo()
          .addKeyValue("method", method)
          .addKeyValue("path", ServerTracingFilter.pathOf(request))
          .addKeyValue("status_code", status)
          .addKeyValue("elapsed_ms", Math.round(elapsed.toNanos() / 1_000.0) / 1_000.0)
          .log("request_completed");
    }
  }

  /** Route template set by the handler mapping, or the shared label when nothing matched. */
  static String routeOf(HttpServletRequest request) {
    Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
    if (pattern instanceof String route && !route.isEmpty()) {
      return route;
    }
    return HttpRequestMetrics.UNMATCHED_PATH;
  }
}
