package io.microtrace.platform.http.filters;

import io.microtrace.platform.http.context.RequestIdContext;
import io.microtrace.platform.http.metrics.HttpRequestMetrics;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.semconv.ErrorAttributes;
import io.opentelemetry.semconv.HttpAttributes;
import io.opentelemetry.semconv.UrlAttributes;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Creates one SERVER span per inbound request.
 *
 * <ul>
 *   <li>Parent context is extracted from the request headers with the configured propagators (W3C
 *       {@code traceparent}/{@code baggage} by default).
 *   <li>Span name is {@code METHOD /route} once Spring MVC matched a handler, {@code METHOD} plus
 *       the raw path otherwise.
 *   <li>Carries HTTP semantic-convention attributes, the status code and {@value
 *       #REQUEST_ID_ATTRIBUTE}; 5xx responses and escaping exceptions mark the span as ERROR.
 *   <li>{@code trace_id} and {@code span_id} are exposed in the MDC while the request runs.
 * </ul>
 *
 * <p>Paths matching one of the excluded Ant patterns (the metrics scrape endpoint by default) are
 * never traced.
 */
@Order(ServerTracingFilter.ORDER)
public final class ServerTracingFilter extends OncePerRequestFilter {

  public static final int ORDER = RequestIdFilter.ORDER + 10;

  public static final String INSTRUMENTATION_NAME = "io.microtrace.platform.http.server";

  public static final String REQUEST_ID_ATTRIBUTE = "microtrace.request_id";

  public static final String MDC_TRACE_ID = "trace_id";
  public static final String MDC_SPAN_ID = "span_id";

  private static final AttributeKey<String> REQUEST_ID_KEY =
      AttributeKey.stringKey(REQUEST_ID_ATTRIBUTE);

  private static final AntPathMatcher ANT = new AntPathMatcher();

  static final TextMapGetter<HttpServletRequest> HEADER_GETTER =
      new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(HttpServletRequest carrier) {
          return Collections.list(carrier.getHeaderNames());
        }

        @Override
        public String get(HttpServletRequest carrier, String key) {
          return carrier == null ? null : carrier.getHeader(key);
        }
      };

  private final Tracer tracer;
  private final TextMapPropagator propagator;
  private final List<String> excludedPaths;

  public ServerTracingFilter(OpenTelemetry openTelemetry, Collection<String> excludedPaths) {
    Objects.requireNonNull(openTelemetry, "openTelemetry");
    this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
    this.propagator = openTelemetry.getPropagators().getTextMapPropagator();
    this.excludedPaths = excludedPaths == null ? List.of() : List.copyOf(excludedPaths);
  }

  public List<String> getExcludedPaths() {
    return excludedPaths;
  }

  @Override
  protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
    String path = pathOf(request);
    for (String pattern : excludedPaths) {
      if (ANT.match(pattern, path)) {
        return true;
      }
    }
    return false;
  }

  @Override
  protected void doFilterInternal(
      @NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response,
      @NonNull FilterChain chain)
      throws ServletException, IOException {

    final String method = request.getMethod();
    final String path = pathOf(request);
    Context parent = propagator.extract(Context.current(), request, HEADER_GETTER);

    Span span =
        tracer
            .spanBuilder(method + " " + path)
            .setParent(parent)
            .setSpanKind(SpanKind.SERVER)
            .setAttribute(HttpAttributes.HTTP_REQUEST_METHOD, method)
            .setAttribute(UrlAttributes.URL_PATH, path)
            .setAttribute(UrlAttributes.URL_SCHEME, request.getScheme())
            .setAttribute(REQUEST_ID_KEY, RequestIdContext.current())
            .startSpan();

    SpanContext sc = span.getSpanContext();
    String previousTraceId = MDC.get(MDC_TRACE_ID);
    String previousSpanId = MDC.get(MDC_SPAN_ID);
    MDC.put(MDC_TRACE_ID, sc.getTraceId());
    MDC.put(MDC_SPAN_ID, sc.getSpanId());

    try (Scope ignored = span.makeCurrent()) {
      chain.doFilter(request, response);
      int status = response.getStatus();
      span.setAttribute(HttpAttributes.HTTP_RESPONSE_STATUS_CODE, (long) status);
      if (status >= 500) {
        span.setAttribute(ErrorAttributes.ERROR_TYPE, Integer.toString(status));
        span.setStatus(StatusCode.ERROR);
      }
    } catch (IOException | ServletException | RuntimeException | Error ex) {
      span.setAttribute(
          HttpAttributes.HTTP_RESPONSE_STATUS_CODE, (long) RequestMetricsFilter.FALLBACK_STATUS);
      span.setAttribute(ErrorAttributes.ERROR_TYPE, HttpRequestMetrics.kindOf(ex));
      span.recordException(ex);
      span.setStatus(StatusCode.ERROR);
      throw ex;
    } finally {
      if (request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE)
          instanceof String route) {
        span.setAttribute(HttpAttributes.HTTP_ROUTE, route);
        span.updateName(method + " " + route);
      }
      span.end();
      restore(MDC_TRACE_ID, previousTraceId);
      restore(MDC_SPAN_ID, previousSpanId);
    }
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }

  static String pathOf(HttpServletRequest request) {
    String uri = request.getRequestURI();
    String contextPath = request.getContextPath();
    if (uri == null) {
      return "/";
    }
    if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
      uri = uri.substring(contextPath.length());
    }
    return uri.isEmpty() ? "/" : uri;
  }
}
