package io.microtrace.platform.http.client;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import io.opentelemetry.semconv.ErrorAttributes;
import io.opentelemetry.semconv.HttpAttributes;
import io.opentelemetry.semconv.ServerAttributes;
import io.opentelemetry.semconv.UrlAttributes;
import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

/**
 * Outbound counterpart of {@code ServerTracingFilter}: one CLIENT span per call made through a
 * {@code RestClient} or {@code RestTemplate}, with the current context injected into the request
 * headers so the callee joins the trace.
 */
public final class TracingClientHttpRequestInterceptor implements ClientHttpRequestInterceptor {

  public static final String INSTRUMENTATION_NAME = "io.microtrace.platform.http.client";

  private static final TextMapSetter<HttpHeaders> HEADER_SETTER =
      (carrier, key, value) -> {
        if (carrier != null) {
          carrier.set(key, value);
        }
      };

  private final Tracer tracer;
  private final TextMapPropagator propagator;

  public TracingClientHttpRequestInterceptor(OpenTelemetry openTelemetry) {
    Objects.requireNonNull(openTelemetry, "openTelemetry");
    this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
    this.propagator = openTelemetry.getPropagators().getTextMapPropagator();
  }

  @Override
  public ClientHttpResponse intercept(
      HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
    String method = request.getMethod().name();
    URI uri = request.getURI();

    var builder =
        tracer
            .spanBuilder(method)
            .setSpanKind(SpanKind.CLIENT)
            .setAttribute(HttpAttributes.HTTP_REQUEST_METHOD, method)
            .setAttribute(UrlAttributes.URL_FULL, uri.toString());
    if (uri.getHost() != null) {
      builder.setAttribute(ServerAttributes.SERVER_ADDRESS, uri.getHost());
    }
    if (uri.getPort() > 0) {
      builder.setAttribute(ServerAttributes.SERVER_PORT, (long) uri.getPort());
    }
    Span span = builder.startSpan();

    try (Scope ignored = span.makeCurrent()) {
      propagator.inject(Context.current(), request.getHeaders(), HEADER_SETTER);
      ClientHttpResponse response = execution.execute(request, body);
      int status = response.getStatusCode().value();
      span.setAttribute(HttpAttributes.HTTP_RESPONSE_STATUS_CODE, (long) status);
      if (status >= 400) {
        span.setAttribute(ErrorAttributes.ERROR_TYPE, Integer.toString(status));
        span.setStatus(StatusCode.ERROR);
      }
      return response;
    } catch (IOException | RuntimeException ex) {
      span.setAttribute(ErrorAttributes.ERROR_TYPE, ex.getClass().getName());
      span.recordException(ex);
      span.setStatus(StatusCode.ERROR);
      throw ex;
    } finally {
      span.end();
    }
  }
}
