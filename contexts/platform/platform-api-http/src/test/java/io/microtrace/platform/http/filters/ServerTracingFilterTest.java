package io.microtrace.platform.http.filters;

import static io.opentelemetry.api.common.AttributeKey.stringKey;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.microtrace.platform.http.context.RequestIdContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.semconv.HttpAttributes;
import io.opentelemetry.semconv.UrlAttributes;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

class ServerTracingFilterTest {

  private InMemorySpanExporter spans;
  private OpenTelemetrySdk otel;
  private ServerTracingFilter filter;

  @BeforeEach
  void setUp() {
    spans = InMemorySpanExporter.create();
    otel =
        OpenTelemetrySdk.builder()
            .setTracerProvider(
                SdkTracerProvider.builder()
                    .addSpanProcessor(SimpleSpanProcessor.create(spans))
                    .build())
            .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
            .build();
    filter = new ServerTracingFilter(otel, List.of("/metrics"));
  }

  @AfterEach
  void tearDown() {
    otel.getSdkTracerProvider().shutdown();
    MDC.clear();
  }

  @Test
  void createsOneServerSpanPerRequest() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/analyze");
    request.setAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE, "/analyze");
    MockHttpServletResponse response = new MockHttpServletResponse();

    try (RequestIdContext.Scope ignored = RequestIdContext.open("abc-123")) {
      filter.doFilter(request, response, new MockFilterChain());
    }

    List<SpanData> finished = spans.getFinishedSpanItems();
    assertThat(finished).hasSize(1);
    SpanData span = finished.get(0);
    assertThat(span.getKind()).isEqualTo(SpanKind.SERVER);
    assertThat(span.getName()).isEqualTo("POST /analyze");
    assertThat(span.getAttributes().get(HttpAttributes.HTTP_REQUEST_METHOD)).isEqualTo("POST");
    assertThat(span.getAttributes().get(UrlAttributes.URL_PATH)).isEqualTo("/analyze");
    assertThat(span.getAttributes().get(HttpAttributes.HTTP_ROUTE)).isEqualTo("/analyze");
    assertThat(span.getAttributes().get(HttpAttributes.HTTP_RESPONSE_STATUS_CODE)).isEqualTo(200L);
    assertThat(span.getAttributes().get(stringKey(ServerTracingFilter.REQUEST_ID_ATTRIBUTE)))
        .isEqualTo("abc-123");
  }

  @Test
  void excludedPathsProduceNoSpan() throws Exception {
    filter.doFilter(
        new MockHttpServletRequest("GET", "/metrics"),
        new MockHttpServletResponse(),
        new MockFilterChain());

    assertThat(spans.getFinishedSpanItems()).isEmpty();
  }

  @Test
  void continuesAnIncomingW3cTrace() throws Exception {
    String traceId = "4bf92f3577b34da6a3ce929d0e0e4736";
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/analyze");
    request.addHeader("traceparent", "00-" + traceId + "-00f067aa0ba902b7-01");

    filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

    SpanData span = spans.getFinishedSpanItems().get(0);
    assertThat(span.getTraceId()).isEqualTo(traceId);
    assertThat(span.getParentSpanId()).isEqualTo("00f067aa0ba902b7");
  }

  @Test
  void exposesTraceIdsInMdcOnlyWhileTheRequestRuns() throws Exception {
    AtomicReference<String> traceId = new AtomicReference<>();

    filter.doFilter(
        new MockHttpServletRequest("POST", "/analyze"),
        new MockHttpServletResponse(),
        (req, res) -> traceId.set(MDC.get(ServerTracingFilter.MDC_TRACE_ID)));

    assertThat(traceId.get()).isEqualTo(spans.getFinishedSpanItems().get(0).getTraceId());
    assertThat(MDC.get(ServerTracingFilter.MDC_TRACE_ID)).isNull();
    assertThat(MDC.get(ServerTracingFilter.MDC_SPAN_ID)).isNull();
  }

  @Test
  void escapingExceptionMarksTheSpanAsError() {
    assertThatThrownBy(
            () ->
                filter.doFilter(
                    new MockHttpServletRequest("POST", "/analyze"),
                    new MockHttpServletResponse(),
                    (req, res) -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class);

    SpanData span = spans.getFinishedSpanItems().get(0);
    assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    assertThat(span.getAttributes().get(HttpAttributes.HTTP_RESPONSE_STATUS_CODE)).isEqualTo(500L);
    assertThat(span.getEvents()).anySatisfy(e -> assertThat(e.getName()).isEqualTo("exception"));
  }

  @Test
  void serverErrorStatusMarksTheSpanAsError() throws Exception {
    filter.doFilter(
        new MockHttpServletRequest("POST", "/analyze"),
        new MockHttpServletResponse(),
        (req, res) -> ((HttpServletResponse) res).setStatus(503));

    SpanData span = spans.getFinishedSpanItems().get(0);
    assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    assertThat(span.getAttributes().get(HttpAttributes.HTTP_RESPONSE_STATUS_CODE)).isEqualTo(503L);
  }
}
