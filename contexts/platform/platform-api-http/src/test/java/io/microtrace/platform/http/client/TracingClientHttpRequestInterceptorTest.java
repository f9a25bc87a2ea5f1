package io.microtrace.platform.http.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

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
import io.opentelemetry.semconv.ServerAttributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

class TracingClientHttpRequestInterceptorTest {

  private InMemorySpanExporter spans;
  private OpenTelemetrySdk otel;
  private RestTemplate restTemplate;
  private MockRestServiceServer server;

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
    restTemplate = new RestTemplate();
    restTemplate.getInterceptors().add(new TracingClientHttpRequestInterceptor(otel));
    server = MockRestServiceServer.bindTo(restTemplate).build();
  }

  @AfterEach
  void tearDown() {
    otel.getSdkTracerProvider().shutdown();
  }

  @Test
  void createsClientSpanAndInjectsTraceparent() {
    server
        .expect(requestTo("http://downstream.local:8081/ping"))
        .andExpect(header("traceparent", startsWith("00-")))
        .andRespond(withSuccess("pong", MediaType.TEXT_PLAIN));

    String body = restTemplate.getForObject("http://downstream.local:8081/ping", String.class);

    assertThat(body).isEqualTo("pong");
    server.verify();
    SpanData span = spans.getFinishedSpanItems().get(0);
    assertThat(span.getKind()).isEqualTo(SpanKind.CLIENT);
    assertThat(span.getName()).isEqualTo("GET");
    assertThat(span.getAttributes().get(HttpAttributes.HTTP_RESPONSE_STATUS_CODE)).isEqualTo(200L);
    assertThat(span.getAttributes().get(ServerAttributes.SERVER_ADDRESS))
        .isEqualTo("downstream.local");
    assertThat(span.getAttributes().get(ServerAttributes.SERVER_PORT)).isEqualTo(8081L);
  }

  @Test
  void serverErrorsMarkTheClientSpan() {
    server.expect(requestTo("http://downstream.local/fail")).andRespond(withServerError());

    assertThatThrownBy(() -> restTemplate.getForObject("http://downstream.local/fail", String.class))
        .isInstanceOf(HttpServerErrorException.class);

    SpanData span = spans.getFinishedSpanItems().get(0);
    assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    assertThat(span.getAttributes().get(HttpAttributes.HTTP_RESPONSE_STATUS_CODE)).isEqualTo(500L);
  }
}
