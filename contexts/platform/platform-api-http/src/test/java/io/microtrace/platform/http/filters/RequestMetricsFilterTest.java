package io.microtrace.platform.http.filters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.microtrace.platform.domain.error.AnalysisAbortedException;
import io.microtrace.platform.http.metrics.HttpRequestMetrics;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

class RequestMetricsFilterTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final RequestMetricsFilter filter =
      new RequestMetricsFilter(new HttpRequestMetrics(registry));

  @Test
  void successfulRequestCountsOnceWithResponseStatus() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    response.setStatus(200);

    filter.doFilter(
        routed("POST", "/analyze"), response, new MockFilterChain());

    assertThat(requestCount("POST", "/analyze", "200")).isEqualTo(1.0);
    assertThat(latency("POST", "/analyze").count()).isEqualTo(1L);
    assertThat(registry.find(HttpRequestMetrics.ERRORS).counters()).isEmpty();
  }

  @Test
  void undeclaredExceptionCountsAs500AndIsRethrownUnchanged() {
    IllegalStateException failure = new IllegalStateException("worker exploded");
    FilterChain failing =
        (req, res) -> {
          throw new ServletException("Request processing failed: " + failure, failure);
        };

    assertThatThrownBy(
            () ->
                filter.doFilter(
                    routed("POST", "/analyze"),
                    new MockHttpServletResponse(),
                    failing))
        .isInstanceOf(ServletException.class)
        .hasCause(failure);

    assertThat(requestCount("POST", "/analyze", "500")).isEqualTo(1.0);
    assertThat(latency("POST", "/analyze").count()).isEqualTo(1L);
    assertThat(errorCount("POST", "/analyze", "IllegalStateException")).isEqualTo(1.0);
  }

  @Test
  void runtimeExceptionIsCountedUnderItsOwnKind() {
    FilterChain failing =
        (req, res) -> {
          throw new ArithmeticException("/ by zero");
        };

    assertThatThrownBy(
            () ->
                filter.doFilter(
                    routed("GET", "/analyze"),
                    new MockHttpServletResponse(),
                    failing))
        .isInstanceOf(ArithmeticException.class);

    assertThat(errorCount("GET", "/analyze", "ArithmeticException")).isEqualTo(1.0);
    assertThat(requestCount("GET", "/analyze", "500")).isEqualTo(1.0);
  }

  @Test
  void declaredErrorUsesTheRenderedStatusAndCountsTheError() throws Exception {
    FilterChain advised =
        (req, res) -> {
          AnalysisAbortedException declared = new AnalysisAbortedException("aborted", null);
          RequestMetricsFilter.markDeclaredError((HttpServletRequest) req, declared);
          ((HttpServletResponse) res).setStatus(declared.status());
        };

    filter.doFilter(
        routed("POST", "/analyze"), new MockHttpServletResponse(), advised);

    assertThat(requestCount("POST", "/analyze", "503")).isEqualTo(1.0);
    assertThat(errorCount("POST", "/analyze", "AnalysisAbortedException")).isEqualTo(1.0);
    assertThat(latency("POST", "/analyze").count()).isEqualTo(1L);
  }

  @Test
  void requestCountEqualsLatencySamplesAcrossMixedOutcomes() throws Exception {
    int ok = 7;
    int failed = 3;
    for (int i = 0; i < ok; i++) {
      filter.doFilter(
          routed("POST", "/analyze"),
          new MockHttpServletResponse(),
          new MockFilterChain());
    }
    for (int i = 0; i < failed; i++) {
      assertThatThrownBy(
              () ->
                  filter.doFilter(
                      routed("POST", "/analyze"),
                      new MockHttpServletResponse(),
                      (req, res) -> {
                        throw new IllegalArgumentException("induced");
                      }))
          .isInstanceOf(IllegalArgumentException.class);
    }

    double total =
        registry.find(HttpRequestMetrics.REQUESTS).tag("path", "/analyze").counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    assertThat(total).isEqualTo(ok + failed);
    assertThat(latency("POST", "/analyze").count()).isEqualTo(ok + failed);
    assertThat(errorCount("POST", "/analyze", "IllegalArgumentException")).isEqualTo(failed);
  }

  @Test
  void errorDispatchIsNotCountedAgain() throws Exception {
    MockHttpServletRequest request = routed("POST", "/analyze");
    request.setDispatcherType(jakarta.servlet.DispatcherType.ERROR);

    filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

    assertThat(registry.find(HttpRequestMetrics.REQUESTS).counters()).isEmpty();
  }

  @Test
  void pathLabelIsTheRouteTemplateNotTheRawUri() throws Exception {
    for (String id : new String[] {"1", "2", "3"}) {
      MockHttpServletRequest request = new MockHttpServletRequest("GET", "/items/" + id);
      request.setAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE, "/items/{id}");
      filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());
    }

    assertThat(requestCount("GET", "/items/{id}", "200")).isEqualTo(3.0);
    assertThat(registry.find(HttpRequestMetrics.REQUESTS).counters()).hasSize(1);
  }

  @Test
  void unmatchedRequestsShareOneFallbackLabel() throws Exception {
    for (String uri : new String[] {"/nope", "/wp-admin", "/a/b/c"}) {
      MockHttpServletResponse response = new MockHttpServletResponse();
      response.setStatus(404);
      filter.doFilter(new MockHttpServletRequest("GET", uri), response, new MockFilterChain());
    }

    assertThat(requestCount("GET", HttpRequestMetrics.UNMATCHED_PATH, "404")).isEqualTo(3.0);
    assertThat(registry.find(HttpRequestMetrics.REQUESTS).tag("path", "/nope").counters())
        .isEmpty();
    assertThat(registry.find(HttpRequestMetrics.REQUESTS).counters()).hasSize(1);
  }

  /** Request as the handler mapping leaves it once {@code route} matched. */
  private static MockHttpServletRequest routed(String method, String route) {
    MockHttpServletRequest request = new MockHttpServletRequest(method, route);
    request.setAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE, route);
    return request;
  }

  private double requestCount(String method, String path, String status) {
    Counter c =
        registry
            .find(HttpRequestMetrics.REQUESTS)
            .tags("method", method, "path", path, "status", status)
            .counter();
    return c == null ? 0.0 : c.count();
  }

  private double errorCount(String method, String path, String exception) {
    Counter c =
        registry
            .find(HttpRequestMetrics.ERRORS)
            .tags("method", method, "path", path, "exception", exception)
            .counter();
    return c == null ? 0.0 : c.count();
  }

  private Timer latency(String method, String path) {
    return registry.get(HttpRequestMetrics.LATENCY).tags("method", method, "path", path).timer();
  }
}
