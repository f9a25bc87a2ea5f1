package io.microtrace.platform.starter.observability.obsv;

import io.microtrace.platform.http.metrics.HttpRequestMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Process-wide metrics registry rendered in the Prometheus text exposition format, plus the
 * request meters recorded by the web filters.
 */
@AutoConfiguration
public class MetricsAutoConfig {

  @Bean
  @ConditionalOnMissingBean
  public PrometheusMeterRegistry prometheusMeterRegistry() {
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  @Bean
  @ConditionalOnMissingBean
  public HttpRequestMetrics httpRequestMetrics(MeterRegistry registry) {
    return new HttpRequestMetrics(registry);
  }
}
