package io.microtrace.platform.starter.core.web.autoconfig;

import static jakarta.servlet.DispatcherType.ASYNC;
import static jakarta.servlet.DispatcherType.ERROR;
import static jakarta.servlet.DispatcherType.REQUEST;

import io.microtrace.platform.http.filters.RequestIdFilter;
import io.microtrace.platform.http.filters.RequestMetricsFilter;
import io.microtrace.platform.http.filters.ServerTracingFilter;
import io.microtrace.platform.http.metrics.HttpRequestMetrics;
import io.microtrace.platform.starter.observability.obsv.MetricsAutoConfig;
import io.microtrace.platform.starter.observability.obsv.OtelAutoConfig;
import io.microtrace.platform.starter.observability.obsv.TracingBootstrap;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.Filter;
import java.util.EnumSet;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.boot.web.client.RestTemplateCustomizer;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.DispatcherServlet;

/**
 * Core, always-on web wiring (no domain/app coupling).
 *
 * <ul>
 *   <li>RequestIdFilter (request id / MDC / response header)
 *   <li>ServerTracingFilter (one SERVER span per request) when tracing is configured
 *   <li>RequestMetricsFilter (request count, latency, errors)
 *   <li>CLIENT spans on {@code RestClient} and {@code RestTemplate} built by Boot
 * </ul>
 *
 * <p>Filter orders nest them as request id, then tracing, then metrics.
 */
@AutoConfiguration(after = {OtelAutoConfig.class, MetricsAutoConfig.class})
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass(DispatcherServlet.class)
@EnableConfigurationProperties(RequestIdProperties.class)
public class CoreWebAutoConfiguration {

  private static final EnumSet<DispatcherType> DEFAULT_DISPATCHERS =
      EnumSet.of(REQUEST, ERROR, ASYNC);

  // -----------------------------------------------------------------------------------------------
  // Request Id
  // -----------------------------------------------------------------------------------------------

  /**
   * Registers {@link RequestIdFilter} with the configured header.
   *
   * @param p request id properties
   * @return filter registration bean
   */
  @Bean(name = "requestIdFilterRegistration")
  @ConditionalOnProperty(
      prefix = "microtrace.web.request-id",
      name = "enabled",
      matchIfMissing = true)
  @ConditionalOnMissingBean(name = "requestIdFilterRegistration")
  public FilterRegistrationBean<RequestIdFilter> requestIdFilter(RequestIdProperties p) {
    return register(new RequestIdFilter(p.getHeader()), RequestIdFilter.ORDER);
  }

  // -----------------------------------------------------------------------------------------------
  // Tracing
  // -----------------------------------------------------------------------------------------------

  /** Registers the server filter built once by {@link TracingBootstrap#instrumentServer()}. */
  @Bean(name = "serverTracingFilterRegistration")
  @ConditionalOnBean(TracingBootstrap.class)
  @ConditionalOnMissingBean(name = "serverTracingFilterRegistration")
  public FilterRegistrationBean<ServerTracingFilter> serverTracingFilter(
      TracingBootstrap bootstrap) {
    return register(bootstrap.instrumentServer(), ServerTracingFilter.ORDER);
  }

  /** Adds CLIENT spans to every {@code RestClient.Builder} Boot hands out. */
  @Bean
  @ConditionalOnBean(TracingBootstrap.class)
  public RestClientCustomizer tracingRestClientCustomizer(TracingBootstrap bootstrap) {
    return builder -> builder.requestInterceptor(bootstrap.clientInterceptor());
  }

  /** Adds CLIENT spans to every {@code RestTemplate} built from {@code RestTemplateBuilder}. */
  @Bean
  @ConditionalOnBean(TracingBootstrap.class)
  public RestTemplateCustomizer tracingRestTemplateCustomizer(TracingBootstrap bootstrap) {
    return restTemplate -> restTemplate.getInterceptors().add(bootstrap.clientInterceptor());
  }

  // -----------------------------------------------------------------------------------------------
  // Metrics
  // -----------------------------------------------------------------------------------------------

  @Bean(name = "requestMetricsFilterRegistration")
  @ConditionalOnBean(HttpRequestMetrics.class)
  @ConditionalOnProperty(
      prefix = "microtrace.web.metrics",
      name = "enabled",
      matchIfMissing = true)
  @ConditionalOnMissingBean(name = "requestMetricsFilterRegistration")
  public FilterRegistrationBean<RequestMetricsFilter> requestMetricsFilter(
      HttpRequestMetrics metrics) {
    return register(new RequestMetricsFilter(metrics), RequestMetricsFilter.ORDER);
  }

  private static <F extends Filter> FilterRegistrationBean<F> register(
      F filter, int order) {
    var reg = new FilterRegistrationBean<>(filter);
    reg.setDispatcherTypes(DEFAULT_DISPATCHERS);
    reg.setOrder(order);
    reg.addUrlPatterns("/*");
    reg.setAsyncSupported(true);
    return reg;
  }
}
