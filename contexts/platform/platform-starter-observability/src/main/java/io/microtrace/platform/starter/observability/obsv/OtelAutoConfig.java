package io.microtrace.platform.starter.observability.obsv;

import static io.opentelemetry.semconv.ServiceAttributes.SERVICE_NAME;
import static io.opentelemetry.semconv.ServiceAttributes.SERVICE_VERSION;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.List;
import java.util.Optional;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

/**
 * Auto-configuration for OpenTelemetry tracing.
 *
 * <p>Beans provided: {@code Resource}, {@code SpanExporter}, {@link TracingBootstrap}, {@code
 * OpenTelemetry}, {@code Tracer}, plus a shutdown hook that flushes the tracer provider.
 */
@AutoConfiguration
@EnableConfigurationProperties(OtelProperties.class)
@ConditionalOnProperty(
    prefix = "microtrace.otel",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class OtelAutoConfig {

  public static final String DEFAULT_SERVICE_NAME = "microtrace";
  public static final String INSTRUMENTATION_SCOPE = "io.microtrace.platform";

  private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT_KEY =
      AttributeKey.stringKey("deployment.environment");

  // ------------------------------------------------------------------------------------
  // Resource
  // ------------------------------------------------------------------------------------

  /** Builds the {@link Resource} with service.name/version and deployment.environment. */
  @Bean
  @ConditionalOnMissingBean
  public Resource otelResource(
      Environment env, OtelProperties props, Optional<BuildProperties> build) {
    String serviceName =
        props.getServiceName() != null && !props.getServiceName().isBlank()
            ? props.getServiceName()
            : env.getProperty("spring.application.name", DEFAULT_SERVICE_NAME);
    String environment = env.getProperty("spring.profiles.active", "default");
    String version = build.map(BuildProperties::getVersion).orElse("0.0.0");

    Attributes attrs =
        Attributes.builder()
            .put(SERVICE_NAME, serviceName)
            .put(SERVICE_VERSION, version)
            .put(DEPLOYMENT_ENVIRONMENT_KEY, environment)
            .build();

    return Resource.getDefault().merge(Resource.create(attrs));
  }

  // ------------------------------------------------------------------------------------
  // Exporter
  // ------------------------------------------------------------------------------------

  /**
   * OTLP span exporter (gRPC/HTTP) per properties. With the exporter disabled, spans are built
   * and dropped. The tracer provider owns the exporter's shutdown.
   */
  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean
  public SpanExporter otelSpanExporter(OtelProperties props) {
    if (!props.isExporterEnabled()) {
      return SpanExporter.composite(List.of());
    }
    return props.getProtocol().isGrpc()
        ? OtlpGrpcSpanExporter.builder()
            .setEndpoint(props.getTracesEndpoint())
            .setTimeout(props.getExporterTimeout())
            .build()
        : OtlpHttpSpanExporter.builder()
            .setEndpoint(props.getTracesEndpoint())
            .setTimeout(props.getExporterTimeout())
            .build();
  }

  // ------------------------------------------------------------------------------------
  // Bootstrap + API beans
  // ------------------------------------------------------------------------------------

  @Bean
  @ConditionalOnMissingBean
  public TracingBootstrap tracingBootstrap(
      Resource resource, OtelProperties props, ObjectProvider<SpanExporter> exporter) {
    return new TracingBootstrap(resource, props, exporter::getObject);
  }

  @Bean
  @ConditionalOnMissingBean
  public OpenTelemetry openTelemetry(TracingBootstrap bootstrap) {
    return bootstrap.configure();
  }

  @Bean
  @ConditionalOnMissingBean
  public Tracer platformTracer(OpenTelemetry openTelemetry) {
    return openTelemetry.getTracer(INSTRUMENTATION_SCOPE);
  }

  /** Flushes and shuts down the tracer provider on context close. */
  @Bean
  public DisposableBean otelShutdownHook(TracingBootstrap bootstrap) {
    return bootstrap::shutdown;
  }
}
