package io.microtrace.platform.starter.observability.obsv;

import io.microtrace.platform.http.client.TracingClientHttpRequestInterceptor;
import io.microtrace.platform.http.filters.ServerTracingFilter;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.baggage.propagation.W3CBaggagePropagator;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-time construction of the process tracing stack.
 *
 * <p>Two independent initialisation steps, each performed at most once per instance:
 *
 * <ol>
 *   <li>{@link #configure()}: builds the {@link OpenTelemetrySdk} (resource, sampler, W3C
 *       propagators, a {@link BatchSpanProcessor} over the exporter) and the outbound client
 *       interceptor. The exporter supplier is invoked exactly once.
 *   <li>{@link #instrumentServer()}: builds the {@link ServerTracingFilter} for inbound requests,
 *       configuring the SDK first if needed.
 * </ol>
 *
 * <p>Repeated calls return the instances built the first time. Both steps are guarded by a single
 * lock, so concurrent callers during startup observe one provider.
 */
public final class TracingBootstrap {

  private static final Logger log = LoggerFactory.getLogger(TracingBootstrap.class);

  private final Resource resource;
  private final OtelProperties props;
  private final Supplier<SpanExporter> exporterFactory;

  private final Object lock = new Object();
  private volatile OpenTelemetrySdk sdk;
  private volatile TracingClientHttpRequestInterceptor clientInterceptor;
  private volatile ServerTracingFilter serverFilter;

  public TracingBootstrap(
      Resource resource, OtelProperties props, Supplier<SpanExporter> exporterFactory) {
    this.resource = Objects.requireNonNull(resource, "resource");
    this.props = Objects.requireNonNull(props, "props");
    this.exporterFactory = Objects.requireNonNull(exporterFactory, "exporterFactory");
  }

  /** Returns the SDK, building it on first use. */
  public OpenTelemetrySdk configure() {
    OpenTelemetrySdk current = sdk;
    if (current != null) {
      return current;
    }
    synchronized (lock) {
      if (sdk == null) {
        OpenTelemetrySdk built = build();
        clientInterceptor = new TracingClientHttpRequestInterceptor(built);
        sdk = built;
        log.atInfo()
            .addKeyValue("exporter_endpoint", props.isExporterEnabled() ? props.getTracesEndpoint() : "none")
            .addKeyValue("protocol", props.getProtocol().name())
            .log("tracing_initialized");
      }
      return sdk;
    }
  }

  /** Returns the inbound request filter, building it (and the SDK) on first use. */
  public ServerTracingFilter instrumentServer() {
    ServerTracingFilter current = serverFilter;
    if (current != null) {
      return current;
    }
    synchronized (lock) {
      if (serverFilter == null) {
        serverFilter = new ServerTracingFilter(configure(), props.getExcludedPaths());
        log.atInfo()
            .addKeyValue("excluded_paths", props.getExcludedPaths())
            .log("server_instrumented");
      }
      return serverFilter;
    }
  }

  /** Interceptor adding CLIENT spans to outbound HTTP calls. */
  public TracingClientHttpRequestInterceptor clientInterceptor() {
    configure();
    return clientInterceptor;
  }

  public boolean isConfigured() {
    return sdk != null;
  }

  public boolean isServerInstrumented() {
    return serverFilter != null;
  }

  /** The tracer provider built by {@link #configure()}. */
  public SdkTracerProvider tracerProvider() {
    return configure().getSdkTracerProvider();
  }

  /** Flushes pending spans and shuts the provider down. No-op when never configured. */
  public void shutdown() {
    OpenTelemetrySdk current = sdk;
    if (current == null) {
      return;
    }
    current.getSdkTracerProvider().shutdown().join(props.getExporterTimeout().toMillis(), TimeUnit.MILLISECONDS);
  }

  private OpenTelemetrySdk build() {
    BatchSpanProcessor spanProcessor =
        BatchSpanProcessor.builder(exporterFactory.get())
            .setScheduleDelay(props.getBatchScheduleDelay())
            .setExporterTimeout(props.getExporterTimeout())
            .setMaxQueueSize(props.getBatchMaxQueue())
            .setMaxExportBatchSize(props.getBatchMaxExportBatchSize())
            .build();

    SdkTracerProvider tracerProvider =
        SdkTracerProvider.builder()
            .setResource(resource)
            .addSpanProcessor(spanProcessor)
            .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(props.getTraceSampleRatio())))
            .build();

    ContextPropagators propagators =
        ContextPropagators.create(
            TextMapPropagator.composite(
                W3CTraceContextPropagator.getInstance(), W3CBaggagePropagator.getInstance()));

    OpenTelemetrySdk built =
        OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(propagators)
            .build();

    if (props.isRegisterGlobal()) {
      try {
        GlobalOpenTelemetry.set(built);
      } catch (IllegalStateException ex) {
        log.atWarn()
            .setCause(ex)
            .log("global_opentelemetry_already_set; keeping the existing global instance");
      }
    }
    return built;
  }
}
