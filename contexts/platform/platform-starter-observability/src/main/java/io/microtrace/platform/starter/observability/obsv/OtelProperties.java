package io.microtrace.platform.starter.observability.obsv;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for OpenTelemetry tracing.
 *
 * <p>Prefix: {@code microtrace.otel}</p>
 *
 * <ul>
 *   <li>OTLP over HTTP/protobuf by default (port 4318, {@code /v1/traces}); gRPC on 4317.</li>
 *   <li>The traces endpoint may be set explicitly; otherwise it is derived from {@link #endpoint}
 *       and {@link #protocol}.</li>
 *   <li>Batching and timeouts default to the OTel SDK defaults.</li>
 *   <li>{@link #excludedPaths} are never traced (Ant patterns, matched on the request path).</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "microtrace.otel")
public class OtelProperties {

    /** Master switch for the tracing auto-configuration. */
    private boolean enabled = true;

    /** {@code service.name} resource attribute; falls back to {@code spring.application.name}. */
    private String serviceName;

    /** Transport protocol for OTLP. */
    @NotNull
    private Protocol protocol = Protocol.HTTP;

    /** Base collector endpoint, e.g. {@code http://otel-collector:4318}. */
    private String endpoint;

    /** Traces exporter endpoint. If unset, derived from {@link #endpoint} + {@link #protocol}. */
    private String tracesEndpoint;

    /** When false, spans are still created but dropped by a no-op exporter. */
    private boolean exporterEnabled = true;

    /** Exporter timeout. Default: 10s. */
    @NotNull
    private Duration exporterTimeout = Duration.ofSeconds(10);

    /** Batch schedule delay. Default: 5s. */
    @NotNull
    private Duration batchScheduleDelay = Duration.ofSeconds(5);

    /** Max queue size for the batch processor. Default: 2048. */
    @Min(1)
    private int batchMaxQueue = 2048;

    /** Max export batch size. Default: 512. */
    @Min(1)
    private int batchMaxExportBatchSize = 512;

    /** ParentBased(traceIdRatioBased) sampler ratio (0.0..1.0). Default: sample everything. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double traceSampleRatio = 1.0;

    /** Register the SDK as {@code GlobalOpenTelemetry} for libraries that look it up there. */
    private boolean registerGlobal = true;

    /** Request paths that never get a server span. */
    @NotNull
    private List<String> excludedPaths = new ArrayList<>(List.of("/metrics"));

    // ======== Derived endpoint logic ========

    private static final String DEFAULT_GRPC_BASE = "http://localhost:4317";
    private static final String DEFAULT_HTTP_BASE = "http://localhost:4318";
    private static final String HTTP_TRACES_PATH = "/v1/traces";

    /**
     * Returns the effective traces endpoint based on precedence:
     * <pre>
     * tracesEndpoint (if set)
     * else endpoint + protocol defaults
     * else protocol default (localhost)
     * </pre>
     */
    public String getTracesEndpoint() {
        if (isNonEmpty(tracesEndpoint)) {
            return tracesEndpoint;
        }
        return switch (protocol) {
            case GRPC -> nonEmptyOrDefault(endpoint, DEFAULT_GRPC_BASE);
            case HTTP -> ensureHttpPath(nonEmptyOrDefault(endpoint, DEFAULT_HTTP_BASE), HTTP_TRACES_PATH);
        };
    }

    private static String ensureHttpPath(String base, String requiredPath) {
        String normalized = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        return normalized.endsWith(requiredPath) ? normalized : normalized + requiredPath;
    }

    private static boolean isNonEmpty(String s) {
        return s != null && !s.isBlank();
    }

    private static String nonEmptyOrDefault(String value, String def) {
        return isNonEmpty(value) ? value : def;
    }

    // ======== Getters / Setters ========

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public void setProtocol(Protocol protocol) {
        this.protocol = protocol == null ? Protocol.HTTP : protocol;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /** For HTTP, do NOT include {@code /v1/traces}; it is appended automatically. */
    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public void setTracesEndpoint(String tracesEndpoint) {
        this.tracesEndpoint = tracesEndpoint;
    }

    public boolean isExporterEnabled() {
        return exporterEnabled;
    }

    public void setExporterEnabled(boolean exporterEnabled) {
        this.exporterEnabled = exporterEnabled;
    }

    public Duration getExporterTimeout() {
        return exporterTimeout;
    }

    public void setExporterTimeout(Duration exporterTimeout) {
        this.exporterTimeout = exporterTimeout == null ? Duration.ofSeconds(10) : exporterTimeout;
    }

    public Duration getBatchScheduleDelay() {
        return batchScheduleDelay;
    }

    public void setBatchScheduleDelay(Duration batchScheduleDelay) {
        this.batchScheduleDelay = batchScheduleDelay == null ? Duration.ofSeconds(5) : batchScheduleDelay;
    }

    public int getBatchMaxQueue() {
        return batchMaxQueue;
    }

    public void setBatchMaxQueue(int batchMaxQueue) {
        this.batchMaxQueue = Math.max(1, batchMaxQueue);
    }

    public int getBatchMaxExportBatchSize() {
        return batchMaxExportBatchSize;
    }

    public void setBatchMaxExportBatchSize(int batchMaxExportBatchSize) {
        this.batchMaxExportBatchSize = Math.max(1, batchMaxExportBatchSize);
    }

    public double getTraceSampleRatio() {
        return traceSampleRatio;
    }

    public void setTraceSampleRatio(double traceSampleRatio) {
        if (traceSampleRatio < 0.0) traceSampleRatio = 0.0;
        if (traceSampleRatio > 1.0) traceSampleRatio = 1.0;
        this.traceSampleRatio = traceSampleRatio;
    }

    public boolean isRegisterGlobal() {
        return registerGlobal;
    }

    public void setRegisterGlobal(boolean registerGlobal) {
        this.registerGlobal = registerGlobal;
    }

    public List<String> getExcludedPaths() {
        return Collections.unmodifiableList(excludedPaths);
    }

    public void setExcludedPaths(List<String> excludedPaths) {
        this.excludedPaths = excludedPaths == null ? new ArrayList<>() : new ArrayList<>(excludedPaths);
    }

    // ======== Types ========

    public enum Protocol {
        GRPC, HTTP;
        public boolean isGrpc() { return this == GRPC; }
    }
}
