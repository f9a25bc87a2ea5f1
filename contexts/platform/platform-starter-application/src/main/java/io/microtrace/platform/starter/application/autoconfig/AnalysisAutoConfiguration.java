package io.microtrace.platform.starter.application.autoconfig;

import io.microtrace.platform.application.analysis.AnalysisWorker;
import io.microtrace.platform.application.analysis.ChaosSettings;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the analysis worker. Uses the platform {@link Tracer} when tracing is
 * configured and a no-op tracer otherwise.
 */
@AutoConfiguration(
    afterName = "io.microtrace.platform.starter.observability.obsv.OtelAutoConfig")
@EnableConfigurationProperties(ChaosProperties.class)
public class AnalysisAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(AnalysisAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  ChaosSettings chaosSettings(ChaosProperties props) {
    ChaosSettings settings = props.toSettings();
    log.atInfo()
        .addKeyValue("chaos_enabled", settings.enabled())
        .addKeyValue("probability", settings.probability())
        .addKeyValue("on_interrupt", settings.onInterrupt())
        .log("analysis_worker_configured");
    return settings;
  }

  @Bean
  @ConditionalOnMissingBean
  AnalysisWorker analysisWorker(ObjectProvider<Tracer> tracer, ChaosSettings settings) {
    Tracer t =
        tracer.getIfAvailable(() -> OpenTelemetry.noop().getTracer(AnalysisWorker.class.getName()));
    return new AnalysisWorker(t, settings);
  }
}
