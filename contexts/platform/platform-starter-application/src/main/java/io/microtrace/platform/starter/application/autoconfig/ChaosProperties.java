package io.microtrace.platform.starter.application.autoconfig;

import io.microtrace.platform.application.analysis.ChaosSettings;
import io.microtrace.platform.application.analysis.ChaosSettings.InterruptPolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Chaos injection for the analysis worker. Prefix: {@code microtrace.chaos}.
 *
 * <p>{@code enabled} is kept as raw text so any value of the {@code CHAOS_ENABLED} environment
 * variable binds; only {@code "true"} (case-insensitive) switches chaos on.
 */
@Validated
@ConfigurationProperties(prefix = "microtrace.chaos")
public class ChaosProperties {

  /** Raw chaos flag. */
  private String enabled = "false";

  /** Probability that a call receives the extra delay. */
  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double probability = ChaosSettings.DEFAULT_PROBABILITY;

  /** Lower bound of the extra delay. */
  @NotNull
  private Duration minDelay = ChaosSettings.DEFAULT_MIN_DELAY;

  /** Upper bound of the extra delay. */
  @NotNull
  private Duration maxDelay = ChaosSettings.DEFAULT_MAX_DELAY;

  /** Delay paid by every call. */
  @NotNull
  private Duration baselineDelay = ChaosSettings.DEFAULT_BASELINE_DELAY;

  /** Reaction to a thread interrupt while the worker sleeps. */
  private InterruptPolicy onInterrupt = InterruptPolicy.COMPLETE;

  public ChaosSettings toSettings() {
    return new ChaosSettings(
        ChaosSettings.parseFlag(enabled),
        probability,
        minDelay,
        maxDelay,
        baselineDelay,
        onInterrupt);
  }

  public String getEnabled() {
    return enabled;
  }

  public void setEnabled(String v) {
    this.enabled = v;
  }

  public double getProbability() {
    return probability;
  }

  public void setProbability(double v) {
    this.probability = v;
  }

  public Duration getMinDelay() {
    return minDelay;
  }

  public void setMinDelay(Duration v) {
    this.minDelay = v;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public void setMaxDelay(Duration v) {
    this.maxDelay = v;
  }

  public Duration getBaselineDelay() {
    return baselineDelay;
  }

  public void setBaselineDelay(Duration v) {
    this.baselineDelay = v;
  }

  public InterruptPolicy getOnInterrupt() {
    return onInterrupt;
  }

  public void setOnInterrupt(InterruptPolicy v) {
    this.onInterrupt = v;
  }
}
