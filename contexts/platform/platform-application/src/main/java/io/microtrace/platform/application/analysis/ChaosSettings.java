package io.microtrace.platform.application.analysis;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable tuning for {@link AnalysisWorker}: the baseline delay every call pays, and the
 * optional randomized extra delay ("chaos") used to produce visible tail latency.
 *
 * @param enabled whether chaos injection is active at all
 * @param probability chance in {@code [0, 1]} that a call receives an extra delay
 * @param minDelay lower bound of the extra delay (inclusive)
 * @param maxDelay upper bound of the extra delay (inclusive)
 * @param baselineDelay delay applied to every call
 * @param onInterrupt what to do when the calling thread is interrupted while sleeping
 */
public record ChaosSettings(
    boolean enabled,
    double probability,
    Duration minDelay,
    Duration maxDelay,
    Duration baselineDelay,
    InterruptPolicy onInterrupt) {

  public static final double DEFAULT_PROBABILITY = 0.05;
  public static final Duration DEFAULT_MIN_DELAY = Duration.ofMillis(100);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(200);
  public static final Duration DEFAULT_BASELINE_DELAY = Duration.ofMillis(10);

  /** Reaction to a thread interrupt during the simulated delays. */
  public enum InterruptPolicy {
    /** Restore the interrupt flag, stop sleeping and still return the result. */
    COMPLETE,
    /** Restore the interrupt flag and fail the call with a declared 503. */
    ABORT
  }

  public ChaosSettings {
    if (Double.isNaN(probability) || probability < 0.0 || probability > 1.0) {
      throw new IllegalArgumentException("probability must be within [0, 1], got: " + probability);
    }
    Objects.requireNonNull(minDelay, "minDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    Objects.requireNonNull(baselineDelay, "baselineDelay");
    if (minDelay.isNegative() || baselineDelay.isNegative()) {
      throw new IllegalArgumentException("delays must not be negative");
    }
    if (maxDelay.compareTo(minDelay) < 0) {
      throw new IllegalArgumentException(
          "maxDelay (" + maxDelay + ") must be >= minDelay (" + minDelay + ")");
    }
    onInterrupt = (onInterrupt == null ? InterruptPolicy.COMPLETE : onInterrupt);
  }

  /** Defaults with chaos switched off. */
  public static ChaosSettings disabled() {
    return withFlag(false);
  }

  /** Defaults with the given chaos flag. */
  public static ChaosSettings withFlag(boolean enabled) {
    return new ChaosSettings(
        enabled,
        DEFAULT_PROBABILITY,
        DEFAULT_MIN_DELAY,
        DEFAULT_MAX_DELAY,
        DEFAULT_BASELINE_DELAY,
        InterruptPolicy.COMPLETE);
  }

  /**
   * Interprets a raw flag value such as the {@code CHAOS_ENABLED} environment variable. Only
   * {@code "true"} in any case enables chaos. Any other value disables it, including {@code null}
   * and {@code " true "} with blanks around it.
   */
  public static boolean parseFlag(String raw) {
    return raw != null && "true".equals(raw.toLowerCase(Locale.ROOT));
  }

  public ChaosSettings withProbability(double newProbability) {
    return new ChaosSettings(
        enabled, newProbability, minDelay, maxDelay, baselineDelay, onInterrupt);
  }

  public ChaosSettings withInterruptPolicy(InterruptPolicy policy) {
    return new ChaosSettings(enabled, probability, minDelay, maxDelay, baselineDelay, policy);
  }
}
