package io.microtrace.platform.application.analysis;

import io.microtrace.platform.domain.analysis.AnalysisResult;
import io.microtrace.platform.domain.error.AnalysisAbortedException;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Small worker simulating a call into another service.
 *
 * <p>Every call sleeps for {@link ChaosSettings#baselineDelay()} so timings show up in metrics and
 * traces. When chaos is enabled, a call is additionally delayed, with probability {@link
 * ChaosSettings#probability()}, by a duration drawn uniformly from {@code [minDelay, maxDelay]}.
 * The decision and the delay are drawn independently on each call.
 *
 * <p>Each call runs inside an INTERNAL span named {@value #SPAN_NAME} carrying the inputs, outputs
 * and chaos attributes.
 *
 * <p>Thread-safety: stateless apart from immutable settings; safe for concurrent use.
 */
public class AnalysisWorker {

  private static final Logger log = LoggerFactory.getLogger(AnalysisWorker.class);

  public static final String SPAN_NAME = "AnalysisWorker.analyze";

  static final AttributeKey<Double> INPUT_A = AttributeKey.doubleKey("worker.input_a");
  static final AttributeKey<Double> INPUT_B = AttributeKey.doubleKey("worker.input_b");
  static final AttributeKey<Boolean> CHAOS_ENABLED =
      AttributeKey.booleanKey("worker.chaos_enabled");
  static final AttributeKey<Double> CHAOS_DELAY_MS = AttributeKey.doubleKey("worker.chaos_delay_ms");
  static final AttributeKey<Double> SUM = AttributeKey.doubleKey("worker.sum");
  static final AttributeKey<Double> DIFFERENCE = AttributeKey.doubleKey("worker.difference");

  private final Tracer tracer;
  private final ChaosSettings chaos;

  public AnalysisWorker(Tracer tracer, ChaosSettings chaos) {
    this.tracer = Objects.requireNonNull(tracer, "tracer");
    this.chaos = Objects.requireNonNull(chaos, "chaos");
  }

  /**
   * Computes {@code {a + b, a - b}} after the simulated delays.
   *
   * @throws AnalysisAbortedException when interrupted mid-delay under {@link
   *     ChaosSettings.InterruptPolicy#ABORT}
   */
  public AnalysisResult analyze(double a, double b) {
    Span span = tracer.spanBuilder(SPAN_NAME).setSpanKind(SpanKind.INTERNAL).startSpan();
    try (Scope ignored = span.makeCurrent()) {
      span.setAttribute(INPUT_A, a);
      span.setAttribute(INPUT_B, b);

      pause(chaos.baselineDelay());

      span.setAttribute(CHAOS_ENABLED, chaos.enabled());
      if (chaos.enabled() && ThreadLocalRandom.current().nextDouble() < chaos.probability()) {
        Duration delay = drawChaosDelay();
        double delayMs = roundMillis(delay);
        span.setAttribute(CHAOS_DELAY_MS, delayMs);
        log.atInfo()
            .addKeyValue("delay_ms", delayMs)
            .addKeyValue("probability", chaos.probability())
            .log("chaos_injected");
        pause(delay);
      }

      AnalysisResult result = AnalysisResult.of(a, b);
      span.setAttribute(SUM, result.sum());
      span.setAttribute(DIFFERENCE, result.difference());
      log.atDebug()
          .addKeyValue("input_a", a)
          .addKeyValue("input_b", b)
          .addKeyValue("sum", result.sum())
          .addKeyValue("difference", result.difference())
          .log("analysis_completed");
      return result;
    } catch (RuntimeException ex) {
      span.recordException(ex);
      span.setStatus(StatusCode.ERROR);
      throw ex;
    } finally {
      span.end();
    }
  }

  public ChaosSettings settings() {
    return chaos;
  }

  private Duration drawChaosDelay() {
    long min = chaos.minDelay().toNanos();
    long max = chaos.maxDelay().toNanos();
    if (max == min) {
      return chaos.minDelay();
    }
    // nextLong(origin, bound) excludes the bound; +1 keeps maxDelay reachable.
    return Duration.ofNanos(ThreadLocalRandom.current().nextLong(min, max + 1));
  }

  private void pause(Duration delay) {
    if (delay.isZero()) {
      return;
    }
    try {
      Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      if (chaos.onInterrupt() == ChaosSettings.InterruptPolicy.ABORT) {
        throw new AnalysisAbortedException("Analysis interrupted during simulated delay", ex);
      }
      log.atWarn().addKeyValue("delay_ms", roundMillis(delay)).log("analysis_delay_interrupted");
    }
  }

  private static double roundMillis(Duration d) {
    return Math.round(d.toNanos() / 1_000.0) / 1_000.0;
  }
}
