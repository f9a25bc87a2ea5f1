package io.microtrace.platform.domain.analysis;

/**
 * Immutable outcome of one analysis call.
 *
 * <p>Value semantics only: two results are equal when both numbers are equal. Nothing is
 * persisted.
 *
 * @param sum {@code a + b}
 * @param difference {@code a - b}
 */
public record AnalysisResult(double sum, double difference) {

  /**
   * Computes the result for the given operands.
   *
   * @param a first operand
   * @param b second operand
   * @return {@code {a + b, a - b}}
   */
  public static AnalysisResult of(double a, double b) {
    return new AnalysisResult(a + b, a - b);
  }
}
