package io.microtrace.analysis.api;

import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /analyze}.
 *
 * @param a first number to analyze
 * @param b second number to analyze
 */
public record AnalyzeRequest(@NotNull Double a, @NotNull Double b) {}
