package io.microtrace.analysis.api;

import io.microtrace.platform.domain.analysis.AnalysisResult;

public record AnalyzeResponse(double sum, double difference) {

  static AnalyzeResponse from(AnalysisResult result) {
    return new AnalyzeResponse(result.sum(), result.difference());
  }
}
