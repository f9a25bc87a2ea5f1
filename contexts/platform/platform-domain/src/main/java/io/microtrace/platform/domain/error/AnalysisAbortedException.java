package io.microtrace.platform.domain.error;

import java.io.Serial;

/** Raised when an analysis is cut short because its thread was interrupted mid-delay. */
public class AnalysisAbortedException extends MicroTraceException {

  @Serial private static final long serialVersionUID = 1L;

  public AnalysisAbortedException(String detail, Throwable cause) {
    super(
        ProblemTypes.ANALYSIS_ABORTED,
        ProblemTypes.ANALYSIS_ABORTED.defaultStatus(),
        detail,
        cause);
  }
}
