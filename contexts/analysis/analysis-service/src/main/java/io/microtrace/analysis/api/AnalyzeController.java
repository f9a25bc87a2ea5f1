package io.microtrace.analysis.api;

import io.microtrace.platform.application.analysis.AnalysisWorker;
import io.microtrace.platform.domain.analysis.AnalysisResult;
import jakarta.validation.Valid;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AnalyzeController {

  private static final Logger log = LoggerFactory.getLogger(AnalyzeController.class);

  private final AnalysisWorker worker;

  public AnalyzeController(AnalysisWorker worker) {
    this.worker = Objects.requireNonNull(worker, "worker");
  }

  @PostMapping(
      path = "/analyze",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public AnalyzeResponse analyze(@Valid @RequestBody AnalyzeRequest request) {
    log.atInfo()
        .addKeyValue("input_a", request.a())
        .addKeyValue("input_b", request.b())
        .log("analyze_request");

    AnalysisResult result = worker.analyze(request.a(), request.b());

    log.atInfo()
        .addKeyValue("sum", result.sum())
        .addKeyValue("difference", result.difference())
        .log("analyze_response");
    return AnalyzeResponse.from(result);
  }
}
