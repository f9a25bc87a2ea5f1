package io.microtrace.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Analysis service: {@code POST /analyze} and {@code GET /metrics}. */
@SpringBootApplication
public class MicroTraceApplication {

  public static void main(String[] args) {
    SpringApplication.run(MicroTraceApplication.class, args);
  }
}
