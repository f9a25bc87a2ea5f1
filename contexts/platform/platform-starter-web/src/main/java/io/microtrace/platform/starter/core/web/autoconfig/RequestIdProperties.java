package io.microtrace.platform.starter.core.web.autoconfig;

import io.microtrace.platform.http.filters.RequestIdFilter;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Request id handling for inbound requests.
 *
 * <p>Binds to {@code microtrace.web.request-id.*}.
 */
@Validated
@ConfigurationProperties(prefix = "microtrace.web.request-id")
public class RequestIdProperties {

  /** Enable the request id filter. */
  private boolean enabled = true;

  /** Header read from the request and echoed on the response. */
  @NotBlank private String header = RequestIdFilter.DEFAULT_HEADER;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getHeader() {
    return header;
  }

  public void setHeader(String header) {
    this.header = header;
  }
}
