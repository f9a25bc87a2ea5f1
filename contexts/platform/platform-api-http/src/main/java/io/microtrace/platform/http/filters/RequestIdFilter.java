package io.microtrace.platform.http.filters;

import io.microtrace.platform.http.context.RequestIdContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Request id filter for Servlet applications.
 *
 * <p>Responsibilities:
 *
 * <ul>
 *   <li>Reads the id from a configurable header (default {@value #DEFAULT_HEADER}); generates a
 *       random UUID v4 when the header is missing or blank.
 *   <li>Publishes it through {@link RequestIdContext} for the whole downstream chain and as the
 *       request attribute {@link #REQUEST_ATTR_REQUEST_ID}.
 *   <li>Echoes it on the response under the same header, before the chain runs, so the header is
 *       present even when a downstream component throws.
 * </ul>
 *
 * <p>The filter also runs on the ERROR dispatch and reuses the id stored on the request, so the
 * container's error page answers with the same id. Stateless and thread-safe. Must run first:
 * tracing and metrics filters rely on the id being in place.
 */
@Order(RequestIdFilter.ORDER)
public final class RequestIdFilter extends OncePerRequestFilter {

  /** Outermost of the platform filters. */
  public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

  public static final String DEFAULT_HEADER = "X-Request-ID";

  /** Request attribute holding the resolved id (available to downstream handlers). */
  public static final String REQUEST_ATTR_REQUEST_ID =
      RequestIdFilter.class.getName() + ".REQUEST_ID";

  private final String headerName;

  public RequestIdFilter() {
    this(DEFAULT_HEADER);
  }

  /**
   * @param headerName header to read from and echo to; blank falls back to {@value
   *     #DEFAULT_HEADER}
   */
  public RequestIdFilter(String headerName) {
    this.headerName =
        (headerName == null || headerName.isBlank()) ? DEFAULT_HEADER : headerName.trim();
  }

  public String getHeaderName() {
    return headerName;
  }

  @Override
  protected void doFilterInternal(
      @NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response,
      @NonNull FilterChain chain)
      throws ServletException, IOException {

    String requestId = resolve(request);
    request.setAttribute(REQUEST_ATTR_REQUEST_ID, requestId);
    response.setHeader(headerName, requestId);

    try (RequestIdContext.Scope ignored = RequestIdContext.open(requestId)) {
      chain.doFilter(request, response);
    }
  }

  /** Keep the id on error dispatch. */
  @Override
  protected boolean shouldNotFilterErrorDispatch() {
    return false;
  }

  private String resolve(HttpServletRequest request) {
    Object existing = request.getAttribute(REQUEST_ATTR_REQUEST_ID);
    if (existing instanceof String id && !id.isBlank()) {
      return id;
    }
    String incoming = request.getHeader(headerName);
    if (incoming != null && !incoming.isBlank()) {
      return incoming.trim();
    }
    return UUID.randomUUID().toString();
  }

  /**
   * Returns the id the filter resolved for {@code request}, or {@link RequestIdContext#NONE} when
   * the filter did not run.
   */
  public static String requestIdOf(HttpServletRequest request) {
    Object id = request.getAttribute(REQUEST_ATTR_REQUEST_ID);
    return (id instanceof String s && !s.isBlank()) ? s : RequestIdContext.NONE;
  }
}
