package io.microtrace.platform.domain.error;

import java.net.URI;
import java.util.Objects;

/**
 * The RFC7807 <em>problem type</em> URIs returned by MicroTrace.
 *
 * <p>Each type carries a default HTTP status and a short title. Slugs are lowercase kebab-case and
 * stable across versions; the web layer renders them as {@code application/problem+json}.
 */
public final class ProblemTypes {

    /** Base authority for all problem type URIs. */
    public static final String BASE = "https://problems.microtrace.io";

    /** 400 – Request body failed schema validation. */
    public static final ProblemType VALIDATION_FAILED =
            def("validation-failed", "Validation Failed", 400);

    /** 400 – Request body could not be read (malformed JSON, wrong types). */
    public static final ProblemType MALFORMED_REQUEST =
            def("malformed-request", "Malformed Request", 400);

    /** 503 – Analysis was interrupted while waiting on an injected delay. */
    public static final ProblemType ANALYSIS_ABORTED =
            def("analysis-aborted", "Analysis Aborted", 503);

    private ProblemTypes() {}

    private static ProblemType def(String slug, String title, int status) {
        return new ProblemType(slug, title, status);
    }

    /**
     * A stable problem type.
     *
     * @param slug kebab-case identifier
     * @param title short human-readable summary
     * @param defaultStatus HTTP status used when the thrower does not override it
     */
    public record ProblemType(String slug, String title, int defaultStatus) {

        public ProblemType {
            Objects.requireNonNull(slug, "slug");
            Objects.requireNonNull(title, "title");
            if (defaultStatus < 100 || defaultStatus > 599) {
                throw new IllegalArgumentException("Invalid HTTP status: " + defaultStatus);
            }
        }

        /** Absolute type URI, e.g. {@code https://problems.microtrace.io/analysis-aborted}. */
        public URI uri() {
            return URI.create(BASE + "/" + slug);
        }
    }
}
