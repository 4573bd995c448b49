package io.typecheck.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.typecheck.core.error.ValueMismatchException;

/**
 * Renders a {@link ValueMismatchException} as an RFC 9457 Problem Details
 * body: {@code type}, {@code title}, {@code status}, {@code detail} and
 * {@code instance}, plus the extension members {@code expected} and
 * {@code is}.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class ProblemDetailBuilder {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_STATUS = 400;
    private static final String DEFAULT_TITLE = "Type Check Failed";

    private final int status;

    /** Creates a builder with default status 400. */
    public ProblemDetailBuilder() {
        this(DEFAULT_STATUS);
    }

    /**
     * Creates a builder with a custom status code.
     *
     * @param status the HTTP status code to report
     */
    public ProblemDetailBuilder(int status) {
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("Status code must be between 100 and 599, got: " + status);
        }
        this.status = status;
    }

    /** Returns the HTTP status code used by this builder. */
    public int status() {
        return status;
    }

    /**
     * Builds the error body for a mismatch.
     *
     * @param exception    the mismatch
     * @param instancePath the path or pointer of the checked value, may be null
     * @return the error body
     */
    public JsonNode build(ValueMismatchException exception, String instancePath) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("type", ValueMismatchException.URN);
        body.put("title", DEFAULT_TITLE);
        body.put("status", status);
        body.put("detail", exception.getMessage());
        if (instancePath != null) {
            body.put("instance", instancePath);
        } else {
            body.putNull("instance");
        }
        body.put("expected", exception.expected());
        body.put("is", exception.is());
        return body;
    }
}
