package io.typecheck.core.error;

import java.util.Objects;

/**
 * Diagnostic error raised by {@code TypeChecker.assertAndThrow} when a value matches none of the
 * alternatives of a descriptor. URN: {@code urn:typecheck:error:value-mismatch}
 *
 * <p>The message is always {@code "Expected " + expected + ", got " + is}.
 */
public final class ValueMismatchException extends TypeCheckException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:typecheck:error:value-mismatch";

    private final String expected;
    private final String is;

    public ValueMismatchException(String expected, String is) {
        super("Expected " + expected + ", got " + is, Phase.EVALUATION);
        this.expected = Objects.requireNonNull(expected, "expected must not be null");
        this.is = Objects.requireNonNull(is, "is must not be null");
    }

    /** What the value should have been, e.g. {@code "positive integer OR string"}. */
    public String expected() {
        return expected;
    }

    /** What the value was, e.g. {@code "a negative number or 0"}. Empty if no condition was blamed. */
    public String is() {
        return is;
    }
}
