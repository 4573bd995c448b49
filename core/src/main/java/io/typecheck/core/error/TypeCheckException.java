package io.typecheck.core.error;

/**
 * Abstract base for all runtime-typecheck exceptions. Never thrown directly; use
 * {@link ConditionDefinitionException} or {@link ValueMismatchException}.
 *
 * <p>Exceptions raised by condition predicates or {@code is} callbacks are not wrapped in this
 * hierarchy: they propagate to the caller unchanged.
 */
public abstract class TypeCheckException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        DEFINITION,
        EVALUATION
    }

    private final Phase phase;

    protected TypeCheckException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
