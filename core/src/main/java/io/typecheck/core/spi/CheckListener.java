package io.typecheck.core.spi;

import io.typecheck.core.model.ValueType;

/**
 * SPI for observability hooks on {@link io.typecheck.core.engine.TypeChecker}.
 *
 * <p>
 * Implementations bridge to metrics or audit systems; the core has no
 * telemetry dependencies. Events are immutable. Implementations MUST be
 * thread-safe and non-blocking. Exceptions thrown by listeners are caught and
 * logged by the checker and never change the outcome of a check.
 */
public interface CheckListener {

    /**
     * Called after every check, matched or not.
     *
     * @param event contains the value type, number of alternatives and outcome
     */
    void onCheckCompleted(CheckCompletedEvent event);

    /**
     * Called when {@code assertAndThrow} is about to raise a mismatch.
     *
     * @param event contains the value type and both rendered message halves
     */
    void onMismatch(MismatchEvent event);

    // --- Event records ---

    /** Event emitted when a check completes. */
    record CheckCompletedEvent(ValueType valueType, int alternatives, boolean matched) {}

    /** Event emitted when a mismatch is raised. */
    record MismatchEvent(ValueType valueType, String expected, String is) {}
}
