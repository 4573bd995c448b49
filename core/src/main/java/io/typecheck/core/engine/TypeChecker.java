package io.typecheck.core.engine;

import io.typecheck.core.error.ValueMismatchException;
import io.typecheck.core.model.ConditionList;
import io.typecheck.core.model.Descriptor;
import io.typecheck.core.model.ValueType;
import io.typecheck.core.spi.CheckListener;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for checking values against descriptors.
 *
 * <p>
 * {@link #check} only classifies. {@link #assertAndThrow} additionally builds
 * a diagnostic on failure: the expected half from the whole descriptor, the
 * actual half from the condition {@link RelevanceResolver} blames.
 *
 * <p>
 * Thread-safe: holds only immutable configuration. Every call builds its own
 * traversal state.
 */
public final class TypeChecker {

    private static final Logger LOG = LoggerFactory.getLogger(TypeChecker.class);
    private static final TypeChecker STANDARD = new TypeChecker();

    private final MessageStyle style;
    private final CheckListener listener;

    /** Creates a checker with the default message style and no listener. */
    public TypeChecker() {
        this(MessageStyle.DEFAULT, null);
    }

    /**
     * Creates a checker.
     *
     * @param style    message rendering settings
     * @param listener observability hook, or {@code null} for none
     */
    public TypeChecker(MessageStyle style, CheckListener listener) {
        this.style = Objects.requireNonNull(style, "style must not be null");
        this.listener = listener;
    }

    /** Shared checker with the default style and no listener. */
    public static TypeChecker standard() {
        return STANDARD;
    }

    /** The message style used for expected-value messages. */
    public MessageStyle style() {
        return style;
    }

    /**
     * Returns {@code true} if the value matches any alternative of the
     * descriptor. Predicate exceptions propagate unchanged.
     */
    public boolean check(Object value, Descriptor descriptor) {
        boolean matched = AssertionEvaluator.evaluate(value, descriptor);
        notifyCheckCompleted(value, descriptor, matched);
        return matched;
    }

    /** Varargs form of {@link #check(Object, Descriptor)}. */
    public boolean check(Object value, ConditionList... alternatives) {
        return check(value, Descriptor.anyOf(alternatives));
    }

    /**
     * Returns silently if the value matches the descriptor.
     *
     * @throws ValueMismatchException if it matches no alternative, carrying
     *                                the expected and actual descriptions
     */
    public void assertAndThrow(Object value, Descriptor descriptor) {
        if (check(value, descriptor)) {
            return;
        }
        String expected = MessageComposer.getMessageExpected(descriptor, style);
        String is = MessageComposer.getMessageIs(value, descriptor);
        ValueType valueType = ValueClassifier.classify(value);
        LOG.debug("typecheck.mismatch expected='{}' is='{}' value_type={}", expected, is, valueType);
        notifyMismatch(valueType, expected, is);
        throw new ValueMismatchException(expected, is);
    }

    /** Varargs form of {@link #assertAndThrow(Object, Descriptor)}. */
    public void assertAndThrow(Object value, ConditionList... alternatives) {
        assertAndThrow(value, Descriptor.anyOf(alternatives));
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged, they MUST NOT affect the check.

    private void notifyCheckCompleted(Object value, Descriptor descriptor, boolean matched) {
        if (listener == null) return;
        try {
            listener.onCheckCompleted(new CheckListener.CheckCompletedEvent(
                    ValueClassifier.classify(value), descriptor.size(), matched));
        } catch (Exception e) {
            LOG.warn("CheckListener.onCheckCompleted failed", e);
        }
    }

    private void notifyMismatch(ValueType valueType, String expected, String is) {
        if (listener == null) return;
        try {
            listener.onMismatch(new CheckListener.MismatchEvent(valueType, expected, is));
        } catch (Exception e) {
            LOG.warn("CheckListener.onMismatch failed", e);
        }
    }
}
