package io.typecheck.core.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * The "should be" fragment of a {@link Condition}: either a fixed
 * {@link MessagePart} or a function of the running {@link ExpectedData}.
 *
 * <p>
 * Sealed: all variants are known at compile time. Thread-safe and immutable
 * as long as computed functions are side-effect free.
 */
public sealed interface ShouldBe {

    /**
     * Resolves this fragment against the running state.
     *
     * @param data the type accumulated so far
     * @return the fragment to merge, never null
     */
    MessagePart resolve(ExpectedData data);

    /** Whether resolution depends on the running state. */
    boolean isComputed();

    static ShouldBe of(MessagePart part) {
        return new Literal(part);
    }

    static ShouldBe computed(Function<ExpectedData, MessagePart> function) {
        return new Computed(function);
    }

    /** A fixed fragment. */
    record Literal(MessagePart part) implements ShouldBe {
        public Literal {
            Objects.requireNonNull(part, "part must not be null");
        }

        @Override
        public MessagePart resolve(ExpectedData data) {
            return part;
        }

        @Override
        public boolean isComputed() {
            return false;
        }
    }

    /** A fragment computed from the type contributed by prerequisites. */
    record Computed(Function<ExpectedData, MessagePart> function) implements ShouldBe {
        public Computed {
            Objects.requireNonNull(function, "function must not be null");
        }

        @Override
        public MessagePart resolve(ExpectedData data) {
            MessagePart part = function.apply(data);
            return part != null ? part : MessagePart.empty();
        }

        @Override
        public boolean isComputed() {
            return true;
        }
    }
}
