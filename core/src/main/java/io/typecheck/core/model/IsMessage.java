package io.typecheck.core.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * The "is" sentence of a {@link Condition}, describing a value that fails it.
 * Should start with a lower-case indefinite article, e.g.
 * {@code "a negative number or 0"}.
 */
public sealed interface IsMessage {

    /**
     * Renders the sentence for a failing value.
     *
     * @param data the failing value with its type and article
     * @return the sentence
     */
    String render(IsData data);

    static IsMessage of(String text) {
        return new Literal(text);
    }

    static IsMessage computed(Function<IsData, String> function) {
        return new Computed(function);
    }

    /** A fixed sentence, returned verbatim. */
    record Literal(String text) implements IsMessage {
        public Literal {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String render(IsData data) {
            return text;
        }
    }

    /** A sentence computed from the failing value. */
    record Computed(Function<IsData, String> function) implements IsMessage {
        public Computed {
            Objects.requireNonNull(function, "function must not be null");
        }

        @Override
        public String render(IsData data) {
            return function.apply(data);
        }
    }
}
