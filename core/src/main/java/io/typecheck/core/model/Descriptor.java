package io.typecheck.core.model;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered disjunction of {@link ConditionList} alternatives: a value matches
 * the descriptor if any one alternative holds. A descriptor without
 * alternatives never matches.
 *
 * <p>
 * Typically assembled ad hoc at each call site. Immutable.
 *
 * @param alternatives the alternatives in declaration order
 */
public record Descriptor(List<ConditionList> alternatives) implements Iterable<ConditionList> {

    private static final Descriptor NONE = new Descriptor(List.of());

    public Descriptor {
        Objects.requireNonNull(alternatives, "alternatives must not be null");
        for (ConditionList alternative : alternatives) {
            Objects.requireNonNull(alternative, "alternatives must not contain null");
        }
        alternatives = List.copyOf(alternatives);
    }

    /** The descriptor without alternatives. */
    public static Descriptor none() {
        return NONE;
    }

    /**
     * Creates a descriptor from the given alternatives.
     *
     * @param alternatives single conditions or {@link ConditionList#allOf AND-groups}
     * @return the descriptor
     */
    public static Descriptor anyOf(ConditionList... alternatives) {
        return alternatives.length == 0 ? NONE : new Descriptor(Arrays.asList(alternatives));
    }

    /** Creates a descriptor from a list of alternatives. */
    public static Descriptor anyOf(List<? extends ConditionList> alternatives) {
        return alternatives.isEmpty() ? NONE : new Descriptor(List.copyOf(alternatives));
    }

    /** Returns {@code true} if the descriptor has no alternatives. */
    public boolean isEmpty() {
        return alternatives.isEmpty();
    }

    /** Number of alternatives. */
    public int size() {
        return alternatives.size();
    }

    @Override
    public Iterator<ConditionList> iterator() {
        return alternatives.iterator();
    }
}
