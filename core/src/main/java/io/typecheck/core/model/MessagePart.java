package io.typecheck.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sentence fragment of the form "[before] [type] [after]" used to describe
 * what a value should be.
 *
 * <p>
 * {@code before} and {@code after} accumulate across merges in insertion
 * order. {@code type} is single-valued: the first non-null type wins and is
 * never overwritten by a later merge. Structural equality (record semantics)
 * is what de-duplicates identical fragments in
 * {@link io.typecheck.core.engine.MessageComposer#mergeExpected}.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param before attributes rendered in front of the type, never null
 * @param type   the type noun, or {@code null} if no condition contributed one
 * @param after  trailing clauses rendered behind the type, never null
 */
public record MessagePart(List<String> before, String type, List<String> after) {

    private static final MessagePart EMPTY = new MessagePart(List.of(), null, List.of());

    public MessagePart {
        before = before == null ? List.of() : List.copyOf(before);
        after = after == null ? List.of() : List.copyOf(after);
        if (type != null && type.isEmpty()) {
            type = null;
        }
    }

    /** A fragment without any parts. */
    public static MessagePart empty() {
        return EMPTY;
    }

    /** A fragment contributing only a type noun, e.g. {@code "number"}. */
    public static MessagePart ofType(String type) {
        return new MessagePart(List.of(), type, List.of());
    }

    /** A fragment contributing a single attribute in front of the type. */
    public static MessagePart ofBefore(String before) {
        return new MessagePart(List.of(Objects.requireNonNull(before, "before must not be null")), null, List.of());
    }

    /** A fragment contributing a single trailing clause. */
    public static MessagePart ofAfter(String after) {
        return new MessagePart(List.of(), null, List.of(Objects.requireNonNull(after, "after must not be null")));
    }

    /** Returns a copy of this fragment with the given trailing clause appended. */
    public MessagePart withAfter(String clause) {
        return merge(ofAfter(clause));
    }

    /** Returns {@code true} if no part has been contributed. */
    public boolean isEmpty() {
        return before.isEmpty() && type == null && after.isEmpty();
    }

    /**
     * Merges {@code other} into a new fragment: {@code before} and
     * {@code after} lists are concatenated (this fragment first), the type of
     * this fragment is kept if present.
     *
     * @param other the fragment to merge in, may be null
     * @return the merged fragment
     */
    public MessagePart merge(MessagePart other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<String> mergedBefore = new ArrayList<>(before);
        mergedBefore.addAll(other.before);
        List<String> mergedAfter = new ArrayList<>(after);
        mergedAfter.addAll(other.after);
        return new MessagePart(mergedBefore, type != null ? type : other.type, mergedAfter);
    }
}
