package io.typecheck.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One alternative of a {@link Descriptor}: either a single {@link Condition}
 * or an AND-group of conditions, all of which must hold.
 *
 * <p>
 * Both shapes normalize to the same thing through {@link #conditions()}: a
 * single condition is a group of one.
 */
public sealed interface ConditionList permits Condition, ConditionList.AllOf {

    /** The conditions of this group, in declaration order. Never null. */
    List<Condition> conditions();

    /**
     * Creates an AND-group. An empty group holds vacuously.
     *
     * @param conditions the conditions that must all hold
     * @return the group
     */
    static ConditionList allOf(Condition... conditions) {
        return new AllOf(Arrays.asList(conditions));
    }

    /** Creates an AND-group from a list. */
    static ConditionList allOf(List<Condition> conditions) {
        return new AllOf(conditions);
    }

    /** AND-group of conditions. Immutable. */
    record AllOf(List<Condition> conditions) implements ConditionList {
        public AllOf {
            Objects.requireNonNull(conditions, "conditions must not be null");
            for (Condition condition : conditions) {
                Objects.requireNonNull(condition, "conditions must not contain null");
            }
            conditions = List.copyOf(conditions);
        }
    }
}
