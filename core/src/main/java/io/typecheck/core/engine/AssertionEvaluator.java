package io.typecheck.core.engine;

import io.typecheck.core.model.Condition;
import io.typecheck.core.model.ConditionList;
import io.typecheck.core.model.Descriptor;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a value satisfies a {@link Descriptor}: an OR over
 * alternatives, each an AND over conditions, recursively through every
 * condition's prerequisites.
 *
 * <p>
 * Evaluation order per alternative: the prerequisites of each condition are
 * checked first, in declaration order, and a failing prerequisite fails the
 * alternative immediately. Only when all prerequisites hold are the
 * conditions' own predicates invoked, so a predicate never sees a value its
 * prerequisites reject. Predicate exceptions propagate unchanged.
 *
 * <p>
 * A condition reached again through its own prerequisites (a cyclic graph)
 * is not descended into a second time; the repeated prerequisite check is
 * treated as already satisfied.
 *
 * <p>
 * Thread-safe and stateless: the cycle guard is created per top-level call.
 */
public final class AssertionEvaluator {

    private AssertionEvaluator() {}

    /**
     * Returns {@code true} if any alternative of the descriptor holds for the
     * value. A descriptor without alternatives never holds.
     *
     * @param value      the value to test, may be null
     * @param descriptor the alternatives to test against
     */
    public static boolean evaluate(Object value, Descriptor descriptor) {
        return evaluate(value, descriptor, newIdentitySet());
    }

    /**
     * Returns {@code true} if every condition of the AND-group holds for the
     * value, including prerequisites. An empty group holds vacuously.
     */
    public static boolean evaluate(Object value, ConditionList alternative) {
        return evaluate(value, alternative, newIdentitySet());
    }

    /**
     * Returns {@code true} if the condition has no prerequisites or the value
     * satisfies them. An explicitly empty prerequisite descriptor does not gate.
     */
    public static boolean prerequisitesHold(Object value, Condition condition) {
        return prerequisitesHold(value, condition, newIdentitySet());
    }

    static Set<Condition> newIdentitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private static boolean evaluate(Object value, Descriptor descriptor, Set<Condition> path) {
        for (ConditionList alternative : descriptor) {
            if (evaluate(value, alternative, path)) {
                return true;
            }
        }
        return false;
    }

    private static boolean evaluate(Object value, ConditionList alternative, Set<Condition> path) {
        List<Condition> group = alternative.conditions();
        for (Condition condition : group) {
            if (!prerequisitesHold(value, condition, path)) {
                return false;
            }
        }
        for (Condition condition : group) {
            if (!condition.test(value)) {
                return false;
            }
        }
        return true;
    }

    private static boolean prerequisitesHold(Object value, Condition condition, Set<Condition> path) {
        if (!condition.hasPrerequisites()) {
            return true;
        }
        if (!path.add(condition)) {
            return true;
        }
        try {
            return evaluate(value, condition.prerequisites(), path);
        } finally {
            path.remove(condition);
        }
    }
}
