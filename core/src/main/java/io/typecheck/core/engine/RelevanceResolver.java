package io.typecheck.core.engine;

import io.typecheck.core.model.Condition;
import io.typecheck.core.model.ConditionList;
import io.typecheck.core.model.Descriptor;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the single failing {@link Condition} that best explains why a value
 * does not match a {@link Descriptor}.
 *
 * <p>
 * Every alternative is scored depth-first. Each condition whose own predicate
 * passes adds {@value #PASS_BONUS} to its group's score; every level of
 * prerequisites costs {@value #DEPTH_PENALTY}. The alternative with the
 * strictly highest score wins (ties go to the earlier alternative), and its
 * first failing condition in declaration order is blamed. The pass bonus
 * dominates, so the alternative closest to succeeding is preferred; the depth
 * penalty prefers the shallowest failure among equally close alternatives.
 *
 * <p>
 * Conditions are shared by reference, so one identity-keyed visited set is
 * threaded through a whole top-level call: a condition reachable from several
 * parents is scored once. A condition whose prerequisites do not hold never
 * has its own predicate invoked, even when those prerequisites were already
 * visited through another parent.
 *
 * <p>
 * Thread-safe and stateless: the visited set is created per top-level call.
 */
public final class RelevanceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(RelevanceResolver.class);

    /** Score added for every condition whose predicate holds. */
    public static final int PASS_BONUS = 10;

    /** Score subtracted per level of prerequisite nesting. */
    public static final int DEPTH_PENALTY = 1;

    private RelevanceResolver() {}

    /**
     * Returns the failing condition that best explains why the value does not
     * match the descriptor, or empty if the value matches.
     *
     * @param value      the value under test, may be null
     * @param descriptor the alternatives the value was tested against
     * @return the blamed condition, or empty if the value matches or no
     *         alternative could be scored
     */
    public static Optional<Condition> findFailing(Object value, Descriptor descriptor) {
        if (AssertionEvaluator.evaluate(value, descriptor)) {
            return Optional.empty();
        }
        Score best = score(value, descriptor, AssertionEvaluator.newIdentitySet());
        if (LOG.isTraceEnabled()) {
            LOG.trace(
                    "relevance.resolved failing={} score={} alternatives={}",
                    best.failure() != null ? best.failure().name() : "none",
                    best.value(),
                    descriptor.size());
        }
        return Optional.ofNullable(best.failure());
    }

    /**
     * Recursively counts the conditions of a descriptor whose predicates hold
     * for the value. Each condition is counted at most once per call, however
     * many parents reference it. This does not tell whether the descriptor as
     * a whole matches.
     *
     * @param value      the value under test, may be null
     * @param descriptor the conditions to count
     * @return the number of passing conditions
     */
    public static int getDescriptorPassCount(Object value, Descriptor descriptor) {
        return passCount(value, descriptor, AssertionEvaluator.newIdentitySet());
    }

    private static int passCount(Object value, Descriptor descriptor, Set<Condition> visited) {
        int count = 0;
        for (ConditionList alternative : descriptor) {
            for (Condition condition : alternative.conditions()) {
                if (!visited.add(condition)) {
                    continue;
                }
                if (condition.hasPrerequisites()) {
                    count += passCount(value, condition.prerequisites(), visited);
                }
                if (holds(value, condition)) {
                    count++;
                }
            }
        }
        return count;
    }

    private static Score score(Object value, Descriptor descriptor, Set<Condition> visited) {
        Score best = Score.NONE;
        for (ConditionList alternative : descriptor) {
            Score candidate = scoreGroup(value, alternative.conditions(), visited);
            if (candidate.value() > best.value()) {
                best = candidate;
            }
        }
        return best;
    }

    private static Score scoreGroup(Object value, List<Condition> group, Set<Condition> visited) {
        double levelScore = 0;
        double bestChildScore = Double.NEGATIVE_INFINITY;
        Condition firstFailure = null;

        for (Condition condition : group) {
            if (!visited.add(condition)) {
                continue;
            }
            double childScore = 0;
            Condition childFailure = null;
            if (condition.hasPrerequisites()) {
                Score child = score(value, condition.prerequisites(), visited);
                childScore = child.value() - DEPTH_PENALTY;
                childFailure = child.failure();
            }
            if (childFailure == null) {
                if (holds(value, condition)) {
                    levelScore += PASS_BONUS;
                } else {
                    childFailure = condition;
                }
            }
            bestChildScore = Math.max(bestChildScore, childScore);
            if (firstFailure == null) {
                firstFailure = childFailure;
            }
        }
        return new Score(bestChildScore + levelScore, firstFailure);
    }

    // Prerequisites may have been visited, and so skipped, through another parent.
    private static boolean holds(Object value, Condition condition) {
        return AssertionEvaluator.prerequisitesHold(value, condition) && condition.test(value);
    }

    /** Score of an alternative and the first failure found in it. */
    private record Score(double value, Condition failure) {
        static final Score NONE = new Score(Double.NEGATIVE_INFINITY, null);
    }
}
