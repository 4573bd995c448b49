package io.typecheck.core.engine;

import io.typecheck.core.model.Condition;
import io.typecheck.core.model.ConditionList;
import io.typecheck.core.model.Descriptor;
import io.typecheck.core.model.ExpectedData;
import io.typecheck.core.model.IsData;
import io.typecheck.core.model.MessagePart;
import io.typecheck.core.model.ValueType;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the two halves of a mismatch message: what a value was expected to
 * be, composed from every condition's {@code shouldBe} fragment, and what it
 * actually is, taken from the condition blamed by {@link RelevanceResolver}.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class MessageComposer {

    private static final String THAT = "that ";
    private static final String AND = "and ";

    private MessageComposer() {}

    /**
     * Merges the {@code shouldBe} fragments of a descriptor into one fragment
     * per distinct alternative.
     *
     * <p>
     * Within an AND-group, literal fragments merge first, in declaration
     * order. Each condition's prerequisites are then merged recursively: a
     * single resulting fragment merges into the group, several fragments
     * expand the group into one branch each. Computed fragments are resolved
     * last, once per branch, against the branch's type. Structurally
     * identical fragments are reported once, first occurrence kept.
     *
     * @param descriptor the descriptor to describe
     * @return the distinct fragments in alternative order
     */
    public static List<MessagePart> mergeExpected(Descriptor descriptor) {
        return merge(descriptor, AssertionEvaluator.newIdentitySet());
    }

    /** Renders a fragment with the {@link MessageStyle#DEFAULT default style}. */
    public static String render(MessagePart part) {
        return render(part, MessageStyle.DEFAULT);
    }

    /**
     * Renders a fragment as prose: the {@code before} items joined by
     * {@code ", "}, the type (or the placeholder), then the {@code after}
     * items. Items starting with "that" are moved last and every one after
     * the first is rewritten to start with "and", e.g.
     * {@code "positive integer that is divisible by 5 and is greater than 25"}.
     *
     * @param part  the fragment
     * @param style rendering settings
     * @return the rendered text
     */
    public static String render(MessagePart part, MessageStyle style) {
        StringBuilder out = new StringBuilder();
        if (!part.before().isEmpty()) {
            out.append(String.join(", ", part.before())).append(' ');
        }
        out.append(part.type() != null ? part.type() : style.missingTypePlaceholder());
        if (!part.after().isEmpty()) {
            out.append(' ').append(String.join(" ", orderClauses(part.after())));
        }
        return out.toString();
    }

    /** Returns {@link #getMessageExpected(Descriptor, MessageStyle)} with the default style. */
    public static String getMessageExpected(Descriptor descriptor) {
        return getMessageExpected(descriptor, MessageStyle.DEFAULT);
    }

    /**
     * Describes what a value matching the descriptor looks like, e.g.
     * {@code "positive integer OR string"}. Independent of any value.
     */
    public static String getMessageExpected(Descriptor descriptor, MessageStyle style) {
        List<String> rendered = new ArrayList<>();
        for (MessagePart part : mergeExpected(descriptor)) {
            rendered.add(render(part, style));
        }
        return String.join(style.alternativeSeparator(), rendered);
    }

    /**
     * Describes what the value is, using the {@code is} message of the
     * condition blamed by {@link RelevanceResolver#findFailing}.
     *
     * @return the description, or an empty string if the value matches
     */
    public static String getMessageIs(Object value, Descriptor descriptor) {
        Optional<Condition> failing = RelevanceResolver.findFailing(value, descriptor);
        if (failing.isEmpty()) {
            return "";
        }
        ValueType type = ValueClassifier.classify(value);
        return failing.get().is().render(new IsData(value, type, ValueClassifier.article(type)));
    }

    /**
     * Returns {@link #getMessageIs} for the first of the values that does not
     * match the descriptor, or an empty string if all match. Used by container
     * conditions to describe their offending element.
     */
    public static String getMessageIsIterated(Iterable<?> values, Descriptor descriptor) {
        for (Object item : values) {
            if (!AssertionEvaluator.evaluate(item, descriptor)) {
                return getMessageIs(item, descriptor);
            }
        }
        return "";
    }

    private static List<MessagePart> merge(Descriptor descriptor, Set<Condition> path) {
        Set<MessagePart> distinct = new LinkedHashSet<>();
        for (ConditionList alternative : descriptor) {
            distinct.addAll(mergeGroup(alternative.conditions(), path));
        }
        return new ArrayList<>(distinct);
    }

    private static List<MessagePart> mergeGroup(List<Condition> group, Set<Condition> path) {
        MessagePart own = MessagePart.empty();
        for (Condition condition : group) {
            if (!condition.shouldBe().isComputed()) {
                own = own.merge(condition.shouldBe().resolve(new ExpectedData(own.type())));
            }
        }

        List<MessagePart> branches = List.of(own);
        for (Condition condition : group) {
            if (!condition.hasPrerequisites() || !path.add(condition)) {
                continue;
            }
            List<MessagePart> inherited;
            try {
                inherited = merge(condition.prerequisites(), path);
            } finally {
                path.remove(condition);
            }
            if (inherited.isEmpty()) {
                continue;
            }
            List<MessagePart> expanded = new ArrayList<>(branches.size() * inherited.size());
            for (MessagePart branch : branches) {
                for (MessagePart part : inherited) {
                    expanded.add(branch.merge(part));
                }
            }
            branches = expanded;
        }

        for (Condition condition : group) {
            if (condition.shouldBe().isComputed()) {
                List<MessagePart> resolved = new ArrayList<>(branches.size());
                for (MessagePart branch : branches) {
                    resolved.add(branch.merge(condition.shouldBe().resolve(new ExpectedData(branch.type()))));
                }
                branches = resolved;
            }
        }
        return branches;
    }

    // Clauses starting with "that" go last; the second and later read "and ...".
    private static List<String> orderClauses(List<String> clauses) {
        List<String> ordered = new ArrayList<>(clauses.size());
        List<String> thatClauses = new ArrayList<>();
        for (String clause : clauses) {
            if (clause.startsWith(THAT)) {
                thatClauses.add(clause);
            } else {
                ordered.add(clause);
            }
        }
        for (int i = 0; i < thatClauses.size(); i++) {
            String clause = thatClauses.get(i);
            ordered.add(i == 0 ? clause : AND + clause.substring(THAT.length()));
        }
        return ordered;
    }
}
