package io.typecheck.core.model;

import io.typecheck.core.error.ConditionDefinitionException;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A named, composable validation unit: a predicate, optional prerequisites
 * and the two message fragments used to explain a failure.
 *
 * <p>
 * The predicate is only ever invoked on values that already satisfy the
 * {@link #prerequisites() prerequisites}. Conditions are commonly shared by
 * reference between many parents (for example every numeric condition lists
 * {@code NUMBER} as prerequisite), so the condition graph is a DAG. Equality
 * is identity: traversals key their visited sets on the instance.
 *
 * <p>
 * Immutable and thread-safe, provided the supplied functions are.
 */
public final class Condition implements ConditionList {

    private final String name;
    private final Predicate<Object> assertion;
    private final Descriptor prerequisites;
    private final ShouldBe shouldBe;
    private final IsMessage is;
    private final List<Condition> self;

    private Condition(Builder builder) {
        this.name = builder.name != null ? builder.name : "anonymous";
        this.assertion = builder.assertion;
        this.prerequisites = builder.prerequisites != null ? builder.prerequisites : Descriptor.none();
        this.shouldBe = builder.shouldBe;
        this.is = builder.is;
        this.self = List.of(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Evaluates this condition's own predicate, ignoring prerequisites.
     * Exceptions thrown by the predicate propagate unchanged.
     */
    public boolean test(Object value) {
        return assertion.test(value);
    }

    /** Prerequisites the value must satisfy before {@link #test} is meaningful. Never null. */
    public Descriptor prerequisites() {
        return prerequisites;
    }

    /** Returns {@code true} if this condition gates on a non-empty prerequisite descriptor. */
    public boolean hasPrerequisites() {
        return !prerequisites.isEmpty();
    }

    public ShouldBe shouldBe() {
        return shouldBe;
    }

    public IsMessage is() {
        return is;
    }

    /** Diagnostic name, used in logs only. */
    public String name() {
        return name;
    }

    @Override
    public List<Condition> conditions() {
        return self;
    }

    @Override
    public String toString() {
        return "Condition[" + name + "]";
    }

    /** Builder for {@link Condition}. Not thread-safe. */
    public static final class Builder {

        private String name;
        private Predicate<Object> assertion;
        private Descriptor prerequisites;
        private ShouldBe shouldBe;
        private IsMessage is;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder assertion(Predicate<Object> assertion) {
            this.assertion = assertion;
            return this;
        }

        public Builder prerequisites(Descriptor prerequisites) {
            this.prerequisites = prerequisites;
            return this;
        }

        public Builder prerequisites(ConditionList... alternatives) {
            this.prerequisites = Descriptor.anyOf(alternatives);
            return this;
        }

        public Builder shouldBe(ShouldBe shouldBe) {
            this.shouldBe = shouldBe;
            return this;
        }

        public Builder shouldBe(MessagePart part) {
            return shouldBe(ShouldBe.of(part));
        }

        public Builder shouldBe(Function<ExpectedData, MessagePart> function) {
            return shouldBe(ShouldBe.computed(function));
        }

        public Builder is(IsMessage is) {
            this.is = is;
            return this;
        }

        public Builder is(String text) {
            return is(IsMessage.of(text));
        }

        public Builder is(Function<IsData, String> function) {
            return is(IsMessage.computed(function));
        }

        /**
         * Builds the condition.
         *
         * @throws ConditionDefinitionException if the assertion, shouldBe or is
         *                                      field is missing
         */
        public Condition build() {
            String label = name != null ? name : "anonymous";
            if (assertion == null) {
                throw new ConditionDefinitionException("Condition '" + label + "' has no assertion", label);
            }
            if (shouldBe == null) {
                throw new ConditionDefinitionException("Condition '" + label + "' has no shouldBe fragment", label);
            }
            if (is == null) {
                throw new ConditionDefinitionException("Condition '" + label + "' has no is message", label);
            }
            return new Condition(this);
        }
    }
}
