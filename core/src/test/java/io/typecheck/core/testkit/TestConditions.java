package io.typecheck.core.testkit;

import io.typecheck.core.catalog.Conditions;
import io.typecheck.core.engine.Values;
import io.typecheck.core.model.Condition;
import io.typecheck.core.model.MessagePart;
import java.util.concurrent.atomic.AtomicInteger;

/** Conditions shared by the engine tests. */
public final class TestConditions {

    private TestConditions() {}

    /** A number divisible by {@code divisor}. */
    public static Condition divisibleBy(int divisor) {
        return Condition.builder()
                .name("divisibleBy" + divisor)
                .prerequisites(Conditions.NUMBER)
                .assertion(value -> Values.number(value) % divisor == 0)
                .shouldBe(MessagePart.ofAfter("that is divisible by " + divisor))
                .is("a number not divisible by " + divisor)
                .build();
    }

    /** A number strictly greater than {@code bound}. */
    public static Condition greaterThan(int bound) {
        return Condition.builder()
                .name("greaterThan" + bound)
                .prerequisites(Conditions.NUMBER)
                .assertion(value -> Values.number(value) > bound)
                .shouldBe(MessagePart.ofAfter("that is greater than " + bound))
                .is("a number less than or equal to " + bound)
                .build();
    }

    /** A condition gated on {@code NUMBER} whose predicate must never run. */
    public static Condition explodingNumberCondition() {
        return Condition.builder()
                .name("exploding")
                .prerequisites(Conditions.NUMBER)
                .assertion(value -> {
                    throw new AssertionError("predicate must not be invoked for " + value);
                })
                .shouldBe(MessagePart.ofBefore("exploding"))
                .is("never")
                .build();
    }

    /** A condition without prerequisites that always yields {@code result}. */
    public static Condition constant(String name, boolean result) {
        return Condition.builder()
                .name(name)
                .assertion(value -> result)
                .shouldBe(MessagePart.ofType(name))
                .is("not " + name)
                .build();
    }

    /** A condition without prerequisites that counts its invocations. */
    public static Condition counting(String name, boolean result, AtomicInteger invocations) {
        return Condition.builder()
                .name(name)
                .assertion(value -> {
                    invocations.incrementAndGet();
                    return result;
                })
                .shouldBe(MessagePart.ofType(name))
                .is("not " + name)
                .build();
    }
}
