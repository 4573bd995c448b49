package io.typecheck.core.catalog;

import io.typecheck.core.engine.AssertionEvaluator;
import io.typecheck.core.engine.MessageComposer;
import io.typecheck.core.engine.ValueClassifier;
import io.typecheck.core.engine.Values;
import io.typecheck.core.error.ConditionDefinitionException;
import io.typecheck.core.model.Condition;
import io.typecheck.core.model.ConditionList;
import io.typecheck.core.model.Descriptor;
import io.typecheck.core.model.IsData;
import io.typecheck.core.model.MessagePart;
import io.typecheck.core.model.ValueType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog of ready-made conditions, built only on the public core model.
 *
 * <p>
 * Constants are shared singletons, so a descriptor combining e.g.
 * {@link #POSITIVE} and {@link #INTEGER} references the same {@link #NUMBER}
 * prerequisite twice. Factories return fresh conditions on every call.
 */
public final class Conditions {

    private static final Map<ValueType, Condition> TYPE_CONDITIONS = new EnumMap<>(ValueType.class);

    static {
        for (ValueType type : ValueType.values()) {
            TYPE_CONDITIONS.put(type, typeCondition(type));
        }
    }

    public static final Condition BOOLEAN = typeOf(ValueType.BOOLEAN);
    public static final Condition FUNCTION = typeOf(ValueType.FUNCTION);
    public static final Condition NUMBER = typeOf(ValueType.NUMBER);
    public static final Condition STRING = typeOf(ValueType.STRING);
    public static final Condition ARRAY = typeOf(ValueType.ARRAY);
    public static final Condition OBJECT = typeOf(ValueType.OBJECT);

    public static final Condition TRUE = Condition.builder()
            .name("true")
            .prerequisites(BOOLEAN)
            .assertion(value -> Values.bool(value))
            .shouldBe(MessagePart.ofType("true"))
            .is("false")
            .build();

    public static final Condition FALSE = Condition.builder()
            .name("false")
            .prerequisites(BOOLEAN)
            .assertion(value -> !Values.bool(value))
            .shouldBe(MessagePart.ofType("false"))
            .is("true")
            .build();

    public static final Condition INTEGER = Condition.builder()
            .name("integer")
            .prerequisites(NUMBER)
            .assertion(Values::isIntegral)
            .shouldBe(MessagePart.ofType("integer"))
            .is("a floating point number")
            .build();

    public static final Condition NONNEGATIVE = Condition.builder()
            .name("nonnegative")
            .prerequisites(NUMBER)
            .assertion(value -> Values.number(value) >= 0)
            .shouldBe(MessagePart.ofBefore("non-negative"))
            .is("a negative number")
            .build();

    public static final Condition POSITIVE = Condition.builder()
            .name("positive")
            .prerequisites(NUMBER)
            .assertion(value -> Values.number(value) > 0)
            .shouldBe(MessagePart.ofBefore("positive"))
            .is("a negative number or 0")
            .build();

    public static final Condition NONEMPTY = Condition.builder()
            .name("nonempty")
            .prerequisites(ARRAY, STRING)
            .assertion(value -> Values.length(value) > 0)
            .shouldBe(MessagePart.ofBefore("non-empty"))
            .is((IsData data) -> "an empty " + data.type())
            .build();

    private Conditions() {}

    /**
     * Returns the shared condition asserting a runtime type tag, e.g.
     * {@code typeOf(ValueType.NUMBER)}. Its {@code is} message is the tag of
     * the offending value.
     */
    public static Condition typeOf(ValueType type) {
        return TYPE_CONDITIONS.get(type);
    }

    private static Condition typeCondition(ValueType type) {
        return Condition.builder()
                .name(type.tag())
                .assertion(value -> ValueClassifier.classify(value) == type)
                .shouldBe(MessagePart.ofType(type.tag()))
                .is((IsData data) -> data.type().tag())
                .build();
    }

    /**
     * An array whose elements all match the descriptor, rendered as
     * {@code Array<...>}. Without alternatives, any array.
     */
    public static Condition arrayOf(ConditionList... alternatives) {
        Descriptor descriptor = Descriptor.anyOf(alternatives);
        if (descriptor.isEmpty()) {
            return ARRAY;
        }
        return Condition.builder()
                .name("arrayOf")
                .prerequisites(ARRAY)
                .assertion(value -> allMatch(Values.elements(value), descriptor))
                .shouldBe(MessagePart.ofType("Array<" + MessageComposer.getMessageExpected(descriptor) + ">"))
                .is((IsData data) -> {
                    if (data.type() != ValueType.ARRAY) {
                        return data.type().tag();
                    }
                    List<Object> elements = Values.elements(data.value());
                    if (elements.isEmpty()) {
                        return "an empty array";
                    }
                    return "Array<" + MessageComposer.getMessageIsIterated(elements, descriptor) + ">";
                })
                .build();
    }

    /**
     * An object whose member values all match the descriptor, rendered as
     * {@code Object<keyName, ...>}. Without alternatives, any object.
     *
     * @param keyName name displayed for the keys, e.g. {@code "string"}
     * @throws ConditionDefinitionException if {@code keyName} is null or blank
     */
    public static Condition objectOf(String keyName, ConditionList... alternatives) {
        if (keyName == null || keyName.isBlank()) {
            throw new ConditionDefinitionException(
                    "Condition 'objectOf': the first argument must be a key name, used for displaying "
                            + "\"Object<keyName, ...>\" in the type message (if generic, use \"string\")",
                    "objectOf");
        }
        Descriptor descriptor = Descriptor.anyOf(alternatives);
        if (descriptor.isEmpty()) {
            return OBJECT;
        }
        return Condition.builder()
                .name("objectOf")
                .prerequisites(OBJECT)
                .assertion(value -> allMatch(Values.members(value), descriptor))
                .shouldBe(MessagePart.ofType(
                        "Object<" + keyName + ", " + MessageComposer.getMessageExpected(descriptor) + ">"))
                .is((IsData data) -> {
                    if (data.type() != ValueType.OBJECT) {
                        return data.type().tag();
                    }
                    List<Object> members = Values.members(data.value());
                    if (members.isEmpty()) {
                        return "an empty object";
                    }
                    return "Object<" + MessageComposer.getMessageIsIterated(members, descriptor) + ">";
                })
                .build();
    }

    /**
     * A string equal to one of the keywords.
     *
     * @throws ConditionDefinitionException if no keyword is given
     */
    public static Condition keywords(String... keywords) {
        if (keywords == null || keywords.length == 0) {
            throw new ConditionDefinitionException(
                    "Condition 'keywords' requires at least one keyword", "keywords");
        }
        List<String> allowed = new ArrayList<>(Arrays.asList(keywords));
        String type = allowed.size() > 1
                ? "one of the keywords " + ValueClassifier.enumerate(allowed)
                : "the keyword \"" + allowed.get(0) + "\"";
        return Condition.builder()
                .name("keywords")
                .prerequisites(STRING)
                .assertion(value -> allowed.contains(Values.text(value)))
                .shouldBe(MessagePart.ofType(type))
                .is("a different string")
                .build();
    }

    /**
     * An array or string of exactly the given length.
     *
     * @throws ConditionDefinitionException if {@code length} is negative
     */
    public static Condition length(int length) {
        if (length < 0) {
            throw new ConditionDefinitionException(
                    "Condition 'length' requires a non-negative length, got: " + length, "length");
        }
        return Condition.builder()
                .name("length")
                .prerequisites(ARRAY, STRING)
                .assertion(value -> Values.length(value) == length)
                .shouldBe(data -> new MessagePart(List.of(), data.type(), List.of("of length " + length)))
                .is((IsData data) -> data.article() + " " + data.type() + " of a different length")
                .build();
    }

    /**
     * A number within the closed interval {@code [min, max]}.
     *
     * @throws ConditionDefinitionException if {@code min > max}
     */
    public static Condition range(double min, double max) {
        if (min > max) {
            throw new ConditionDefinitionException(
                    "Condition 'range' requires min <= max, got: [" + format(min) + ", " + format(max) + "]",
                    "range");
        }
        String interval = "of the interval [" + format(min) + ", " + format(max) + "]";
        return Condition.builder()
                .name("range")
                .prerequisites(NUMBER)
                .assertion(value -> {
                    double number = Values.number(value);
                    return number >= min && number <= max;
                })
                .shouldBe(data -> new MessagePart(List.of(), data.type(), List.of(interval)))
                .is("a number outside of the required range")
                .build();
    }

    private static boolean allMatch(List<Object> items, Descriptor descriptor) {
        for (Object item : items) {
            if (!AssertionEvaluator.evaluate(item, descriptor)) {
                return false;
            }
        }
        return true;
    }

    // 5.0 renders as "5", 2.5 as "2.5"
    private static String format(double number) {
        if (number == Math.rint(number) && !Double.isInfinite(number) && Math.abs(number) < 1e15) {
            return Long.toString((long) number);
        }
        return Double.toString(number);
    }
}
