package io.typecheck.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.typecheck.core.model.ValueType;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runtime type tagging and the small grammar helpers used to build messages.
 *
 * <p>
 * Both plain Java values and Jackson {@link JsonNode} trees are classified.
 * Arrays, NaN and null are recognized ahead of the generic object and number
 * tags.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class ValueClassifier {

    private static final List<Class<?>> FUNCTION_TYPES = List.of(
            Function.class,
            BiFunction.class,
            Supplier.class,
            Consumer.class,
            BiConsumer.class,
            Predicate.class,
            BiPredicate.class,
            Runnable.class,
            Callable.class);

    private ValueClassifier() {}

    /**
     * Returns the runtime type tag of a value.
     *
     * @param value any value, may be null
     * @return the tag, never null
     */
    public static ValueType classify(Object value) {
        if (value == null) {
            return ValueType.NULL;
        }
        if (value instanceof JsonNode node) {
            return classifyNode(node);
        }
        if (value.getClass().isArray() || value instanceof Collection) {
            return ValueType.ARRAY;
        }
        if (value instanceof Double d && d.isNaN() || value instanceof Float f && f.isNaN()) {
            return ValueType.NAN;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return ValueType.STRING;
        }
        if (value instanceof BigInteger) {
            return ValueType.BIGINT;
        }
        if (value instanceof Number) {
            return ValueType.NUMBER;
        }
        if (value instanceof Boolean) {
            return ValueType.BOOLEAN;
        }
        if (value instanceof Enum) {
            return ValueType.SYMBOL;
        }
        if (isFunction(value)) {
            return ValueType.FUNCTION;
        }
        return ValueType.OBJECT;
    }

    private static ValueType classifyNode(JsonNode node) {
        if (node.isMissingNode()) {
            return ValueType.UNDEFINED;
        }
        if (node.isNull()) {
            return ValueType.NULL;
        }
        if (node.isArray()) {
            return ValueType.ARRAY;
        }
        if (node.isTextual()) {
            return ValueType.STRING;
        }
        if (node.isNumber()) {
            if (node.isBigInteger()) {
                return ValueType.BIGINT;
            }
            if ((node.isDouble() || node.isFloat()) && Double.isNaN(node.doubleValue())) {
                return ValueType.NAN;
            }
            return ValueType.NUMBER;
        }
        if (node.isBoolean()) {
            return ValueType.BOOLEAN;
        }
        return ValueType.OBJECT;
    }

    private static boolean isFunction(Object value) {
        if (value.getClass().isHidden()) {
            return true;
        }
        for (Class<?> type : FUNCTION_TYPES) {
            if (type.isInstance(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the indefinite article for a word: "an" if it starts with a
     * vowel (case-insensitive), "a" otherwise. Not linguistically complete.
     */
    public static String article(String word) {
        if (word == null || word.isEmpty()) {
            return "a";
        }
        char first = Character.toLowerCase(word.charAt(0));
        return "aeiou".indexOf(first) >= 0 ? "an" : "a";
    }

    /** Article for a type tag, e.g. "an" for {@code array}. */
    public static String article(ValueType type) {
        return article(type.tag());
    }

    /**
     * Renders a list of words as a quoted enumeration of the form
     * {@code "x", "y" or "z"}. A single word renders as {@code "x"}.
     *
     * @param words the words to enumerate
     * @return the enumeration, empty for an empty list
     */
    public static String enumerate(List<String> words) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < words.size(); i++) {
            if (i != 0 && i == words.size() - 1) {
                out.append(" or ");
            } else if (i != 0) {
                out.append(", ");
            }
            out.append('"').append(words.get(i)).append('"');
        }
        return out.toString();
    }
}
