package io.typecheck.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Uniform read access to array-, string-, number- and object-like values,
 * whether they are plain Java values or Jackson {@link JsonNode} trees.
 *
 * <p>
 * Intended for condition predicates, which are only called on values that
 * already passed their type prerequisites. Calling an accessor on a value of
 * the wrong kind is a programming error and raises
 * {@link IllegalArgumentException}.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class Values {

    private Values() {}

    /**
     * Returns the elements of an array-like value (Java array, collection or
     * JSON array) in iteration order.
     */
    public static List<Object> elements(Object value) {
        if (value instanceof JsonNode node && node.isArray()) {
            List<Object> out = new ArrayList<>(node.size());
            node.forEach(out::add);
            return out;
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> out = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                out.add(Array.get(value, i));
            }
            return out;
        }
        throw new IllegalArgumentException("Not an array-like value: " + describe(value));
    }

    /**
     * Returns the member values of an object-like value: map values, JSON
     * object field values. Other objects have no enumerable members.
     */
    public static List<Object> members(Object value) {
        if (value instanceof JsonNode node) {
            List<Object> out = new ArrayList<>(node.size());
            if (node.isObject()) {
                Iterator<JsonNode> it = node.elements();
                it.forEachRemaining(out::add);
            }
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            return new ArrayList<>(map.values());
        }
        return List.of();
    }

    /** Returns the length of a string-like or array-like value. */
    public static int length(Object value) {
        if (value instanceof JsonNode node) {
            if (node.isTextual()) {
                return node.textValue().length();
            }
            if (node.isArray()) {
                return node.size();
            }
        }
        if (value instanceof CharSequence text) {
            return text.length();
        }
        if (value instanceof Character) {
            return 1;
        }
        if (value instanceof Collection<?> collection) {
            return collection.size();
        }
        if (value != null && value.getClass().isArray()) {
            return Array.getLength(value);
        }
        throw new IllegalArgumentException("Value has no length: " + describe(value));
    }

    /** Returns the text of a string-like value. */
    public static String text(Object value) {
        if (value instanceof JsonNode node && node.isTextual()) {
            return node.textValue();
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return value.toString();
        }
        throw new IllegalArgumentException("Not a string value: " + describe(value));
    }

    /** Returns a number-like value as a double. */
    public static double number(Object value) {
        if (value instanceof JsonNode node && node.isNumber()) {
            return node.doubleValue();
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException("Not a number value: " + describe(value));
    }

    /**
     * Returns {@code true} if a number-like value has no fractional part.
     * Infinite values are not integral.
     */
    public static boolean isIntegral(Object value) {
        if (value instanceof JsonNode node && node.isIntegralNumber()) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
        }
        if (value instanceof JsonNode node && node.isBigDecimal()) {
            return isIntegral(node.decimalValue());
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return true;
        }
        double d = number(value);
        return !Double.isInfinite(d) && d % 1 == 0;
    }

    /** Returns the boolean of a boolean-like value. */
    public static boolean bool(Object value) {
        if (value instanceof JsonNode node && node.isBoolean()) {
            return node.booleanValue();
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException("Not a boolean value: " + describe(value));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
