package io.typecheck.core.model;

/**
 * Closed set of runtime type tags produced by
 * {@link io.typecheck.core.engine.ValueClassifier#classify(Object)}.
 *
 * <p>
 * Each tag renders as its lower-case name ({@code NaN} keeps its casing) so
 * that {@code is} messages read naturally, e.g. "an array" or "a NaN".
 */
public enum ValueType {
    ARRAY("array"),
    NAN("NaN"),
    NULL("null"),
    STRING("string"),
    NUMBER("number"),
    BIGINT("bigint"),
    BOOLEAN("boolean"),
    SYMBOL("symbol"),
    UNDEFINED("undefined"),
    OBJECT("object"),
    FUNCTION("function");

    private final String tag;

    ValueType(String tag) {
        this.tag = tag;
    }

    /** The tag as it appears in rendered messages. */
    public String tag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
