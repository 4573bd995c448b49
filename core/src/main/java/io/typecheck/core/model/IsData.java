package io.typecheck.core.model;

import java.util.Objects;

/**
 * Data describing a value that did not pass a condition. Handed to
 * {@link IsMessage.Computed} functions.
 *
 * @param value   the value under test, may be null
 * @param type    the classified runtime type of the value
 * @param article the indefinite article ("a" or "an") matching {@code type}
 */
public record IsData(Object value, ValueType type, String article) {

    public IsData {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(article, "article must not be null");
    }
}
