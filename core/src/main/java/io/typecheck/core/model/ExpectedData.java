package io.typecheck.core.model;

/**
 * Running state handed to a {@link ShouldBe.Computed} fragment function.
 *
 * @param type the type noun accumulated so far, or {@code null} if none
 */
public record ExpectedData(String type) {}
