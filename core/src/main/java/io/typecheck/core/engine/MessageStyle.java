package io.typecheck.core.engine;

/**
 * Rendering settings for expected-value messages.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param alternativeSeparator   separator placed between the rendered
 *                               alternatives (default: {@code " OR "})
 * @param missingTypePlaceholder noun rendered when no condition of an
 *                               alternative contributed a type (default:
 *                               {@code "value"})
 */
public record MessageStyle(String alternativeSeparator, String missingTypePlaceholder) {

    /** Default style: {@code " OR "} between alternatives, {@code "value"} for a missing type. */
    public static final MessageStyle DEFAULT = new MessageStyle(" OR ", "value");

    public MessageStyle {
        if (alternativeSeparator == null || alternativeSeparator.isBlank()) {
            throw new IllegalArgumentException("alternativeSeparator must not be blank");
        }
        if (missingTypePlaceholder == null || missingTypePlaceholder.isBlank()) {
            throw new IllegalArgumentException("missingTypePlaceholder must not be blank");
        }
    }
}
