package io.typecheck.core.error;

/**
 * Thrown when a condition or condition factory receives malformed arguments. Raised at
 * construction time, before any value is checked.
 */
public final class ConditionDefinitionException extends TypeCheckException {

    private static final long serialVersionUID = 1L;

    private final String conditionName;

    public ConditionDefinitionException(String message, String conditionName) {
        super(message, Phase.DEFINITION);
        this.conditionName = conditionName;
    }

    /** The name of the condition or factory that rejected its arguments. */
    public String conditionName() {
        return conditionName;
    }
}
