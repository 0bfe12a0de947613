package natvis.rules;

/**
 * An expression template guarded by an optional condition, e.g. `<ValuePointer Condition="_isSmall">_buf</ValuePointer>`
 */
public final class ConditionalExpression {
    public final String value;
    /**
     * null or blank means "always"
     */
    public final String maybeNull_condition;

    public ConditionalExpression(String value, String maybeNull_condition) {
        this.value = value;
        this.maybeNull_condition = maybeNull_condition;
    }
}
