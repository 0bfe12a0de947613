package natvis.rules;

/**
 * e.g. `<DisplayString Condition="size == 0">empty</DisplayString>`
 */
public final class DisplayStringRule {
    /**
     * literal text with `{expr}` spans; `{{` and `}}` are escaped braces
     */
    public final String template;
    public final String maybeNull_condition;

    public DisplayStringRule(String template, String maybeNull_condition) {
        this.template = template;
        this.maybeNull_condition = maybeNull_condition;
    }
}
