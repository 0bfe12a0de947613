package natvis.rules;

/**
 * A typedef-like rewrite, e.g. `<Alias Name="MyVec&lt;*&gt;" Value="std::vector&lt;$T1&gt;"/>`
 */
public final class AliasDefinition {
    public final String name;
    /**
     * target type name; may reference `$T1`..`$Tn` of the matched name
     */
    public final String value;

    public AliasDefinition(String name, String value) {
        this.name = name;
        this.value = value;
    }
}
