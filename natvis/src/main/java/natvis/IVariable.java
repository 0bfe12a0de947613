package natvis;

/**
 * A live value in the debuggee, as exposed by the host's expression engine.
 *
 * The visualizer core only reads from a variable, or asks it to evaluate a further expression
 * in the same thread/frame context. It never mutates one.
 */
public interface IVariable {
    public static enum NodeType {
        FIELD, BASE_CLASS, ARRAY_ELEMENT, SYNTHETIC
    }

    /**
     * name as displayed, e.g. "m_head" or "[3]"
     */
    public String getName();

    /**
     * a path expression that re-evaluates to this variable in its frame, e.g. "list.m_head"
     */
    public String getFullName();

    /**
     * the native (non-visualized) display text; for pointers this starts with the address, e.g. "0x7ffe1000"
     */
    public String getValue();

    public String getTypeName();

    public NodeType getNodeType();

    public boolean isError();

    /**
     * true if this variable was produced as part of a visualized expansion, so its
     * display string should be computed even when display strings are only on for visualized items.
     */
    public boolean isVisualized();

    /**
     * true if the host already rendered a final display string for this value (e.g. a format specifier was applied)
     */
    public boolean isPreformatted();

    public boolean isReadOnly();

    public boolean isStringType();

    public int getThreadId();

    public String getAddress();

    public long getSize();

    public int getChildCount();

    /**
     * Direct children in native order, fetching them first if necessary. Never null.
     */
    public IVariable[] getChildren();

    /**
     * @return IVariable | null
     */
    public IVariable findChildByName(String name);

    /**
     * Synchronously evaluates `expression` in this variable's thread/frame context.
     * Never returns null; failures are reported through {@link #isError()} on the result, whose value is then the error text.
     *
     * @param maybeNull_displayName name for the result; if null, the expression text is used
     */
    public IVariable evaluate(String expression, String maybeNull_displayName);
}
