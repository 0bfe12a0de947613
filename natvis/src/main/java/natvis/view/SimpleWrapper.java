package natvis.view;

import natvis.IVariable;

/**
 * Presents an existing value under another name, e.g. a tree node's value shown as "[3]".
 * Everything but the identity accessors is delegated to the wrapped value.
 *
 * Wrappers don't stack: wrapping a wrapper wraps its underlying value instead.
 */
public class SimpleWrapper implements IVariable {
    protected final IVariable parent;
    private final String name;

    public SimpleWrapper(String name, IVariable underlying) {
        this.parent = underlying instanceof SimpleWrapper ? ((SimpleWrapper)underlying).parent : underlying;
        this.name = name;
    }

    public IVariable getWrapped() {
        return parent;
    }

    public String getName() { return name; }
    public String getFullName() { return parent.getFullName(); }
    public String getTypeName() { return parent.getTypeName(); }
    public boolean isVisualized() { return parent.isVisualized(); }

    public String getValue() { return parent.getValue(); }
    public NodeType getNodeType() { return parent.getNodeType(); }
    public boolean isError() { return parent.isError(); }
    public boolean isPreformatted() { return parent.isPreformatted(); }
    public boolean isReadOnly() { return parent.isReadOnly(); }
    public boolean isStringType() { return parent.isStringType(); }
    public int getThreadId() { return parent.getThreadId(); }
    public String getAddress() { return parent.getAddress(); }
    public long getSize() { return parent.getSize(); }
    public int getChildCount() { return parent.getChildCount(); }
    public IVariable[] getChildren() { return parent.getChildren(); }
    public IVariable findChildByName(String name) { return parent.findChildByName(name); }
    public IVariable evaluate(String expression, String maybeNull_displayName) { return parent.evaluate(expression, maybeNull_displayName); }

    @Override
    public String toString() {
        return name + " -> " + parent;
    }
}
