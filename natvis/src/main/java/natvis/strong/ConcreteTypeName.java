package natvis.strong;

import natvis.IVariable;

/**
 * The exact type name string the debugger reported for a value, before any parsing.
 * Resolution results are cached under this key.
 */
public final class ConcreteTypeName extends StrongT<String> {
    public ConcreteTypeName(String v) {
        super(v);
    }

    public static ConcreteTypeName of(IVariable v) {
        final var typeName = v.getTypeName();
        return new ConcreteTypeName(typeName == null ? "" : typeName);
    }
}
