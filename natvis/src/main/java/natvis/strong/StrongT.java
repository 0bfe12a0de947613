package natvis.strong;

import java.util.Objects;

/**
 * Derived classes are final, simple "strong" wrappers around the underlying type `T`,
 * so that e.g. a raw type name and an already parsed-and-rewritten alias target can't be mixed up.
 */
public abstract class StrongT<T> {
    private final T v;

    StrongT(T v) {
        this.v = Objects.requireNonNull(v);
    }

    public T get() {
        return v;
    }

    @Override
    public int hashCode() {
        return v.hashCode();
    }

    @Override
    public boolean equals(Object other) {
        return other != null
            && other.getClass() == this.getClass()
            && v.equals(((StrongT<?>)other).v);
    }

    @Override
    public String toString() {
        return v.toString();
    }
}
