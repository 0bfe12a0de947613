package natvis.typename;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured form of a type name or type pattern, e.g. `std::map<int, Foo*>::iterator const *`
 * is qualifiers [std, map<int, Foo*>], base name "iterator", no args, suffix "const*".
 *
 * Immutable.
 */
public final class TypeName {
    public static final String WILDCARD = "*";
    private static final String[] cvQualifiers = { "const", "volatile" };

    private final List<TypeName> qualifiers;
    private final String baseName;
    private final List<TypeName> args;
    /**
     * pointer/reference markers, cv-qualifiers and array extents following the name, whitespace removed
     */
    private final String suffix;
    private final String fullyQualifiedName;

    TypeName(List<TypeName> qualifiers, String baseName, List<TypeName> args, String suffix, String fullyQualifiedName) {
        this.qualifiers = Collections.unmodifiableList(new ArrayList<>(qualifiers));
        this.baseName = baseName;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.suffix = suffix;
        this.fullyQualifiedName = fullyQualifiedName;
    }

    static TypeName wildcard() {
        return new TypeName(List.of(), WILDCARD, List.of(), "", WILDCARD);
    }

    /**
     * enclosing scopes, outermost first
     */
    public List<TypeName> getQualifiers() {
        return qualifiers;
    }

    public String getBaseName() {
        return baseName;
    }

    /**
     * template arguments of the innermost name
     */
    public List<TypeName> getArgs() {
        return args;
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * The name as written (trimmed). This is the text a `$Tn` placeholder is replaced with.
     */
    public String getFullyQualifiedName() {
        return fullyQualifiedName;
    }

    public boolean isWildcard() {
        return WILDCARD.equals(baseName) && qualifiers.isEmpty() && args.isEmpty() && suffix.isEmpty();
    }

    /**
     * Template arguments of every scope in the chain, outermost first, followed by this name's own arguments.
     */
    public List<TypeName> getFlattenedArgs() {
        var result = new ArrayList<TypeName>();
        for (var q : qualifiers) {
            result.addAll(q.getArgs());
        }
        result.addAll(args);
        return result;
    }

    /**
     * Trailing cv-qualifiers don't count, `Foo * const` ends with a pointer.
     */
    public boolean endsWithPointerOrReference() {
        final var s = withoutTrailingCv(suffix);
        return s.endsWith("*") || s.endsWith("&");
    }

    /**
     * `Foo<int> *` -> `Foo<int>`, `Foo&&` -> `Foo&`, `Foo * const` -> `Foo`. Returns this if there is no trailing marker.
     */
    public TypeName withoutTrailingMarker() {
        if (!endsWithPointerOrReference()) {
            return this;
        }
        final var s = withoutTrailingCv(suffix);
        final var t = withoutTrailingCv(fullyQualifiedName);
        return new TypeName(qualifiers, baseName, args, s.substring(0, s.length() - 1), t.substring(0, t.length() - 1).trim());
    }

    private static String withoutTrailingCv(String s) {
        var result = s.trim();
        boolean again = true;
        while (again) {
            again = false;
            for (var cv : cvQualifiers) {
                if (result.endsWith(cv)) {
                    result = result.substring(0, result.length() - cv.length()).trim();
                    again = true;
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return fullyQualifiedName;
    }
}
