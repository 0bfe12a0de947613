package natvis;

import java.util.Optional;

import natvis.typename.TypeName;

/**
 * Parses raw type name strings and does wildcard-aware matching between them.
 */
public interface ITypePatternMatcher {
    /**
     * @return empty if `rawTypeName` isn't a well formed type name or pattern
     */
    public Optional<TypeName> parse(String rawTypeName);

    public boolean match(TypeName candidate, TypeName pattern);
}
