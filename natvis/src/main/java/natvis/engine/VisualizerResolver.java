package natvis.engine;

import java.util.HashMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import natvis.ITypePatternMatcher;
import natvis.IVariable;
import natvis.NatvisConfig;
import natvis.VisualizerBinding;
import natvis.strong.ConcreteTypeName;
import natvis.typename.TypeName;
import natvis.view.VisualizerWrapper;

/**
 * Finds the visualizer for a value: direct match, then with one pointer/reference marker stripped,
 * then through aliases, then the same again for each base class in turn.
 *
 * Results are cached per concrete type name for the life of the session; the cache is only ever added to.
 * Misses aren't cached.
 */
public class VisualizerResolver {
    private final VisualizerRegistry registry;
    private final ITypePatternMatcher matcher;
    private final ExpressionSubstitution substitution;
    private final ConcurrentMap<ConcreteTypeName, VisualizerBinding> vizCache = new ConcurrentHashMap<>();

    public VisualizerResolver(VisualizerRegistry registry, ITypePatternMatcher matcher, ExpressionSubstitution substitution) {
        this.registry = registry;
        this.matcher = matcher;
        this.substitution = substitution;
    }

    /**
     * @return VisualizerBinding | null if no visualizer applies
     */
    public VisualizerBinding maybeNull_findType(IVariable variable) {
        if (variable instanceof VisualizerWrapper) {
            return ((VisualizerWrapper)variable).getVisualizer();
        }

        final var cacheKey = ConcreteTypeName.of(variable);
        final var cached = vizCache.get(cacheKey);
        if (cached != null) {
            return cached;
        }

        var parsedName = matcher.parse(variable.getTypeName()).orElse(null);
        IVariable current = variable;
        while (parsedName != null) {
            var visualizer = maybeNull_scan(parsedName, cacheKey);
            if (visualizer == null && parsedName.endsWithPointerOrReference()) {
                visualizer = maybeNull_scan(parsedName.withoutTrailingMarker(), cacheKey);
            }
            if (visualizer != null) {
                return visualizer;
            }
            // only the first base class is followed
            current = maybeNull_findBaseClass(current);
            if (current == null) {
                break;
            }
            parsedName = matcher.parse(current.getTypeName()).orElse(null);
        }
        return null;
    }

    /**
     * Searches visualizers, then aliases; a matching alias restarts the search with the alias target,
     * at most {@link NatvisConfig#MAX_ALIAS_CHAIN} times.
     */
    private VisualizerBinding maybeNull_scan(TypeName name, ConcreteTypeName cacheKey) {
        int aliasChain = 0;
        while (name != null) {
            final var visualizer = registry.maybeNull_findVisualizer(name);
            if (visualizer != null) {
                final var binding = new VisualizerBinding(visualizer.visualizer, name);
                final var existing = vizCache.putIfAbsent(cacheKey, binding);
                return existing != null ? existing : binding;
            }

            // failed to find a visualizer for the type, try looking for a typedef
            final var alias = registry.maybeNull_findAlias(name);
            if (alias == null) {
                return null;
            }

            final var scopedNames = new HashMap<String, String>();
            int t = 1;
            for (var arg : name.getFlattenedArgs()) {
                scopedNames.put("$T" + t, arg.getFullyQualifiedName());
                t++;
            }

            aliasChain++;
            if (aliasChain > NatvisConfig.MAX_ALIAS_CHAIN) {
                return null;
            }
            final var newName = substitution.replaceNamesInExpression(alias.alias.value, null, scopedNames);
            name = matcher.parse(newName).orElse(null);
        }
        return null;
    }

    private static IVariable maybeNull_findBaseClass(IVariable variable) {
        for (var child : variable.getChildren()) {
            if (child.getNodeType() == IVariable.NodeType.BASE_CLASS) {
                return child;
            }
        }
        return null;
    }
}
