package natvis.engine;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import natvis.FormattedValue;
import natvis.IDefinitionStore;
import natvis.INatvis;
import natvis.IExpressionContext;
import natvis.ITypePatternMatcher;
import natvis.IVariable;
import natvis.NatvisConfig;
import natvis.VisualizerBinding;
import natvis.rules.NatvisDocumentReader;
import natvis.typename.CppTypePatternMatcher;
import natvis.view.VisualizerWrapper;

/**
 * Wires the registry, resolver, formatter and expansion engine together for one debug session.
 * The resolution cache and the visualization set live exactly as long as this object.
 */
public class NatvisSession implements INatvis {
    private static final Logger LOG = LoggerFactory.getLogger(NatvisSession.class);

    private final NatvisConfig config;
    private final VisualizerRegistry registry;
    private final VisualizerResolver resolver;
    private final VisualizationCache cache;
    private final DisplayStringFormatter formatter;
    private final ExpansionEngine expansion;

    public NatvisSession(NatvisConfig config) {
        this(config, new CppTypePatternMatcher());
    }

    public NatvisSession(NatvisConfig config, ITypePatternMatcher matcher) {
        final var substitution = new ExpressionSubstitution();
        this.config = config;
        this.registry = new VisualizerRegistry(matcher, new NatvisDocumentReader());
        this.resolver = new VisualizerResolver(registry, matcher, substitution);
        this.cache = new VisualizationCache();
        this.formatter = new DisplayStringFormatter(config, resolver, substitution, cache);
        this.expansion = new ExpansionEngine(config, resolver, substitution, formatter);
    }

    public void loadAll(IDefinitionStore store) {
        registry.loadAll(store);
    }

    public boolean load(IDefinitionStore.IRuleDocument document) {
        return registry.load(document);
    }

    public Optional<VisualizerBinding> resolve(IVariable variable) {
        try {
            return Optional.ofNullable(resolver.maybeNull_findType(variable));
        }
        catch (Exception e) {
            LOG.debug("natvis resolve: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public FormattedValue formatDisplayString(IVariable variable) {
        return formatter.formatDisplayString(variable);
    }

    public IVariable[] expand(IVariable variable) {
        return expansion.expand(variable);
    }

    public IVariable getVariable(String expression, IExpressionContext frame) {
        final var trimmed = expression.trim();
        if (!trimmed.endsWith(VisualizerWrapper.VIEW_SUFFIX)) {
            return frame.evaluate(expression);
        }

        final var result = frame.evaluate(trimmed.substring(0, trimmed.length() - VisualizerWrapper.VIEW_SUFFIX.length()));
        if (result.isError()) {
            return result;
        }
        final var view = expansion.maybeNull_getVisualizationWrapper(result);
        return view == null ? result : new VisualizerWrapper(expression, result, ((VisualizerWrapper)view).getVisualizer(), true);
    }

    public String getUiVisualizerName(String serviceId, int id) {
        return registry.getUiVisualizerName(serviceId, id);
    }

    public boolean isVisualized(IVariable variable) {
        return cache.contains(variable);
    }

    public NatvisConfig getConfig() {
        return config;
    }
}
