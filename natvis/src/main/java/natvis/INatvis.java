package natvis;

import java.util.Optional;

/**
 * The host-facing surface of one debug session's visualizer core.
 *
 * Every call is best effort: a broken rule never turns into an exception here, the value's native
 * presentation is used instead.
 */
public interface INatvis {
    public void loadAll(IDefinitionStore store);

    /**
     * @return false if the document was skipped
     */
    public boolean load(IDefinitionStore.IRuleDocument document);

    public Optional<VisualizerBinding> resolve(IVariable variable);

    public FormattedValue formatDisplayString(IVariable variable);

    /**
     * note we return an array, the host pages through it as it likes
     */
    public IVariable[] expand(IVariable variable);

    /**
     * Evaluates a user expression in `frame`. A trailing ",viz" asks for the visualized view of the result.
     */
    public IVariable getVariable(String expression, IExpressionContext frame);

    /**
     * @return the menu label registered for a UI visualizer, or "" if there isn't one
     */
    public String getUiVisualizerName(String serviceId, int id);

    /**
     * true if this exact value (by identity) got its display string from a visualizer
     */
    public boolean isVisualized(IVariable variable);

    public NatvisConfig getConfig();
}
