package natvis.rules;

import java.util.Collections;
import java.util.List;

import natvis.VisualizerId;

/**
 * One `<Type>` element.
 */
public final class VisualizerDefinition {
    public final String name;
    public final List<String> alternativeTypes;
    /**
     * in declaration order; the first one whose condition passes is used
     */
    public final List<DisplayStringRule> displayStrings;
    /**
     * null if the type has no `<Expand>` element (an empty `<Expand/>` is an empty list)
     */
    public final List<ExpandRule> maybeNull_expandRules;
    public final List<VisualizerId> uiVisualizers;

    public VisualizerDefinition(
        String name,
        List<String> alternativeTypes,
        List<DisplayStringRule> displayStrings,
        List<ExpandRule> maybeNull_expandRules,
        List<VisualizerId> uiVisualizers
    ) {
        this.name = name;
        this.alternativeTypes = Collections.unmodifiableList(alternativeTypes);
        this.displayStrings = Collections.unmodifiableList(displayStrings);
        this.maybeNull_expandRules = maybeNull_expandRules == null ? null : Collections.unmodifiableList(maybeNull_expandRules);
        this.uiVisualizers = Collections.unmodifiableList(uiVisualizers);
    }

    public boolean hasExpandRules() {
        return maybeNull_expandRules != null;
    }
}
