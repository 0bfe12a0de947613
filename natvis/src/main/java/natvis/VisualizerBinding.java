package natvis;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import natvis.rules.VisualizerDefinition;
import natvis.typename.TypeName;

/**
 * A visualizer matched to a concrete type, with `$T1`..`$Tn` bound to that type's template arguments.
 */
public final class VisualizerBinding {
    public final VisualizerDefinition visualizer;
    private final Map<String, String> scopedNames;

    public VisualizerBinding(VisualizerDefinition visualizer, TypeName matchedName) {
        this.visualizer = visualizer;
        final var names = new HashMap<String, String>();
        final var args = matchedName.getArgs();
        for (int i = 0; i < args.size(); ++i) {
            names.put("$T" + (i + 1), args.get(i).getFullyQualifiedName());
        }
        this.scopedNames = Collections.unmodifiableMap(names);
    }

    /**
     * placeholder -> concrete type text, e.g. "$T1" -> "std::string"
     */
    public Map<String, String> getScopedNames() {
        return scopedNames;
    }

    public VisualizerId[] getUiVisualizers() {
        return visualizer.uiVisualizers.toArray(new VisualizerId[0]);
    }
}
