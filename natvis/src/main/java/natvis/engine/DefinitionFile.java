package natvis.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import natvis.rules.AliasDefinition;
import natvis.rules.UiVisualizerRegistration;
import natvis.rules.VisualizerDefinition;
import natvis.typename.TypeName;

/**
 * A loaded rule document with its type patterns parsed, in declaration order.
 * A definition with alternative types appears once per pattern.
 */
public final class DefinitionFile {
    public static final class TypeEntry {
        public final TypeName pattern;
        public final VisualizerDefinition visualizer;

        TypeEntry(TypeName pattern, VisualizerDefinition visualizer) {
            this.pattern = pattern;
            this.visualizer = visualizer;
        }
    }

    public static final class AliasEntry {
        public final TypeName pattern;
        public final AliasDefinition alias;

        AliasEntry(TypeName pattern, AliasDefinition alias) {
            this.pattern = pattern;
            this.alias = alias;
        }
    }

    public final String origin;
    public final List<TypeEntry> visualizers;
    public final List<AliasEntry> aliases;
    public final List<UiVisualizerRegistration> uiVisualizers;

    DefinitionFile(String origin, List<TypeEntry> visualizers, List<AliasEntry> aliases, List<UiVisualizerRegistration> uiVisualizers) {
        this.origin = origin;
        this.visualizers = Collections.unmodifiableList(new ArrayList<>(visualizers));
        this.aliases = Collections.unmodifiableList(new ArrayList<>(aliases));
        this.uiVisualizers = Collections.unmodifiableList(new ArrayList<>(uiVisualizers));
    }
}
