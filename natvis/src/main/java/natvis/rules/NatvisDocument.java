package natvis.rules;

import java.util.Collections;
import java.util.List;

/**
 * The contents of one `<AutoVisualizer>` document, before type patterns are parsed.
 */
public final class NatvisDocument {
    public final String origin;
    public final List<VisualizerDefinition> types;
    public final List<AliasDefinition> aliases;
    public final List<UiVisualizerRegistration> uiVisualizers;

    public NatvisDocument(String origin, List<VisualizerDefinition> types, List<AliasDefinition> aliases, List<UiVisualizerRegistration> uiVisualizers) {
        this.origin = origin;
        this.types = Collections.unmodifiableList(types);
        this.aliases = Collections.unmodifiableList(aliases);
        this.uiVisualizers = Collections.unmodifiableList(uiVisualizers);
    }
}
