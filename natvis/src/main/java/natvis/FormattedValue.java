package natvis;

public class FormattedValue {
    final public String text;
    /**
     * null if no visualizer was found for the value
     */
    final public VisualizerId[] maybeNull_uiVisualizers;

    public FormattedValue(String text, VisualizerId[] maybeNull_uiVisualizers) {
        this.text = text;
        this.maybeNull_uiVisualizers = maybeNull_uiVisualizers;
    }
}
