package natvis.view;

import natvis.IVariable;
import natvis.VisualizerBinding;

/**
 * One of the two alternate presentations of a visualized value: the "[Visualizer View]" node (rendered mode),
 * whose children come from the visualizer, or the "[Raw View]" node, whose children are the native ones.
 * Either way it carries the binding it was made with, so resolution is skipped for it.
 */
public final class VisualizerWrapper extends SimpleWrapper {
    public static final String VISUALIZED_VIEW = "[Visualizer View]";
    public static final String RAW_VIEW = "[Raw View]";
    public static final String VIEW_SUFFIX = ",viz";

    private final VisualizerBinding visualizer;
    private final boolean isVisualizerView;

    public VisualizerWrapper(String name, IVariable underlying, VisualizerBinding visualizer, boolean isVisualizerView) {
        super(name, underlying);
        this.visualizer = visualizer;
        this.isVisualizerView = isVisualizerView;
    }

    public VisualizerBinding getVisualizer() {
        return visualizer;
    }

    @Override
    public boolean isVisualized() {
        return isVisualizerView;
    }

    @Override
    public String getTypeName() {
        return "";
    }

    @Override
    public String getFullName() {
        return isVisualizerView ? parent.getFullName() + VIEW_SUFFIX : parent.getFullName();
    }
}
