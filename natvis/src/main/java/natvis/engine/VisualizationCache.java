package natvis.engine;

import java.util.Collections;
import java.util.Set;

import com.google.common.collect.MapMaker;

import natvis.IVariable;

/**
 * The values whose display string came from a visualizer in this session.
 *
 * Keyed by identity (guava's weak keys compare with ==), and weakly, so values the host drops aren't retained.
 */
public class VisualizationCache {
    private final Set<IVariable> visualized = Collections.newSetFromMap(
        new MapMaker()
            .concurrencyLevel(/* default as per docs */ 4)
            .weakKeys()
            .<IVariable, Boolean>makeMap()
    );

    public void add(IVariable variable) {
        visualized.add(variable);
    }

    public boolean contains(IVariable variable) {
        return visualized.contains(variable);
    }
}
