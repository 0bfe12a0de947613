package natvis.engine;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.collect.MapMaker;

import natvis.IVariable;

/**
 * Hands out DAP `variablesReference` ids for values shown to the client.
 *
 * Most values shown are made on the fly (view nodes, evaluated items), so nothing else keeps them alive:
 * a tracked value is held until {@link #clear()}, which the host calls when the debuggee resumes and every
 * reference it handed out is stale. Registering the same value (by identity) twice yields the same id.
 */
public class VariableTracker {
    /**
     * guava's weakKeys() compares keys with ==, which is what we want for values that
     * may well implement equals in terms of their display text
     */
    private final ConcurrentMap<IVariable, TaggedVariable> taggedByVariable = new MapMaker()
        .concurrencyLevel(/* default as per docs */ 4)
        .weakKeys()
        .makeMap();
    private final Map<Integer, TaggedVariable> taggedByID = new ConcurrentHashMap<>();

    // 0 means "no children" to a DAP client
    private final AtomicInteger nextId = new AtomicInteger(1);

    public static class TaggedVariable {
        public final int id;

        /**
         * nonNull
         */
        public final IVariable variable;

        private TaggedVariable(int id, IVariable variable) {
            this.id = id;
            this.variable = Objects.requireNonNull(variable);
        }
    }

    /**
     * Always succeeds, returning an existing or freshly assigned id.
     */
    public TaggedVariable idempotentRegisterVariable(IVariable variable) {
        Objects.requireNonNull(variable);
        return taggedByVariable.computeIfAbsent(variable, v -> {
            final var fresh = new TaggedVariable(nextId.getAndIncrement(), v);
            taggedByID.put(fresh.id, fresh);
            return fresh;
        });
    }

    /**
     * @return TaggedVariable | null if the id was never handed out, or was handed out before the last clear()
     */
    public TaggedVariable maybeNull_getFromId(int id) {
        return taggedByID.get(id);
    }

    public void clear() {
        taggedByID.clear();
        taggedByVariable.clear();
    }
}
