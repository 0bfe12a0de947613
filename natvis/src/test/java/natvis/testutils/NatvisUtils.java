package natvis.testutils;

import natvis.NatvisConfig;
import natvis.engine.NatvisSession;
import natvis.store.InMemoryDefinitionStore;

public class NatvisUtils {
    public static final String NS = "http://schemas.microsoft.com/vstudio/debugger/natvis/2010";

    /**
     * Wraps `body` (`<Type>`, `<Alias>`, ... elements) in an `<AutoVisualizer>` document.
     */
    public static String natvis(String... body) {
        final var sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"utf-8\"?>\n");
        sb.append("<AutoVisualizer xmlns=\"" + NS + "\">\n");
        for (var b : body) {
            sb.append(b).append("\n");
        }
        sb.append("</AutoVisualizer>\n");
        return sb.toString();
    }

    public static NatvisSession session(boolean showDisplayStrings, String... body) {
        final var session = new NatvisSession(new NatvisConfig(showDisplayStrings));
        session.loadAll(new InMemoryDefinitionStore().add("test.natvis", natvis(body)));
        return session;
    }
}
