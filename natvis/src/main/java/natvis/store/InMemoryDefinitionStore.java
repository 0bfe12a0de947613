package natvis.store;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import natvis.IDefinitionStore;

/**
 * Rule documents held as strings, e.g. visualizers embedded in a host or handed over by a client.
 */
public class InMemoryDefinitionStore implements IDefinitionStore {
    private final List<IRuleDocument> documents = new ArrayList<>();

    public InMemoryDefinitionStore add(String origin, String xml) {
        final var bytes = xml.getBytes(StandardCharsets.UTF_8);
        documents.add(new IRuleDocument() {
            public String getOrigin() {
                return origin;
            }
            public InputStream open() {
                return new ByteArrayInputStream(bytes);
            }
        });
        return this;
    }

    public List<IRuleDocument> getDocuments() {
        return new ArrayList<>(documents);
    }
}
