package natvis;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Source of rule documents. Discovery (search paths, project files, etc.) is up to the host.
 */
public interface IDefinitionStore {
    public interface IRuleDocument {
        /**
         * a label for diagnostics, typically a file path
         */
        public String getOrigin();

        /**
         * The caller closes the stream.
         */
        public InputStream open() throws IOException;
    }

    public List<IRuleDocument> getDocuments();
}
