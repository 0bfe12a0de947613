package natvis.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import natvis.IDefinitionStore;

/**
 * Rule documents on disk.
 *
 * An absolute file name is used as-is. A relative one is looked up next to the debuggee's executable first,
 * then in the global visualizers directory; the first one that exists is used. A file that can't be found
 * is reported and yields no document.
 */
public class FileDefinitionStore implements IDefinitionStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileDefinitionStore.class);

    private final List<Path> files;

    private FileDefinitionStore(List<Path> files) {
        this.files = Collections.unmodifiableList(files);
    }

    public static FileDefinitionStore ofFiles(List<Path> files) {
        return new FileDefinitionStore(new ArrayList<>(files));
    }

    /**
     * @param maybeNull_exeDirectory directory of the debuggee's executable, for local launches
     * @param maybeNull_globalDirectory the host's global visualizers directory
     */
    public static FileDefinitionStore locate(String fileName, Path maybeNull_exeDirectory, Path maybeNull_globalDirectory) {
        final var result = new ArrayList<Path>();
        if (fileName == null || fileName.trim().isEmpty()) {
            return new FileDefinitionStore(result);
        }

        final var path = Path.of(fileName);
        if (path.isAbsolute()) {
            result.add(path);
            return new FileDefinitionStore(result);
        }

        for (var dir : new Path[] {maybeNull_exeDirectory, maybeNull_globalDirectory}) {
            if (dir == null) {
                continue;
            }
            final var candidate = dir.resolve(path);
            if (Files.isRegularFile(candidate)) {
                result.add(candidate);
                return new FileDefinitionStore(result);
            }
        }

        LOG.warn("natvis: couldn't find '{}' (looked in {} and {})", fileName, maybeNull_exeDirectory, maybeNull_globalDirectory);
        return new FileDefinitionStore(result);
    }

    public List<IRuleDocument> getDocuments() {
        final var result = new ArrayList<IRuleDocument>();
        for (var file : files) {
            result.add(new IRuleDocument() {
                public String getOrigin() {
                    return file.toString();
                }
                public InputStream open() throws IOException {
                    return Files.newInputStream(file);
                }
            });
        }
        return result;
    }
}
