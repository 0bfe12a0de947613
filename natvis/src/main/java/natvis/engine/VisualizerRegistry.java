package natvis.engine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import natvis.IDefinitionStore;
import natvis.ITypePatternMatcher;
import natvis.rules.NatvisDocument;
import natvis.rules.NatvisDocumentException;
import natvis.rules.NatvisDocumentReader;
import natvis.rules.VisualizerDefinition;
import natvis.typename.TypeName;

/**
 * All loaded rule documents, searched in load order and then declaration order.
 *
 * Loading may happen on a different thread than lookups. Appends are serialized on `loadLock`;
 * lookups iterate a copy-on-write snapshot and never see a partially registered document.
 */
public class VisualizerRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(VisualizerRegistry.class);

    private final ITypePatternMatcher matcher;
    private final NatvisDocumentReader reader;
    private final List<DefinitionFile> files = new CopyOnWriteArrayList<>();
    private final Object loadLock = new Object();

    public VisualizerRegistry(ITypePatternMatcher matcher, NatvisDocumentReader reader) {
        this.matcher = matcher;
        this.reader = reader;
    }

    public void loadAll(IDefinitionStore store) {
        final List<IDefinitionStore.IRuleDocument> documents;
        try {
            documents = store.getDocuments();
        }
        catch (RuntimeException e) {
            LOG.warn("natvis: couldn't enumerate rule documents: {}", e.getMessage());
            return;
        }
        for (var document : documents) {
            load(document);
        }
    }

    /**
     * @return false if the document couldn't be read; that is reported but not fatal
     */
    public boolean load(IDefinitionStore.IRuleDocument document) {
        final var origin = document.getOrigin();
        try (var in = document.open()) {
            register(reader.read(in, origin));
            return true;
        }
        catch (IOException e) {
            LOG.warn("natvis: couldn't read '{}': {}", origin, e.getMessage());
            return false;
        }
        catch (NatvisDocumentException e) {
            LOG.warn("natvis: {}", e.getMessage());
            return false;
        }
        catch (RuntimeException e) {
            // don't allow a bad rule file to stop debugging
            LOG.warn("natvis: error reading '{}': {}", origin, e.toString());
            return false;
        }
    }

    public void register(NatvisDocument document) {
        final var visualizers = new ArrayList<DefinitionFile.TypeEntry>();
        final var aliases = new ArrayList<DefinitionFile.AliasEntry>();

        for (var v : document.types) {
            addTypeEntry(visualizers, v.name, v, document.origin);
            for (var alternative : v.alternativeTypes) {
                addTypeEntry(visualizers, alternative, v, document.origin);
            }
        }

        for (var a : document.aliases) {
            final var pattern = matcher.parse(a.name);
            if (pattern.isPresent()) {
                aliases.add(new DefinitionFile.AliasEntry(pattern.get(), a));
            }
            else {
                LOG.warn("natvis: {}: skipping <Alias> with unparsable Name '{}'", document.origin, a.name);
            }
        }

        final var file = new DefinitionFile(document.origin, visualizers, aliases, document.uiVisualizers);
        synchronized (loadLock) {
            files.add(file);
        }
        LOG.debug("natvis: loaded '{}' ({} type patterns, {} aliases)", document.origin, visualizers.size(), aliases.size());
    }

    private void addTypeEntry(List<DefinitionFile.TypeEntry> into, String name, VisualizerDefinition v, String origin) {
        final var pattern = matcher.parse(name);
        if (pattern.isPresent()) {
            into.add(new DefinitionFile.TypeEntry(pattern.get(), v));
        }
        else {
            LOG.warn("natvis: {}: skipping type pattern '{}', it doesn't parse", origin, name);
        }
    }

    public List<DefinitionFile> getFiles() {
        return files;
    }

    /**
     * @return the first visualizer entry whose pattern matches, or null
     */
    public DefinitionFile.TypeEntry maybeNull_findVisualizer(TypeName name) {
        for (var file : files) {
            for (var entry : file.visualizers) {
                if (matcher.match(name, entry.pattern)) {
                    return entry;
                }
            }
        }
        return null;
    }

    /**
     * @return the first alias entry whose pattern matches, or null
     */
    public DefinitionFile.AliasEntry maybeNull_findAlias(TypeName name) {
        for (var file : files) {
            for (var entry : file.aliases) {
                if (matcher.match(name, entry.pattern)) {
                    return entry;
                }
            }
        }
        return null;
    }

    /**
     * Scans every file's UI visualizer registrations; a later registration of the same (serviceId, id) wins.
     * @return the menu label, or "" if there is no such registration
     */
    public String getUiVisualizerName(String serviceId, int id) {
        String result = "";
        for (var file : files) {
            for (var ui : file.uiVisualizers) {
                if (ui.serviceId.equals(serviceId) && ui.id == id) {
                    result = ui.menuName;
                    break;
                }
            }
        }
        return result;
    }
}
