package natvis.engine;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import natvis.IDefinitionStore;
import natvis.rules.NatvisDocumentReader;
import natvis.store.InMemoryDefinitionStore;
import natvis.testutils.NatvisUtils;
import natvis.typename.CppTypePatternMatcher;

class VisualizerRegistryTest {
    private final CppTypePatternMatcher matcher = new CppTypePatternMatcher();
    private final VisualizerRegistry registry = new VisualizerRegistry(matcher, new NatvisDocumentReader());

    private static IDefinitionStore.IRuleDocument unreadable(String origin) {
        return new IDefinitionStore.IRuleDocument() {
            public String getOrigin() {
                return origin;
            }
            public InputStream open() throws IOException {
                throw new IOException("no such file");
            }
        };
    }

    @Test
    void badDocumentsAreSkippedAndLoadingContinues() {
        final var store = new InMemoryDefinitionStore()
            .add("broken.natvis", "<AutoVisualizer><Type Name='A'>")
            .add("wrong-root.natvis", "<Visualizers/>")
            .add("good.natvis", NatvisUtils.natvis("<Type Name='A'><DisplayString>a</DisplayString></Type>"));

        registry.loadAll(store);

        assertEquals(1, registry.getFiles().size());
        assertEquals("good.natvis", registry.getFiles().get(0).origin);
        assertFalse(registry.load(unreadable("missing.natvis")));
        assertEquals(1, registry.getFiles().size());
    }

    @Test
    void unparsablePatternsAreSkipped() {
        registry.loadAll(new InMemoryDefinitionStore().add("x.natvis", NatvisUtils.natvis(
            "<Type Name='Foo&lt;'><DisplayString>bad</DisplayString></Type>",
            "<Type Name='Foo'><AlternativeType Name='&gt;Bar'/><DisplayString>good</DisplayString></Type>",
            "<Alias Name='::' Value='Foo'/>"
        )));
        final var file = registry.getFiles().get(0);
        assertEquals(1, file.visualizers.size());
        assertEquals("Foo", file.visualizers.get(0).visualizer.name);
        assertEquals(0, file.aliases.size());
    }

    @Test
    void searchesFilesInLoadOrderThenDeclarationOrder() {
        registry.loadAll(new InMemoryDefinitionStore()
            .add("first.natvis", NatvisUtils.natvis(
                "<Type Name='Foo&lt;int&gt;'><DisplayString>first-exact</DisplayString></Type>",
                "<Type Name='Foo&lt;*&gt;'><DisplayString>first-wild</DisplayString></Type>"
            ))
            .add("second.natvis", NatvisUtils.natvis(
                "<Type Name='Foo&lt;*&gt;'><DisplayString>second-wild</DisplayString></Type>",
                "<Type Name='Bar'><DisplayString>second-bar</DisplayString></Type>"
            ))
        );

        assertEquals("Foo<int>", registry.maybeNull_findVisualizer(matcher.parse("Foo<int>").get()).visualizer.name);
        assertEquals("first-wild", registry.maybeNull_findVisualizer(matcher.parse("Foo<char>").get()).visualizer.displayStrings.get(0).template);
        assertEquals("Bar", registry.maybeNull_findVisualizer(matcher.parse("Bar").get()).visualizer.name);
        assertNull(registry.maybeNull_findVisualizer(matcher.parse("Baz").get()));
    }

    @Test
    void laterUiVisualizerRegistrationsWin() {
        registry.loadAll(new InMemoryDefinitionStore()
            .add("a.natvis", NatvisUtils.natvis(
                "<UIVisualizer ServiceId='{svc}' Id='1' MenuName='Old Viewer'/>",
                "<UIVisualizer ServiceId='{svc}' Id='2' MenuName='Other'/>"
            ))
            .add("b.natvis", NatvisUtils.natvis("<UIVisualizer ServiceId='{svc}' Id='1' MenuName='New Viewer'/>"))
        );

        assertEquals("New Viewer", registry.getUiVisualizerName("{svc}", 1));
        assertEquals("Other", registry.getUiVisualizerName("{svc}", 2));
        assertEquals("", registry.getUiVisualizerName("{svc}", 3));
        assertEquals("", registry.getUiVisualizerName("{other}", 1));
    }

    @Test
    void aStoreThatThrowsLoadsNothing() {
        registry.loadAll(() -> {
            throw new IllegalStateException("can't list documents");
        });
        assertEquals(List.of(), registry.getFiles());
    }
}
