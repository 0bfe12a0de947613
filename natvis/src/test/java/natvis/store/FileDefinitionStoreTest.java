package natvis.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import natvis.NatvisConfig;
import natvis.engine.NatvisSession;
import natvis.testutils.FakeProcess;
import natvis.testutils.NatvisUtils;

class FileDefinitionStoreTest {
    @TempDir
    Path tmp;

    private Path write(Path dir, String name, String contents) throws IOException {
        Files.createDirectories(dir);
        return Files.write(dir.resolve(name), contents.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void aRelativeNameIsLookedUpNextToTheExecutableFirst() throws IOException {
        final var exeDir = tmp.resolve("bin");
        final var globalDir = tmp.resolve("global");
        final var local = write(exeDir, "app.natvis", NatvisUtils.natvis());
        write(globalDir, "app.natvis", NatvisUtils.natvis());

        final var documents = FileDefinitionStore.locate("app.natvis", exeDir, globalDir).getDocuments();
        assertEquals(1, documents.size());
        assertEquals(local.toString(), documents.get(0).getOrigin());
    }

    @Test
    void thenInTheGlobalDirectory() throws IOException {
        final var globalDir = tmp.resolve("global");
        final var global = write(globalDir, "app.natvis", NatvisUtils.natvis());

        final var documents = FileDefinitionStore.locate("app.natvis", tmp.resolve("bin"), globalDir).getDocuments();
        assertEquals(List.of(global.toString()), List.of(documents.get(0).getOrigin()));
    }

    @Test
    void anAbsoluteNameIsUsedAsIs() throws IOException {
        final var file = write(tmp.resolve("elsewhere"), "x.natvis", NatvisUtils.natvis());
        final var documents = FileDefinitionStore.locate(file.toString(), null, null).getDocuments();
        assertEquals(file.toString(), documents.get(0).getOrigin());
    }

    @Test
    void aMissingFileYieldsNoDocuments() {
        assertEquals(0, FileDefinitionStore.locate("nope.natvis", tmp, tmp).getDocuments().size());
        assertEquals(0, FileDefinitionStore.locate("", tmp, tmp).getDocuments().size());
    }

    @Test
    void filesLoadIntoASession() throws IOException {
        final var good = write(tmp, "good.natvis", NatvisUtils.natvis("<Type Name='Foo'><DisplayString>foo!</DisplayString></Type>"));
        final var gone = tmp.resolve("gone.natvis");

        final var session = new NatvisSession(new NatvisConfig(true));
        session.loadAll(FileDefinitionStore.ofFiles(List.of(gone, good)));

        final var process = new FakeProcess();
        assertEquals("foo!", session.formatDisplayString(process.variable("f", "Foo", "{...}")).text);
    }
}
