package me.golemcore.interactions.adapter.outbound.resource;

import me.golemcore.interactions.domain.exception.ResourceFailureKind;
import me.golemcore.interactions.domain.exception.ResourceHandlingException;
import me.golemcore.interactions.domain.exception.ResourceOperation;
import me.golemcore.interactions.domain.model.LoadedResource;
import me.golemcore.interactions.domain.model.ResourceMetadata;
import me.golemcore.interactions.infrastructure.config.InteractionsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemResourceConnectorTest {

    @TempDir
    Path tempDir;

    private FileSystemResourceConnector connector;

    @BeforeEach
    void setUp() throws IOException {
        InteractionsProperties properties = new InteractionsProperties();
        properties.getResources().setRoot(tempDir.toString());
        connector = new FileSystemResourceConnector(properties);
        Files.createDirectories(tempDir.resolve("docs"));
        Files.writeString(tempDir.resolve("docs/notes.md"), "# Notes", StandardCharsets.UTF_8);
        Files.write(tempDir.resolve("logo.png"), new byte[] { (byte) 0x89, 'P', 'N', 'G' });
    }

    @Test
    void shouldLoadTextFileWithMetadata() {
        LoadedResource resource = connector.loadResource("docs/notes.md");

        assertEquals("# Notes", new String(resource.getContent(), StandardCharsets.UTF_8));
        ResourceMetadata metadata = resource.getMetadata();
        assertEquals("docs/notes.md", metadata.getUri());
        assertEquals("text/markdown", metadata.getMimeType());
        assertEquals(ResourceMetadata.CONTENT_TEXT, metadata.getContentType());
        assertEquals(7L, metadata.getSize());
        assertNotNull(metadata.getLastModified());
    }

    @Test
    void shouldLoadImageAsImageContent() {
        LoadedResource resource = connector.loadResource("file:logo.png");

        assertEquals("image/png", resource.getMetadata().getMimeType());
        assertTrue(resource.getMetadata().isImage());
        assertEquals(4, resource.getContent().length);
    }

    @Test
    void shouldResolveDataSourceUri() {
        LoadedResource resource = connector.loadResource("rw+local+workspace+file:./docs/notes.md");

        assertEquals("# Notes", new String(resource.getContent(), StandardCharsets.UTF_8));
    }

    @Test
    void shouldStripUriPrefixes() {
        assertEquals("docs/a.md", FileSystemResourceConnector.toRelativePath("file:///docs/a.md"));
        assertEquals("./a.md", FileSystemResourceConnector.toRelativePath("r+gh+repo+file:./a.md"));
        assertEquals("a.md", FileSystemResourceConnector.toRelativePath("/a.md"));
    }

    @Test
    void shouldReportMissingFileAsNotFound() {
        ResourceHandlingException ex = assertThrows(ResourceHandlingException.class,
                () -> connector.loadResource("docs/missing.md"));

        assertEquals(ResourceFailureKind.NOT_FOUND, ex.getKind());
        assertEquals(ResourceOperation.READ, ex.getOperation());
        assertTrue(ex.isNotFound());
    }

    @Test
    void shouldRejectPathsOutsideRoot() {
        ResourceHandlingException ex = assertThrows(ResourceHandlingException.class,
                () -> connector.loadResource("../outside.txt"));

        assertEquals(ResourceFailureKind.PERMISSION_DENIED, ex.getKind());
    }

    @Test
    void shouldRefuseDirectory() {
        ResourceHandlingException ex = assertThrows(ResourceHandlingException.class,
                () -> connector.loadResource("docs"));

        assertEquals(ResourceFailureKind.IO, ex.getKind());
    }

    @Test
    void shouldCheckExistence() {
        assertTrue(connector.resourceExists("docs/notes.md"));
        assertFalse(connector.resourceExists("docs/other.md"));
        assertFalse(connector.resourceExists("docs"));
    }
}
