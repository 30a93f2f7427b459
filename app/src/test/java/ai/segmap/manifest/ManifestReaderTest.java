package ai.segmap.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestReaderTest {

    @TempDir
    Path cacheDir;

    private Path write(String rel, String content) throws IOException {
        var file = cacheDir.resolve(rel);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testPopulatedMeansObjectWithFiles() throws IOException {
        assertTrue(ManifestReader.isPopulated(write("a/manifest.json", "{\"files\":{}}")));
        assertFalse(ManifestReader.isPopulated(write("b/manifest.json", "{}")));
        assertFalse(ManifestReader.isPopulated(write("c/manifest.json", "{\"files\":")));
        assertFalse(ManifestReader.isPopulated(write("d/manifest.json", "[1, 2]")));
        assertFalse(ManifestReader.isPopulated(cacheDir.resolve("absent/manifest.json")));
    }

    @Test
    void testReadParsesFullManifest() throws IOException {
        var file = write(
                "src/app/manifest.json",
                """
                {
                  "entries": ["src/app/layout.tsx"],
                  "files": {"src/app/layout.tsx": {"imports": [], "lines": 4}},
                  "segment": "src/app",
                  "updatedAt": 17
                }
                """);
        var manifest = ManifestReader.read(file).orElseThrow();
        assertEquals("src/app", manifest.segment());
        assertEquals(4, manifest.files().get("src/app/layout.tsx").lines());
        assertEquals(17, manifest.updatedAt());
        assertTrue(ManifestReader.read(write("x/manifest.json", "not json")).isEmpty());
    }

    @Test
    void testFindPendingPlaceholders() throws IOException {
        var pendingB = write("src/app/b/manifest.json", "{}");
        var pendingA = write("src/app/a/manifest.json", "");
        write("src/app/manifest.json", "{\"files\":{}}");
        write("src/app/c/notes.json", "{}");

        assertEquals(List.of(pendingA, pendingB), ManifestReader.findPendingPlaceholders(cacheDir));
        assertEquals(List.of(), ManifestReader.findPendingPlaceholders(cacheDir.resolve("missing")));
    }
}
