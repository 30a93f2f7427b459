package ai.segmap.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.segmap.analyzer.FileRecord;
import ai.segmap.segment.SegmentClosure;
import ai.segmap.segment.SegmentDefinition;
import ai.segmap.util.Json;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestWriterTest {

    @TempDir
    Path tempDir;

    private Path root;
    private ManifestPaths paths;

    @BeforeEach
    void setUp() {
        root = tempDir.toAbsolutePath().normalize();
        paths = new ManifestPaths(root.resolve("node_modules/.cache/test"));
    }

    private SegmentClosure closure() {
        var layout = root.resolve("src/app/layout.tsx");
        var page = root.resolve("src/app/page.tsx");
        var util = root.resolve("src/lib/util.ts");
        var notMember = root.resolve("src/lib/other.ts");
        var definition = new SegmentDefinition("src/app", List.of(page, layout));
        return new SegmentClosure(
                definition,
                Set.of(layout, page, util),
                Map.of(
                        layout, new FileRecord(List.of(util), 12),
                        page, new FileRecord(List.of(util, notMember), 3),
                        util, new FileRecord(List.of(), 0)),
                Set.of());
    }

    @Test
    void testManifestContent() throws IOException {
        var clock = Clock.fixed(Instant.ofEpochMilli(1_000), ZoneOffset.UTC);
        var writer = new ManifestWriter(root, paths, clock);
        var manifest = writer.write(closure());

        assertEquals(List.of("src/app/layout.tsx", "src/app/page.tsx"), manifest.entries());
        assertEquals(
                List.of("src/app/layout.tsx", "src/app/page.tsx", "src/lib/util.ts"),
                List.copyOf(manifest.files().keySet()));
        assertEquals(new ManifestFile(List.of("src/lib/util.ts"), 12), manifest.files().get("src/app/layout.tsx"));
        // imports outside the closure are not recorded
        assertEquals(new ManifestFile(List.of("src/lib/util.ts"), 3), manifest.files().get("src/app/page.tsx"));
        assertEquals("src/app", manifest.segment());
        assertEquals(1_000, manifest.updatedAt());

        var written = ManifestReader.read(paths.manifestPath("src/app"));
        assertEquals(manifest, written.orElseThrow());
    }

    @Test
    void testSerializedKeyOrderAndIndentation() throws IOException {
        var writer = new ManifestWriter(root, paths);
        writer.write(closure());
        var json = Files.readString(paths.manifestPath("src/app"));

        int entries = json.indexOf("\"entries\"");
        int files = json.indexOf("\"files\"");
        int segment = json.indexOf("\"segment\"");
        int updatedAt = json.indexOf("\"updatedAt\"");
        assertTrue(entries >= 0 && entries < files && files < segment && segment < updatedAt, json);
        assertTrue(json.contains("\n"), "manifest should be pretty-printed");
        assertTrue(Json.readTree(json).path("files").path("src/lib/util.ts").path("imports").isArray());
    }

    @Test
    void testUpdatedAtStrictlyIncreasesWithStoppedClock() throws IOException {
        var clock = Clock.fixed(Instant.ofEpochMilli(5_000), ZoneOffset.UTC);
        var writer = new ManifestWriter(root, paths, clock);
        var first = writer.write(closure());
        var second = writer.write(closure());
        assertEquals(first.updatedAt() + 1, second.updatedAt());
        assertEquals(first.withoutTimestamp(), second.withoutTimestamp());
    }

    @Test
    void testDelete() throws IOException {
        var writer = new ManifestWriter(root, paths);
        writer.write(closure());
        assertTrue(Files.exists(paths.manifestPath("src/app")));
        assertTrue(writer.delete("src/app"));
        assertFalse(Files.exists(paths.manifestPath("src/app")));
        assertFalse(writer.delete("src/app"));
    }

    @Test
    void testNoTempFilesLeftBehind() throws IOException {
        var writer = new ManifestWriter(root, paths);
        writer.write(closure());
        try (var listing = Files.list(paths.manifestPath("src/app").getParent())) {
            assertEquals(List.of("manifest.json"), listing.map(p -> p.getFileName().toString()).toList());
        }
    }
}
