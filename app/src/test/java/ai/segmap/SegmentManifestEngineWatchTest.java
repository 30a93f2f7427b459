package ai.segmap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.segmap.manifest.ManifestConsumer;
import ai.segmap.manifest.ManifestReader;
import ai.segmap.testutil.TestProject;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** End-to-end runs against a real {@link ProjectWatchService}. Timeouts are generous for slow CI file systems. */
class SegmentManifestEngineWatchTest {

    private static final long WAIT_MS = 15_000;

    private TestProject project;
    private SegmentManifestEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        project = TestProject.createTestProject("testcode-app");
        var config = project.config();
        Files.createDirectories(config.cacheDir());
        var watchService = new ProjectWatchService(List.of(config.srcDir(), config.cacheDir()), List.of());
        engine = new SegmentManifestEngine(config, null, watchService);
        engine.start().get(30, TimeUnit.SECONDS);
        Thread.sleep(300);
    }

    @AfterEach
    void tearDown() {
        engine.close();
        project.close();
    }

    private static boolean waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_MS;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return condition.getAsBoolean();
    }

    @Test
    void testEditIsPickedUp() throws Exception {
        project.write("src/app/test/page.tsx", "export default function TestPage() { return null; }\n");

        assertTrue(waitFor(() -> ManifestReader.read(project.manifestPath("src/app/test"))
                .map(m -> m.files().keySet().equals(Set.of("src/app/test/layout.tsx", "src/app/test/page.tsx")))
                .orElse(false)));
    }

    @Test
    void testNewSegmentDirectoryIsPickedUp() throws Exception {
        project.write("src/app/blog/layout.tsx", "import '../../lib/site';\n");

        assertTrue(waitFor(() -> ManifestReader.isPopulated(project.manifestPath("src/app/blog"))));
        assertEquals(
                Set.of("src/app/blog/layout.tsx", "src/lib/site.ts"),
                ManifestReader.read(project.manifestPath("src/app/blog")).orElseThrow().files().keySet());
    }

    @Test
    void testRemovedSegmentLosesManifest() throws Exception {
        project.delete("src/app/test/layout.tsx");

        assertTrue(waitFor(() -> !Files.exists(project.manifestPath("src/app/test"))));
        assertTrue(ManifestReader.isPopulated(project.manifestPath("src/app")));
    }

    @Test
    void testConsumerPlaceholderIsFulfilled() throws Exception {
        Path manifestPath = project.manifestPath("src/app/test");
        Files.delete(manifestPath);

        assertTrue(ManifestConsumer.writePlaceholderIfAbsent(manifestPath));

        assertTrue(waitFor(() -> ManifestReader.isPopulated(manifestPath)));
    }

    @Test
    void testConsumerAcquireWaitsForBuild() throws Exception {
        var config = project.config();
        Files.delete(project.manifestPath("src/app/test"));

        var consumer = new ManifestConsumer(config, null);
        var dependencies = consumer.acquire(project.path("src/app/test/layout.tsx"));

        assertTrue(dependencies.contains(project.path("src/lib/format.ts")));
        assertFalse(dependencies.contains(project.path("src/app/layout.tsx")));
    }
}
