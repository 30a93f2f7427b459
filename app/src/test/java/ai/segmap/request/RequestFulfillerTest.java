package ai.segmap.request;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.segmap.manifest.Manifest;
import ai.segmap.manifest.ManifestPaths;
import ai.segmap.segment.SegmentDefinition;
import ai.segmap.segment.SegmentDiscovery;
import ai.segmap.testutil.TestProject;
import ai.segmap.util.EventLoopExecutor;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RequestFulfillerTest {

    private TestProject project;
    private EventLoopExecutor loop;
    private ManifestPaths paths;
    private final AtomicInteger builds = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
        project = TestProject.createTestProject("testcode-app");
        loop = new EventLoopExecutor("request-test-loop", th -> {});
        paths = new ManifestPaths(project.config());
    }

    @AfterEach
    void tearDown() {
        loop.shutdownAndAwait(1000, "request-test-loop");
        project.close();
    }

    private RequestFulfiller fulfiller(boolean tracked) {
        return new RequestFulfiller(paths, new SegmentDiscovery(project.config()), loop, new RequestFulfiller.Target() {
            @Override
            public boolean isTracked(String segmentId) {
                return tracked;
            }

            @Override
            public Manifest build(SegmentDefinition definition) {
                builds.incrementAndGet();
                var manifest = new Manifest(List.of(), Map.of(), definition.id(), builds.get());
                try {
                    Files.createDirectories(paths.manifestPath(definition.id()).getParent());
                    Files.writeString(paths.manifestPath(definition.id()), "{\"files\":{}}");
                } catch (IOException e) {
                    throw new RuntimeException(e);
                }
                return manifest;
            }
        });
    }

    @Test
    void testConcurrentIdenticalRequestsShareOneBuild() throws Exception {
        var fulfiller = fulfiller(false);
        var gate = new CountDownLatch(1);
        loop.submit(() -> {
            gate.await(5, TimeUnit.SECONDS);
            return null;
        });

        var manifestPath = paths.manifestPath("src/app/test");
        var first = fulfiller.request(manifestPath, true);
        var second = fulfiller.request(manifestPath, true);
        assertSame(first, second);
        assertEquals(1, fulfiller.pendingCount());

        gate.countDown();
        assertEquals("src/app/test", first.get(5, TimeUnit.SECONDS).orElseThrow().segment());
        assertEquals(1, builds.get());

        var third = fulfiller.request(manifestPath, true);
        assertNotSame(first, third);
        third.get(5, TimeUnit.SECONDS);
        assertEquals(2, builds.get());
    }

    @Test
    void testPopulatedTrackedManifestIsNotRebuiltUnlessForced() throws Exception {
        var fulfiller = fulfiller(true);
        var manifestPath = paths.manifestPath("src/app");
        fulfiller.request(manifestPath, true).get(5, TimeUnit.SECONDS);
        assertEquals(1, builds.get());

        fulfiller.request(manifestPath, false).get(5, TimeUnit.SECONDS);
        assertEquals(1, builds.get());

        fulfiller.request(manifestPath, true).get(5, TimeUnit.SECONDS);
        assertEquals(2, builds.get());
    }

    @Test
    void testUnknownOrForeignPathsAreNoOps() throws Exception {
        var fulfiller = fulfiller(false);
        assertTrue(fulfiller.request(paths.manifestPath("src/app/missing"), true)
                .get(5, TimeUnit.SECONDS)
                .isEmpty());
        assertTrue(fulfiller.request(project.path("src/app/manifest.json"), true)
                .get(5, TimeUnit.SECONDS)
                .isEmpty());
        assertTrue(fulfiller.request(paths.cacheDir().resolve("src/app/other.json"), true)
                .get(5, TimeUnit.SECONDS)
                .isEmpty());
        assertEquals(0, builds.get());
    }
}
