package ai.segmap.request;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

class StdinRequestChannelTest {

    @Test
    void testValidLinesAreDispatchedInOrder() {
        var input = String.join(
                "\n",
                ManifestRequest.of(Path.of("/c/src/app/manifest.json"), false).toJsonLine(),
                "",
                "not json",
                "{\"type\":\"other\",\"manifestPath\":\"/c/x/manifest.json\"}",
                ManifestRequest.of(Path.of("/c/src/app/test/manifest.json"), true).toJsonLine());
        var received = new ArrayList<ManifestRequest>();
        var channel = new StdinRequestChannel(
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), received::add);

        channel.readLoop();

        assertEquals(
                List.of(
                        ManifestRequest.of(Path.of("/c/src/app/manifest.json"), false),
                        ManifestRequest.of(Path.of("/c/src/app/test/manifest.json"), true)),
                received);
    }

    @Test
    void testSinkFailureDoesNotStopTheChannel() {
        var input = ManifestRequest.of(Path.of("/c/a/manifest.json"), false).toJsonLine() + "\n"
                + ManifestRequest.of(Path.of("/c/b/manifest.json"), false).toJsonLine() + "\n";
        var received = new ArrayList<ManifestRequest>();
        var channel = new StdinRequestChannel(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), r -> {
            received.add(r);
            if (received.size() == 1) {
                throw new IllegalStateException("boom");
            }
        });

        channel.readLoop();

        assertEquals(2, received.size());
    }

    @Test
    void testReaderThreadStopsAtEndOfStream() throws Exception {
        var input = ManifestRequest.of(Path.of("/c/a/manifest.json"), true).toJsonLine() + "\n";
        var received = new CopyOnWriteArrayList<ManifestRequest>();
        try (var channel = new StdinRequestChannel(
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), received::add)) {
            channel.start();

            long deadline = System.currentTimeMillis() + 5_000;
            while (channel.isRunning() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }

            assertFalse(channel.isRunning());
            assertTrue(received.contains(ManifestRequest.of(Path.of("/c/a/manifest.json"), true)));
        }
    }
}
