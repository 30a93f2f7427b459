package ai.segmap.request;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Reads line-delimited JSON {@link ManifestRequest}s from a stream on a daemon thread and hands each valid one to a
 * sink. Blank, malformed and foreign lines are skipped.
 */
public class StdinRequestChannel implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(StdinRequestChannel.class);

    private final InputStream in;
    private final Consumer<ManifestRequest> sink;
    private volatile boolean running = true;

    @Nullable
    private volatile Thread readerThread;

    public StdinRequestChannel(InputStream in, Consumer<ManifestRequest> sink) {
        this.in = in;
        this.sink = sink;
    }

    public void start() {
        var thread = new Thread(this::readLoop, "segmap-request-reader");
        thread.setDaemon(true);
        readerThread = thread;
        thread.start();
    }

    void readLoop() {
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                var request = ManifestRequest.parse(line.trim());
                if (request.isEmpty()) {
                    logger.warn("Ignoring unrecognized request line: {}", line);
                    continue;
                }
                try {
                    sink.accept(request.get());
                } catch (RuntimeException e) {
                    logger.error("Failed to dispatch request {}", request.get(), e);
                }
            }
            logger.debug("Request stream ended");
        } catch (IOException e) {
            if (running) {
                logger.error("Error reading request stream", e);
            }
        }
    }

    public boolean isRunning() {
        var thread = readerThread;
        return running && thread != null && thread.isAlive();
    }

    @Override
    public void close() {
        running = false;
        var thread = readerThread;
        if (thread != null) {
            thread.interrupt();
        }
    }
}
