package ai.segmap.exception;

import java.nio.file.Path;

/** A consumer gave up waiting for a manifest to become populated. */
public class ManifestTimeoutException extends RuntimeException {
    private final Path manifestPath;
    private final long elapsedMillis;

    public ManifestTimeoutException(Path manifestPath, long elapsedMillis) {
        super("Manifest timeout after %dms: %s".formatted(elapsedMillis, manifestPath));
        this.manifestPath = manifestPath;
        this.elapsedMillis = elapsedMillis;
    }

    public Path getManifestPath() {
        return manifestPath;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }
}
