package ai.segmap.manifest;

import ai.segmap.exception.ManifestTimeoutException;
import ai.segmap.request.ManifestRequest;
import ai.segmap.util.FileUtil;
import ai.segmap.util.Json;
import ai.segmap.util.SegmapConfig;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Build-tool side of the manifest contract: ask for a segment's manifest, block until it is populated, then read the
 * files the segment depends on.
 *
 * <p>Requests always go out as a {@code {}} placeholder at the manifest path, which a watching engine picks up. When an
 * in-process sink is supplied the request is also delivered directly.
 */
public class ManifestConsumer {
    private static final Logger logger = LogManager.getLogger(ManifestConsumer.class);

    static final String PLACEHOLDER = "{}";

    private final Path projectRoot;
    private final Path cacheDir;
    private final long pollIntervalMs;
    private final long timeoutMs;
    private final @Nullable Consumer<ManifestRequest> inProcessSink;

    public ManifestConsumer(SegmapConfig config, @Nullable Consumer<ManifestRequest> inProcessSink) {
        this.projectRoot = config.projectRoot();
        this.cacheDir = config.cacheDir();
        this.pollIntervalMs = config.pollIntervalMs();
        this.timeoutMs = config.timeoutMs();
        this.inProcessSink = inProcessSink;
    }

    /** {@code <cacheDir>/<dir of layoutFile relative to the root>/manifest.json} */
    public Path manifestPathFor(Path layoutFile) {
        var segmentDir = FileUtil.normalize(layoutFile).getParent();
        var relative = projectRoot.relativize(segmentDir);
        return cacheDir.resolve(relative).resolve(ManifestPaths.MANIFEST_FILE_NAME).normalize();
    }

    /**
     * Requests, waits for and reads the manifest of the segment whose marker is {@code layoutFile}.
     *
     * @return the absolute dependency paths listed in the manifest
     */
    public List<Path> acquire(Path layoutFile) throws IOException, InterruptedException {
        var manifestPath = manifestPathFor(layoutFile);
        request(manifestPath, true);
        awaitPopulated(manifestPath);
        var source = Files.readString(manifestPath, StandardCharsets.UTF_8);
        return dependencyPaths(source, projectRoot);
    }

    public void request(Path manifestPath, boolean force) throws IOException {
        writePlaceholderIfAbsent(manifestPath);
        if (inProcessSink != null) {
            logger.debug("Sending in-process request for {}", manifestPath);
            inProcessSink.accept(ManifestRequest.of(manifestPath, force));
        }
    }

    /** Writes {@code {}} unless a file is already there. Returns true if the placeholder was written. */
    public static boolean writePlaceholderIfAbsent(Path manifestPath) throws IOException {
        Files.createDirectories(manifestPath.toAbsolutePath().getParent());
        try {
            Files.writeString(manifestPath, PLACEHOLDER, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
            logger.debug("Wrote placeholder {}", manifestPath);
            return true;
        } catch (FileAlreadyExistsException e) {
            logger.trace("Manifest {} already exists; no placeholder written", manifestPath);
            return false;
        }
    }

    /**
     * Polls until {@link ManifestReader#isPopulated(Path)} holds.
     *
     * @throws ManifestTimeoutException once the configured timeout has elapsed without the manifest being populated
     */
    public void awaitPopulated(Path manifestPath) throws InterruptedException {
        long start = System.currentTimeMillis();
        while (true) {
            if (ManifestReader.isPopulated(manifestPath)) {
                return;
            }
            long elapsed = System.currentTimeMillis() - start;
            if (elapsed > timeoutMs) {
                throw new ManifestTimeoutException(manifestPath, elapsed);
            }
            Thread.sleep(pollIntervalMs);
        }
    }

    /**
     * Entries plus file keys of a manifest, resolved against {@code projectRoot}. Absolute and root-escaping paths are
     * dropped. Returns an empty list when the source is not a manifest.
     */
    public static List<Path> dependencyPaths(String manifestSource, Path projectRoot) {
        var root = FileUtil.normalize(projectRoot);
        JsonNode node;
        try {
            node = Json.readTree(manifestSource);
        } catch (IOException e) {
            logger.debug("Manifest source is not JSON", e);
            return List.of();
        }
        if (node == null
                || !node.isObject()
                || !node.path("entries").isArray()
                || !node.path("files").isObject()) {
            return List.of();
        }

        var result = new TreeSet<Path>();
        node.get("entries").forEach(entry -> {
            if (entry.isTextual()) {
                addResolved(root, entry.asText(), result);
            }
        });
        node.get("files").fieldNames().forEachRemaining(name -> addResolved(root, name, result));
        return List.copyOf(result);
    }

    private static void addResolved(Path root, String relative, TreeSet<Path> sink) {
        Path candidate;
        try {
            candidate = Path.of(relative);
        } catch (InvalidPathException e) {
            logger.debug("Ignoring unusable manifest path {}", relative, e);
            return;
        }
        if (candidate.isAbsolute() || relative.startsWith("/")) {
            return;
        }
        var normalized = candidate.normalize();
        if (normalized.toString().startsWith("..")) {
            return;
        }
        sink.add(root.resolve(normalized));
    }
}
