package ai.segmap.manifest;

import ai.segmap.segment.SegmentClosure;
import ai.segmap.util.AtomicWrites;
import ai.segmap.util.FileUtil;
import ai.segmap.util.Json;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Serializes {@link SegmentClosure}s to their manifest files. Each write replaces the whole file atomically.
 *
 * <p>{@code updatedAt} never repeats or goes backwards for a segment within one writer, even if the clock does.
 */
public class ManifestWriter {
    private static final Logger logger = LogManager.getLogger(ManifestWriter.class);

    private final Path projectRoot;
    private final ManifestPaths paths;
    private final Clock clock;
    private final Map<String, Long> lastUpdatedAt = new HashMap<>();

    public ManifestWriter(Path projectRoot, ManifestPaths paths) {
        this(projectRoot, paths, Clock.systemUTC());
    }

    public ManifestWriter(Path projectRoot, ManifestPaths paths, Clock clock) {
        this.projectRoot = FileUtil.normalize(projectRoot);
        this.paths = paths;
        this.clock = clock;
    }

    /** Builds the manifest for {@code closure}, writes it, and returns what was written. */
    public Manifest write(SegmentClosure closure) throws IOException {
        var manifest = toManifest(closure);
        var target = paths.manifestPath(closure.segmentId());
        AtomicWrites.atomicOverwrite(target, Json.toJson(manifest));
        logger.debug("Wrote manifest for {} ({} files) to {}", closure.segmentId(), manifest.files().size(), target);
        return manifest;
    }

    /** Removes the segment's manifest. Returns true if a file was deleted. */
    public boolean delete(String segmentId) throws IOException {
        lastUpdatedAt.remove(segmentId);
        var target = paths.manifestPath(segmentId);
        boolean deleted = Files.deleteIfExists(target);
        if (deleted) {
            logger.debug("Deleted manifest {}", target);
        }
        return deleted;
    }

    Manifest toManifest(SegmentClosure closure) {
        var members = closure.files();
        var files = new TreeMap<String, ManifestFile>();
        for (var file : members) {
            var record = closure.records().get(file);
            var imports = closure.dependenciesOf(file).stream()
                    .filter(members::contains)
                    .map(this::relativize)
                    .sorted()
                    .distinct()
                    .toList();
            files.put(relativize(file), new ManifestFile(imports, record == null ? 0 : record.lines()));
        }
        var entries = closure.definition().entries().stream()
                .map(this::relativize)
                .sorted()
                .toList();
        return new Manifest(entries, files, closure.segmentId(), nextTimestamp(closure.segmentId()));
    }

    private long nextTimestamp(String segmentId) {
        long now = clock.millis();
        var previous = lastUpdatedAt.get(segmentId);
        long next = previous == null ? now : Math.max(now, previous + 1);
        lastUpdatedAt.put(segmentId, next);
        return next;
    }

    private String relativize(Path file) {
        return FileUtil.toRelativePosix(projectRoot, file);
    }
}
