package ai.segmap.segment;

import ai.segmap.util.FileUtil;
import ai.segmap.util.SegmapConfig;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Finds segments: every directory under the app root holding an entry marker file. */
public class SegmentDiscovery {
    private static final Logger logger = LogManager.getLogger(SegmentDiscovery.class);

    private final SegmapConfig config;

    public SegmentDiscovery(SegmapConfig config) {
        this.config = config;
    }

    /** All segments currently on disk keyed by id. An absent app directory yields an empty map. */
    public SortedMap<String, SegmentDefinition> discover() throws IOException {
        var result = new TreeMap<String, SegmentDefinition>();
        var appDir = config.appDir();
        if (!Files.isDirectory(appDir)) {
            logger.debug("App directory {} does not exist; no segments", appDir);
            return result;
        }

        var markers = new ArrayList<Path>();
        Files.walkFileTree(appDir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()
                        && file.getFileName().toString().equals(config.entryMarker())) {
                    markers.add(FileUtil.normalize(file));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                // directories can vanish between listing and visiting
                logger.debug("Skipping unreadable path {}", file, exc);
                return FileVisitResult.CONTINUE;
            }
        });

        for (var marker : markers) {
            var definition = define(marker.getParent());
            result.put(definition.id(), definition);
        }
        logger.debug("Discovered {} segments under {}", result.size(), appDir);
        return result;
    }

    /**
     * Re-derives a single segment by id. Empty when the id does not name a directory under the app root or the
     * directory has no marker.
     */
    public Optional<SegmentDefinition> discoverOne(String segmentId) {
        Path dir;
        try {
            dir = config.projectRoot().resolve(segmentId).normalize();
        } catch (RuntimeException e) {
            logger.debug("Invalid segment id {}", segmentId, e);
            return Optional.empty();
        }
        if (!FileUtil.isWithin(config.appDir(), dir)) {
            logger.debug("Segment id {} is outside {}", segmentId, config.appDir());
            return Optional.empty();
        }
        if (!Files.isRegularFile(dir.resolve(config.entryMarker()))) {
            return Optional.empty();
        }
        return Optional.of(define(dir));
    }

    /** Compares known ids against a fresh discovery result. */
    public static DiscoveryDiff diff(Iterable<String> previousIds, Map<String, SegmentDefinition> current) {
        var removed = new ArrayList<String>();
        for (var id : previousIds) {
            if (!current.containsKey(id)) {
                removed.add(id);
            }
        }
        return new DiscoveryDiff(new ArrayList<>(current.keySet()), removed);
    }

    /** True for the marker or page file anywhere under the app root. */
    public boolean isEntryFile(Path file) {
        var normalized = FileUtil.normalize(file);
        if (!FileUtil.isWithin(config.appDir(), normalized) || normalized.getFileName() == null) {
            return false;
        }
        var name = normalized.getFileName().toString();
        return name.equals(config.entryMarker()) || name.equals(config.pageFile());
    }

    private SegmentDefinition define(Path segmentDir) {
        var entries = new ArrayList<Path>();
        entries.add(segmentDir.resolve(config.entryMarker()));
        var page = segmentDir.resolve(config.pageFile());
        if (Files.isRegularFile(page)) {
            entries.add(page);
        }
        var id = FileUtil.toRelativePosix(config.projectRoot(), segmentDir);
        return new SegmentDefinition(id, entries);
    }
}
