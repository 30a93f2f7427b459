package ai.segmap.manifest;

import ai.segmap.util.FileUtil;
import ai.segmap.util.SegmapConfig;
import java.nio.file.Path;
import java.util.Optional;

/** Maps segment ids to manifest locations under the cache directory and back. */
public class ManifestPaths {
    public static final String MANIFEST_FILE_NAME = "manifest.json";

    private final Path cacheDir;

    public ManifestPaths(SegmapConfig config) {
        this(config.cacheDir());
    }

    public ManifestPaths(Path cacheDir) {
        this.cacheDir = FileUtil.normalize(cacheDir);
    }

    public Path cacheDir() {
        return cacheDir;
    }

    /** {@code <cacheDir>/<segmentId>/manifest.json} */
    public Path manifestPath(String segmentId) {
        return cacheDir.resolve(segmentId).resolve(MANIFEST_FILE_NAME).normalize();
    }

    /**
     * Inverse of {@link #manifestPath(String)}. Empty for paths outside the cache directory, not named
     * {@code manifest.json}, or sitting directly in the cache directory.
     */
    public Optional<String> segmentIdOf(Path manifestPath) {
        var normalized = FileUtil.normalize(manifestPath);
        if (!isManifestFile(normalized)) {
            return Optional.empty();
        }
        var segmentDir = normalized.getParent();
        if (segmentDir == null || segmentDir.equals(cacheDir)) {
            return Optional.empty();
        }
        return Optional.of(FileUtil.toRelativePosix(cacheDir, segmentDir));
    }

    public boolean isManifestFile(Path path) {
        var normalized = FileUtil.normalize(path);
        var name = normalized.getFileName();
        return name != null
                && MANIFEST_FILE_NAME.equals(name.toString())
                && FileUtil.isWithin(cacheDir, normalized);
    }

    public boolean isUnderCache(Path path) {
        return FileUtil.isWithin(cacheDir, FileUtil.normalize(path));
    }
}
