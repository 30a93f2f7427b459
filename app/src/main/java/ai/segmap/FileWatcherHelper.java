package ai.segmap;

import ai.segmap.IWatchService.EventBatch;
import ai.segmap.manifest.ManifestPaths;
import ai.segmap.segment.SegmentDiscovery;
import ai.segmap.util.AtomicWrites;
import ai.segmap.util.FileUtil;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Splits raw watch events into source changes and manifest request signals, and decides whether source changes need a
 * full refresh or only a targeted rebuild.
 */
public class FileWatcherHelper {

    private final Path srcDir;
    private final ManifestPaths manifestPaths;
    private final SegmentDiscovery discovery;

    public FileWatcherHelper(Path srcDir, ManifestPaths manifestPaths, SegmentDiscovery discovery) {
        this.srcDir = FileUtil.normalize(srcDir);
        this.manifestPaths = manifestPaths;
        this.discovery = discovery;
    }

    /**
     * Result of classifying one batch.
     *
     * @param changedSourceFiles every path under the source root that changed
     * @param requiresFullRefresh a create, delete or overflow happened under the source root, or an entry file changed
     * @param filesAddedOrRemoved a create, delete or overflow happened under the source root, so specifiers cached
     *     against the old file set may now resolve differently
     * @param manifestCandidates manifest files created or modified under the cache directory
     * @param rescanPlaceholders individual manifest events may have been missed (overflow or a new directory under the
     *     cache), so the whole cache directory should be scanned for placeholders
     */
    public record ChangeClassification(
            Set<Path> changedSourceFiles,
            boolean requiresFullRefresh,
            boolean filesAddedOrRemoved,
            Set<Path> manifestCandidates,
            boolean rescanPlaceholders) {

        public boolean hasSourceChanges() {
            return requiresFullRefresh || !changedSourceFiles.isEmpty();
        }
    }

    public ChangeClassification classifyChanges(EventBatch batch) {
        var sourceFiles = new LinkedHashSet<Path>();
        var manifests = new TreeSet<Path>();
        boolean fullRefresh = false;
        boolean fileSetChanged = false;
        boolean rescan = false;

        for (var event : batch.events()) {
            var path = FileUtil.normalize(event.path());
            if (event.kind() == FileChangeEvent.Kind.OVERFLOW) {
                // treat overflow anywhere as potentially both kinds of change
                fullRefresh = true;
                fileSetChanged = true;
                rescan = true;
                continue;
            }
            if (manifestPaths.isUnderCache(path)) {
                if (AtomicWrites.isTempFile(path) || event.kind() == FileChangeEvent.Kind.DELETE) {
                    continue;
                }
                if (manifestPaths.isManifestFile(path)) {
                    manifests.add(path);
                } else if (event.kind() == FileChangeEvent.Kind.CREATE) {
                    // a new directory may already hold a placeholder written before it was registered
                    rescan = true;
                }
                continue;
            }
            if (!FileUtil.isWithin(srcDir, path)) {
                continue;
            }
            sourceFiles.add(path);
            if (event.isStructural()) {
                fileSetChanged = true;
            }
            if (event.isStructural() || discovery.isEntryFile(path)) {
                fullRefresh = true;
            }
        }
        return new ChangeClassification(sourceFiles, fullRefresh, fileSetChanged, manifests, rescan);
    }
}
