package ai.segmap;

import ai.segmap.FileWatcherHelper.ChangeClassification;
import ai.segmap.IWatchService.EventBatch;
import ai.segmap.analyzer.FileCache;
import ai.segmap.analyzer.ImportExtractor;
import ai.segmap.analyzer.SpecifierResolver;
import ai.segmap.manifest.Manifest;
import ai.segmap.manifest.ManifestPaths;
import ai.segmap.manifest.ManifestReader;
import ai.segmap.manifest.ManifestWriter;
import ai.segmap.request.ManifestRequest;
import ai.segmap.request.RequestFulfiller;
import ai.segmap.segment.ClosureBuilder;
import ai.segmap.segment.SegmentDefinition;
import ai.segmap.segment.SegmentDiscovery;
import ai.segmap.segment.SegmentIndex;
import ai.segmap.util.EventLoopExecutor;
import ai.segmap.util.FileUtil;
import ai.segmap.util.SegmapConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Keeps one manifest per segment current with the source tree.
 *
 * <p>All state (file cache, segment index, known segment definitions) is owned by a single loop thread. Watch events,
 * manifest requests and test queries are queued onto that loop, so builds never interleave.
 */
public class SegmentManifestEngine implements IWatchService.Listener, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(SegmentManifestEngine.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 5_000;

    private final SegmapConfig config;

    @Nullable
    private final SegmentListener listener;

    private final IWatchService watchService;
    private final EventLoopExecutor loop;
    private final String loopName;

    private final FileCache fileCache;
    private final SegmentDiscovery discovery;
    private final ClosureBuilder closureBuilder;
    private final SegmentIndex index = new SegmentIndex();
    private final ManifestPaths manifestPaths;
    private final ManifestWriter writer;
    private final FileWatcherHelper watcherHelper;
    private final RequestFulfiller fulfiller;

    private final SortedMap<String, SegmentDefinition> definitions = new TreeMap<>();

    /** Engine without file watching; changes must be fed through {@link #processEvents(List)}. */
    public SegmentManifestEngine(SegmapConfig config) {
        this(config, null, null);
    }

    /**
     * @param config resolved configuration
     * @param listener notified after each manifest write or removal (can be null)
     * @param watchService source of file events; the engine registers itself as a listener (null disables watching)
     */
    public SegmentManifestEngine(
            SegmapConfig config, @Nullable SegmentListener listener, @Nullable IWatchService watchService) {
        this(config, listener, watchService, Clock.systemUTC());
    }

    SegmentManifestEngine(
            SegmapConfig config,
            @Nullable SegmentListener listener,
            @Nullable IWatchService watchService,
            Clock clock) {
        this.config = config;
        this.listener = listener;
        this.watchService = watchService != null ? watchService : new IWatchService() {};
        if (watchService != null) {
            watchService.addListener(this);
        }

        this.fileCache = new FileCache(new ImportExtractor(), new SpecifierResolver(config));
        this.discovery = new SegmentDiscovery(config);
        this.closureBuilder = new ClosureBuilder(fileCache);
        this.manifestPaths = new ManifestPaths(config);
        this.writer = new ManifestWriter(config.projectRoot(), manifestPaths, clock);
        this.watcherHelper = new FileWatcherHelper(config.srcDir(), manifestPaths, discovery);

        this.loopName = "segmap-engine-" + config.projectRoot().getFileName();
        this.loop = new EventLoopExecutor(loopName, th -> logger.error("Uncaught exception in segment engine", th));
        this.fulfiller = new RequestFulfiller(manifestPaths, discovery, loop, new RequestFulfiller.Target() {
            @Override
            public boolean isTracked(String segmentId) {
                return definitions.containsKey(segmentId) && index.isTracked(segmentId);
            }

            @Override
            public Manifest build(SegmentDefinition definition) {
                definitions.put(definition.id(), definition);
                return buildSegment(definition);
            }
        });
    }

    /**
     * Runs the initial pass (create the cache directory, build every segment, fulfil pending placeholders). The watch
     * service starts immediately but holds its events until the initial pass completes.
     */
    public CompletableFuture<Void> start() {
        return loop.submit(() -> {
            var delayNotificationsUntilCompleted = new CompletableFuture<Void>();
            watchService.start(delayNotificationsUntilCompleted);
            try {
                long start = System.currentTimeMillis();
                initialPass();
                logger.info(
                        "Initial pass built {} segments in {} ms",
                        definitions.size(),
                        System.currentTimeMillis() - start);
                delayNotificationsUntilCompleted.complete(null);
            } catch (RuntimeException e) {
                delayNotificationsUntilCompleted.completeExceptionally(e);
                throw e;
            }
        });
    }

    private void initialPass() {
        try {
            Files.createDirectories(config.cacheDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to create cache directory " + config.cacheDir(), e);
        }
        refreshAllSegments();
        fulfilPendingPlaceholders();
    }

    @Override
    public void onFilesChanged(EventBatch batch) {
        logger.trace("Engine received events batch: {}", batch);
        loop.submit(() -> processBatch(batch));
    }

    /** Queues a batch of changes as if the watch service had reported them. */
    public CompletableFuture<Void> processEvents(List<FileChangeEvent> events) {
        var batch = new EventBatch(events);
        return loop.submit(() -> processBatch(batch));
    }

    /** Rediscovers and rebuilds every segment. */
    public CompletableFuture<Void> refresh() {
        return loop.submit(this::refreshAllSegments);
    }

    /**
     * Asks for the manifest at {@code manifestPath} to be populated.
     *
     * @param force rebuild even when the manifest is already populated
     * @return the manifest on disk once the request is handled, or empty when the path names no segment
     */
    public CompletableFuture<Optional<Manifest>> requestManifest(Path manifestPath, boolean force) {
        return fulfiller.request(manifestPath, force);
    }

    public CompletableFuture<Optional<Manifest>> requestManifest(ManifestRequest request) {
        return requestManifest(request.path(), request.force());
    }

    private void processBatch(EventBatch batch) {
        var classification = watcherHelper.classifyChanges(batch);
        if (classification.hasSourceChanges()) {
            processSourceEvents(classification);
        }
        for (var manifestPath : classification.manifestCandidates()) {
            if (!ManifestReader.isPopulated(manifestPath)) {
                fulfilSafely(manifestPath);
            }
        }
        if (classification.rescanPlaceholders()) {
            fulfilPendingPlaceholders();
        }
    }

    private void processSourceEvents(ChangeClassification changes) {
        if (changes.filesAddedOrRemoved()) {
            // cached importers may hold edges resolved against the old file set
            logger.debug("Files added or removed; clearing {} cached records", fileCache.size());
            fileCache.invalidateAll();
        } else {
            for (var file : changes.changedSourceFiles()) {
                fileCache.invalidate(file);
            }
        }

        if (changes.requiresFullRefresh()) {
            logger.debug("Structural change in {} paths; refreshing all segments", changes.changedSourceFiles().size());
            refreshAllSegments();
            return;
        }

        var impacted = index.impactedSegments(changes.changedSourceFiles());
        logger.debug("{} changed files impact segments {}", changes.changedSourceFiles().size(), impacted);
        for (var segmentId : impacted) {
            var definition = definitions.get(segmentId);
            if (definition != null) {
                buildSafely(definition);
            }
        }
    }

    private void refreshAllSegments() {
        SortedMap<String, SegmentDefinition> discovered;
        try {
            discovered = discovery.discover();
        } catch (IOException e) {
            throw new UncheckedIOException("Segment discovery failed under " + config.appDir(), e);
        }

        var diff = SegmentDiscovery.diff(List.copyOf(definitions.keySet()), discovered);
        definitions.putAll(discovered);
        if (diff.hasRemovals()) {
            logger.debug("Segments no longer present: {}", diff.removed());
        }
        for (var removed : diff.removed()) {
            removeSegment(removed);
        }
        for (var segmentId : diff.current()) {
            buildSafely(definitions.get(segmentId));
        }
    }

    private void removeSegment(String segmentId) {
        logger.debug("Removing segment {}", segmentId);
        index.clearMembership(segmentId);
        definitions.remove(segmentId);
        try {
            writer.delete(segmentId);
        } catch (IOException e) {
            logger.error("Failed to delete manifest for removed segment {}", segmentId, e);
        }
        if (listener != null) {
            listener.onSegmentRemoved(segmentId);
        }
    }

    private void buildSafely(SegmentDefinition definition) {
        try {
            buildSegment(definition);
        } catch (RuntimeException e) {
            logger.error("Failed to build segment {}", definition.id(), e);
        }
    }

    private Manifest buildSegment(SegmentDefinition definition) {
        var closure = closureBuilder.build(definition);
        index.replaceMembership(definition.id(), closure.files());
        Manifest manifest;
        try {
            manifest = writer.write(closure);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write manifest for " + definition.id(), e);
        }
        if (listener != null) {
            listener.onSegmentBuilt(definition.id(), manifest);
        }
        return manifest;
    }

    private void fulfilPendingPlaceholders() {
        List<Path> pending;
        try {
            pending = ManifestReader.findPendingPlaceholders(config.cacheDir());
        } catch (IOException e) {
            logger.error("Unable to scan {} for pending manifest requests", config.cacheDir(), e);
            return;
        }
        for (var manifestPath : pending) {
            fulfilSafely(manifestPath);
        }
    }

    private void fulfilSafely(Path manifestPath) {
        try {
            fulfiller.fulfil(manifestPath, false);
        } catch (RuntimeException e) {
            logger.error("Failed to fulfil manifest request for {}", manifestPath, e);
        }
    }

    // The query methods below block on the loop, so they cannot be called from a SegmentListener callback.

    /** Snapshot of the known segment definitions. */
    public SortedMap<String, SegmentDefinition> segments() {
        return query(() -> Collections.unmodifiableSortedMap(new TreeMap<>(definitions)));
    }

    public Set<String> segmentsOf(Path file) {
        var normalized = FileUtil.normalize(file);
        return query(() -> index.segmentsOf(normalized));
    }

    public Set<Path> filesOf(String segmentId) {
        return query(() -> index.filesOf(segmentId));
    }

    public int cachedFileCount() {
        return query(fileCache::size);
    }

    private <T> T query(Callable<T> task) {
        if (loop.inLoop()) {
            throw new IllegalStateException("Engine queries cannot run on the engine loop");
        }
        return loop.submit(task).join();
    }

    @Override
    public void close() {
        watchService.removeListener(this);
        watchService.close();
        loop.shutdownAndAwait(SHUTDOWN_TIMEOUT_MS, loopName);
    }
}
