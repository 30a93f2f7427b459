package ai.segmap.request;

import ai.segmap.manifest.Manifest;
import ai.segmap.manifest.ManifestPaths;
import ai.segmap.manifest.ManifestReader;
import ai.segmap.segment.SegmentDefinition;
import ai.segmap.segment.SegmentDiscovery;
import ai.segmap.util.EventLoopExecutor;
import ai.segmap.util.FileUtil;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns "please populate this manifest" requests into segment builds on the engine's loop.
 *
 * <p>Identical requests that arrive while one is still queued or running share its future. Requests that arrive after
 * it completed find the manifest populated and return without rebuilding, unless forced.
 */
public class RequestFulfiller {
    private static final Logger logger = LogManager.getLogger(RequestFulfiller.class);

    /** The engine operations a request needs. Called on the loop thread only. */
    public interface Target {
        boolean isTracked(String segmentId);

        /** Registers {@code definition} and builds its manifest. */
        Manifest build(SegmentDefinition definition);
    }

    private record Key(Path manifestPath, boolean force) {}

    private final ManifestPaths paths;
    private final SegmentDiscovery discovery;
    private final EventLoopExecutor loop;
    private final Target target;
    private final ConcurrentMap<Key, CompletableFuture<Optional<Manifest>>> pending = new ConcurrentHashMap<>();

    public RequestFulfiller(ManifestPaths paths, SegmentDiscovery discovery, EventLoopExecutor loop, Target target) {
        this.paths = paths;
        this.discovery = discovery;
        this.loop = loop;
        this.target = target;
    }

    /**
     * Queues a request, or joins an identical one already in flight.
     *
     * @return the manifest now on disk, or empty when the path names no segment
     */
    public CompletableFuture<Optional<Manifest>> request(Path manifestPath, boolean force) {
        var key = new Key(FileUtil.normalize(manifestPath), force);
        var placeholder = new CompletableFuture<Optional<Manifest>>();
        var existing = pending.putIfAbsent(key, placeholder);
        if (existing != null) {
            logger.trace("Coalescing request for {} with one already in flight", key.manifestPath());
            return existing;
        }

        loop.submit(() -> fulfil(key.manifestPath(), key.force())).whenComplete((result, ex) -> {
            // remove first so a waiter that re-requests on completion queues a fresh request
            pending.remove(key, placeholder);
            if (ex != null) {
                placeholder.completeExceptionally(ex);
            } else {
                placeholder.complete(result);
            }
        });
        return placeholder;
    }

    /** Handles one request synchronously. Must run on the loop thread. */
    public Optional<Manifest> fulfil(Path manifestPath, boolean force) {
        var normalized = FileUtil.normalize(manifestPath);
        var segmentId = paths.segmentIdOf(normalized);
        if (segmentId.isEmpty()) {
            logger.debug("Ignoring request for {}: not a manifest path under {}", normalized, paths.cacheDir());
            return Optional.empty();
        }

        var id = segmentId.get();
        if (!force && target.isTracked(id) && ManifestReader.isPopulated(normalized)) {
            logger.debug("Manifest for {} already populated", id);
            var current = ManifestReader.read(normalized);
            if (current.isPresent()) {
                return current;
            }
        }

        var definition = discovery.discoverOne(id);
        if (definition.isEmpty()) {
            logger.debug("Ignoring request for {}: no entry marker", id);
            return Optional.empty();
        }
        logger.debug("Fulfilling request for segment {} (force={})", id, force);
        return Optional.of(target.build(definition.get()));
    }

    int pendingCount() {
        return pending.size();
    }
}
