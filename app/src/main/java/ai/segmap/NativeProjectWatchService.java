package ai.segmap;

import ai.segmap.util.FileUtil;
import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * File watching service using io.methvin:directory-watcher, which uses platform-native recursive watching:
 * FSEvents on macOS, inotify on Linux and FILE_TREE watching on Windows.
 *
 * <p>Each event is delivered as its own batch; the engine coalesces work on its own loop.
 */
public class NativeProjectWatchService implements IWatchService {
    private static final Logger logger = LogManager.getLogger(NativeProjectWatchService.class);

    private final List<Path> roots;
    private final List<Listener> listeners;

    @Nullable
    private volatile DirectoryWatcher watcher;

    private volatile boolean running = true;

    @Nullable
    private volatile Thread watcherThread;

    public NativeProjectWatchService(List<Path> roots, List<Listener> listeners) {
        this.roots = roots.stream().map(FileUtil::normalize).toList();
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    /** Builds the underlying watcher eagerly so that setup failures surface to the caller. */
    void initialize() throws IOException {
        var existing = roots.stream().filter(Files::isDirectory).toList();
        if (existing.isEmpty()) {
            throw new IOException("None of the watch roots exist: " + roots);
        }
        watcher = DirectoryWatcher.builder()
                .paths(existing)
                .listener(this::handleEvent)
                .fileHashing(false)
                .build();
    }

    @Override
    public void start(CompletableFuture<?> delayNotificationsUntilCompleted) {
        var thread = new Thread(() -> beginWatching(delayNotificationsUntilCompleted));
        thread.setName("NativeDirectoryWatcher@" + roots.get(0));
        thread.setDaemon(true);
        watcherThread = thread;
        thread.start();
    }

    private void beginWatching(CompletableFuture<?> delayNotificationsUntilCompleted) {
        logger.debug("Setting up native directory watcher for {}", roots);
        try {
            if (watcher == null) {
                initialize();
            }

            try {
                delayNotificationsUntilCompleted.get();
            } catch (ExecutionException e) {
                logger.error("Initial work failed; not delivering file events", e);
                return;
            }

            var w = watcher;
            if (w == null || !running) {
                return;
            }
            logger.info("Starting native directory watcher for: {}", roots);
            w.watch(); // blocks until the watcher is closed
        } catch (IOException e) {
            logger.error("Error setting up native directory watcher", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Native watcher thread interrupted; shutting down");
        }
    }

    private void handleEvent(DirectoryChangeEvent event) {
        if (!running) return;

        try {
            var kind =
                    switch (event.eventType()) {
                        case CREATE -> FileChangeEvent.Kind.CREATE;
                        case DELETE -> FileChangeEvent.Kind.DELETE;
                        case OVERFLOW -> FileChangeEvent.Kind.OVERFLOW;
                        default -> FileChangeEvent.Kind.MODIFY;
                    };
            Path changedPath = event.path() == null ? roots.get(0) : FileUtil.normalize(event.path());
            logger.trace("File event: {} on {}", kind, changedPath);

            var batch = new EventBatch();
            batch.add(new FileChangeEvent(changedPath, kind));
            notifyFilesChanged(batch);
        } catch (RuntimeException e) {
            logger.error("Error handling directory change event", e);
        }
    }

    private void notifyFilesChanged(EventBatch batch) {
        for (Listener listener : listeners) {
            try {
                listener.onFilesChanged(batch);
            } catch (Exception e) {
                logger.error(
                        "Error notifying listener {} of file changes",
                        listener.getClass().getSimpleName(),
                        e);
            }
        }
    }

    @Override
    public void addListener(Listener listener) {
        listeners.add(listener);
        logger.debug("Added listener: {}", listener.getClass().getSimpleName());
    }

    @Override
    public void removeListener(Listener listener) {
        listeners.remove(listener);
        logger.debug("Removed listener: {}", listener.getClass().getSimpleName());
    }

    @Override
    public synchronized void close() {
        running = false;

        var w = watcher;
        if (w != null) {
            try {
                logger.info("Closing native directory watcher for: {}", roots);
                w.close();
            } catch (IOException e) {
                logger.error("Error closing native directory watcher", e);
            }
        }

        var thread = watcherThread;
        if (thread != null) {
            try {
                thread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for watcher thread to stop");
            }
        }
    }
}
