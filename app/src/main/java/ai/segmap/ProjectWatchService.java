package ai.segmap;

import ai.segmap.util.FileUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Watches one or more directory trees with the JDK {@link WatchService}, registering every directory recursively and
 * batching events that arrive within a short debounce window.
 */
public class ProjectWatchService implements IWatchService {

    private final Logger logger = LogManager.getLogger(ProjectWatchService.class);

    private static final long DEBOUNCE_DELAY_MS = 100;
    private static final long POLL_TIMEOUT_MS = 100;

    private final List<Path> roots;
    private final List<Listener> listeners;

    private volatile boolean running = true;

    @Nullable
    private volatile Thread watcherThread;

    public ProjectWatchService(List<Path> roots, List<Listener> listeners) {
        this.roots = roots.stream().map(FileUtil::normalize).toList();
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    @Override
    public void start(CompletableFuture<?> delayNotificationsUntilCompleted) {
        var thread = new Thread(
                () -> beginWatching(delayNotificationsUntilCompleted), "DirectoryWatcher@" + roots.get(0));
        thread.setDaemon(true);
        watcherThread = thread;
        thread.start();
    }

    private void beginWatching(CompletableFuture<?> delayNotificationsUntilCompleted) {
        logger.debug("Setting up WatchService for {}", roots);
        try (WatchService watchService = FileSystems.getDefault().newWatchService()) {
            for (var root : roots) {
                registerAllDirectories(root, watchService);
            }

            // The WatchService queues any events that arrive while we wait.
            try {
                delayNotificationsUntilCompleted.get();
            } catch (ExecutionException e) {
                logger.error("Initial work failed; not delivering file events", e);
                return;
            }

            while (running) {
                WatchKey key = watchService.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);

                if (key == null) {
                    notifyNoFilesChanged();
                    continue;
                }

                var batch = new EventBatch();
                collectEventsFromKey(key, watchService, batch);

                long deadline = System.currentTimeMillis() + DEBOUNCE_DELAY_MS;
                while (true) {
                    long remaining = deadline - System.currentTimeMillis();
                    if (remaining <= 0) break;
                    WatchKey nextKey = watchService.poll(remaining, TimeUnit.MILLISECONDS);
                    if (nextKey == null) break;
                    collectEventsFromKey(nextKey, watchService, batch);
                }

                if (!batch.isEmpty()) {
                    notifyFilesChanged(batch);
                }
            }
        } catch (IOException e) {
            logger.error("Error setting up watch service", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("FileWatchService thread interrupted; shutting down");
        }
    }

    private void collectEventsFromKey(WatchKey key, WatchService watchService, EventBatch batch) {
        Path watchPath = (Path) key.watchable();
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                batch.add(new FileChangeEvent(watchPath, FileChangeEvent.Kind.OVERFLOW));
                continue;
            }

            if (!(event.context() instanceof Path ctx)) {
                logger.warn("Event is not overflow but has no path: {}", event);
                continue;
            }

            Path eventPath = FileUtil.normalize(watchPath.resolve(ctx));
            batch.add(new FileChangeEvent(eventPath, toKind(event.kind())));

            // a new directory must be registered before its children can be seen
            if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(eventPath)) {
                try {
                    registerAllDirectories(eventPath, watchService);
                } catch (IOException ex) {
                    logger.warn("Failed to register new directory for watching: {}", eventPath, ex);
                }
            }
        }

        if (!key.reset()) {
            logger.debug("Watch key no longer valid: {}", key.watchable());
        }
    }

    private static FileChangeEvent.Kind toKind(WatchEvent.Kind<?> kind) {
        if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
            return FileChangeEvent.Kind.CREATE;
        }
        if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
            return FileChangeEvent.Kind.DELETE;
        }
        return FileChangeEvent.Kind.MODIFY;
    }

    /**
     * @param start either a watched root or a newly created directory beneath one
     */
    private void registerAllDirectories(Path start, WatchService watchService) throws IOException {
        if (!Files.isDirectory(start)) return;

        for (int attempt = 1; attempt <= 3; attempt++) {
            try (var walker = Files.walk(start)) {
                walker.filter(Files::isDirectory).forEach(dir -> {
                    try {
                        dir.register(
                                watchService,
                                StandardWatchEventKinds.ENTRY_CREATE,
                                StandardWatchEventKinds.ENTRY_DELETE,
                                StandardWatchEventKinds.ENTRY_MODIFY);
                    } catch (IOException e) {
                        logger.warn("Failed to register directory for watching: {}", dir, e);
                    }
                });
                return;
            } catch (IOException | UncheckedIOException e) {
                Throwable cause = (e instanceof UncheckedIOException uioe) ? uioe.getCause() : e;

                // directories can disappear mid-walk; retry a couple of times
                if (cause instanceof NoSuchFileException && attempt < 3) {
                    logger.debug("Attempt {} to walk {} hit NoSuchFileException, retrying", attempt, start, cause);
                    try {
                        Thread.sleep(10);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new IOException("Interrupted while registering " + start, ie);
                    }
                }
            }
        }
        logger.debug("Failed to (completely) register directory `{}` for watching", start);
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

    private void notifyNoFilesChanged() {
        for (Listener listener : listeners) {
            try {
                listener.onNoFilesChangedDuringPollInterval();
            } catch (Exception e) {
                logger.error(
                        "Error notifying listener {} of no file changes",
                        listener.getClass().getSimpleName(),
                        e);
            }
        }
    }
}
