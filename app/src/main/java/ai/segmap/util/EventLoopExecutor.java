package ai.segmap.util;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Single-threaded executor that owns the engine's mutable state. Every task runs to completion before the next one
 * starts. Failures are reported to the exception handler and surface through the returned future.
 */
public class EventLoopExecutor {
    private static final Logger logger = LogManager.getLogger(EventLoopExecutor.class);

    private final ExecutorService delegate;
    private final Consumer<Throwable> exceptionHandler;
    private volatile @Nullable Thread loopThread;

    public EventLoopExecutor(String threadName, Consumer<Throwable> exceptionHandler) {
        this.exceptionHandler = exceptionHandler;
        var threadFactory = new ThreadFactory() {
            private final ThreadFactory defaults = Executors.defaultThreadFactory();

            @Override
            public Thread newThread(Runnable r) {
                Thread t = defaults.newThread(r);
                t.setName(threadName);
                t.setDaemon(true);
                loopThread = t;
                return t;
            }
        };
        this.delegate = Executors.newSingleThreadExecutor(threadFactory);
    }

    public <T> CompletableFuture<T> submit(Callable<T> task) {
        var cf = new CompletableFuture<T>();
        try {
            var underlying = delegate.submit(() -> {
                try {
                    cf.complete(task.call());
                } catch (Throwable t) {
                    exceptionHandler.accept(t);
                    cf.completeExceptionally(t);
                }
            });
            cf.whenComplete((res, ex) -> {
                if (cf.isCancelled()) underlying.cancel(true);
            });
        } catch (RejectedExecutionException e) {
            logger.trace("Task rejected because event loop is shut down", e);
            cf.completeExceptionally(e);
        }
        return cf;
    }

    public CompletableFuture<Void> submit(Runnable task) {
        return submit(() -> {
            task.run();
            return null;
        });
    }

    /** True when called from the loop thread; blocking on the loop from there would deadlock. */
    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * Stops accepting tasks and waits for the running one (and anything queued) to finish, forcing
     * {@code shutdownNow()} once {@code timeoutMillis} elapses.
     */
    public void shutdownAndAwait(long timeoutMillis, String name) {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                logger.warn("{} did not terminate within {}ms; forcing shutdownNow()", name, timeoutMillis);
                var pending = delegate.shutdownNow();
                if (!pending.isEmpty()) {
                    logger.debug("Canceled {} queued tasks in {}", pending.size(), name);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while awaiting termination of {}", name, e);
        }
    }
}
