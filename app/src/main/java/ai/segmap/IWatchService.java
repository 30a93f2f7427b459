package ai.segmap;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

public interface IWatchService extends AutoCloseable {
    default void start(CompletableFuture<?> delayNotificationsUntilCompleted) {}

    default void addListener(Listener listener) {}

    default void removeListener(Listener listener) {}

    @Override
    default void close() {}

    interface Listener {
        void onFilesChanged(EventBatch batch);

        default void onNoFilesChangedDuringPollInterval() {}
    }

    /** mutable since we will collect events until they stop arriving */
    class EventBatch {
        boolean isOverflowed;
        final List<FileChangeEvent> events = new ArrayList<>();

        public EventBatch() {}

        public EventBatch(List<FileChangeEvent> events) {
            for (var event : events) {
                add(event);
            }
        }

        public void add(FileChangeEvent event) {
            if (event.kind() == FileChangeEvent.Kind.OVERFLOW) {
                isOverflowed = true;
            }
            events.add(event);
        }

        public boolean isOverflowed() {
            return isOverflowed;
        }

        public List<FileChangeEvent> events() {
            return List.copyOf(events);
        }

        public Set<Path> files() {
            var files = new LinkedHashSet<Path>();
            for (var event : events) {
                if (event.kind() != FileChangeEvent.Kind.OVERFLOW) {
                    files.add(event.path());
                }
            }
            return files;
        }

        public boolean isEmpty() {
            return events.isEmpty() && !isOverflowed;
        }

        @Override
        public String toString() {
            return "EventBatch{" + "isOverflowed=" + isOverflowed + ", events=" + events + '}';
        }
    }
}
