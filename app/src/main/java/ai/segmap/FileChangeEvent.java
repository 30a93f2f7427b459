package ai.segmap;

import java.nio.file.Path;

/**
 * One raw file-system change.
 *
 * @param path absolute, normalized path that changed; for {@link Kind#OVERFLOW} the watched root
 * @param kind what happened
 */
public record FileChangeEvent(Path path, Kind kind) {
    public enum Kind {
        CREATE,
        MODIFY,
        DELETE,
        /** Events were lost; the receiver must assume anything changed. */
        OVERFLOW
    }

    /** True for kinds that can change the set of files on disk. */
    public boolean isStructural() {
        return kind != Kind.MODIFY;
    }
}
