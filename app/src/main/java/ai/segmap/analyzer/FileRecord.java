package ai.segmap.analyzer;

import java.nio.file.Path;
import java.util.List;

/**
 * Cached analysis of one file.
 *
 * @param imports sorted, distinct absolute paths of resolved imports
 * @param lines line count of the file text
 */
public record FileRecord(List<Path> imports, int lines) {
    public static final FileRecord MISSING = new FileRecord(List.of(), 0);

    public FileRecord {
        imports = List.copyOf(imports);
    }
}
