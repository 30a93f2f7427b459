package ai.segmap.segment;

import java.nio.file.Path;
import java.util.List;

/**
 * A segment as found on disk.
 *
 * @param id project-root-relative POSIX path of the segment directory, e.g. {@code src/app/test}
 * @param entries sorted absolute paths of the entry marker and, when present, its sibling page file
 */
public record SegmentDefinition(String id, List<Path> entries) {
    public SegmentDefinition {
        entries = entries.stream().sorted().toList();
    }
}
