package ai.segmap.manifest;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * On-disk manifest of one segment. Paths are project-root-relative with '/' separators.
 *
 * @param entries the segment's entry files, sorted
 * @param files every closure member keyed by path, in lexicographic order
 * @param segment segment id
 * @param updatedAt epoch milliseconds of the write
 */
@JsonPropertyOrder({"entries", "files", "segment", "updatedAt"})
public record Manifest(List<String> entries, Map<String, ManifestFile> files, String segment, long updatedAt) {
    public Manifest {
        entries = entries == null ? List.of() : List.copyOf(entries);
        files = files == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(files));
    }

    /** Same content with the timestamp zeroed, for comparing two builds. */
    public Manifest withoutTimestamp() {
        return new Manifest(entries, files, segment, 0L);
    }
}
