package ai.segmap.segment;

import ai.segmap.analyzer.FileRecord;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Result of one closure traversal.
 *
 * @param definition segment the traversal started from
 * @param files every existing file reached from the entries
 * @param records the record each visited file was expanded with
 * @param missing paths reached through an entry or import that did not exist at traversal time
 */
public record SegmentClosure(
        SegmentDefinition definition, Set<Path> files, Map<Path, FileRecord> records, Set<Path> missing) {

    public SegmentClosure {
        files = Collections.unmodifiableSet(new TreeSet<>(files));
        records = Collections.unmodifiableMap(new TreeMap<>(records));
        missing = Collections.unmodifiableSet(new TreeSet<>(missing));
    }

    public String segmentId() {
        return definition.id();
    }

    /** Imports recorded for {@code file} during traversal, empty when the file is not a member. */
    public List<Path> dependenciesOf(Path file) {
        var record = records.get(file);
        return record == null ? List.of() : record.imports();
    }
}
