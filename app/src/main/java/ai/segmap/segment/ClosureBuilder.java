package ai.segmap.segment;

import ai.segmap.analyzer.FileCache;
import ai.segmap.analyzer.FileRecord;
import ai.segmap.util.FileUtil;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Computes the transitive import closure of a segment's entries against the {@link FileCache}. */
public class ClosureBuilder {
    private static final Logger logger = LogManager.getLogger(ClosureBuilder.class);

    private final FileCache cache;

    public ClosureBuilder(FileCache cache) {
        this.cache = cache;
    }

    public SegmentClosure build(SegmentDefinition definition) {
        var visited = new HashSet<Path>();
        var missing = new HashSet<Path>();
        Map<Path, FileRecord> records = new HashMap<>();
        var pending = new ArrayDeque<Path>();
        definition.entries().forEach(pending::push);

        while (!pending.isEmpty()) {
            var file = FileUtil.normalize(pending.pop());
            if (visited.contains(file) || missing.contains(file)) {
                continue;
            }
            if (!Files.exists(file)) {
                missing.add(file);
                continue;
            }
            visited.add(file);

            var record = cache.get(file);
            records.put(file, record);
            for (var imported : record.imports()) {
                if (!visited.contains(imported)) {
                    pending.push(imported);
                }
            }
        }

        if (!missing.isEmpty()) {
            logger.debug("Segment {} references {} missing files: {}", definition.id(), missing.size(), missing);
        }
        logger.trace("Segment {} closure has {} files", definition.id(), visited.size());
        return new SegmentClosure(definition, visited, records, missing);
    }
}
