package ai.segmap.analyzer;

import ai.segmap.util.FileUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lazily computed {@link FileRecord}s keyed by normalized absolute path. Not thread-safe; owned by the engine's event
 * loop.
 */
public class FileCache {
    private static final Logger logger = LogManager.getLogger(FileCache.class);

    private final Map<Path, FileRecord> records = new HashMap<>();
    private final ImportExtractor extractor;
    private final SpecifierResolver resolver;

    public FileCache(ImportExtractor extractor, SpecifierResolver resolver) {
        this.extractor = extractor;
        this.resolver = resolver;
    }

    /** Returns the cached record, computing it on a miss. Absent files are cached as {@link FileRecord#MISSING}. */
    public FileRecord get(Path path) {
        var key = FileUtil.normalize(path);
        var cached = records.get(key);
        if (cached != null) {
            return cached;
        }
        var computed = compute(key);
        records.put(key, computed);
        return computed;
    }

    public void invalidate(Path path) {
        records.remove(FileUtil.normalize(path));
    }

    public void invalidateAll() {
        records.clear();
    }

    public int size() {
        return records.size();
    }

    boolean contains(Path path) {
        return records.containsKey(FileUtil.normalize(path));
    }

    private FileRecord compute(Path file) {
        if (!Files.exists(file)) {
            logger.trace("{} does not exist; caching empty record", file);
            return FileRecord.MISSING;
        }
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Unable to read {}; treating as empty", file, e);
            return FileRecord.MISSING;
        }

        var imports = new TreeSet<Path>();
        for (var specifier : extractor.extract(text, file)) {
            resolver.resolve(specifier, file).ifPresent(imports::add);
        }
        return new FileRecord(imports.stream().toList(), FileUtil.countLines(text));
    }
}
