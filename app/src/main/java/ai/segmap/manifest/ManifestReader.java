package ai.segmap.manifest;

import ai.segmap.util.Json;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads manifests back from disk. A file that is absent, half-written or otherwise unparseable is "not populated";
 * none of these are errors from a reader's point of view.
 */
public final class ManifestReader {
    private static final Logger logger = LogManager.getLogger(ManifestReader.class);

    private ManifestReader() {}

    public static Optional<Manifest> read(Path manifestPath) {
        return readString(manifestPath).flatMap(content -> {
            try {
                return Optional.of(Json.fromJson(content, Manifest.class));
            } catch (IOException e) {
                logger.trace("Unparseable manifest {}", manifestPath, e);
                return Optional.empty();
            }
        });
    }

    /** True when the file parses as a JSON object that has a {@code files} key. */
    public static boolean isPopulated(Path manifestPath) {
        return readString(manifestPath).map(ManifestReader::isPopulatedContent).orElse(false);
    }

    static boolean isPopulatedContent(String content) {
        try {
            var node = Json.readTree(content);
            return node != null && node.isObject() && node.has("files");
        } catch (IOException e) {
            logger.trace("Manifest content not yet parseable", e);
            return false;
        }
    }

    /** Every {@code manifest.json} under {@code cacheDir} that is not yet populated, sorted. */
    public static List<Path> findPendingPlaceholders(Path cacheDir) throws IOException {
        var pending = new ArrayList<Path>();
        if (!Files.isDirectory(cacheDir)) {
            return pending;
        }
        try (Stream<Path> walk = Files.walk(cacheDir)) {
            walk.filter(p -> p.getFileName() != null
                            && ManifestPaths.MANIFEST_FILE_NAME.equals(p.getFileName().toString()))
                    .filter(Files::isRegularFile)
                    .filter(p -> !isPopulated(p))
                    .sorted()
                    .forEach(pending::add);
        }
        return pending;
    }

    private static Optional<String> readString(Path manifestPath) {
        try {
            return Optional.of(Files.readString(manifestPath, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            logger.debug("Unable to read manifest {}", manifestPath, e);
            return Optional.empty();
        }
    }
}
