package ai.segmap.testutil;

import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.segmap.util.FileUtil;
import ai.segmap.util.SegmapConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.stream.Stream;

/** A throwaway project directory for engine tests. Deleted on close. */
public class TestProject implements AutoCloseable {
    private final Path root;

    TestProject(Path root) {
        this.root = FileUtil.normalize(root);
    }

    /** Copies {@code src/test/resources/<subDir>} into a fresh temporary directory. */
    public static TestProject createTestProject(String subDir) throws IOException {
        Path testDir = Path.of("src/test/resources", subDir);
        assertTrue(Files.exists(testDir), "Test resource dir missing: " + testDir);
        assertTrue(Files.isDirectory(testDir), testDir + " is not a directory");

        var target = Files.createTempDirectory("segmap-test-");
        try (Stream<Path> walk = Files.walk(testDir)) {
            walk.forEach(source -> {
                var dest = target.resolve(testDir.relativize(source).toString());
                try {
                    if (Files.isDirectory(source)) {
                        Files.createDirectories(dest);
                    } else {
                        Files.copy(source, dest, StandardCopyOption.REPLACE_EXISTING);
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        }
        return new TestProject(target);
    }

    public Path getRoot() {
        return root;
    }

    public SegmapConfig config() {
        return SegmapConfig.defaults(root);
    }

    public Path path(String relPath) {
        return root.resolve(relPath).normalize();
    }

    public Path write(String relPath, String contents) throws IOException {
        var file = path(relPath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, contents, StandardCharsets.UTF_8);
        return file;
    }

    public String read(String relPath) throws IOException {
        return Files.readString(path(relPath), StandardCharsets.UTF_8);
    }

    public void delete(String relPath) throws IOException {
        Files.delete(path(relPath));
    }

    /** Manifest location for a segment under the default cache directory. */
    public Path manifestPath(String segmentId) {
        return config().cacheDir().resolve(segmentId).resolve("manifest.json");
    }

    @Override
    public void close() {
        FileUtil.deleteRecursively(root);
    }
}
