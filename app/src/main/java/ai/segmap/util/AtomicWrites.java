package ai.segmap.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class AtomicWrites {

    /** Prefix of the sibling temp files; watchers ignore them. */
    public static final String TEMP_PREFIX = ".segmap-";

    public static final String TEMP_SUFFIX = ".tmp";

    private AtomicWrites() {}

    /**
     * Replaces {@code targetPath} with {@code content}. The full content goes to a temp file in the same directory
     * first and is then moved over the target, so readers see either the old file, no file, or the complete new one.
     * Parent directories are created as needed.
     */
    public static void atomicOverwrite(Path targetPath, String content) throws IOException {
        var parent = targetPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tempFile = Files.createTempFile(parent, TEMP_PREFIX, TEMP_SUFFIX);
        try {
            Files.write(tempFile, content.getBytes(StandardCharsets.UTF_8));
            try {
                Files.move(tempFile, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }

    public static boolean isTempFile(Path path) {
        var name = path.getFileName();
        if (name == null) {
            return false;
        }
        var s = name.toString();
        return s.startsWith(TEMP_PREFIX) && s.endsWith(TEMP_SUFFIX);
    }
}
