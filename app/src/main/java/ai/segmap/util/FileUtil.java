package ai.segmap.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class FileUtil {
    private static final Logger logger = LogManager.getLogger(FileUtil.class);

    private static final Pattern LINE_TERMINATOR = Pattern.compile("\r?\n");

    private FileUtil() {
        /* utility class – no instances */
    }

    /** Absolute, normalized form used as the key for every per-file structure. */
    public static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    /** True when {@code file} is {@code directory} itself or lies beneath it. Both must be normalized. */
    public static boolean isWithin(Path directory, Path file) {
        return file.startsWith(directory);
    }

    /** Root-relative path with '/' separators regardless of platform; "" for the root itself. */
    public static String toRelativePosix(Path root, Path file) {
        var rel = root.relativize(file).toString();
        return rel.replace('\\', '/');
    }

    /** Lower-cased extension including the dot, or "" when the file name has none. */
    public static String extension(Path path) {
        var name = path.getFileName();
        if (name == null) {
            return "";
        }
        var s = name.toString();
        int dot = s.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return s.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * Number of line-terminator-delimited segments: 0 for empty text, otherwise one more than the number of line
     * terminators, so a trailing newline counts an empty final line.
     */
    public static int countLines(String content) {
        if (content.isEmpty()) {
            return 0;
        }
        return LINE_TERMINATOR.split(content, -1).length;
    }

    /**
     * Deletes {@code path} and everything beneath it. Does **not** follow symlinks; logs but ignores individual delete
     * failures.
     */
    public static boolean deleteRecursively(Path path) {
        if (!Files.exists(path)) {
            return false;
        }

        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    logger.warn("Failed to delete {}", p, e);
                }
            });
            return !Files.exists(path);
        } catch (IOException e) {
            logger.error("Failed to walk or initiate deletion for directory: {}", path, e);
            return false;
        }
    }
}
