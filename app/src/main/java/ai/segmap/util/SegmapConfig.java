package ai.segmap.util;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable engine configuration. All directory fields are absolute and normalized.
 *
 * <p>Values are layered, later sources winning: built-in defaults, {@code segmap.properties} in the project root,
 * {@code SEGMAP_*} environment variables, {@code segmap.*} system properties, and finally explicit overrides (usually
 * command-line options).
 *
 * @param projectRoot root that segment ids and manifest paths are relative to
 * @param srcDir source root; imports resolving outside it are not tracked
 * @param appDir directory scanned for entry markers
 * @param cacheDir directory under which manifests are written
 * @param entryMarker file name whose presence makes a directory a segment
 * @param pageFile optional secondary entry file next to the marker
 * @param aliases import prefix to directory rewrites, in match order
 * @param pollIntervalMs consumer polling interval while waiting for a manifest
 * @param timeoutMs consumer hard timeout while waiting for a manifest
 * @param watchServiceImpl "legacy" or "native"
 */
public record SegmapConfig(
        Path projectRoot,
        Path srcDir,
        Path appDir,
        Path cacheDir,
        String entryMarker,
        String pageFile,
        Map<String, Path> aliases,
        long pollIntervalMs,
        long timeoutMs,
        String watchServiceImpl) {

    private static final Logger logger = LogManager.getLogger(SegmapConfig.class);

    public static final String PROPERTIES_FILE = "segmap.properties";

    public static final String KEY_SRC_DIR = "srcDir";
    public static final String KEY_APP_DIR = "appDir";
    public static final String KEY_CACHE_DIR = "cacheDir";
    public static final String KEY_ENTRY_MARKER = "entryMarker";
    public static final String KEY_PAGE_FILE = "pageFile";
    public static final String KEY_ALIASES = "aliases";
    public static final String KEY_POLL_INTERVAL_MS = "pollIntervalMs";
    public static final String KEY_TIMEOUT_MS = "timeoutMs";
    public static final String KEY_WATCH_SERVICE_IMPL = "watchservice.impl";

    private static final Map<String, String> DEFAULTS = Map.of(
            KEY_SRC_DIR, "src",
            KEY_APP_DIR, "src/app",
            KEY_CACHE_DIR, "node_modules/.cache/test",
            KEY_ENTRY_MARKER, "layout.tsx",
            KEY_PAGE_FILE, "page.tsx",
            KEY_ALIASES, "@src/=src,@/=src",
            KEY_POLL_INTERVAL_MS, "10",
            KEY_TIMEOUT_MS, "10000",
            KEY_WATCH_SERVICE_IMPL, "legacy");

    public SegmapConfig {
        if (!projectRoot.isAbsolute()) {
            throw new IllegalArgumentException("Project root must be absolute, got " + projectRoot);
        }
        aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    /** Defaults only, ignoring files, environment and system properties. */
    public static SegmapConfig defaults(Path projectRoot) {
        return fromValues(normalize(projectRoot), DEFAULTS);
    }

    /** Full layered load; {@code overrides} wins over every other source. */
    public static SegmapConfig load(Path projectRoot, Map<String, String> overrides) throws IOException {
        var root = normalize(projectRoot);
        var values = new HashMap<>(DEFAULTS);
        values.putAll(readPropertiesFile(root.resolve(PROPERTIES_FILE)));
        for (var key : DEFAULTS.keySet()) {
            var env = System.getenv(envName(key));
            if (env != null && !env.isBlank()) {
                values.put(key, env);
            }
            var prop = System.getProperty("segmap." + key);
            if (prop != null && !prop.isBlank()) {
                values.put(key, prop);
            }
        }
        overrides.forEach((k, v) -> {
            if (DEFAULTS.containsKey(k) && v != null && !v.isBlank()) {
                values.put(k, v);
            }
        });
        return fromValues(root, values);
    }

    /** SEGMAP_ prefix, camelCase and dots turned into upper snake case: pollIntervalMs -> SEGMAP_POLL_INTERVAL_MS. */
    static String envName(String key) {
        var sb = new StringBuilder("SEGMAP_");
        for (char c : key.toCharArray()) {
            if (c == '.') {
                sb.append('_');
            } else if (Character.isUpperCase(c)) {
                sb.append('_').append(c);
            } else {
                sb.append(Character.toUpperCase(c));
            }
        }
        return sb.toString().toUpperCase(Locale.ROOT);
    }

    private static Map<String, String> readPropertiesFile(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return Map.of();
        }
        var props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        logger.debug("Loaded {} configuration entries from {}", props.size(), file);
        var result = new HashMap<String, String>();
        for (var name : props.stringPropertyNames()) {
            result.put(name, props.getProperty(name).trim());
        }
        return result;
    }

    private static SegmapConfig fromValues(Path root, Map<String, String> values) {
        return new SegmapConfig(
                root,
                resolveDir(root, values.get(KEY_SRC_DIR)),
                resolveDir(root, values.get(KEY_APP_DIR)),
                resolveDir(root, values.get(KEY_CACHE_DIR)),
                values.get(KEY_ENTRY_MARKER),
                values.get(KEY_PAGE_FILE),
                parseAliases(root, values.get(KEY_ALIASES)),
                parseLong(KEY_POLL_INTERVAL_MS, values.get(KEY_POLL_INTERVAL_MS)),
                parseLong(KEY_TIMEOUT_MS, values.get(KEY_TIMEOUT_MS)),
                values.get(KEY_WATCH_SERVICE_IMPL));
    }

    /**
     * Parses "prefix=dir,prefix=dir". Each dir is relative to the project root. Splits on the first '=' only, so
     * "@/=src" maps "@/" to "src".
     */
    static Map<String, Path> parseAliases(Path root, @Nullable String spec) {
        var result = new LinkedHashMap<String, Path>();
        if (spec == null || spec.isBlank()) {
            return result;
        }
        for (var item : spec.split(",")) {
            var trimmed = item.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0 || eq == trimmed.length() - 1) {
                throw new IllegalArgumentException("Invalid alias entry '" + trimmed + "', expected prefix=dir");
            }
            result.put(trimmed.substring(0, eq).trim(), resolveDir(root, trimmed.substring(eq + 1).trim()));
        }
        return result;
    }

    private static long parseLong(String key, String value) {
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed <= 0) {
                throw new IllegalArgumentException(key + " must be positive, got " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private static Path resolveDir(Path root, String value) {
        var p = Path.of(value);
        return (p.isAbsolute() ? p : root.resolve(p)).normalize();
    }

    private static Path normalize(Path root) {
        return root.toAbsolutePath().normalize();
    }
}
