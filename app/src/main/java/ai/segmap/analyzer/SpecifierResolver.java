package ai.segmap.analyzer;

import ai.segmap.util.FileUtil;
import ai.segmap.util.SegmapConfig;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Maps a raw import specifier, as written in a module, to the absolute path of a file inside the source root.
 * Builtins, bare package names and anything landing outside the source root resolve to nothing.
 */
public class SpecifierResolver {
    private static final Logger logger = LogManager.getLogger(SpecifierResolver.class);

    public static final List<String> RESOLVE_EXTENSIONS = List.of(".tsx", ".ts", ".jsx", ".js", ".mjs", ".cjs", ".json");

    private static final String NODE_PREFIX = "node:";
    private static final String BUILTINS_RESOURCE = "node-builtins.txt";
    private static final Set<String> NODE_BUILTINS = loadBuiltins();

    private final Path srcDir;
    private final Map<String, Path> aliases;

    public SpecifierResolver(SegmapConfig config) {
        this.srcDir = config.srcDir();
        this.aliases = config.aliases();
    }

    public Optional<Path> resolve(String specifier, Path importer) {
        if (specifier.startsWith(NODE_PREFIX) || NODE_BUILTINS.contains(specifier)) {
            return Optional.empty();
        }

        var rewritten = applyAliases(specifier);
        Path target;
        try {
            if (rewritten.startsWith("./") || rewritten.startsWith("../")) {
                var parent = importer.getParent();
                if (parent == null) {
                    return Optional.empty();
                }
                target = parent.resolve(rewritten).normalize();
            } else if (Path.of(rewritten).isAbsolute()) {
                target = Path.of(rewritten).normalize();
            } else {
                logger.trace("Bare specifier '{}' in {} not tracked", specifier, importer);
                return Optional.empty();
            }
        } catch (InvalidPathException e) {
            logger.trace("Unusable specifier '{}' in {}", specifier, importer, e);
            return Optional.empty();
        }

        for (var candidate : candidates(target)) {
            if (Files.isRegularFile(candidate)) {
                if (!FileUtil.isWithin(srcDir, candidate)) {
                    continue;
                }
                return Optional.of(candidate);
            }
        }
        logger.trace("Specifier '{}' in {} did not resolve inside {}", specifier, importer, srcDir);
        return Optional.empty();
    }

    private String applyAliases(String specifier) {
        for (var alias : aliases.entrySet()) {
            var prefix = alias.getKey();
            if (specifier.startsWith(prefix)) {
                var remainder = specifier.substring(prefix.length());
                return alias.getValue().resolve(remainder).normalize().toString();
            }
        }
        return specifier;
    }

    /** Exact path first, then {@code <p><ext>} and {@code <p>/index<ext>} per extension, unless an extension is given. */
    static List<Path> candidates(Path target) {
        if (!FileUtil.extension(target).isEmpty()) {
            return List.of(target);
        }
        var fileName = target.getFileName();
        if (fileName == null) {
            return List.of();
        }
        var result = new ArrayList<Path>();
        result.add(target);
        for (var ext : RESOLVE_EXTENSIONS) {
            result.add(target.resolveSibling(fileName + ext));
            result.add(target.resolve("index" + ext));
        }
        return result;
    }

    static boolean isBuiltin(String specifier) {
        return NODE_BUILTINS.contains(specifier);
    }

    private static Set<String> loadBuiltins() {
        var stream = SpecifierResolver.class.getResourceAsStream(BUILTINS_RESOURCE);
        if (stream == null) {
            throw new IllegalStateException("Missing classpath resource " + BUILTINS_RESOURCE);
        }
        var names = new HashSet<String>();
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                var trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                names.add(trimmed);
                names.add(NODE_PREFIX + trimmed);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + BUILTINS_RESOURCE, e);
        }
        return Set.copyOf(names);
    }
}
