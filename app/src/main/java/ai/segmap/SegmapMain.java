package ai.segmap;

import ai.segmap.manifest.Manifest;
import ai.segmap.request.StdinRequestChannel;
import ai.segmap.util.SegmapConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Command-line entry point.
 *
 * <pre>
 * segmap [--root DIR] [--once] [--manifest PATH] [--stdin-requests] [--KEY VALUE ...]
 * </pre>
 *
 * Builds every manifest, then keeps them current by watching the source tree until the process is stopped.
 * {@code --once} exits after the initial build; {@code --manifest} additionally forces a rebuild of that one manifest
 * and exits. Exit status is 0 on success, 1 on a runtime failure and 2 on bad usage or an I/O setup error.
 */
public final class SegmapMain {
    private static final Logger logger = LogManager.getLogger(SegmapMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String ARG_ROOT = "root";
    private static final String ARG_ONCE = "once";
    private static final String ARG_MANIFEST = "manifest";
    private static final String ARG_STDIN_REQUESTS = "stdin-requests";
    private static final String ARG_HELP = "help";

    private static final Set<String> FLAGS = Set.of(ARG_ONCE, ARG_STDIN_REQUESTS, ARG_HELP);
    private static final Set<String> CONFIG_KEYS = Set.of(
            SegmapConfig.KEY_SRC_DIR,
            SegmapConfig.KEY_APP_DIR,
            SegmapConfig.KEY_CACHE_DIR,
            SegmapConfig.KEY_ENTRY_MARKER,
            SegmapConfig.KEY_PAGE_FILE,
            SegmapConfig.KEY_ALIASES,
            SegmapConfig.KEY_POLL_INTERVAL_MS,
            SegmapConfig.KEY_TIMEOUT_MS,
            SegmapConfig.KEY_WATCH_SERVICE_IMPL);

    private SegmapMain() {}

    /** Thrown for command lines that cannot be acted on. */
    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    /*
     * Parse command-line arguments into a map of keys to values.
     * Supports both --key value and --key=value forms; flags map to "".
     */
    static Map<String, String> parseArgs(String[] args) throws UsageException {
        var result = new HashMap<String, String>();
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            if (!arg.startsWith("--")) {
                throw new UsageException("Unexpected argument: " + arg);
            }
            var withoutPrefix = arg.substring(2);
            String key;
            String value;

            if (withoutPrefix.contains("=")) {
                var parts = withoutPrefix.split("=", 2);
                key = parts[0];
                value = parts[1];
            } else {
                key = withoutPrefix;
                if (!FLAGS.contains(key) && i + 1 < args.length && !args[i + 1].startsWith("--")) {
                    value = args[++i];
                } else {
                    value = "";
                }
            }

            if (!FLAGS.contains(key) && !CONFIG_KEYS.contains(key) && !ARG_ROOT.equals(key) && !ARG_MANIFEST.equals(key)) {
                throw new UsageException("Unknown option --" + key);
            }
            if (!FLAGS.contains(key) && value.isBlank()) {
                throw new UsageException("Option --" + key + " requires a value");
            }
            result.put(key, value);
        }
        return result;
    }

    /*
     * Get configuration value from either parsed args or environment variable.
     */
    @Nullable
    private static String getConfigValue(Map<String, String> parsedArgs, String argKey, String envVarName) {
        var argValue = parsedArgs.get(argKey);
        if (argValue != null && !argValue.isBlank()) {
            return argValue;
        }
        return System.getenv(envVarName);
    }

    public static void main(String[] args) {
        int exitCode = run(args, System.in, System.out);
        System.exit(exitCode);
    }

    /** Runs the command line; in watch mode this blocks until the thread is interrupted. */
    static int run(String[] args, InputStream requestStream, PrintStream out) {
        Map<String, String> parsedArgs;
        SegmapConfig config;
        try {
            parsedArgs = parseArgs(args);
            if (parsedArgs.containsKey(ARG_HELP)) {
                printUsage(out);
                return EXIT_OK;
            }
            var rootValue = getConfigValue(parsedArgs, ARG_ROOT, "SEGMAP_ROOT");
            var root = Path.of(rootValue == null || rootValue.isBlank() ? "" : rootValue).toAbsolutePath();
            if (!Files.isDirectory(root)) {
                throw new UsageException("Project root is not a directory: " + root);
            }
            var overrides = new HashMap<String, String>();
            for (var key : CONFIG_KEYS) {
                var value = parsedArgs.get(key);
                if (value != null) {
                    overrides.put(key, value);
                }
            }
            config = SegmapConfig.load(root, overrides);
            Files.createDirectories(config.cacheDir());
        } catch (UsageException | IllegalArgumentException e) {
            logger.error("{}", e.getMessage());
            printUsage(out);
            return EXIT_USAGE;
        } catch (IOException e) {
            logger.error("Unable to set up project directories", e);
            return EXIT_USAGE;
        }

        logger.info(
                "Starting segmap with root={}, srcDir={}, cacheDir={}",
                config.projectRoot(),
                config.srcDir(),
                config.cacheDir());

        boolean once = parsedArgs.containsKey(ARG_ONCE);
        var manifestArg = parsedArgs.get(ARG_MANIFEST);
        if (once || manifestArg != null || !Files.isDirectory(config.srcDir())) {
            return runOnce(config, manifestArg);
        }
        return runWatching(config, parsedArgs.containsKey(ARG_STDIN_REQUESTS), requestStream);
    }

    private static int runOnce(SegmapConfig config, @Nullable String manifestArg) {
        try (var engine = new SegmentManifestEngine(config, loggingListener(), null)) {
            engine.start().join();
            if (manifestArg != null) {
                var manifestPath = config.projectRoot().resolve(manifestArg).normalize();
                var result = engine.requestManifest(manifestPath, true).join();
                if (result.isEmpty()) {
                    logger.warn("{} does not name a segment manifest; nothing built", manifestPath);
                }
            }
            return EXIT_OK;
        } catch (CompletionException e) {
            logger.error("Manifest build failed", e.getCause());
            return EXIT_FAILURE;
        } catch (InvalidPathException e) {
            logger.error("Invalid manifest path {}", manifestArg, e);
            return EXIT_USAGE;
        }
    }

    private static int runWatching(SegmapConfig config, boolean readStdin, InputStream requestStream) {
        var watchService = WatchServiceFactory.create(
                List.of(config.srcDir(), config.cacheDir()), List.of(), config.watchServiceImpl());
        var engine = new SegmentManifestEngine(config, loggingListener(), watchService);
        var channel = readStdin
                ? new StdinRequestChannel(requestStream, request -> engine.requestManifest(request))
                : null;

        Runtime.getRuntime()
                .addShutdownHook(new Thread(
                        () -> {
                            logger.info("Shutdown signal received, stopping watcher");
                            if (channel != null) {
                                channel.close();
                            }
                            engine.close();
                        },
                        "segmap-shutdown-hook"));

        try {
            engine.start().join();
        } catch (CompletionException e) {
            logger.error("Initial manifest build failed", e.getCause());
            return EXIT_FAILURE;
        }
        if (channel != null) {
            channel.start();
        }

        logger.info("Watching {} for changes", config.srcDir());
        try {
            Thread.currentThread().join(); // keep the main thread alive until shutdown
        } catch (InterruptedException e) {
            logger.info("Main thread interrupted; exiting");
            Thread.currentThread().interrupt();
        }
        return EXIT_OK;
    }

    private static SegmentListener loggingListener() {
        return new SegmentListener() {
            @Override
            public void onSegmentBuilt(String segmentId, Manifest manifest) {
                logger.info("Updated manifest for {} ({} files)", segmentId, manifest.files().size());
            }

            @Override
            public void onSegmentRemoved(String segmentId) {
                logger.info("Removed manifest for {}", segmentId);
            }
        };
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: segmap [--root DIR] [--once] [--manifest PATH] [--stdin-requests] [--KEY VALUE ...]");
        out.println("  --root DIR          project root (default: current directory, or SEGMAP_ROOT)");
        out.println("  --once              build every manifest and exit");
        out.println("  --manifest PATH     build every manifest, force-rebuild PATH, and exit");
        out.println("  --stdin-requests    read line-delimited JSON manifest requests from standard input");
        out.println("  configuration keys: " + String.join(", ", CONFIG_KEYS.stream().sorted().toList()));
    }
}
