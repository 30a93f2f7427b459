package ai.segmap;

import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Creates the {@link IWatchService} implementation named by configuration.
 *
 * <p>"legacy" selects the JDK {@link java.nio.file.WatchService} implementation and is the default. "native" selects
 * the directory-watcher implementation, falling back to legacy when it cannot be set up.
 */
public class WatchServiceFactory {
    private static final Logger logger = LogManager.getLogger(WatchServiceFactory.class);

    public static final String LEGACY = "legacy";
    public static final String NATIVE = "native";

    private WatchServiceFactory() {}

    public static IWatchService create(List<Path> roots, List<IWatchService.Listener> listeners, String implProp) {
        if (NATIVE.equalsIgnoreCase(implProp)) {
            logger.info("Using native watch service (forced by configuration)");
            return createNativeWithFallback(roots, listeners);
        }
        if (!LEGACY.equalsIgnoreCase(implProp)) {
            logger.warn("Unknown watch service implementation '{}'; using legacy", implProp);
        } else {
            logger.debug("Using legacy watch service");
        }
        return new ProjectWatchService(roots, listeners);
    }

    /** Try to create the native implementation, fall back to legacy on error. */
    static IWatchService createNativeWithFallback(List<Path> roots, List<IWatchService.Listener> listeners) {
        try {
            var service = new NativeProjectWatchService(roots, listeners);
            service.initialize();
            return service;
        } catch (Exception e) {
            logger.warn("Failed to create native watch service, falling back to legacy implementation", e);
            return new ProjectWatchService(roots, listeners);
        }
    }
}
