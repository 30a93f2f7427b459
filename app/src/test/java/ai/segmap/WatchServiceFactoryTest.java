package ai.segmap;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WatchServiceFactoryTest {

    @TempDir
    Path tempDir;

    @Test
    void testConfigurationForcesLegacy() {
        try (var service = WatchServiceFactory.create(List.of(tempDir), List.of(), "legacy")) {
            assertInstanceOf(ProjectWatchService.class, service);
        }
    }

    @Test
    void testConfigurationForcesNative() {
        try (var service = WatchServiceFactory.create(List.of(tempDir), List.of(), "native")) {
            assertInstanceOf(NativeProjectWatchService.class, service);
        }
    }

    @Test
    void testConfigurationCaseInsensitive() {
        try (var legacy = WatchServiceFactory.create(List.of(tempDir), List.of(), "LEGACY");
                var nativeService = WatchServiceFactory.create(List.of(tempDir), List.of(), "Native")) {
            assertInstanceOf(ProjectWatchService.class, legacy);
            assertInstanceOf(NativeProjectWatchService.class, nativeService);
        }
    }

    @Test
    void testUnknownValueUsesLegacy() {
        try (var service = WatchServiceFactory.create(List.of(tempDir), List.of(), "polling")) {
            assertInstanceOf(ProjectWatchService.class, service);
        }
    }

    @Test
    void testNativeFallsBackWhenRootsAreMissing() {
        var missing = tempDir.resolve("does-not-exist");
        try (var service = WatchServiceFactory.create(List.of(missing), List.of(), "native")) {
            assertInstanceOf(ProjectWatchService.class, service);
        }
    }
}
