package ai.segmap.testutil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates temporary projects from source code defined by content-filename pairs. This is cleaned up once closed.
 */
public class InlineTestProjectCreator {

    private InlineTestProjectCreator() {}

    public static TestProjectBuilder code(String contents, String filename) {
        return new TestProjectBuilder().addFileContents(contents, filename);
    }

    public static TestProjectBuilder empty() {
        return new TestProjectBuilder();
    }

    public static class TestProjectBuilder {

        private final List<FileContents> entries = new ArrayList<>();

        private TestProjectBuilder() {}

        public TestProjectBuilder addFileContents(String contents, String filename) {
            entries.add(new FileContents(filename, contents));
            return this;
        }

        public TestProject build() throws IOException {
            var newTemporaryDirectory = Files.createTempDirectory("segmap-inline-test-");
            for (var entry : entries) {
                var absPath = newTemporaryDirectory.resolve(entry.relPath);
                Files.createDirectories(absPath.getParent());
                Files.writeString(absPath, entry.contents, StandardOpenOption.CREATE_NEW);
            }
            return new TestProject(newTemporaryDirectory);
        }
    }

    private record FileContents(String relPath, String contents) {}
}
