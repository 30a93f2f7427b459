package ai.segmap.analyzer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.segmap.testutil.InlineTestProjectCreator;
import ai.segmap.testutil.TestProject;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class FileCacheTest {

    private TestProject project;
    private FileCache cache;

    @BeforeEach
    void setUp() throws IOException {
        project = InlineTestProjectCreator.code(
                        """
                        import {b} from './b';
                        import {c} from './c';
                        import React from 'react';
                        """,
                        "src/a.ts")
                .addFileContents("export const b = 1;\n", "src/b.ts")
                .addFileContents("export const c = 1;", "src/c.ts")
                .build();
        cache = new FileCache(new ImportExtractor(), new SpecifierResolver(project.config()));
    }

    @AfterEach
    void tearDown() {
        project.close();
    }

    @Test
    public void testRecordHoldsSortedResolvedImportsAndLineCount() {
        var record = cache.get(project.path("src/a.ts"));
        assertEquals(List.of(project.path("src/b.ts"), project.path("src/c.ts")), record.imports());
        assertEquals(4, record.lines());
        assertEquals(1, cache.get(project.path("src/c.ts")).lines());
        assertEquals(2, cache.get(project.path("src/b.ts")).lines());
    }

    @Test
    public void testRecordIsReusedUntilInvalidated() throws IOException {
        var a = project.path("src/a.ts");
        var first = cache.get(a);
        assertSame(first, cache.get(a));

        project.write("src/a.ts", "export const a = 1;\n");
        assertSame(first, cache.get(a), "stale until invalidated");

        cache.invalidate(a);
        var second = cache.get(a);
        assertNotSame(first, second);
        assertTrue(second.imports().isEmpty());
    }

    @Test
    public void testMissingFileIsCachedAsEmptyUntilInvalidated() throws IOException {
        var missing = project.path("src/later.ts");
        assertEquals(FileRecord.MISSING, cache.get(missing));
        assertEquals(1, cache.size());

        project.write("src/later.ts", "import {b} from './b';\n");
        assertEquals(FileRecord.MISSING, cache.get(missing));

        cache.invalidate(missing);
        assertEquals(List.of(project.path("src/b.ts")), cache.get(missing).imports());
    }

    @Test
    public void testInvalidateAll() {
        cache.get(project.path("src/a.ts"));
        cache.get(project.path("src/b.ts"));
        assertEquals(2, cache.size());
        cache.invalidateAll();
        assertEquals(0, cache.size());
        assertTrue(!cache.contains(project.path("src/a.ts")));
    }

    @Test
    public void testNonNormalizedKeysShareOneEntry() {
        var direct = cache.get(project.path("src/b.ts"));
        var roundabout = cache.get(project.getRoot().resolve("src/../src/./b.ts"));
        assertSame(direct, roundabout);
        assertEquals(1, cache.size());
    }
}
