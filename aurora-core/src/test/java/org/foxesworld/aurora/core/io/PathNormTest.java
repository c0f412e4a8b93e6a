package org.foxesworld.aurora.core.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PathNormTest {

    @TempDir
    Path tmp;

    @Test
    void normalizesSlashes() {
        assertEquals("data/models.bif", PathNorm.normalize("data\\models.bif"));
        assertEquals("a/b", PathNorm.normalize("./a//b/"));
        assertEquals("a/b/c", PathNorm.join("a/", "/b\\c"));
        assertEquals("", PathNorm.normalize(null));
    }

    @Test
    void resolvesIgnoringCase() throws Exception {
        Path data = Files.createDirectories(tmp.resolve("Data"));
        Path bif = Files.createFile(data.resolve("models.bif"));

        assertEquals(bif, PathNorm.resolveCaseAware(tmp, "data\\Models.BIF"));
        assertTrue(PathNorm.exists(tmp, "DATA/MODELS.bif"));
        assertTrue(PathNorm.isDirectory(tmp, "data"));
        assertTrue(PathNorm.isFile(tmp, "data/models.bif"));
    }

    @Test
    void missingPathFallsBackToPlainResolution() {
        Path p = PathNorm.resolveCaseAware(tmp, "nope/file.txt");
        assertEquals(tmp.resolve("nope/file.txt"), p);
        assertFalse(PathNorm.exists(tmp, "nope/file.txt"));
    }

    @Test
    void relativizeUsesDotForRoot() throws Exception {
        Path sub = Files.createDirectories(tmp.resolve("patch1").resolve("deep"));
        assertEquals(".", PathNorm.relativize(tmp, tmp));
        assertEquals("patch1/deep", PathNorm.relativize(tmp, sub));
    }
}
