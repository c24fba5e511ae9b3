package com.playlistchecker.common.util;

import com.playlistchecker.test.TestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileUtilsTest extends TestBase {

    @TempDir
    Path tempDir;

    @Test
    void testEnsureDirectoryIsIdempotent() throws IOException {
        Path dir = tempDir.resolve("a").resolve("b");
        FileUtils.ensureDirectory(dir);
        FileUtils.ensureDirectory(dir);
        assertTrue(Files.isDirectory(dir));
    }

    @Test
    void testWriteAtomicallyReplacesAndLeavesNoTempFiles() throws IOException {
        Path target = tempDir.resolve("out.m3u");
        FileUtils.writeAtomically(target, "first");
        FileUtils.writeAtomically(target, "second");

        assertEquals("second", Files.readString(target, StandardCharsets.UTF_8));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(1, files.count(), "Only the target file should remain");
        }
    }
}
