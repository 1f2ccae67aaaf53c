package com.bot.plugin;

import com.bot.persistence.SaveFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void resolve_createsWorkDirAndReportsFirstLoad() {
        Path root = tempDir.resolve("data");
        PathResolver resolver = new PathResolver(root);

        PluginPaths paths = resolver.resolve("Demo", PathResolverTest.class, tempDir.resolve("plugins/demo"), SaveFormat.JSON);

        assertEquals(root.toAbsolutePath().normalize().resolve("demo"), paths.getWorkDirectory());
        assertEquals(paths.getWorkDirectory().resolve("demo.json"), paths.getDataFile());
        assertEquals("demo", paths.getPluginDirName());
        assertTrue(Files.isDirectory(paths.getWorkDirectory()));
        assertTrue(paths.isFirstLoad());
    }

    @Test
    void resolve_firstLoadWhenDirExistsButDataFileMissing() throws Exception {
        Path root = tempDir.resolve("data");
        Files.createDirectories(root.resolve("demo"));

        PluginPaths paths = new PathResolver(root).resolve("Demo", PathResolverTest.class,
                tempDir.resolve("demo"), SaveFormat.YAML);

        assertTrue(paths.isFirstLoad());
        assertEquals("demo.yaml", paths.getDataFile().getFileName().toString());
    }

    @Test
    void resolve_notFirstLoadWhenDataFileExists() throws Exception {
        Path root = tempDir.resolve("data");
        Files.createDirectories(root.resolve("demo"));
        Files.writeString(root.resolve("demo/demo.json"), "{}");

        PluginPaths paths = new PathResolver(root).resolve("Demo", PathResolverTest.class,
                tempDir.resolve("demo"), SaveFormat.JSON);

        assertFalse(paths.isFirstLoad());
    }

    @Test
    void resolve_failsWhenWorkDirIsAFile() throws Exception {
        Path root = Files.createDirectories(tempDir.resolve("data"));
        Files.writeString(root.resolve("demo"), "not a directory");

        WorkspaceException e = assertThrows(WorkspaceException.class, () -> new PathResolver(root)
                .resolve("Demo", PathResolverTest.class, tempDir.resolve("demo"), SaveFormat.JSON));
        assertEquals("Demo", e.getPluginName());
    }

    @Test
    void resolve_derivesSourceDirectoryFromCodeSource() {
        PluginPaths paths = new PathResolver(tempDir).resolve("Demo", PathResolverTest.class, null, SaveFormat.JSON);

        assertNotNull(paths.getSourceFile());
        assertEquals(paths.getSourceDirectory().getFileName().toString(), paths.getPluginDirName());
        assertTrue(Files.isDirectory(tempDir.resolve(paths.getPluginDirName())));
    }
}
