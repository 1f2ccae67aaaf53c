package com.bot.plugin;

import com.bot.persistence.DataTree;
import com.bot.persistence.JacksonPersistenceEngine;
import com.bot.persistence.LoadException;
import com.bot.persistence.PersistenceEngine;
import com.bot.persistence.SaveException;
import com.bot.persistence.SaveFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PersistentDataTest {

    private final PersistenceEngine engine = new JacksonPersistenceEngine();

    @TempDir
    Path tempDir;

    private PersistentData bind(Path file, boolean debug) {
        return new PersistentData("Demo", file, SaveFormat.JSON, engine, debug, new ReentrantLock());
    }

    @Test
    void load_readsExistingFile() throws Exception {
        Path file = tempDir.resolve("demo.json");
        Files.writeString(file, "{\"count\": 3, \"names\": [\"a\", \"b\"]}");
        PersistentData data = bind(file, false);

        data.load();

        assertEquals(3, data.data().get("count"));
        assertEquals(List.of("a", "b"), data.data().get("names"));
    }

    @Test
    void saveThenLoad_restoresTree() {
        Path file = tempDir.resolve("demo.json");
        PersistentData first = bind(file, false);
        first.data().put("greeting", "hi");
        first.section("config").put("limit", 5);
        first.save();

        PersistentData second = bind(file, false);
        second.load();

        assertEquals("hi", second.data().get("greeting"));
        assertEquals(Map.of("limit", 5), second.data().get("config"));
    }

    @Test
    void load_resetsCorruptFileOutsideDebug() throws Exception {
        Path file = tempDir.resolve("demo.json");
        Files.writeString(file, "{ this is not json");
        PersistentData data = bind(file, false);

        data.load();

        assertTrue(data.data().isEmpty());
        assertTrue(engine.load(file, SaveFormat.JSON).isEmpty());
    }

    @Test
    void load_createsMissingFileOutsideDebug() {
        Path file = tempDir.resolve("demo.json");
        PersistentData data = bind(file, false);

        data.load();

        assertTrue(Files.exists(file));
        assertTrue(data.data().isEmpty());
    }

    @Test
    void load_leavesCorruptFileAloneInDebug() throws Exception {
        Path file = tempDir.resolve("demo.json");
        Files.writeString(file, "{ this is not json");
        PersistentData data = bind(file, true);
        data.data().put("kept", true);

        data.load();

        assertEquals("{ this is not json", Files.readString(file));
        assertEquals(Boolean.TRUE, data.data().get("kept"));
    }

    @Test
    void load_keepsTreeIdentity() throws Exception {
        Path file = tempDir.resolve("demo.json");
        Files.writeString(file, "{\"a\": 1}");
        PersistentData data = bind(file, false);
        Map<String, Object> tree = data.data();

        data.load();

        assertSame(tree, data.data());
        assertEquals(1, tree.get("a"));
    }

    @Test
    void save_failsWhenDirectoryIsMissing() {
        PersistentData data = bind(tempDir.resolve("missing/demo.json"), false);
        data.data().put("a", 1);

        assertThrows(SaveException.class, data::save);
    }

    @Test
    void section_rejectsNonMapEntry() {
        PersistentData data = bind(tempDir.resolve("demo.json"), false);
        data.data().put("config", "flat");

        assertThrows(IllegalStateException.class, () -> data.section("config"));
        assertFalse(data.data().get("config") instanceof Map);
    }

    @Test
    void render_listsEntries() {
        PersistentData data = bind(tempDir.resolve("demo.json"), false);
        data.data().put("a", 1);

        assertEquals(List.of("└── a: 1"), data.render());
    }

    @Test
    void saveThenLoad_reloadsNormalizedTree() {
        Path file = tempDir.resolve("demo.json");
        PersistentData first = bind(file, false);
        first.data().put("count", 5L);
        first.data().put("ratio", 0.5f);
        first.section("config").put("limit", (short) 3);
        first.save();

        PersistentData second = bind(file, false);
        second.load();

        assertEquals(DataTree.copyOf(first.data()), second.data());
        assertEquals(5, second.data().get("count"));
        assertEquals(0.5, second.data().get("ratio"));
    }

    @Test
    void load_failsWhenResetCannotSave() {
        Path file = tempDir.resolve("demo.json");
        PersistenceEngine broken = new PersistenceEngine() {
            @Override
            public Map<String, Object> load(Path path, SaveFormat format) {
                throw new LoadException(path, "unreadable");
            }

            @Override
            public void save(Map<String, Object> tree, Path path, SaveFormat format) {
                throw new SaveException(path, "read-only");
            }
        };
        PersistentData data = new PersistentData("Demo", file, SaveFormat.JSON, broken, false, new ReentrantLock());

        SaveException e = assertThrows(SaveException.class, data::load);

        assertEquals("read-only", e.getMessage());
    }
}
