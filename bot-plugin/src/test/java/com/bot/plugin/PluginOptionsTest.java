package com.bot.plugin;

import com.bot.config.BotConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginOptionsTest {

    @Test
    void fromMap_acceptsKnownKeys() {
        PluginOptions options = PluginOptions.fromMap(Map.of(
                "persistentRoot", "/tmp/bot",
                "sourceDirectory", Path.of("plugins", "demo"),
                "debug", "true",
                "metaData", Map.of("owner", "ops")));

        assertEquals(Path.of("/tmp/bot"), options.getPersistentRoot());
        assertEquals(Path.of("plugins", "demo"), options.getSourceDirectory());
        assertTrue(options.isDebug());
        assertEquals("ops", options.getMetaData().get("owner"));
    }

    @Test
    void fromMap_rejectsUnknownKeys() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PluginOptions.fromMap(Map.of("debug", true, "colour", "blue")));
        assertTrue(e.getMessage().contains("colour"));
    }

    @Test
    void fromMap_rejectsWrongTypes() {
        assertThrows(IllegalArgumentException.class, () -> PluginOptions.fromMap(Map.of("debug", 1)));
        assertThrows(IllegalArgumentException.class, () -> PluginOptions.fromMap(Map.of("metaData", "x")));
        assertThrows(IllegalArgumentException.class, () -> PluginOptions.fromMap(Map.of("persistentRoot", " ")));
    }

    @Test
    void builder_defaults() {
        PluginOptions options = PluginOptions.builder().build();

        assertEquals(Path.of("data"), options.getPersistentRoot());
        assertNull(options.getSourceDirectory());
        assertFalse(options.isDebug());
        assertTrue(options.getMetaData().isEmpty());
    }

    @Test
    void defaults_takesRootAndDebugFromConfig() {
        BotConfig config = BotConfig.builder().persistentDir("state").debug(true).build();

        PluginOptions options = PluginOptions.defaults(config);

        assertEquals(Path.of("state"), options.getPersistentRoot());
        assertTrue(options.isDebug());
    }
}
