package com.bot.persistence;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SaveFormatTest {

    @Test
    void of_resolvesNamesCaseInsensitively() {
        assertEquals(SaveFormat.JSON, SaveFormat.of("json"));
        assertEquals(SaveFormat.JSON, SaveFormat.of(" JSON "));
        assertEquals(SaveFormat.YAML, SaveFormat.of("yaml"));
        assertEquals(SaveFormat.YAML, SaveFormat.of("yml"));
    }

    @Test
    void of_unknownOrBlank_throwsUnknownFormat() {
        assertThrows(UnknownFormatException.class, () -> SaveFormat.of("pickle"));
        assertThrows(UnknownFormatException.class, () -> SaveFormat.of(""));
        assertThrows(UnknownFormatException.class, () -> SaveFormat.of(null));
    }

    @Test
    void extension_matchesName() {
        assertEquals("json", SaveFormat.JSON.getExtension());
        assertEquals("yaml", SaveFormat.YAML.getExtension());
    }
}
