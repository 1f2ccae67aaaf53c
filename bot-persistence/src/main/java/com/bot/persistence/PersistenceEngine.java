package com.bot.persistence;

import java.nio.file.Path;
import java.util.Map;

/**
 * Reads and writes a plugin's keyed data tree. The tree is a string-keyed map whose values
 * are strings, numbers, booleans, null, lists and nested maps; see {@link DataTree} for the
 * exact types and how they come back on load.
 */
public interface PersistenceEngine {

    /**
     * Reads the data file into a new mutable, insertion-ordered map.
     *
     * @throws MissingFileException   if the file does not exist
     * @throws LoadException          if the file cannot be read or is not a mapping
     * @throws UnknownFormatException if the engine does not handle {@code format}
     */
    Map<String, Object> load(Path file, SaveFormat format);

    /**
     * Writes the tree to the data file, replacing its contents. Values are normalized with
     * {@link DataTree#copyOf(Map)} first.
     *
     * @throws SaveException          if the file cannot be written or holds an unsupported value
     * @throws UnknownFormatException if the engine does not handle {@code format}
     */
    void save(Map<String, Object> data, Path file, SaveFormat format);
}
