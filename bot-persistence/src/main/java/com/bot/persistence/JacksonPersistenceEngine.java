package com.bot.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link PersistenceEngine} backed by Jackson: JSON through {@code jackson-databind}, YAML through
 * {@code jackson-dataformat-yaml}. Saves go to a sibling temp file that is then moved over the
 * data file, so a failed write leaves the previous contents in place.
 */
public final class JacksonPersistenceEngine implements PersistenceEngine {

    private static final Logger log = LoggerFactory.getLogger(JacksonPersistenceEngine.class);

    private static final TypeReference<LinkedHashMap<String, Object>> TREE_TYPE = new TypeReference<>() {};
    private static final String TEMP_SUFFIX = ".tmp";

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public JacksonPersistenceEngine() {
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    @Override
    public Map<String, Object> load(Path file, SaveFormat format) {
        ObjectMapper mapper = mapperFor(file, format);
        if (!Files.exists(file)) {
            throw new MissingFileException(file, "Data file does not exist: " + file);
        }
        if (!Files.isRegularFile(file)) {
            throw new LoadException(file, "Data file is not a regular file: " + file);
        }
        LinkedHashMap<String, Object> tree;
        try {
            tree = mapper.readValue(file.toFile(), TREE_TYPE);
        } catch (IOException e) {
            throw new LoadException(file, "Failed to read " + format + " data from " + file + ": " + e.getMessage(), e);
        }
        if (tree == null) {
            throw new LoadException(file, "Data file holds no mapping: " + file);
        }
        log.debug("Loaded {} top-level key(s) from {}", tree.size(), file);
        return tree;
    }

    @Override
    public void save(Map<String, Object> data, Path file, SaveFormat format) {
        ObjectMapper mapper = mapperFor(file, format);
        Map<String, Object> tree;
        try {
            tree = DataTree.copyOf(data);
        } catch (IllegalArgumentException e) {
            throw new SaveException(file, "Cannot save data to " + file + ": " + e.getMessage(), e);
        }
        Path temp = file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
        try {
            mapper.writeValue(temp.toFile(), tree);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new SaveException(file, "Failed to write " + format + " data to " + file + ": " + e.getMessage(), e);
        }
        log.debug("Saved data to {}", file);
    }

    private ObjectMapper mapperFor(Path file, SaveFormat format) {
        if (format == null) {
            throw new UnknownFormatException(file, "No save format given for " + file);
        }
        switch (format) {
            case JSON:
                return jsonMapper;
            case YAML:
                return yamlMapper;
            default:
                throw new UnknownFormatException(file, "Unsupported save format " + format + " for " + file);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
