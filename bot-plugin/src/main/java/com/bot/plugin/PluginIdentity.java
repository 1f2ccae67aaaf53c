package com.bot.plugin;

import com.bot.annotations.BotPlugin;
import com.bot.annotations.Dependency;
import com.bot.persistence.PersistenceException;
import com.bot.persistence.SaveFormat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable identity of a plugin: name, version, author, description, dependencies and the
 * format its data is persisted in. Normally read from the {@link BotPlugin} annotation via
 * {@link #of(Class)}; {@link #builder()} is used where no annotated class is at hand.
 */
public final class PluginIdentity {

    static final String DEFAULT_AUTHOR = "Unknown";
    static final String DEFAULT_DESCRIPTION = "This plugin has no description";

    private final String name;
    private final String version;
    private final String author;
    private final String description;
    private final Map<String, String> dependencies;
    private final SaveFormat saveFormat;

    private PluginIdentity(Builder b) {
        this.name = b.name;
        this.version = b.version;
        this.author = b.author;
        this.description = b.description;
        this.dependencies = Collections.unmodifiableMap(new LinkedHashMap<>(b.dependencies));
        this.saveFormat = b.saveFormat;
    }

    /**
     * Reads the identity declared by {@code @BotPlugin} on the given class.
     *
     * @throws IdentityException if the annotation is missing, name or version is blank,
     *                           a dependency is declared twice, or the save format is unknown
     */
    public static PluginIdentity of(Class<?> pluginClass) {
        Objects.requireNonNull(pluginClass, "pluginClass");
        BotPlugin annotation = pluginClass.getAnnotation(BotPlugin.class);
        if (annotation == null) {
            throw new IdentityException(pluginClass.getName(),
                    "Plugin class " + pluginClass.getName() + " is not annotated with @BotPlugin");
        }
        Builder b = builder()
                .name(annotation.name())
                .version(annotation.version())
                .author(annotation.author())
                .description(annotation.description())
                .saveFormat(annotation.saveFormat());
        for (Dependency dependency : annotation.dependencies()) {
            b.dependency(dependency.name(), dependency.version());
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getAuthor() {
        return author;
    }

    public String getDescription() {
        return description;
    }

    /** Plugin name → version constraint; empty when the plugin has no dependencies. */
    public Map<String, String> getDependencies() {
        return dependencies;
    }

    public SaveFormat getSaveFormat() {
        return saveFormat;
    }

    @Override
    public String toString() {
        return name + " v" + version + " by " + author;
    }

    public static final class Builder {
        private String name;
        private String version;
        private String author = DEFAULT_AUTHOR;
        private String description = DEFAULT_DESCRIPTION;
        private final Map<String, String> dependencies = new LinkedHashMap<>();
        private SaveFormat saveFormat = SaveFormat.JSON;
        private String saveFormatName;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        /** Blank falls back to {@code "Unknown"}. */
        public Builder author(String author) {
            this.author = isBlank(author) ? DEFAULT_AUTHOR : author;
            return this;
        }

        /** Blank falls back to the placeholder description. */
        public Builder description(String description) {
            this.description = isBlank(description) ? DEFAULT_DESCRIPTION : description;
            return this;
        }

        /** Adds a dependency; a blank constraint means any version. */
        public Builder dependency(String pluginName, String versionConstraint) {
            if (isBlank(pluginName)) {
                throw new IdentityException(name, "Dependency name must not be blank");
            }
            String constraint = isBlank(versionConstraint) ? "*" : versionConstraint.trim();
            if (dependencies.putIfAbsent(pluginName, constraint) != null) {
                throw new IdentityException(name, "Dependency " + pluginName + " declared more than once");
            }
            return this;
        }

        public Builder saveFormat(SaveFormat saveFormat) {
            this.saveFormat = Objects.requireNonNull(saveFormat, "saveFormat");
            this.saveFormatName = null;
            return this;
        }

        /** Format by name ({@code json}, {@code yaml}); resolved in {@link #build()}. */
        public Builder saveFormat(String saveFormatName) {
            this.saveFormatName = saveFormatName;
            return this;
        }

        public PluginIdentity build() {
            if (isBlank(name)) {
                throw new IdentityException(name, "Plugin name must not be blank");
            }
            if (isBlank(version)) {
                throw new IdentityException(name, "Plugin " + name + " must declare a version");
            }
            if (saveFormatName != null) {
                try {
                    saveFormat = SaveFormat.of(saveFormatName);
                } catch (PersistenceException e) {
                    throw new IdentityException(name,
                            "Plugin " + name + " declares unknown save format '" + saveFormatName + "'", e);
                }
            }
            return new PluginIdentity(this);
        }

        private static boolean isBlank(String s) {
            return s == null || s.isBlank();
        }
    }
}
