package com.bot.plugin;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Filesystem locations of one plugin, resolved once at construction by {@link PathResolver}.
 * The working directory is {@code {persistentRoot}/{pluginDirName}/} and the data file is
 * {@code {workDir}/{pluginDirName}.{ext}}.
 */
public final class PluginPaths {

    private final Path sourceDirectory;
    private final Path sourceFile;
    private final Path workDirectory;
    private final Path dataFile;
    private final boolean firstLoad;

    PluginPaths(Path sourceDirectory, Path sourceFile, Path workDirectory, Path dataFile, boolean firstLoad) {
        this.sourceDirectory = Objects.requireNonNull(sourceDirectory, "sourceDirectory");
        this.sourceFile = sourceFile;
        this.workDirectory = Objects.requireNonNull(workDirectory, "workDirectory");
        this.dataFile = Objects.requireNonNull(dataFile, "dataFile");
        this.firstLoad = firstLoad;
    }

    /** Directory the plugin was loaded from; its file name is the plugin directory name. */
    public Path getSourceDirectory() {
        return sourceDirectory;
    }

    /** Jar or class file the plugin class came from; null when the class has no code source. */
    public Path getSourceFile() {
        return sourceFile;
    }

    public String getPluginDirName() {
        return sourceDirectory.getFileName().toString();
    }

    public Path getWorkDirectory() {
        return workDirectory;
    }

    public Path getDataFile() {
        return dataFile;
    }

    /** True when the working directory or the data file did not exist before construction. */
    public boolean isFirstLoad() {
        return firstLoad;
    }

    @Override
    public String toString() {
        return "PluginPaths{workDirectory=" + workDirectory + ", dataFile=" + dataFile
                + ", firstLoad=" + firstLoad + "}";
    }
}
