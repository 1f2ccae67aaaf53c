package com.bot.plugin;

import com.bot.persistence.SaveFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.Objects;

/**
 * Resolves a plugin's source, working directory and data file under a persistent root, and
 * creates the working directory when absent. The first-load flag is computed before anything
 * is created.
 */
public final class PathResolver {

    private static final Logger log = LoggerFactory.getLogger(PathResolver.class);

    private final Path persistentRoot;

    public PathResolver(Path persistentRoot) {
        this.persistentRoot = Objects.requireNonNull(persistentRoot, "persistentRoot").toAbsolutePath().normalize();
    }

    public Path getPersistentRoot() {
        return persistentRoot;
    }

    /**
     * Resolves paths for one plugin.
     *
     * @param pluginName      used in error messages
     * @param pluginClass     class whose code source gives the source directory
     * @param sourceDirectory explicit source directory; null to derive it from the class
     * @param format          decides the data file extension
     * @throws WorkspaceException if the working directory exists but is not a directory, cannot
     *                            be created, or the source directory cannot be determined
     */
    public PluginPaths resolve(String pluginName, Class<?> pluginClass, Path sourceDirectory, SaveFormat format) {
        Objects.requireNonNull(pluginClass, "pluginClass");
        Objects.requireNonNull(format, "format");
        Path sourceFile = codeSourceFile(pluginClass);
        Path sourceDir;
        if (sourceDirectory != null) {
            sourceDir = sourceDirectory.toAbsolutePath().normalize();
        } else if (sourceFile != null) {
            sourceDir = Files.isDirectory(sourceFile) ? sourceFile : sourceFile.getParent();
        } else {
            throw new WorkspaceException(pluginName,
                    "Cannot determine the source directory of " + pluginClass.getName() + "; set sourceDirectory");
        }
        if (sourceDir == null || sourceDir.getFileName() == null) {
            throw new WorkspaceException(pluginName, "Source directory of " + pluginName + " has no name: " + sourceDir);
        }
        if (sourceFile != null && Files.isDirectory(sourceFile)) {
            sourceFile = sourceFile.resolve(pluginClass.getName().replace('.', '/') + ".class");
        }

        String dirName = sourceDir.getFileName().toString();
        Path workDir = persistentRoot.resolve(dirName);
        Path dataFile = workDir.resolve(dirName + "." + format.getExtension());

        boolean firstLoad = false;
        if (!Files.exists(workDir)) {
            try {
                Files.createDirectories(workDir);
            } catch (IOException e) {
                throw new WorkspaceException(pluginName, "Cannot create working directory " + workDir, e);
            }
            firstLoad = true;
        } else if (!Files.exists(dataFile)) {
            firstLoad = true;
        }
        if (!Files.isDirectory(workDir)) {
            throw new WorkspaceException(pluginName, "Working directory " + workDir + " exists but is not a directory");
        }
        log.debug("Resolved paths for {}: source={} work={} data={} firstLoad={}",
                pluginName, sourceDir, workDir, dataFile, firstLoad);
        return new PluginPaths(sourceDir, sourceFile, workDir, dataFile, firstLoad);
    }

    /** Jar file or classes directory of the class; null when unavailable. */
    static Path codeSourceFile(Class<?> pluginClass) {
        CodeSource codeSource = pluginClass.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return null;
        }
        URL location = codeSource.getLocation();
        if (location == null || !"file".equals(location.getProtocol())) {
            return null;
        }
        try {
            return Paths.get(location.toURI()).toAbsolutePath().normalize();
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.warn("Unusable code source {} for {}: {}", location, pluginClass.getName(), e.getMessage());
            return null;
        }
    }
}
