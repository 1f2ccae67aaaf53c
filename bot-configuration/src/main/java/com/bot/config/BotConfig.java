package com.bot.config;

import java.util.Objects;

/**
 * Host configuration for the plugin kernel, loaded from environment variables.
 * <p>
 * Persistent data: BOT_PERSISTENT_DIR (root under which each plugin gets its working directory).
 * Debug mode: BOT_DEBUG (disables saving on unload and corruption recovery on load).
 * Hook threads: BOT_HOOK_THREADS (size of the pool that runs synchronous plugin hooks; 0 = unbounded).
 */
public final class BotConfig {

    private static final String ENV_PERSISTENT_DIR = "BOT_PERSISTENT_DIR";
    private static final String ENV_DEBUG = "BOT_DEBUG";
    private static final String ENV_HOOK_THREADS = "BOT_HOOK_THREADS";

    private static final String DEFAULT_PERSISTENT_DIR = "data";
    private static final boolean DEFAULT_DEBUG = false;
    private static final int DEFAULT_HOOK_THREADS = 0;

    private final String persistentDir;
    private final boolean debug;
    private final int hookThreads;

    private BotConfig(Builder b) {
        this.persistentDir = b.persistentDir;
        this.debug = b.debug;
        this.hookThreads = Math.max(0, b.hookThreads);
    }

    /** Root directory for plugin working directories. Default {@code data}. */
    public String getPersistentDir() {
        return persistentDir;
    }

    /** Whether plugins are constructed in debug mode. Default false. */
    public boolean isDebug() {
        return debug;
    }

    /** Fixed size of the hook thread pool; 0 means a cached (unbounded) pool. */
    public int getHookThreads() {
        return hookThreads;
    }

    public static BotConfig fromEnvironment() {
        return builder()
                .persistentDir(getEnv(ENV_PERSISTENT_DIR, DEFAULT_PERSISTENT_DIR))
                .debug(parseBoolean(System.getenv(ENV_DEBUG), DEFAULT_DEBUG))
                .hookThreads(parseInt(System.getenv(ENV_HOOK_THREADS), DEFAULT_HOOK_THREADS))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "BotConfig{persistentDir=" + persistentDir + ", debug=" + debug + ", hookThreads=" + hookThreads + "}";
    }

    public static final class Builder {
        private String persistentDir = DEFAULT_PERSISTENT_DIR;
        private boolean debug = DEFAULT_DEBUG;
        private int hookThreads = DEFAULT_HOOK_THREADS;

        public Builder persistentDir(String persistentDir) {
            this.persistentDir = Objects.requireNonNull(persistentDir, "persistentDir");
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder hookThreads(int hookThreads) {
            this.hookThreads = hookThreads;
            return this;
        }

        public BotConfig build() {
            return new BotConfig(this);
        }
    }
}
