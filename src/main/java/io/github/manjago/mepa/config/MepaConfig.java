package io.github.manjago.mepa.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;

/**
 * Configuration for the MEPA interpreter.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record MepaConfig(
    // Shell
    String prompt,
    int pageSize,             // lines per LIST page

    // Execution
    long maxSteps,            // 0 = unlimited
    long maxMemory,           // memory cells AMEM may reach

    // Debug
    boolean showStack         // dump stack after every debug step
) {

    /**
     * Load default configuration.
     */
    public static MepaConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static MepaConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static MepaConfig fromConfig(Config config) {
        Config c = config.getConfig("mepa");

        return new MepaConfig(
            c.getString("shell.prompt"),
            c.getInt("shell.page-size"),
            c.getLong("run.max-steps"),
            c.getLong("run.max-memory"),
            c.getBoolean("debug.show-stack")
        );
    }

    public MepaConfig {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("shell.page-size must be positive: " + pageSize);
        }
        if (maxSteps < 0) {
            throw new IllegalArgumentException("run.max-steps must not be negative: " + maxSteps);
        }
        if (maxMemory < 0 || maxMemory > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("run.max-memory out of range: " + maxMemory);
        }
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String prompt = "> ";
        private int pageSize = 20;
        private long maxSteps = 0;
        private long maxMemory = 1_048_576;
        private boolean showStack = false;

        public Builder prompt(String prompt) { this.prompt = prompt; return this; }
        public Builder pageSize(int size) { this.pageSize = size; return this; }
        public Builder maxSteps(long max) { this.maxSteps = max; return this; }
        public Builder maxMemory(long cells) { this.maxMemory = cells; return this; }
        public Builder showStack(boolean show) { this.showStack = show; return this; }

        public MepaConfig build() {
            return new MepaConfig(prompt, pageSize, maxSteps, maxMemory, showStack);
        }
    }

    @Override
    public String toString() {
        return String.format("""
            MepaConfig:
              shell.prompt:       "%s"
              shell.page-size:    %d lines
              run.max-steps:      %s
              run.max-memory:     %,d cells
              debug.show-stack:   %s
            """,
            prompt,
            pageSize,
            maxSteps == 0 ? "unlimited" : String.format("%,d", maxSteps),
            maxMemory,
            showStack
        );
    }
}
