package io.github.manjago.mepa.cli;

import io.github.manjago.mepa.config.MepaConfig;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by every command that loads configuration.
 */
public class ConfigOptions {

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    Path configFile;

    MepaConfig load() {
        return configFile != null ? MepaConfig.fromFile(configFile) : MepaConfig.defaults();
    }
}
