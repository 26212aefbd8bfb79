package me.toymail.draftsmith.commands;

import me.toymail.draftsmith.store.StoreContext;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Base for commands that read config.yaml and the state next to it.
 */
abstract class ConfiguredCommand implements Callable<Integer> {
    protected final StoreContext context;

    @Option(names = {"-c", "--config"}, paramLabel = "FILE",
            description = "Path to the YAML configuration (default: ./config.yaml)")
    Path configPath;

    protected ConfiguredCommand(StoreContext context) {
        this.context = context;
    }

    protected void applyConfig() {
        if (configPath != null) {
            context.useConfig(configPath);
        }
    }
}
