package me.toymail.draftsmith.commands;

import me.toymail.draftsmith.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

@Command(
        name = "draftsmith",
        mixinStandardHelpOptions = true,
        description = "Drafts replies to incoming email with an LLM and leaves them in your Drafts folder",
        footer = {
                "",
                "Quick Start:",
                "  draftsmith credential set --email you@example.com   Save the mailbox password",
                "  draftsmith run                                        Start drafting replies",
                "",
                "Common Commands:",
                "  run         Poll the inbox until stopped",
                "  once        Run a single polling cycle",
                "  instruct    Add a standing instruction",
                "  example     Save a finished reply as a style example",
                "  history     Show the conversation with a sender",
                "  status      Show the last health record",
                "  credential  Manage the keychain password",
                "",
                "Use 'draftsmith <command> --help' for more information on a command."
        },
        subcommands = {
                RunCmd.class,
                OnceCmd.class,
                InstructCmd.class,
                ExampleCmd.class,
                HistoryCmd.class,
                StatusCmd.class,
                CredentialCmd.class
        }
)
public final class RootCmd implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(RootCmd.class);
    private final StoreContext context;

    public RootCmd(StoreContext context) {
        this.context = context;
    }

    @Override public void run() {
        log.info("Use --help. Example: draftsmith run --config {}", context.configPath());
    }
}
