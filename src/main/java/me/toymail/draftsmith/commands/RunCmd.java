package me.toymail.draftsmith.commands;

import me.toymail.draftsmith.AssistantException;
import me.toymail.draftsmith.service.AssistantService;
import me.toymail.draftsmith.service.ShutdownHandler;
import me.toymail.draftsmith.store.StorageException;
import me.toymail.draftsmith.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

@Command(name = "run", description = "Watch the inbox and stage a draft reply for every new email",
        footer = {
                "",
                "Example:",
                "  draftsmith run --config ~/mail/config.yaml",
                "",
                "Runs until interrupted. Startup problems (bad config, failed login) exit with status 1."
        })
public final class RunCmd extends ConfiguredCommand {
    private static final Logger log = LoggerFactory.getLogger(RunCmd.class);

    public RunCmd(StoreContext context) {
        super(context);
    }

    @Override
    public Integer call() {
        applyConfig();
        AssistantService service = new AssistantService(context);
        try {
            service.start(System.console());
        } catch (AssistantException e) {
            log.error("Startup failed: {}", e.getMessage());
            return 1;
        } catch (StorageException e) {
            log.error("Failed to load assistant state: {}", e.getMessage());
            return 1;
        }

        ShutdownHandler shutdown = service.shutdownHandler();
        shutdown.registerShutdownHook();
        try {
            service.loop().run();
        } finally {
            shutdown.run();
        }
        return 0;
    }
}
