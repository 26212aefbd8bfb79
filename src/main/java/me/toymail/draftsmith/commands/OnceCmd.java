package me.toymail.draftsmith.commands;

import jakarta.mail.MessagingException;
import me.toymail.draftsmith.AssistantException;
import me.toymail.draftsmith.service.AssistantService;
import me.toymail.draftsmith.service.CycleReport;
import me.toymail.draftsmith.service.MailConnectionLostException;
import me.toymail.draftsmith.store.StorageException;
import me.toymail.draftsmith.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

@Command(name = "once", description = "Run a single polling cycle and exit")
public final class OnceCmd extends ConfiguredCommand {
    private static final Logger log = LoggerFactory.getLogger(OnceCmd.class);

    public OnceCmd(StoreContext context) {
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

        try {
            CycleReport report = service.loop().runCycle();
            service.health().cycleCompleted(report);
            log.info("Candidates: {}", report.candidates());
            log.info("Drafts saved: {}", report.published());
            log.info("Already answered: {}", report.alreadyRecorded());
            log.info("Failed: {}", report.failed());
            return 0;
        } catch (MessagingException | MailConnectionLostException e) {
            log.error("Cycle failed: {}", e.getMessage(), e);
            service.health().cycleFailed(e);
            return 1;
        } finally {
            service.shutdownHandler().run();
        }
    }
}
