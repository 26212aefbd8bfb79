package me.toymail.draftsmith.commands;

import me.toymail.draftsmith.ConfigException;
import me.toymail.draftsmith.store.StorageException;
import me.toymail.draftsmith.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "instruct", description = "Add a standing instruction to the training context",
        footer = {
                "",
                "Example:",
                "  draftsmith instruct \"Always sign off with 'Best, Sam'\""
        })
public final class InstructCmd extends ConfiguredCommand {
    private static final Logger log = LoggerFactory.getLogger(InstructCmd.class);

    @Parameters(arity = "1..*", paramLabel = "TEXT", description = "Instruction text")
    String[] words;

    public InstructCmd(StoreContext context) {
        super(context);
    }

    @Override
    public Integer call() {
        applyConfig();
        String instruction = String.join(" ", words).trim();
        if (instruction.isEmpty()) {
            log.error("Instruction text is empty");
            return 2;
        }
        try {
            context.contextStore().addInstruction(instruction);
            log.info("Instruction saved to {}", context.documents().baseDir());
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration error: {}", e.getMessage());
            return 1;
        } catch (StorageException e) {
            log.error("Failed to save instruction: {}", e.getMessage());
            return 1;
        }
    }
}
