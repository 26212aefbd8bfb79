package me.toymail.draftsmith.commands;

import me.toymail.draftsmith.ConfigException;
import me.toymail.draftsmith.store.StorageException;
import me.toymail.draftsmith.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Command(name = "example", description = "Store a finished reply as a style example for future drafts",
        footer = {
                "",
                "Example:",
                "  draftsmith example --sender bob@example.com --subject \"Invoice\" \\",
                "      --original-file invoice.txt --response-file reply.txt",
                "",
                "Each text can be given inline or read from a file, but not both."
        })
public final class ExampleCmd extends ConfiguredCommand {
    private static final Logger log = LoggerFactory.getLogger(ExampleCmd.class);

    @Spec
    CommandSpec spec;

    @Option(names = "--sender", required = true, description = "Address the original email came from")
    String sender;

    @Option(names = "--subject", required = true, description = "Subject of the original email")
    String subject;

    @Option(names = "--original", description = "Body of the original email")
    String original;

    @Option(names = "--original-file", paramLabel = "FILE", description = "Read the original body from a file")
    Path originalFile;

    @Option(names = "--response", description = "The reply that was actually sent")
    String response;

    @Option(names = "--response-file", paramLabel = "FILE", description = "Read the reply from a file")
    Path responseFile;

    public ExampleCmd(StoreContext context) {
        super(context);
    }

    @Override
    public Integer call() {
        applyConfig();
        String originalText;
        String responseText;
        try {
            originalText = pick("--original", original, "--original-file", originalFile);
            responseText = pick("--response", response, "--response-file", responseFile);
        } catch (IOException e) {
            log.error("Failed to read example text: {}", e.getMessage());
            return 1;
        }

        try {
            context.contextStore().addExampleResponse(sender, subject, originalText, responseText);
            log.info("Example reply to {} ({}) saved", sender, subject);
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration error: {}", e.getMessage());
            return 1;
        } catch (StorageException e) {
            log.error("Failed to save example: {}", e.getMessage());
            return 1;
        }
    }

    private String pick(String inlineName, String inline, String fileName, Path file) throws IOException {
        if (inline != null && file != null) {
            throw new ParameterException(spec.commandLine(),
                    "Use either " + inlineName + " or " + fileName + ", not both");
        }
        if (file != null) {
            return Files.readString(file, StandardCharsets.UTF_8);
        }
        if (inline == null) {
            throw new ParameterException(spec.commandLine(),
                    "Missing " + inlineName + " or " + fileName);
        }
        return inline;
    }
}
