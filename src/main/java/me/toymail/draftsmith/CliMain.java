package me.toymail.draftsmith;

import me.toymail.draftsmith.commands.RootCmd;
import me.toymail.draftsmith.logging.LoggingConfig;
import me.toymail.draftsmith.store.StoreContext;
import picocli.CommandLine;

public final class CliMain {
    public static void main(String[] args) {
        LoggingConfig.init();
        StoreContext context = StoreContext.initialize();
        CommandLine.IFactory factory = new StoreAwareFactory(context);
        int code = new CommandLine(new RootCmd(context), factory).execute(args);
        System.exit(code);
    }
}
