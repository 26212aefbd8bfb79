package me.toymail.draftsmith;

import me.toymail.draftsmith.store.StoreContext;
import picocli.CommandLine;

import java.lang.reflect.Constructor;

/**
 * Hands the shared {@link StoreContext} to every command that asks for it.
 */
public final class StoreAwareFactory implements CommandLine.IFactory {
    private final StoreContext context;
    private final CommandLine.IFactory defaultFactory = CommandLine.defaultFactory();

    public StoreAwareFactory(StoreContext context) {
        this.context = context;
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        try {
            Constructor<K> constructor = cls.getDeclaredConstructor(StoreContext.class);
            return constructor.newInstance(context);
        } catch (NoSuchMethodException e) {
            // nested subcommands and converters take no context
            return defaultFactory.create(cls);
        }
    }
}
