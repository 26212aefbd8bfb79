package me.toymail.draftsmith.store;

import me.toymail.draftsmith.ConfigException;
import me.toymail.draftsmith.PasswordResolver;
import me.toymail.draftsmith.config.AssistantConfig;
import me.toymail.draftsmith.config.ConfigLoader;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Lazily built state shared by the CLI commands: configuration,
 * state documents, and credentials.
 */
public final class StoreContext {
    public static final String DEFAULT_CONFIG = "config.yaml";

    private final CredentialStore credentialStore;
    private final PasswordResolver passwordResolver;
    private Path configPath;
    private AssistantConfig config;
    private DocumentStore documents;
    private ContextStore contextStore;

    StoreContext(Path configPath, CredentialStore credentialStore) {
        this.configPath = configPath;
        this.credentialStore = credentialStore;
        this.passwordResolver = new PasswordResolver(credentialStore);
    }

    public static StoreContext initialize() {
        return new StoreContext(Paths.get(DEFAULT_CONFIG), new CredentialStore());
    }

    public static StoreContext initialize(Path configPath, CredentialStore credentialStore) {
        return new StoreContext(configPath, credentialStore);
    }

    /**
     * Point at another config file; drops anything loaded from the previous one.
     */
    public synchronized void useConfig(Path path) {
        if (path == null || path.equals(configPath)) return;
        this.configPath = path;
        this.config = null;
        this.documents = null;
        this.contextStore = null;
    }

    public synchronized Path configPath() {
        return configPath;
    }

    public synchronized AssistantConfig config() throws ConfigException {
        if (config == null) {
            config = ConfigLoader.load(configPath);
        }
        return config;
    }

    public synchronized DocumentStore documents() throws ConfigException {
        if (documents == null) {
            documents = new DocumentStore(Paths.get(config().stateDir));
        }
        return documents;
    }

    /**
     * The loaded context store; the first call reads (or creates) the state documents.
     */
    public synchronized ContextStore contextStore() throws ConfigException, StorageException {
        if (contextStore == null) {
            ContextStore store = new ContextStore(documents(), config().systemPrompt);
            store.load();
            contextStore = store;
        }
        return contextStore;
    }

    public CredentialStore credentials() {
        return credentialStore;
    }

    public PasswordResolver passwordResolver() {
        return passwordResolver;
    }
}
