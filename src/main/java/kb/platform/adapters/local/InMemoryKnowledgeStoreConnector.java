package kb.platform.adapters.local;

import java.util.Objects;
import kb.core.errors.AuthenticationException;
import kb.core.store.KnowledgeStoreConnector;
import kb.core.store.RemoteServices;

/** Accepts keys with the configured prefix and hands out one shared in-memory store. */
public class InMemoryKnowledgeStoreConnector implements KnowledgeStoreConnector {
  private final String validKeyPrefix;
  private final RemoteServices services;

  public InMemoryKnowledgeStoreConnector(
      String validKeyPrefix, InMemoryKnowledgeStoreAdapter store, LocalCompletionAdapter completions) {
    this.validKeyPrefix = validKeyPrefix == null ? "" : validKeyPrefix;
    this.services =
        new RemoteServices(
            Objects.requireNonNull(store, "store must not be null."),
            Objects.requireNonNull(completions, "completions must not be null."));
  }

  @Override
  public RemoteServices connect(String apiKey) {
    if (apiKey == null || !apiKey.startsWith(validKeyPrefix)) {
      throw new AuthenticationException("Invalid API key.");
    }
    return services;
  }
}
