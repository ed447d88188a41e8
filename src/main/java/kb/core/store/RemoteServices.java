package kb.core.store;

import java.util.Objects;

public record RemoteServices(KnowledgeStorePort store, CompletionPort completions) {
  public RemoteServices {
    Objects.requireNonNull(store, "store must not be null.");
    Objects.requireNonNull(completions, "completions must not be null.");
  }
}
