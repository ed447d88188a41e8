package kb.core.session;

import java.util.Optional;

/**
 * Explicit per-caller state: accepted credentials (as a bound component set) and the index used
 * when a query names none.
 *
 * <p>Not synchronized. Concurrent callers must not share a session without external ordering.
 */
public class KnowledgeBaseSession {
  private KnowledgeBaseContext context;
  private String currentIndexId;

  public boolean isConfigured() {
    return context != null;
  }

  public Optional<KnowledgeBaseContext> context() {
    return Optional.ofNullable(context);
  }

  public Optional<String> currentIndexId() {
    return Optional.ofNullable(currentIndexId);
  }

  void attach(KnowledgeBaseContext context) {
    this.context = context;
  }

  void selectIndex(String indexId) {
    this.currentIndexId = indexId;
  }

  void clearIndexIfCurrent(String indexId) {
    if (indexId != null && indexId.equals(currentIndexId)) {
      this.currentIndexId = null;
    }
  }
}
