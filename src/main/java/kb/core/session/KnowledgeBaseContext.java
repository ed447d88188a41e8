package kb.core.session;

import java.time.Clock;
import kb.core.batch.BatchTracker;
import kb.core.files.FileRegistry;
import kb.core.index.IndexLifecycleManager;
import kb.core.retrieval.RetrievalComposer;
import kb.core.retrieval.RetrievalSettings;
import kb.core.store.RemoteServices;

/** The component set bound to one set of accepted credentials. */
public final class KnowledgeBaseContext {
  private final FileRegistry registry;
  private final BatchTracker batchTracker;
  private final IndexLifecycleManager indexManager;
  private final RetrievalComposer retrievalComposer;

  public KnowledgeBaseContext(RemoteServices services, RetrievalSettings settings, Clock clock) {
    this.registry = new FileRegistry(services.store(), clock);
    this.batchTracker = new BatchTracker(services.store());
    this.indexManager = new IndexLifecycleManager(services.store(), batchTracker, registry);
    this.retrievalComposer =
        new RetrievalComposer(services.store(), services.completions(), settings);
  }

  public FileRegistry registry() {
    return registry;
  }

  public BatchTracker batchTracker() {
    return batchTracker;
  }

  public IndexLifecycleManager indexManager() {
    return indexManager;
  }

  public RetrievalComposer retrievalComposer() {
    return retrievalComposer;
  }
}
