package kb.core.session;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import kb.core.batch.Batch;
import kb.core.errors.PreconditionException;
import kb.core.errors.ValidationException;
import kb.core.files.UploadedFile;
import kb.core.index.FileContentResult;
import kb.core.index.Index;
import kb.core.index.IndexCreation;
import kb.core.index.IndexedFile;
import kb.core.retrieval.QueryOptions;
import kb.core.retrieval.QueryResult;
import kb.core.retrieval.RetrievalSettings;
import kb.core.store.KnowledgeStoreConnector;
import kb.core.store.RemoteServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for the knowledge base. Sequences the components bound to a session and
 * substitutes session defaults (file set, current index, model); holds no state of its own.
 */
public class KnowledgeBaseFacade {
  private static final Logger LOGGER = LoggerFactory.getLogger(KnowledgeBaseFacade.class);

  private final KnowledgeStoreConnector connector;
  private final RetrievalSettings settings;
  private final Clock clock;

  public KnowledgeBaseFacade(
      KnowledgeStoreConnector connector, RetrievalSettings settings, Clock clock) {
    this.connector = Objects.requireNonNull(connector, "connector must not be null.");
    this.settings = settings == null ? RetrievalSettings.defaults() : settings;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  /** Verifies the key against the remote service before accepting it. Allowed once per session. */
  public void configure(KnowledgeBaseSession session, String apiKey) {
    Objects.requireNonNull(session, "session must not be null.");
    if (apiKey == null || apiKey.isBlank()) {
      throw new ValidationException("API key is required.");
    }
    if (session.isConfigured()) {
      throw new PreconditionException("Session is already configured.");
    }

    RemoteServices services = connector.connect(apiKey.trim());
    session.attach(new KnowledgeBaseContext(services, settings, clock));
    LOGGER.info("Session configured");
  }

  public UploadedFile upload(KnowledgeBaseSession session, byte[] content, String filename) {
    return requireContext(session).registry().register(content, filename);
  }

  public List<UploadedFile> listFiles(KnowledgeBaseSession session) {
    return requireContext(session).registry().list();
  }

  public void deleteFile(KnowledgeBaseSession session, String fileId) {
    requireContext(session).indexManager().deleteFile(fileId);
  }

  /** Without explicit file ids every registered file is indexed. Selects the new index. */
  public IndexCreation createIndex(
      KnowledgeBaseSession session, String name, List<String> fileIds) {
    KnowledgeBaseContext context = requireContext(session);
    List<String> ids = fileIds == null ? context.registry().fileIds() : fileIds;
    IndexCreation created = context.indexManager().create(name, ids);
    session.selectIndex(created.index().id());
    return created;
  }

  public List<Index> listIndexes(KnowledgeBaseSession session) {
    return requireContext(session).indexManager().list();
  }

  public void deleteIndex(KnowledgeBaseSession session, String indexId) {
    requireContext(session).indexManager().delete(indexId);
    session.clearIndexIfCurrent(indexId == null ? null : indexId.trim());
  }

  /** Without explicit file ids every registered file is added. Selects the index. */
  public Batch addFiles(KnowledgeBaseSession session, String indexId, List<String> fileIds) {
    KnowledgeBaseContext context = requireContext(session);
    List<String> ids = fileIds == null ? context.registry().fileIds() : fileIds;
    Batch batch = context.indexManager().addFiles(indexId, ids);
    session.selectIndex(batch.indexId());
    return batch;
  }

  public Index getIndexStatus(KnowledgeBaseSession session, String indexId) {
    return requireContext(session).indexManager().getStatus(indexId);
  }

  public List<IndexedFile> listIndexFiles(KnowledgeBaseSession session, String indexId) {
    return requireContext(session).indexManager().listFiles(indexId);
  }

  public Index removeIndexFile(KnowledgeBaseSession session, String indexId, String fileId) {
    return requireContext(session).indexManager().removeFile(indexId, fileId);
  }

  public FileContentResult getFileContent(
      KnowledgeBaseSession session, String indexId, String fileId) {
    return requireContext(session).indexManager().getFileContent(indexId, fileId);
  }

  public Batch pollBatch(KnowledgeBaseSession session, String indexId, String batchId) {
    return requireContext(session).batchTracker().poll(indexId, batchId);
  }

  public QueryResult query(
      KnowledgeBaseSession session, String text, String indexId, String model) {
    return query(session, text, indexId, model, QueryOptions.none());
  }

  /** Falls back to the session's current index when no index id is given. */
  public QueryResult query(
      KnowledgeBaseSession session,
      String text,
      String indexId,
      String model,
      QueryOptions options) {
    KnowledgeBaseContext context = requireContext(session);
    String effectiveIndexId =
        indexId == null || indexId.isBlank() ? session.currentIndexId().orElse(null) : indexId;
    return context.retrievalComposer().query(text, effectiveIndexId, model, options);
  }

  public HealthSummary health(KnowledgeBaseSession session) {
    int files = session.context().map(c -> c.registry().list().size()).orElse(0);
    return new HealthSummary(
        "healthy", session.isConfigured(), session.currentIndexId().orElse(null), files);
  }

  private static KnowledgeBaseContext requireContext(KnowledgeBaseSession session) {
    Objects.requireNonNull(session, "session must not be null.");
    return session
        .context()
        .orElseThrow(() -> new PreconditionException("API key is not configured."));
  }
}
