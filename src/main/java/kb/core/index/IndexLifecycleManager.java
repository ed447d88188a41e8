package kb.core.index;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import kb.core.batch.Batch;
import kb.core.batch.BatchTracker;
import kb.core.errors.ResourceNotFoundException;
import kb.core.errors.ValidationException;
import kb.core.files.DocumentFormats;
import kb.core.files.FileRegistry;
import kb.core.files.UploadedFile;
import kb.core.store.KnowledgeStorePort;
import kb.core.store.RemoteFile;
import kb.core.store.RemoteIndex;
import kb.core.store.RemoteIndexFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and deletes indexes and manages their file membership.
 *
 * <p>Counts are always read from the remote store; nothing here caches them. Status also takes
 * the most recent batch observed by {@link BatchTracker} into account. Batches are started
 * through the tracker and never awaited.
 */
public class IndexLifecycleManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(IndexLifecycleManager.class);

  private final KnowledgeStorePort store;
  private final BatchTracker batchTracker;
  private final FileRegistry registry;

  public IndexLifecycleManager(
      KnowledgeStorePort store, BatchTracker batchTracker, FileRegistry registry) {
    this.store = Objects.requireNonNull(store, "store must not be null.");
    this.batchTracker = Objects.requireNonNull(batchTracker, "batchTracker must not be null.");
    this.registry = Objects.requireNonNull(registry, "registry must not be null.");
  }

  public IndexCreation create(String name, List<String> initialFileIds) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Index name is required.");
    }

    RemoteIndex remote = store.createIndex(name.trim());
    LOGGER.info("Created index {} ({})", remote.id(), remote.name());

    List<String> fileIds = initialFileIds == null ? List.of() : initialFileIds;
    if (fileIds.stream().allMatch(id -> id == null || id.isBlank())) {
      Index index =
          new Index(
              remote.id(),
              remote.name(),
              IndexStatus.EMPTY,
              FileCounts.empty(),
              Instant.ofEpochSecond(remote.createdAt()));
      return new IndexCreation(index, null);
    }

    Batch batch = batchTracker.enqueue(remote.id(), fileIds);
    Index index =
        new Index(
            remote.id(),
            remote.name(),
            IndexStatus.INDEXING,
            batch.fileCounts(),
            Instant.ofEpochSecond(remote.createdAt()));
    return new IndexCreation(index, batch);
  }

  public List<Index> list() {
    return store.listIndexes().stream().map(this::toIndex).toList();
  }

  public Index getStatus(String indexId) {
    return toIndex(store.retrieveIndex(requireId(indexId, "Index id")));
  }

  public List<IndexedFile> listFiles(String indexId) {
    String safeIndexId = requireId(indexId, "Index id");
    List<IndexedFile> files = new ArrayList<>();
    for (RemoteIndexFile remoteFile : store.listIndexFiles(safeIndexId)) {
      describe(remoteFile).ifPresent(files::add);
    }
    return List.copyOf(files);
  }

  /** Starts a batch for additional files and returns without waiting for it. */
  public Batch addFiles(String indexId, List<String> fileIds) {
    return batchTracker.enqueue(requireId(indexId, "Index id"), fileIds);
  }

  /**
   * Detaches a file from an index and returns the index as the remote store reports it
   * afterwards. Counts may lag the removal briefly.
   */
  public Index removeFile(String indexId, String fileId) {
    String safeIndexId = requireId(indexId, "Index id");
    String safeFileId = requireId(fileId, "File id");

    store.removeIndexFile(safeIndexId, safeFileId);
    registry.forget(safeFileId);
    LOGGER.info("Removed file {} from index {}", safeFileId, safeIndexId);
    return getStatus(safeIndexId);
  }

  /** Deletes the underlying file object. Indexes still referencing it stop returning it. */
  public void deleteFile(String fileId) {
    String safeFileId = requireId(fileId, "File id");
    store.deleteFile(safeFileId);
    registry.forget(safeFileId);
    LOGGER.info("Deleted file {}", safeFileId);
  }

  public void delete(String indexId) {
    String safeIndexId = requireId(indexId, "Index id");
    store.deleteIndex(safeIndexId);
    batchTracker.forgetIndex(safeIndexId);
    LOGGER.info("Deleted index {}", safeIndexId);
  }

  public FileContentResult getFileContent(String indexId, String fileId) {
    String safeIndexId = requireId(indexId, "Index id");
    String safeFileId = requireId(fileId, "File id");

    String filename =
        registry
            .find(safeFileId)
            .map(UploadedFile::displayName)
            .orElseGet(() -> store.retrieveFile(safeFileId).filename());

    if (!DocumentFormats.isPlainText(filename)) {
      return FileContentResult.notRetrievable(
          safeFileId,
          filename,
          "File " + filename + " is not plain text. Only .md and .txt files can be displayed.");
    }

    return store
        .readFileContent(safeIndexId, safeFileId)
        .map(content -> FileContentResult.retrieved(safeFileId, filename, content))
        .orElseGet(
            () ->
                FileContentResult.notRetrievable(
                    safeFileId,
                    filename,
                    "The content of " + filename + " is not available from the store."));
  }

  private Optional<IndexedFile> describe(RemoteIndexFile remoteFile) {
    IndexedFileStatus status = IndexedFileStatus.fromRemote(remoteFile.status());
    Optional<UploadedFile> known = registry.find(remoteFile.fileId());
    if (known.isPresent()) {
      return Optional.of(
          new IndexedFile(
              remoteFile.fileId(), status, known.get().displayName(), known.get().byteSize()));
    }

    try {
      RemoteFile metadata = store.retrieveFile(remoteFile.fileId());
      return Optional.of(
          new IndexedFile(remoteFile.fileId(), status, metadata.filename(), metadata.bytes()));
    } catch (ResourceNotFoundException e) {
      LOGGER.warn("Skipping index file {}: metadata no longer available", remoteFile.fileId());
      return Optional.empty();
    }
  }

  /** Remote counts combined with the last batch this session saw for the index. */
  private Index toIndex(RemoteIndex remote) {
    FileCounts counts = FileCounts.fromRemote(remote.fileCounts());
    Batch latest = batchTracker.latestFor(remote.id()).orElse(null);
    return new Index(
        remote.id(),
        remote.name(),
        IndexStatus.derive(remote.status(), counts, latest),
        counts,
        Instant.ofEpochSecond(remote.createdAt()));
  }

  private static String requireId(String value, String label) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(label + " is required.");
    }
    return value.trim();
  }
}
