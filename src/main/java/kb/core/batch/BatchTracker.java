package kb.core.batch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import kb.core.errors.ValidationException;
import kb.core.index.FileCounts;
import kb.core.store.KnowledgeStorePort;
import kb.core.store.RemoteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts indexing batches and observes their progress. Transitions are driven by the remote
 * service; this class never forces one and never loops: callers own the polling schedule.
 *
 * <p>Observations are kept per index: the last state of each batch and the most recent batch
 * of each index. Both are dropped when the index is forgotten.
 */
public class BatchTracker {
  private static final Logger LOGGER = LoggerFactory.getLogger(BatchTracker.class);

  private final KnowledgeStorePort store;
  private final Map<BatchKey, Batch> lastObserved = new ConcurrentHashMap<>();
  private final Map<String, Batch> latestByIndex = new ConcurrentHashMap<>();

  public BatchTracker(KnowledgeStorePort store) {
    this.store = Objects.requireNonNull(store, "store must not be null.");
  }

  public Batch enqueue(String indexId, List<String> fileIds) {
    String safeIndexId = requireId(indexId, "Index id");
    List<String> ids = distinctIds(fileIds);
    if (ids.isEmpty()) {
      throw new ValidationException("At least one file id is required to start a batch.");
    }

    Batch batch = toBatch(store.createBatch(safeIndexId, ids), safeIndexId);
    lastObserved.put(new BatchKey(safeIndexId, batch.id()), batch);
    latestByIndex.put(safeIndexId, batch);
    LOGGER.info(
        "Enqueued batch {} on index {} for {} file(s), status {}",
        batch.id(),
        safeIndexId,
        ids.size(),
        batch.status());
    return batch;
  }

  /** Single status fetch. A batch observed in a terminal state is returned as-is afterwards. */
  public Batch poll(String indexId, String batchId) {
    String safeIndexId = requireId(indexId, "Index id");
    String safeBatchId = requireId(batchId, "Batch id");

    BatchKey key = new BatchKey(safeIndexId, safeBatchId);
    Batch previous = lastObserved.get(key);
    if (previous != null && previous.isComplete()) {
      return previous;
    }

    Batch observed = toBatch(store.retrieveBatch(safeIndexId, safeBatchId), safeIndexId);
    Batch merged = keepForwardOnly(previous, observed);
    lastObserved.put(key, merged);
    latestByIndex.compute(
        safeIndexId,
        (id, latest) -> latest == null || latest.id().equals(merged.id()) ? merged : latest);
    LOGGER.debug(
        "Polled batch {}: {} ({} / {} completed, {} failed)",
        safeBatchId,
        merged.status(),
        merged.fileCounts().completed(),
        merged.fileCounts().total(),
        merged.fileCounts().failed());
    return merged;
  }

  /** Last observed state of the most recently started batch of an index, if any. */
  public Optional<Batch> latestFor(String indexId) {
    if (indexId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(latestByIndex.get(indexId.trim()));
  }

  /** Drops everything observed for an index, typically after it was deleted. */
  public void forgetIndex(String indexId) {
    if (indexId == null) {
      return;
    }
    String safeIndexId = indexId.trim();
    latestByIndex.remove(safeIndexId);
    lastObserved.keySet().removeIf(key -> key.indexId().equals(safeIndexId));
  }

  public static boolean isComplete(Batch batch) {
    return batch != null && batch.isComplete();
  }

  /**
   * Neither the status nor the terminal per-file counts of a running batch move backwards
   * when the remote store answers with a lagging read.
   */
  private static Batch keepForwardOnly(Batch previous, Batch observed) {
    if (previous == null || observed.isComplete()) {
      return observed;
    }
    BatchStatus status =
        observed.status().ordinal() >= previous.status().ordinal()
            ? observed.status()
            : previous.status();
    return new Batch(
        observed.id(),
        observed.indexId(),
        status,
        mergeCounts(previous.fileCounts(), observed.fileCounts()),
        observed.createdAt());
  }

  static FileCounts mergeCounts(FileCounts previous, FileCounts observed) {
    if (previous == null) {
      return observed;
    }
    if (observed == null) {
      return previous;
    }
    long completed = Math.max(previous.completed(), observed.completed());
    long failed = Math.max(previous.failed(), observed.failed());
    long cancelled = Math.max(previous.cancelled(), observed.cancelled());
    long total = Math.max(previous.total(), observed.total());
    long inProgress = Math.max(0, total - completed - failed - cancelled);
    return FileCounts.of(completed, inProgress, failed, cancelled);
  }

  private static Batch toBatch(RemoteBatch remote, String fallbackIndexId) {
    String indexId =
        remote.indexId() == null || remote.indexId().isBlank() ? fallbackIndexId : remote.indexId();
    return new Batch(
        remote.id(),
        indexId,
        BatchStatus.fromRemote(remote.status()),
        FileCounts.fromRemote(remote.fileCounts()),
        Instant.ofEpochSecond(remote.createdAt()));
  }

  private static List<String> distinctIds(List<String> fileIds) {
    if (fileIds == null) {
      return List.of();
    }
    LinkedHashSet<String> ids = new LinkedHashSet<>();
    for (String id : fileIds) {
      if (id != null && !id.isBlank()) {
        ids.add(id.trim());
      }
    }
    return List.copyOf(new ArrayList<>(ids));
  }

  private static String requireId(String value, String label) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(label + " is required.");
    }
    return value.trim();
  }

  private record BatchKey(String indexId, String batchId) {}
}
