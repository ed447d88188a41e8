package kb.platform.adapters.local;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import kb.core.errors.ResourceNotFoundException;
import kb.core.errors.ValidationException;
import kb.core.store.KnowledgeStorePort;
import kb.core.store.RemoteBatch;
import kb.core.store.RemoteChunk;
import kb.core.store.RemoteFile;
import kb.core.store.RemoteFileCounts;
import kb.core.store.RemoteIndex;
import kb.core.store.RemoteIndexFile;

/**
 * Process-local knowledge store for the {@code local} and {@code test} profiles.
 *
 * <p>Processing is simulated: every read of an index or batch advances its pending files by one
 * tick, and after {@code pollsToComplete} ticks a file completes, or fails when it is empty.
 * Search ranks paragraphs of completed files by word overlap with the query.
 */
public class InMemoryKnowledgeStoreAdapter implements KnowledgeStorePort {
  private static final int MIN_TOKEN_LENGTH = 3;

  private final int pollsToComplete;
  private final Clock clock;

  private final Map<String, StoredFile> files = new LinkedHashMap<>();
  private final Map<String, StoredIndex> indexes = new LinkedHashMap<>();
  private long fileSequence;
  private long indexSequence;
  private long batchSequence;

  public InMemoryKnowledgeStoreAdapter(int pollsToComplete, Clock clock) {
    this.pollsToComplete = Math.max(0, pollsToComplete);
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  @Override
  public synchronized RemoteFile uploadFile(String filename, byte[] content) {
    if (content == null) {
      throw new ValidationException("content must not be null.");
    }
    String id = "file-local-" + (++fileSequence);
    StoredFile file = new StoredFile(id, filename, content.clone(), now());
    files.put(id, file);
    return file.toRemote();
  }

  @Override
  public synchronized RemoteFile retrieveFile(String fileId) {
    return requireFile(fileId).toRemote();
  }

  @Override
  public synchronized void deleteFile(String fileId) {
    if (files.remove(fileId) == null) {
      return;
    }
    for (StoredIndex index : indexes.values()) {
      index.entries.remove(fileId);
    }
  }

  @Override
  public synchronized Optional<String> readFileContent(String indexId, String fileId) {
    StoredIndex index = requireIndex(indexId);
    if (!index.entries.containsKey(fileId)) {
      return Optional.empty();
    }
    StoredFile file = files.get(fileId);
    if (file == null || file.content.length == 0) {
      return Optional.empty();
    }
    return Optional.of(file.text());
  }

  @Override
  public synchronized RemoteIndex createIndex(String name) {
    String id = "vs_local_" + (++indexSequence);
    StoredIndex index = new StoredIndex(id, name, now());
    indexes.put(id, index);
    return index.toRemote();
  }

  @Override
  public synchronized RemoteIndex retrieveIndex(String indexId) {
    StoredIndex index = requireIndex(indexId);
    advance(index);
    return index.toRemote();
  }

  @Override
  public synchronized List<RemoteIndex> listIndexes() {
    List<RemoteIndex> result = new ArrayList<>();
    for (StoredIndex index : indexes.values()) {
      advance(index);
      result.add(index.toRemote());
    }
    result.sort(Comparator.comparingLong(RemoteIndex::createdAt).reversed());
    return result;
  }

  @Override
  public synchronized void deleteIndex(String indexId) {
    indexes.remove(indexId);
  }

  @Override
  public synchronized List<RemoteIndexFile> listIndexFiles(String indexId) {
    StoredIndex index = requireIndex(indexId);
    advance(index);
    return index.entries.values().stream()
        .map(entry -> new RemoteIndexFile(entry.fileId, entry.status, entry.usageBytes(), entry.lastError))
        .toList();
  }

  @Override
  public synchronized void removeIndexFile(String indexId, String fileId) {
    StoredIndex index = indexes.get(indexId);
    if (index != null) {
      index.entries.remove(fileId);
    }
  }

  @Override
  public synchronized RemoteBatch createBatch(String indexId, List<String> fileIds) {
    StoredIndex index = requireIndex(indexId);
    for (String fileId : fileIds) {
      requireFile(fileId);
    }
    StoredBatch batch = new StoredBatch("vsfb_local_" + (++batchSequence), new LinkedHashSet<>(fileIds), now());
    for (String fileId : batch.fileIds) {
      index.entries.put(fileId, new Entry(fileId, files.get(fileId)));
    }
    index.batches.put(batch.id, batch);
    if (pollsToComplete == 0) {
      advance(index);
    }
    return batch.toRemote(index);
  }

  @Override
  public synchronized RemoteBatch retrieveBatch(String indexId, String batchId) {
    StoredIndex index = requireIndex(indexId);
    StoredBatch batch = index.batches.get(batchId);
    if (batch == null) {
      throw new ResourceNotFoundException(batchId, "Batch not found: " + batchId);
    }
    advance(index);
    return batch.toRemote(index);
  }

  @Override
  public synchronized List<RemoteChunk> search(String indexId, String query, int maxResults) {
    StoredIndex index = requireIndex(indexId);
    Set<String> queryTokens = tokens(query);
    if (queryTokens.isEmpty() || maxResults <= 0) {
      return List.of();
    }

    List<RemoteChunk> hits = new ArrayList<>();
    for (Entry entry : index.entries.values()) {
      if (!"completed".equals(entry.status) || entry.file == null) {
        continue;
      }
      for (String paragraph : entry.file.text().split("\\n\\s*\\n")) {
        if (paragraph.isBlank()) {
          continue;
        }
        Set<String> paragraphTokens = tokens(paragraph);
        long overlap = queryTokens.stream().filter(paragraphTokens::contains).count();
        if (overlap > 0) {
          double score = (double) overlap / queryTokens.size();
          hits.add(new RemoteChunk(entry.fileId, entry.file.filename, score, paragraph.trim()));
        }
      }
    }
    hits.sort(Comparator.comparingDouble(RemoteChunk::score).reversed());
    return hits.size() > maxResults ? List.copyOf(hits.subList(0, maxResults)) : hits;
  }

  private void advance(StoredIndex index) {
    for (Entry entry : index.entries.values()) {
      if (!"in_progress".equals(entry.status)) {
        continue;
      }
      entry.ticks++;
      if (entry.ticks >= pollsToComplete) {
        if (entry.file == null || entry.file.content.length == 0) {
          entry.status = "failed";
          entry.lastError = "File is empty.";
        } else {
          entry.status = "completed";
        }
      }
    }
  }

  private StoredFile requireFile(String fileId) {
    StoredFile file = files.get(fileId);
    if (file == null) {
      throw new ResourceNotFoundException(fileId, "File not found: " + fileId);
    }
    return file;
  }

  private StoredIndex requireIndex(String indexId) {
    StoredIndex index = indexes.get(indexId);
    if (index == null) {
      throw new ResourceNotFoundException(indexId, "Index not found: " + indexId);
    }
    return index;
  }

  private long now() {
    return clock.instant().getEpochSecond();
  }

  static Set<String> tokens(String text) {
    if (text == null) {
      return Set.of();
    }
    return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
        .filter(token -> token.length() >= MIN_TOKEN_LENGTH)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  private static RemoteFileCounts count(Iterable<Entry> entries) {
    long completed = 0;
    long inProgress = 0;
    long failed = 0;
    long cancelled = 0;
    long total = 0;
    for (Entry entry : entries) {
      total++;
      switch (entry.status) {
        case "completed" -> completed++;
        case "failed" -> failed++;
        case "cancelled" -> cancelled++;
        default -> inProgress++;
      }
    }
    return new RemoteFileCounts(completed, inProgress, failed, cancelled, total);
  }

  private static final class StoredFile {
    private final String id;
    private final String filename;
    private final byte[] content;
    private final long createdAt;

    private StoredFile(String id, String filename, byte[] content, long createdAt) {
      this.id = id;
      this.filename = filename;
      this.content = content;
      this.createdAt = createdAt;
    }

    private String text() {
      return new String(content, StandardCharsets.UTF_8);
    }

    private RemoteFile toRemote() {
      return new RemoteFile(id, filename, content.length, createdAt);
    }
  }

  private static final class Entry {
    private final String fileId;
    private final StoredFile file;
    private String status = "in_progress";
    private String lastError;
    private int ticks;

    private Entry(String fileId, StoredFile file) {
      this.fileId = fileId;
      this.file = file;
    }

    private long usageBytes() {
      return "completed".equals(status) && file != null ? file.content.length : 0;
    }
  }

  private static final class StoredBatch {
    private final String id;
    private final Set<String> fileIds;
    private final long createdAt;

    private StoredBatch(String id, Set<String> fileIds, long createdAt) {
      this.id = id;
      this.fileIds = fileIds;
      this.createdAt = createdAt;
    }

    private RemoteBatch toRemote(StoredIndex index) {
      List<Entry> members =
          fileIds.stream().map(index.entries::get).filter(e -> e != null).toList();
      RemoteFileCounts counts = count(members);
      String status;
      if (counts.inProgress() > 0) {
        status = "in_progress";
      } else if (counts.total() > 0 && counts.failed() == counts.total()) {
        status = "failed";
      } else {
        status = "completed";
      }
      return new RemoteBatch(id, index.id, status, counts, createdAt);
    }
  }

  private static final class StoredIndex {
    private final String id;
    private final String name;
    private final long createdAt;
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Map<String, StoredBatch> batches = new LinkedHashMap<>();

    private StoredIndex(String id, String name, long createdAt) {
      this.id = id;
      this.name = name;
      this.createdAt = createdAt;
    }

    private RemoteIndex toRemote() {
      RemoteFileCounts counts = count(entries.values());
      String status = counts.inProgress() > 0 ? "in_progress" : "completed";
      return new RemoteIndex(id, name, status, counts, createdAt);
    }
  }
}
