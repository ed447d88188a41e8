package kb.core.store;

import java.util.List;
import java.util.Optional;

/**
 * Operations consumed from the remote embedding/index service.
 *
 * <p>Implementations translate transport failures into {@link kb.core.errors.RemoteStoreException}
 * and missing objects into {@link kb.core.errors.ResourceNotFoundException}. Status fields are
 * passed through in the remote service's own vocabulary.
 */
public interface KnowledgeStorePort {
  RemoteFile uploadFile(String filename, byte[] content);

  RemoteFile retrieveFile(String fileId);

  /** Deletes the underlying file object. Succeeds when the file is already gone. */
  void deleteFile(String fileId);

  /** Plain-text content of a file attached to an index, or empty when not retrievable. */
  Optional<String> readFileContent(String indexId, String fileId);

  RemoteIndex createIndex(String name);

  RemoteIndex retrieveIndex(String indexId);

  List<RemoteIndex> listIndexes();

  /** Succeeds when the index is already gone. */
  void deleteIndex(String indexId);

  List<RemoteIndexFile> listIndexFiles(String indexId);

  /** Detaches a file from an index. Succeeds when the association is already gone. */
  void removeIndexFile(String indexId, String fileId);

  RemoteBatch createBatch(String indexId, List<String> fileIds);

  RemoteBatch retrieveBatch(String indexId, String batchId);

  /** Chunks ranked by the remote relevance score, best first. */
  List<RemoteChunk> search(String indexId, String query, int maxResults);
}
