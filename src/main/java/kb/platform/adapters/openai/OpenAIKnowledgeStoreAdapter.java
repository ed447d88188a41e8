package kb.platform.adapters.openai;

import com.openai.client.OpenAIClient;
import com.openai.core.MultipartField;
import com.openai.errors.BadRequestException;
import com.openai.errors.NotFoundException;
import com.openai.errors.PermissionDeniedException;
import com.openai.errors.UnauthorizedException;
import com.openai.models.files.FileCreateParams;
import com.openai.models.files.FileDeleteParams;
import com.openai.models.files.FileObject;
import com.openai.models.files.FilePurpose;
import com.openai.models.files.FileRetrieveParams;
import com.openai.models.vectorstores.VectorStore;
import com.openai.models.vectorstores.VectorStoreCreateParams;
import com.openai.models.vectorstores.VectorStoreDeleteParams;
import com.openai.models.vectorstores.VectorStoreListParams;
import com.openai.models.vectorstores.VectorStoreRetrieveParams;
import com.openai.models.vectorstores.VectorStoreSearchParams;
import com.openai.models.vectorstores.VectorStoreSearchResponse;
import com.openai.models.vectorstores.filebatches.FileBatchCreateParams;
import com.openai.models.vectorstores.filebatches.FileBatchRetrieveParams;
import com.openai.models.vectorstores.filebatches.VectorStoreFileBatch;
import com.openai.models.vectorstores.files.FileContentParams;
import com.openai.models.vectorstores.files.FileListParams;
import com.openai.models.vectorstores.files.VectorStoreFile;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import kb.core.errors.AuthenticationException;
import kb.core.errors.RemoteStoreException;
import kb.core.errors.ResourceNotFoundException;
import kb.core.errors.ValidationException;
import kb.core.store.KnowledgeStorePort;
import kb.core.store.RemoteBatch;
import kb.core.store.RemoteChunk;
import kb.core.store.RemoteFile;
import kb.core.store.RemoteFileCounts;
import kb.core.store.RemoteIndex;
import kb.core.store.RemoteIndexFile;

/** Knowledge store backed by OpenAI files, vector stores and vector store file batches. */
public class OpenAIKnowledgeStoreAdapter implements KnowledgeStorePort {
  private static final long PAGE_SIZE = 100L;

  private final OpenAIClient client;

  public OpenAIKnowledgeStoreAdapter(OpenAIClient client) {
    this.client = Objects.requireNonNull(client, "client must not be null.");
  }

  @Override
  public RemoteFile uploadFile(String filename, byte[] content) {
    if (content == null) {
      throw new ValidationException("content must not be null.");
    }
    MultipartField<InputStream> fileField =
        MultipartField.<InputStream>builder()
            .value(new ByteArrayInputStream(content))
            .filename(filename)
            .contentType("application/octet-stream")
            .build();
    FileObject uploaded =
        call(
            "upload file " + filename,
            filename,
            () ->
                client
                    .files()
                    .create(
                        FileCreateParams.builder()
                            .file(fileField)
                            .purpose(FilePurpose.ASSISTANTS)
                            .build()));
    return toRemoteFile(uploaded);
  }

  @Override
  public RemoteFile retrieveFile(String fileId) {
    FileObject file =
        call(
            "retrieve file " + fileId,
            fileId,
            () -> client.files().retrieve(FileRetrieveParams.builder().fileId(fileId).build()));
    return toRemoteFile(file);
  }

  @Override
  public void deleteFile(String fileId) {
    try {
      client.files().delete(FileDeleteParams.builder().fileId(fileId).build());
    } catch (NotFoundException ignored) {
      return;
    } catch (RuntimeException e) {
      throw translate("delete file " + fileId, fileId, e);
    }
  }

  @Override
  public Optional<String> readFileContent(String indexId, String fileId) {
    List<String> parts;
    try {
      parts =
          client
              .vectorStores()
              .files()
              .content(FileContentParams.builder().vectorStoreId(indexId).fileId(fileId).build())
              .autoPager()
              .stream()
              .map(item -> item.text().orElse(null))
              .filter(text -> text != null && !text.isBlank())
              .toList();
    } catch (NotFoundException | BadRequestException e) {
      return Optional.empty();
    } catch (RuntimeException e) {
      throw translate("read content of file " + fileId, fileId, e);
    }
    return parts.isEmpty() ? Optional.empty() : Optional.of(String.join("\n", parts));
  }

  @Override
  public RemoteIndex createIndex(String name) {
    VectorStore vectorStore =
        call(
            "create vector store " + name,
            name,
            () -> client.vectorStores().create(VectorStoreCreateParams.builder().name(name).build()));
    return toRemoteIndex(vectorStore);
  }

  @Override
  public RemoteIndex retrieveIndex(String indexId) {
    VectorStore vectorStore =
        call(
            "retrieve vector store " + indexId,
            indexId,
            () ->
                client
                    .vectorStores()
                    .retrieve(VectorStoreRetrieveParams.builder().vectorStoreId(indexId).build()));
    return toRemoteIndex(vectorStore);
  }

  @Override
  public List<RemoteIndex> listIndexes() {
    return call(
        "list vector stores",
        null,
        () ->
            client
                .vectorStores()
                .list(VectorStoreListParams.builder().limit(PAGE_SIZE).build())
                .autoPager()
                .stream()
                .map(OpenAIKnowledgeStoreAdapter::toRemoteIndex)
                .toList());
  }

  @Override
  public void deleteIndex(String indexId) {
    try {
      client
          .vectorStores()
          .delete(VectorStoreDeleteParams.builder().vectorStoreId(indexId).build());
    } catch (NotFoundException ignored) {
      return;
    } catch (RuntimeException e) {
      throw translate("delete vector store " + indexId, indexId, e);
    }
  }

  @Override
  public List<RemoteIndexFile> listIndexFiles(String indexId) {
    return call(
        "list files of vector store " + indexId,
        indexId,
        () ->
            client
                .vectorStores()
                .files()
                .list(FileListParams.builder().vectorStoreId(indexId).limit(PAGE_SIZE).build())
                .autoPager()
                .stream()
                .map(OpenAIKnowledgeStoreAdapter::toRemoteIndexFile)
                .toList());
  }

  @Override
  public void removeIndexFile(String indexId, String fileId) {
    try {
      client
          .vectorStores()
          .files()
          .delete(
              com.openai.models.vectorstores.files.FileDeleteParams.builder()
                  .vectorStoreId(indexId)
                  .fileId(fileId)
                  .build());
    } catch (NotFoundException ignored) {
      return;
    } catch (RuntimeException e) {
      throw translate("remove file " + fileId + " from vector store " + indexId, fileId, e);
    }
  }

  @Override
  public RemoteBatch createBatch(String indexId, List<String> fileIds) {
    VectorStoreFileBatch batch =
        call(
            "create file batch on vector store " + indexId,
            indexId,
            () ->
                client
                    .vectorStores()
                    .fileBatches()
                    .create(
                        FileBatchCreateParams.builder()
                            .vectorStoreId(indexId)
                            .fileIds(fileIds)
                            .build()));
    return toRemoteBatch(batch);
  }

  @Override
  public RemoteBatch retrieveBatch(String indexId, String batchId) {
    VectorStoreFileBatch batch =
        call(
            "retrieve file batch " + batchId,
            batchId,
            () ->
                client
                    .vectorStores()
                    .fileBatches()
                    .retrieve(
                        FileBatchRetrieveParams.builder()
                            .vectorStoreId(indexId)
                            .batchId(batchId)
                            .build()));
    return toRemoteBatch(batch);
  }

  @Override
  public List<RemoteChunk> search(String indexId, String query, int maxResults) {
    return call(
        "search vector store " + indexId,
        indexId,
        () ->
            client
                .vectorStores()
                .search(
                    VectorStoreSearchParams.builder()
                        .vectorStoreId(indexId)
                        .query(query)
                        .maxNumResults((long) maxResults)
                        .build())
                .autoPager()
                .stream()
                .limit(maxResults)
                .map(OpenAIKnowledgeStoreAdapter::toRemoteChunk)
                .toList());
  }

  private static <T> T call(String action, String resourceId, Supplier<T> request) {
    try {
      return request.get();
    } catch (RuntimeException e) {
      throw translate(action, resourceId, e);
    }
  }

  static RuntimeException translate(String action, String resourceId, RuntimeException e) {
    if (e instanceof NotFoundException) {
      return new ResourceNotFoundException(resourceId, "Not found: " + resourceId, e);
    }
    if (e instanceof UnauthorizedException || e instanceof PermissionDeniedException) {
      return new AuthenticationException("API key rejected while trying to " + action + ".", e);
    }
    return new RemoteStoreException("Failed to " + action + ": " + e.getMessage(), e);
  }

  private static RemoteFile toRemoteFile(FileObject file) {
    return new RemoteFile(file.id(), file.filename(), file.bytes(), file.createdAt());
  }

  private static RemoteIndex toRemoteIndex(VectorStore vectorStore) {
    VectorStore.FileCounts counts = vectorStore.fileCounts();
    return new RemoteIndex(
        vectorStore.id(),
        vectorStore.name(),
        String.valueOf(vectorStore.status()),
        new RemoteFileCounts(
            counts.completed(),
            counts.inProgress(),
            counts.failed(),
            counts.cancelled(),
            counts.total()),
        vectorStore.createdAt());
  }

  private static RemoteIndexFile toRemoteIndexFile(VectorStoreFile file) {
    return new RemoteIndexFile(
        file.id(),
        String.valueOf(file.status()),
        file.usageBytes(),
        file.lastError().map(VectorStoreFile.LastError::message).orElse(null));
  }

  private static RemoteBatch toRemoteBatch(VectorStoreFileBatch batch) {
    VectorStoreFileBatch.FileCounts counts = batch.fileCounts();
    return new RemoteBatch(
        batch.id(),
        batch.vectorStoreId(),
        String.valueOf(batch.status()),
        new RemoteFileCounts(
            counts.completed(),
            counts.inProgress(),
            counts.failed(),
            counts.cancelled(),
            counts.total()),
        batch.createdAt());
  }

  private static RemoteChunk toRemoteChunk(VectorStoreSearchResponse hit) {
    String text =
        hit.content().stream()
            .map(VectorStoreSearchResponse.Content::text)
            .filter(t -> t != null && !t.isBlank())
            .map(String::trim)
            .collect(Collectors.joining("\n"));
    return new RemoteChunk(hit.fileId(), hit.filename(), hit.score(), text);
  }
}
