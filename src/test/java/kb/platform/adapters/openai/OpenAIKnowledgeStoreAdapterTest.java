package kb.platform.adapters.openai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.openai.client.OpenAIClient;
import com.openai.errors.BadRequestException;
import com.openai.errors.NotFoundException;
import com.openai.errors.UnauthorizedException;
import com.openai.models.files.FileCreateParams;
import com.openai.models.files.FileObject;
import com.openai.models.files.FilePurpose;
import com.openai.models.vectorstores.VectorStore;
import com.openai.models.vectorstores.VectorStoreDeleteParams;
import com.openai.models.vectorstores.VectorStoreRetrieveParams;
import com.openai.models.vectorstores.filebatches.FileBatchCreateParams;
import com.openai.models.vectorstores.files.FileContentParams;
import com.openai.models.vectorstores.files.FileListParams;
import com.openai.services.blocking.FileService;
import com.openai.services.blocking.VectorStoreService;
import com.openai.services.blocking.vectorstores.FileBatchService;
import java.nio.charset.StandardCharsets;
import java.util.List;
import kb.core.errors.AuthenticationException;
import kb.core.errors.RemoteStoreException;
import kb.core.errors.ResourceNotFoundException;
import kb.core.store.RemoteFile;
import kb.core.store.RemoteIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OpenAIKnowledgeStoreAdapterTest {
  private static final String INDEX_ID = "vs_test";

  @Mock private OpenAIClient client;
  @Mock private FileService fileService;
  @Mock private VectorStoreService vectorStoreService;
  @Mock private com.openai.services.blocking.vectorstores.FileService vectorStoreFileService;
  @Mock private FileBatchService fileBatchService;

  private OpenAIKnowledgeStoreAdapter adapter;

  @BeforeEach
  void setUp() {
    adapter = new OpenAIKnowledgeStoreAdapter(client);
  }

  @Test
  void uploadFile_sendsAssistantsPurposeAndMapsMetadata() {
    doReturn(fileService).when(client).files();
    FileObject uploaded = mock(FileObject.class);
    doReturn("file_123").when(uploaded).id();
    doReturn("faq.md").when(uploaded).filename();
    doReturn(500L).when(uploaded).bytes();
    doReturn(1_700_000_000L).when(uploaded).createdAt();
    ArgumentCaptor<FileCreateParams> captor = ArgumentCaptor.forClass(FileCreateParams.class);
    doReturn(uploaded).when(fileService).create(captor.capture());

    RemoteFile file = adapter.uploadFile("faq.md", "# FAQ".getBytes(StandardCharsets.UTF_8));

    assertEquals(new RemoteFile("file_123", "faq.md", 500L, 1_700_000_000L), file);
    assertEquals(FilePurpose.ASSISTANTS, captor.getValue().purpose());
  }

  @Test
  void retrieveIndex_mapsStatusAndCounts() {
    doReturn(vectorStoreService).when(client).vectorStores();
    VectorStore vectorStore = mock(VectorStore.class);
    VectorStore.FileCounts counts = mock(VectorStore.FileCounts.class);
    doReturn(INDEX_ID).when(vectorStore).id();
    doReturn("KB").when(vectorStore).name();
    doReturn(VectorStore.Status.COMPLETED).when(vectorStore).status();
    doReturn(counts).when(vectorStore).fileCounts();
    doReturn(42L).when(vectorStore).createdAt();
    doReturn(2L).when(counts).completed();
    doReturn(0L).when(counts).inProgress();
    doReturn(1L).when(counts).failed();
    doReturn(0L).when(counts).cancelled();
    doReturn(3L).when(counts).total();
    doReturn(vectorStore).when(vectorStoreService).retrieve(any(VectorStoreRetrieveParams.class));

    RemoteIndex index = adapter.retrieveIndex(INDEX_ID);

    assertEquals(INDEX_ID, index.id());
    assertEquals("completed", index.status());
    assertEquals(2L, index.fileCounts().completed());
    assertEquals(1L, index.fileCounts().failed());
    assertEquals(42L, index.createdAt());
  }

  @Test
  void retrieveIndex_translatesNotFound() {
    doReturn(vectorStoreService).when(client).vectorStores();
    doThrow(mock(NotFoundException.class))
        .when(vectorStoreService)
        .retrieve(any(VectorStoreRetrieveParams.class));

    ResourceNotFoundException e =
        assertThrows(ResourceNotFoundException.class, () -> adapter.retrieveIndex("vs_gone"));

    assertEquals("vs_gone", e.resourceId());
  }

  @Test
  void deleteIndex_ignoresAlreadyDeletedIndex() {
    doReturn(vectorStoreService).when(client).vectorStores();
    doThrow(mock(NotFoundException.class))
        .when(vectorStoreService)
        .delete(any(VectorStoreDeleteParams.class));

    adapter.deleteIndex(INDEX_ID);
  }

  @Test
  void removeIndexFile_ignoresMissingAssociation() {
    doReturn(vectorStoreService).when(client).vectorStores();
    doReturn(vectorStoreFileService).when(vectorStoreService).files();
    doThrow(mock(NotFoundException.class))
        .when(vectorStoreFileService)
        .delete(any(com.openai.models.vectorstores.files.FileDeleteParams.class));

    adapter.removeIndexFile(INDEX_ID, "file_1");
  }

  @Test
  void listIndexFiles_translatesRejectedKey() {
    doReturn(vectorStoreService).when(client).vectorStores();
    doReturn(vectorStoreFileService).when(vectorStoreService).files();
    doThrow(mock(UnauthorizedException.class))
        .when(vectorStoreFileService)
        .list(any(FileListParams.class));

    assertThrows(AuthenticationException.class, () -> adapter.listIndexFiles(INDEX_ID));
  }

  @Test
  void createBatch_wrapsTransportFailures() {
    doReturn(vectorStoreService).when(client).vectorStores();
    doReturn(fileBatchService).when(vectorStoreService).fileBatches();
    IllegalStateException cause = new IllegalStateException("connection reset");
    doThrow(cause).when(fileBatchService).create(any(FileBatchCreateParams.class));

    RemoteStoreException e =
        assertThrows(
            RemoteStoreException.class, () -> adapter.createBatch(INDEX_ID, List.of("file_1")));

    assertSame(cause, e.getCause());
    assertTrue(e.getMessage().contains("connection reset"));
  }

  @Test
  void readFileContent_returnsEmptyWhenStoreRefusesContent() {
    doReturn(vectorStoreService).when(client).vectorStores();
    doReturn(vectorStoreFileService).when(vectorStoreService).files();
    doThrow(mock(BadRequestException.class))
        .when(vectorStoreFileService)
        .content(any(FileContentParams.class));

    assertTrue(adapter.readFileContent(INDEX_ID, "file_1").isEmpty());
  }
}
