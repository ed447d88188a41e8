package kb.platform.delivery.web;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import kb.core.batch.Batch;
import kb.core.index.FileContentResult;
import kb.core.index.Index;
import kb.core.index.IndexCreation;
import kb.core.index.IndexedFile;
import kb.core.session.KnowledgeBaseFacade;
import kb.core.session.KnowledgeBaseSession;
import kb.platform.polling.BatchAwaiter;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class IndexApiController {
  private static final long MAX_WAIT_SECONDS = 300;

  private final KnowledgeBaseFacade facade;
  private final KnowledgeBaseSession session;
  private final BatchAwaiter batchAwaiter;

  public IndexApiController(
      KnowledgeBaseFacade facade, KnowledgeBaseSession session, BatchAwaiter batchAwaiter) {
    this.facade = facade;
    this.session = session;
    this.batchAwaiter = batchAwaiter;
  }

  @PostMapping(
      path = "/api/vector-store",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<IndexCreation> createIndex(@RequestBody CreateIndexRequest request) {
    CreateIndexRequest body = request == null ? new CreateIndexRequest(null, null) : request;
    return ResponseEntity.ok(facade.createIndex(session, body.name(), body.fileIds()));
  }

  @GetMapping(path = "/api/vector-stores", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<Index>> listIndexes() {
    return ResponseEntity.ok(facade.listIndexes(session));
  }

  @DeleteMapping(path = "/api/vector-stores/{indexId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, String>> deleteIndex(@PathVariable String indexId) {
    facade.deleteIndex(session, indexId);
    return ResponseEntity.ok(Map.of("deleted", indexId));
  }

  @GetMapping(path = "/api/status/{indexId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Index> status(@PathVariable String indexId) {
    return ResponseEntity.ok(facade.getIndexStatus(session, indexId));
  }

  @GetMapping(path = "/api/vector-stores/{indexId}/files", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<IndexedFile>> listIndexFiles(@PathVariable String indexId) {
    return ResponseEntity.ok(facade.listIndexFiles(session, indexId));
  }

  @PostMapping(
      path = "/api/vector-stores/{indexId}/add-files",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Batch> addFiles(
      @PathVariable String indexId, @RequestBody(required = false) AddFilesRequest request) {
    List<String> fileIds = request == null ? null : request.fileIds();
    return ResponseEntity.ok(facade.addFiles(session, indexId, fileIds));
  }

  /** With {@code waitSeconds > 0} the call blocks until the batch completes or the wait ends. */
  @GetMapping(
      path = "/api/vector-stores/{indexId}/batch/{batchId}/status",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Batch> batchStatus(
      @PathVariable String indexId,
      @PathVariable String batchId,
      @RequestParam(name = "waitSeconds", defaultValue = "0") long waitSeconds) {
    if (waitSeconds <= 0) {
      return ResponseEntity.ok(facade.pollBatch(session, indexId, batchId));
    }
    Duration wait = Duration.ofSeconds(Math.min(waitSeconds, MAX_WAIT_SECONDS));
    return ResponseEntity.ok(
        batchAwaiter.await(() -> facade.pollBatch(session, indexId, batchId), wait));
  }

  @DeleteMapping(
      path = "/api/vector-stores/{indexId}/files/{fileId}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Index> removeIndexFile(
      @PathVariable String indexId, @PathVariable String fileId) {
    return ResponseEntity.ok(facade.removeIndexFile(session, indexId, fileId));
  }

  @GetMapping(
      path = "/api/vector-stores/{indexId}/files/{fileId}/content",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<FileContentResult> fileContent(
      @PathVariable String indexId, @PathVariable String fileId) {
    return ResponseEntity.ok(facade.getFileContent(session, indexId, fileId));
  }

  public record CreateIndexRequest(String name, List<String> fileIds) {}

  public record AddFilesRequest(List<String> fileIds) {}
}
