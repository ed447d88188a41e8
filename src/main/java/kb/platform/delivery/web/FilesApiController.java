package kb.platform.delivery.web;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import kb.core.errors.ValidationException;
import kb.core.files.UploadedFile;
import kb.core.session.KnowledgeBaseFacade;
import kb.core.session.KnowledgeBaseSession;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
public class FilesApiController {
  private final KnowledgeBaseFacade facade;
  private final KnowledgeBaseSession session;

  public FilesApiController(KnowledgeBaseFacade facade, KnowledgeBaseSession session) {
    this.facade = facade;
    this.session = session;
  }

  @PostMapping(
      path = "/api/upload",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<UploadedFile> upload(@RequestPart("file") MultipartFile file) {
    byte[] content;
    try {
      content = file.getBytes();
    } catch (IOException e) {
      throw new ValidationException("Failed to read uploaded file: " + e.getMessage(), e);
    }
    return ResponseEntity.ok(facade.upload(session, content, file.getOriginalFilename()));
  }

  @GetMapping(path = "/api/files", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<UploadedFile>> listFiles() {
    return ResponseEntity.ok(facade.listFiles(session));
  }

  @DeleteMapping(path = "/api/files/{fileId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, String>> deleteFile(@PathVariable String fileId) {
    facade.deleteFile(session, fileId);
    return ResponseEntity.ok(Map.of("deleted", fileId));
  }
}
