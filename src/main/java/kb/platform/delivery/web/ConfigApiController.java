package kb.platform.delivery.web;

import java.util.Map;
import kb.core.session.KnowledgeBaseFacade;
import kb.core.session.KnowledgeBaseSession;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigApiController {
  private final KnowledgeBaseFacade facade;
  private final KnowledgeBaseSession session;

  public ConfigApiController(KnowledgeBaseFacade facade, KnowledgeBaseSession session) {
    this.facade = facade;
    this.session = session;
  }

  @PostMapping(
      path = "/api/config",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> configure(@RequestBody ConfigRequest request) {
    facade.configure(session, request == null ? null : request.apiKey());
    return ResponseEntity.ok(Map.of("success", true, "message", "API key configured"));
  }

  public record ConfigRequest(String apiKey) {}
}
