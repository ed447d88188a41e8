package kb.platform.delivery.web;

import kb.core.session.HealthSummary;
import kb.core.session.KnowledgeBaseFacade;
import kb.core.session.KnowledgeBaseSession;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
  private final KnowledgeBaseFacade facade;
  private final KnowledgeBaseSession session;

  public HealthController(KnowledgeBaseFacade facade, KnowledgeBaseSession session) {
    this.facade = facade;
    this.session = session;
  }

  @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<HealthSummary> health() {
    return ResponseEntity.ok(facade.health(session));
  }
}
