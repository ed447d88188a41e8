package kb.platform.delivery.web;

import java.util.ArrayList;
import java.util.List;
import kb.core.retrieval.QueryOptions;
import kb.core.retrieval.QueryResult;
import kb.core.session.KnowledgeBaseFacade;
import kb.core.session.KnowledgeBaseSession;
import kb.core.store.CompletionMessage;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class QueryApiController {
  private final KnowledgeBaseFacade facade;
  private final KnowledgeBaseSession session;

  public QueryApiController(KnowledgeBaseFacade facade, KnowledgeBaseSession session) {
    this.facade = facade;
    this.session = session;
  }

  @PostMapping(
      path = "/api/query",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<QueryResult> query(@RequestBody QueryRequest request) {
    QueryRequest body =
        request == null ? new QueryRequest(null, null, null, null, null, null) : request;
    QueryOptions options =
        new QueryOptions(toTurns(body.history()), body.additionalContext(), body.temperature());
    return ResponseEntity.ok(
        facade.query(session, body.query(), body.vectorStoreId(), body.model(), options));
  }

  private static List<CompletionMessage> toTurns(List<HistoryMessage> history) {
    if (history == null) {
      return List.of();
    }
    List<CompletionMessage> turns = new ArrayList<>(history.size());
    for (HistoryMessage message : history) {
      turns.add(message == null ? null : QueryOptions.turn(message.role(), message.content()));
    }
    return turns;
  }

  public record QueryRequest(
      String query,
      String vectorStoreId,
      String model,
      List<HistoryMessage> history,
      String additionalContext,
      Double temperature) {}

  public record HistoryMessage(String role, String content) {}
}
