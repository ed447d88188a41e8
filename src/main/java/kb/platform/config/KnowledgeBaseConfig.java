package kb.platform.config;

import java.time.Clock;
import kb.core.retrieval.RetrievalSettings;
import kb.core.session.KnowledgeBaseFacade;
import kb.core.session.KnowledgeBaseSession;
import kb.core.store.KnowledgeStoreConnector;
import kb.platform.polling.BatchAwaiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class KnowledgeBaseConfig {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public RetrievalSettings retrievalSettings(
      @Value("${kb.retrieval.defaultModel:" + RetrievalSettings.DEFAULT_MODEL + "}") String defaultModel,
      @Value("${kb.retrieval.topK:10}") int topK,
      @Value("${kb.retrieval.maxContextChars:8000}") int maxContextChars) {
    return new RetrievalSettings(defaultModel, topK, maxContextChars);
  }

  @Bean
  public KnowledgeBaseFacade knowledgeBaseFacade(
      KnowledgeStoreConnector connector, RetrievalSettings retrievalSettings, Clock clock) {
    return new KnowledgeBaseFacade(connector, retrievalSettings, clock);
  }

  /** The HTTP surface serves a single operator, so one session lives for the whole process. */
  @Bean
  public KnowledgeBaseSession knowledgeBaseSession() {
    return new KnowledgeBaseSession();
  }

  @Bean
  public BatchAwaiter batchAwaiter(
      @Value("${kb.polling.intervalMillis:2000}") long intervalMillis,
      @Value("${kb.polling.maxTransientFailures:3}") int maxTransientFailures) {
    return new BatchAwaiter(intervalMillis, maxTransientFailures);
  }
}
