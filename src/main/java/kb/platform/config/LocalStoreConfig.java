package kb.platform.config;

import java.time.Clock;
import kb.core.store.KnowledgeStoreConnector;
import kb.platform.adapters.local.InMemoryKnowledgeStoreAdapter;
import kb.platform.adapters.local.InMemoryKnowledgeStoreConnector;
import kb.platform.adapters.local.LocalCompletionAdapter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile({"test", "local"})
public class LocalStoreConfig {
  @Bean
  public InMemoryKnowledgeStoreAdapter inMemoryKnowledgeStore(
      @Value("${kb.local.pollsToComplete:2}") int pollsToComplete, Clock clock) {
    return new InMemoryKnowledgeStoreAdapter(pollsToComplete, clock);
  }

  @Bean
  public LocalCompletionAdapter localCompletionAdapter(
      @Value("${kb.local.failCompletions:false}") boolean failCompletions) {
    return new LocalCompletionAdapter(failCompletions);
  }

  @Bean
  public KnowledgeStoreConnector localKnowledgeStoreConnector(
      @Value("${kb.local.validKeyPrefix:sk-}") String validKeyPrefix,
      InMemoryKnowledgeStoreAdapter store,
      LocalCompletionAdapter completions) {
    return new InMemoryKnowledgeStoreConnector(validKeyPrefix, store, completions);
  }
}
