package kb.platform.config;

import java.time.Duration;
import kb.core.store.KnowledgeStoreConnector;
import kb.platform.adapters.openai.OpenAIKnowledgeStoreConnector;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("!test & !local")
public class OpenAIConfig {
  @Bean
  public KnowledgeStoreConnector openAiKnowledgeStoreConnector(
      @Value("${kb.openai.timeoutSeconds:60}") long timeoutSeconds) {
    return new OpenAIKnowledgeStoreConnector(Duration.ofSeconds(Math.max(1, timeoutSeconds)));
  }
}
