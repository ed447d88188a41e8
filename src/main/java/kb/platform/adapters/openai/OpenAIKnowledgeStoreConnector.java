package kb.platform.adapters.openai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.errors.PermissionDeniedException;
import com.openai.errors.UnauthorizedException;
import com.openai.models.models.ModelListParams;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import kb.core.errors.AuthenticationException;
import kb.core.errors.RemoteStoreException;
import kb.core.store.KnowledgeStoreConnector;
import kb.core.store.RemoteServices;

/**
 * Builds an OpenAI client for a key and lists models once to prove the key works. SDK retries
 * are disabled so every failure reaches the caller after one attempt.
 */
public class OpenAIKnowledgeStoreConnector implements KnowledgeStoreConnector {
  private final Function<String, OpenAIClient> clientFactory;

  public OpenAIKnowledgeStoreConnector(Duration timeout) {
    this(
        apiKey ->
            OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .maxRetries(0)
                .timeout(Objects.requireNonNull(timeout, "timeout must not be null."))
                .build());
  }

  OpenAIKnowledgeStoreConnector(Function<String, OpenAIClient> clientFactory) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory must not be null.");
  }

  @Override
  public RemoteServices connect(String apiKey) {
    OpenAIClient client = clientFactory.apply(apiKey);
    try {
      client.models().list(ModelListParams.builder().build());
    } catch (UnauthorizedException | PermissionDeniedException e) {
      throw closeAfter(
          client, new AuthenticationException("Invalid API key: " + e.getMessage(), e));
    } catch (RuntimeException e) {
      throw closeAfter(
          client, new RemoteStoreException("Could not reach OpenAI: " + e.getMessage(), e));
    }
    return new RemoteServices(
        new OpenAIKnowledgeStoreAdapter(client), new OpenAIChatCompletionAdapter(client));
  }

  /** A client whose key check failed is never handed out, so its connection pool is released. */
  private static RuntimeException closeAfter(OpenAIClient client, RuntimeException failure) {
    try {
      client.close();
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
    }
    return failure;
  }
}
