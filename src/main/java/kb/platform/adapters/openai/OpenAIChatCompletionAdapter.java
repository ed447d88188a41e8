package kb.platform.adapters.openai;

import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionAssistantMessageParam;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import java.util.List;
import java.util.Objects;
import kb.core.store.CompletionMessage;
import kb.core.store.CompletionPort;

public class OpenAIChatCompletionAdapter implements CompletionPort {
  private final OpenAIClient client;

  public OpenAIChatCompletionAdapter(OpenAIClient client) {
    this.client = Objects.requireNonNull(client, "client must not be null.");
  }

  @Override
  public String complete(String model, List<CompletionMessage> messages, Double temperature) {
    ChatCompletionCreateParams.Builder builder = ChatCompletionCreateParams.builder().model(model);
    for (CompletionMessage message : messages) {
      switch (message.role()) {
        case SYSTEM -> builder.addSystemMessage(message.content());
        case USER -> builder.addUserMessage(message.content());
        case ASSISTANT -> builder.addMessage(
            ChatCompletionAssistantMessageParam.builder().content(message.content()).build());
      }
    }
    if (temperature != null) {
      builder.temperature(temperature);
    }

    ChatCompletion completion;
    try {
      completion = client.chat().completions().create(builder.build());
    } catch (RuntimeException e) {
      throw OpenAIKnowledgeStoreAdapter.translate("generate completion with " + model, model, e);
    }

    return completion.choices().stream()
        .findFirst()
        .flatMap(choice -> choice.message().content())
        .orElse("");
  }
}
