package kb.platform.adapters.openai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.openai.client.OpenAIClient;
import com.openai.errors.PermissionDeniedException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessage;
import com.openai.services.blocking.ChatService;
import com.openai.services.blocking.chat.ChatCompletionService;
import java.util.List;
import java.util.Optional;
import kb.core.errors.AuthenticationException;
import kb.core.store.CompletionMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OpenAIChatCompletionAdapterTest {
  @Mock private OpenAIClient client;
  @Mock private ChatService chatService;
  @Mock private ChatCompletionService completionService;

  private OpenAIChatCompletionAdapter adapter;

  @BeforeEach
  void setUp() {
    doReturn(chatService).when(client).chat();
    doReturn(completionService).when(chatService).completions();
    adapter = new OpenAIChatCompletionAdapter(client);
  }

  @Test
  void complete_sendsMessagesInOrderAndReturnsFirstChoice() {
    ChatCompletion completion = mock(ChatCompletion.class);
    ChatCompletion.Choice choice = mock(ChatCompletion.Choice.class);
    ChatCompletionMessage message = mock(ChatCompletionMessage.class);
    doReturn(List.of(choice)).when(completion).choices();
    doReturn(message).when(choice).message();
    doReturn(Optional.of("Everything is covered.")).when(message).content();
    ArgumentCaptor<ChatCompletionCreateParams> captor =
        ArgumentCaptor.forClass(ChatCompletionCreateParams.class);
    doReturn(completion).when(completionService).create(captor.capture());

    String answer =
        adapter.complete(
            "gpt-4.1-mini",
            List.of(
                CompletionMessage.system("rules"),
                CompletionMessage.system("context"),
                CompletionMessage.user("what is covered?")),
            null);

    assertEquals("Everything is covered.", answer);
    ChatCompletionCreateParams params = captor.getValue();
    assertEquals(3, params.messages().size());
    assertEquals(true, params.messages().get(0).isSystem());
    assertEquals(true, params.messages().get(2).isUser());
    assertTrue(params.temperature().isEmpty());
  }

  @Test
  void complete_sendsAssistantTurnsAndTemperature() {
    ChatCompletion completion = mock(ChatCompletion.class);
    doReturn(List.of()).when(completion).choices();
    ArgumentCaptor<ChatCompletionCreateParams> captor =
        ArgumentCaptor.forClass(ChatCompletionCreateParams.class);
    doReturn(completion).when(completionService).create(captor.capture());

    String answer =
        adapter.complete(
            "gpt-4.1-mini",
            List.of(
                CompletionMessage.system("rules"),
                CompletionMessage.user("return policy?"),
                CompletionMessage.assistant("30 days."),
                CompletionMessage.user("and abroad?")),
            0.3);

    assertEquals("", answer);
    ChatCompletionCreateParams params = captor.getValue();
    assertTrue(params.messages().get(2).isAssistant());
    assertEquals(Optional.of(0.3), params.temperature());
  }

  @Test
  void complete_translatesPermissionFailures() {
    doThrow(mock(PermissionDeniedException.class))
        .when(completionService)
        .create(any(ChatCompletionCreateParams.class));

    assertThrows(
        AuthenticationException.class,
        () -> adapter.complete("gpt-4.1-mini", List.of(CompletionMessage.user("hi")), null));
  }
}
