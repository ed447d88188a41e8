package kb.platform.adapters.openai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.openai.client.OpenAIClient;
import com.openai.errors.UnauthorizedException;
import com.openai.models.models.ModelListParams;
import com.openai.services.blocking.ModelService;
import java.util.ArrayList;
import java.util.List;
import kb.core.errors.AuthenticationException;
import kb.core.errors.RemoteStoreException;
import kb.core.store.RemoteServices;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OpenAIKnowledgeStoreConnectorTest {
  @Mock private OpenAIClient client;
  @Mock private ModelService modelService;

  private final List<String> requestedKeys = new ArrayList<>();
  private OpenAIKnowledgeStoreConnector connector;

  @BeforeEach
  void setUp() {
    connector =
        new OpenAIKnowledgeStoreConnector(
            apiKey -> {
              requestedKeys.add(apiKey);
              return client;
            });
    doReturn(modelService).when(client).models();
  }

  @Test
  void connect_verifiesKeyBeforeReturningBindings() {
    RemoteServices services = connector.connect("sk-live");

    assertEquals(List.of("sk-live"), requestedKeys);
    assertInstanceOf(OpenAIKnowledgeStoreAdapter.class, services.store());
    assertInstanceOf(OpenAIChatCompletionAdapter.class, services.completions());
    verify(client, never()).close();
  }

  @Test
  void connect_reportsRejectedKeyAsAuthenticationFailure() {
    doThrow(mock(UnauthorizedException.class)).when(modelService).list(any(ModelListParams.class));

    assertThrows(AuthenticationException.class, () -> connector.connect("sk-bad"));
    verify(client).close();
  }

  @Test
  void connect_reportsUnreachableServiceAsRemoteFailure() {
    doThrow(new IllegalStateException("timeout")).when(modelService).list(any(ModelListParams.class));

    assertThrows(RemoteStoreException.class, () -> connector.connect("sk-live"));
    verify(client).close();
  }

  @Test
  void connect_keepsReportingCheckFailureWhenCloseAlsoFails() {
    doThrow(new IllegalStateException("timeout")).when(modelService).list(any(ModelListParams.class));
    doThrow(new IllegalStateException("pool busy")).when(client).close();

    RemoteStoreException e =
        assertThrows(RemoteStoreException.class, () -> connector.connect("sk-live"));

    assertEquals("pool busy", e.getSuppressed()[0].getMessage());
  }
}
