package kb.platform.delivery.web;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import kb.core.errors.ValidationException;
import kb.core.session.KnowledgeBaseFacade;
import kb.core.session.KnowledgeBaseSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.multipart.MultipartFile;

@ExtendWith(MockitoExtension.class)
class FilesApiControllerTest {
  @Mock private KnowledgeBaseFacade facade;
  @Mock private MultipartFile file;

  @Test
  void upload_reportsUnreadablePartAsBadInput() throws IOException {
    KnowledgeBaseSession session = new KnowledgeBaseSession();
    FilesApiController controller = new FilesApiController(facade, session);
    doThrow(new IOException("stream closed")).when(file).getBytes();

    ValidationException e = assertThrows(ValidationException.class, () -> controller.upload(file));

    assertTrue(e.getMessage().contains("stream closed"));
    verify(facade, never()).upload(any(), any(), any());
  }
}
