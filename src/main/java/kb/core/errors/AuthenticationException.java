package kb.core.errors;

public class AuthenticationException extends KnowledgeBaseException {
  public AuthenticationException(String message) {
    super(message);
  }

  public AuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }
}
