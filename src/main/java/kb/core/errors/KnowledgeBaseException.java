package kb.core.errors;

public abstract class KnowledgeBaseException extends RuntimeException {
  protected KnowledgeBaseException(String message) {
    super(message);
  }

  protected KnowledgeBaseException(String message, Throwable cause) {
    super(message, cause);
  }
}
