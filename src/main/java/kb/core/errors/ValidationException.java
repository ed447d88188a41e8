package kb.core.errors;

/** Bad caller input: blank names, missing ids, empty questions. */
public class ValidationException extends KnowledgeBaseException {
  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
