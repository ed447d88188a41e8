package kb.core.errors;

/** The operation requires setup that has not happened yet (credentials, a selected index). */
public class PreconditionException extends KnowledgeBaseException {
  public PreconditionException(String message) {
    super(message);
  }
}
