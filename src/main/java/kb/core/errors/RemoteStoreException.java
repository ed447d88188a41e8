package kb.core.errors;

/** Failure reported by the remote index or completion service. Never retried by the core. */
public class RemoteStoreException extends KnowledgeBaseException {
  public RemoteStoreException(String message) {
    super(message);
  }

  public RemoteStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
