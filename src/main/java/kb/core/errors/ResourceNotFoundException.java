package kb.core.errors;

public class ResourceNotFoundException extends KnowledgeBaseException {
  private final String resourceId;

  public ResourceNotFoundException(String resourceId, String message) {
    super(message);
    this.resourceId = resourceId;
  }

  public ResourceNotFoundException(String resourceId, String message, Throwable cause) {
    super(message, cause);
    this.resourceId = resourceId;
  }

  public String resourceId() {
    return resourceId;
  }
}
