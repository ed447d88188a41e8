package kb.core.index;

/**
 * Outcome of a content fetch. Files the remote store cannot return as plain text are a normal
 * outcome reported with {@code success=false} and a message suitable for display.
 */
public record FileContentResult(
    boolean success, String fileId, String filename, String content, String message) {
  public static FileContentResult retrieved(String fileId, String filename, String content) {
    return new FileContentResult(true, fileId, filename, content, null);
  }

  public static FileContentResult notRetrievable(String fileId, String filename, String message) {
    return new FileContentResult(false, fileId, filename, null, message);
  }
}
