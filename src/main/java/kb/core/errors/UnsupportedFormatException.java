package kb.core.errors;

public class UnsupportedFormatException extends KnowledgeBaseException {
  private final String filename;

  public UnsupportedFormatException(String filename, String message) {
    super(message);
    this.filename = filename;
  }

  public String filename() {
    return filename;
  }
}
