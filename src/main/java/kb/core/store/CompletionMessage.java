package kb.core.store;

public record CompletionMessage(Role role, String content) {
  public static CompletionMessage system(String content) {
    return new CompletionMessage(Role.SYSTEM, content);
  }

  public static CompletionMessage user(String content) {
    return new CompletionMessage(Role.USER, content);
  }

  public static CompletionMessage assistant(String content) {
    return new CompletionMessage(Role.ASSISTANT, content);
  }

  public enum Role {
    SYSTEM,
    USER,
    ASSISTANT
  }
}
