package kb.core.retrieval;

public record RetrievalSettings(String defaultModel, int topK, int maxContextChars) {
  public static final String DEFAULT_MODEL = "gpt-4.1-mini";
  public static final int DEFAULT_TOP_K = 10;
  public static final int DEFAULT_MAX_CONTEXT_CHARS = 8000;

  public RetrievalSettings {
    if (defaultModel == null || defaultModel.isBlank()) {
      defaultModel = DEFAULT_MODEL;
    }
    if (topK <= 0) {
      topK = DEFAULT_TOP_K;
    }
    if (maxContextChars <= 0) {
      maxContextChars = DEFAULT_MAX_CONTEXT_CHARS;
    }
  }

  public static RetrievalSettings defaults() {
    return new RetrievalSettings(DEFAULT_MODEL, DEFAULT_TOP_K, DEFAULT_MAX_CONTEXT_CHARS);
  }
}
