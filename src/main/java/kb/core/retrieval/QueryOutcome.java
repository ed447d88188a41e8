package kb.core.retrieval;

public enum QueryOutcome {
  ANSWERED,
  NO_CONTEXT
}
