package kb.core.batch;

/** How a batch ended, as seen by callers. Partial failures are not errors. */
public enum BatchOutcome {
  PENDING,
  SUCCEEDED,
  COMPLETED_WITH_ERRORS,
  FAILED,
  CANCELLED,
  EXPIRED
}
