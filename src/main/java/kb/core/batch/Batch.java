package kb.core.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import kb.core.index.FileCounts;

public record Batch(
    String id, String indexId, BatchStatus status, FileCounts fileCounts, Instant createdAt) {

  @JsonProperty("complete")
  public boolean isComplete() {
    return status != null && status.isTerminal();
  }

  @JsonProperty("outcome")
  public BatchOutcome outcome() {
    if (!isComplete()) {
      return BatchOutcome.PENDING;
    }
    FileCounts counts = fileCounts == null ? FileCounts.empty() : fileCounts;
    return switch (status) {
      case COMPLETED -> counts.failed() > 0 || counts.cancelled() > 0
          ? BatchOutcome.COMPLETED_WITH_ERRORS
          : BatchOutcome.SUCCEEDED;
      case FAILED -> counts.completed() > 0
          ? BatchOutcome.COMPLETED_WITH_ERRORS
          : BatchOutcome.FAILED;
      case CANCELLED -> BatchOutcome.CANCELLED;
      case EXPIRED -> BatchOutcome.EXPIRED;
      default -> BatchOutcome.PENDING;
    };
  }
}
