package kb.core.batch;

import kb.core.store.RemoteStatus;

public enum BatchStatus {
  QUEUED,
  IN_PROGRESS,
  COMPLETED,
  FAILED,
  CANCELLED,
  EXPIRED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED || this == EXPIRED;
  }

  /** Unknown or missing remote values are treated as still running. */
  public static BatchStatus fromRemote(String remoteStatus) {
    String status = RemoteStatus.normalize(remoteStatus);
    if (status == null) {
      return IN_PROGRESS;
    }
    return switch (status) {
      case "queued", "pending" -> QUEUED;
      case "completed", "succeeded" -> COMPLETED;
      case "failed", "error" -> FAILED;
      case "cancelled", "canceled", "cancelling" -> CANCELLED;
      case "expired" -> EXPIRED;
      default -> IN_PROGRESS;
    };
  }
}
