package kb.core.index;

import kb.core.store.RemoteStatus;

public enum IndexedFileStatus {
  QUEUED,
  PROCESSING,
  COMPLETED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  public static IndexedFileStatus fromRemote(String remoteStatus) {
    String status = RemoteStatus.normalize(remoteStatus);
    if (status == null) {
      return PROCESSING;
    }
    return switch (status) {
      case "completed", "ready", "succeeded" -> COMPLETED;
      case "failed", "error" -> FAILED;
      case "cancelled", "canceled" -> CANCELLED;
      case "queued", "pending" -> QUEUED;
      default -> PROCESSING;
    };
  }
}
