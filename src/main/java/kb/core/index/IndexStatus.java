package kb.core.index;

import kb.core.batch.Batch;
import kb.core.batch.BatchStatus;
import kb.core.store.RemoteStatus;

public enum IndexStatus {
  EMPTY,
  INDEXING,
  READY,
  ERROR;

  /**
   * Derives the canonical status from the remote index status and its current file counts.
   * A partially failed index stays READY; the failures remain visible through the counts.
   */
  public static IndexStatus derive(String remoteStatus, FileCounts counts) {
    String status = RemoteStatus.normalize(remoteStatus);
    FileCounts safeCounts = counts == null ? FileCounts.empty() : counts;

    if ("expired".equals(status)) {
      return ERROR;
    }
    if (safeCounts.inProgress() > 0 || "in_progress".equals(status)) {
      return INDEXING;
    }
    if (safeCounts.total() == 0) {
      return EMPTY;
    }
    if (safeCounts.completed() == 0 && safeCounts.failed() > 0) {
      return ERROR;
    }
    return READY;
  }

  /**
   * Same as {@link #derive(String, FileCounts)}, but a most recent batch that ended as failed or
   * expired without indexing a single file turns an otherwise settled index into ERROR. Adding
   * files again moves it back to INDEXING.
   */
  public static IndexStatus derive(String remoteStatus, FileCounts counts, Batch latestBatch) {
    IndexStatus status = derive(remoteStatus, counts);
    if (status == INDEXING || latestBatch == null || !latestBatch.isComplete()) {
      return status;
    }
    boolean batchFailed =
        latestBatch.status() == BatchStatus.FAILED || latestBatch.status() == BatchStatus.EXPIRED;
    long batchCompleted =
        latestBatch.fileCounts() == null ? 0 : latestBatch.fileCounts().completed();
    return batchFailed && batchCompleted == 0 ? ERROR : status;
  }
}
