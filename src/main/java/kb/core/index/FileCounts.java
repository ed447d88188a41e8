package kb.core.index;

import kb.core.store.RemoteFileCounts;

/** Per-status file counts. {@code total} is always the sum of the four status counts. */
public record FileCounts(long completed, long inProgress, long failed, long cancelled, long total) {
  public FileCounts {
    if (completed < 0 || inProgress < 0 || failed < 0 || cancelled < 0) {
      throw new IllegalArgumentException("File counts must be non-negative.");
    }
    if (total != completed + inProgress + failed + cancelled) {
      throw new IllegalArgumentException("total must equal the sum of the per-status counts.");
    }
  }

  public static FileCounts of(long completed, long inProgress, long failed, long cancelled) {
    return new FileCounts(
        completed, inProgress, failed, cancelled, completed + inProgress + failed + cancelled);
  }

  public static FileCounts empty() {
    return of(0, 0, 0, 0);
  }

  /** The remote total is ignored; indexing systems update it later than the status counts. */
  public static FileCounts fromRemote(RemoteFileCounts counts) {
    if (counts == null) {
      return empty();
    }
    return of(
        Math.max(0, counts.completed()),
        Math.max(0, counts.inProgress()),
        Math.max(0, counts.failed()),
        Math.max(0, counts.cancelled()));
  }
}
