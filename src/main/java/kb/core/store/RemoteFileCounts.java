package kb.core.store;

public record RemoteFileCounts(
    long completed, long inProgress, long failed, long cancelled, long total) {
  public static RemoteFileCounts none() {
    return new RemoteFileCounts(0, 0, 0, 0, 0);
  }
}
