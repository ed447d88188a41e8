package kb.core.store;

public record RemoteIndex(
    String id, String name, String status, RemoteFileCounts fileCounts, long createdAt) {}
