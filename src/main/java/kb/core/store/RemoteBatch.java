package kb.core.store;

public record RemoteBatch(
    String id, String indexId, String status, RemoteFileCounts fileCounts, long createdAt) {}
