package kb.core.store;

public record RemoteFile(String id, String filename, long bytes, long createdAt) {}
