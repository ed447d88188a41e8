package kb.core.store;

public record RemoteIndexFile(String fileId, String status, long usageBytes, String lastError) {}
