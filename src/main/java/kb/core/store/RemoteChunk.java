package kb.core.store;

public record RemoteChunk(String fileId, String filename, double score, String text) {}
