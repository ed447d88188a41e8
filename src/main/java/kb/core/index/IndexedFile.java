package kb.core.index;

public record IndexedFile(
    String remoteId, IndexedFileStatus status, String displayName, long byteSize) {}
