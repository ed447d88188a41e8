package kb.core.files;

import java.time.Instant;

public record UploadedFile(String remoteId, String displayName, long byteSize, Instant uploadedAt) {}
