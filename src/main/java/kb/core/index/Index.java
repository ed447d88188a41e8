package kb.core.index;

import java.time.Instant;

public record Index(
    String id, String name, IndexStatus status, FileCounts fileCounts, Instant createdAt) {}
