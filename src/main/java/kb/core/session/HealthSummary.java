package kb.core.session;

public record HealthSummary(
    String status, boolean apiConfigured, String currentIndexId, int filesUploaded) {}
