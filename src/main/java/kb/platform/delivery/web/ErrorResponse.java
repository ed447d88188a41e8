package kb.platform.delivery.web;

public record ErrorResponse(String error) {}
