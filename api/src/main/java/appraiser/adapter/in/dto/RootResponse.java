package appraiser.adapter.in.dto;

public record RootResponse(String message, String version, String docs, String health) {}
