package appraiser.adapter.in.dto;

public record MessageResponse(String message) {}
