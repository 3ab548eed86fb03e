package appraiser.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import appraiser.core.model.auth.Credential;

/**
 * Key metadata. Never carries the secret, its hash or its prefix.
 */
public record KeyResponse(
        long id,
        String name,
        String description,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("is_active") boolean isActive,
        @JsonProperty("is_deleted") boolean isDeleted) {

    public static KeyResponse from(Credential credential) {
        return new KeyResponse(
                credential.id(),
                credential.name(),
                credential.description(),
                credential.createdAt(),
                credential.updatedAt(),
                credential.isUsable(),
                credential.isDeleted());
    }
}
