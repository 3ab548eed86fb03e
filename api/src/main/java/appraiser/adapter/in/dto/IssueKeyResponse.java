package appraiser.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import appraiser.core.model.auth.CredentialIssueResult;

/**
 * Response for a newly issued key. {@code key} is the only time the secret is disclosed.
 */
public record IssueKeyResponse(
        long id,
        String name,
        String key,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("is_active") boolean isActive) {

    public static IssueKeyResponse from(CredentialIssueResult result) {
        var credential = result.credential();
        return new IssueKeyResponse(
                credential.id(), credential.name(), result.plaintext(), credential.createdAt(), credential.isUsable());
    }
}
