package appraiser.adapter.in.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request body for issuing an API key.
 */
public record IssueKeyRequest(
        @NotNull @Size(min = 1, max = 100) String name,
        @Size(max = 500) String description) {}
