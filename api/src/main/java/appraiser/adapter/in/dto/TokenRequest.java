package appraiser.adapter.in.dto;

import jakarta.validation.constraints.NotNull;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TokenRequest(@JsonProperty("api_key") @NotNull String apiKey) {

    @Override
    public String toString() {
        return "TokenRequest[apiKey=[REDACTED]]";
    }
}
