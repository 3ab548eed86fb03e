package appraiser.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import appraiser.core.model.auth.SessionToken;

public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn) {

    public static TokenResponse from(SessionToken token) {
        return new TokenResponse(token.token(), SessionToken.TOKEN_TYPE, token.expiresInSeconds());
    }
}
