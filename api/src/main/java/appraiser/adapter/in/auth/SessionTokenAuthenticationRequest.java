package appraiser.adapter.in.auth;

import io.quarkus.security.identity.request.BaseAuthenticationRequest;

/**
 * Authentication request carrying a bearer session token.
 *
 * <p>Passed from {@link SessionTokenAuthenticationMechanism} to
 * {@link SessionTokenIdentityProvider}.
 */
public class SessionTokenAuthenticationRequest extends BaseAuthenticationRequest {

    private final String token;

    public SessionTokenAuthenticationRequest(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
