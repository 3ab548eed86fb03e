package appraiser.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import appraiser.core.model.auth.AuthenticatedCaller;
import appraiser.core.model.auth.SessionToken;

/**
 * Port interface for session token exchange and the per-request gate.
 */
public interface SessionAuthentication {

    /**
     * Exchange an API key for a session token.
     *
     * @param apiKey the plaintext key
     * @return Uni with the minted token, or empty if the key is not valid
     */
    Uni<Optional<SessionToken>> exchange(String apiKey);

    /**
     * Resolve the caller behind a bearer token.
     *
     * <p>Verifies the token and re-checks that its key is still usable.
     *
     * @param bearerToken the compact token
     * @return Uni with the caller, or empty for any failure
     */
    Uni<Optional<AuthenticatedCaller>> authenticate(String bearerToken);
}
