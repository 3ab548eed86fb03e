package appraiser.adapter.in.auth;

import java.security.Principal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.IdentityProvider;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;

import appraiser.core.model.auth.AuthenticatedCaller;
import appraiser.core.port.in.SessionAuthentication;

/**
 * Quarkus identity provider resolving session tokens to callers.
 *
 * <p>The resulting {@link SecurityIdentity} carries a {@link CallerPrincipal} and the
 * {@link AuthenticatedCaller} under the {@value #CALLER_ATTRIBUTE} attribute. Every
 * failure is reported the same way.
 */
@ApplicationScoped
public class SessionTokenIdentityProvider implements IdentityProvider<SessionTokenAuthenticationRequest> {

    public static final String CALLER_ATTRIBUTE = "caller";
    static final String FAILURE_MESSAGE = "Could not validate credentials";

    private final SessionAuthentication sessionAuthentication;

    @Inject
    public SessionTokenIdentityProvider(SessionAuthentication sessionAuthentication) {
        this.sessionAuthentication = sessionAuthentication;
    }

    @Override
    public Class<SessionTokenAuthenticationRequest> getRequestType() {
        return SessionTokenAuthenticationRequest.class;
    }

    @Override
    public Uni<SecurityIdentity> authenticate(
            SessionTokenAuthenticationRequest request, AuthenticationRequestContext context) {
        return sessionAuthentication
                .authenticate(request.getToken())
                .map(caller -> caller.orElseThrow(() -> new AuthenticationFailedException(FAILURE_MESSAGE)))
                .map(SessionTokenIdentityProvider::buildIdentity);
    }

    static SecurityIdentity buildIdentity(AuthenticatedCaller caller) {
        return QuarkusSecurityIdentity.builder()
                .setPrincipal(new CallerPrincipal(caller.id(), caller.name()))
                .addAttribute(CALLER_ATTRIBUTE, caller)
                .build();
    }

    /**
     * Resolve the caller from an authenticated identity.
     *
     * @param identity the current identity
     * @return the caller
     * @throws AuthenticationFailedException if the identity was not produced by this provider
     */
    public static AuthenticatedCaller callerOf(SecurityIdentity identity) {
        AuthenticatedCaller caller = identity.getAttribute(CALLER_ATTRIBUTE);
        if (caller == null) {
            throw new AuthenticationFailedException(FAILURE_MESSAGE);
        }
        return caller;
    }

    /**
     * Principal for a caller authenticated by session token.
     */
    public static class CallerPrincipal implements Principal {
        private final long keyId;
        private final String name;

        public CallerPrincipal(long keyId, String name) {
            this.keyId = keyId;
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        public long getKeyId() {
            return keyId;
        }
    }
}
