package appraiser.core.service.auth;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import appraiser.core.model.auth.AuthenticatedCaller;
import appraiser.core.model.auth.SessionToken;
import appraiser.core.model.auth.TokenVerification;
import appraiser.core.port.in.CredentialManagement;
import appraiser.core.port.in.SessionAuthentication;
import appraiser.core.port.out.CredentialRepository;
import appraiser.core.port.out.ServiceMetrics;

/**
 * Exchanges API keys for session tokens and resolves bearer tokens to callers.
 *
 * <p>A token stays cryptographically valid after its key is deactivated or deleted,
 * so every authentication re-reads the key and re-checks that it is usable. All
 * failures collapse to an empty result; the reason is only logged.
 */
@ApplicationScoped
public class SessionAuthenticationService implements SessionAuthentication {

    private static final Logger LOG = Logger.getLogger(SessionAuthenticationService.class);

    private final CredentialManagement credentials;
    private final CredentialRepository repository;
    private final SessionTokenService tokens;
    private final ServiceMetrics metrics;

    @Inject
    public SessionAuthenticationService(
            CredentialManagement credentials,
            CredentialRepository repository,
            SessionTokenService tokens,
            ServiceMetrics metrics) {
        this.credentials = credentials;
        this.repository = repository;
        this.tokens = tokens;
        this.metrics = metrics;
    }

    @Override
    public Uni<Optional<SessionToken>> exchange(String apiKey) {
        return credentials.validate(apiKey).map(match -> {
            metrics.recordTokenExchange(match.isPresent());
            if (match.isEmpty()) {
                LOG.debug("Token exchange rejected: no usable key matched");
                return Optional.empty();
            }
            LOG.infof("Issued session token for key %d", match.get().id());
            return Optional.of(tokens.mint(match.get()));
        });
    }

    @Override
    public Uni<Optional<AuthenticatedCaller>> authenticate(String bearerToken) {
        TokenVerification verification = tokens.verify(bearerToken);
        if (verification instanceof TokenVerification.Invalid invalid) {
            return reject("invalid_token", invalid.reason());
        }

        var claims = ((TokenVerification.Valid) verification).claims();
        return repository.findById(claims.subject()).flatMap(found -> {
            if (found.isEmpty()) {
                return reject("key_missing", "key " + claims.subject() + " no longer exists");
            }
            if (!found.get().isUsable()) {
                return reject("key_not_usable", "key " + claims.subject() + " is " + found.get().state());
            }
            return Uni.createFrom()
                    .item(Optional.of(new AuthenticatedCaller(found.get().id(), found.get().name())));
        });
    }

    private Uni<Optional<AuthenticatedCaller>> reject(String category, String reason) {
        LOG.debugv("Session gate rejected request: {0}", reason);
        metrics.recordGateRejection(category);
        return Uni.createFrom().item(Optional.empty());
    }
}
