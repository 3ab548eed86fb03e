package appraiser.core.model.auth;

/**
 * Outcome of verifying a session token.
 *
 * <p>Callers must not expose {@link Invalid#reason()} to clients; it exists for logs.
 */
public sealed interface TokenVerification {

    record Valid(SessionClaims claims) implements TokenVerification {}

    record Invalid(String reason) implements TokenVerification {}

    static TokenVerification valid(SessionClaims claims) {
        return new Valid(claims);
    }

    static TokenVerification invalid(String reason) {
        return new Invalid(reason);
    }
}
