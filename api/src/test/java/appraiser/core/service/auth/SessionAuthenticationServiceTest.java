package appraiser.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import appraiser.adapter.out.storage.memory.InMemoryCredentialRepository;
import appraiser.adapter.out.storage.memory.InMemoryPredictionLogRepository;
import appraiser.adapter.out.telemetry.MicrometerServiceMetrics;

@DisplayName("SessionAuthenticationService")
class SessionAuthenticationServiceTest {

    private SimpleMeterRegistry registry;
    private CredentialService credentials;
    private SessionTokenService tokens;
    private SessionAuthenticationService sessions;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        var metrics = new MicrometerServiceMetrics(registry, true);
        var repository = new InMemoryCredentialRepository(new InMemoryPredictionLogRepository());
        credentials = new CredentialService(repository, new ReversibleHasher(), metrics);
        tokens = new SessionTokenService(
                SessionTokenServiceTest.config("unit-test-signing-secret-0123456789", Duration.ofMinutes(30)));
        sessions = new SessionAuthenticationService(credentials, repository, tokens, metrics);
    }

    @Nested
    @DisplayName("exchange")
    class ExchangeTests {

        @Test
        @DisplayName("should mint a bearer token for a valid key")
        void shouldMintToken() {
            var issued = credentials.issue("Test Key", null).await().indefinitely();

            var token = sessions.exchange(issued.plaintext()).await().indefinitely();

            assertTrue(token.isPresent());
            assertEquals(1800, token.get().expiresInSeconds());
            assertEquals(
                    1.0,
                    registry.get("appraiser.auth.token.exchanges")
                            .tag("outcome", "success")
                            .counter()
                            .count());
        }

        @Test
        @DisplayName("should refuse an unknown key")
        void shouldRefuseUnknownKey() {
            var token = sessions.exchange(CredentialService.generateSecret()).await().indefinitely();

            assertTrue(token.isEmpty());
            assertEquals(
                    1.0,
                    registry.get("appraiser.auth.token.exchanges")
                            .tag("outcome", "failure")
                            .counter()
                            .count());
        }
    }

    @Nested
    @DisplayName("authenticate")
    class AuthenticateTests {

        @Test
        @DisplayName("should resolve the caller behind a valid token")
        void shouldResolveCaller() {
            var issued = credentials.issue("caller", null).await().indefinitely();
            var token = sessions.exchange(issued.plaintext()).await().indefinitely().orElseThrow();

            var caller = sessions.authenticate(token.token()).await().indefinitely();

            assertEquals(issued.credential().id(), caller.orElseThrow().id());
            assertEquals("caller", caller.get().name());
        }

        @Test
        @DisplayName("should reject a still-valid token once its key is deactivated")
        void shouldRecheckKeyLiveness() {
            var issued = credentials.issue("revoked", null).await().indefinitely();
            var token = sessions.exchange(issued.plaintext()).await().indefinitely().orElseThrow();

            credentials.deactivate(issued.credential().id()).await().indefinitely();

            assertTrue(sessions.authenticate(token.token()).await().indefinitely().isEmpty());
            assertEquals(
                    1.0,
                    registry.get("appraiser.auth.gate.rejections")
                            .tag("reason", "key_not_usable")
                            .counter()
                            .count());
        }

        @Test
        @DisplayName("should reject a token whose key was removed")
        void shouldRejectRemovedKey() {
            var issued = credentials.issue("removed", null).await().indefinitely();
            var token = sessions.exchange(issued.plaintext()).await().indefinitely().orElseThrow();

            credentials.delete(issued.credential().id(), true).await().indefinitely();

            assertTrue(sessions.authenticate(token.token()).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should reject expired and malformed tokens")
        void shouldRejectInvalidTokens() {
            var expired = tokens.mint(1, "expired", Duration.ZERO);

            assertTrue(sessions.authenticate(expired.token()).await().indefinitely().isEmpty());
            assertTrue(sessions.authenticate("garbage").await().indefinitely().isEmpty());
            assertEquals(
                    2.0,
                    registry.get("appraiser.auth.gate.rejections")
                            .tag("reason", "invalid_token")
                            .counter()
                            .count());
        }
    }
}
