package appraiser.core.service.auth;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import appraiser.core.config.TokenConfig;
import appraiser.core.model.auth.TokenVerification;

@DisplayName("SessionTokenService")
class SessionTokenServiceTest {

    private static final String SECRET = "unit-test-signing-secret-0123456789";

    private SessionTokenService service;

    static TokenConfig config(String secret, Duration ttl) {
        return new TokenConfig() {
            @Override
            public String secret() {
                return secret;
            }

            @Override
            public Duration ttl() {
                return ttl;
            }

            @Override
            public String issuer() {
                return "appraiser";
            }
        };
    }

    @BeforeEach
    void setUp() {
        service = new SessionTokenService(config(SECRET, Duration.ofMinutes(30)));
    }

    @Nested
    @DisplayName("mint and verify")
    class MintVerifyTests {

        @Test
        @DisplayName("should verify a freshly minted token")
        void shouldVerifyFreshToken() {
            var token = service.mint(42, "Test Key", Duration.ofMinutes(30));

            var verification = service.verify(token.token());

            assertThat(verification, instanceOf(TokenVerification.Valid.class));
            var claims = ((TokenVerification.Valid) verification).claims();
            assertEquals(42, claims.subject());
            assertEquals("Test Key", claims.name());
            assertEquals(token.expiresAt(), claims.expiresAt());
            assertEquals(1800, token.expiresInSeconds());
        }

        @Test
        @DisplayName("should treat a zero lifetime token as expired")
        void shouldExpireZeroTtlToken() {
            var token = service.mint(7, "short-lived", Duration.ZERO);

            var verification = service.verify(token.token());

            assertThat(verification, instanceOf(TokenVerification.Invalid.class));
            assertEquals("expired", ((TokenVerification.Invalid) verification).reason());
        }

        @Test
        @DisplayName("should reject a token with a modified payload")
        void shouldRejectTamperedToken() {
            var token = service.mint(1, "victim", Duration.ofMinutes(5)).token();
            String[] parts = token.split("\\.");
            var forged = service.mint(2, "attacker", Duration.ofMinutes(5)).token().split("\\.");

            String tampered = parts[0] + "." + forged[1] + "." + parts[2];

            assertThat(service.verify(tampered), instanceOf(TokenVerification.Invalid.class));
        }

        @Test
        @DisplayName("should reject a token signed with another secret")
        void shouldRejectForeignSecret() {
            var other = new SessionTokenService(config("another-signing-secret-abcdefghijklmno", Duration.ofMinutes(5)));
            var foreign = other.mint(1, "foreign", Duration.ofMinutes(5)).token();

            assertThat(service.verify(foreign), instanceOf(TokenVerification.Invalid.class));
        }

        @Test
        @DisplayName("should reject malformed input")
        void shouldRejectMalformedInput() {
            assertThat(service.verify(null), instanceOf(TokenVerification.Invalid.class));
            assertThat(service.verify(""), instanceOf(TokenVerification.Invalid.class));
            assertThat(service.verify("not-a-token"), instanceOf(TokenVerification.Invalid.class));
            assertThat(service.verify("a.b.c"), instanceOf(TokenVerification.Invalid.class));
        }

        @Test
        @DisplayName("should use the configured lifetime for credentials")
        void shouldUseConfiguredTtl() {
            Instant before = Instant.now();
            var token = service.mint(3, "configured", service.ttl());

            assertFalse(token.expiresAt().isBefore(before.plus(Duration.ofMinutes(30)).minusSeconds(1)));
            assertTrue(token.toString().contains("REDACTED"));
        }
    }

    @Nested
    @DisplayName("configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("should refuse a secret shorter than 32 bytes")
        void shouldRefuseShortSecret() {
            assertThrows(
                    SessionTokenService.TokenSigningException.class,
                    () -> new SessionTokenService(config("too-short", Duration.ofMinutes(1))));
        }

        @Test
        @DisplayName("should refuse a missing secret")
        void shouldRefuseMissingSecret() {
            assertThrows(
                    SessionTokenService.TokenSigningException.class,
                    () -> new SessionTokenService(config(null, Duration.ofMinutes(1))));
        }
    }
}
