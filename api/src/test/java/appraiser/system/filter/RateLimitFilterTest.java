package appraiser.system.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import jakarta.ws.rs.container.ContainerRequestContext;

import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import appraiser.core.model.ratelimit.RateLimitCategory;
import appraiser.core.service.common.TrustedProxyValidator;

@DisplayName("RateLimitFilter")
class RateLimitFilterTest {

    @Nested
    @DisplayName("categorize")
    class CategorizeTests {

        @Test
        @DisplayName("should give anonymous auth endpoints their own budgets")
        void shouldCategorizeAuthEndpoints() {
            assertEquals(
                    Optional.of(RateLimitCategory.KEY_ISSUANCE), RateLimitFilter.categorize("POST", "/auth/keys"));
            assertEquals(
                    Optional.of(RateLimitCategory.KEY_ISSUANCE), RateLimitFilter.categorize("POST", "/auth/keys/"));
            assertEquals(
                    Optional.of(RateLimitCategory.TOKEN_EXCHANGE), RateLimitFilter.categorize("POST", "/auth/token"));
        }

        @Test
        @DisplayName("should treat prediction endpoints as general traffic")
        void shouldCategorizePredictions() {
            assertEquals(Optional.of(RateLimitCategory.GENERAL), RateLimitFilter.categorize("POST", "/predict"));
            assertEquals(Optional.of(RateLimitCategory.GENERAL), RateLimitFilter.categorize("POST", "/predict/batch"));
        }

        @Test
        @DisplayName("should leave other endpoints unthrottled")
        void shouldSkipOtherEndpoints() {
            assertTrue(RateLimitFilter.categorize("GET", "/auth/keys").isEmpty());
            assertTrue(RateLimitFilter.categorize("GET", "/health").isEmpty());
            assertTrue(RateLimitFilter.categorize("GET", "/logs").isEmpty());
            assertTrue(RateLimitFilter.categorize("GET", "/predictions").isEmpty());
        }
    }

    @Nested
    @DisplayName("parseForwardedFor")
    class ForwardedTests {

        @Test
        @DisplayName("should take the first hop and strip ports")
        void shouldParseIpv4() {
            assertEquals("192.0.2.60", RateLimitFilter.parseForwardedFor("for=192.0.2.60;proto=http;by=203.0.113.43"));
            assertEquals("192.0.2.60", RateLimitFilter.parseForwardedFor("for=\"192.0.2.60:4711\", for=198.51.100.17"));
        }

        @Test
        @DisplayName("should unwrap bracketed IPv6 addresses")
        void shouldParseIpv6() {
            assertEquals("2001:db8:cafe::17", RateLimitFilter.parseForwardedFor("For=\"[2001:db8:cafe::17]:4711\""));
        }

        @Test
        @DisplayName("should return null without a for directive")
        void shouldHandleMissingFor() {
            assertNull(RateLimitFilter.parseForwardedFor("proto=https;by=203.0.113.43"));
        }
    }

    @Nested
    @DisplayName("extractClientIp")
    class ClientIpTests {

        private ContainerRequestContext ctx;
        private HttpServerRequest request;

        @BeforeEach
        void setUp() {
            ctx = mock(ContainerRequestContext.class);
            request = mock(HttpServerRequest.class);
            when(ctx.getHeaderString("X-Forwarded-For")).thenReturn("203.0.113.7, 10.0.0.9");
            when(ctx.getHeaderString("Forwarded")).thenReturn(null);
        }

        private void peer(String host) {
            when(request.remoteAddress()).thenReturn(SocketAddress.inetSocketAddress(40000, host));
        }

        @Test
        @DisplayName("should use the peer address when no proxies are trusted")
        void shouldIgnoreHeadersByDefault() {
            peer("192.0.2.10");

            assertEquals(
                    "192.0.2.10", RateLimitFilter.extractClientIp(ctx, request, new TrustedProxyValidator(List.of())));
        }

        @Test
        @DisplayName("should use the peer address when it is not a listed proxy")
        void shouldIgnoreHeadersFromUnlistedPeer() {
            peer("192.0.2.10");

            assertEquals(
                    "192.0.2.10",
                    RateLimitFilter.extractClientIp(ctx, request, new TrustedProxyValidator(List.of("10.0.0.0/8"))));
        }

        @Test
        @DisplayName("should believe X-Forwarded-For from a trusted proxy")
        void shouldUseForwardedForFromTrustedProxy() {
            peer("10.1.2.3");

            assertEquals(
                    "203.0.113.7",
                    RateLimitFilter.extractClientIp(ctx, request, new TrustedProxyValidator(List.of("10.0.0.0/8"))));
        }

        @Test
        @DisplayName("should prefer Forwarded over X-Forwarded-For from a trusted proxy")
        void shouldPreferForwardedHeader() {
            peer("10.1.2.3");
            when(ctx.getHeaderString("Forwarded")).thenReturn("for=198.51.100.4");

            assertEquals(
                    "198.51.100.4",
                    RateLimitFilter.extractClientIp(ctx, request, new TrustedProxyValidator(List.of("10.1.2.3"))));
        }

        @Test
        @DisplayName("should fall back to the peer when a trusted proxy sends no headers")
        void shouldFallBackToPeer() {
            peer("10.1.2.3");
            when(ctx.getHeaderString("X-Forwarded-For")).thenReturn(null);

            assertEquals(
                    "10.1.2.3",
                    RateLimitFilter.extractClientIp(ctx, request, new TrustedProxyValidator(List.of("10.0.0.0/8"))));
        }

        @Test
        @DisplayName("should report unknown without a remote address")
        void shouldHandleMissingRemoteAddress() {
            when(request.remoteAddress()).thenReturn(null);

            assertEquals(
                    "unknown",
                    RateLimitFilter.extractClientIp(ctx, request, new TrustedProxyValidator(List.of("10.0.0.0/8"))));
        }
    }
}
