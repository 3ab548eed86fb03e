package appraiser.adapter.out.ratelimit.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import appraiser.core.model.ratelimit.EffectiveRateLimit;
import appraiser.core.model.ratelimit.RateLimitCategory;
import appraiser.core.model.ratelimit.RateLimitDecision;
import appraiser.core.model.ratelimit.RateLimitKey;

@DisplayName("InMemoryRateLimiter")
class InMemoryRateLimiterTest {

    private static final long WINDOW_START = 1_700_000_040_000L;

    private AtomicLong clock;
    private InMemoryRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong(WINDOW_START);
        rateLimiter = new InMemoryRateLimiter(clock::get);
    }

    private RateLimitDecision consume(RateLimitKey key, EffectiveRateLimit limit) {
        return rateLimiter.checkAndConsume(key, limit).await().atMost(Duration.ofSeconds(1));
    }

    @Nested
    @DisplayName("Fixed window")
    class FixedWindowTests {

        @Test
        @DisplayName("should count down remaining requests")
        void shouldCountDownRemaining() {
            var key = new RateLimitKey("10.0.0.1", RateLimitCategory.GENERAL);
            var limit = EffectiveRateLimit.of(3, 60);

            assertEquals(2, consume(key, limit).remaining());
            assertEquals(1, consume(key, limit).remaining());
            assertEquals(0, consume(key, limit).remaining());
        }

        @Test
        @DisplayName("should reject the request after the limit with a retry hint")
        void shouldRejectAfterLimit() {
            var key = new RateLimitKey("10.0.0.1", RateLimitCategory.TOKEN_EXCHANGE);
            var limit = EffectiveRateLimit.of(2, 60);
            consume(key, limit);
            consume(key, limit);

            clock.addAndGet(15_000);
            var decision = consume(key, limit);

            assertFalse(decision.allowed());
            assertEquals(0, decision.remaining());
            assertEquals(2, decision.limit());
            assertTrue(decision.retryAfterSeconds() >= 1 && decision.retryAfterSeconds() <= 60);
            assertEquals(decision.resetAt().getEpochSecond(), decision.resetAtEpochSeconds());
        }

        @Test
        @DisplayName("should start a new window once the current one ends")
        void shouldResetOnNextWindow() {
            var key = new RateLimitKey("10.0.0.1", RateLimitCategory.GENERAL);
            var limit = EffectiveRateLimit.of(1, 60);
            consume(key, limit);
            assertFalse(consume(key, limit).allowed());

            clock.addAndGet(60_000);

            assertTrue(consume(key, limit).allowed());
        }
    }

    @Nested
    @DisplayName("Reset")
    class ResetTests {

        @Test
        @DisplayName("should forget one counter on reset")
        void shouldResetOneCounter() {
            var key = new RateLimitKey("10.0.0.1", RateLimitCategory.KEY_ISSUANCE);
            var other = new RateLimitKey("10.0.0.2", RateLimitCategory.KEY_ISSUANCE);
            var limit = EffectiveRateLimit.of(1, 3600);
            consume(key, limit);
            consume(other, limit);

            rateLimiter.reset(key).await().indefinitely();

            assertTrue(consume(key, limit).allowed());
            assertFalse(consume(other, limit).allowed());
        }

        @Test
        @DisplayName("should forget every counter on clear")
        void shouldClearAll() {
            var limit = EffectiveRateLimit.of(1, 60);
            consume(new RateLimitKey("a", RateLimitCategory.GENERAL), limit);
            consume(new RateLimitKey("b", RateLimitCategory.GENERAL), limit);
            assertEquals(2, rateLimiter.getCounterCount());

            rateLimiter.clear().await().indefinitely();

            assertEquals(0, rateLimiter.getCounterCount());
        }

        @Test
        @DisplayName("should evict counters once their window has ended")
        void shouldEvictExpiredCounters() {
            var minute = EffectiveRateLimit.of(5, 60);
            var hour = EffectiveRateLimit.of(5, 3600);
            for (int i = 0; i < 3; i++) {
                consume(new RateLimitKey("10.0.0." + i, RateLimitCategory.GENERAL), minute);
            }
            consume(new RateLimitKey("10.0.1.1", RateLimitCategory.KEY_ISSUANCE), hour);
            assertEquals(4, rateLimiter.getCounterCount());

            clock.addAndGet(120_000);
            assertEquals(1, rateLimiter.getCounterCount());

            clock.addAndGet(3_600_000);
            assertEquals(0, rateLimiter.getCounterCount());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should admit exactly the limit under concurrent load")
        void shouldNotLoseIncrements() throws Exception {
            var key = new RateLimitKey("10.0.0.1", RateLimitCategory.GENERAL);
            var limit = EffectiveRateLimit.of(50, 60);
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                var tasks = new ArrayList<Callable<Boolean>>();
                for (int i = 0; i < 200; i++) {
                    tasks.add(() -> consume(key, limit).allowed());
                }
                long admitted = 0;
                for (Future<Boolean> result : executor.invokeAll(tasks)) {
                    if (result.get()) {
                        admitted++;
                    }
                }
                assertEquals(50, admitted);
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
