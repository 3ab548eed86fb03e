package appraiser.adapter.out.ratelimit.memory;

import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import io.smallrye.mutiny.Uni;

import appraiser.core.model.ratelimit.EffectiveRateLimit;
import appraiser.core.model.ratelimit.RateLimitDecision;
import appraiser.core.model.ratelimit.RateLimitKey;
import appraiser.core.model.ratelimit.WindowState;
import appraiser.core.port.out.RateLimiter;

/**
 * In-memory fixed-window rate limiter backed by a Caffeine cache.
 *
 * <p>
 * Windows are aligned to multiples of the window size since the epoch. Each counter
 * expires when its window ends, so idle clients do not accumulate. Counters are
 * updated inside a map {@code compute}, so concurrent requests for the same key never
 * lose an increment.
 *
 * <p>
 * Limitations:
 * <ul>
 * <li>State is not shared across instances</li>
 * <li>State is lost on restart</li>
 * <li>Up to twice the limit can pass around a window boundary</li>
 * </ul>
 */
public final class InMemoryRateLimiter implements RateLimiter {

    private final Cache<String, WindowState> states;
    private final LongSupplier clock;

    public InMemoryRateLimiter() {
        this(System::currentTimeMillis);
    }

    /**
     * Creates a limiter reading time from the given millisecond clock.
     *
     * @param clock epoch millisecond source, also used to expire counters
     */
    public InMemoryRateLimiter(LongSupplier clock) {
        this.clock = clock;
        this.states = Caffeine.newBuilder()
                .expireAfter(new WindowEndExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.getAsLong()))
                .executor(Runnable::run)
                .build();
    }

    /**
     * Expires each counter at the end of its window.
     */
    private static final class WindowEndExpiry implements Expiry<String, WindowState> {
        @Override
        public long expireAfterCreate(String key, WindowState value, long currentTime) {
            return untilWindowEnd(value, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, WindowState value, long currentTime, long currentDuration) {
            return untilWindowEnd(value, currentTime);
        }

        @Override
        public long expireAfterRead(String key, WindowState value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long untilWindowEnd(WindowState value, long currentTimeNanos) {
            return Math.max(0, TimeUnit.MILLISECONDS.toNanos(value.windowEndMillis()) - currentTimeNanos);
        }
    }

    @Override
    public Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, EffectiveRateLimit limit) {
        final var nowMillis = clock.getAsLong();
        final var windowMillis = limit.windowMillis();
        final var windowStart = nowMillis - Math.floorMod(nowMillis, windowMillis);

        final var updated = states.asMap().compute(key.toCacheKey(), (k, current) -> {
            if (current == null || current.windowStartMillis() != windowStart) {
                return WindowState.first(windowStart, windowMillis);
            }
            return current.increment();
        });

        final var resetAt = Instant.ofEpochMilli(updated.windowEndMillis());
        if (updated.count() > limit.requestsPerWindow()) {
            final var retryAfter = Math.max(1, (updated.windowEndMillis() - nowMillis + 999) / 1000);
            return Uni.createFrom()
                    .item(RateLimitDecision.rejected(
                            limit.requestsPerWindow(), limit.windowSeconds(), resetAt, retryAfter));
        }
        return Uni.createFrom()
                .item(RateLimitDecision.allow(
                        limit.requestsPerWindow() - updated.count(),
                        limit.requestsPerWindow(),
                        limit.windowSeconds(),
                        resetAt));
    }

    @Override
    public Uni<Void> reset(RateLimitKey key) {
        states.invalidate(key.toCacheKey());
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Void> clear() {
        states.invalidateAll();
        return Uni.createFrom().voidItem();
    }

    /**
     * Returns the number of live counters after expired windows are evicted.
     *
     * @return the number of counters
     */
    public long getCounterCount() {
        states.cleanUp();
        return states.estimatedSize();
    }
}
