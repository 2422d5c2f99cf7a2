package io.bastion.core.ratelimit;

import io.bastion.core.event.EventBus;
import io.bastion.core.lifecycle.ManagedResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.BiPredicate;

/**
 * Fixed-window rate limiter keyed by (operation class, identifier).
 *
 * <p>The first call for a key, or the first call after its window has elapsed,
 * opens a fresh window with a count of one. Later calls in the same window
 * increment the count and are allowed while it stays within the policy's
 * limit; beyond that they are denied with the time left until rollover.</p>
 *
 * <p>Each key is updated atomically through {@link ConcurrentHashMap#compute},
 * so concurrent calls on one identifier are linearizable while calls on
 * different identifiers proceed in parallel on different bins.</p>
 *
 * <p>Memory stays bounded: windows idle for {@code idleWindowMultiplier} window
 * lengths are purged by {@link #releaseExpired()}, and once {@code maxTrackedWindows}
 * is reached elapsed windows are dropped inline. If every tracked window is
 * still live, new identifiers are denied until one rolls over. A new window
 * claims its slot inside the same atomic update that creates it, so concurrent
 * first calls never push the count past the limit. Reaching the limit is logged
 * once, when it happens, not on every denial.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FixedWindowRateLimiter limiter = FixedWindowRateLimiter.builder()
 *     .defaultPolicy(RatePolicy.of(1000, Duration.ofSeconds(60)))
 *     .override("login", RatePolicy.of(5, Duration.ofMinutes(1)))
 *     .build();
 *
 * limiter.acquire("login", remoteAddress);   // throws RateLimitedException
 * }</pre>
 *
 * @since 1.0.0
 */
public class FixedWindowRateLimiter implements RateLimiter, ManagedResource {

    private static final Logger log = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

    /** Rough per-window bookkeeping cost used for memory estimates. */
    static final int WINDOW_OVERHEAD_BYTES = 128;

    private final String name;
    private final RatePolicy defaultPolicy;
    private final Map<String, RatePolicy> overrides;
    private final int idleWindowMultiplier;
    private final int maxTrackedWindows;
    private final Clock clock;
    private final EventBus eventBus;

    private final ConcurrentHashMap<WindowKey, RateWindow> windows = new ConcurrentHashMap<>();
    private final LongAdder allowed = new LongAdder();
    private final LongAdder denied = new LongAdder();
    private final AtomicInteger tracked = new AtomicInteger();
    private final AtomicBoolean saturated = new AtomicBoolean();
    private final LongAdder saturations = new LongAdder();
    private volatile long lastAccessMillis;

    private record WindowKey(String operationClass, String identifier) {}

    /**
     * Counter for one key. Immutable; every call replaces it.
     */
    private record RateWindow(long windowStart, int count, long lastSeen) {

        boolean hasElapsed(long now, long windowMillis) {
            return now - windowStart >= windowMillis;
        }
    }

    private FixedWindowRateLimiter(Builder builder) {
        this.name = builder.name;
        this.defaultPolicy = builder.defaultPolicy;
        this.overrides = Map.copyOf(builder.overrides);
        this.idleWindowMultiplier = builder.idleWindowMultiplier;
        this.maxTrackedWindows = builder.maxTrackedWindows;
        this.clock = builder.clock;
        this.eventBus = builder.eventBus;
        this.lastAccessMillis = clock.millis();
    }

    /**
     * Creates a new builder.
     * @return new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public RateDecision allow(String operationClass, String identifier) {
        Objects.requireNonNull(operationClass, "operationClass must not be null");
        Objects.requireNonNull(identifier, "identifier must not be null");

        RatePolicy policy = policyFor(operationClass);
        long windowMillis = policy.windowMillis();
        long now = clock.millis();
        lastAccessMillis = now;
        WindowKey key = new WindowKey(operationClass, identifier);

        // Capped at limit + 1 so a flood cannot overflow the counter
        int ceiling = policy.limit() + 1;
        RateWindow window = update(key, now, windowMillis, ceiling);
        if (window == null) {
            purgeElapsed(now);
            window = update(key, now, windowMillis, ceiling);
        }
        if (window == null) {
            if (saturated.compareAndSet(false, true)) {
                saturations.increment();
                log.warn("[BASTION] Rate limiter '{}' reached {} tracked windows, denying new identifiers",
                        name, maxTrackedWindows);
            }
            return deny(operationClass, identifier, policy.window(), policy, now);
        }
        if (saturated.get() && tracked.get() < maxTrackedWindows && saturated.compareAndSet(true, false)) {
            log.info("[BASTION] Rate limiter '{}' is below {} tracked windows again", name, maxTrackedWindows);
        }

        if (window.count() <= policy.limit()) {
            allowed.increment();
            return RateDecision.allow(policy.limit() - window.count(), policy.limit());
        }
        Duration retryAfter = Duration.ofMillis(
                Math.max(1L, window.windowStart() + windowMillis - now));
        return deny(operationClass, identifier, retryAfter, policy, now);
    }

    /**
     * Counts one call in the key's window. Returns null, leaving no window behind,
     * when the key is new and no slot is free.
     */
    private RateWindow update(WindowKey key, long now, long windowMillis, int ceiling) {
        return windows.compute(key, (k, current) -> {
            if (current == null) {
                if (tracked.incrementAndGet() > maxTrackedWindows) {
                    tracked.decrementAndGet();
                    return null;
                }
                return new RateWindow(now, 1, now);
            }
            if (current.hasElapsed(now, windowMillis)) {
                return new RateWindow(now, 1, now);
            }
            return new RateWindow(current.windowStart(), Math.min(current.count() + 1, ceiling), now);
        });
    }

    private RateDecision deny(String operationClass, String identifier, Duration retryAfter,
                              RatePolicy policy, long now) {
        denied.increment();
        log.debug("[BASTION] Rate limited {} for '{}', retry after {}ms",
                identifier, operationClass, retryAfter.toMillis());
        eventBus.publish(new RateLimitedEvent(operationClass, identifier, retryAfter,
                Instant.ofEpochMilli(now)));
        return RateDecision.deny(retryAfter, policy.limit());
    }

    @Override
    public long remaining(String operationClass, String identifier) {
        RatePolicy policy = policyFor(operationClass);
        RateWindow window = windows.get(new WindowKey(operationClass, identifier));
        if (window == null || window.hasElapsed(clock.millis(), policy.windowMillis())) {
            return policy.limit();
        }
        return Math.max(0, policy.limit() - window.count());
    }

    @Override
    public RatePolicy policyFor(String operationClass) {
        return overrides.getOrDefault(operationClass, defaultPolicy);
    }

    @Override
    public long trackedWindows() {
        return windows.size();
    }

    @Override
    public long deniedCount() {
        return denied.sum();
    }

    /**
     * Returns the number of allowed calls since creation.
     * @return allowed count
     */
    public long allowedCount() {
        return allowed.sum();
    }

    /**
     * Returns how many times the tracking limit was reached since creation.
     * Repeated denials while the limit holds count once.
     * @return saturation count
     */
    public long saturationCount() {
        return saturations.sum();
    }

    private void purgeElapsed(long now) {
        purgeWhere((key, window) -> window.hasElapsed(now, policyFor(key.operationClass()).windowMillis()));
    }

    private long purgeWhere(BiPredicate<WindowKey, RateWindow> stale) {
        long purged = 0;
        for (Map.Entry<WindowKey, RateWindow> entry : windows.entrySet()) {
            // Conditional remove: a window updated meanwhile is left in place
            if (stale.test(entry.getKey(), entry.getValue())
                    && windows.remove(entry.getKey(), entry.getValue())) {
                tracked.decrementAndGet();
                purged++;
            }
        }
        return purged;
    }

    // ManagedResource implementation

    @Override
    public String name() {
        return name;
    }

    @Override
    public long estimatedMemoryBytes() {
        return (long) windows.size() * WINDOW_OVERHEAD_BYTES;
    }

    @Override
    public long itemCount() {
        return windows.size();
    }

    @Override
    public long releaseAll() {
        return purgeWhere((key, window) -> true);
    }

    /**
     * Purges windows with no activity for {@code idleWindowMultiplier} window lengths.
     * @return number of windows purged
     */
    @Override
    public long releaseExpired() {
        long now = clock.millis();
        return purgeWhere((key, window) -> {
            long idleLimit = policyFor(key.operationClass()).windowMillis() * idleWindowMultiplier;
            return now - window.lastSeen() >= idleLimit;
        });
    }

    @Override
    public long lastAccessTimeMillis() {
        return lastAccessMillis;
    }

    /**
     * Builder for FixedWindowRateLimiter.
     */
    public static class Builder {
        private String name = "rate-limiter";
        private RatePolicy defaultPolicy = RatePolicy.DEFAULT;
        private final Map<String, RatePolicy> overrides = new HashMap<>();
        private int idleWindowMultiplier = 3;
        private int maxTrackedWindows = 100_000;
        private Clock clock = Clock.systemUTC();
        private EventBus eventBus;

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        public Builder defaultPolicy(RatePolicy policy) {
            this.defaultPolicy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        public Builder defaultPolicy(int limit, Duration window) {
            return defaultPolicy(RatePolicy.of(limit, window));
        }

        /**
         * Overrides the policy for one operation class.
         *
         * @param operationClass operation class
         * @param policy the policy
         * @return this builder
         */
        public Builder override(String operationClass, RatePolicy policy) {
            Objects.requireNonNull(operationClass, "operationClass must not be null");
            this.overrides.put(operationClass, Objects.requireNonNull(policy, "policy must not be null"));
            return this;
        }

        public Builder overrides(Map<String, RatePolicy> overrides) {
            overrides.forEach(this::override);
            return this;
        }

        public Builder idleWindowMultiplier(int multiplier) {
            if (multiplier < 1) {
                throw new IllegalArgumentException("idleWindowMultiplier must be at least 1");
            }
            this.idleWindowMultiplier = multiplier;
            return this;
        }

        public Builder maxTrackedWindows(int maxTrackedWindows) {
            if (maxTrackedWindows <= 0) {
                throw new IllegalArgumentException("maxTrackedWindows must be positive");
            }
            this.maxTrackedWindows = maxTrackedWindows;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public FixedWindowRateLimiter build() {
            if (eventBus == null) {
                eventBus = EventBus.create();
            }
            return new FixedWindowRateLimiter(this);
        }
    }
}
