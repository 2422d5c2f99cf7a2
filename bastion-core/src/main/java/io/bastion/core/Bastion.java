package io.bastion.core;

import io.bastion.core.cache.Cache;
import io.bastion.core.cache.ScoredCache;
import io.bastion.core.cache.SetOutcome;
import io.bastion.core.event.EventBus;
import io.bastion.core.guard.GuardVerdict;
import io.bastion.core.guard.InjectionDetectedException;
import io.bastion.core.guard.QueryGuard;
import io.bastion.core.key.KeyHasher;
import io.bastion.core.lifecycle.ManagedResource;
import io.bastion.core.lifecycle.ResourceSweeper;
import io.bastion.core.queue.RequestQueue;
import io.bastion.core.ratelimit.FixedWindowRateLimiter;
import io.bastion.core.ratelimit.RateDecision;
import io.bastion.core.ratelimit.RateLimitedException;
import io.bastion.core.ratelimit.RateLimiter;
import io.bastion.core.serializer.ValueSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Main entry point: one cache, one rate limiter and one query guard behind a
 * single object.
 *
 * <p>Each instance owns its components and a background sweeper that purges
 * expired cache entries and idle rate windows. Nothing is process-global;
 * two instances share no state. Close the instance to stop its sweeper.</p>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (Bastion bastion = Bastion.create(BastionConfig.defaults())) {
 *
 *     bastion.acquire("search", userId);           // throws RateLimitedException
 *     bastion.validateQueryText(searchText);       // throws InjectionDetectedException
 *
 *     byte[] page = bastion.get(List.of("search", searchText, pageNo),
 *             () -> render(repository.search(searchText, pageNo)));
 * }
 * }</pre>
 *
 * <h2>Outcomes</h2>
 * <ul>
 *   <li><b>Too large</b> - {@link SetOutcome#isTooLarge()}, the value is simply not cached</li>
 *   <li><b>Rate limited</b> - a denied {@link RateDecision}, or {@link RateLimitedException} from {@code acquire}</li>
 *   <li><b>Injection</b> - {@link InjectionDetectedException}; the calling operation must stop</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class Bastion implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Bastion.class);

    /** Bastion version */
    public static final String VERSION = "1.0.0-SNAPSHOT";

    private final String name;
    private final Cache cache;
    private final RateLimiter rateLimiter;
    private final QueryGuard queryGuard;
    private final ResourceSweeper sweeper;
    private final EventBus eventBus;
    private final int requestQueueCapacity;

    private Bastion(Builder builder) {
        this.name = builder.config.name();
        this.requestQueueCapacity = builder.config.requestQueueCapacity();
        this.cache = builder.cache;
        this.rateLimiter = builder.rateLimiter;
        this.queryGuard = builder.queryGuard;
        this.sweeper = builder.sweeper;
        this.eventBus = builder.eventBus;
    }

    /**
     * Creates an instance with every component built from the configuration.
     *
     * @param config the configuration
     * @return new instance, to be closed by the caller
     */
    public static Bastion create(BastionConfig config) {
        return builder().config(config).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Cache ====================

    /**
     * Returns a copy of the cached value, or empty on miss or expiry.
     *
     * @param keyParts ordered key parts
     * @return the value if present
     */
    public Optional<byte[]> get(List<?> keyParts) {
        return cache.get(keyParts);
    }

    /**
     * Returns the cached value or computes, caches and returns it.
     *
     * @param keyParts ordered key parts
     * @param loader computes the value on a miss
     * @return the cached or computed value
     */
    public byte[] get(List<?> keyParts, Supplier<byte[]> loader) {
        return cache.get(keyParts, loader);
    }

    /**
     * Returns the cached value decoded with the serializer.
     *
     * @param keyParts ordered key parts
     * @param serializer decodes the stored bytes
     * @param <T> value type
     * @return the decoded value if present
     */
    public <T> Optional<T> get(List<?> keyParts, ValueSerializer<T> serializer) {
        Objects.requireNonNull(serializer, "serializer must not be null");
        return cache.get(keyParts).map(serializer::deserialize);
    }

    public SetOutcome set(List<?> keyParts, byte[] value) {
        return cache.set(keyParts, value);
    }

    public SetOutcome set(List<?> keyParts, byte[] value, Duration ttl) {
        return cache.set(keyParts, value, ttl);
    }

    /**
     * Encodes and caches a value with the default TTL.
     *
     * @param keyParts ordered key parts
     * @param value the value, not null
     * @param serializer encodes the value
     * @param <T> value type
     * @return the outcome
     */
    public <T> SetOutcome set(List<?> keyParts, T value, ValueSerializer<T> serializer) {
        Objects.requireNonNull(serializer, "serializer must not be null");
        return cache.set(keyParts, serializer.serialize(value));
    }

    public <T> SetOutcome set(List<?> keyParts, T value, ValueSerializer<T> serializer, Duration ttl) {
        Objects.requireNonNull(serializer, "serializer must not be null");
        return cache.set(keyParts, serializer.serialize(value), ttl);
    }

    public void invalidate(List<?> keyParts) {
        cache.invalidate(keyParts);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    // ==================== Rate limiting ====================

    /**
     * Counts one operation of the default class for the identifier.
     *
     * @param identifier caller identity
     * @return the decision
     */
    public RateDecision allow(String identifier) {
        return rateLimiter.allow(identifier);
    }

    public RateDecision allow(String operationClass, String identifier) {
        return rateLimiter.allow(operationClass, identifier);
    }

    /**
     * Counts one operation, throwing when it is denied.
     *
     * @param operationClass operation class
     * @param identifier caller identity
     * @throws RateLimitedException if the operation is denied
     */
    public void acquire(String operationClass, String identifier) {
        rateLimiter.acquire(operationClass, identifier);
    }

    // ==================== Query guard ====================

    /**
     * Rejects query text that matches an injection signature.
     *
     * @param text free-form query text
     * @throws InjectionDetectedException if the text is rejected
     */
    public void validateQueryText(String text) {
        queryGuard.validate(text);
    }

    /**
     * Rejects query text that matches an injection signature or that, with its
     * bound parameters, exceeds the complexity ceiling.
     *
     * @param text free-form query text
     * @param parameterCount number of bound parameters
     * @throws InjectionDetectedException if the text is rejected
     */
    public void validateQueryText(String text, int parameterCount) {
        queryGuard.validate(text, parameterCount);
    }

    public GuardVerdict inspectQueryText(String text) {
        return queryGuard.inspect(text);
    }

    // ==================== Request queues ====================

    /**
     * Creates a priority queue sized from the configuration whose admissions are
     * charged to this instance's rate limiter under operation class
     * {@value RequestQueue#OPERATION_CLASS} and the queue's name.
     *
     * @param queueName queue name, used as the rate-limit identifier
     * @param <T> request type
     * @return new, empty queue
     */
    public <T> RequestQueue<T> newRequestQueue(String queueName) {
        return RequestQueue.<T>builder()
                .name(queueName)
                .capacity(requestQueueCapacity)
                .rateLimiter(rateLimiter)
                .build();
    }

    // ==================== Observability ====================

    public BastionStats stats() {
        return new BastionStats(
                cache.stats().snapshot(),
                rateLimiter.trackedWindows(),
                rateLimiter.deniedCount(),
                queryGuard.rejectedCount(),
                queryGuard.ruleCount());
    }

    /**
     * Runs one sweep immediately on the calling thread.
     * @return number of expired entries and idle windows released
     */
    public long sweepNow() {
        return sweeper.sweepNow();
    }

    public String name() {
        return name;
    }

    public Cache cache() {
        return cache;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public QueryGuard queryGuard() {
        return queryGuard;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public ResourceSweeper sweeper() {
        return sweeper;
    }

    @Override
    public void close() {
        sweeper.close();
        log.info("[BASTION] Instance '{}' closed", name);
    }

    /**
     * Builder for Bastion. Components left unset are built from the configuration.
     */
    public static class Builder {
        private BastionConfig config = BastionConfig.defaults();
        private Cache cache;
        private RateLimiter rateLimiter;
        private QueryGuard queryGuard;
        private ResourceSweeper sweeper;
        private EventBus eventBus;
        private KeyHasher keyHasher;
        private Clock clock = Clock.systemUTC();

        public Builder config(BastionConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder cache(Cache cache) {
            this.cache = cache;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder queryGuard(QueryGuard queryGuard) {
            this.queryGuard = queryGuard;
            return this;
        }

        /**
         * Supplies the sweeper. The instance takes ownership and closes it.
         * @param sweeper the sweeper
         * @return this builder
         */
        public Builder sweeper(ResourceSweeper sweeper) {
            this.sweeper = sweeper;
            return this;
        }

        /**
         * Shares an event bus between the components built by this builder.
         * @param eventBus the event bus
         * @return this builder
         */
        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder keyHasher(KeyHasher keyHasher) {
            this.keyHasher = keyHasher;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Bastion build() {
            if (eventBus == null) {
                eventBus = EventBus.create();
            }
            if (keyHasher == null) {
                keyHasher = new KeyHasher();
            }
            if (cache == null) {
                cache = ScoredCache.builder()
                        .config(config.cacheConfig())
                        .keyHasher(keyHasher)
                        .clock(clock)
                        .eventBus(eventBus)
                        .build();
            }
            if (rateLimiter == null) {
                rateLimiter = FixedWindowRateLimiter.builder()
                        .name(config.name() + "-rate-limiter")
                        .defaultPolicy(config.defaultRatePolicy())
                        .overrides(config.rateLimitOverrides())
                        .idleWindowMultiplier(config.idleWindowMultiplier())
                        .maxTrackedWindows(config.maxTrackedWindows())
                        .clock(clock)
                        .eventBus(eventBus)
                        .build();
            }
            if (queryGuard == null) {
                queryGuard = QueryGuard.builder()
                        .rulesResource(config.injectionPatterns())
                        .maxTextLength(config.maxQueryTextLength())
                        .maxComplexity(config.maxQueryComplexity())
                        .eventBus(eventBus)
                        .clock(clock)
                        .build();
            }
            if (sweeper == null) {
                sweeper = ResourceSweeper.builder()
                        .name(config.name())
                        .sweepInterval(config.sweepInterval())
                        .build();
            }
            registerIfManaged(cache);
            registerIfManaged(rateLimiter);

            Bastion bastion = new Bastion(this);
            log.info("[BASTION] Instance '{}' ready - {} injection rules, cache capacity {} bytes",
                    config.name(), queryGuard.ruleCount(), config.capacityBytes());
            return bastion;
        }

        private void registerIfManaged(Object component) {
            if (component instanceof ManagedResource) {
                sweeper.register((ManagedResource) component);
            }
        }
    }
}
