package io.bastion.core.queue;

import io.bastion.core.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory queue that serves requests by priority.
 *
 * <p>Requests wait in one FIFO lane per {@link RequestPriority}. {@link #poll()}
 * always drains {@code HIGH} before {@code NORMAL} before {@code LOW}; within
 * a lane, first in is first out.</p>
 *
 * <p>An offer is refused, and returns {@code false}, when the queue already
 * holds {@code capacity} requests or when the optional {@link RateLimiter}
 * denies operation class {@value #OPERATION_CLASS} for the queue's name.
 * Capacity is checked first, so a refused offer on a full queue does not
 * spend a rate-limit token.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RequestQueue<GenerationRequest> queue = RequestQueue.<GenerationRequest>builder()
 *     .name("generation")
 *     .capacity(500)
 *     .rateLimiter(limiter)
 *     .build();
 *
 * if (!queue.offer(request, RequestPriority.HIGH)) {
 *     return serviceUnavailable();
 * }
 * queue.poll().ifPresent(worker::submit);
 * }</pre>
 *
 * @param <E> the request type
 * @since 1.0.0
 */
public class RequestQueue<E> {

    private static final Logger log = LoggerFactory.getLogger(RequestQueue.class);

    /** Operation class charged to the rate limiter for each admitted request. */
    public static final String OPERATION_CLASS = "enqueue";

    public static final int DEFAULT_CAPACITY = 1000;
    public static final int MAX_CAPACITY = 100_000;

    private final String name;
    private final int capacity;
    private final RateLimiter rateLimiter;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<RequestPriority, ArrayDeque<E>> lanes = new EnumMap<>(RequestPriority.class);
    private int size;

    // Metrics, guarded by lock
    private long enqueued;
    private long rejectedFull;
    private long rejectedRateLimited;

    private RequestQueue(Builder<E> builder) {
        this.name = builder.name;
        this.capacity = builder.capacity;
        this.rateLimiter = builder.rateLimiter;
        for (RequestPriority priority : RequestPriority.values()) {
            lanes.put(priority, new ArrayDeque<>());
        }
    }

    /**
     * Creates a new builder.
     * @param <E> request type
     * @return new builder
     */
    public static <E> Builder<E> builder() {
        return new Builder<>();
    }

    // ========================================================================
    // PUBLIC API
    // ========================================================================

    /**
     * Offers a request at {@link RequestPriority#NORMAL}.
     *
     * @param request the request
     * @return true if queued
     */
    public boolean offer(E request) {
        return offer(request, RequestPriority.NORMAL);
    }

    /**
     * Offers a request at the given priority. A null priority means
     * {@link RequestPriority#NORMAL}.
     *
     * @param request the request
     * @param priority lane to queue in
     * @return true if queued, false if the queue is full or rate limited
     * @throws NullPointerException if request is null
     */
    public boolean offer(E request, RequestPriority priority) {
        Objects.requireNonNull(request, "request must not be null");
        RequestPriority lane = priority != null ? priority : RequestPriority.NORMAL;

        lock.lock();
        try {
            if (size >= capacity) {
                rejectedFull++;
                log.debug("[BASTION] Queue '{}' full at {} requests, refused {} request",
                        name, capacity, lane);
                return false;
            }
            if (rateLimiter != null && rateLimiter.allow(OPERATION_CLASS, name).denied()) {
                rejectedRateLimited++;
                log.debug("[BASTION] Queue '{}' rate limited, refused {} request", name, lane);
                return false;
            }
            lanes.get(lane).addLast(request);
            size++;
            enqueued++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest request of the highest non-empty priority.
     * @return the request, or empty if the queue is empty
     */
    public Optional<E> poll() {
        lock.lock();
        try {
            for (RequestPriority priority : RequestPriority.values()) {
                E request = lanes.get(priority).pollFirst();
                if (request != null) {
                    size--;
                    return Optional.of(request);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Removes every queued request.
     * @return number of requests removed
     */
    public int clear() {
        lock.lock();
        try {
            int removed = size;
            lanes.values().forEach(ArrayDeque::clear);
            size = 0;
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public QueueStats stats() {
        lock.lock();
        try {
            return new QueueStats(size,
                    lanes.get(RequestPriority.HIGH).size(),
                    lanes.get(RequestPriority.NORMAL).size(),
                    lanes.get(RequestPriority.LOW).size(),
                    enqueued, rejectedFull, rejectedRateLimited);
        } finally {
            lock.unlock();
        }
    }

    public String name() {
        return name;
    }

    public int capacity() {
        return capacity;
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    /**
     * Builder for RequestQueue.
     * @param <E> request type
     */
    public static class Builder<E> {
        private String name = "requests";
        private int capacity = DEFAULT_CAPACITY;
        private RateLimiter rateLimiter;

        public Builder<E> name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        /**
         * Sets the maximum number of queued requests.
         *
         * @param capacity between 1 and {@value RequestQueue#MAX_CAPACITY}
         * @return this builder
         */
        public Builder<E> capacity(int capacity) {
            if (capacity < 1 || capacity > MAX_CAPACITY) {
                throw new IllegalArgumentException("capacity must be between 1 and " + MAX_CAPACITY);
            }
            this.capacity = capacity;
            return this;
        }

        /**
         * Sets the limiter consulted on each admission; none by default.
         * @param rateLimiter the limiter, or null
         * @return this builder
         */
        public Builder<E> rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public RequestQueue<E> build() {
            return new RequestQueue<>(this);
        }
    }
}
