package io.bastion.core.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic expiry sweep for Bastion components.
 *
 * <p>Runs a single daemon task that calls {@link ManagedResource#releaseExpired()}
 * on every registered resource at a fixed interval. Expired cache entries and idle
 * rate windows are reclaimed even when nobody reads them again, so resident
 * memory does not drift upward.</p>
 *
 * <p>Each sweeper is an explicitly owned instance; there is no process-wide
 * default. Closing it cancels the task and waits for an in-flight tick.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ResourceSweeper sweeper = ResourceSweeper.builder()
 *     .name("bastion")
 *     .sweepInterval(Duration.ofSeconds(30))
 *     .build();
 *
 * sweeper.register(cache);
 * sweeper.register(rateLimiter);
 *
 * // On shutdown
 * sweeper.close();
 * }</pre>
 *
 * @since 1.0.0
 */
public class ResourceSweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResourceSweeper.class);

    private final String name;
    private final Map<String, ManagedResource> resources = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final long sweepIntervalMillis;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong totalReleasedItems = new AtomicLong(0);
    private final AtomicLong sweepCount = new AtomicLong(0);
    private final AtomicLong failedSweeps = new AtomicLong(0);

    private final ScheduledFuture<?> sweepTask;

    private ResourceSweeper(Builder builder) {
        this.name = builder.name;
        this.sweepIntervalMillis = builder.sweepInterval.toMillis();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name + "-sweeper");
            t.setDaemon(true);
            return t;
        });

        this.sweepTask = scheduler.scheduleWithFixedDelay(
                this::periodicSweep,
                sweepIntervalMillis,
                sweepIntervalMillis,
                TimeUnit.MILLISECONDS
        );
        log.info("[BASTION] Sweeper '{}' started - interval={}ms", name, sweepIntervalMillis);
    }

    /**
     * Creates a new builder.
     * @return new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a resource for sweeping.
     * @param resource the resource to sweep
     * @throws IllegalStateException if the sweeper is closed
     */
    public void register(ManagedResource resource) {
        if (resource == null || resource.name() == null) {
            throw new IllegalArgumentException("resource and its name must not be null");
        }
        if (!running.get()) {
            throw new IllegalStateException("Sweeper '" + name + "' is closed");
        }
        resources.put(resource.name(), resource);
        log.debug("[BASTION] Resource registered: {}", resource.name());
    }

    /**
     * Deregisters a resource.
     * @param resourceName the resource name
     * @return the removed resource, or null if not found
     */
    public ManagedResource deregister(String resourceName) {
        ManagedResource removed = resources.remove(resourceName);
        if (removed != null) {
            log.debug("[BASTION] Resource deregistered: {}", resourceName);
        }
        return removed;
    }

    /**
     * Runs one sweep over all resources on the calling thread.
     *
     * <p>A failing resource is logged and counted; the others are still swept.</p>
     *
     * @return total items released
     */
    public long sweepNow() {
        long released = 0;
        for (ManagedResource resource : resources.values()) {
            try {
                long count = resource.releaseExpired();
                released += count;
                if (count > 0) {
                    log.debug("[BASTION] Released {} expired items from {}", count, resource.name());
                }
            } catch (RuntimeException e) {
                failedSweeps.incrementAndGet();
                log.warn("[BASTION] Error sweeping {}: {}", resource.name(), e.getMessage(), e);
            }
        }
        sweepCount.incrementAndGet();
        if (released > 0) {
            totalReleasedItems.addAndGet(released);
            log.info("[BASTION] Sweep released {} expired items", released);
        }
        return released;
    }

    /**
     * Returns the total estimated memory usage across all resources.
     * @return total bytes
     */
    public long totalMemoryBytes() {
        return resources.values().stream()
                .mapToLong(ManagedResource::estimatedMemoryBytes)
                .sum();
    }

    /**
     * Returns the total item count across all resources.
     * @return total items
     */
    public long totalItemCount() {
        return resources.values().stream()
                .mapToLong(ManagedResource::itemCount)
                .sum();
    }

    /**
     * Returns true while the periodic task is scheduled.
     * @return true if running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Returns metrics about this sweeper.
     * @return metrics snapshot
     */
    public Metrics getMetrics() {
        return new Metrics(
                resources.size(),
                totalItemCount(),
                totalMemoryBytes(),
                totalReleasedItems.get(),
                sweepCount.get(),
                failedSweeps.get()
        );
    }

    /**
     * Returns a snapshot of all registered resources.
     * @return list of resource snapshots
     */
    public List<ResourceSnapshot> getResourceSnapshots() {
        List<ResourceSnapshot> snapshots = new ArrayList<>();
        for (ManagedResource resource : resources.values()) {
            snapshots.add(new ResourceSnapshot(
                    resource.name(),
                    resource.itemCount(),
                    resource.estimatedMemoryBytes(),
                    resource.lastAccessTimeMillis()
            ));
        }
        return snapshots;
    }

    private void periodicSweep() {
        if (!running.get()) return;
        try {
            sweepNow();
        } catch (RuntimeException e) {
            // Keep the schedule alive; an escaping exception would cancel it
            log.error("[BASTION] Error in periodic sweep", e);
        }
    }

    /**
     * Shuts down the sweeper. Registered resources keep their data.
     */
    public void shutdown() {
        close();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("[BASTION] Sweeper '{}' shutting down...", name);

            sweepTask.cancel(false);
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }

            resources.clear();
            log.info("[BASTION] Sweeper '{}' shutdown complete", name);
        }
    }

    /**
     * Metrics snapshot.
     */
    public record Metrics(
            int resourceCount,
            long totalItems,
            long totalMemoryBytes,
            long totalReleasedItems,
            long sweepCount,
            long failedSweeps
    ) {}

    /**
     * Resource snapshot for monitoring.
     */
    public record ResourceSnapshot(
            String name,
            long itemCount,
            long memoryBytes,
            long lastAccessMillis
    ) {}

    /**
     * Builder for ResourceSweeper.
     */
    public static class Builder {
        private String name = "bastion";
        private Duration sweepInterval = Duration.ofSeconds(30);

        public Builder name(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            this.name = name;
            return this;
        }

        /**
         * Sets the interval between sweeps.
         * @param sweepInterval sweep interval
         * @return this builder
         */
        public Builder sweepInterval(Duration sweepInterval) {
            if (sweepInterval == null || sweepInterval.isNegative() || sweepInterval.isZero()) {
                throw new IllegalArgumentException("sweepInterval must be positive");
            }
            this.sweepInterval = sweepInterval;
            return this;
        }

        public ResourceSweeper build() {
            return new ResourceSweeper(this);
        }
    }
}
