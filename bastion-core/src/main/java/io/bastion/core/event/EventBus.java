package io.bastion.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Simple in-process event bus for observing Bastion components.
 *
 * <p>Use cases:</p>
 * <ul>
 *   <li>Counting capacity evictions for dashboards</li>
 *   <li>Auditing rejected queries and denied requests</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * EventBus bus = EventBus.create();
 *
 * bus.subscribe(InjectionDetectedEvent.class, event ->
 *     audit.record("query-rejected", event.label()));
 * }</pre>
 *
 * <p>Thread-safe. Handlers are called in order of registration. A failing
 * handler is logged and does not prevent the remaining handlers from running.</p>
 *
 * @since 1.0.0
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<Class<?>, List<Consumer<?>>> handlers = new ConcurrentHashMap<>();
    private final Executor asyncExecutor;

    private EventBus(Executor asyncExecutor) {
        this.asyncExecutor = asyncExecutor;
    }

    /**
     * Creates an event bus whose async publish runs on the calling thread.
     * @return new event bus
     */
    public static EventBus create() {
        return new EventBus(Runnable::run);
    }

    /**
     * Creates an event bus with custom async executor.
     *
     * @param asyncExecutor executor for async publish
     * @return new event bus
     */
    public static EventBus create(Executor asyncExecutor) {
        return new EventBus(asyncExecutor);
    }

    /**
     * Subscribes to events of a specific type.
     *
     * @param eventType the event class to subscribe to
     * @param handler the handler to call when event is published
     * @param <E> event type
     * @return subscription that can be used to unsubscribe
     */
    public <E extends Event> Subscription subscribe(Class<E> eventType, Consumer<E> handler) {
        handlers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
                .add(handler);
        return () -> unsubscribe(eventType, handler);
    }

    /**
     * Unsubscribes a handler.
     *
     * @param eventType the event class
     * @param handler the handler to remove
     * @param <E> event type
     */
    public <E extends Event> void unsubscribe(Class<E> eventType, Consumer<E> handler) {
        List<Consumer<?>> list = handlers.get(eventType);
        if (list != null) {
            list.remove(handler);
        }
    }

    /**
     * Publishes an event synchronously.
     * Handlers registered for the event's class or any supertype are called
     * in the current thread.
     *
     * @param event the event to publish
     */
    public void publish(Event event) {
        if (event == null || handlers.isEmpty()) return;

        for (Map.Entry<Class<?>, List<Consumer<?>>> entry : handlers.entrySet()) {
            if (entry.getKey().isInstance(event)) {
                for (Consumer<?> handler : entry.getValue()) {
                    dispatch(handler, event);
                }
            }
        }
    }

    /**
     * Publishes an event through the async executor.
     *
     * @param event the event to publish
     */
    public void publishAsync(Event event) {
        asyncExecutor.execute(() -> publish(event));
    }

    @SuppressWarnings("unchecked")
    private static void dispatch(Consumer<?> handler, Event event) {
        try {
            ((Consumer<Event>) handler).accept(event);
        } catch (RuntimeException e) {
            log.warn("[BASTION] Event handler failed for {}: {}",
                    event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    /**
     * Returns the number of handlers for a specific event type.
     *
     * @param eventType the event class
     * @return number of registered handlers
     */
    public int handlerCount(Class<?> eventType) {
        List<Consumer<?>> list = handlers.get(eventType);
        return list != null ? list.size() : 0;
    }

    /**
     * Clears all handlers.
     */
    public void clear() {
        handlers.clear();
    }

    /**
     * Subscription handle for unsubscribing.
     */
    @FunctionalInterface
    public interface Subscription {
        /**
         * Unsubscribes from the event.
         */
        void unsubscribe();
    }
}
