package in.imagen.service.core;

import in.imagen.domain.common.EventType;
import in.imagen.domain.common.LifecycleEvent;
import in.imagen.infrastructure.metrics.LifecycleMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Typed publish/subscribe registry for lifecycle events.
 *
 * One instance per process, passed to every publisher and subscriber.
 *
 * DELIVERY:
 * - Synchronous, on the publisher's thread
 * - Within a kind, handlers run in registration order
 * - A failing handler is logged and skipped; publish never throws because of it
 *
 * THREAD-SAFETY:
 * ConcurrentHashMap of CopyOnWriteArrayList. Publish iterates a snapshot,
 * so subscribe/unsubscribe during delivery is safe.
 */
public final class EventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    // kind → handlers in registration order
    private final Map<EventType, CopyOnWriteArrayList<EventHandler>> handlers = new ConcurrentHashMap<>();
    private final LifecycleMetrics metrics;

    public EventBus() {
        this(LifecycleMetrics.NOOP);
    }

    public EventBus(LifecycleMetrics metrics) {
        this.metrics = metrics;
    }

    // ═══════════════════════════════════════════════════════════════
    // REGISTRATION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Register a handler for one kind. Registering the same handler twice is a no-op.
     */
    public void subscribe(EventType type, EventHandler handler) {
        if (type == null || handler == null) {
            throw new IllegalArgumentException("Event type and handler are required");
        }
        boolean added = handlers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).addIfAbsent(handler);
        if (added) {
            log.debug("Subscribed {} to {}", handlerName(handler), type);
        }
    }

    /**
     * Remove a registration. No-op if absent.
     */
    public void unsubscribe(EventType type, EventHandler handler) {
        List<EventHandler> list = handlers.get(type);
        if (list != null && list.remove(handler)) {
            log.debug("Unsubscribed {} from {}", handlerName(handler), type);
        }
    }

    /**
     * Drop every handler of one kind (test teardown).
     */
    public void clearSubscribers(EventType type) {
        List<EventHandler> list = handlers.remove(type);
        if (list != null && !list.isEmpty()) {
            log.debug("Cleared {} subscribers of {}", list.size(), type);
        }
    }

    /**
     * Drop every handler of every kind.
     */
    public void clearAll() {
        handlers.clear();
    }

    public int subscriberCount(EventType type) {
        List<EventHandler> list = handlers.get(type);
        return list == null ? 0 : list.size();
    }

    // ═══════════════════════════════════════════════════════════════
    // DELIVERY
    // ═══════════════════════════════════════════════════════════════

    /**
     * Deliver an event to every handler registered for its kind.
     */
    public void publish(LifecycleEvent event) {
        List<EventHandler> list = handlers.get(event.type());
        int count = list == null ? 0 : list.size();

        log.debug("Event published: type={}, entityId={}, entityType={}, handlers={}",
                  event.type(), event.entityId(), event.entityType(), count);
        metrics.recordEventPublished(event.type());

        if (count == 0) {
            return;
        }

        for (EventHandler handler : list) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                log.error("Subscriber {} failed handling {} for {}: {}",
                          handlerName(handler), event.type(), event.entityId(), e.getMessage(), e);
                metrics.recordSubscriberFailure(event.type());
            }
        }
    }

    private static String handlerName(EventHandler handler) {
        return handler.getClass().getName();
    }
}
