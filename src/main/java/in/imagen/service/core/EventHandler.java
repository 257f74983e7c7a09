package in.imagen.service.core;

import in.imagen.domain.common.LifecycleEvent;

/**
 * Subscriber callback. Invoked synchronously on the publishing thread.
 */
@FunctionalInterface
public interface EventHandler {
    void handle(LifecycleEvent event);
}
