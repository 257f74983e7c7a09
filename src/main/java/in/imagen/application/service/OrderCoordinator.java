package in.imagen.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * OrderCoordinator - single writer per order for sibling aggregation.
 *
 * Generations of one order may finish concurrently on different poller threads.
 * Every "evaluate all siblings" step for an order runs under that order's lock,
 * so two completions can never both observe "all terminal" from a stale read.
 *
 * PARTITIONING STRATEGY:
 * - Stripe count = clamp(availableProcessors(), 8, 32)
 * - Route by: hash(orderId) mod stripes
 *
 * Runs on the caller's thread; bus delivery stays synchronous.
 */
public final class OrderCoordinator {
    private static final Logger log = LoggerFactory.getLogger(OrderCoordinator.class);

    private static final int MIN_STRIPES = 8;
    private static final int MAX_STRIPES = 32;

    private final ReentrantLock[] stripes;

    public OrderCoordinator() {
        this(calculateOptimalStripes());
    }

    public OrderCoordinator(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be >= 1");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
        log.debug("OrderCoordinator initialized with {} stripes", stripeCount);
    }

    private static int calculateOptimalStripes() {
        int processors = Runtime.getRuntime().availableProcessors();
        return Math.max(MIN_STRIPES, Math.min(MAX_STRIPES, processors));
    }

    /**
     * Run a task while holding the order's lock.
     */
    public void execute(String orderId, Runnable task) {
        executeWithResult(orderId, () -> {
            task.run();
            return null;
        });
    }

    /**
     * Run a task while holding the order's lock and return its result.
     */
    public <T> T executeWithResult(String orderId, Supplier<T> task) {
        ReentrantLock lock = stripes[getStripe(orderId)];
        lock.lock();
        try {
            return task.get();
        } finally {
            lock.unlock();
        }
    }

    int getStripe(String orderId) {
        return Math.floorMod(orderId.hashCode(), stripes.length);
    }

    public int getStripeCount() {
        return stripes.length;
    }
}
