package in.imagen.infrastructure.persistence;

import in.imagen.application.port.output.OrderRepository;
import in.imagen.application.port.output.PersistenceException;
import in.imagen.domain.order.Order;
import in.imagen.domain.order.OrderStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory order store.
 */
public final class InMemoryOrderRepository implements OrderRepository {

    private final Map<String, Order> orders = new ConcurrentHashMap<>();

    @Override
    public Order createOrder(String model, String prompt, Map<String, Object> baseParameters,
                             String projectId, OrderStatus status) {
        Order order = new Order(UUID.randomUUID().toString(), model, prompt, baseParameters,
                                status, projectId, Instant.now());
        orders.put(order.orderId(), order);
        return order;
    }

    @Override
    public Order updateOrderStatus(String orderId, OrderStatus status) {
        Order updated = orders.computeIfPresent(orderId, (id, existing) -> existing.withStatus(status));
        if (updated == null) {
            throw new PersistenceException("order", orderId, "Order not found");
        }
        return updated;
    }

    @Override
    public Optional<Order> findById(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    public List<Order> findAll() {
        return List.copyOf(orders.values());
    }
}
