package in.imagen.application.port.output;

import in.imagen.domain.order.Order;
import in.imagen.domain.order.OrderStatus;

import java.util.Map;
import java.util.Optional;

/**
 * Order persistence. Implementations throw {@link PersistenceException} on failure.
 */
public interface OrderRepository {
    Order createOrder(String model, String prompt, Map<String, Object> baseParameters,
                      String projectId, OrderStatus status);

    Order updateOrderStatus(String orderId, OrderStatus status);

    Optional<Order> findById(String orderId);
}
