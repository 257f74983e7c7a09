package in.imagen.domain.order;

/**
 * Order status lifecycle.
 *
 * Flow: PENDING → PROCESSING → FULFILLED/FAILED/CANCELED
 * A PENDING order may also go straight to FAILED when submission is rolled back.
 */
public enum OrderStatus {
    PENDING,     // Persisted, job not yet created
    PROCESSING,  // At least one generation job running
    FULFILLED,   // All generations terminal, at least one completed
    FAILED,      // All generations terminal, none completed, at least one failed
    CANCELED;    // All generations canceled

    public boolean isTerminal() {
        return this == FULFILLED || this == FAILED || this == CANCELED;
    }

    public boolean isActive() {
        return !isTerminal();
    }

    /**
     * Check whether moving to {@code next} advances the lifecycle.
     * Terminal statuses never change and nothing moves back to PENDING.
     */
    public boolean canTransitionTo(OrderStatus next) {
        if (isTerminal() || next == null || next == this) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == PROCESSING || next == FAILED || next == CANCELED;
            case PROCESSING -> next.isTerminal();
            default -> false;
        };
    }
}
