package in.imagen.domain.generation;

/**
 * Generation status lifecycle.
 *
 * Flow: STARTING → IN_PROGRESS → COMPLETED/FAILED/CANCELLED
 */
public enum GenerationStatus {
    STARTING,     // Job created at the provider
    IN_PROGRESS,  // Provider reported processing
    COMPLETED,    // Outputs available, artifacts created
    FAILED,       // Provider failure, transport error or timeout
    CANCELLED;    // Canceled on request

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
