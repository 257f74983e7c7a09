package in.imagen.application.service;

/**
 * Result of a cancellation request.
 */
public enum CancelOutcome {
    CANCELED,    // Provider accepted, canceled event published
    NOT_ACTIVE,  // Unknown job id, or already terminal
    FAILED       // Provider cancel failed, failed event published
}
