package in.imagen.domain.order;

/**
 * Result of submitting an order or an additional generation.
 */
public record SubmissionResult(
    boolean succeeded,
    Order order,             // null if the order was never persisted
    String jobId,            // null on failure
    SubmissionStep failedStep,
    String error
) {
    /**
     * Create a successful result.
     */
    public static SubmissionResult success(Order order, String jobId) {
        return new SubmissionResult(true, order, jobId, null, null);
    }

    /**
     * Create a failed result.
     */
    public static SubmissionResult failure(SubmissionStep step, String error) {
        return new SubmissionResult(false, null, null, step, error);
    }

    /**
     * Create a failed result for an order that was already persisted.
     */
    public static SubmissionResult failure(Order order, SubmissionStep step, String error) {
        return new SubmissionResult(false, order, null, step, error);
    }
}
