package in.imagen.domain.order;

/**
 * Steps of order submission, used to report where a submission failed.
 */
public enum SubmissionStep {
    CONFIGURATION,
    LOAD_ORDER,
    PERSIST_ORDER,
    CREATE_JOB,
    PERSIST_GENERATION,
    UPDATE_ORDER_STATUS
}
