package in.imagen.domain.common;

/**
 * Type of the entity an event is about.
 */
public enum EntityType {
    /**
     * ORDER: a user-level request.
     * Examples: order.created, order.fulfilled
     */
    ORDER,

    /**
     * GENERATION: one external job under an order.
     * Examples: generation.completed, generation.failed
     */
    GENERATION,

    /**
     * ARTIFACT: one stored output of a generation.
     */
    ARTIFACT,

    /**
     * PREDICTION: raw external job outcome, before it is persisted.
     */
    PREDICTION
}
