package in.imagen.application.port.output;

/**
 * Exception thrown when a repository call fails.
 */
public class PersistenceException extends RuntimeException {

    private final String entity;
    private final String entityId;

    public PersistenceException(String entity, String entityId, String message) {
        super(String.format("[%s:%s] %s", entity, entityId, message));
        this.entity = entity;
        this.entityId = entityId;
    }

    public PersistenceException(String entity, String entityId, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", entity, entityId, message), cause);
        this.entity = entity;
        this.entityId = entityId;
    }

    public String getEntity() {
        return entity;
    }

    public String getEntityId() {
        return entityId;
    }
}
