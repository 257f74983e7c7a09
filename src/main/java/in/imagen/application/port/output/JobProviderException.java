package in.imagen.application.port.output;

/**
 * Exception thrown when a job provider call fails.
 */
public class JobProviderException extends RuntimeException {

    private final String operation;
    private final String jobId;
    private final int statusCode;

    public JobProviderException(String operation, String jobId, String message) {
        this(operation, jobId, -1, message, null);
    }

    public JobProviderException(String operation, String jobId, String message, Throwable cause) {
        this(operation, jobId, -1, message, cause);
    }

    public JobProviderException(String operation, String jobId, int statusCode, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", operation, jobId, message), cause);
        this.operation = operation;
        this.jobId = jobId;
        this.statusCode = statusCode;
    }

    public String getOperation() {
        return operation;
    }

    public String getJobId() {
        return jobId;
    }

    /**
     * HTTP status returned by the provider, -1 if the call never got a response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
