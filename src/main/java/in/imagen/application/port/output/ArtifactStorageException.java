package in.imagen.application.port.output;

/**
 * Exception thrown when an output cannot be stored locally.
 */
public class ArtifactStorageException extends RuntimeException {

    private final String jobId;
    private final String outputUrl;

    public ArtifactStorageException(String jobId, String outputUrl, String message) {
        super(String.format("[%s:%s] %s", jobId, outputUrl, message));
        this.jobId = jobId;
        this.outputUrl = outputUrl;
    }

    public ArtifactStorageException(String jobId, String outputUrl, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", jobId, outputUrl, message), cause);
        this.jobId = jobId;
        this.outputUrl = outputUrl;
    }

    public String getJobId() {
        return jobId;
    }

    public String getOutputUrl() {
        return outputUrl;
    }
}
