package in.imagen.application.port.output;

import java.util.Map;

/**
 * External asynchronous generation service.
 * Every operation throws {@link JobProviderException} when the call fails.
 */
public interface JobStatusProvider {

    /**
     * Create a job.
     *
     * @param model Model identifier ("owner/name" or "owner/name:version")
     * @param params Model input, passed through unchanged
     * @return Provider job id
     */
    String createJob(String model, Map<String, Object> params);

    /**
     * Fetch the current job status.
     */
    JobStatus getJob(String jobId);

    /**
     * Ask the provider to cancel a job.
     */
    void cancelJob(String jobId);

    /**
     * Snapshot of an external job.
     *
     * @param status starting, processing, succeeded, failed, canceled (anything else counts as in progress)
     * @param output raw output: null, a single value, or a list
     * @param error provider error text, may be null
     */
    record JobStatus(String id, String status, Object output, String error) {
        public static final String SUCCEEDED = "succeeded";
        public static final String FAILED = "failed";
        public static final String CANCELED = "canceled";
        public static final String PROCESSING = "processing";

        public boolean isSucceeded() {
            return SUCCEEDED.equalsIgnoreCase(status);
        }

        public boolean isFailed() {
            return FAILED.equalsIgnoreCase(status);
        }

        public boolean isCanceled() {
            return CANCELED.equalsIgnoreCase(status) || "cancelled".equalsIgnoreCase(status);
        }

        public boolean isProcessing() {
            return PROCESSING.equalsIgnoreCase(status);
        }
    }
}
