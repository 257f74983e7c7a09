package in.imagen.application.port.output;

/**
 * Retrieves a raw job output into local storage.
 */
public interface ArtifactStore {

    /**
     * Store one output.
     *
     * @param jobId Job that produced the output
     * @param index Position of the output in the job's output list
     * @param outputUrl Raw output reference
     * @return Facts about the stored file
     * @throws ArtifactStorageException if the output cannot be retrieved or written
     */
    StoredFile store(String jobId, int index, String outputUrl);

    /**
     * Stored file facts. Dimensions are null when they cannot be read.
     */
    record StoredFile(String path, Integer width, Integer height, String format, long sizeBytes) {}
}
