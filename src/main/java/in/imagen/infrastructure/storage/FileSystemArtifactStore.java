package in.imagen.infrastructure.storage;

import in.imagen.application.port.output.ArtifactStorageException;
import in.imagen.application.port.output.ArtifactStore;
import in.imagen.domain.artifact.ArtifactType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Iterator;
import java.util.Locale;
import java.util.UUID;

/**
 * Downloads http(s) outputs into a local directory as {@code <uuid>.<ext>}.
 * Image dimensions and format are read with ImageIO when the file is an image.
 */
public class FileSystemArtifactStore implements ArtifactStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);

    private static final String DEFAULT_EXTENSION = "png";

    private final Path directory;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public FileSystemArtifactStore(Path directory) {
        this(directory, Duration.ofSeconds(60));
    }

    public FileSystemArtifactStore(Path directory, Duration requestTimeout) {
        this.directory = directory;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public StoredFile store(String jobId, int index, String outputUrl) {
        if (outputUrl == null || !(outputUrl.startsWith("http://") || outputUrl.startsWith("https://"))) {
            throw new ArtifactStorageException(jobId, outputUrl, "Not a downloadable URL");
        }

        String extension = ArtifactType.extensionOf(outputUrl);
        if (extension.isEmpty()) {
            extension = DEFAULT_EXTENSION;
        }
        Path target = directory.resolve(UUID.randomUUID() + "." + extension);
        Path partial = directory.resolve(target.getFileName() + ".part");

        try {
            Files.createDirectories(directory);

            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(outputUrl))
                .timeout(requestTimeout)
                .GET()
                .build();
            HttpResponse<Path> response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(partial));

            if (response.statusCode() / 100 != 2) {
                discard(partial);
                throw new ArtifactStorageException(jobId, outputUrl, "HTTP error " + response.statusCode());
            }
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);

            long size = Files.size(target);
            StoredFile stored = describe(target, extension, size);
            log.info("Stored output {} of {} at {} ({} bytes, {}x{})",
                     index, jobId, target, size, stored.width(), stored.height());
            return stored;

        } catch (IOException e) {
            discard(partial);
            throw new ArtifactStorageException(jobId, outputUrl, "Download failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            discard(partial);
            Thread.currentThread().interrupt();
            throw new ArtifactStorageException(jobId, outputUrl, "Download interrupted", e);
        }
    }

    private void discard(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            log.warn("Could not delete partial download {}: {}", partial, e.getMessage());
        }
    }

    /**
     * Read dimensions and format without decoding the whole image.
     */
    StoredFile describe(Path file, String extension, long size) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(file.toFile())) {
            if (input != null) {
                Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
                if (readers.hasNext()) {
                    ImageReader reader = readers.next();
                    try {
                        reader.setInput(input);
                        return new StoredFile(file.toString(), reader.getWidth(0), reader.getHeight(0),
                                              reader.getFormatName().toLowerCase(Locale.ROOT), size);
                    } finally {
                        reader.dispose();
                    }
                }
            }
        }
        // Not an image ImageIO understands (video, audio, webp)
        return new StoredFile(file.toString(), null, null, extension, size);
    }

    public Path getDirectory() {
        return directory;
    }
}
