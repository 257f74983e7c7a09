package in.imagen.domain.artifact;

import java.util.Locale;
import java.util.Set;

/**
 * Media type of a stored artifact.
 */
public enum ArtifactType {
    IMAGE,
    VIDEO,
    AUDIO;

    private static final Set<String> VIDEO_EXTENSIONS = Set.of("mp4", "webm", "mov", "avi", "mkv");
    private static final Set<String> AUDIO_EXTENSIONS = Set.of("mp3", "wav", "ogg", "flac", "m4a");

    /**
     * Infer the type from a file name or URL. Defaults to IMAGE.
     */
    public static ArtifactType fromReference(String reference) {
        String ext = extensionOf(reference);
        if (VIDEO_EXTENSIONS.contains(ext)) return VIDEO;
        if (AUDIO_EXTENSIONS.contains(ext)) return AUDIO;
        return IMAGE;
    }

    /**
     * Lower-case extension without the dot, ignoring any query string. Empty if none.
     */
    public static String extensionOf(String reference) {
        if (reference == null) return "";
        String path = reference;
        int query = path.indexOf('?');
        if (query >= 0) path = path.substring(0, query);
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot < slash) return "";
        return path.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
