package io.workermanifest.core.error;

/** Thrown when a manifest document is unreadable, mistyped, incomplete, or has unknown keys. */
public class ManifestFormatException extends ManifestLoadException {

    private static final long serialVersionUID = 1L;

    public ManifestFormatException(String message, String source) {
        super(message, source);
    }

    public ManifestFormatException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
