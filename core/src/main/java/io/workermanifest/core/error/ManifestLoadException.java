package io.workermanifest.core.error;

/**
 * Abstract parent for errors raised while turning a raw document into a {@code Manifest}.
 * Carries an additional {@code source} field identifying the file or resource that caused the
 * error.
 */
public abstract class ManifestLoadException extends ManifestException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected ManifestLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    protected ManifestLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null}. */
    public String source() {
        return source;
    }
}
