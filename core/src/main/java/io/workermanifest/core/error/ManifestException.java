package io.workermanifest.core.error;

/**
 * Abstract base for all worker-manifest exceptions. Never thrown directly; use the concrete
 * subclasses under {@link ManifestLoadException} or {@link ManifestResolveException}.
 */
public abstract class ManifestException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        RESOLVE
    }

    private final Phase phase;

    protected ManifestException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ManifestException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
