package io.workermanifest.core.error;

/**
 * Abstract parent for errors raised while resolving a loaded manifest for one environment.
 * Carries the requested environment name ({@code null} for the top level).
 */
public abstract class ManifestResolveException extends ManifestException {

    private static final long serialVersionUID = 1L;

    private final String environment;

    protected ManifestResolveException(String message, String environment) {
        super(message, Phase.RESOLVE);
        this.environment = environment;
    }

    /** The environment being resolved, or {@code null} for the top level. */
    public String environment() {
        return environment;
    }
}
