package io.workermanifest.core.error;

/** Thrown when a requested environment overlay cannot be found. */
public final class EnvironmentLookupException extends ManifestResolveException {

    private static final long serialVersionUID = 1L;

    /** Why the lookup failed. */
    public enum Kind {
        /** The manifest has overlays, but none with the requested name. */
        UNKNOWN_ENVIRONMENT,
        /** The manifest has no {@code env} table at all. */
        NO_ENVIRONMENTS_DEFINED
    }

    private final Kind kind;

    private EnvironmentLookupException(String message, Kind kind, String environment) {
        super(message, environment);
        this.kind = kind;
    }

    public static EnvironmentLookupException unknownEnvironment(String environment) {
        return new EnvironmentLookupException(
                "Could not find environment with name \"" + environment + "\"", Kind.UNKNOWN_ENVIRONMENT, environment);
    }

    public static EnvironmentLookupException noEnvironmentsDefined(String environment) {
        return new EnvironmentLookupException(
                "There are no environments specified in your manifest (requested \"" + environment + "\")",
                Kind.NO_ENVIRONMENTS_DEFINED,
                environment);
    }

    public Kind kind() {
        return kind;
    }
}
