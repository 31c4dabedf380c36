package io.workermanifest.core.error;

/** Thrown when the effective worker name is rejected by the configured name validator. */
public final class InvalidNameException extends ManifestResolveException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public InvalidNameException(String name, String environment) {
        super("Invalid worker name \"" + name + "\"", environment);
        this.name = name;
    }

    /** The rejected name. */
    public String name() {
        return name;
    }
}
