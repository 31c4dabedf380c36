package io.workermanifest.core.spi;

import java.util.regex.Pattern;

/**
 * Decides whether a worker name is acceptable to the deployment platform. Consulted before a
 * deploy config is built for the effective name.
 */
@FunctionalInterface
public interface NameValidator {

    /** Lowercase alphanumerics, dashes and underscores; must not start with a dash. */
    Pattern STANDARD_PATTERN = Pattern.compile("^[a-z0-9_][a-z0-9\\-_]*$");

    /**
     * @param name the effective worker name
     * @return {@code true} if the name may be deployed
     */
    boolean isValid(String name);

    /** The platform's standard worker-name rule. */
    static NameValidator standard() {
        return name -> name != null && STANDARD_PATTERN.matcher(name).matches();
    }
}
