package io.workermanifest.core.error;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Thrown when the top-level name and the explicit environment names are not pairwise
 * distinct. Each duplicated name is reported once.
 */
public final class NameConflictException extends ManifestLoadException {

    private static final long serialVersionUID = 1L;

    private final Set<String> duplicates;

    public NameConflictException(Set<String> duplicates, String source) {
        super(buildMessage(duplicates), source);
        this.duplicates = Collections.unmodifiableSet(new TreeSet<>(duplicates));
    }

    /** The duplicated names, sorted. */
    public Set<String> duplicates() {
        return duplicates;
    }

    private static String buildMessage(Set<String> duplicates) {
        String wording = duplicates.size() == 1 ? "this name is duplicated" : "these names are duplicated";
        return "Each name in your manifest must be unique, " + wording + ": "
                + String.join(", ", new TreeSet<>(duplicates));
    }
}
