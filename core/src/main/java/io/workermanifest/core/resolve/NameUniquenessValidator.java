package io.workermanifest.core.resolve;

import io.workermanifest.core.error.NameConflictException;
import io.workermanifest.core.model.Environment;
import io.workermanifest.core.model.Manifest;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks that the top-level worker name and every explicit environment {@code name} are
 * pairwise distinct. Environments without an explicit name are skipped; their derived
 * {@code <name>-<env>} names are not considered.
 */
public final class NameUniquenessValidator {

    private NameUniquenessValidator() {}

    /**
     * @param manifest the manifest to check
     * @param source   file path or resource identifier for error context, may be null
     * @throws NameConflictException listing every duplicated name once
     */
    public static void validate(Manifest manifest, String source) {
        Set<String> duplicates = findDuplicates(manifest);
        if (!duplicates.isEmpty()) {
            throw new NameConflictException(duplicates, source);
        }
    }

    /** Returns the duplicated names, sorted; empty when all names are distinct. */
    public static Set<String> findDuplicates(Manifest manifest) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new TreeSet<>();
        seen.add(manifest.name());
        if (manifest.environments() != null) {
            for (Environment environment : manifest.environments().values()) {
                String name = environment.name();
                if (name != null && !seen.add(name)) {
                    duplicates.add(name);
                }
            }
        }
        return duplicates;
    }
}
