package io.workermanifest.core.spi;

import java.util.Optional;

/**
 * Supplies overrides for top-level scalar manifest keys from outside the document, typically
 * from prefixed process environment variables ({@code CF_ACCOUNT_ID} overriding
 * {@code account_id}).
 *
 * <p>
 * The parser consults the provider once per overridable key while building a manifest. The
 * resolution core never reads process state itself; everything external enters through this
 * interface.
 *
 * <p>
 * Implementations must be thread-safe.
 */
@FunctionalInterface
public interface EnvironmentOverlayProvider {

    /**
     * Returns the override for a manifest key.
     *
     * @param key the manifest key as written in the document (e.g. {@code account_id})
     * @return the raw override value, or empty if the key is not overridden
     */
    Optional<String> valueFor(String key);

    /** A provider that overrides nothing. */
    static EnvironmentOverlayProvider none() {
        return key -> Optional.empty();
    }
}
