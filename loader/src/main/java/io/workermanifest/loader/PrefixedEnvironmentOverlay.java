package io.workermanifest.loader;

import io.workermanifest.core.spi.EnvironmentOverlayProvider;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Overrides manifest keys from prefixed environment variables: with the default {@code CF_}
 * prefix, {@code CF_ACCOUNT_ID} overrides {@code account_id} and {@code CF_WORKERS_DEV}
 * overrides {@code workers_dev}.
 *
 * <p>
 * A variable counts as "set" if and only if it is defined AND its trimmed value is non-empty;
 * empty or whitespace-only values leave the document value in place.
 */
public final class PrefixedEnvironmentOverlay implements EnvironmentOverlayProvider {

    /** Prefix used by {@link #fromSystem()}. */
    public static final String DEFAULT_PREFIX = "CF_";

    private final String prefix;
    private final Function<String, String> envLookup;

    /**
     * @param prefix    variable name prefix, e.g. {@code CF_}
     * @param envLookup maps variable names to values; {@code null} means not defined
     */
    public PrefixedEnvironmentOverlay(String prefix, Function<String, String> envLookup) {
        this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
    }

    /** Reads {@code CF_*} variables from the process environment. */
    public static PrefixedEnvironmentOverlay fromSystem() {
        return new PrefixedEnvironmentOverlay(DEFAULT_PREFIX, System::getenv);
    }

    /** The variable name consulted for a manifest key ({@code webpack_config} → {@code CF_WEBPACK_CONFIG}). */
    public String variableFor(String key) {
        return prefix + key.toUpperCase(Locale.ROOT).replace('-', '_');
    }

    @Override
    public Optional<String> valueFor(String key) {
        String value = envLookup.apply(variableFor(key));
        if (value == null || value.trim().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }
}
