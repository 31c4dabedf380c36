package io.workermanifest.core.resolve;

import io.workermanifest.core.error.EnvironmentLookupException;
import io.workermanifest.core.model.EffectiveTarget;
import io.workermanifest.core.model.Environment;
import io.workermanifest.core.model.Manifest;
import io.workermanifest.core.model.TargetKind;
import java.util.Objects;

/**
 * Merges an environment overlay into the top level of a {@link Manifest}, producing the
 * {@link EffectiveTarget} for that environment. Each field follows the policy declared on
 * {@link TargetField}; the effective name is computed by {@link #effectiveName}.
 *
 * <p>
 * A declared {@code site} forces {@link TargetKind#WEBPACK} regardless of the {@code type}
 * key, for the top level and every environment alike.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class InheritanceResolver {

    private InheritanceResolver() {}

    /**
     * Resolves the effective target.
     *
     * @param manifest        the manifest
     * @param environmentName the environment to resolve, or null for the top level
     * @return the effective target
     * @throws EnvironmentLookupException if the named environment does not exist
     */
    public static EffectiveTarget resolve(Manifest manifest, String environmentName) {
        Objects.requireNonNull(manifest, "manifest must not be null");
        Environment overlay = findEnvironment(manifest, environmentName);

        TargetKind kind = TargetField.TARGET_KIND.policy().apply(manifest.targetKind(), null);
        if (TargetField.SITE.policy().apply(manifest.site(), null) != null) {
            kind = TargetKind.WEBPACK;
        }

        if (overlay == null) {
            return new EffectiveTarget(
                    manifest.name(),
                    kind,
                    manifest.accountId(),
                    manifest.webpackConfig(),
                    manifest.kvNamespaces(),
                    manifest.site());
        }

        return new EffectiveTarget(
                effectiveName(manifest, environmentName, overlay),
                kind,
                TargetField.ACCOUNT_ID.policy().apply(manifest.accountId(), overlay.accountId()),
                TargetField.WEBPACK_CONFIG.policy().apply(manifest.webpackConfig(), overlay.webpackConfig()),
                TargetField.KV_NAMESPACES.policy().apply(manifest.kvNamespaces(), overlay.kvNamespaces()),
                TargetField.SITE.policy().apply(manifest.site(), null));
    }

    /**
     * Looks up an environment overlay.
     *
     * @return the overlay, or null when {@code environmentName} is null
     * @throws EnvironmentLookupException if the name is given but not defined
     */
    public static Environment findEnvironment(Manifest manifest, String environmentName) {
        if (environmentName == null) {
            return null;
        }
        if (!manifest.hasEnvironments()) {
            throw EnvironmentLookupException.noEnvironmentsDefined(environmentName);
        }
        Environment environment = manifest.environments().get(environmentName);
        if (environment == null) {
            throw EnvironmentLookupException.unknownEnvironment(environmentName);
        }
        return environment;
    }

    /**
     * Computes the worker name of an environment: the overlay's explicit name, else
     * {@code <top-level name>-<environment name>}; the top-level name when no overlay applies.
     */
    public static String effectiveName(Manifest manifest, String environmentName, Environment overlay) {
        if (overlay == null || environmentName == null) {
            return manifest.name();
        }
        if (overlay.name() != null) {
            return overlay.name();
        }
        return manifest.name() + "-" + environmentName;
    }
}
