package io.workermanifest.core.engine;

import io.workermanifest.core.error.EnvironmentLookupException;
import io.workermanifest.core.error.InvalidNameException;
import io.workermanifest.core.error.RouteResolveException;
import io.workermanifest.core.model.DeployConfig;
import io.workermanifest.core.model.EffectiveTarget;
import io.workermanifest.core.model.Environment;
import io.workermanifest.core.model.Manifest;
import io.workermanifest.core.model.RoutingInputs;
import io.workermanifest.core.resolve.InheritanceResolver;
import io.workermanifest.core.resolve.NameUniquenessValidator;
import io.workermanifest.core.resolve.RouteResolver;
import io.workermanifest.core.spi.NameValidator;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers per-environment questions about a loaded {@link Manifest}: the effective worker
 * name, the effective build target and the deploy config.
 *
 * <p>
 * Worker names are checked for uniqueness once, at construction. Every query is computed
 * fresh from the immutable manifest; nothing is cached, so an engine can be shared freely
 * across threads.
 */
public final class ManifestEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ManifestEngine.class);

    private final Manifest manifest;
    private final NameValidator nameValidator;
    private final RouteResolver routeResolver;

    /** Creates an engine with the standard name rule and a strict route resolver. */
    public ManifestEngine(Manifest manifest) {
        this(manifest, NameValidator.standard(), RouteResolver.strict());
    }

    /**
     * @param manifest      the manifest to query
     * @param nameValidator rule applied to effective names before building a deploy config
     * @param routeResolver resolver for routing fields
     * @throws io.workermanifest.core.error.NameConflictException if worker names collide
     */
    public ManifestEngine(Manifest manifest, NameValidator nameValidator, RouteResolver routeResolver) {
        this.manifest = Objects.requireNonNull(manifest, "manifest must not be null");
        this.nameValidator = Objects.requireNonNull(nameValidator, "nameValidator must not be null");
        this.routeResolver = Objects.requireNonNull(routeResolver, "routeResolver must not be null");
        NameUniquenessValidator.validate(manifest, null);
    }

    /** Names of the declared environments, in declaration order; empty if none. */
    public Set<String> environmentNames() {
        return manifest.hasEnvironments() ? manifest.environments().keySet() : Set.of();
    }

    /**
     * Returns the worker name for an environment. Never fails: an unknown environment, or an
     * environment requested from a manifest without any, yields the top-level name.
     *
     * @param environmentName the environment, or null for the top level
     */
    public String effectiveName(String environmentName) {
        try {
            Environment overlay = InheritanceResolver.findEnvironment(manifest, environmentName);
            return InheritanceResolver.effectiveName(manifest, environmentName, overlay);
        } catch (EnvironmentLookupException e) {
            LOG.debug("Falling back to top-level name: environment={}, reason={}", environmentName, e.kind());
            return manifest.name();
        }
    }

    /**
     * Returns the effective build target for an environment.
     *
     * @param environmentName the environment, or null for the top level
     * @throws EnvironmentLookupException if the environment does not exist
     */
    public EffectiveTarget effectiveTarget(String environmentName) {
        return InheritanceResolver.resolve(manifest, environmentName);
    }

    /**
     * Returns the deploy config for an environment.
     *
     * <p>
     * An environment that declares any of {@code workers_dev}, {@code route} or {@code routes}
     * is resolved on its own, borrowing only the top-level account and zone ids. An environment
     * that declares none inherits the top-level target, which is only allowed when that target
     * is zoneless: a zoned worker needs its own routes per environment.
     *
     * @param environmentName the environment, or null for the top level
     * @throws InvalidNameException       if the effective name is rejected
     * @throws EnvironmentLookupException if the environment does not exist
     * @throws RouteResolveException      if routing does not resolve to exactly one target
     */
    public DeployConfig deployConfig(String environmentName) {
        String scriptName = effectiveName(environmentName);
        if (!nameValidator.isValid(scriptName)) {
            throw new InvalidNameException(scriptName, environmentName);
        }

        Environment overlay = InheritanceResolver.findEnvironment(manifest, environmentName);
        if (overlay == null) {
            return routeResolver.resolve(scriptName, manifest.routingInputs(), null);
        }

        RoutingInputs environmentRouting = overlay.routingInputs(manifest.accountId(), manifest.zoneId());
        if (environmentRouting != null) {
            return routeResolver.resolve(scriptName, environmentRouting, environmentName);
        }

        DeployConfig inherited = routeResolver.resolve(scriptName, manifest.routingInputs(), environmentName);
        return inherited.fold(
                zoned -> {
                    throw new RouteResolveException(
                            "You must specify route(s) per environment for zoned deploys (environment \""
                                    + environmentName + "\")",
                            RouteResolveException.Kind.ENVIRONMENT_ROUTE_REQUIRED,
                            environmentName);
                },
                zoneless -> zoneless);
    }
}
