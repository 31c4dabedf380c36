package io.workermanifest.core.resolve;

import io.workermanifest.core.error.RouteResolveException;
import io.workermanifest.core.error.RouteResolveException.Kind;
import io.workermanifest.core.model.DeployConfig;
import io.workermanifest.core.model.RoutingInputs;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether one level of routing fields describes a zoned deploy, a zoneless deploy,
 * or an invalid combination.
 *
 * <p>
 * Evaluation order:
 * <ol>
 * <li>{@code route} together with a non-empty {@code routes}: ambiguous</li>
 * <li>{@code workers_dev = true} together with any route: ambiguous</li>
 * <li>{@code workers_dev = true}: zoneless (account id required)</li>
 * <li>{@code route} or {@code routes}: zoned (non-blank patterns, account id, zone id
 * required, checked in that order)</li>
 * <li>nothing: no target, or a zoneless deploy with {@code workers_dev = false} when the
 * resolver permits unrouted targets</li>
 * </ol>
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class RouteResolver {

    private static final Logger LOG = LoggerFactory.getLogger(RouteResolver.class);

    private static final RouteResolver STRICT = new RouteResolver(false);
    private static final RouteResolver PERMISSIVE = new RouteResolver(true);

    private final boolean permitUnroutedTarget;

    private RouteResolver(boolean permitUnroutedTarget) {
        this.permitUnroutedTarget = permitUnroutedTarget;
    }

    /** A resolver that rejects a level with no deploy target ({@link Kind#NO_TARGET}). */
    public static RouteResolver strict() {
        return STRICT;
    }

    /**
     * A resolver that turns a level with no deploy target into a zoneless config with
     * {@code workersDev = false}, for callers that only need a dev-only target.
     */
    public static RouteResolver permittingUnroutedTarget() {
        return PERMISSIVE;
    }

    /**
     * Resolves routing fields after filling unset account and zone ids from the fallbacks.
     *
     * @param scriptName        effective worker name
     * @param inputs            routing fields of the level being resolved
     * @param fallbackAccountId account id used when {@code inputs} has none, may be null
     * @param fallbackZoneId    zone id used when {@code inputs} has none, may be null
     * @return the deploy config
     * @throws RouteResolveException if the fields do not describe exactly one target
     */
    public DeployConfig resolve(
            String scriptName, RoutingInputs inputs, String fallbackAccountId, String fallbackZoneId) {
        return resolve(scriptName, inputs.withFallbacks(fallbackAccountId, fallbackZoneId), null);
    }

    /** Resolves routing fields as given, without fallbacks. */
    public DeployConfig resolve(String scriptName, RoutingInputs inputs) {
        return resolve(scriptName, inputs, null);
    }

    /**
     * Resolves routing fields as given.
     *
     * @param environment environment name recorded on errors, or null for the top level
     */
    public DeployConfig resolve(String scriptName, RoutingInputs inputs, String environment) {
        Objects.requireNonNull(scriptName, "scriptName must not be null");
        Objects.requireNonNull(inputs, "inputs must not be null");

        boolean hasRoute = inputs.route() != null;
        boolean hasRouteList = inputs.routes() != null && !inputs.routes().isEmpty();
        boolean workersDev = Boolean.TRUE.equals(inputs.workersDev());

        if (hasRoute && hasRouteList) {
            throw new RouteResolveException(
                    "Specify either 'route' or 'routes', not both", Kind.AMBIGUOUS_CONFIG, environment);
        }
        if (workersDev && inputs.hasRoutes()) {
            throw new RouteResolveException(
                    "'workers_dev = true' cannot be combined with 'route' or 'routes'; pick one deploy target",
                    Kind.AMBIGUOUS_CONFIG,
                    environment);
        }

        DeployConfig config;
        if (workersDev) {
            config = new DeployConfig.Zoneless(requireAccountId(inputs, environment), scriptName, true);
        } else if (inputs.hasRoutes()) {
            config = zoned(scriptName, inputs, hasRoute ? List.of(inputs.route()) : inputs.routes(), environment);
        } else if (permitUnroutedTarget) {
            config = new DeployConfig.Zoneless(requireAccountId(inputs, environment), scriptName, false);
        } else {
            throw new RouteResolveException(
                    "No deploy target specified: set 'workers_dev = true' or provide 'route'/'routes' with a 'zone_id'",
                    Kind.NO_TARGET,
                    environment);
        }

        LOG.debug(
                "Routing resolved: script={}, environment={}, mode={}",
                scriptName,
                environment,
                config.fold(zoned -> "zoned", zoneless -> "zoneless"));
        return config;
    }

    private DeployConfig.Zoned zoned(String scriptName, RoutingInputs inputs, List<String> routes, String environment) {
        for (String pattern : routes) {
            if (pattern == null || pattern.isBlank()) {
                throw new RouteResolveException(
                        "Route patterns must not be empty", Kind.INVALID_ROUTE, environment);
            }
        }
        String accountId = requireAccountId(inputs, environment);
        if (inputs.zoneId() == null || inputs.zoneId().isEmpty()) {
            throw new RouteResolveException(
                    "Field 'zone_id' is required to deploy to routes", Kind.MISSING_ZONE_ID, environment);
        }
        return new DeployConfig.Zoned(accountId, inputs.zoneId(), scriptName, routes);
    }

    private static String requireAccountId(RoutingInputs inputs, String environment) {
        if (inputs.accountId() == null || inputs.accountId().isEmpty()) {
            throw new RouteResolveException(
                    "Field 'account_id' is required to deploy", Kind.MISSING_ACCOUNT_ID, environment);
        }
        return inputs.accountId();
    }
}
