package io.workermanifest.core.model;

import java.util.List;

/**
 * A named environment overlay ({@code [env.<name>]}). Every component is nullable; an unset
 * component means the overlay does not override that field. Overlays cannot declare
 * {@code type} or {@code site}.
 *
 * @param name           explicit worker name for this environment, or null
 * @param accountId      account override
 * @param zoneId         zone override
 * @param workersDev     routing: deploy to the platform subdomain
 * @param route          routing: single route pattern
 * @param routes         routing: list of route patterns
 * @param webpackConfig  webpack configuration path override
 * @param privateProject the {@code private} flag
 * @param kvNamespaces   KV bindings of this environment only (never inherited)
 */
public record Environment(
        String name,
        String accountId,
        String zoneId,
        Boolean workersDev,
        String route,
        List<String> routes,
        String webpackConfig,
        Boolean privateProject,
        List<KvNamespace> kvNamespaces) {

    public Environment {
        routes = routes != null ? List.copyOf(routes) : null;
        kvNamespaces = kvNamespaces != null ? List.copyOf(kvNamespaces) : null;
    }

    /** An overlay that overrides nothing. */
    public static Environment empty() {
        return new Environment(null, null, null, null, null, null, null, null, null);
    }

    /**
     * Returns {@code true} if this overlay configures its own deploy target, i.e. sets any of
     * {@code workers_dev}, {@code route} or {@code routes}. Account and zone ids alone do not
     * count: they only refine whatever target the overlay declares.
     */
    public boolean declaresRouting() {
        return workersDev != null || route != null || routes != null;
    }

    /**
     * Builds this overlay's routing inputs, falling back to the top-level account and zone ids.
     *
     * @return the routing inputs, or null if this overlay declares no routing of its own
     */
    public RoutingInputs routingInputs(String topLevelAccountId, String topLevelZoneId) {
        if (!declaresRouting()) {
            return null;
        }
        return new RoutingInputs(workersDev, route, routes, zoneId, accountId)
                .withFallbacks(topLevelAccountId, topLevelZoneId);
    }
}
