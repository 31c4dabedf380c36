package io.workermanifest.core.model;

import java.util.List;

/**
 * The routing fields of one resolution level (the top level or a single environment).
 * Every component is nullable; null means "not configured at this level".
 *
 * @param workersDev whether to deploy to the platform subdomain
 * @param route      a single route pattern
 * @param routes     a list of route patterns
 * @param zoneId     DNS zone the routes belong to
 * @param accountId  account that owns the worker
 */
public record RoutingInputs(Boolean workersDev, String route, List<String> routes, String zoneId, String accountId) {

    public RoutingInputs {
        routes = routes != null ? List.copyOf(routes) : null;
    }

    /** Returns {@code true} if {@code route} is set or {@code routes} is non-empty. */
    public boolean hasRoutes() {
        return route != null || (routes != null && !routes.isEmpty());
    }

    /**
     * Returns a copy whose unset account and zone ids are taken from the given fallbacks.
     * Values already set at this level win.
     */
    public RoutingInputs withFallbacks(String fallbackAccountId, String fallbackZoneId) {
        return new RoutingInputs(
                workersDev,
                route,
                routes,
                zoneId != null ? zoneId : fallbackZoneId,
                accountId != null ? accountId : fallbackAccountId);
    }
}
