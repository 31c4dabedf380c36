package io.workermanifest.core.error;

/** Thrown when routing fields do not resolve to exactly one deploy configuration. */
public final class RouteResolveException extends ManifestResolveException {

    private static final long serialVersionUID = 1L;

    /** The routing rule that was violated. */
    public enum Kind {
        /** No route, no routes and no {@code workers_dev = true}. */
        NO_TARGET,
        /** Both route and routes, or workers_dev together with a route. */
        AMBIGUOUS_CONFIG,
        /** A deploy needs an account id and none is configured. */
        MISSING_ACCOUNT_ID,
        /** A zoned deploy needs a zone id and none is configured. */
        MISSING_ZONE_ID,
        /** A route pattern is blank. */
        INVALID_ROUTE,
        /** The top level is zoned and the environment brings no routing of its own. */
        ENVIRONMENT_ROUTE_REQUIRED
    }

    private final Kind kind;

    public RouteResolveException(String message, Kind kind, String environment) {
        super(message, environment);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
