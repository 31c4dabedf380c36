package io.workermanifest.core.model;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Where a worker is published: bound to routes in a DNS zone ({@link Zoned}) or served from
 * the platform subdomain ({@link Zoneless}).
 *
 * <p>
 * Closed hierarchy. Consumers branch with {@link #fold(Function, Function)}, which names every
 * variant in its signature, so a new routing mode is a compile error at each consumption site.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface DeployConfig {

    /** The worker script name this config deploys. */
    String scriptName();

    /** The account that owns the worker. */
    String accountId();

    /** Applies the function matching this variant. */
    <R> R fold(Function<Zoned, R> onZoned, Function<Zoneless, R> onZoneless);

    /**
     * A deploy bound to explicit route patterns in one zone.
     *
     * @param accountId  owning account
     * @param zoneId     zone the routes belong to
     * @param scriptName worker script name
     * @param routes     route patterns, never empty
     */
    record Zoned(String accountId, String zoneId, String scriptName, List<String> routes) implements DeployConfig {

        public Zoned {
            Objects.requireNonNull(accountId, "accountId must not be null");
            Objects.requireNonNull(zoneId, "zoneId must not be null");
            Objects.requireNonNull(scriptName, "scriptName must not be null");
            Objects.requireNonNull(routes, "routes must not be null");
            if (routes.isEmpty()) {
                throw new IllegalArgumentException("a zoned deploy needs at least one route");
            }
            routes = List.copyOf(routes);
        }

        @Override
        public <R> R fold(Function<Zoned, R> onZoned, Function<Zoneless, R> onZoneless) {
            return onZoned.apply(this);
        }
    }

    /**
     * A deploy to the platform-provided subdomain.
     *
     * @param accountId  owning account
     * @param scriptName worker script name
     * @param workersDev whether the subdomain deploy is enabled
     */
    record Zoneless(String accountId, String scriptName, boolean workersDev) implements DeployConfig {

        public Zoneless {
            Objects.requireNonNull(accountId, "accountId must not be null");
            Objects.requireNonNull(scriptName, "scriptName must not be null");
        }

        @Override
        public <R> R fold(Function<Zoned, R> onZoned, Function<Zoneless, R> onZoneless) {
            return onZoneless.apply(this);
        }
    }
}
