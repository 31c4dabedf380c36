package io.workermanifest.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed worker manifest: the top-level configuration plus its environment overlays.
 *
 * <p>
 * Immutable, thread-safe. Created once by {@code ManifestParser} (or programmatically in
 * tests) and never modified by resolution.
 *
 * @param name           base worker name ({@code ""} when the document omits it)
 * @param targetKind     declared {@code type}
 * @param accountId      account id, or null when unset or empty
 * @param zoneId         zone id, or null when unset or empty
 * @param workersDev     routing: deploy to the platform subdomain
 * @param route          routing: single route pattern, or null when unset or empty
 * @param routes         routing: list of route patterns
 * @param webpackConfig  path to a custom webpack configuration
 * @param privateProject the {@code private} flag
 * @param site           static site table, or null
 * @param kvNamespaces   top-level KV bindings, or null
 * @param environments   overlays keyed by environment name, or null when the document has
 *                       no {@code env} table
 */
public record Manifest(
        String name,
        TargetKind targetKind,
        String accountId,
        String zoneId,
        Boolean workersDev,
        String route,
        List<String> routes,
        String webpackConfig,
        Boolean privateProject,
        SiteConfig site,
        List<KvNamespace> kvNamespaces,
        Map<String, Environment> environments) {

    public Manifest {
        Objects.requireNonNull(name, "manifest name must not be null");
        Objects.requireNonNull(targetKind, "manifest type must not be null");
        routes = routes != null ? List.copyOf(routes) : null;
        kvNamespaces = kvNamespaces != null ? List.copyOf(kvNamespaces) : null;
        environments = environments != null ? Collections.unmodifiableMap(new LinkedHashMap<>(environments)) : null;
    }

    /** The top-level routing fields. */
    public RoutingInputs routingInputs() {
        return new RoutingInputs(workersDev, route, routes, zoneId, accountId);
    }

    /** Returns {@code true} if the document declares an {@code env} table (even an empty one). */
    public boolean hasEnvironments() {
        return environments != null;
    }

    /** Starts a builder with the given name and kind and everything else unset. */
    public static Builder builder(String name, TargetKind targetKind) {
        return new Builder(name, targetKind);
    }

    /** Mutable builder for {@link Manifest}, mainly used by the parser and by tests. */
    public static final class Builder {

        private String name;
        private TargetKind targetKind;
        private String accountId;
        private String zoneId;
        private Boolean workersDev;
        private String route;
        private List<String> routes;
        private String webpackConfig;
        private Boolean privateProject;
        private SiteConfig site;
        private List<KvNamespace> kvNamespaces;
        private Map<String, Environment> environments;

        private Builder(String name, TargetKind targetKind) {
            this.name = name;
            this.targetKind = targetKind;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder targetKind(TargetKind targetKind) {
            this.targetKind = targetKind;
            return this;
        }

        public Builder accountId(String accountId) {
            this.accountId = accountId;
            return this;
        }

        public Builder zoneId(String zoneId) {
            this.zoneId = zoneId;
            return this;
        }

        public Builder workersDev(Boolean workersDev) {
            this.workersDev = workersDev;
            return this;
        }

        public Builder route(String route) {
            this.route = route;
            return this;
        }

        public Builder routes(List<String> routes) {
            this.routes = routes;
            return this;
        }

        public Builder webpackConfig(String webpackConfig) {
            this.webpackConfig = webpackConfig;
            return this;
        }

        public Builder privateProject(Boolean privateProject) {
            this.privateProject = privateProject;
            return this;
        }

        public Builder site(SiteConfig site) {
            this.site = site;
            return this;
        }

        public Builder kvNamespaces(List<KvNamespace> kvNamespaces) {
            this.kvNamespaces = kvNamespaces;
            return this;
        }

        public Builder environments(Map<String, Environment> environments) {
            this.environments = environments;
            return this;
        }

        /** Adds one overlay, creating the {@code env} table on first use. */
        public Builder environment(String environmentName, Environment environment) {
            if (this.environments == null) {
                this.environments = new LinkedHashMap<>();
            }
            this.environments.put(environmentName, environment);
            return this;
        }

        public Manifest build() {
            return new Manifest(
                    name,
                    targetKind,
                    accountId,
                    zoneId,
                    workersDev,
                    route,
                    routes,
                    webpackConfig,
                    privateProject,
                    site,
                    kvNamespaces,
                    environments);
        }
    }
}
