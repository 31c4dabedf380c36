package io.workermanifest.core.document;

import java.util.List;
import java.util.Set;

/** Key names of the manifest document format, shared by the parser and the serializer. */
public final class ManifestKeys {

    public static final String NAME = "name";
    public static final String TYPE = "type";
    public static final String ACCOUNT_ID = "account_id";
    public static final String ZONE_ID = "zone_id";
    public static final String WORKERS_DEV = "workers_dev";
    public static final String ROUTE = "route";
    public static final String ROUTES = "routes";
    public static final String WEBPACK_CONFIG = "webpack_config";
    public static final String PRIVATE = "private";
    public static final String SITE = "site";
    public static final String KV_NAMESPACES = "kv-namespaces";
    public static final String ENV = "env";

    public static final String SITE_BUCKET = "bucket";
    public static final String SITE_ENTRY_POINT = "entry-point";
    public static final String SITE_INCLUDE = "include";
    public static final String SITE_EXCLUDE = "exclude";

    public static final String KV_ID = "id";
    public static final String KV_BINDING = "binding";
    public static final String KV_BUCKET = "bucket";

    /** Recognized top-level keys. */
    public static final Set<String> ROOT_KEYS = Set.of(
            NAME, TYPE, ACCOUNT_ID, ZONE_ID, WORKERS_DEV, ROUTE, ROUTES, WEBPACK_CONFIG, PRIVATE, SITE, KV_NAMESPACES, ENV);

    /** Recognized keys inside an {@code env.<name>} table. {@code type} and {@code site} are top-level only. */
    public static final Set<String> ENVIRONMENT_KEYS = Set.of(
            NAME, ACCOUNT_ID, ZONE_ID, WORKERS_DEV, ROUTE, ROUTES, WEBPACK_CONFIG, PRIVATE, KV_NAMESPACES);

    /** Recognized keys inside the {@code site} table. */
    public static final Set<String> SITE_KEYS = Set.of(SITE_BUCKET, SITE_ENTRY_POINT, SITE_INCLUDE, SITE_EXCLUDE);

    /** Recognized keys inside a {@code kv-namespaces} entry. */
    public static final Set<String> KV_NAMESPACE_KEYS = Set.of(KV_ID, KV_BINDING, KV_BUCKET);

    /** Top-level scalar keys an {@code EnvironmentOverlayProvider} may override, in lookup order. */
    public static final List<String> OVERRIDABLE_KEYS =
            List.of(NAME, TYPE, ACCOUNT_ID, ZONE_ID, WORKERS_DEV, ROUTE, WEBPACK_CONFIG, PRIVATE);

    /** Overridable keys whose values are booleans. */
    public static final Set<String> BOOLEAN_KEYS = Set.of(WORKERS_DEV, PRIVATE);

    private ManifestKeys() {
        // constants
    }
}
