package io.workermanifest.core.document;

import static io.workermanifest.core.document.ManifestKeys.ACCOUNT_ID;
import static io.workermanifest.core.document.ManifestKeys.ENV;
import static io.workermanifest.core.document.ManifestKeys.KV_BINDING;
import static io.workermanifest.core.document.ManifestKeys.KV_BUCKET;
import static io.workermanifest.core.document.ManifestKeys.KV_ID;
import static io.workermanifest.core.document.ManifestKeys.KV_NAMESPACES;
import static io.workermanifest.core.document.ManifestKeys.NAME;
import static io.workermanifest.core.document.ManifestKeys.PRIVATE;
import static io.workermanifest.core.document.ManifestKeys.ROUTE;
import static io.workermanifest.core.document.ManifestKeys.ROUTES;
import static io.workermanifest.core.document.ManifestKeys.SITE;
import static io.workermanifest.core.document.ManifestKeys.SITE_BUCKET;
import static io.workermanifest.core.document.ManifestKeys.SITE_ENTRY_POINT;
import static io.workermanifest.core.document.ManifestKeys.SITE_EXCLUDE;
import static io.workermanifest.core.document.ManifestKeys.SITE_INCLUDE;
import static io.workermanifest.core.document.ManifestKeys.TYPE;
import static io.workermanifest.core.document.ManifestKeys.WEBPACK_CONFIG;
import static io.workermanifest.core.document.ManifestKeys.WORKERS_DEV;
import static io.workermanifest.core.document.ManifestKeys.ZONE_ID;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.workermanifest.core.model.Environment;
import io.workermanifest.core.model.KvNamespace;
import io.workermanifest.core.model.Manifest;
import io.workermanifest.core.model.SiteConfig;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a {@link Manifest} back into a generic document tree, the inverse of
 * {@link ManifestParser}. Unset fields are omitted; {@code name} and {@code type} are always
 * written. Writing the tree to a concrete format is left to the caller.
 *
 * <p>
 * Pure and thread-safe.
 */
public final class ManifestSerializer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ManifestSerializer() {}

    public static ObjectNode serialize(Manifest manifest) {
        Objects.requireNonNull(manifest, "manifest must not be null");
        ObjectNode root = NODES.objectNode();
        root.put(NAME, manifest.name());
        root.put(TYPE, manifest.targetKind().wireName());
        putIfSet(root, ACCOUNT_ID, manifest.accountId());
        putIfSet(root, WORKERS_DEV, manifest.workersDev());
        putIfSet(root, ROUTE, manifest.route());
        putIfSet(root, ROUTES, manifest.routes());
        putIfSet(root, ZONE_ID, manifest.zoneId());
        putIfSet(root, WEBPACK_CONFIG, manifest.webpackConfig());
        putIfSet(root, PRIVATE, manifest.privateProject());
        if (manifest.site() != null) {
            root.set(SITE, site(manifest.site()));
        }
        if (manifest.kvNamespaces() != null) {
            root.set(KV_NAMESPACES, kvNamespaces(manifest.kvNamespaces()));
        }
        if (manifest.environments() != null) {
            ObjectNode env = root.putObject(ENV);
            for (Map.Entry<String, Environment> entry : manifest.environments().entrySet()) {
                env.set(entry.getKey(), environment(entry.getValue()));
            }
        }
        return root;
    }

    private static ObjectNode environment(Environment environment) {
        ObjectNode node = NODES.objectNode();
        putIfSet(node, NAME, environment.name());
        putIfSet(node, ACCOUNT_ID, environment.accountId());
        putIfSet(node, WORKERS_DEV, environment.workersDev());
        putIfSet(node, ROUTE, environment.route());
        putIfSet(node, ROUTES, environment.routes());
        putIfSet(node, ZONE_ID, environment.zoneId());
        putIfSet(node, WEBPACK_CONFIG, environment.webpackConfig());
        putIfSet(node, PRIVATE, environment.privateProject());
        if (environment.kvNamespaces() != null) {
            node.set(KV_NAMESPACES, kvNamespaces(environment.kvNamespaces()));
        }
        return node;
    }

    private static ObjectNode site(SiteConfig site) {
        ObjectNode node = NODES.objectNode();
        node.put(SITE_BUCKET, site.bucket());
        putIfSet(node, SITE_ENTRY_POINT, site.entryPoint());
        putIfSet(node, SITE_INCLUDE, site.include());
        putIfSet(node, SITE_EXCLUDE, site.exclude());
        return node;
    }

    private static ArrayNode kvNamespaces(List<KvNamespace> namespaces) {
        ArrayNode array = NODES.arrayNode();
        for (KvNamespace namespace : namespaces) {
            ObjectNode node = array.addObject();
            node.put(KV_BINDING, namespace.binding());
            node.put(KV_ID, namespace.id());
            putIfSet(node, KV_BUCKET, namespace.bucket());
        }
        return array;
    }

    private static void putIfSet(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void putIfSet(ObjectNode node, String field, Boolean value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void putIfSet(ObjectNode node, String field, List<String> values) {
        if (values != null) {
            ArrayNode array = node.putArray(field);
            values.forEach(array::add);
        }
    }
}
