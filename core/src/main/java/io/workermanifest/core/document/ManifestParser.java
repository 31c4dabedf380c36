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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.workermanifest.core.error.ManifestFormatException;
import io.workermanifest.core.error.MisplacedFieldException;
import io.workermanifest.core.model.Environment;
import io.workermanifest.core.model.KvNamespace;
import io.workermanifest.core.model.Manifest;
import io.workermanifest.core.model.SiteConfig;
import io.workermanifest.core.model.TargetKind;
import io.workermanifest.core.resolve.NameUniquenessValidator;
import io.workermanifest.core.spi.EnvironmentOverlayProvider;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a generic document tree (as produced by any Jackson data format) onto a
 * {@link Manifest}.
 *
 * <p>
 * Keys this library does not model ({@code vars}, {@code usage_model}, ...) are skipped at
 * the top level, in {@code env.<name>} tables and in {@code kv-namespaces} entries, so
 * manifests written for newer tooling still load. The {@code site} table is strict: an
 * unknown key there is a {@link ManifestFormatException}, and a {@code kv-namespaces} key
 * gets its own {@link MisplacedFieldException}, since a TOML {@code [site]} header silently
 * captures every key written below it.
 *
 * <p>
 * Overrides from the {@link EnvironmentOverlayProvider} are applied to the top-level scalar
 * keys before mapping. After mapping, worker names are checked for uniqueness.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class ManifestParser {

    private static final Logger LOG = LoggerFactory.getLogger(ManifestParser.class);

    private ManifestParser() {}

    /** Parses a tree with no external overrides. */
    public static Manifest parse(JsonNode root, String source) {
        return parse(root, source, EnvironmentOverlayProvider.none());
    }

    /**
     * Parses a document tree into a validated manifest.
     *
     * @param root    the document tree; must be an object
     * @param source  file path or resource identifier for error context, may be null
     * @param overlay provider of top-level scalar overrides
     * @return the parsed manifest
     * @throws ManifestFormatException if the tree is malformed or contains unknown keys
     * @throws io.workermanifest.core.error.NameConflictException if worker names collide
     */
    public static Manifest parse(JsonNode root, String source, EnvironmentOverlayProvider overlay) {
        Objects.requireNonNull(overlay, "overlay must not be null");
        if (root == null || !root.isObject()) {
            throw new ManifestFormatException("Manifest document must be a table of keys", source);
        }
        ObjectNode document = applyOverlay((ObjectNode) root, overlay, source);

        ignoreUnknownKeys(document, ManifestKeys.ROOT_KEYS, "top level", source);

        String typeValue = requireString(document, TYPE, "top level", source);
        TargetKind targetKind = TargetKind.fromWireName(typeValue)
                .orElseThrow(() -> new ManifestFormatException(
                        "Unknown type '" + typeValue + "', expected one of: "
                                + Arrays.stream(TargetKind.values())
                                        .map(TargetKind::wireName)
                                        .collect(Collectors.joining(", ")),
                        source));

        String name = optionalString(document, NAME, "top level", source);
        Manifest manifest = Manifest.builder(name != null ? name : "", targetKind)
                .accountId(optionalNonEmptyString(document, ACCOUNT_ID, "top level", source))
                .zoneId(optionalNonEmptyString(document, ZONE_ID, "top level", source))
                .workersDev(optionalBoolean(document, WORKERS_DEV, "top level", source))
                .route(optionalNonEmptyString(document, ROUTE, "top level", source))
                .routes(optionalStringList(document, ROUTES, "top level", source))
                .webpackConfig(optionalString(document, WEBPACK_CONFIG, "top level", source))
                .privateProject(optionalBoolean(document, PRIVATE, "top level", source))
                .site(parseSite(document.get(SITE), source))
                .kvNamespaces(parseKvNamespaces(document.get(KV_NAMESPACES), KV_NAMESPACES, source))
                .environments(parseEnvironments(document.get(ENV), source))
                .build();

        NameUniquenessValidator.validate(manifest, source);

        LOG.debug(
                "Manifest parsed: source={}, name={}, type={}, environments={}",
                source,
                manifest.name(),
                manifest.targetKind().wireName(),
                manifest.hasEnvironments() ? manifest.environments().keySet() : "none");
        return manifest;
    }

    // --- Overlay ---

    private static ObjectNode applyOverlay(ObjectNode root, EnvironmentOverlayProvider overlay, String source) {
        ObjectNode document = null;
        for (String key : ManifestKeys.OVERRIDABLE_KEYS) {
            var value = overlay.valueFor(key);
            if (value.isEmpty()) {
                continue;
            }
            if (document == null) {
                document = root.deepCopy();
            }
            String raw = value.get();
            if (ManifestKeys.BOOLEAN_KEYS.contains(key)) {
                document.set(key, BooleanNode.valueOf(parseBooleanOverride(key, raw, source)));
            } else {
                document.set(key, TextNode.valueOf(raw));
            }
            LOG.debug("Environment override applied: key={}", key);
        }
        return document != null ? document : root;
    }

    private static boolean parseBooleanOverride(String key, String raw, String source) {
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw new ManifestFormatException(
                "Environment override for '" + key + "' must be 'true' or 'false', got '" + raw + "'", source);
    }

    // --- Tables ---

    private static SiteConfig parseSite(JsonNode siteNode, String source) {
        if (siteNode == null || siteNode.isNull()) {
            return null;
        }
        if (!siteNode.isObject()) {
            throw new ManifestFormatException("'site' must be a table", source);
        }
        if (siteNode.has(KV_NAMESPACES)) {
            throw new MisplacedFieldException(KV_NAMESPACES, SITE, "top level", source);
        }
        rejectUnknownKeys(siteNode, ManifestKeys.SITE_KEYS, SITE, source);
        return new SiteConfig(
                requireString(siteNode, SITE_BUCKET, SITE, source),
                optionalString(siteNode, SITE_ENTRY_POINT, SITE, source),
                optionalStringList(siteNode, SITE_INCLUDE, SITE, source),
                optionalStringList(siteNode, SITE_EXCLUDE, SITE, source));
    }

    private static List<KvNamespace> parseKvNamespaces(JsonNode node, String blockName, String source) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new ManifestFormatException("'" + blockName + "' must be an array of tables", source);
        }
        List<KvNamespace> namespaces = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            String entryName = blockName + "[" + i + "]";
            if (!entry.isObject()) {
                throw new ManifestFormatException("'" + entryName + "' must be a table", source);
            }
            ignoreUnknownKeys(entry, ManifestKeys.KV_NAMESPACE_KEYS, entryName, source);
            namespaces.add(new KvNamespace(
                    requireString(entry, KV_ID, entryName, source),
                    requireString(entry, KV_BINDING, entryName, source),
                    optionalString(entry, KV_BUCKET, entryName, source)));
        }
        return namespaces;
    }

    private static Map<String, Environment> parseEnvironments(JsonNode envNode, String source) {
        if (envNode == null || envNode.isNull()) {
            return null;
        }
        if (!envNode.isObject()) {
            throw new ManifestFormatException("'env' must be a table of environments", source);
        }
        Map<String, Environment> environments = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> field : envNode.properties()) {
            environments.put(field.getKey(), parseEnvironment(field.getKey(), field.getValue(), source));
        }
        return environments;
    }

    private static Environment parseEnvironment(String environmentName, JsonNode node, String source) {
        String blockName = "env." + environmentName;
        if (!node.isObject()) {
            throw new ManifestFormatException("'" + blockName + "' must be a table", source);
        }
        ignoreUnknownKeys(node, ManifestKeys.ENVIRONMENT_KEYS, blockName, source);
        return new Environment(
                optionalString(node, NAME, blockName, source),
                optionalNonEmptyString(node, ACCOUNT_ID, blockName, source),
                optionalNonEmptyString(node, ZONE_ID, blockName, source),
                optionalBoolean(node, WORKERS_DEV, blockName, source),
                optionalNonEmptyString(node, ROUTE, blockName, source),
                optionalStringList(node, ROUTES, blockName, source),
                optionalString(node, WEBPACK_CONFIG, blockName, source),
                optionalBoolean(node, PRIVATE, blockName, source),
                parseKvNamespaces(node.get(KV_NAMESPACES), blockName + "." + KV_NAMESPACES, source));
    }

    // --- Field helpers ---

    private static String requireString(JsonNode node, String field, String blockName, String source) {
        String value = optionalString(node, field, blockName, source);
        if (value == null) {
            throw new ManifestFormatException("Missing required field '" + field + "' in '" + blockName + "'", source);
        }
        return value;
    }

    private static String optionalString(JsonNode node, String field, String blockName, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ManifestFormatException(
                    "Field '" + field + "' in '" + blockName + "' must be a string, got " + value.getNodeType(),
                    source);
        }
        return value.asText();
    }

    /** Like {@link #optionalString} but an empty string counts as unset. */
    private static String optionalNonEmptyString(JsonNode node, String field, String blockName, String source) {
        String value = optionalString(node, field, blockName, source);
        return value == null || value.isEmpty() ? null : value;
    }

    private static Boolean optionalBoolean(JsonNode node, String field, String blockName, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isBoolean()) {
            throw new ManifestFormatException(
                    "Field '" + field + "' in '" + blockName + "' must be a boolean, got " + value.getNodeType(),
                    source);
        }
        return value.booleanValue();
    }

    private static List<String> optionalStringList(JsonNode node, String field, String blockName, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isArray()) {
            throw new ManifestFormatException(
                    "Field '" + field + "' in '" + blockName + "' must be an array of strings", source);
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new ManifestFormatException(
                        "Field '" + field + "' in '" + blockName + "' must contain only strings", source);
            }
            items.add(item.asText());
        }
        return items;
    }

    private static List<String> unknownKeys(JsonNode node, Set<String> knownKeys) {
        return StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
    }

    /** Logs keys outside the recognized set and leaves them unread. */
    private static void ignoreUnknownKeys(JsonNode node, Set<String> knownKeys, String blockName, String source) {
        List<String> unknown = unknownKeys(node, knownKeys);
        if (!unknown.isEmpty()) {
            LOG.debug("Ignoring unrecognized keys: source={}, block={}, keys={}", source, blockName, unknown);
        }
    }

    /**
     * Rejects unknown keys in a table by throwing {@link ManifestFormatException} if any key is
     * not in the allowed set.
     */
    private static void rejectUnknownKeys(JsonNode node, Set<String> knownKeys, String blockName, String source) {
        List<String> unknown = unknownKeys(node, knownKeys);
        if (!unknown.isEmpty()) {
            throw new ManifestFormatException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + ", recognized keys are: " + knownKeys.stream().sorted().collect(Collectors.toList()),
                    source);
        }
    }
}
