package io.workermanifest.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The fully resolved build target for one environment (or the top level), produced by
 * {@code InheritanceResolver}. Immutable; computed fresh per query.
 *
 * @param name          effective worker name
 * @param targetKind    effective kind; always {@link TargetKind#WEBPACK} when {@code site} is set
 * @param accountId     effective account id, or null
 * @param webpackConfig effective webpack configuration path, or null
 * @param kvNamespaces  KV bindings of the resolved level only, or null
 * @param site          the top-level site, or null
 */
public record EffectiveTarget(
        String name,
        TargetKind targetKind,
        String accountId,
        String webpackConfig,
        List<KvNamespace> kvNamespaces,
        SiteConfig site) {

    public EffectiveTarget {
        Objects.requireNonNull(name, "target name must not be null");
        Objects.requireNonNull(targetKind, "target kind must not be null");
        kvNamespaces = kvNamespaces != null ? List.copyOf(kvNamespaces) : null;
    }
}
