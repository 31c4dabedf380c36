package io.workermanifest.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The {@code [site]} table of a manifest: static assets served by the worker.
 *
 * <p>
 * Presence of a site forces the effective {@link TargetKind} to {@link TargetKind#WEBPACK}.
 *
 * @param bucket     directory holding the static assets (required)
 * @param entryPoint directory of the worker script serving the assets, or null
 * @param include    glob patterns to upload exclusively, or null
 * @param exclude    glob patterns to skip, or null
 */
public record SiteConfig(String bucket, String entryPoint, List<String> include, List<String> exclude) {

    public SiteConfig {
        Objects.requireNonNull(bucket, "site bucket must not be null");
        include = include != null ? List.copyOf(include) : null;
        exclude = exclude != null ? List.copyOf(exclude) : null;
    }

    /** Creates a site serving {@code bucket} with no entry point or filters. */
    public static SiteConfig ofBucket(String bucket) {
        return new SiteConfig(bucket, null, null, null);
    }
}
