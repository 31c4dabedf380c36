package io.workermanifest.core.model;

import java.util.Optional;

/**
 * Build/runtime mode of a worker, written as the {@code type} key of a manifest.
 *
 * <ul>
 *   <li>{@link #PLAIN}: a plain JavaScript worker, uploaded as-is ({@code javascript}).
 *   <li>{@link #RUST}: a Rust worker compiled to WebAssembly ({@code rust}).
 *   <li>{@link #WEBPACK}: bundled with webpack before upload ({@code webpack}). Always used
 *       when the manifest declares a {@code site}.
 * </ul>
 */
public enum TargetKind {
    PLAIN("javascript"),
    RUST("rust"),
    WEBPACK("webpack");

    private final String wireName;

    TargetKind(String wireName) {
        this.wireName = wireName;
    }

    /** The value used for the {@code type} key in manifest documents. */
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a {@code type} value. Only the exact wire names match; {@code "Webpack"} or
     * {@code " rust "} are not recognized.
     *
     * @return the matching kind, or empty if the value is not recognized
     */
    public static Optional<TargetKind> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (TargetKind kind : values()) {
            if (kind.wireName.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
