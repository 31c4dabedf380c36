package io.workermanifest.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.workermanifest.core.document.ManifestParser;
import io.workermanifest.core.document.ManifestSerializer;
import io.workermanifest.core.error.ManifestFormatException;
import io.workermanifest.core.model.Manifest;
import io.workermanifest.core.spi.EnvironmentOverlayProvider;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link Manifest}s from TOML, YAML or JSON files and renders them back.
 *
 * <p>
 * The format is chosen from the file extension (see {@link ManifestFormat#fromPath}). The
 * document is read into a Jackson tree and handed to {@link ManifestParser} together with an
 * {@link EnvironmentOverlayProvider}; by default the {@code CF_*} process environment
 * variables override the matching top-level keys.
 */
public final class ManifestLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ManifestLoader.class);

    private ManifestLoader() {
        // utility class
    }

    /**
     * Loads a manifest file, applying {@code CF_*} environment variable overrides.
     *
     * @param path manifest file
     * @return the parsed manifest
     * @throws ManifestFormatException if the file is missing, unreadable or malformed
     */
    public static Manifest load(Path path) {
        return load(path, PrefixedEnvironmentOverlay.fromSystem());
    }

    /**
     * Loads a manifest file with the given overlay provider.
     *
     * @param path    manifest file
     * @param overlay provider of top-level overrides; {@link EnvironmentOverlayProvider#none()}
     *                for none
     * @return the parsed manifest
     * @throws ManifestFormatException if the file is missing, unreadable or malformed
     */
    public static Manifest load(Path path, EnvironmentOverlayProvider overlay) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(overlay, "overlay must not be null");
        String source = path.toString();
        ManifestFormat format = ManifestFormat.fromPath(path);
        if (!Files.isRegularFile(path)) {
            throw new ManifestFormatException("Manifest file not found: " + path, source);
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = format.mapper().readTree(in);
        } catch (IOException e) {
            throw new ManifestFormatException("Failed to parse " + format + " manifest: " + path, e, source);
        }

        Manifest manifest = ManifestParser.parse(root, source, overlay);
        LOG.info(
                "Manifest loaded: source={}, format={}, environments={}",
                source,
                format,
                manifest.hasEnvironments() ? manifest.environments().size() : 0);
        return manifest;
    }

    /** Parses manifest text with no environment overrides. */
    public static Manifest loadFromString(String content, ManifestFormat format) {
        return loadFromString(content, format, EnvironmentOverlayProvider.none());
    }

    /**
     * Parses manifest text.
     *
     * @throws ManifestFormatException if the text is malformed
     */
    public static Manifest loadFromString(String content, ManifestFormat format, EnvironmentOverlayProvider overlay) {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(format, "format must not be null");
        String source = "<" + format.name().toLowerCase(Locale.ROOT) + " string>";
        JsonNode root;
        try {
            root = format.mapper().readTree(content);
        } catch (JsonProcessingException e) {
            throw new ManifestFormatException("Failed to parse " + format + " manifest: " + e.getOriginalMessage(), e, source);
        }
        return ManifestParser.parse(root, source, overlay);
    }

    /**
     * Renders a manifest in the given format. Only keys that are set are written.
     *
     * @throws IllegalStateException if the tree cannot be written, which indicates a bug
     */
    public static String render(Manifest manifest, ManifestFormat format) {
        Objects.requireNonNull(manifest, "manifest must not be null");
        try {
            return format.mapper().writeValueAsString(ManifestSerializer.serialize(manifest));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render manifest as " + format, e);
        }
    }

    /** Renders a manifest and writes it to {@code path}, choosing the format from the extension. */
    public static void write(Manifest manifest, Path path) throws IOException {
        ManifestFormat format = ManifestFormat.fromPath(path);
        Files.writeString(path, render(manifest, format));
        LOG.info("Manifest written: target={}, format={}", path, format);
    }
}
