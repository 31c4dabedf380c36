package io.workermanifest.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import io.workermanifest.core.error.ManifestFormatException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Document formats a manifest can be written in. Every format reads into, and writes from,
 * the same Jackson tree, so the core parser never sees the difference.
 */
public enum ManifestFormat {
    TOML(List.of(".toml"), new TomlMapper()),
    YAML(
            List.of(".yaml", ".yml"),
            new ObjectMapper(new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER))),
    JSON(List.of(".json"), new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));

    private final List<String> extensions;
    private final ObjectMapper mapper;

    ManifestFormat(List<String> extensions, ObjectMapper mapper) {
        this.extensions = extensions;
        this.mapper = mapper;
    }

    /** File extensions (lower case, with the dot) recognized for this format. */
    public List<String> extensions() {
        return extensions;
    }

    /** The shared, thread-safe mapper for this format. */
    ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Picks the format from a file name extension, case-insensitively.
     *
     * @throws ManifestFormatException if the extension is not recognized
     */
    public static ManifestFormat fromPath(Path path) {
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString().toLowerCase(Locale.ROOT) : "";
        for (ManifestFormat format : values()) {
            for (String extension : format.extensions) {
                if (name.endsWith(extension)) {
                    return format;
                }
            }
        }
        String expected = Arrays.stream(values())
                .flatMap(format -> format.extensions().stream())
                .collect(Collectors.joining(", "));
        throw new ManifestFormatException(
                "Unsupported manifest file extension: " + path + " (expected one of: " + expected + ")",
                path.toString());
    }
}
