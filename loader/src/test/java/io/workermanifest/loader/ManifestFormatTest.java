package io.workermanifest.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.workermanifest.core.error.ManifestFormatException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link ManifestFormat} extension lookup. */
class ManifestFormatTest {

    @ParameterizedTest
    @CsvSource({
        "wrangler.toml, TOML",
        "config/WRANGLER.TOML, TOML",
        "wrangler.yaml, YAML",
        "wrangler.yml, YAML",
        "wrangler.json, JSON"
    })
    void formatFromExtension(String file, ManifestFormat expected) {
        assertThat(ManifestFormat.fromPath(Path.of(file))).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"wrangler.ini", "wrangler", "toml"})
    void unknownExtensionRejected(String file) {
        assertThatThrownBy(() -> ManifestFormat.fromPath(Path.of(file)))
                .isInstanceOf(ManifestFormatException.class)
                .hasMessageContaining("Unsupported manifest file extension");
    }

    @Test
    void rejectionListsEveryRecognizedExtension() {
        assertThatThrownBy(() -> ManifestFormat.fromPath(Path.of("wrangler.ini")))
                .isInstanceOf(ManifestFormatException.class)
                .hasMessageContaining("expected one of: .toml, .yaml, .yml, .json");
    }
}
