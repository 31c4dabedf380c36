package io.workermanifest.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.workermanifest.core.engine.ManifestEngine;
import io.workermanifest.core.error.ManifestFormatException;
import io.workermanifest.core.error.MisplacedFieldException;
import io.workermanifest.core.error.NameConflictException;
import io.workermanifest.core.model.DeployConfig;
import io.workermanifest.core.model.KvNamespace;
import io.workermanifest.core.model.Manifest;
import io.workermanifest.core.model.TargetKind;
import io.workermanifest.core.spi.EnvironmentOverlayProvider;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ManifestLoader}. Fixture manifests live under
 * {@code src/test/resources/manifests}.
 */
@DisplayName("ManifestLoader")
class ManifestLoaderTest {

    private static Path fixture(String name) {
        try {
            return Path.of(ManifestLoaderTest.class
                    .getClassLoader()
                    .getResource("manifests/" + name)
                    .toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    private static Manifest loadFixture(String name) {
        return ManifestLoader.load(fixture(name), EnvironmentOverlayProvider.none());
    }

    @Nested
    @DisplayName("Loading fixtures")
    class Fixtures {

        @Test
        @DisplayName("minimal TOML manifest")
        void defaultToml() {
            Manifest manifest = loadFixture("default.toml");

            assertThat(manifest.name()).isEqualTo("worker");
            assertThat(manifest.targetKind()).isEqualTo(TargetKind.PLAIN);
            assertThat(manifest.accountId()).isEqualTo("acc123");
            assertThat(manifest.workersDev()).isTrue();
            assertThat(manifest.hasEnvironments()).isFalse();
            assertThat(new ManifestEngine(manifest).deployConfig(null))
                    .isEqualTo(new DeployConfig.Zoneless("acc123", "worker", true));
        }

        @Test
        @DisplayName("TOML environments keep declaration order")
        void environmentsToml() {
            Manifest manifest = loadFixture("environments.toml");

            assertThat(manifest.targetKind()).isEqualTo(TargetKind.WEBPACK);
            assertThat(manifest.environments()).containsOnlyKeys("staging", "production");
            assertThat(new ManifestEngine(manifest).environmentNames()).containsExactly("staging", "production");
            assertThat(manifest.environments().get("production").routes())
                    .containsExactly("example.com/*", "www.example.com/*");
        }

        @Test
        @DisplayName("TOML, YAML and JSON fixtures load to equal manifests")
        void formatsAgree() {
            Manifest toml = loadFixture("environments.toml");

            assertThat(loadFixture("environments.yaml")).isEqualTo(toml);
            assertThat(loadFixture("environments.json")).isEqualTo(toml);
        }

        @Test
        @DisplayName("kv namespaces and site are read from their tables")
        void kvNamespacesAndSite() {
            Manifest manifest = loadFixture("kv_namespaces.toml");

            assertThat(manifest.kvNamespaces()).containsExactly(new KvNamespace("abc", "CACHE", null));
            assertThat(manifest.site().bucket()).isEqualTo("./public");
            assertThat(manifest.site().entryPoint()).isEqualTo("workers-site");
            assertThat(manifest.environments().get("prod").kvNamespaces())
                    .containsExactly(new KvNamespace("prod-abc", "CACHE", null));
        }

        @Test
        @DisplayName("resolved deploy configs for every environment")
        void deployConfigs() {
            ManifestEngine engine = new ManifestEngine(loadFixture("environments.toml"));

            assertThat(engine.deployConfig(null))
                    .isEqualTo(new DeployConfig.Zoned("acc123", "zone456", "worker", List.of("example.com/*")));
            assertThat(engine.deployConfig("staging"))
                    .isEqualTo(new DeployConfig.Zoneless("acc123", "worker-staging", true));
            assertThat(engine.deployConfig("production"))
                    .isEqualTo(new DeployConfig.Zoned(
                            "acc123", "zone456", "worker-live", List.of("example.com/*", "www.example.com/*")));
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class Overlay {

        @Test
        @DisplayName("CF_ACCOUNT_ID overrides account_id")
        void accountIdOverride() {
            Map<String, String> env = Map.of("CF_ACCOUNT_ID", "from-env");

            Manifest manifest =
                    ManifestLoader.load(fixture("default.toml"), new PrefixedEnvironmentOverlay("CF_", env::get));

            assertThat(manifest.accountId()).isEqualTo("from-env");
        }

        @Test
        @DisplayName("CF_WORKERS_DEV=false turns off workers_dev")
        void booleanOverride() {
            Map<String, String> env = Map.of("CF_WORKERS_DEV", "FALSE");

            Manifest manifest =
                    ManifestLoader.load(fixture("default.toml"), new PrefixedEnvironmentOverlay("CF_", env::get));

            assertThat(manifest.workersDev()).isFalse();
        }

        @Test
        @DisplayName("blank variables leave the document value")
        void blankIgnored() {
            Map<String, String> env = Map.of("CF_ACCOUNT_ID", "   ");

            Manifest manifest =
                    ManifestLoader.load(fixture("default.toml"), new PrefixedEnvironmentOverlay("CF_", env::get));

            assertThat(manifest.accountId()).isEqualTo("acc123");
        }

        @Test
        @DisplayName("invalid boolean override is a format error")
        void invalidBoolean() {
            Map<String, String> env = Map.of("CF_WORKERS_DEV", "yes");

            assertThatThrownBy(() -> ManifestLoader.load(
                            fixture("default.toml"), new PrefixedEnvironmentOverlay("CF_", env::get)))
                    .isInstanceOf(ManifestFormatException.class)
                    .hasMessageContaining("workers_dev");
        }
    }

    @Nested
    @DisplayName("Error handling")
    class Errors {

        @Test
        @DisplayName("kv-namespaces under [site] → MisplacedFieldException")
        void kvUnderSite() {
            assertThatThrownBy(() -> loadFixture("site_with_kv.toml"))
                    .isInstanceOfSatisfying(MisplacedFieldException.class, e -> {
                        assertThat(e.field()).isEqualTo("kv-namespaces");
                        assertThat(e.foundIn()).isEqualTo("site");
                        assertThat(e.source()).endsWith("site_with_kv.toml");
                    });
        }

        @Test
        @DisplayName("duplicate worker names fail at load time")
        void duplicateNames() {
            assertThatThrownBy(() -> loadFixture("duplicate_names.toml"))
                    .isInstanceOfSatisfying(
                            NameConflictException.class, e -> assertThat(e.duplicates()).containsExactly("worker"));
        }

        @Test
        @DisplayName("missing file → ManifestFormatException naming the path")
        void missingFile(@TempDir Path dir) {
            Path missing = dir.resolve("wrangler.toml");

            assertThatThrownBy(() -> ManifestLoader.load(missing, EnvironmentOverlayProvider.none()))
                    .isInstanceOfSatisfying(ManifestFormatException.class, e -> {
                        assertThat(e.getMessage()).contains("not found");
                        assertThat(e.source()).isEqualTo(missing.toString());
                    });
        }

        @Test
        @DisplayName("malformed TOML → ManifestFormatException with cause")
        void malformedToml(@TempDir Path dir) throws IOException {
            Path broken = dir.resolve("wrangler.toml");
            Files.writeString(broken, "name = \"worker\nthis is not toml\n");

            assertThatThrownBy(() -> ManifestLoader.load(broken, EnvironmentOverlayProvider.none()))
                    .isInstanceOf(ManifestFormatException.class)
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("unsupported extension → ManifestFormatException")
        void unsupportedExtension(@TempDir Path dir) throws IOException {
            Path ini = dir.resolve("wrangler.ini");
            Files.writeString(ini, "name = worker\n");

            assertThatThrownBy(() -> ManifestLoader.load(ini, EnvironmentOverlayProvider.none()))
                    .isInstanceOf(ManifestFormatException.class)
                    .hasMessageContaining("wrangler.ini");
        }

        @Test
        @DisplayName("YAML list at the root → ManifestFormatException")
        void nonTableRoot() {
            assertThatThrownBy(() -> ManifestLoader.loadFromString("- a\n- b\n", ManifestFormat.YAML))
                    .isInstanceOf(ManifestFormatException.class)
                    .hasMessageContaining("table of keys");
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("render then reload yields the same manifest in every format")
        void renderRoundTrip() {
            Manifest manifest = loadFixture("environments.toml");

            for (ManifestFormat format : ManifestFormat.values()) {
                String text = ManifestLoader.render(manifest, format);
                assertThat(ManifestLoader.loadFromString(text, format))
                        .as("round trip through %s", format)
                        .isEqualTo(manifest);
            }
        }

        @Test
        @DisplayName("kv namespaces and site survive a TOML round trip")
        void tablesRoundTrip() {
            Manifest manifest = loadFixture("kv_namespaces.toml");

            String toml = ManifestLoader.render(manifest, ManifestFormat.TOML);

            assertThat(ManifestLoader.loadFromString(toml, ManifestFormat.TOML)).isEqualTo(manifest);
        }

        @Test
        @DisplayName("write picks the format from the extension")
        void writeAndLoad(@TempDir Path dir) throws IOException {
            Manifest manifest = loadFixture("environments.toml");
            Path target = dir.resolve("wrangler.yml");

            ManifestLoader.write(manifest, target);

            assertThat(Files.readString(target)).contains("account_id:", "acc123");
            assertThat(ManifestLoader.load(target, EnvironmentOverlayProvider.none())).isEqualTo(manifest);
        }
    }
}
