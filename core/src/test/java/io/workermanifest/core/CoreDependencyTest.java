package io.workermanifest.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies that the core module stays format-agnostic: it works on Jackson trees only and
 * must not pull any concrete document format onto its classpath. Formats belong to the
 * loader module.
 */
class CoreDependencyTest {

    /** Group paths that MUST NOT appear on the core classpath. */
    private static final List<String> FORBIDDEN_GROUPS = List.of(
            "com.fasterxml.jackson.dataformat", // TOML / YAML / ...
            "org.yaml" // SnakeYAML
            );

    /** Classpath fragments of sibling modules: the installed artifact and the reactor build directory. */
    private static final List<String> FORBIDDEN_MODULES = List.of("worker-manifest-loader", "/loader/target/");

    @Test
    void coreClasspathContainsNoDocumentFormats() {
        String classpath = System.getProperty("java.class.path");
        assertThat(classpath).as("java.class.path should be set").isNotNull();

        for (String forbiddenGroup : FORBIDDEN_GROUPS) {
            String pathFragment = forbiddenGroup.replace('.', '/');
            assertThat(classpath)
                    .as("Core classpath must not contain: %s", forbiddenGroup)
                    .doesNotContain(pathFragment);
        }
    }

    @Test
    void coreClasspathDoesNotContainTheLoader() {
        String classpath = System.getProperty("java.class.path");

        for (String fragment : FORBIDDEN_MODULES) {
            assertThat(classpath.replace('\\', '/'))
                    .as("Core classpath must not contain the loader module: %s", fragment)
                    .doesNotContain(fragment);
        }
    }
}
