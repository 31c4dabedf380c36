package io.workermanifest.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link RoutingInputs}. */
@DisplayName("RoutingInputs")
class RoutingInputsTest {

    @Test
    @DisplayName("a single route or a non-empty route list counts as routes")
    void hasRoutes() {
        assertThat(new RoutingInputs(null, "example.com/*", null, null, null).hasRoutes()).isTrue();
        assertThat(new RoutingInputs(null, null, List.of("a.com/*"), null, null).hasRoutes()).isTrue();
    }

    @Test
    @DisplayName("an empty route list or workers_dev alone is not a route")
    void noRoutes() {
        assertThat(new RoutingInputs(true, null, List.of(), "zone", "acc").hasRoutes()).isFalse();
        assertThat(new RoutingInputs(null, null, null, null, null).hasRoutes()).isFalse();
    }

    @Test
    @DisplayName("fallback ids only fill unset fields")
    void withFallbacks() {
        RoutingInputs inputs = new RoutingInputs(null, "example.com/*", null, null, "own-acc");

        assertThat(inputs.withFallbacks("top-acc", "top-zone"))
                .isEqualTo(new RoutingInputs(null, "example.com/*", null, "top-zone", "own-acc"));
    }
}
