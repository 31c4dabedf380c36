package io.workermanifest.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link Environment} routing detection. */
@DisplayName("Environment routing inputs")
class EnvironmentTest {

    @Test
    @DisplayName("overlay with only account and zone ids declares no routing")
    void accountAndZoneAloneAreNotRouting() {
        var environment = new Environment(null, "env-account", "env-zone", null, null, null, null, null, null);

        assertThat(environment.declaresRouting()).isFalse();
        assertThat(environment.routingInputs("top-account", "top-zone")).isNull();
    }

    @Test
    @DisplayName("overlay routing borrows top-level account and zone ids when unset")
    void borrowsTopLevelIds() {
        var environment = new Environment(null, null, null, null, "prod.example.com/*", null, null, null, null);

        RoutingInputs inputs = environment.routingInputs("top-account", "top-zone");

        assertThat(inputs.route()).isEqualTo("prod.example.com/*");
        assertThat(inputs.accountId()).isEqualTo("top-account");
        assertThat(inputs.zoneId()).isEqualTo("top-zone");
    }

    @Test
    @DisplayName("overlay ids win over top-level ids")
    void overlayIdsWin() {
        var environment =
                new Environment(null, "env-account", "env-zone", null, null, List.of("a.com/*"), null, null, null);

        RoutingInputs inputs = environment.routingInputs("top-account", "top-zone");

        assertThat(inputs.accountId()).isEqualTo("env-account");
        assertThat(inputs.zoneId()).isEqualTo("env-zone");
    }

    @Test
    @DisplayName("workers_dev = false still counts as declared routing")
    void explicitWorkersDevFalseIsRouting() {
        var environment = new Environment(null, null, null, false, null, null, null, null, null);

        assertThat(environment.declaresRouting()).isTrue();
    }
}
