package dev.stepbot.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StepErrorTest {

    @Test
    void messagesNameTheFailure() {
        assertThat(new StepError.StepNotFound("Login").message()).isEqualTo("Step not found: Login");
        assertThat(new StepError.TransportFailure("Connection refused").message())
            .isEqualTo("Transport failure: Connection refused");
        assertThat(new StepError.Timeout("Read timed out").message()).contains("timed out");
        assertThat(new StepError.DuplicateStepName("Home").message()).isEqualTo("Duplicate step name: Home");
    }

    @Test
    void statusMismatchDistinguishesExplicitListFromSuccessRange() {
        assertThat(new StepError.StatusCodeNotFound(404, List.of(200)).message())
            .isEqualTo("Status code 404 not in expected codes [200]");
        assertThat(new StepError.StatusCodeNotFound(301, List.of()).message())
            .isEqualTo("Status code 301 is not a 2xx success");
    }

    @Test
    void statusMismatchComparesByValue() {
        assertThat(new StepError.StatusCodeNotFound(404, List.of(200)))
            .isEqualTo(new StepError.StatusCodeNotFound(404, List.of(200)))
            .isNotEqualTo(new StepError.StatusCodeNotFound(404, List.of()));
    }
}
