package dev.stepbot.engine;

import dev.stepbot.model.StepError;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepRegistryTest {

    @Test
    void startsEmpty() {
        var registry = new StepRegistry();

        assertThat(registry.size()).isZero();
        assertThat(registry.names()).isEmpty();
    }

    @Test
    void insertedStepIsFoundByName() throws StepException {
        var registry = new StepRegistry();
        registry.insert(new RecordingStep("RobotsTxt"));

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.get("RobotsTxt")).isPresent();
        assertThat(registry.require("RobotsTxt").name()).isEqualTo("RobotsTxt");
    }

    @Test
    void sameNameOverwritesWithoutGrowing() throws StepException {
        var registry = new StepRegistry();
        var first = new RecordingStep("Home");
        var second = new RecordingStep("Home");

        registry.insert(first);
        registry.insert(second);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.require("Home")).isSameAs(second);
    }

    @Test
    void sharedInstanceCanBeInsertedMoreThanOnce() throws StepException {
        var registry = new StepRegistry();
        var shared = new RecordingStep("Shared");

        registry.insertAll(List.of(shared, new RecordingStep("Other"), shared));

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.require("Shared")).isSameAs(shared);
        assertThat(registry.names()).containsExactly("Other", "Shared");
    }

    @Test
    void containsStepComparesByName() throws StepException {
        var registry = new StepRegistry();
        registry.insert(new RecordingStep("Login"));

        assertThat(registry.containsStep(new RecordingStep("Login"))).isTrue();
        assertThat(registry.containsStep(new RecordingStep("Logout"))).isFalse();
        assertThat(registry.containsName("Login")).isTrue();
        assertThat(registry.containsName("Logout")).isFalse();
    }

    @Test
    void missingNameIsRecoverable() {
        var registry = new StepRegistry();

        assertThat(registry.get("Nope")).isEmpty();
        assertThatThrownBy(() -> registry.require("Nope"))
            .isInstanceOf(StepException.class)
            .satisfies(e -> assertThat(((StepException) e).error())
                .isEqualTo(new StepError.StepNotFound("Nope")));
    }

    @Test
    void strictRegistryRejectsDuplicateName() throws StepException {
        var registry = StepRegistry.strict();
        var original = new RecordingStep("Home");
        registry.insert(original);

        assertThatThrownBy(() -> registry.insert(new RecordingStep("Home")))
            .isInstanceOf(StepException.class)
            .satisfies(e -> assertThat(((StepException) e).error())
                .isEqualTo(new StepError.DuplicateStepName("Home")));
        assertThat(registry.require("Home")).isSameAs(original);
    }
}
