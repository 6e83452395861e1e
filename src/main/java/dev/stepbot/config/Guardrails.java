package dev.stepbot.config;

/**
 * Limits on how long a caller follows next-step hints, so a step that always
 * points at itself cannot loop forever.
 */
public record Guardrails(
    int maxSteps,
    int maxStepVisits
) {
    public static final int DEFAULT_MAX_STEPS = 100;
    public static final int DEFAULT_MAX_STEP_VISITS = 10;

    public static Guardrails defaults() {
        return new Guardrails(DEFAULT_MAX_STEPS, DEFAULT_MAX_STEP_VISITS);
    }
}
