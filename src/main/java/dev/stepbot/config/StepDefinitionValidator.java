package dev.stepbot.config;

import dev.stepbot.model.Request;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates step definitions before any of them is registered.
 */
public final class StepDefinitionValidator {

    private StepDefinitionValidator() {}

    /**
     * Validate a definitions file. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(StepDefinitions definitions) {
        var errors = new ArrayList<String>();
        Map<String, StepDefinition> steps = definitions.steps();

        if (steps.isEmpty()) {
            errors.add("No steps defined");
        }
        if (definitions.initialStep() == null || !steps.containsKey(definitions.initialStep())) {
            errors.add("Initial step not found in steps: " + definitions.initialStep());
        }

        Guardrails guardrails = definitions.guardrails();
        if (guardrails.maxSteps() < 1 || guardrails.maxStepVisits() < 1) {
            errors.add("Guardrails must be positive: " + guardrails);
        }

        for (var entry : steps.entrySet()) {
            String stepName = entry.getKey();
            StepDefinition step = entry.getValue();

            if (step.url() == null || step.url().isBlank()) {
                errors.add("Step '%s' has missing or empty url".formatted(stepName));
            } else {
                try {
                    Request.of(step.method(), step.url())
                        .withProxy(step.proxy())
                        .withBody(step.body(), step.contentType());
                } catch (IllegalArgumentException e) {
                    errors.add("Step '%s': %s".formatted(stepName, e.getMessage()));
                }
            }

            if (step.timeoutMillis() <= 0) {
                errors.add("Step '%s' has non-positive timeoutMillis %d"
                    .formatted(stepName, step.timeoutMillis()));
            }
            if (step.delayMillis() < 0) {
                errors.add("Step '%s' has negative delayMillis %d"
                    .formatted(stepName, step.delayMillis()));
            }

            if (step.statusCodes() != null) {
                for (int code : step.statusCodes()) {
                    if (code < 100 || code > 599) {
                        errors.add("Step '%s': status code %d outside 100-599".formatted(stepName, code));
                    }
                }
            }

            checkTarget(errors, steps, stepName, "onSuccess", step.onSuccess());
            checkTarget(errors, steps, stepName, "onError", step.onError());
            checkTarget(errors, steps, stepName, "onTimeout", step.onTimeout());
        }

        return errors;
    }

    private static void checkTarget(List<String> errors, Map<String, StepDefinition> steps,
                                    String stepName, String field, String target) {
        if (target != null && !steps.containsKey(target)) {
            errors.add("Step '%s': %s '%s' not found in steps".formatted(stepName, field, target));
        }
    }
}
