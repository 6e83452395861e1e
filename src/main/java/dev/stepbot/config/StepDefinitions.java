package dev.stepbot.config;

import java.util.Map;

/**
 * The contents of one definitions file.
 */
public record StepDefinitions(
    String initialStep,
    String userAgent, // nullable — default user agent
    Guardrails guardrails,
    Map<String, StepDefinition> steps
) {}
