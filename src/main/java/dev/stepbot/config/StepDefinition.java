package dev.stepbot.config;

import java.util.List;
import java.util.Map;

/**
 * A step described in a definitions file rather than in code.
 * The {@code on*} fields name the step to run next for each outcome.
 */
public record StepDefinition(
    String name,
    String method,
    String url,
    Map<String, String> headers,
    long timeoutMillis,
    List<Integer> statusCodes, // nullable — 2xx accepted
    boolean compression,
    String proxy, // nullable
    String body, // nullable
    String contentType, // nullable
    String onSuccess, // nullable — chain ends
    String onError, // nullable
    String onTimeout, // nullable
    long delayMillis
) {
    public static final long DEFAULT_TIMEOUT_MILLIS = 30_000L;
}
