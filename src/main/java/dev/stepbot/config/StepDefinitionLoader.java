package dev.stepbot.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads step definitions from JSON.
 */
public final class StepDefinitionLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StepDefinitionLoader() {}

    public static StepDefinitions loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseDefinitions(root);
    }

    public static StepDefinitions loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseDefinitions(root);
    }

    private static StepDefinitions parseDefinitions(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Definitions must be a JSON object");
        }
        JsonNode stepsNode = root.get("steps");
        if (stepsNode == null || !stepsNode.isObject()) {
            throw new IllegalArgumentException("Missing 'steps' object");
        }
        Map<String, StepDefinition> steps = new LinkedHashMap<>();
        for (var entry : stepsNode.properties()) {
            steps.put(entry.getKey(), parseStep(entry.getKey(), entry.getValue()));
        }

        String initialStep = text(root, "initialStep");
        if (initialStep == null && !steps.isEmpty()) {
            initialStep = steps.keySet().iterator().next();
        }
        return new StepDefinitions(initialStep, text(root, "userAgent"),
            parseGuardrails(root.get("guardrails")), steps);
    }

    private static Guardrails parseGuardrails(JsonNode node) {
        if (node == null || node.isNull()) {
            return Guardrails.defaults();
        }
        int maxSteps = node.has("maxSteps")
            ? node.get("maxSteps").asInt() : Guardrails.DEFAULT_MAX_STEPS;
        int maxStepVisits = node.has("maxStepVisits")
            ? node.get("maxStepVisits").asInt() : Guardrails.DEFAULT_MAX_STEP_VISITS;
        return new Guardrails(maxSteps, maxStepVisits);
    }

    private static StepDefinition parseStep(String name, JsonNode node) {
        Map<String, String> headers = new LinkedHashMap<>();
        JsonNode headersNode = node.get("headers");
        if (headersNode != null && headersNode.isObject()) {
            for (var entry : headersNode.properties()) {
                headers.put(entry.getKey(), entry.getValue().asText());
            }
        }

        List<Integer> statusCodes = null;
        JsonNode codesNode = node.get("statusCodes");
        if (codesNode != null && codesNode.isArray()) {
            statusCodes = new ArrayList<>();
            for (JsonNode code : codesNode) {
                statusCodes.add(code.asInt());
            }
        }

        return new StepDefinition(
            name,
            node.has("method") ? node.get("method").asText() : "GET",
            text(node, "url"),
            headers,
            node.has("timeoutMillis") ? node.get("timeoutMillis").asLong() : StepDefinition.DEFAULT_TIMEOUT_MILLIS,
            statusCodes,
            !node.has("compression") || node.get("compression").asBoolean(),
            text(node, "proxy"),
            text(node, "body"),
            text(node, "contentType"),
            text(node, "onSuccess"),
            text(node, "onError"),
            text(node, "onTimeout"),
            node.has("delayMillis") ? node.get("delayMillis").asLong() : 0L
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
