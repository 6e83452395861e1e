package dev.stepbot.config;

import dev.stepbot.engine.Context;
import dev.stepbot.engine.Step;
import dev.stepbot.model.Request;
import dev.stepbot.model.StepError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A {@link Step} driven by a {@link StepDefinition}: each outcome points the
 * context at the configured next step, or ends the chain when none is configured.
 */
public final class DeclarativeStep implements Step {

    private static final Logger log = LoggerFactory.getLogger(DeclarativeStep.class);

    private final StepDefinition definition;
    private final String userAgent; // nullable

    public DeclarativeStep(StepDefinition definition, String userAgent) {
        this.definition = definition;
        this.userAgent = userAgent;
    }

    /** One step per definition, in file order. */
    public static List<Step> fromDefinitions(StepDefinitions definitions) {
        var steps = new ArrayList<Step>();
        for (StepDefinition definition : definitions.steps().values()) {
            steps.add(new DeclarativeStep(definition, definitions.userAgent()));
        }
        return steps;
    }

    public StepDefinition definition() {
        return definition;
    }

    @Override
    public String name() {
        return definition.name();
    }

    @Override
    public Request onRequest() {
        Request request = Request.of(definition.method(), definition.url())
            .withTimeout(Duration.ofMillis(definition.timeoutMillis()))
            .withCompression(definition.compression())
            .withProxy(definition.proxy())
            .withStatusCodes(definition.statusCodes());
        for (Map.Entry<String, String> header : definition.headers().entrySet()) {
            request = request.withHeader(header.getKey(), header.getValue());
        }
        if (userAgent != null) {
            request = request.withUserAgent(userAgent);
        }
        if (definition.body() != null) {
            request = request.withBody(definition.body(), definition.contentType());
        }
        return request;
    }

    @Override
    public void onSuccess(Context ctx) {
        advance(ctx, definition.onSuccess());
    }

    @Override
    public void onError(Context ctx, StepError error) {
        log.debug("Step {} error: {}", name(), error.message());
        advance(ctx, definition.onError());
    }

    @Override
    public void onTimeout(Context ctx) {
        advance(ctx, definition.onTimeout());
    }

    private void advance(Context ctx, String next) {
        if (next == null) {
            ctx.clearNextStep();
            return;
        }
        ctx.setNextStep(next);
        ctx.delayNextStep(Duration.ofMillis(definition.delayMillis()));
    }
}
