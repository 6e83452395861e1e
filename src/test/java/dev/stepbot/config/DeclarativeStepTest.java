package dev.stepbot.config;

import dev.stepbot.engine.Context;
import dev.stepbot.engine.Step;
import dev.stepbot.http.HttpRequester;
import dev.stepbot.model.Request;
import dev.stepbot.model.StepError;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeclarativeStepTest {

    private static final StepDefinition ROBOTS = new StepDefinition(
        "RobotsTxt", "GET", "https://test.com/robots.txt", Map.of("Accept", "*/*"), 5000L,
        List.of(200), false, "http://proxy.local:3128", null, null,
        "Home", "Retry", "RobotsTxt", 100L);

    private static Context contextFor(Step step) {
        return new Context(step.onRequest(), new HttpRequester((request, settings, cookies) -> {
            throw new IOException("not used");
        }));
    }

    @Test
    void onRequestBuildsDescriptorFromDefinition() {
        Request request = new DeclarativeStep(ROBOTS, "crawler/1.0").onRequest();

        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.url()).isEqualTo("https://test.com/robots.txt");
        assertThat(request.headers().get("Accept")).containsExactly("*/*");
        assertThat(request.timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(request.statusCodes()).containsExactly(200);
        assertThat(request.compression()).isFalse();
        assertThat(request.proxy()).isEqualTo("http://proxy.local:3128");
        assertThat(request.userAgent()).isEqualTo("crawler/1.0");
        assertThat(request.body()).isNull();
    }

    @Test
    void defaultUserAgentWhenNoneConfigured() {
        assertThat(new DeclarativeStep(ROBOTS, null).onRequest().userAgent())
            .isEqualTo(Request.DEFAULT_USER_AGENT);
    }

    @Test
    void eachOutcomePointsAtConfiguredNextStep() {
        var step = new DeclarativeStep(ROBOTS, null);

        Context success = contextFor(step);
        step.onSuccess(success);
        assertThat(success.getNextStep()).contains("Home");
        assertThat(success.getNextDelay()).isEqualTo(Duration.ofMillis(100));

        Context error = contextFor(step);
        step.onError(error, new StepError.StatusCodeNotFound(500, List.of(200)));
        assertThat(error.getNextStep()).contains("Retry");

        Context timeout = contextFor(step);
        step.onTimeout(timeout);
        assertThat(timeout.getNextStep()).contains("RobotsTxt");
    }

    @Test
    void missingTargetEndsTheChain() {
        var leaf = new StepDefinition("Leaf", "GET", "https://test.com/", Map.of(), 1000L,
            null, true, null, null, null, null, null, null, 0L);
        var step = new DeclarativeStep(leaf, null);
        Context ctx = contextFor(step);
        ctx.setNextStep("Stale");

        step.onSuccess(ctx);

        assertThat(ctx.getNextStep()).isEmpty();
    }

    @Test
    void fromDefinitionsKeepsFileOrder() throws IOException {
        var definitions = StepDefinitionLoader.loadFromString(StepDefinitionLoaderTest.CRAWL);

        List<Step> steps = DeclarativeStep.fromDefinitions(definitions);

        assertThat(steps).extracting(Step::name).containsExactly("RobotsTxt", "Home");
        assertThat(steps.get(1).onRequest().body()).isEqualTo("{}");
    }
}
