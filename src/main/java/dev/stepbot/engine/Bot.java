package dev.stepbot.engine;

import dev.stepbot.http.ApacheHttpTransport;
import dev.stepbot.http.HttpRequester;
import dev.stepbot.http.HttpTransport;
import dev.stepbot.http.TransportResponse;
import dev.stepbot.model.Request;
import dev.stepbot.model.StepError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Executes one named step end to end: builds the request, sends it once, classifies
 * the outcome and dispatches exactly one callback on the step.
 *
 * <p>The bot never retries and never sets the next-step hint; callers read
 * {@link Context#getNextStep()} to decide what to run next.
 */
public final class Bot {

    private static final Logger log = LoggerFactory.getLogger(Bot.class);

    private final StepRegistry steps;
    private final HttpTransport transport;

    public Bot() {
        this(new StepRegistry(), new ApacheHttpTransport());
    }

    public Bot(StepRegistry steps, HttpTransport transport) {
        this.steps = Objects.requireNonNull(steps, "steps");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public StepRegistry steps() {
        return steps;
    }

    /**
     * Run the named step.
     *
     * @return the context after {@link Step#onSuccess} ran
     * @throws StepException when the step is unknown, its request cannot be built, the
     *                       transport fails or times out, or the status is rejected; the step
     *                       has already been notified unless nothing was sent
     */
    public Context execute(String stepName) throws StepException {
        Step step = steps.require(stepName);

        long start = System.nanoTime();

        Context ctx;
        try {
            ctx = newContext(step.onRequest());
        } catch (IllegalArgumentException e) {
            // nothing was sent, so there is no outcome to report to the step
            StepError error = new StepError.TransportFailure("Invalid request: " + e.getMessage());
            log.warn("Step {} failed: {}", stepName, error.message());
            throw new StepException(error, null, e);
        }
        ctx.setCurrentStep(stepName);

        TransportResponse response;
        try {
            response = ctx.httpRequester().send(ctx.takePendingRequest());
        } catch (IOException e) {
            ctx.setTimeElapsed(elapsedMillis(start));
            if (HttpRequester.isTimeout(e)) {
                log.warn("Step {} timed out after {} ms", stepName, ctx.getTimeElapsed());
                step.onTimeout(ctx);
                throw new StepException(new StepError.Timeout(describe(e)), ctx, e);
            }
            StepError error = new StepError.TransportFailure(describe(e));
            log.warn("Step {} failed: {}", stepName, error.message());
            step.onError(ctx, error);
            throw new StepException(error, ctx, e);
        }

        ctx.setTimeElapsed(elapsedMillis(start));
        ctx.recordResponse(response);

        List<Integer> expected = ctx.statusCodes();
        boolean accepted = expected != null
            ? expected.contains(response.statusCode())
            : response.isSuccess();

        if (!accepted) {
            StepError error = new StepError.StatusCodeNotFound(response.statusCode(),
                expected == null ? List.of() : expected);
            log.warn("Step {} rejected: {}", stepName, error.message());
            step.onError(ctx, error);
            throw new StepException(error, ctx, null);
        }

        ctx.releaseRawResponse();
        log.debug("Step {} succeeded with status {} in {} ms", stepName,
            response.statusCode(), ctx.getTimeElapsed());
        step.onSuccess(ctx);
        return ctx;
    }

    /**
     * Run the named step on the given executor. The future fails with a
     * {@link CompletionException} whose cause is the {@link StepException}.
     */
    public CompletableFuture<Context> executeAsync(String stepName, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return execute(stepName);
            } catch (StepException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    private Context newContext(Request request) {
        HttpRequester requester = new HttpRequester(transport);
        requester.settings().setProxy(request.proxy());
        requester.settings().setUserAgent(request.userAgent());
        requester.settings().setCompression(request.compression());
        requester.settings().setConnectTimeout(request.timeout());
        return new Context(request, requester);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
